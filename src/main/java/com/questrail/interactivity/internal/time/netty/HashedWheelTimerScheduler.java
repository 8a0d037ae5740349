package com.questrail.interactivity.internal.time.netty;

import com.questrail.interactivity.internal.time.Cancellable;
import com.questrail.interactivity.internal.time.MonotonicClock;
import com.questrail.interactivity.internal.time.MonotonicScheduler;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * HashedWheelTimerScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by Netty's {@link HashedWheelTimer}.
 *
 * <h2>When to use</h2>
 * A timer wheel trades precision (one tick) for O(1) scheduling and
 * cancellation. That suits pagination timeouts: many concurrent sessions, each
 * with one long timeout that is usually cancelled early.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Callers only see
 * {@link Cancellable}.
 *
 * <h2>Lifecycle</h2>
 * Unlike {@code ScheduledExecutorScheduler}, this class owns its timer thread.
 * {@link #stop()} releases it; tasks still pending at that point never run.
 */
public final class HashedWheelTimerScheduler implements MonotonicScheduler, AutoCloseable
{
    private final HashedWheelTimer timer;
    private final MonotonicClock clock;

    /**
     * @param clock        monotonic clock used to convert deadlines into delays
     * @param tickDuration resolution of the wheel
     */
    public HashedWheelTimerScheduler(MonotonicClock clock, Duration tickDuration)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(tickDuration, "tickDuration");
        if (tickDuration.isZero() || tickDuration.isNegative()) {
            throw new IllegalArgumentException("tickDuration must be positive");
        }

        this.timer = new HashedWheelTimer(
                new DefaultThreadFactory("pagination-timeouts", true),
                tickDuration.toNanos(),
                TimeUnit.NANOSECONDS);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }

    /**
     * Stops the timer thread.
     */
    public void stop()
    {
        timer.stop();
    }

    @Override
    public void close()
    {
        stop();
    }
}
