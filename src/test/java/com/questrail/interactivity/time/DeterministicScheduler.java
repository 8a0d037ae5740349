package com.questrail.interactivity.time;

import com.questrail.interactivity.internal.time.Cancellable;
import com.questrail.interactivity.internal.time.MonotonicClock;
import com.questrail.interactivity.internal.time.MonotonicScheduler;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        Scheduled next;
        while ((next = pollDue()) != null) {
            if (next.fired.compareAndSet(false, true)) {
                next.task.run();
            }
        }
    }

    /**
     * Number of tasks still queued and not cancelled.
     */
    public synchronized long pendingCount() {
        return queue.stream().filter(s -> !s.fired.get()).count();
    }

    private synchronized Scheduled pollDue() {
        if (!queue.isEmpty() && queue.peek().deadlineNanos <= clock.nowNanos()) {
            return queue.poll();
        }
        return null;
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final Runnable task;
        // Set when the task either ran or was cancelled.
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return fired.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            return Long.compare(this.deadlineNanos, o.deadlineNanos);
        }
    }
}
