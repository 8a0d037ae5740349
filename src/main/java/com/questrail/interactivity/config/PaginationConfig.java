package com.questrail.interactivity.config;

import com.questrail.interactivity.api.ControlBindingSet;
import com.questrail.interactivity.api.PaginationBehavior;
import com.questrail.interactivity.api.PaginationDeletion;
import com.questrail.interactivity.bindings.EmojiControlBindings;

import java.time.Duration;
import java.util.Objects;

/**
 * Defaults applied by the pagination runtime when a call does not specify them.
 *
 * <ul>
 *   <li><b>timeout</b>: how long a session accepts input (default 5 minutes)</li>
 *   <li><b>behavior</b>: boundary policy (default {@code CLAMP})</li>
 *   <li><b>deletion</b>: cleanup policy (default {@code DELETE_CONTROL_MARKS})</li>
 *   <li><b>bindings</b>: control tokens (default emoji set)</li>
 *   <li><b>timerBackend</b>: how timeouts are scheduled (default JDK executor)</li>
 * </ul>
 */
public record PaginationConfig(
    Duration timeout,
    PaginationBehavior behavior,
    PaginationDeletion deletion,
    ControlBindingSet bindings,
    TimerBackend timerBackend,
    Duration wheelTickDuration
) {
    /**
     * Timer implementation backing session timeouts.
     */
    public enum TimerBackend {
        /** A single-threaded {@code ScheduledExecutorService}. */
        SCHEDULED_EXECUTOR,
        /** Netty's {@code HashedWheelTimer}; precision is one wheel tick. */
        HASHED_WHEEL
    }

    public PaginationConfig {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(behavior, "behavior");
        Objects.requireNonNull(deletion, "deletion");
        Objects.requireNonNull(bindings, "bindings");
        Objects.requireNonNull(timerBackend, "timerBackend");
        Objects.requireNonNull(wheelTickDuration, "wheelTickDuration");

        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (wheelTickDuration.isZero() || wheelTickDuration.isNegative()) {
            throw new IllegalArgumentException("wheelTickDuration must be positive");
        }
    }

    public static PaginationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration timeout = Duration.ofMinutes(5);
        private PaginationBehavior behavior = PaginationBehavior.CLAMP;
        private PaginationDeletion deletion = PaginationDeletion.DELETE_CONTROL_MARKS;
        private ControlBindingSet bindings = EmojiControlBindings.defaults();
        private TimerBackend timerBackend = TimerBackend.SCHEDULED_EXECUTOR;
        private Duration wheelTickDuration = Duration.ofMillis(100);

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withBehavior(PaginationBehavior behavior) {
            this.behavior = behavior;
            return this;
        }

        public Builder withDeletion(PaginationDeletion deletion) {
            this.deletion = deletion;
            return this;
        }

        public Builder withBindings(ControlBindingSet bindings) {
            this.bindings = bindings;
            return this;
        }

        public Builder withTimerBackend(TimerBackend timerBackend) {
            this.timerBackend = timerBackend;
            return this;
        }

        public Builder withWheelTickDuration(Duration tick) {
            this.wheelTickDuration = tick;
            return this;
        }

        public PaginationConfig build() {
            return new PaginationConfig(timeout, behavior, deletion, bindings, timerBackend, wheelTickDuration);
        }
    }
}
