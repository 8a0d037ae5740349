package com.questrail.interactivity.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for session timeouts.
 *
 * <h2>Binding invariant</h2>
 * Session deadlines MUST be computed from a monotonic time source. Wall-clock
 * time (e.g. {@code Instant.now()}) is permitted only for observability
 * timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
