package com.questrail.interactivity.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled session timeout.
 *
 * <p>
 * Kept tiny so it can be implemented by:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a JVM {@code ScheduledExecutorService}-backed scheduler</li>
 *   <li>a hashed timer wheel</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();

    /**
     * A handle for a task that was never scheduled.
     */
    Cancellable NONE = () -> false;
}
