package com.questrail.interactivity.api;

/**
 * SessionStatus
 * -----------------------------------------------------------------------------
 * Lifecycle state of a {@link PaginationSession}.
 *
 * <h2>Transitions</h2>
 * <pre>
 *   ACTIVE --(timeout | stop)--&gt; COMPLETED --(cleanup executed)--&gt; DISPOSED
 * </pre>
 *
 * Transitions are strictly forward. A session never returns to a prior state.
 */
public enum SessionStatus
{
    /**
     * The session accepts controls and its timeout is armed.
     */
    ACTIVE,

    /**
     * The completion signal has fired. Navigation is frozen; cleanup may be
     * pending or in flight.
     */
    COMPLETED,

    /**
     * Cleanup has run (successfully or not) and all session resources have
     * been released.
     */
    DISPOSED;

    /**
     * Returns {@code true} if controls may still be registered.
     */
    public boolean isLive() {
        return this == ACTIVE;
    }
}
