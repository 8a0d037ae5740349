package com.questrail.interactivity.observability;

import com.questrail.interactivity.cleanup.CleanupOutcome;

/**
 * Main interface for receiving pagination observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from timer threads and collector threads
 * concurrently. Implementations must not block and must not throw.</p>
 */
public interface PaginationObservabilitySink {
    /**
     * Called when a session changes {@link com.questrail.interactivity.api.SessionStatus}.
     */
    void onStateTransition(SessionStateTransitionEvent event);

    /**
     * Called after a navigation action has been applied.
     */
    void onNavigation(NavigationEvent event);

    /**
     * Called once per session when its cleanup policy has run.
     */
    void onCleanup(CleanupOutcome outcome);

    /**
     * Called when an error or anomaly occurs.
     */
    void onError(PaginationErrorEvent event);
}
