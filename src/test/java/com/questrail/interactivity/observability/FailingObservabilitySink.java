package com.questrail.interactivity.observability;

import com.questrail.interactivity.cleanup.CleanupOutcome;

/**
 * Test sink whose every callback throws.
 */
public final class FailingObservabilitySink implements PaginationObservabilitySink {

    private static RuntimeException failure() {
        return new IllegalStateException("observability backend unavailable");
    }

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {
        throw failure();
    }

    @Override
    public void onNavigation(NavigationEvent event) {
        throw failure();
    }

    @Override
    public void onCleanup(CleanupOutcome outcome) {
        throw failure();
    }

    @Override
    public void onError(PaginationErrorEvent event) {
        throw failure();
    }
}
