package com.questrail.interactivity.observability;

import com.questrail.interactivity.cleanup.CleanupOutcome;

/**
 * No-op implementation of PaginationObservabilitySink.
 */
public final class NullObservabilitySink implements PaginationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {}

    @Override
    public void onNavigation(NavigationEvent event) {}

    @Override
    public void onCleanup(CleanupOutcome outcome) {}

    @Override
    public void onError(PaginationErrorEvent event) {}
}
