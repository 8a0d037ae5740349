package com.questrail.interactivity.observability;

import com.questrail.interactivity.cleanup.CleanupOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PaginationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPaginationObservabilitySink implements PaginationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPaginationObservabilitySink.class);

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {
        log.info("Pagination {}: {} -> {}{}",
            event.target(),
            event.oldStatus(),
            event.newStatus(),
            event.reason().map(r -> " (" + r + ")").orElse(""));
    }

    @Override
    public void onNavigation(NavigationEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Pagination {}: {} {} -> {}",
                event.target(), event.action(), event.oldIndex(), event.newIndex());
        }
    }

    @Override
    public void onCleanup(CleanupOutcome outcome) {
        if (outcome.succeeded()) {
            log.debug("Pagination {}: cleanup {} done", outcome.target(), outcome.policy());
        } else {
            log.warn("Pagination {}: cleanup {} failed", outcome.target(), outcome.policy(),
                outcome.failure().orElse(null));
        }
    }

    @Override
    public void onError(PaginationErrorEvent event) {
        if (event.severity() == PaginationErrorEvent.Severity.WARNING) {
            log.warn("Pagination {}: {}", event.target(), event.message(), event.cause());
        } else {
            log.error("Pagination {}: {}", event.target(), event.message(), event.cause());
        }
    }
}
