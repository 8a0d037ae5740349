package com.questrail.interactivity.observability;

import com.questrail.interactivity.api.CompletionReason;
import com.questrail.interactivity.api.RenderTarget;
import com.questrail.interactivity.api.SessionStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a lifecycle transition of a pagination session.
 *
 * @param reason completion reason, present for every transition out of
 *               {@link SessionStatus#ACTIVE}
 */
public record SessionStateTransitionEvent(
    Instant timestamp,
    RenderTarget target,
    SessionStatus oldStatus,
    SessionStatus newStatus,
    Optional<CompletionReason> reason
) {
}
