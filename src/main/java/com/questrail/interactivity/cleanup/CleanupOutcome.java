package com.questrail.interactivity.cleanup;

import com.questrail.interactivity.api.PaginationDeletion;
import com.questrail.interactivity.api.RenderTarget;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of running a session's cleanup policy.
 *
 * @param target  message the policy was applied to
 * @param policy  policy that ran
 * @param failure remote failure, if the policy's call failed
 */
public record CleanupOutcome(RenderTarget target,
                             PaginationDeletion policy,
                             Optional<Throwable> failure)
{
    public CleanupOutcome {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(failure, "failure");
    }

    public static CleanupOutcome success(RenderTarget target, PaginationDeletion policy) {
        return new CleanupOutcome(target, policy, Optional.empty());
    }

    public static CleanupOutcome failed(RenderTarget target, PaginationDeletion policy, Throwable cause) {
        return new CleanupOutcome(target, policy, Optional.of(cause));
    }

    public boolean succeeded() {
        return failure.isEmpty();
    }
}
