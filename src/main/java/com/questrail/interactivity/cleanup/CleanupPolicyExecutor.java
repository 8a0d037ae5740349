package com.questrail.interactivity.cleanup;

import com.questrail.interactivity.api.PaginationDeletion;
import com.questrail.interactivity.api.RenderTarget;
import com.questrail.interactivity.render.ArtifactOperations;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * CleanupPolicyExecutor
 * -----------------------------------------------------------------------------
 * Performs the disposal action selected by a {@link PaginationDeletion}
 * against a rendered message.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Exactly one branch runs per call; at most one remote call is issued</li>
 *   <li>The returned stage never completes exceptionally</li>
 *   <li>A failed or throwing remote call is captured in the
 *       {@link CleanupOutcome}</li>
 * </ul>
 *
 * Calling it at most once per session is the session's responsibility.
 */
public final class CleanupPolicyExecutor
{
    private final ArtifactOperations operations;

    public CleanupPolicyExecutor(ArtifactOperations operations) {
        this.operations = Objects.requireNonNull(operations, "operations");
    }

    public CompletionStage<CleanupOutcome> execute(RenderTarget target, PaginationDeletion policy) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(policy, "policy");

        final CompletionStage<Void> call;
        try {
            call = switch (policy) {
                case DELETE_CONTROL_MARKS -> operations.removeAllControlMarks(target);
                case DELETE_RENDERED_ARTIFACT -> operations.deleteArtifact(target);
                case KEEP_CONTROL_MARKS -> CompletableFuture.completedFuture(null);
            };
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(CleanupOutcome.failed(target, policy, e));
        }

        if (call == null) {
            return CompletableFuture.completedFuture(CleanupOutcome.failed(target, policy,
                    new IllegalStateException(policy + " call returned no stage")));
        }

        return call.handle((ignored, error) -> error == null
                ? CleanupOutcome.success(target, policy)
                : CleanupOutcome.failed(target, policy, unwrap(error)));
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
