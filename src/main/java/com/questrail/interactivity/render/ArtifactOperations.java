package com.questrail.interactivity.render;

import com.questrail.interactivity.api.ControlBindingSet;
import com.questrail.interactivity.api.Page;
import com.questrail.interactivity.api.RenderTarget;

import java.util.concurrent.CompletionStage;

/**
 * ArtifactOperations
 * -----------------------------------------------------------------------------
 * Port to the client layer that owns rendered messages.
 *
 * <p>Every call is asynchronous and may fail. Failures are signalled by an
 * exceptionally completed stage; implementations should not throw. The
 * pagination core never retries: it reports failures upward and carries on.</p>
 *
 * <p>Implementations may be backed by a REST client, a gateway connection, or
 * a test double.</p>
 */
public interface ArtifactOperations
{
    /**
     * Edits the target message to display {@code page}.
     */
    CompletionStage<Void> render(RenderTarget target, Page page);

    /**
     * Attaches the controls of {@code bindings} to the target message: one
     * reaction per token for reaction bindings, one button row for button
     * bindings.
     */
    CompletionStage<Void> attachControls(RenderTarget target, ControlBindingSet bindings);

    /**
     * Removes every control mark (reactions or components) from the target.
     */
    CompletionStage<Void> removeAllControlMarks(RenderTarget target);

    /**
     * Deletes the target message.
     */
    CompletionStage<Void> deleteArtifact(RenderTarget target);
}
