package com.questrail.interactivity.api;

import com.questrail.interactivity.cleanup.CleanupOutcome;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * PaginationSession
 * -----------------------------------------------------------------------------
 * One live, user-navigable pagination interaction bound to one rendered message
 * and one controlling user.
 *
 * <h2>Core Responsibilities</h2>
 * A {@code PaginationSession} is responsible for:
 * <ul>
 *   <li>Holding an immutable, non-empty sequence of pages</li>
 *   <li>Applying navigation controls under the session's boundary policy</li>
 *   <li>Owning the session timeout and a one-shot completion signal</li>
 *   <li>Running its cleanup policy exactly once on disposal</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Receiving raw input events or filtering them by user or message</li>
 *   <li>Rendering pages into messages</li>
 *   <li>Retrying failed remote calls</li>
 * </ul>
 *
 * <h2>Threading and Concurrency</h2>
 * Implementations must be thread-safe. {@link #registerControl(ControlToken)},
 * {@link #stop()} and the timeout callback are serialized against each other.
 * Once completion has been observed by any thread, no later control changes the
 * current index.
 *
 * <h2>Lifecycle</h2>
 * See {@link SessionStatus}. {@link #close()} provides scoped release for
 * try-with-resources callers; after disposal the page accessors fail with
 * {@link IllegalStateException}.
 */
public interface PaginationSession extends AutoCloseable
{
    /**
     * Applies the control bound to {@code token}, if any, and returns the page
     * to render.
     *
     * @param token control token delivered by the transport
     * @return the navigation result
     * @throws SessionInactiveException if the session has already completed
     */
    NavigationResult registerControl(ControlToken token) throws SessionInactiveException;

    /**
     * Fires the completion signal with {@link CompletionReason#STOPPED} and
     * disarms the timeout.
     *
     * @return {@code true} if this call completed the session; {@code false} if
     *         it had already completed
     */
    boolean stop();

    /**
     * Blocks the calling thread until the completion signal fires.
     *
     * @return why the session completed
     * @throws InterruptedException if the calling thread is interrupted
     */
    CompletionReason awaitCompletion() throws InterruptedException;

    /**
     * Blocks the calling thread until the completion signal fires or
     * {@code timeout} elapses.
     *
     * @return {@code true} if the session completed within the timeout
     * @throws InterruptedException if the calling thread is interrupted
     */
    boolean awaitCompletion(Duration timeout) throws InterruptedException;

    /**
     * Returns a stage completed with the completion reason when the completion
     * signal fires. Never completes exceptionally.
     */
    CompletionStage<CompletionReason> completion();

    /**
     * Runs the cleanup policy exactly once and releases session resources.
     *
     * <p>If the session is still active it is completed first with
     * {@link CompletionReason#ABANDONED}. Every call returns the same stage,
     * which never completes exceptionally: cleanup failures are captured in the
     * {@link CleanupOutcome}.</p>
     */
    CompletionStage<CleanupOutcome> dispose();

    /**
     * Disposes this session and waits for cleanup to finish.
     */
    @Override
    void close();

    SessionStatus status();

    int pageCount();

    /**
     * @throws IllegalStateException if the session has been disposed
     */
    int currentIndex();

    /**
     * @throws IllegalStateException if the session has been disposed
     */
    Page currentPage();

    UserId owner();

    RenderTarget renderTarget();

    ControlBindingSet bindings();

    PaginationBehavior behavior();

    PaginationDeletion deletion();

    Duration timeout();
}
