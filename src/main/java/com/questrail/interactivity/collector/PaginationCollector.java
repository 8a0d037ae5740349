package com.questrail.interactivity.collector;

import com.questrail.interactivity.api.NavigationResult;
import com.questrail.interactivity.api.PaginationSession;
import com.questrail.interactivity.api.SessionInactiveException;
import com.questrail.interactivity.cleanup.CleanupOutcome;
import com.questrail.interactivity.internal.time.SystemWallClock;
import com.questrail.interactivity.observability.NullObservabilitySink;
import com.questrail.interactivity.observability.PaginationErrorEvent;
import com.questrail.interactivity.observability.PaginationObservabilitySink;
import com.questrail.interactivity.render.ArtifactOperations;
import com.questrail.interactivity.transport.InputEvent;
import com.questrail.interactivity.transport.InputEventSource;
import com.questrail.interactivity.transport.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PaginationCollector
 * =============================================================================
 * Bridges an {@link InputEventSource} to one {@link PaginationSession}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Filter input to the session's message and owner</li>
 *   <li>Register each remaining control with the session</li>
 *   <li>Render the resulting page through {@link ArtifactOperations}</li>
 *   <li>On completion: unsubscribe, then dispose the session exactly once</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   collector.start()  → subscribes; returns the disposal stage
 *   (timeout | stop)   → unsubscribe + session.dispose()
 * </pre>
 *
 * Render failures are reported to the observability sink and never retried.
 */
public final class PaginationCollector
{
    private static final Logger log = LoggerFactory.getLogger(PaginationCollector.class);

    private final PaginationSession session;
    private final InputEventSource source;
    private final ArtifactOperations operations;
    private final PaginationObservabilitySink observabilitySink;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<CleanupOutcome> finished = new CompletableFuture<>();
    private volatile Subscription subscription;

    public PaginationCollector(PaginationSession session,
                               InputEventSource source,
                               ArtifactOperations operations,
                               PaginationObservabilitySink observabilitySink) {
        this.session = Objects.requireNonNull(session, "session");
        this.source = Objects.requireNonNull(source, "source");
        this.operations = Objects.requireNonNull(operations, "operations");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Subscribes to the event source and arranges disposal on completion.
     * Idempotent: later calls return the same stage.
     *
     * @return stage completed with the session's cleanup outcome once it is disposed
     */
    public CompletionStage<CleanupOutcome> start() {
        if (started.compareAndSet(false, true)) {
            subscription = source.subscribe(this::onInput);
            session.completion().whenComplete((reason, error) -> finish());
        }
        return finished.copy();
    }

    private void onInput(InputEvent event) {
        if (!event.target().equals(session.renderTarget())) {
            return;
        }
        if (!event.actor().equals(session.owner())) {
            log.trace("Ignoring input from {} on {}: not the owner", event.actor(), event.target());
            return;
        }

        final NavigationResult result;
        try {
            result = session.registerControl(event.token());
        } catch (SessionInactiveException e) {
            log.debug("Dropping late input on {}: {}", event.target(), e.getMessage());
            return;
        }

        if (result.shouldRender()) {
            render(result);
        }
    }

    private void render(NavigationResult result) {
        CompletionStage<Void> call;
        try {
            call = operations.render(session.renderTarget(), result.page());
        } catch (RuntimeException e) {
            reportRenderFailure(e);
            return;
        }
        call.whenComplete((ignored, error) -> {
            if (error != null) {
                reportRenderFailure(error);
            }
        });
    }

    private void reportRenderFailure(Throwable error) {
        observabilitySink.onError(new PaginationErrorEvent(SystemWallClock.INSTANCE.now(),
                session.renderTarget(), PaginationErrorEvent.Severity.ERROR, "Render failed", error));
    }

    private void finish() {
        Subscription s = subscription;
        if (s != null) {
            s.cancel();
        }
        session.dispose().whenComplete((outcome, error) -> {
            if (error != null) {
                finished.completeExceptionally(error);
            } else {
                finished.complete(outcome);
            }
        });
    }
}
