package com.questrail.interactivity.runtime;

import com.questrail.interactivity.api.ControlBindingSet;
import com.questrail.interactivity.api.Page;
import com.questrail.interactivity.api.PaginationBehavior;
import com.questrail.interactivity.api.PaginationDeletion;
import com.questrail.interactivity.api.PaginationSession;
import com.questrail.interactivity.api.RenderTarget;
import com.questrail.interactivity.api.UserId;
import com.questrail.interactivity.cleanup.CleanupOutcome;
import com.questrail.interactivity.cleanup.CleanupPolicyExecutor;
import com.questrail.interactivity.collector.PaginationCollector;
import com.questrail.interactivity.config.PaginationConfig;
import com.questrail.interactivity.core.DefaultPaginationSession;
import com.questrail.interactivity.internal.time.MonotonicClock;
import com.questrail.interactivity.internal.time.MonotonicScheduler;
import com.questrail.interactivity.internal.time.ScheduledExecutorScheduler;
import com.questrail.interactivity.internal.time.SystemMonotonicClock;
import com.questrail.interactivity.internal.time.SystemWallClock;
import com.questrail.interactivity.internal.time.netty.HashedWheelTimerScheduler;
import com.questrail.interactivity.observability.NullObservabilitySink;
import com.questrail.interactivity.observability.PaginationErrorEvent;
import com.questrail.interactivity.observability.PaginationObservabilitySink;
import com.questrail.interactivity.render.ArtifactOperations;
import com.questrail.interactivity.transport.InputEventSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PaginationRuntime
 * =============================================================================
 * Composition root and lifecycle owner for pagination sessions.
 *
 * <h2>Owns</h2>
 * <ul>
 *   <li>the timer backend (unless one is supplied to the builder)</li>
 *   <li>the cleanup executor shared by its sessions</li>
 *   <li>the set of sessions that have not yet completed</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.paginate(...)  → session + collector; stage completes on disposal
 *   runtime.stop()         → abandons live sessions, releases the timer backend
 * </pre>
 */
public final class PaginationRuntime implements AutoCloseable {

    private final PaginationConfig config;
    private final ArtifactOperations operations;
    private final InputEventSource inputSource;
    private final PaginationObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Runnable schedulerShutdown;
    private final CleanupPolicyExecutor cleanup;

    private final Set<PaginationSession> liveSessions = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(true);

    private PaginationRuntime(Builder b,
                              MonotonicScheduler scheduler,
                              Runnable schedulerShutdown) {
        this.config = b.config;
        this.operations = b.operations;
        this.inputSource = b.inputSource;
        this.observabilitySink = b.observabilitySink;
        this.clock = b.clock;
        this.scheduler = scheduler;
        this.schedulerShutdown = schedulerShutdown;
        this.cleanup = new CleanupPolicyExecutor(operations);
    }

    public PaginationConfig config() {
        return config;
    }

    /**
     * Creates a session with the configured defaults and starts its timeout.
     */
    public PaginationSession createSession(List<Page> pages, UserId owner, RenderTarget target) {
        return createSession(pages, owner, config.behavior(), config.deletion(),
                config.timeout(), config.bindings(), target);
    }

    /**
     * Creates a session and starts its timeout. The caller drives it and must
     * dispose it.
     *
     * @throws IllegalArgumentException if {@code pages} is empty or the timeout is not positive
     * @throws IllegalStateException    if the runtime has been stopped
     */
    public PaginationSession createSession(List<Page> pages,
                                           UserId owner,
                                           PaginationBehavior behavior,
                                           PaginationDeletion deletion,
                                           Duration timeout,
                                           ControlBindingSet bindings,
                                           RenderTarget target) {
        if (!running.get()) {
            throw new IllegalStateException("Pagination runtime has been stopped");
        }

        DefaultPaginationSession session = DefaultPaginationSession.builder()
                .withPages(pages)
                .withOwner(owner)
                .withRenderTarget(target)
                .withBehavior(behavior)
                .withDeletion(deletion)
                .withTimeout(timeout)
                .withBindings(bindings)
                .withCleanup(cleanup)
                .withScheduler(scheduler)
                .withClock(clock)
                .withObservabilitySink(observabilitySink)
                .open();

        liveSessions.add(session);
        session.completion().whenComplete((reason, error) -> liveSessions.remove(session));

        // stop() flips the flag before it snapshots liveSessions; a session added
        // after that snapshot is released here.
        if (!running.get()) {
            session.close();
            throw new IllegalStateException("Pagination runtime has been stopped");
        }
        return session;
    }

    /**
     * Paginates {@code pages} on {@code target} for {@code owner} using the
     * configured defaults.
     */
    public CompletionStage<CleanupOutcome> paginate(List<Page> pages, UserId owner, RenderTarget target) {
        return paginate(pages, owner, config.behavior(), config.deletion(),
                config.timeout(), config.bindings(), target);
    }

    /**
     * Creates a session, starts collecting input for it, renders the first page
     * and attaches the controls.
     *
     * @return stage completed with the cleanup outcome once the session is disposed
     * @throws IllegalStateException if no input source was configured
     */
    public CompletionStage<CleanupOutcome> paginate(List<Page> pages,
                                                    UserId owner,
                                                    PaginationBehavior behavior,
                                                    PaginationDeletion deletion,
                                                    Duration timeout,
                                                    ControlBindingSet bindings,
                                                    RenderTarget target) {
        if (inputSource == null) {
            throw new IllegalStateException("No InputEventSource configured");
        }

        PaginationSession session = createSession(pages, owner, behavior, deletion, timeout, bindings, target);
        PaginationCollector collector = new PaginationCollector(session, inputSource, operations, observabilitySink);
        CompletionStage<CleanupOutcome> finished = collector.start();

        try {
            operations.render(target, pages.get(0))
                    .thenCompose(v -> operations.attachControls(target, bindings))
                    .whenComplete((v, error) -> {
                        if (error != null) {
                            reportSetupFailure(target, error);
                        }
                    });
        } catch (RuntimeException e) {
            reportSetupFailure(target, e);
        }
        return finished;
    }

    private void reportSetupFailure(RenderTarget target, Throwable error) {
        observabilitySink.onError(new PaginationErrorEvent(SystemWallClock.INSTANCE.now(), target,
                PaginationErrorEvent.Severity.ERROR, "Initial render failed", error));
    }

    /**
     * Returns the number of sessions that have not yet completed.
     */
    public int liveSessionCount() {
        return liveSessions.size();
    }

    /**
     * Abandons every live session, waits for their cleanup, then releases the
     * timer backend. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        List<PaginationSession> sessions = new ArrayList<>(liveSessions);
        for (PaginationSession session : sessions) {
            session.close();
        }
        liveSessions.clear();
        schedulerShutdown.run();
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PaginationConfig config = PaginationConfig.defaults();
        private ArtifactOperations operations;
        private InputEventSource inputSource;
        private PaginationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;

        public Builder withConfig(PaginationConfig config) {
            this.config = config;
            return this;
        }

        public Builder withArtifactOperations(ArtifactOperations operations) {
            this.operations = operations;
            return this;
        }

        public Builder withInputEventSource(InputEventSource source) {
            this.inputSource = source;
            return this;
        }

        public Builder withObservabilitySink(PaginationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Supplies an externally owned scheduler. The runtime will not shut it down.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public PaginationRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(operations, "operations");
            Objects.requireNonNull(clock, "clock");
            observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            if (scheduler != null) {
                return new PaginationRuntime(this, scheduler, () -> {});
            }

            switch (config.timerBackend()) {
                case HASHED_WHEEL: {
                    HashedWheelTimerScheduler wheel = new HashedWheelTimerScheduler(clock, config.wheelTickDuration());
                    return new PaginationRuntime(this, wheel, wheel::stop);
                }
                case SCHEDULED_EXECUTOR:
                default: {
                    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
                        Thread t = new Thread(r, "pagination-timeouts");
                        t.setDaemon(true);
                        return t;
                    });
                    // Stopped sessions cancel their timeout; do not keep it queued until its deadline.
                    executor.setRemoveOnCancelPolicy(true);
                    return new PaginationRuntime(this, new ScheduledExecutorScheduler(executor, clock),
                            () -> shutdown(executor));
                }
            }
        }

        private static void shutdown(ScheduledExecutorService executor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
