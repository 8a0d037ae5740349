package com.questrail.interactivity.core;

import com.questrail.interactivity.api.CompletionReason;
import com.questrail.interactivity.api.ControlBindingSet;
import com.questrail.interactivity.api.ControlToken;
import com.questrail.interactivity.api.NavigationResult;
import com.questrail.interactivity.api.Page;
import com.questrail.interactivity.api.PaginationAction;
import com.questrail.interactivity.api.PaginationBehavior;
import com.questrail.interactivity.api.PaginationDeletion;
import com.questrail.interactivity.api.PaginationSession;
import com.questrail.interactivity.api.RenderTarget;
import com.questrail.interactivity.api.SessionInactiveException;
import com.questrail.interactivity.api.SessionStatus;
import com.questrail.interactivity.api.UserId;
import com.questrail.interactivity.bindings.EmojiControlBindings;
import com.questrail.interactivity.cleanup.CleanupOutcome;
import com.questrail.interactivity.cleanup.CleanupPolicyExecutor;
import com.questrail.interactivity.internal.state.NavigationReducer;
import com.questrail.interactivity.internal.state.NavigationState;
import com.questrail.interactivity.internal.time.Cancellable;
import com.questrail.interactivity.internal.time.MonotonicClock;
import com.questrail.interactivity.internal.time.MonotonicScheduler;
import com.questrail.interactivity.internal.time.SystemMonotonicClock;
import com.questrail.interactivity.internal.time.SystemWallClock;
import com.questrail.interactivity.internal.time.WallClock;
import com.questrail.interactivity.observability.NavigationEvent;
import com.questrail.interactivity.observability.NullObservabilitySink;
import com.questrail.interactivity.observability.PaginationErrorEvent;
import com.questrail.interactivity.observability.PaginationObservabilitySink;
import com.questrail.interactivity.observability.SessionStateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * DefaultPaginationSession
 * -----------------------------------------------------------------------------
 * Lock-based implementation of {@link PaginationSession}.
 *
 * <h2>Threading model</h2>
 * A single private lock ("monitor") guards the navigation state, the lifecycle
 * status, the timeout handle and the disposal stage. {@link #registerControl},
 * {@link #stop()}, the timeout callback and {@link #dispose()} all take it, so:
 * <ul>
 *   <li>the index invariant holds under any interleaving</li>
 *   <li>the {@code ACTIVE -> COMPLETED} transition happens exactly once</li>
 *   <li>no control mutates the index after that transition</li>
 * </ul>
 *
 * Side effects (observability callbacks, completing stages, remote cleanup)
 * run outside the lock so that dependents and I/O never block navigation.
 *
 * <h2>Timeout</h2>
 * The timeout is armed by {@link Builder#open()} right after construction and
 * disarmed on completion, whichever path completes the session.
 */
public final class DefaultPaginationSession implements PaginationSession
{
    private static final Logger log = LoggerFactory.getLogger(DefaultPaginationSession.class);

    private final Object lock = new Object();

    private final PageStore pages;
    private final UserId owner;
    private final RenderTarget target;
    private final ControlBindingSet bindings;
    private final NavigationReducer reducer;
    private final PaginationDeletion deletion;
    private final Duration timeout;
    private final CleanupPolicyExecutor cleanup;
    private final PaginationObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final CompletableFuture<CompletionReason> completion = new CompletableFuture<>();

    // Guarded by lock.
    private NavigationState state;
    private SessionStatus status = SessionStatus.ACTIVE;
    private Cancellable timeoutHandle = Cancellable.NONE;
    private CompletableFuture<CleanupOutcome> disposal;

    private DefaultPaginationSession(Builder b) {
        this.pages = new PageStore(Objects.requireNonNull(b.pages, "pages"));
        this.owner = Objects.requireNonNull(b.owner, "owner");
        this.target = Objects.requireNonNull(b.target, "target");
        this.bindings = Objects.requireNonNull(b.bindings, "bindings");
        this.reducer = new NavigationReducer(Objects.requireNonNull(b.behavior, "behavior"));
        this.deletion = Objects.requireNonNull(b.deletion, "deletion");
        this.timeout = Objects.requireNonNull(b.timeout, "timeout");
        this.cleanup = Objects.requireNonNull(b.cleanup, "cleanup");
        this.observabilitySink = Objects.requireNonNullElse(b.observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");

        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        this.state = NavigationState.initial(pages.pageCount());
    }

    private void arm(MonotonicScheduler scheduler, MonotonicClock clock) {
        Cancellable handle = scheduler.scheduleAfter(timeout, clock, this::onTimeout);
        synchronized (lock) {
            if (status == SessionStatus.ACTIVE) {
                timeoutHandle = handle;
                return;
            }
        }
        // Completed before the handle could be recorded.
        handle.cancel();
    }

    // ---------------------------------------------------------------------
    // Navigation
    // ---------------------------------------------------------------------

    @Override
    public NavigationResult registerControl(ControlToken token) throws SessionInactiveException {
        Objects.requireNonNull(token, "token");

        final NavigationResult result;
        NavigationEvent applied = null;
        Cancellable stoppedHandle = null;

        synchronized (lock) {
            if (status != SessionStatus.ACTIVE) {
                throw new SessionInactiveException(status);
            }

            if (!bindings.supports(token.kind())) {
                result = snapshotLocked(Optional.empty(), NavigationResult.Outcome.UNSUPPORTED, true);
            } else {
                Optional<PaginationAction> action = bindings.resolve(token);
                if (action.isEmpty()) {
                    result = snapshotLocked(action, NavigationResult.Outcome.UNRECOGNIZED, true);
                } else if (action.get() == PaginationAction.STOP) {
                    stoppedHandle = completeLocked();
                    result = snapshotLocked(action, NavigationResult.Outcome.STOPPED, false);
                } else {
                    NavigationState old = state;
                    NavigationReducer.Result r = reducer.apply(old, action.get());
                    state = r.newState();
                    applied = new NavigationEvent(wallClock.now(), target, action.get(),
                            old.index(), state.index());
                    result = snapshotLocked(action,
                            r.changed() ? NavigationResult.Outcome.NAVIGATED : NavigationResult.Outcome.UNCHANGED,
                            true);
                }
            }
        }

        if (stoppedHandle != null) {
            afterCompletion(stoppedHandle, CompletionReason.STOPPED);
        }
        if (applied != null) {
            NavigationEvent event = applied;
            notifySink(() -> observabilitySink.onNavigation(event));
        }
        if (result.outcome() == NavigationResult.Outcome.UNSUPPORTED) {
            PaginationErrorEvent warning = new PaginationErrorEvent(wallClock.now(), target,
                    PaginationErrorEvent.Severity.WARNING,
                    "Control '" + token.value() + "' is a " + token.kind()
                            + " input; session accepts " + bindings.inputKind() + " only",
                    null);
            notifySink(() -> observabilitySink.onError(warning));
        }
        return result;
    }

    private NavigationResult snapshotLocked(Optional<PaginationAction> action,
                                            NavigationResult.Outcome outcome,
                                            boolean stillActive) {
        return new NavigationResult(pages.pageAt(state.index()), state.index(), action, outcome, stillActive);
    }

    // ---------------------------------------------------------------------
    // Completion
    // ---------------------------------------------------------------------

    @Override
    public boolean stop() {
        return complete(CompletionReason.STOPPED);
    }

    private void onTimeout() {
        try {
            complete(CompletionReason.TIMED_OUT);
        } catch (RuntimeException e) {
            // Never propagate into the timer thread.
            log.error("Timeout callback failed for {}", target, e);
        }
    }

    private boolean complete(CompletionReason reason) {
        final Cancellable handle;
        synchronized (lock) {
            if (status != SessionStatus.ACTIVE) {
                return false;
            }
            handle = completeLocked();
        }
        afterCompletion(handle, reason);
        return true;
    }

    /**
     * Moves ACTIVE to COMPLETED and detaches the timeout handle. Caller holds the lock.
     */
    private Cancellable completeLocked() {
        status = SessionStatus.COMPLETED;
        Cancellable handle = timeoutHandle;
        timeoutHandle = Cancellable.NONE;
        return handle;
    }

    /**
     * Publishes ACTIVE -> COMPLETED, then fires the completion signal. The signal
     * fires even when the sink or the handle fails, and the transition is always
     * published before disposal can run from a completion dependent.
     */
    private void afterCompletion(Cancellable handle, CompletionReason reason) {
        try {
            handle.cancel();
            SessionStateTransitionEvent event = new SessionStateTransitionEvent(wallClock.now(), target,
                    SessionStatus.ACTIVE, SessionStatus.COMPLETED, Optional.of(reason));
            notifySink(() -> observabilitySink.onStateTransition(event));
        } finally {
            completion.complete(reason);
        }
    }

    /**
     * Sink failures are logged and never interrupt the session lifecycle.
     */
    private void notifySink(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Observability sink failed for {}", target, e);
        }
    }

    @Override
    public CompletionReason awaitCompletion() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            // The completion stage is never completed exceptionally.
            throw new IllegalStateException(e.getCause());
        }
    }

    @Override
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        try {
            completion.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    @Override
    public CompletionStage<CompletionReason> completion() {
        return completion.copy();
    }

    // ---------------------------------------------------------------------
    // Disposal
    // ---------------------------------------------------------------------

    @Override
    public CompletionStage<CleanupOutcome> dispose() {
        final CompletableFuture<CleanupOutcome> result;
        Cancellable abandonedHandle = null;

        synchronized (lock) {
            if (disposal != null) {
                return disposal.copy();
            }
            disposal = new CompletableFuture<>();
            result = disposal;
            if (status == SessionStatus.ACTIVE) {
                abandonedHandle = completeLocked();
            }
        }

        if (abandonedHandle != null) {
            afterCompletion(abandonedHandle, CompletionReason.ABANDONED);
        }

        CompletionStage<CleanupOutcome> run;
        try {
            run = cleanup.execute(target, deletion);
        } catch (RuntimeException e) {
            run = CompletableFuture.completedFuture(CleanupOutcome.failed(target, deletion, e));
        }

        run.whenComplete((outcome, error) -> finishDisposal(
                outcome != null ? outcome : CleanupOutcome.failed(target, deletion, error),
                result));

        return result.copy();
    }

    private void finishDisposal(CleanupOutcome outcome, CompletableFuture<CleanupOutcome> result) {
        synchronized (lock) {
            status = SessionStatus.DISPOSED;
        }
        try {
            notifySink(() -> observabilitySink.onCleanup(outcome));
            SessionStateTransitionEvent event = new SessionStateTransitionEvent(wallClock.now(), target,
                    SessionStatus.COMPLETED, SessionStatus.DISPOSED,
                    Optional.ofNullable(completion.getNow(null)));
            notifySink(() -> observabilitySink.onStateTransition(event));
        } finally {
            result.complete(outcome);
        }
    }

    @Override
    public void close() {
        dispose().toCompletableFuture().join();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    @Override
    public SessionStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    @Override
    public int pageCount() {
        return pages.pageCount();
    }

    @Override
    public int currentIndex() {
        synchronized (lock) {
            requireNotDisposedLocked();
            return state.index();
        }
    }

    @Override
    public Page currentPage() {
        synchronized (lock) {
            requireNotDisposedLocked();
            return pages.pageAt(state.index());
        }
    }

    private void requireNotDisposedLocked() {
        if (status == SessionStatus.DISPOSED) {
            throw new IllegalStateException("Session for " + target + " has been disposed");
        }
    }

    @Override
    public UserId owner() {
        return owner;
    }

    @Override
    public RenderTarget renderTarget() {
        return target;
    }

    @Override
    public ControlBindingSet bindings() {
        return bindings;
    }

    @Override
    public PaginationBehavior behavior() {
        return reducer.behavior();
    }

    @Override
    public PaginationDeletion deletion() {
        return deletion;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "DefaultPaginationSession[" + target + ", owner=" + owner + ", status=" + status() + "]";
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<Page> pages;
        private UserId owner;
        private RenderTarget target;
        private ControlBindingSet bindings = EmojiControlBindings.defaults();
        private PaginationBehavior behavior = PaginationBehavior.CLAMP;
        private PaginationDeletion deletion = PaginationDeletion.DELETE_CONTROL_MARKS;
        private Duration timeout;
        private CleanupPolicyExecutor cleanup;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private PaginationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        private Builder() {}

        public Builder withPages(List<Page> pages) {
            this.pages = pages;
            return this;
        }

        public Builder withOwner(UserId owner) {
            this.owner = owner;
            return this;
        }

        public Builder withRenderTarget(RenderTarget target) {
            this.target = target;
            return this;
        }

        public Builder withBindings(ControlBindingSet bindings) {
            this.bindings = bindings;
            return this;
        }

        public Builder withBehavior(PaginationBehavior behavior) {
            this.behavior = behavior;
            return this;
        }

        public Builder withDeletion(PaginationDeletion deletion) {
            this.deletion = deletion;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withCleanup(CleanupPolicyExecutor cleanup) {
            this.cleanup = cleanup;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(PaginationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Creates the session and starts its timeout.
         *
         * @throws IllegalArgumentException if no pages were given or the timeout is not positive
         */
        public DefaultPaginationSession open() {
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(clock, "clock");

            DefaultPaginationSession session = new DefaultPaginationSession(this);
            session.arm(scheduler, clock);
            return session;
        }
    }
}
