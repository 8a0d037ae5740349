package com.questrail.interactivity.collector;

import com.questrail.interactivity.api.ControlToken;
import com.questrail.interactivity.api.Page;
import com.questrail.interactivity.api.PaginationDeletion;
import com.questrail.interactivity.api.RenderTarget;
import com.questrail.interactivity.api.SessionStatus;
import com.questrail.interactivity.api.UserId;
import com.questrail.interactivity.cleanup.CleanupOutcome;
import com.questrail.interactivity.cleanup.CleanupPolicyExecutor;
import com.questrail.interactivity.core.DefaultPaginationSession;
import com.questrail.interactivity.observability.PaginationErrorEvent;
import com.questrail.interactivity.observability.RecordingObservabilitySink;
import com.questrail.interactivity.render.RecordingArtifactOperations;
import com.questrail.interactivity.time.DeterministicScheduler;
import com.questrail.interactivity.time.ManualMonotonicClock;
import com.questrail.interactivity.transport.InputEvent;
import com.questrail.interactivity.transport.ManualInputEventSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PaginationCollectorTest {

    private static final Page A = Page.of("A");
    private static final Page B = Page.of("B");
    private static final UserId OWNER = UserId.of(7L);
    private static final UserId STRANGER = UserId.of(8L);
    private static final RenderTarget TARGET = RenderTarget.of(100L, 200L);
    private static final RenderTarget OTHER = RenderTarget.of(100L, 201L);

    private static final ControlToken NEXT = ControlToken.reaction("▶");
    private static final ControlToken STOP = ControlToken.reaction("⏹");

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingArtifactOperations operations;
    private RecordingObservabilitySink sink;
    private ManualInputEventSource source;
    private DefaultPaginationSession session;
    private PaginationCollector collector;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        operations = new RecordingArtifactOperations();
        sink = new RecordingObservabilitySink();
        source = new ManualInputEventSource();

        session = DefaultPaginationSession.builder()
                .withPages(List.of(A, B))
                .withOwner(OWNER)
                .withRenderTarget(TARGET)
                .withDeletion(PaginationDeletion.DELETE_CONTROL_MARKS)
                .withTimeout(Duration.ofSeconds(10))
                .withCleanup(new CleanupPolicyExecutor(operations))
                .withScheduler(scheduler)
                .withClock(clock)
                .withObservabilitySink(sink)
                .open();

        collector = new PaginationCollector(session, source, operations, sink);
    }

    @Test
    void ownerInputNavigatesAndRenders() {
        collector.start();

        source.emit(new InputEvent(OWNER, NEXT, TARGET));

        assertEquals(1, session.currentIndex());
        assertEquals(List.of(B), operations.renderedPages());
    }

    @Test
    void inputFromOtherUsersIsIgnored() {
        collector.start();

        source.emit(new InputEvent(STRANGER, NEXT, TARGET));

        assertEquals(0, session.currentIndex());
        assertTrue(operations.renderedPages().isEmpty());
    }

    @Test
    void inputOnOtherMessagesIsIgnored() {
        collector.start();

        source.emit(new InputEvent(OWNER, NEXT, OTHER));

        assertEquals(0, session.currentIndex());
        assertTrue(operations.renderedPages().isEmpty());
    }

    @Test
    void unrecognizedInputIsNotRendered() {
        collector.start();

        source.emit(new InputEvent(OWNER, ControlToken.reaction("🎉"), TARGET));

        assertTrue(operations.renderedPages().isEmpty());
        assertEquals(SessionStatus.ACTIVE, session.status());
    }

    @Test
    void stopUnsubscribesAndDisposes() {
        CompletableFuture<CleanupOutcome> finished = collector.start().toCompletableFuture();
        assertEquals(1, source.subscriberCount());

        source.emit(new InputEvent(OWNER, STOP, TARGET));

        assertTrue(finished.isDone());
        assertTrue(finished.join().succeeded());
        assertEquals(0, source.subscriberCount());
        assertEquals(SessionStatus.DISPOSED, session.status());
        assertEquals(1, operations.removeMarksCalls());
        assertTrue(operations.renderedPages().isEmpty());
    }

    @Test
    void timeoutDisposesThroughCollector() {
        CompletableFuture<CleanupOutcome> finished = collector.start().toCompletableFuture();

        clock.advance(Duration.ofSeconds(10));
        scheduler.runDueTasks();

        assertTrue(finished.isDone());
        assertEquals(0, source.subscriberCount());
        assertEquals(SessionStatus.DISPOSED, session.status());

        // Late input after disposal is dropped quietly.
        source.emit(new InputEvent(OWNER, NEXT, TARGET));
        assertTrue(operations.renderedPages().isEmpty());
    }

    @Test
    void startIsIdempotent() {
        collector.start();
        collector.start();

        assertEquals(1, source.subscriberCount());
    }

    @Test
    void startOnCompletedSessionDisposesImmediately() {
        session.stop();

        CompletableFuture<CleanupOutcome> finished = collector.start().toCompletableFuture();

        assertTrue(finished.isDone());
        assertEquals(0, source.subscriberCount());
        assertEquals(SessionStatus.DISPOSED, session.status());
    }

    @Test
    void renderFailureIsReportedAndSessionKeepsRunning() {
        operations.failRenders(new IllegalStateException("rate limited"));
        collector.start();

        source.emit(new InputEvent(OWNER, NEXT, TARGET));

        assertEquals(1, session.currentIndex());
        assertEquals(SessionStatus.ACTIVE, session.status());
        assertEquals(1, sink.getErrors().size());
        assertEquals(PaginationErrorEvent.Severity.ERROR, sink.getErrors().get(0).severity());
    }
}
