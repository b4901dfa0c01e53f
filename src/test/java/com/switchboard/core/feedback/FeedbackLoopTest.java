package com.switchboard.core.feedback;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.FeedbackType;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.UserFeedback;
import com.switchboard.core.store.InMemoryOperationStore;
import com.switchboard.core.store.OperationNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackLoopTest {

    private static final Classification SYSTEM = new Classification(DestinationType.FILE, ConsumerType.MACHINE,
            ExecutionSemantics.EXECUTE, true, "looks like a write");

    private InMemoryOperationStore store;
    private SimpleMeterRegistry registry;
    private List<SwitchboardEvent> events;
    private FeedbackLoop feedbackLoop;

    @BeforeEach
    void setUp() {
        store = new InMemoryOperationStore(Clock.systemUTC());
        registry = new SimpleMeterRegistry();
        var eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        feedbackLoop = new FeedbackLoop(store, eventBus, new SwitchboardMetrics(registry), Clock.systemUTC());
    }

    private AtomicOperation classifiedOperation(String request) {
        AtomicOperation op = store.createOperation(request, "alice");
        return store.updateClassification(op.id(), SYSTEM);
    }

    @Nested
    @DisplayName("corrections")
    class CorrectionTests {

        @Test
        @DisplayName("reclassify the operation and keep the system classification on the feedback")
        void reclassifies() {
            AtomicOperation op = classifiedOperation("good morning");
            store.assignAgent(op.id(), "files");

            UserFeedback feedback = feedbackLoop.recordFeedback(op.id(), FeedbackRequest.correction("alice",
                    DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.INTERPRET,
                    "wrong classification"));

            AtomicOperation updated = store.getOperation(op.id());
            assertEquals(OperationStatus.CLASSIFIED, updated.status());
            assertEquals("stream.human.interpret", updated.classification().key());
            assertTrue(updated.classification().confident());
            assertEquals(SYSTEM, feedback.systemClassification());
            assertEquals(List.of(feedback), store.listFeedback(op.id()));
        }

        @Test
        @DisplayName("absent axes keep the system's value")
        void partialCorrection() {
            AtomicOperation op = classifiedOperation("show me the log");

            UserFeedback feedback = feedbackLoop.recordFeedback(op.id(),
                    FeedbackRequest.correction("alice", DestinationType.STREAM, null, null, null));

            assertEquals(DestinationType.STREAM, feedback.correctedDestination());
            assertEquals(ConsumerType.MACHINE, feedback.correctedConsumer());
            assertEquals(ExecutionSemantics.EXECUTE, feedback.correctedSemantics());
        }

        @Test
        @DisplayName("an unclassified operation needs all three axes")
        void unclassifiedNeedsAllAxes() {
            AtomicOperation op = store.createOperation("x", "alice");

            assertThrows(IllegalArgumentException.class, () -> feedbackLoop.recordFeedback(op.id(),
                    FeedbackRequest.correction("alice", DestinationType.STREAM, null, null, null)));
            assertTrue(store.listFeedback(op.id()).isEmpty());

            feedbackLoop.recordFeedback(op.id(), FeedbackRequest.correction("alice",
                    DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.READ, null));
            assertEquals(OperationStatus.CLASSIFIED, store.getOperation(op.id()).status());
            assertNull(store.listFeedback(op.id()).get(0).systemClassification());
        }

        @Test
        @DisplayName("on a settled operation are stored for learning only")
        void terminalOperation() {
            AtomicOperation op = classifiedOperation("rm -rf build");
            store.assignAgent(op.id(), "system");
            store.transition(op.id(), OperationStatus.VERIFYING);
            store.transition(op.id(), OperationStatus.REJECTED);

            feedbackLoop.recordFeedback(op.id(), FeedbackRequest.correction("alice",
                    DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.INTERPRET, null));

            AtomicOperation after = store.getOperation(op.id());
            assertEquals(OperationStatus.REJECTED, after.status());
            assertEquals(SYSTEM, after.classification());
            assertTrue(store.hasCorrections());
        }

        @Test
        @DisplayName("publish classified and feedback events")
        void publishesEvents() {
            AtomicOperation op = classifiedOperation("good morning");

            feedbackLoop.recordFeedback(op.id(), FeedbackRequest.correction("alice",
                    DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.INTERPRET, null));

            assertEquals(List.of("operation.classified", "feedback.recorded"),
                    events.stream().map(SwitchboardEvent::eventType).toList());
            assertEquals("correction", events.get(0).payload().get("source"));
            assertEquals("stream.human.interpret", events.get(1).payload().get("corrected"));
        }
    }

    @Nested
    @DisplayName("confirmations")
    class ConfirmationTests {

        @Test
        @DisplayName("leave the operation unchanged")
        void leaveOperationUnchanged() {
            AtomicOperation op = classifiedOperation("good morning");

            UserFeedback feedback = feedbackLoop.recordFeedback(op.id(), FeedbackRequest.confirmation("bob"));

            assertEquals(FeedbackType.CONFIRMATION, feedback.feedbackType());
            assertNull(feedback.correctedDestination());
            assertEquals(op, store.getOperation(op.id()));
            assertFalse(store.hasCorrections());
            assertEquals(1.0, registry.find("switchboard.feedback.total")
                    .tag("type", "confirmation").counter().count());
        }
    }

    @Test
    @DisplayName("feedback for an unknown operation is refused")
    void unknownOperation() {
        assertThrows(OperationNotFoundException.class,
                () -> feedbackLoop.recordFeedback("missing", FeedbackRequest.confirmation("bob")));
        assertThrows(NullPointerException.class, () -> feedbackLoop.recordFeedback("missing", null));
    }

    @Test
    @DisplayName("concurrent feedback on one operation is all kept")
    void concurrentFeedback() throws Exception {
        AtomicOperation op = classifiedOperation("good morning");
        int writers = 10;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < writers; i++) {
                boolean correct = i % 2 == 0;
                pool.submit(() -> {
                    start.await();
                    return feedbackLoop.recordFeedback(op.id(), correct
                            ? FeedbackRequest.correction("alice", DestinationType.STREAM, ConsumerType.HUMAN,
                                    ExecutionSemantics.INTERPRET, null)
                            : FeedbackRequest.confirmation("bob"));
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(writers, store.listFeedback(op.id()).size());
        assertEquals(OperationStatus.CLASSIFIED, store.getOperation(op.id()).status());
        assertEquals(1, store.findCorrections(10).size());
    }

    @Test
    @DisplayName("concurrent distinct corrections keep the current classification equal to the served one")
    void concurrentDistinctCorrections() throws Exception {
        DestinationType[] destinations = DestinationType.values();
        ExecutionSemantics[] semantics = ExecutionSemantics.values();
        int writers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            for (int round = 0; round < 20; round++) {
                AtomicOperation op = classifiedOperation("request " + round);
                CountDownLatch start = new CountDownLatch(1);
                var tasks = new ArrayList<Future<UserFeedback>>();
                for (int i = 0; i < writers; i++) {
                    FeedbackRequest request = FeedbackRequest.correction("alice",
                            destinations[i % destinations.length],
                            i % 2 == 0 ? ConsumerType.HUMAN : ConsumerType.MACHINE,
                            semantics[i % semantics.length], "writer " + i);
                    tasks.add(pool.submit(() -> {
                        start.await();
                        return feedbackLoop.recordFeedback(op.id(), request);
                    }));
                }
                start.countDown();
                for (var task : tasks) {
                    task.get(10, TimeUnit.SECONDS);
                }

                Classification current = store.getOperation(op.id()).classification();
                var served = store.findCorrections(1).get(0);
                assertEquals("request " + round, served.request());
                assertEquals(served.correctedDestination() + "." + served.correctedConsumer() + "."
                        + served.correctedSemantics(), current.key());
                assertEquals(served.reasoning(), current.reasoning());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
