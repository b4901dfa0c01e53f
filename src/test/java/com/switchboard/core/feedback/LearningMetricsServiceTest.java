package com.switchboard.core.feedback;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.FeedbackType;
import com.switchboard.core.model.LearningMetrics;
import com.switchboard.core.model.TrainingPair;
import com.switchboard.core.store.InMemoryOperationStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LearningMetricsServiceTest {

    private InMemoryOperationStore store;
    private FeedbackLoop feedbackLoop;
    private LearningMetricsService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryOperationStore(Clock.systemUTC());
        feedbackLoop = new FeedbackLoop(store, new EventBus(),
                new SwitchboardMetrics(new SimpleMeterRegistry()), Clock.systemUTC());
        service = new LearningMetricsService(store);
    }

    private String classified(String request, String userId) {
        AtomicOperation op = store.createOperation(request, userId);
        store.updateClassification(op.id(), Classification.of(DestinationType.FILE, ConsumerType.MACHINE,
                ExecutionSemantics.EXECUTE, true));
        return op.id();
    }

    @Test
    @DisplayName("no feedback yields zero rates")
    void empty() {
        classified("a", "alice");

        LearningMetrics metrics = service.compute(null);

        assertEquals(1, metrics.operations());
        assertEquals(0, metrics.corrections());
        assertEquals(0.0, metrics.classificationAccuracy());
        assertEquals(0.0, metrics.correctionRate());
        assertTrue(metrics.correctedDestinations().isEmpty());
    }

    @Test
    @DisplayName("accuracy counts confirmations and the rate counts corrected operations")
    void rates() {
        String a = classified("a", "alice");
        String b = classified("b", "alice");
        classified("c", "alice");
        classified("d", "alice");
        feedbackLoop.recordFeedback(a, FeedbackRequest.confirmation("alice"));
        feedbackLoop.recordFeedback(b, FeedbackRequest.correction("alice",
                DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.INTERPRET, null));
        feedbackLoop.recordFeedback(b, FeedbackRequest.correction("alice",
                DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.READ, null));

        LearningMetrics metrics = service.compute(null);

        assertEquals(4, metrics.operations());
        assertEquals(2, metrics.corrections());
        assertEquals(1, metrics.confirmations());
        assertEquals(1.0 / 3, metrics.classificationAccuracy(), 1e-9);
        assertEquals(0.25, metrics.correctionRate(), 1e-9);
        assertEquals(Map.of("stream", 2L), metrics.correctedDestinations());
        assertEquals(Map.of("interpret", 1L, "read", 1L), metrics.correctedSemantics());
    }

    @Test
    @DisplayName("a user filter restricts feedback and operations")
    void perUser() {
        String a = classified("a", "alice");
        String b = classified("b", "bob");
        feedbackLoop.recordFeedback(a, FeedbackRequest.confirmation("alice"));
        feedbackLoop.recordFeedback(b, FeedbackRequest.correction("bob",
                DestinationType.PROCESS, null, null, null));

        LearningMetrics alice = service.compute("alice");
        LearningMetrics bob = service.compute("bob");

        assertEquals("alice", alice.userId());
        assertEquals(1, alice.operations());
        assertEquals(1.0, alice.classificationAccuracy());
        assertEquals(1.0, bob.correctionRate());
        assertEquals(Map.of("process", 1L), bob.correctedDestinations());
    }

    @Nested
    @DisplayName("trainingPairs")
    class TrainingPairTests {

        @Test
        @DisplayName("a correction pairs the system label with the corrected one")
        void correctionPair() {
            String id = classified("save my notes", "alice");
            feedbackLoop.recordFeedback(id, FeedbackRequest.correction("alice",
                    DestinationType.FILE, ConsumerType.HUMAN, null, "notes are for me"));

            TrainingPair pair = service.trainingPairs(null, 10).get(0);

            assertEquals("save my notes", pair.request());
            assertEquals("file.machine.execute", pair.systemLabel().key());
            assertEquals("file.human.execute", pair.trueLabel().key());
            assertEquals(FeedbackType.CORRECTION, pair.source());
            assertEquals(TrainingPair.CORRECTION_CONFIDENCE, pair.feedbackConfidence());
            assertTrue(pair.disagrees());
        }

        @Test
        @DisplayName("a confirmation labels the request with the system classification")
        void confirmationPair() {
            String id = classified("run the tests", "alice");
            feedbackLoop.recordFeedback(id, FeedbackRequest.confirmation("alice"));

            TrainingPair pair = service.trainingPairs("alice", 10).get(0);

            assertEquals(pair.systemLabel().key(), pair.trueLabel().key());
            assertEquals(TrainingPair.CONFIRMATION_CONFIDENCE, pair.feedbackConfidence());
            assertFalse(pair.disagrees());
        }

        @Test
        @DisplayName("newest first, one pair per operation, filtered by user and limited")
        void orderingAndFilters() {
            String a = classified("a", "alice");
            String b = classified("b", "bob");
            String c = classified("c", "alice");
            feedbackLoop.recordFeedback(a, FeedbackRequest.correction("alice",
                    DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.INTERPRET, null));
            feedbackLoop.recordFeedback(b, FeedbackRequest.confirmation("bob"));
            feedbackLoop.recordFeedback(c, FeedbackRequest.confirmation("alice"));
            feedbackLoop.recordFeedback(a, FeedbackRequest.correction("alice",
                    DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.READ, null));

            List<TrainingPair> all = service.trainingPairs(null, 10);
            assertEquals(List.of(a, c, b), all.stream().map(TrainingPair::operationId).toList());
            assertEquals("stream.human.read", all.get(0).trueLabel().key());

            assertEquals(List.of(a, c), service.trainingPairs("alice", 10).stream()
                    .map(TrainingPair::operationId).toList());
            assertEquals(1, service.trainingPairs(null, 1).size());
        }

        @Test
        @DisplayName("a non-positive limit is refused")
        void badLimit() {
            assertThrows(IllegalArgumentException.class, () -> service.trainingPairs(null, 0));
        }
    }
}
