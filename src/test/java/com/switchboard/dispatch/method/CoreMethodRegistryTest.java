package com.switchboard.dispatch.method;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.feedback.FeedbackRequest;
import com.switchboard.core.feedback.LearningMetricsService;
import com.switchboard.core.model.*;
import com.switchboard.core.store.InMemoryOperationStore;
import com.switchboard.core.store.OperationNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CoreMethodRegistryTest {

    private static final Classification CHAT = new Classification(DestinationType.STREAM, ConsumerType.HUMAN,
            ExecutionSemantics.INTERPRET, true, null);

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private OperationEngine engine;
    private InMemoryOperationStore store;
    private CoreMethodRegistry registry;

    @BeforeEach
    void setUp() {
        engine = mock(OperationEngine.class);
        store = new InMemoryOperationStore(Clock.systemUTC());
        registry = new CoreMethodRegistry(engine, store, objectMapper);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    @DisplayName("exposes every core method, with store access only where needed")
    void methodTable() {
        assertEquals(Set.of("classify", "route", "verification/run", "feedback/record", "feedback/metrics",
                        "feedback/training-pairs", "corrections/list", "operations/process", "operations/resume",
                        "operations/resolve", "operations/get", "operations/list", "operations/feedback"),
                registry.methodNames());
        assertTrue(registry.spec("verification/run").requiresStore());
        assertTrue(registry.spec("operations/get").requiresStore());
        assertFalse(registry.spec("classify").requiresStore());
        assertFalse(registry.spec("operations/process").requiresStore());
    }

    @Test
    @DisplayName("an unknown method is reported with its name")
    void unknownMethod() {
        var ex = assertThrows(UnknownMethodException.class, () -> registry.dispatch("nope", null));
        assertEquals("nope", ex.method());
        assertEquals(ErrorKind.UNKNOWN_METHOD, ex.kind());
        assertThrows(UnknownMethodException.class, () -> registry.spec("nope"));
    }

    @Test
    @DisplayName("method specs hold exactly one handler")
    void specHoldsOneHandler() {
        assertThrows(IllegalArgumentException.class, () -> new MethodSpec(null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new MethodSpec((s, p) -> p, p -> p));
    }

    @Nested
    @DisplayName("classification and routing")
    class ClassifyTests {

        @Test
        @DisplayName("classify returns the result as JSON with wire values")
        void classify() throws Exception {
            when(engine.classify("good morning", "alice"))
                    .thenReturn(new ClassificationResult(CHAT, "a greeting", "gpt-test"));

            JsonNode result = registry.dispatch("classify", json("{\"request\":\"good morning\",\"userId\":\"alice\"}"));

            assertEquals("stream", result.at("/classification/destination").asText());
            assertEquals("interpret", result.at("/classification/semantics").asText());
            assertEquals("gpt-test", result.get("model").asText());
        }

        @Test
        @DisplayName("classify without a request is refused")
        void classifyMissingRequest() {
            assertThrows(IllegalArgumentException.class, () -> registry.dispatch("classify", null));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("route accepts a nested or bare classification")
        void route() throws Exception {
            when(engine.route(CHAT)).thenReturn(new AgentRoute("assistant", false, "table:stream.human.interpret", CHAT));
            String classification = "{\"destination\":\"stream\",\"consumer\":\"human\","
                    + "\"semantics\":\"interpret\",\"confident\":true}";

            JsonNode nested = registry.dispatch("route", json("{\"classification\":" + classification + "}"));
            JsonNode bare = registry.dispatch("route", json(classification));

            assertEquals("assistant", nested.get("agentId").asText());
            assertEquals(nested, bare);
        }

        @Test
        @DisplayName("route with an unknown axis value is refused")
        void routeBadAxis() {
            assertThrows(IllegalArgumentException.class, () -> registry.dispatch("route",
                    json("{\"destination\":\"printer\",\"consumer\":\"human\",\"semantics\":\"read\"}")));
        }
    }

    @Nested
    @DisplayName("feedback")
    class FeedbackTests {

        @Test
        @DisplayName("feedback/record converts the request")
        void record() throws Exception {
            when(engine.recordFeedback(eq("op-1"), any(FeedbackRequest.class))).thenReturn(new UserFeedback(
                    "fb-1", "op-1", "alice", FeedbackType.CORRECTION, null, DestinationType.STREAM,
                    ConsumerType.HUMAN, ExecutionSemantics.INTERPRET, null, Instant.now()));

            JsonNode result = registry.dispatch("feedback/record", json("{\"operationId\":\"op-1\",\"feedback\":"
                    + "{\"userId\":\"alice\",\"feedbackType\":\"correction\",\"correctedDestination\":\"stream\"}}"));

            ArgumentCaptor<FeedbackRequest> captor = ArgumentCaptor.forClass(FeedbackRequest.class);
            verify(engine).recordFeedback(eq("op-1"), captor.capture());
            assertEquals(FeedbackType.CORRECTION, captor.getValue().feedbackType());
            assertEquals(DestinationType.STREAM, captor.getValue().correctedDestination());
            assertNull(captor.getValue().correctedConsumer());
            assertEquals("fb-1", result.get("id").asText());
        }

        @Test
        @DisplayName("feedback/training-pairs filters by user and defaults the limit")
        void trainingPairs() throws Exception {
            Classification system = Classification.of(DestinationType.FILE, ConsumerType.MACHINE,
                    ExecutionSemantics.EXECUTE, true);
            when(engine.trainingPairs("alice", 5)).thenReturn(List.of(new TrainingPair("op-1", "good morning",
                    system, CHAT, FeedbackType.CORRECTION, TrainingPair.CORRECTION_CONFIDENCE, Instant.now())));
            when(engine.trainingPairs(null, LearningMetricsService.DEFAULT_TRAINING_PAIR_LIMIT)).thenReturn(List.of());

            JsonNode result = registry.dispatch("feedback/training-pairs", json("{\"userId\":\"alice\",\"limit\":5}"));
            registry.dispatch("feedback/training-pairs", null);

            assertEquals("good morning", result.get(0).get("request").asText());
            assertEquals("file", result.get(0).get("systemLabel").get("destination").asText());
            assertEquals("stream", result.get(0).get("trueLabel").get("destination").asText());
            assertEquals("correction", result.get(0).get("source").asText());
            verify(engine).trainingPairs(null, LearningMetricsService.DEFAULT_TRAINING_PAIR_LIMIT);
        }

        @Test
        @DisplayName("corrections/list uses the default limit unless one is given")
        void corrections() throws Exception {
            when(engine.getCorrections()).thenReturn(List.of());
            when(engine.getCorrections(3)).thenReturn(List.of());

            assertTrue(registry.dispatch("corrections/list", null).isArray());
            registry.dispatch("corrections/list", json("{\"limit\":3}"));

            verify(engine).getCorrections();
            verify(engine).getCorrections(3);
        }
    }

    @Nested
    @DisplayName("operations")
    class OperationTests {

        @Test
        @DisplayName("operations/process parses the mode case-insensitively")
        void process() throws Exception {
            registry.dispatch("operations/process", json("{\"request\":\"hi\",\"mode\":\"lenient\"}"));

            verify(engine).process("hi", null, VerificationMode.LENIENT);
        }

        @Test
        @DisplayName("operations/resume passes the id and an optional mode")
        void resume() throws Exception {
            registry.dispatch("operations/resume", json("{\"operationId\":\"op-1\",\"mode\":\"STRICT\"}"));
            registry.dispatch("operations/resume", json("{\"operationId\":\"op-2\"}"));

            verify(engine).resume("op-1", VerificationMode.STRICT);
            verify(engine).resume("op-2", null);
            assertThrows(IllegalArgumentException.class, () -> registry.dispatch("operations/resume", json("{}")));
        }

        @Test
        @DisplayName("operations/resolve needs a boolean decision")
        void resolve() throws Exception {
            assertThrows(IllegalArgumentException.class,
                    () -> registry.dispatch("operations/resolve", json("{\"operationId\":\"op-1\",\"approve\":\"yes\"}")));

            registry.dispatch("operations/resolve", json("{\"operationId\":\"op-1\",\"approve\":false}"));
            verify(engine).resolveEscalation("op-1", false);
        }

        @Test
        @DisplayName("operations/get and operations/list read the store")
        void storeReads() throws Exception {
            AtomicOperation first = store.createOperation("first", "alice");
            store.createOperation("second", "alice");

            JsonNode loaded = registry.dispatch("operations/get", json("{\"operationId\":\"" + first.id() + "\"}"));
            JsonNode listed = registry.dispatch("operations/list", json("{\"limit\":1}"));

            assertEquals("first", loaded.get("userRequest").asText());
            assertEquals("CREATED", loaded.get("status").asText());
            assertEquals(1, listed.size());
            assertEquals("second", listed.get(0).get("userRequest").asText());
            assertThrows(OperationNotFoundException.class,
                    () -> registry.dispatch("operations/get", json("{\"operationId\":\"missing\"}")));
        }

        @Test
        @DisplayName("verification/run loads the operation from the store")
        void verificationRun() throws Exception {
            AtomicOperation op = store.createOperation("good morning", "alice");
            when(engine.runVerification(eq(op), any(ProposedAction.class), any())).thenReturn(new PipelineResult(
                    List.of(StageResult.pass(VerificationLayer.SYNTAX, "ok")), Verdict.APPROVED,
                    VerificationMode.STRICT, null, false));

            JsonNode result = registry.dispatch("verification/run", json("{\"operationId\":\"" + op.id() + "\","
                    + "\"action\":{\"kind\":\"RESPONSE\",\"content\":\"hi\"}}"));

            assertEquals("APPROVED", result.get("verdict").asText());
            ArgumentCaptor<ProposedAction> captor = ArgumentCaptor.forClass(ProposedAction.class);
            verify(engine).runVerification(eq(op), captor.capture(), eq(null));
            assertEquals(ActionKind.RESPONSE, captor.getValue().kind());
        }
    }
}
