package com.switchboard.dispatch.method;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.feedback.FeedbackRequest;
import com.switchboard.core.feedback.LearningMetricsService;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.VerificationMode;
import com.switchboard.core.store.OperationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Name-to-handler table for callers that speak JSON rather than Java.
 * <p>
 * The table is built once in the constructor and never changes. Params and
 * results are Jackson trees; a missing or malformed param raises
 * {@link IllegalArgumentException}.
 */
@Component
public class CoreMethodRegistry {

    private static final Logger log = LoggerFactory.getLogger(CoreMethodRegistry.class);

    static final int DEFAULT_HISTORY_LIMIT = 20;

    private final OperationEngine engine;
    private final OperationStore store;
    private final ObjectMapper objectMapper;
    private final Map<String, MethodSpec> methods;

    public CoreMethodRegistry(OperationEngine engine, OperationStore store, ObjectMapper objectMapper) {
        this.engine = engine;
        this.store = store;
        this.objectMapper = objectMapper;

        var table = new LinkedHashMap<String, MethodSpec>();
        table.put("classify", MethodSpec.plain(params -> toTree(
                engine.classify(requiredText(params, "request"), optionalText(params, "userId")))));
        table.put("route", MethodSpec.plain(params -> toTree(
                engine.route(read(params.has("classification") ? params.get("classification") : params,
                        Classification.class, "classification")))));
        table.put("verification/run", MethodSpec.withStore(this::runVerification));
        table.put("feedback/record", MethodSpec.plain(params -> toTree(
                engine.recordFeedback(requiredText(params, "operationId"),
                        read(params.get("feedback"), FeedbackRequest.class, "feedback")))));
        table.put("feedback/metrics", MethodSpec.plain(params -> toTree(
                engine.learningMetrics(optionalText(params, "userId")))));
        table.put("feedback/training-pairs", MethodSpec.plain(params -> toTree(
                engine.trainingPairs(optionalText(params, "userId"),
                        params.hasNonNull("limit") ? params.get("limit").asInt()
                                : LearningMetricsService.DEFAULT_TRAINING_PAIR_LIMIT))));
        table.put("corrections/list", MethodSpec.plain(params -> toTree(
                params.hasNonNull("limit")
                        ? engine.getCorrections(params.get("limit").asInt())
                        : engine.getCorrections())));
        table.put("operations/process", MethodSpec.plain(params -> toTree(
                engine.process(requiredText(params, "request"), optionalText(params, "userId"),
                        mode(optionalText(params, "mode"))))));
        table.put("operations/resume", MethodSpec.plain(params -> toTree(
                engine.resume(requiredText(params, "operationId"), mode(optionalText(params, "mode"))))));
        table.put("operations/resolve", MethodSpec.plain(params -> toTree(
                engine.resolveEscalation(requiredText(params, "operationId"),
                        requiredBoolean(params, "approve")))));
        table.put("operations/get", MethodSpec.withStore((s, params) -> toTree(
                s.getOperation(requiredText(params, "operationId")))));
        table.put("operations/list", MethodSpec.withStore((s, params) -> toTree(
                s.listOperations(params.hasNonNull("limit") ? params.get("limit").asInt() : DEFAULT_HISTORY_LIMIT))));
        table.put("operations/feedback", MethodSpec.withStore((s, params) -> toTree(
                s.listFeedback(requiredText(params, "operationId")))));
        this.methods = Map.copyOf(table);
        log.debug("Registered {} methods", methods.size());
    }

    /**
     * Invokes a method by name.
     *
     * @throws UnknownMethodException when no method has that name
     */
    public JsonNode dispatch(String method, JsonNode params) {
        MethodSpec spec = methods.get(method);
        if (spec == null) {
            throw new UnknownMethodException(method);
        }
        JsonNode safeParams = params != null ? params : objectMapper.createObjectNode();
        log.debug("Dispatching {} (store: {})", method, spec.requiresStore());
        return spec.invoke(store, safeParams);
    }

    public Set<String> methodNames() {
        return methods.keySet();
    }

    public MethodSpec spec(String method) {
        MethodSpec spec = methods.get(method);
        if (spec == null) {
            throw new UnknownMethodException(method);
        }
        return spec;
    }

    private JsonNode runVerification(OperationStore s, JsonNode params) {
        AtomicOperation operation = s.getOperation(requiredText(params, "operationId"));
        ProposedAction action = read(params.get("action"), ProposedAction.class, "action");
        return toTree(engine.runVerification(operation, action, mode(optionalText(params, "mode"))));
    }

    private JsonNode toTree(Object value) {
        return value == null ? NullNode.getInstance() : objectMapper.valueToTree(value);
    }

    private <T> T read(JsonNode node, Class<T> type, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("Missing param: " + field);
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid param " + field + ": " + e.getOriginalMessage(), e);
        }
    }

    static String requiredText(JsonNode params, String field) {
        String value = optionalText(params, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing param: " + field);
        }
        return value;
    }

    static String optionalText(JsonNode params, String field) {
        JsonNode node = params.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    static boolean requiredBoolean(JsonNode params, String field) {
        JsonNode node = params.get(field);
        if (node == null || !node.isBoolean()) {
            throw new IllegalArgumentException("Missing boolean param: " + field);
        }
        return node.booleanValue();
    }

    static VerificationMode mode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return VerificationMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
