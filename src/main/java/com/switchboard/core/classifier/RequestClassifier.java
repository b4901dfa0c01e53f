package com.switchboard.core.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.context.ClassificationContext;
import com.switchboard.core.error.SwitchboardException;
import com.switchboard.core.llm.InferenceOptions;
import com.switchboard.core.llm.InferenceService;
import com.switchboard.core.llm.JsonRepair;
import com.switchboard.core.llm.LlmProperties;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ClassificationResult;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.CorrectionExemplar;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.ratelimit.RateLimiter;
import com.switchboard.core.store.OperationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Classifies a free-form request along the destination, consumer and semantics axes.
 * <p>
 * Past corrections from {@link ClassificationContext} are placed in the system
 * prompt as few-shot exemplars. The model answer is parsed strictly, then once
 * more after {@link JsonRepair}; if that also fails the call fails with
 * {@link ClassificationParseException}. No default classification is ever
 * substituted.
 */
@Service
public class RequestClassifier {

    private static final Logger log = LoggerFactory.getLogger(RequestClassifier.class);

    static final String RATE_LIMIT_ACTION = "classify";

    private static final String TAXONOMY_PROMPT = """
            You classify requests sent to a local assistant along three independent axes.

            destination - where the output goes:
              "stream"  : shown once in the conversation
              "file"    : written to or removed from the filesystem
              "process" : starts, stops or runs a program
            consumer - who consumes the output:
              "human"   : a person reads it
              "machine" : another program parses it
            semantics - what the operation does:
              "read"      : retrieves existing information without changing anything
              "interpret" : explains, summarises or converses
              "execute"   : performs an action with side effects

            Set "confident" to false whenever the request is ambiguous.

            Respond with JSON only:
            {"destination": "...", "consumer": "...", "semantics": "...", "confident": true, "reasoning": "..."}
            """;

    private final InferenceService inferenceService;
    private final ClassificationContext context;
    private final RateLimiter rateLimiter;
    private final OperationStore store;
    private final ClassifierProperties properties;
    private final LlmProperties llmProperties;
    private final SwitchboardMetrics metrics;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RequestClassifier(InferenceService inferenceService,
                             ClassificationContext context,
                             RateLimiter rateLimiter,
                             OperationStore store,
                             ClassifierProperties properties,
                             LlmProperties llmProperties,
                             SwitchboardMetrics metrics) {
        this.inferenceService = inferenceService;
        this.context = context;
        this.rateLimiter = rateLimiter;
        this.store = store;
        this.properties = properties;
        this.llmProperties = llmProperties;
        this.metrics = metrics;
    }

    public ClassificationResult classify(String request, String userId) {
        return classify(request, userId, context.defaultLimit(), null);
    }

    public ClassificationResult classify(String request, String userId, int exemplarLimit) {
        return classify(request, userId, exemplarLimit, null);
    }

    /**
     * @param userId      the caller; null or blank is anonymous and reaches the rate limiter as null
     * @param operationId when non-null the result is written to the classification log
     * @throws com.switchboard.core.ratelimit.RateLimitExceededException before any inference call
     * @throws ClassificationParseException when the answer is not a valid classification
     */
    public ClassificationResult classify(String request, String userId, int exemplarLimit, String operationId) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("request must not be blank");
        }
        rateLimiter.acquire(userId == null || userId.isBlank() ? null : userId, RATE_LIMIT_ACTION);

        List<CorrectionExemplar> exemplars = context.getCorrections(exemplarLimit);
        String systemPrompt = buildSystemPrompt(exemplars);
        log.debug("Classifying request with {} exemplar(s)", exemplars.size());

        ClassificationResult result;
        try {
            String raw = inferenceService.complete(systemPrompt, request,
                    new InferenceOptions(timeout(), true, properties.getTemperature()));
            Classification classification = parse(raw);
            result = new ClassificationResult(classification, classification.reasoning(), inferenceService.modelName());
        } catch (SwitchboardException e) {
            metrics.recordClassification(e.kind().name());
            throw e;
        }

        metrics.recordClassification(result.confident() ? "confident" : "unconfident");
        log.info("Classified as {} (confident={})", result.classification().key(), result.confident());
        if (operationId != null) {
            store.logClassification(operationId, result);
        }
        return result;
    }

    String buildSystemPrompt(List<CorrectionExemplar> exemplars) {
        if (exemplars.isEmpty()) {
            return TAXONOMY_PROMPT;
        }
        var prompt = new StringBuilder(TAXONOMY_PROMPT);
        prompt.append("\nPAST CORRECTIONS (learn from these mistakes):\n");
        for (CorrectionExemplar exemplar : exemplars) {
            prompt.append("- \"").append(exemplar.request()).append("\" ");
            if (exemplar.systemDestination() != null) {
                prompt.append("was misclassified as ")
                        .append(exemplar.systemDestination()).append('/')
                        .append(exemplar.systemConsumer()).append('/')
                        .append(exemplar.systemSemantics());
            } else {
                prompt.append("was not classified");
            }
            prompt.append("; it should be ")
                    .append(exemplar.correctedDestination()).append('/')
                    .append(exemplar.correctedConsumer()).append('/')
                    .append(exemplar.correctedSemantics());
            if (exemplar.reasoning() != null && !exemplar.reasoning().isBlank()) {
                prompt.append(" (").append(exemplar.reasoning().trim()).append(')');
            }
            prompt.append('\n');
        }
        return prompt.toString();
    }

    Classification parse(String raw) {
        try {
            return toClassification(objectMapper.readTree(raw));
        } catch (JsonProcessingException | IllegalArgumentException first) {
            log.debug("Strict parse failed ({}), attempting repair", first.getMessage());
            try {
                return toClassification(JsonRepair.readTree(raw));
            } catch (JsonProcessingException | IllegalArgumentException second) {
                log.warn("Classification output could not be parsed after repair: {}", second.getMessage());
                throw new ClassificationParseException(
                        "Model output is not a valid classification: " + second.getMessage(), raw, second);
            }
        }
    }

    private Classification toClassification(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }
        DestinationType destination = DestinationType.fromValue(requiredText(node, "destination"));
        ConsumerType consumer = ConsumerType.fromValue(requiredText(node, "consumer"));
        ExecutionSemantics semantics = ExecutionSemantics.fromValue(requiredText(node, "semantics"));
        JsonNode reasoning = node.get("reasoning");
        return new Classification(destination, consumer, semantics, confident(node),
                reasoning != null && reasoning.isTextual() ? reasoning.asText() : null);
    }

    private boolean confident(JsonNode node) {
        JsonNode flag = node.get("confident");
        if (flag != null && flag.isBoolean()) {
            return flag.booleanValue();
        }
        if (flag != null && flag.isTextual()) {
            return Boolean.parseBoolean(flag.asText().trim().toLowerCase(Locale.ROOT));
        }
        JsonNode score = flag != null && flag.isNumber() ? flag : node.get("confidence");
        if (score != null && score.isNumber()) {
            return score.doubleValue() >= properties.getConfidenceThreshold();
        }
        return false;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value.asText();
    }

    private Duration timeout() {
        return properties.getTimeout() != null ? properties.getTimeout() : llmProperties.getTimeout();
    }
}
