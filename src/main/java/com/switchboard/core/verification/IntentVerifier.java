package com.switchboard.core.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.llm.InferenceFailureException;
import com.switchboard.core.llm.InferenceOptions;
import com.switchboard.core.llm.InferenceService;
import com.switchboard.core.llm.InferenceTimeoutException;
import com.switchboard.core.llm.JsonRepair;
import com.switchboard.core.llm.LlmProperties;
import com.switchboard.core.model.IntentJudgment;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationLayer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Asks the model whether the action does what the user asked for.
 * <p>
 * Only a clear ALIGNED passes. When the model cannot be reached or its answer
 * cannot be read, a {@link VerifierInfrastructureException} is raised so the
 * pipeline records the stage as skipped instead of failed.
 */
@Component
public class IntentVerifier implements Verifier {

    private static final String SYSTEM_PROMPT = """
            You check whether a proposed action fulfils a user's request.
            Answer with JSON only: {"judgment": "ALIGNED|MISALIGNED|UNCERTAIN", "rationale": "..."}
            Use ALIGNED only if the action does what was asked and nothing more.
            """;

    private final InferenceService inferenceService;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public IntentVerifier(InferenceService inferenceService, VerificationProperties properties,
                          LlmProperties llmProperties) {
        this.inferenceService = inferenceService;
        Duration configured = properties.getIntent().getTimeout();
        this.timeout = configured != null ? configured : llmProperties.getTimeout();
    }

    @Override
    public VerificationLayer layer() {
        return VerificationLayer.INTENT;
    }

    @Override
    public StageResult verify(VerificationContext context) {
        if (context.action() == null || context.action().kind() == null) {
            return StageResult.fail(layer(), "no action to judge");
        }
        String raw;
        try {
            raw = inferenceService.complete(SYSTEM_PROMPT, userPrompt(context), InferenceOptions.json(timeout));
        } catch (InferenceTimeoutException | InferenceFailureException e) {
            throw new VerifierInfrastructureException(layer(), e.getMessage(), e);
        }
        JsonNode answer = parse(raw);
        IntentJudgment judgment;
        try {
            judgment = IntentJudgment.valueOf(answer.path("judgment").asText("").trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new VerifierInfrastructureException(layer(), "unreadable intent judgment", e);
        }
        String rationale = answer.path("rationale").asText("");
        return switch (judgment) {
            case ALIGNED -> StageResult.pass(layer(), rationale.isBlank() ? "aligned" : rationale);
            case MISALIGNED -> StageResult.fail(layer(), "misaligned: " + rationale);
            case UNCERTAIN -> StageResult.fail(layer(), "uncertain: " + rationale);
        };
    }

    private JsonNode parse(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException | IllegalArgumentException first) {
            try {
                return JsonRepair.readTree(raw);
            } catch (JsonProcessingException | IllegalArgumentException second) {
                throw new VerifierInfrastructureException(layer(), "unparseable intent answer", second);
            }
        }
    }

    private static String userPrompt(VerificationContext context) {
        ProposedAction action = context.action();
        var prompt = new StringBuilder()
                .append("Request: ").append(context.operation().userRequest()).append('\n');
        if (context.classification() != null) {
            prompt.append("Classification: ").append(context.classification().key()).append('\n');
        }
        prompt.append("Action: ").append(action.kind()).append('\n');
        if (action.command() != null) {
            prompt.append("Command: ").append(action.command()).append('\n');
        }
        if (action.targetPath() != null) {
            prompt.append("Target: ").append(action.targetPath()).append('\n');
        }
        if (action.content() != null) {
            prompt.append("Content:\n").append(action.content()).append('\n');
        }
        return prompt.toString();
    }
}
