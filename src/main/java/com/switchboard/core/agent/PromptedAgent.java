package com.switchboard.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.llm.InferenceOptions;
import com.switchboard.core.llm.InferenceService;
import com.switchboard.core.llm.JsonRepair;
import com.switchboard.core.model.ActionKind;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.ProposedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Agent that asks the inference service for a single proposed action.
 */
public class PromptedAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(PromptedAgent.class);

    private static final String FORMAT = """

            Propose exactly one action as JSON:
            {"kind": "RESPONSE|COMMAND|FILE_WRITE|FILE_DELETE",
             "command": "shell command for COMMAND, else null",
             "targetPath": "file path for FILE_WRITE or FILE_DELETE, else null",
             "content": "response text or file content",
             "irreversible": false}
            """;

    private final String id;
    private final String instruction;
    private final InferenceService inferenceService;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PromptedAgent(String id, String instruction, InferenceService inferenceService, Duration timeout) {
        this.id = id;
        this.instruction = instruction;
        this.inferenceService = inferenceService;
        this.timeout = timeout;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ProposedAction propose(AtomicOperation operation) {
        String systemPrompt = "You are the '" + id + "' agent. " + instruction + FORMAT;
        String userPrompt = "Request: " + operation.userRequest()
                + (operation.classification() != null
                    ? "\nClassification: " + operation.classification().key()
                    : "");
        String raw = inferenceService.complete(systemPrompt, userPrompt, InferenceOptions.json(timeout));
        ProposedAction action = parse(raw);
        log.debug("Agent {} proposed {}", id, action.kind());
        return action;
    }

    ProposedAction parse(String raw) {
        try {
            return toAction(objectMapper.readTree(raw));
        } catch (JsonProcessingException | IllegalArgumentException first) {
            try {
                return toAction(JsonRepair.readTree(raw));
            } catch (JsonProcessingException | IllegalArgumentException second) {
                throw new AgentActionException(id, "Agent '" + id + "' returned an unusable action: "
                        + second.getMessage(), second);
            }
        }
    }

    private static ProposedAction toAction(JsonNode node) {
        if (node == null || !node.isObject() || !node.hasNonNull("kind")) {
            throw new IllegalArgumentException("expected a JSON object with a kind");
        }
        ActionKind kind = ActionKind.valueOf(node.get("kind").asText().trim().toUpperCase(Locale.ROOT));
        return new ProposedAction(kind,
                text(node, "command"),
                text(node, "targetPath"),
                text(node, "content"),
                kind == ActionKind.FILE_DELETE || node.path("irreversible").asBoolean(false));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
