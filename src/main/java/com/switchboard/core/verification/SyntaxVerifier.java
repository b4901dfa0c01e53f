package com.switchboard.core.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationLayer;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Structural checks on the proposed action, per action kind.
 */
@Component
public class SyntaxVerifier implements Verifier {

    private final VerificationProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SyntaxVerifier(VerificationProperties properties) {
        this.properties = properties;
    }

    @Override
    public VerificationLayer layer() {
        return VerificationLayer.SYNTAX;
    }

    @Override
    public StageResult verify(VerificationContext context) {
        ProposedAction action = context.action();
        if (action == null || action.kind() == null) {
            return StageResult.fail(layer(), "no action proposed");
        }
        String problem = switch (action.kind()) {
            case RESPONSE -> isBlank(action.content()) ? "response text is empty" : null;
            case COMMAND -> checkCommand(action.command());
            case FILE_WRITE -> checkWrite(action);
            case FILE_DELETE -> isBlank(action.targetPath()) ? "delete has no target path" : null;
        };
        if (problem != null) {
            return StageResult.fail(layer(), problem);
        }
        return StageResult.pass(layer(), "well-formed " + action.kind().name().toLowerCase(Locale.ROOT));
    }

    private String checkCommand(String command) {
        if (isBlank(command)) {
            return "command is empty";
        }
        int max = properties.getSyntax().getMaxCommandLength();
        if (command.length() > max) {
            return "command exceeds " + max + " characters";
        }
        return balanced(command) ? null : "unbalanced quotes or brackets";
    }

    private String checkWrite(ProposedAction action) {
        if (isBlank(action.targetPath())) {
            return "write has no target path";
        }
        if (action.content() == null) {
            return "write has no content";
        }
        if (action.targetPath().toLowerCase(Locale.ROOT).endsWith(".json")) {
            try {
                objectMapper.readTree(action.content());
            } catch (JsonProcessingException e) {
                return "content of " + action.targetPath() + " is not valid JSON";
            }
        }
        return null;
    }

    /**
     * Quotes must close, and brackets outside quotes must nest. A backslash
     * escapes the next character outside single quotes, as in a POSIX shell.
     */
    static boolean balanced(String command) {
        Deque<Character> open = new ArrayDeque<>();
        char quote = 0;
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                }
                continue;
            }
            if (c == '\\') {
                i++;
                continue;
            }
            if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '\'', '"' -> quote = c;
                case '(', '[', '{' -> open.push(c);
                case ')' -> { if (open.isEmpty() || open.pop() != '(') return false; }
                case ']' -> { if (open.isEmpty() || open.pop() != '[') return false; }
                case '}' -> { if (open.isEmpty() || open.pop() != '{') return false; }
                default -> { }
            }
        }
        return quote == 0 && open.isEmpty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
