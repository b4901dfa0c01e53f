package com.switchboard.core.verification;

import com.switchboard.core.model.ActionKind;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Refuses destructive commands, writes to protected locations, path traversal
 * and irreversible actions. A failure here ends the run and is never escalated.
 * <p>
 * Protected roots starting with {@code ~/} match below any home directory:
 * {@code ~}, {@code $HOME}, {@code /root}, {@code /home/<user>} and the
 * running user's {@code user.home}.
 */
@Component
public class SafetyVerifier implements Verifier {

    private static final Logger log = LoggerFactory.getLogger(SafetyVerifier.class);

    /** Programs whose path arguments are written, moved or removed. */
    static final Set<String> WRITING_PROGRAMS = Set.of(
            "rm", "rmdir", "unlink", "shred", "mv", "cp", "ln", "install", "touch", "mkdir",
            "truncate", "tee", "chmod", "chown", "chgrp", "sed", "dd");

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("&&|\\|\\||[;|&\\n]");
    private static final Pattern REDIRECT = Pattern.compile("\\d?>>?\\s*(\\S+)");

    private final List<Pattern> blockedPatterns;
    private final List<Pattern> protectedRoots;
    private final boolean allowIrreversible;

    @Autowired
    public SafetyVerifier(VerificationProperties properties) {
        this(properties, System.getProperty("user.home"));
    }

    SafetyVerifier(VerificationProperties properties, String userHome) {
        VerificationProperties.Safety safety = properties.getSafety();
        this.blockedPatterns = safety.getBlockedPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.protectedRoots = safety.getProtectedPaths().stream()
                .map(path -> rootPattern(trimTrailingSlash(path), userHome))
                .toList();
        this.allowIrreversible = safety.isAllowIrreversible();
    }

    @Override
    public VerificationLayer layer() {
        return VerificationLayer.SAFETY;
    }

    @Override
    public boolean fatal() {
        return true;
    }

    @Override
    public StageResult verify(VerificationContext context) {
        ProposedAction action = context.action();
        if (action == null) {
            return StageResult.fail(layer(), "no action to check");
        }
        if (action.kind() == ActionKind.COMMAND && action.command() != null) {
            for (Pattern pattern : blockedPatterns) {
                if (pattern.matcher(action.command()).find()) {
                    log.warn("Blocked command matched pattern {}", pattern.pattern());
                    return StageResult.fail(layer(), "blocked command pattern: " + pattern.pattern());
                }
            }
            for (String path : writtenPaths(action.command())) {
                Optional<StageResult> violation = checkPath(path);
                if (violation.isPresent()) {
                    log.warn("Command writes to refused path {}", path);
                    return violation.get();
                }
            }
        }
        String target = action.targetPath();
        if (target != null && action.kind() != null && action.kind().mutates()) {
            Optional<StageResult> violation = checkPath(target);
            if (violation.isPresent()) {
                return violation.get();
            }
        } else if (target != null && hasTraversal(target)) {
            return StageResult.fail(layer(), "path traversal in " + target);
        }
        if (isIrreversible(action) && !allowIrreversible) {
            return StageResult.fail(layer(), "irreversible action not allowed");
        }
        return StageResult.pass(layer(), "no safety violations");
    }

    /** Deletes cannot be undone whatever the agent declares. */
    static boolean isIrreversible(ProposedAction action) {
        return action.irreversible() || action.kind() == ActionKind.FILE_DELETE;
    }

    private Optional<StageResult> checkPath(String path) {
        if (hasTraversal(path)) {
            return Optional.of(StageResult.fail(layer(), "path traversal in " + path));
        }
        String normalized = normalize(path);
        for (Pattern root : protectedRoots) {
            if (root.matcher(normalized).matches()) {
                return Optional.of(StageResult.fail(layer(), "protected path: " + path));
            }
        }
        return Optional.empty();
    }

    /**
     * Paths a command writes: redirection targets plus the written arguments of
     * {@link #WRITING_PROGRAMS}, across all segments of a compound command.
     */
    static List<String> writtenPaths(String command) {
        var paths = new ArrayList<String>();
        for (String segment : SEGMENT_SEPARATOR.split(command)) {
            var redirect = REDIRECT.matcher(segment);
            while (redirect.find()) {
                paths.add(unquote(redirect.group(1)));
            }
            String[] tokens = REDIRECT.matcher(segment).replaceAll(" ").trim().split("\\s+");
            int i = 0;
            while (i < tokens.length && (tokens[i].equals("sudo") || tokens[i].equals("env")
                    || (tokens[i].contains("=") && !tokens[i].startsWith("-")))) {
                i++;
            }
            if (i >= tokens.length || !WRITING_PROGRAMS.contains(programName(tokens[i]))) {
                continue;
            }
            String program = programName(tokens[i]);
            var arguments = new ArrayList<String>();
            boolean inPlace = false;
            boolean scriptOption = false;
            for (int j = i + 1; j < tokens.length; j++) {
                String token = unquote(tokens[j]);
                if (token.startsWith("-i") || token.equals("--in-place")) {
                    inPlace = true;
                }
                if (program.equals("sed") && (token.equals("-e") || token.equals("-f"))) {
                    scriptOption = true;
                    j++;
                } else if (!token.isEmpty() && !token.startsWith("-")) {
                    arguments.add(token);
                }
            }
            switch (program) {
                case "dd" -> arguments.stream()
                        .filter(a -> a.startsWith("of="))
                        .forEach(a -> paths.add(a.substring(3)));
                case "cp", "ln", "install" -> {
                    if (!arguments.isEmpty()) {
                        paths.add(arguments.get(arguments.size() - 1));
                    }
                }
                case "sed" -> {
                    if (inPlace && !arguments.isEmpty()) {
                        paths.addAll(scriptOption ? arguments : arguments.subList(1, arguments.size()));
                    }
                }
                default -> paths.addAll(arguments);
            }
        }
        return paths;
    }

    static boolean hasTraversal(String path) {
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.equals("..")) {
                return true;
            }
        }
        return false;
    }

    static Pattern rootPattern(String root, String userHome) {
        if (root.equals("~") || root.startsWith("~/")) {
            String rest = root.substring(1);
            var homes = new StringBuilder("~|\\$HOME|\\$\\{HOME}|/root|/home/[^/]+");
            if (userHome != null && !userHome.isBlank()) {
                homes.append('|').append(Pattern.quote(trimTrailingSlash(userHome)));
            }
            return Pattern.compile("(" + homes + ")" + Pattern.quote(rest) + "(/.*)?");
        }
        return Pattern.compile(Pattern.quote(root) + "(/.*)?");
    }

    private static String programName(String token) {
        return token.substring(token.lastIndexOf('/') + 1);
    }

    private static String unquote(String token) {
        if (token.length() >= 2 && (token.startsWith("\"") && token.endsWith("\"")
                || token.startsWith("'") && token.endsWith("'"))) {
            return token.substring(1, token.length() - 1);
        }
        return token;
    }

    private static String normalize(String path) {
        return trimTrailingSlash(path.replace('\\', '/').replaceAll("/{2,}", "/"));
    }

    private static String trimTrailingSlash(String path) {
        String trimmed = path.trim();
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
