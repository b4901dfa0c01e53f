package com.switchboard.dispatch.cli;

import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.LearningMetrics;
import com.switchboard.core.model.PipelineResult;
import com.switchboard.core.model.StageResult;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Switchboard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWITCHBOARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWITCHBOARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void classification(Classification c) {
        String confidence = c.confident() ? "@|fg(green) confident|@" : "@|fg(yellow) unconfident|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + c.key() + "|@ (" + confidence + ")"));
        if (c.reasoning() != null && !c.reasoning().isBlank()) {
            System.out.println("    " + c.reasoning());
        }
    }

    public static void stage(StageResult stage) {
        String color = switch (stage.outcome()) {
            case PASS -> "fg(green)";
            case FAIL -> "fg(red)";
            case SKIPPED -> "fg(white)";
        };
        String detail = stage.message() != null ? stage.message() : "";
        if (stage.error() != null) {
            detail += " (" + stage.error() + ")";
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-7s", stage.outcome()) + "|@ "
                        + String.format("%-10s", stage.layer()) + " " + detail));
    }

    public static void pipeline(PipelineResult result) {
        for (StageResult stage : result.stages()) {
            stage(stage);
        }
        String verdict = result.approved()
                ? "@|fg(green),bold APPROVED|@"
                : "@|fg(red),bold REJECTED|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Verdict: " + verdict + " (" + result.mode() + ")"
                        + (result.haltedBy() != null ? ", halted by " + result.haltedBy() : "")));
    }

    public static void metrics(LearningMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Learning Metrics|@" + (m.userId() != null ? " for " + m.userId() : "")));
        System.out.println("  Classified operations: " + m.operations());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Feedback: @|fg(green) " + m.confirmations() + " confirmed|@, @|fg(red) "
                        + m.corrections() + " corrected|@"));
        System.out.printf("  Accuracy: %.1f%%%n", m.classificationAccuracy() * 100);
        System.out.printf("  Correction rate: %.1f%%%n", m.correctionRate() * 100);
        counts("Corrected destinations", m.correctedDestinations());
        counts("Corrected consumers", m.correctedConsumers());
        counts("Corrected semantics", m.correctedSemantics());
    }

    public static void watchEvent(SwitchboardEvent event) {
        String prefix = switch (event.type()) {
            case CREATED -> "@|fg(cyan) [OPERATION]|@";
            case RESUMED -> "@|fg(cyan) [RESUMED]|@";
            case CLASSIFIED -> "@|fg(blue) [CLASSIFIED]|@";
            case ROUTED -> "@|fg(magenta) [ROUTED]|@";
            case VERIFICATION_COMPLETED -> "@|bold,fg(yellow) [VERIFIED]|@";
            case ESCALATED -> "@|fg(yellow),bold [ESCALATED]|@";
            case RESOLVED -> "@|fg(green),bold [RESOLVED]|@";
            case FEEDBACK_RECORDED -> "@|fg(green) [FEEDBACK]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.operationId() + " " + event.payload()));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static void counts(String label, Map<String, Long> counts) {
        if (counts == null || counts.isEmpty()) {
            return;
        }
        StringBuilder line = new StringBuilder("  ").append(label).append(":");
        counts.forEach((key, count) -> line.append(' ').append(key).append('=').append(count));
        System.out.println(line);
    }
}
