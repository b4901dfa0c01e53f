package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.model.CorrectionExemplar;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: switchboard corrections
 * <p>
 * Lists the corrections the classifier currently learns from, newest first.
 */
@Command(name = "corrections", mixinStandardHelpOptions = true, description = "List recent corrections")
@Component
public class CorrectionsCommand implements Callable<Integer> {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final OperationEngine engine;

    public CorrectionsCommand(OperationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        List<CorrectionExemplar> corrections;
        try {
            corrections = engine.getCorrections(limit);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (corrections.isEmpty()) {
            ConsoleOutput.info("No corrections found.");
            return 0;
        }
        ConsoleOutput.info("Corrections (" + corrections.size() + "):");
        System.out.println();
        System.out.printf("  %-30s %-26s %-26s %s%n", "REQUEST", "WAS", "SHOULD BE", "REASON");
        System.out.println("  " + "-".repeat(96));
        for (CorrectionExemplar c : corrections) {
            String was = c.systemDestination() == null ? "-"
                    : c.systemDestination() + "." + c.systemConsumer() + "." + c.systemSemantics();
            String shouldBe = c.correctedDestination() + "." + c.correctedConsumer() + "." + c.correctedSemantics();
            System.out.printf("  %-30s %-26s %-26s %s%n",
                    ConsoleOutput.truncate(c.request(), 30), was, shouldBe, ConsoleOutput.truncate(c.reasoning(), 40));
        }
        return 0;
    }
}
