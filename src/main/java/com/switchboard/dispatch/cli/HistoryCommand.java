package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.model.AtomicOperation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: switchboard history
 * <p>
 * Shows stored operations as a table: Operation ID | Status | Classification | Agent | Request.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent operations")
@Component
public class HistoryCommand implements Callable<Integer> {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final OperationEngine engine;

    public HistoryCommand(OperationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        List<AtomicOperation> operations;
        try {
            operations = engine.history(limit);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (operations.isEmpty()) {
            ConsoleOutput.info("No operations found.");
            return 0;
        }

        ConsoleOutput.info("Operations (" + operations.size() + "):");
        System.out.println();
        System.out.printf("  %-36s %-10s %-26s %-14s %s%n", "OPERATION ID", "STATUS", "CLASSIFICATION", "AGENT", "REQUEST");
        System.out.println("  " + "-".repeat(110));
        for (AtomicOperation op : operations) {
            String classification = op.isClassified() ? op.classification().key() : "-";
            String agent = op.agentId() != null ? op.agentId() : "-";
            System.out.printf("  %-36s %-10s %-26s %-14s %s%n",
                    op.id(), op.status(), classification, agent, ConsoleOutput.truncate(op.userRequest(), 30));
        }
        return 0;
    }
}
