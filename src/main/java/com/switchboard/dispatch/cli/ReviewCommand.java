package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.model.AtomicOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchboard review &lt;operationId&gt; --approve|--reject
 * <p>
 * Settles an escalated operation by hand.
 */
@Command(name = "review", mixinStandardHelpOptions = true, description = "Approve or reject an escalated operation")
@Component
public class ReviewCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReviewCommand.class);

    @Parameters(index = "0", description = "Operation id")
    private String operationId;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Decision decision;

    static class Decision {
        @Option(names = "--approve", required = true, description = "Approve the operation")
        boolean approve;

        @Option(names = "--reject", required = true, description = "Reject the operation")
        boolean reject;
    }

    private final OperationEngine engine;

    public ReviewCommand(OperationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        try {
            AtomicOperation resolved = engine.resolveEscalation(operationId, decision.approve);
            ConsoleOutput.success("Operation " + resolved.id() + " is now " + resolved.status());
            return 0;
        } catch (RuntimeException e) {
            log.debug("Review failed", e);
            ConsoleOutput.error("Review failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }
    }
}
