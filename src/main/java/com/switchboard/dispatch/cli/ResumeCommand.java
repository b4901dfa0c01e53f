package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.engine.ProcessResult;
import com.switchboard.core.events.EventBus;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.VerificationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchboard resume &lt;operationId&gt;
 * <p>
 * Routes, proposes and verifies a corrected operation with its current
 * classification. Exit codes match {@code process}.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Continue a corrected operation")
@Component
public class ResumeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResumeCommand.class);

    @Parameters(index = "0", description = "Operation id")
    private String operationId;

    @Option(names = {"--mode", "-m"}, description = "Verification mode: ${COMPLETION-CANDIDATES}")
    private VerificationMode mode;

    @Option(names = {"--watch", "-w"}, description = "Print lifecycle events as they happen")
    private boolean watch;

    private final OperationEngine engine;
    private final EventBus eventBus;

    public ResumeCommand(OperationEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        EventBus.Subscription subscription = watch
                ? eventBus.subscribe(operationId, ConsoleOutput::watchEvent)
                : null;
        try {
            ProcessResult result = engine.resume(operationId, mode);
            ProcessCommand.print(result);
            return result.operation().status() == OperationStatus.REJECTED ? 2 : 0;
        } catch (RuntimeException e) {
            log.debug("Resume failed", e);
            ConsoleOutput.error("Resume failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
