package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.feedback.FeedbackRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "confirm", mixinStandardHelpOptions = true, description = "Confirm an operation's classification")
@Component
public class ConfirmCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConfirmCommand.class);

    @Parameters(index = "0", description = "Operation id")
    private String operationId;

    @Option(names = {"--user", "-u"}, description = "User id")
    private String userId;

    private final OperationEngine engine;

    public ConfirmCommand(OperationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        try {
            engine.recordFeedback(operationId, FeedbackRequest.confirmation(userId));
            ConsoleOutput.success("Classification confirmed for " + operationId);
            return 0;
        } catch (RuntimeException e) {
            log.debug("Confirmation failed", e);
            ConsoleOutput.error("Confirmation failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }
    }
}
