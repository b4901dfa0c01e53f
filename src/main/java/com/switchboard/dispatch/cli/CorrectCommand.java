package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.feedback.FeedbackRequest;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.UserFeedback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchboard correct &lt;operationId&gt; --destination file ...
 * <p>
 * Records a correction. Axes that are not given keep the system's value.
 */
@Command(name = "correct", mixinStandardHelpOptions = true, description = "Correct an operation's classification")
@Component
public class CorrectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CorrectCommand.class);

    @Parameters(index = "0", description = "Operation id")
    private String operationId;

    @Option(names = {"--destination", "-d"}, description = "stream, file or process")
    private String destination;

    @Option(names = {"--consumer", "-c"}, description = "human or machine")
    private String consumer;

    @Option(names = {"--semantics", "-s"}, description = "read, interpret or execute")
    private String semantics;

    @Option(names = {"--reason", "-r"}, description = "Why the original classification was wrong")
    private String reason;

    @Option(names = {"--user", "-u"}, description = "User id")
    private String userId;

    private final OperationEngine engine;

    public CorrectCommand(OperationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        try {
            FeedbackRequest request = FeedbackRequest.correction(userId,
                    destination != null ? DestinationType.fromValue(destination) : null,
                    consumer != null ? ConsumerType.fromValue(consumer) : null,
                    semantics != null ? ExecutionSemantics.fromValue(semantics) : null,
                    reason);
            UserFeedback feedback = engine.recordFeedback(operationId, request);
            ConsoleOutput.success("Correction recorded: " + feedback.correctedClassification().key());
            return 0;
        } catch (RuntimeException e) {
            log.debug("Correction failed", e);
            ConsoleOutput.error("Correction failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }
    }
}
