package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.model.AgentRoute;
import com.switchboard.core.model.ClassificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchboard classify "&lt;request&gt;"
 * <p>
 * Classifies a request and shows where it would be routed, without creating
 * an operation.
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify a request without processing it")
@Component
public class ClassifyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ClassifyCommand.class);

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--user", "-u"}, description = "User id")
    private String userId;

    private final OperationEngine engine;

    public ClassifyCommand(OperationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.info("Classifying request...");
        try {
            ClassificationResult result = engine.classify(request, userId);
            ConsoleOutput.classification(result.classification());
            AgentRoute route = engine.route(result.classification());
            ConsoleOutput.info("Route: " + route.agentId() + " (" + route.reason() + ")");
            return 0;
        } catch (RuntimeException e) {
            log.debug("Classification failed", e);
            ConsoleOutput.error("Classification failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }
    }
}
