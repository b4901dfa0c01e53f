package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import com.switchboard.core.engine.ProcessResult;
import com.switchboard.core.events.EventBus;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.VerificationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchboard process "&lt;request&gt;"
 * <p>
 * Runs the whole flow: classify, route, propose and verify. Exits 0 when the
 * operation is approved or escalated, 2 when rejected and 1 on error.
 */
@Command(name = "process", mixinStandardHelpOptions = true, description = "Classify, route and verify a request")
@Component
public class ProcessCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommand.class);

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--user", "-u"}, description = "User id")
    private String userId;

    @Option(names = {"--mode", "-m"}, description = "Verification mode: ${COMPLETION-CANDIDATES}")
    private VerificationMode mode;

    @Option(names = {"--watch", "-w"}, description = "Print lifecycle events as they happen")
    private boolean watch;

    private final OperationEngine engine;
    private final EventBus eventBus;

    public ProcessCommand(OperationEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        EventBus.Subscription subscription = watch
                ? eventBus.subscribeAll(ConsoleOutput::watchEvent)
                : null;
        try {
            ProcessResult result = engine.process(request, userId, mode);
            print(result);
            OperationStatus status = result.operation().status();
            return status == OperationStatus.REJECTED ? 2 : 0;
        } catch (RuntimeException e) {
            log.debug("Processing failed", e);
            ConsoleOutput.error("Processing failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    static void print(ProcessResult result) {
        System.out.println();
        System.out.println("OPERATION " + result.operation().id());
        if (result.classificationResult() != null) {
            ConsoleOutput.classification(result.classificationResult().classification());
        } else if (result.operation().classification() != null) {
            ConsoleOutput.classification(result.operation().classification());
        }
        if (result.route() != null) {
            ConsoleOutput.info("Agent: " + result.route().agentId() + " (" + result.route().reason() + ")");
        }
        ProposedAction action = result.action();
        if (action != null) {
            ConsoleOutput.info("Proposed " + action.kind() + ": " + describe(action));
        }
        if (result.pipelineResult() != null) {
            ConsoleOutput.pipeline(result.pipelineResult());
        }
        System.out.println();
        OperationStatus status = result.operation().status();
        switch (status) {
            case APPROVED -> ConsoleOutput.success("Operation approved.");
            case ESCALATED -> ConsoleOutput.warn("Operation escalated. Resolve with: switchboard review "
                    + result.operation().id() + " --approve|--reject");
            case REJECTED -> ConsoleOutput.error("Operation rejected.");
            case CLASSIFIED -> ConsoleOutput.warn("Operation was corrected. Continue with: switchboard resume "
                    + result.operation().id());
            default -> ConsoleOutput.info("Operation status: " + status);
        }
    }

    private static String describe(ProposedAction action) {
        return switch (action.kind()) {
            case RESPONSE -> ConsoleOutput.truncate(action.content(), 60);
            case COMMAND -> action.command();
            case FILE_WRITE, FILE_DELETE -> action.targetPath();
        };
    }
}
