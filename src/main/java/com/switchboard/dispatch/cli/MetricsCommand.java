package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.OperationEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(name = "metrics", mixinStandardHelpOptions = true, description = "Show classification learning metrics")
@Component
public class MetricsCommand implements Callable<Integer> {

    @Option(names = {"--user", "-u"}, description = "Only feedback from this user")
    private String userId;

    private final OperationEngine engine;

    public MetricsCommand(OperationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.metrics(engine.learningMetrics(userId));
        return 0;
    }
}
