package com.switchboard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Switchboard.
 */
@Command(
        name = "switchboard",
        mixinStandardHelpOptions = true,
        version = "Switchboard 0.1.0",
        description = "Classifies requests, routes them to agents and verifies what the agents propose",
        subcommands = {
                ClassifyCommand.class,
                ProcessCommand.class,
                ResumeCommand.class,
                CorrectCommand.class,
                ConfirmCommand.class,
                CorrectionsCommand.class,
                HistoryCommand.class,
                ReviewCommand.class,
                MetricsCommand.class,
                CallCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwitchboardCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
