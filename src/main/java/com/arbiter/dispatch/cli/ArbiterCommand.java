package com.arbiter.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Arbiter.
 * Routes to subcommands: coordinate, goals, alignment.
 */
@Command(
        name = "arbiter",
        mixinStandardHelpOptions = true,
        version = "Arbiter 0.1.0",
        description = "Governance and value-alignment engine for automated code generation",
        subcommands = {
                CoordinateCommand.class,
                GoalsCommand.class,
                AlignmentCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ArbiterCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
