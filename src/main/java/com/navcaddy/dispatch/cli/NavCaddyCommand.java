package com.navcaddy.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for NavCaddy.
 * Routes to subcommands: ask, health, serve.
 */
@Command(
        name = "navcaddy",
        mixinStandardHelpOptions = true,
        version = "NavCaddy 0.1.0",
        description = "Conversational golf caddy: intent classification and routing",
        subcommands = {
                AskCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class NavCaddyCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // Reuse the parsed command line so subcommands keep their factory-built instances
        spec.commandLine().usage(System.out);
    }
}
