package com.arenabox.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 */
@Command(
        name = "arenabox",
        mixinStandardHelpOptions = true,
        version = "arenabox 0.1.0",
        description = "Per-participant challenge sandboxes on a Docker engine or swarm",
        subcommands = {
                ServeCommand.class,
                NukeCommand.class,
                SecretsCommand.class,
                InstancesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ArenaboxCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
