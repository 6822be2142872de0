package com.arenabox.dispatch.cli;

import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.Instance;
import com.arenabox.core.model.PortMapping;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the arenabox CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ARENABOX v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ARENABOX]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void instance(Instance instance) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [" + instance.kind() + "]|@ " + instance.handle()
                        + "  challenge " + instance.challengeId()
                        + "  " + instance.image()
                        + "  " + instance.host() + " " + PortMapping.join(instance.ports())));
    }

    public static void bulkResult(String what, BulkResult result) {
        if (result.success()) {
            success(what + ": " + result.succeeded() + " removed");
            return;
        }
        error(what + ": " + result.succeeded() + " removed, " + result.failed() + " failed");
        for (String reason : result.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + reason));
        }
    }
}
