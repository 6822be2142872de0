package com.arenabox.dispatch.cli;

import com.arenabox.core.error.SandboxException;
import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.SecretInfo;
import com.arenabox.secrets.SecretVault;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: arenabox secrets list | delete-all
 */
@Command(name = "secrets", mixinStandardHelpOptions = true,
        description = "List or remove orchestrator secrets")
@Component
public class SecretsCommand implements Runnable {

    private static final String CLI_ACTOR = "cli";

    private final SecretVault secretVault;

    public SecretsCommand(SecretVault secretVault) {
        this.secretVault = secretVault;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "list", description = "List secrets known to the orchestrator")
    int list() {
        try {
            List<SecretInfo> secrets = secretVault.list();
            if (secrets.isEmpty()) {
                ConsoleOutput.info("No secrets");
            }
            for (SecretInfo secret : secrets) {
                System.out.println("  " + secret.id() + "  " + secret.name());
            }
            return 0;
        } catch (SandboxException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    @Command(name = "delete-all", description = "Delete every secret not referenced by a challenge")
    int deleteAll() {
        try {
            BulkResult result = secretVault.deleteAll(CLI_ACTOR);
            ConsoleOutput.bulkResult("Secrets", result);
            return result.success() ? 0 : 1;
        } catch (SandboxException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
