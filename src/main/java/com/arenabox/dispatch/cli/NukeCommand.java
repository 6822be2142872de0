package com.arenabox.dispatch.cli;

import com.arenabox.core.error.SandboxException;
import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.Instance;
import com.arenabox.sandbox.SandboxManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: arenabox nuke (--all | &lt;handle&gt;)
 */
@Command(name = "nuke", mixinStandardHelpOptions = true,
        description = "Force-kill one sandbox by handle, or all of them")
@Component
public class NukeCommand implements Callable<Integer> {

    @Option(names = "--all", description = "Kill every tracked sandbox")
    boolean all;

    @Parameters(paramLabel = "HANDLE", arity = "0..1", description = "Container or service id")
    String handle;

    private final SandboxManager sandboxManager;

    public NukeCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public Integer call() {
        if (all == (handle != null)) {
            ConsoleOutput.error("Specify either --all or a single HANDLE");
            return 2;
        }
        try {
            if (all) {
                BulkResult result = sandboxManager.forceKillAll();
                ConsoleOutput.bulkResult("Sandboxes", result);
                return result.success() ? 0 : 1;
            }
            Instance killed = sandboxManager.forceKill(handle);
            ConsoleOutput.success("Killed " + killed.handle() + " (" + killed.participant().key()
                    + ", challenge " + killed.challengeId() + ")");
            return 0;
        } catch (SandboxException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
