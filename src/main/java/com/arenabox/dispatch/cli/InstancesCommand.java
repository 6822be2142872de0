package com.arenabox.dispatch.cli;

import com.arenabox.core.model.Instance;
import com.arenabox.core.model.Participant;
import com.arenabox.core.model.ParticipantKind;
import com.arenabox.sandbox.SandboxManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: arenabox instances &lt;user|team&gt; &lt;id&gt;
 */
@Command(name = "instances", mixinStandardHelpOptions = true,
        description = "Show a participant's active sandboxes")
@Component
public class InstancesCommand implements Runnable {

    @Parameters(index = "0", paramLabel = "KIND", description = "user or team")
    String kind;

    @Parameters(index = "1", paramLabel = "ID", description = "Participant id")
    String id;

    private final SandboxManager sandboxManager;

    public InstancesCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public void run() {
        Participant participant;
        try {
            participant = new Participant(ParticipantKind.parse(kind), id);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Unknown participant kind: " + kind);
            return;
        }
        List<Instance> instances = sandboxManager.list(participant);
        ConsoleOutput.info(instances.size() + " active instance(s) for " + participant.key());
        instances.forEach(ConsoleOutput::instance);
    }
}
