package com.arenabox.dispatch.cli;

import com.arenabox.core.error.NotFoundException;
import com.arenabox.core.error.TransportException;
import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.Instance;
import com.arenabox.core.model.Participant;
import com.arenabox.core.model.PortMapping;
import com.arenabox.core.model.PortSpec;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.core.model.SecretInfo;
import com.arenabox.sandbox.SandboxManager;
import com.arenabox.secrets.SecretVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private SandboxManager sandboxManager;
    private SecretVault secretVault;

    @BeforeEach
    void setUp() {
        sandboxManager = mock(SandboxManager.class);
        secretVault = mock(SecretVault.class);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == NukeCommand.class) {
                    return (K) new NukeCommand(sandboxManager);
                }
                if (cls == InstancesCommand.class) {
                    return (K) new InstancesCommand(sandboxManager);
                }
                if (cls == SecretsCommand.class) {
                    return (K) new SecretsCommand(secretVault);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new ArenaboxCommand(), createFactory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static Instance instance(String handle) {
        Instant created = Instant.parse("2026-03-01T12:00:00Z");
        return new Instance(1, Participant.team("5"), 42, "nginx:alpine", SandboxKind.SINGLE, handle,
                List.of(new PortMapping(31337, PortSpec.parse("80/tcp"))), "docker.local",
                created, created.plusSeconds(300));
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("serve"));
            assertTrue(result.output().contains("nuke"));
            assertTrue(result.output().contains("secrets"));
            assertTrue(result.output().contains("instances"));
        }

        @Test
        void versionOutput() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("arenabox 0.1.0"));
        }
    }

    @Nested
    @DisplayName("nuke")
    class NukeTests {

        @Test
        void killsSingleHandle() {
            when(sandboxManager.forceKill("c1")).thenReturn(instance("c1"));

            CliResult result = execute("nuke", "c1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Killed c1"));
            verify(sandboxManager, never()).forceKillAll();
        }

        @Test
        void unknownHandleFails() {
            when(sandboxManager.forceKill("nope")).thenThrow(new NotFoundException("No instance with handle nope"));

            CliResult result = execute("nuke", "nope");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No instance with handle nope"));
        }

        @Test
        @DisplayName("--all reports partial failures with a non-zero exit code")
        void killAllPartialFailure() {
            when(sandboxManager.forceKillAll()).thenReturn(new BulkResult(2, 1, List.of("c3: timeout")));

            CliResult result = execute("nuke", "--all");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("c3: timeout"));
        }

        @Test
        void requiresTarget() {
            CliResult result = execute("nuke");

            assertNotEquals(0, result.exitCode());
            verifyNoInteractions(sandboxManager);
        }
    }

    @Nested
    @DisplayName("secrets")
    class SecretsTests {

        @Test
        void listPrintsIdsAndNames() {
            when(secretVault.list()).thenReturn(List.of(new SecretInfo("id1", "db_password")));

            CliResult result = execute("secrets", "list");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("id1  db_password"));
        }

        @Test
        void listFailsWhenOrchestratorUnreachable() {
            when(secretVault.list()).thenThrow(new TransportException("Orchestrator unavailable during secret listing"));

            assertEquals(1, execute("secrets", "list").exitCode());
        }

        @Test
        void deleteAllUsesCliActor() {
            when(secretVault.deleteAll("cli")).thenReturn(new BulkResult(3, 0, List.of()));

            CliResult result = execute("secrets", "delete-all");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("3 removed"));
        }
    }

    @Test
    void instancesListsParticipantSandboxes() {
        when(sandboxManager.list(Participant.team("5"))).thenReturn(List.of(instance("c1")));

        CliResult result = execute("instances", "team", "5");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("1 active instance(s) for team-5"));
        assertTrue(result.output().contains("31337->80/tcp"));
    }
}
