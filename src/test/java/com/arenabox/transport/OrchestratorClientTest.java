package com.arenabox.transport;

import com.arenabox.core.error.TransportException;
import com.arenabox.core.model.OrchestratorConfig;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OrchestratorClientTest {

    private static final OrchestratorConfig PLAIN =
            new OrchestratorConfig("docker.local:2375", false, null, null, null, List.of());
    private static final OrchestratorConfig TLS =
            new OrchestratorConfig("docker.local:2376", true, "CA-PEM", "CERT-PEM", "KEY-PEM", List.of());

    private DockerClient dockerClient;
    private DockerClientFactory factory;
    private OrchestratorClient client;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        factory = mock(DockerClientFactory.class);
        when(factory.create(any(), any())).thenReturn(dockerClient);
        client = new OrchestratorClient(factory);
    }

    @Test
    @DisplayName("a successful call returns the value and closes the client")
    void successfulCall() throws Exception {
        OrchestratorResult<String> result = client.execute(PLAIN, "ping", docker -> "pong");

        assertTrue(result.isSuccess());
        assertEquals("pong", result.value());
        verify(factory).create(PLAIN, null);
        verify(dockerClient).close();
    }

    @Test
    @DisplayName("an unconfigured endpoint fails without building a client")
    void unconfigured() {
        var empty = new OrchestratorConfig(" ", false, null, null, null, List.of());
        OrchestratorResult<String> result = client.execute(empty, "ping", docker -> "pong");

        assertFalse(result.isSuccess());
        verifyNoInteractions(factory);
        assertThrows(TransportException.class, () -> result.orElseThrow("ping"));
    }

    @Test
    @DisplayName("a null response is reported as a failure")
    void nullResponse() {
        OrchestratorResult<String> result = client.execute(PLAIN, "ping", docker -> null);
        assertFalse(result.isSuccess());
        assertTrue(result.error().contains("empty response"));
    }

    @Test
    @DisplayName("engine errors become failures carrying the HTTP status")
    void dockerExceptionCarriesStatus() {
        OrchestratorResult<String> result = client.execute(PLAIN, "inspect", docker -> {
            throw new NotFoundException("no such image");
        });

        assertFalse(result.isSuccess());
        assertEquals(404, result.statusCode());
        assertThrows(IllegalStateException.class, result::value);
    }

    @Test
    @DisplayName("connection failures and timeouts become failures, not exceptions")
    void runtimeFailure() {
        OrchestratorResult<String> result = client.execute(PLAIN, "ping", docker -> {
            throw new RuntimeException("java.net.SocketTimeoutException: Read timed out");
        });

        assertFalse(result.isSuccess());
        assertEquals(0, result.statusCode());
        assertTrue(result.error().contains("timed out"));
    }

    @Test
    @DisplayName("TLS material exists during the call and is removed afterwards")
    void tlsMaterialScopedToCall() {
        var seenDir = new AtomicReference<Path>();
        when(factory.create(eq(TLS), any())).thenAnswer(inv -> {
            Path dir = inv.getArgument(1);
            seenDir.set(dir);
            assertEquals("KEY-PEM", Files.readString(dir.resolve(CredentialMaterial.KEY_FILE)));
            assertTrue(Files.exists(dir.resolve(CredentialMaterial.CA_FILE)));
            return dockerClient;
        });

        OrchestratorResult<String> result = client.execute(TLS, "ping", docker -> "pong");

        assertTrue(result.isSuccess());
        assertNotNull(seenDir.get());
        assertFalse(Files.exists(seenDir.get()));
    }

    @Test
    @DisplayName("TLS material is removed when the call fails")
    void tlsMaterialRemovedOnFailure() {
        var seenDir = new AtomicReference<Path>();
        when(factory.create(eq(TLS), any())).thenAnswer(inv -> {
            seenDir.set(inv.getArgument(1));
            return dockerClient;
        });

        OrchestratorResult<String> result = client.execute(TLS, "ping", docker -> {
            throw new RuntimeException("Connection refused");
        });

        assertFalse(result.isSuccess());
        assertFalse(Files.exists(seenDir.get()));
    }

    @Test
    @DisplayName("TLS without key material fails before any call")
    void tlsWithoutMaterial() {
        var incomplete = new OrchestratorConfig("docker.local:2376", true, "CA", null, null, List.of());
        OrchestratorResult<String> result = client.execute(incomplete, "ping", docker -> "pong");

        assertFalse(result.isSuccess());
        assertTrue(result.error().startsWith("TLS material unavailable"));
        verifyNoInteractions(factory);
    }

    @Test
    @DisplayName("messages that may echo secret data are redacted")
    void redaction() {
        assertEquals("[REDACTED - contains secret data]", OrchestratorClient.redact("bad request: {\"Data\":\"c2VjcmV0\"}"));
        assertEquals("Connection refused", OrchestratorClient.redact("Connection refused"));
        assertEquals("unknown error", OrchestratorClient.redact(null));
    }
}
