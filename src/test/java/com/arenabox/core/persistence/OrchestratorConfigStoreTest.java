package com.arenabox.core.persistence;

import com.arenabox.core.error.TransportException;
import com.arenabox.core.model.OrchestratorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigStoreTest {

    private OrchestratorConfigStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new OrchestratorConfigStore(H2TestDataSource.create());
        store.createTables();
    }

    @Test
    @DisplayName("require fails until a hostname is configured")
    void requireUnconfigured() {
        assertTrue(store.get().isEmpty());
        assertThrows(TransportException.class, store::require);
    }

    @Test
    @DisplayName("the latest save is what the next read sees")
    void singleRowReplaced() {
        store.save(new OrchestratorConfig("docker-a:2375", false, null, null, null, List.of()));
        store.save(new OrchestratorConfig("docker-b:2376", true, "CA", "CERT", "KEY", List.of("nginx", "ctf/web")));

        var config = store.require();
        assertEquals("docker-b:2376", config.hostname());
        assertTrue(config.tlsEnabled());
        assertEquals("KEY", config.clientKey());
        assertEquals(List.of("nginx", "ctf/web"), config.repositories());
    }

    @Test
    @DisplayName("turning TLS off clears stored key material")
    void tlsOffClearsMaterial() {
        store.save(new OrchestratorConfig("docker:2376", true, "CA", "CERT", "KEY", List.of()));
        store.save(new OrchestratorConfig("docker:2375", false, "CA", "CERT", "KEY", List.of()));

        var config = store.require();
        assertNull(config.caCert());
        assertNull(config.clientKey());
        assertTrue(config.repositories().isEmpty());
    }
}
