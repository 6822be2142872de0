package com.arenabox.dispatch.api;

import com.arenabox.core.error.ConflictException;
import com.arenabox.core.error.NotFoundException;
import com.arenabox.core.error.PortExhaustionException;
import com.arenabox.core.model.Instance;
import com.arenabox.core.model.Participant;
import com.arenabox.core.model.PortMapping;
import com.arenabox.core.model.PortSpec;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.sandbox.SandboxManager;
import com.arenabox.sandbox.SandboxManager.ProvisionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InstanceController.class)
@Import({ParticipantResolver.class, IdentityProperties.class})
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class InstanceControllerTest {

    private static final Participant TEAM = Participant.team("5");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SandboxManager sandboxManager;

    private static Instance instance() {
        Instant created = Instant.ofEpochSecond(1_772_366_400L);
        return new Instance(7, TEAM, 42, "nginx:alpine", SandboxKind.SINGLE, "c1",
                List.of(new PortMapping(31337, PortSpec.parse("80/tcp"))), "docker.local",
                created, created.plusSeconds(300));
    }

    // ── POST /api/v1/instances/{challengeId} ────────────────────────────

    @Test
    @DisplayName("POST returns 201 with the new instance")
    void provisionCreated() throws Exception {
        when(sandboxManager.provision(TEAM, 42)).thenReturn(new ProvisionOutcome(instance(), true));

        mockMvc.perform(post("/api/v1/instances/42")
                        .header("X-Participant-Kind", "team")
                        .header("X-Participant-Id", "5"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.handle").value("c1"))
                .andExpect(jsonPath("$.participant_kind").value("team"))
                .andExpect(jsonPath("$.ports[0]").value("31337->80/tcp"))
                .andExpect(jsonPath("$.created_at").value(1_772_366_400L))
                .andExpect(jsonPath("$.revert_eligible_at").value(1_772_366_700L));
    }

    @Test
    @DisplayName("POST returns 200 when the instance already existed")
    void provisionExisting() throws Exception {
        when(sandboxManager.provision(TEAM, 42)).thenReturn(new ProvisionOutcome(instance(), false));

        mockMvc.perform(post("/api/v1/instances/42")
                        .header("X-Participant-Kind", "TEAM")
                        .header("X-Participant-Id", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(7));
    }

    @Test
    void provisionWithoutIdentityIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/instances/42"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Participant identity headers are missing"));

        verify(sandboxManager, never()).provision(any(), anyLong());
    }

    @Test
    void participantIdLongerThanStoredIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/instances/42")
                        .header("X-Participant-Kind", "user")
                        .header("X-Participant-Id", "u".repeat(100)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Participant id exceeds 64 characters"));

        verify(sandboxManager, never()).provision(any(), anyLong());
    }

    @Test
    void unknownChallengeIsNotFound() throws Exception {
        when(sandboxManager.provision(TEAM, 99)).thenThrow(new NotFoundException("Challenge 99 not found"));

        mockMvc.perform(post("/api/v1/instances/99")
                        .header("X-Participant-Kind", "team")
                        .header("X-Participant-Id", "5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Challenge 99 not found"));
    }

    @Test
    void portExhaustionIsServiceUnavailable() throws Exception {
        when(sandboxManager.provision(TEAM, 42))
                .thenThrow(new PortExhaustionException("Unable to allocate 1 port(s) after 100 attempts"));

        mockMvc.perform(post("/api/v1/instances/42")
                        .header("X-Participant-Kind", "team")
                        .header("X-Participant-Id", "5"))
                .andExpect(status().isServiceUnavailable());
    }

    // ── GET /api/v1/instances ───────────────────────────────────────────

    @Test
    void listReturnsParticipantInstances() throws Exception {
        when(sandboxManager.list(TEAM)).thenReturn(List.of(instance()));

        mockMvc.perform(get("/api/v1/instances")
                        .header("X-Participant-Kind", "team")
                        .header("X-Participant-Id", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].challenge_id").value(42));
    }

    // ── POST /api/v1/instances/{challengeId}/revert ─────────────────────

    @Test
    @DisplayName("revert inside the cooldown is a conflict")
    void revertTooEarly() throws Exception {
        when(sandboxManager.revert(TEAM, 42))
                .thenThrow(new ConflictException("Instance can be reverted in 12 second(s)"));

        mockMvc.perform(post("/api/v1/instances/42/revert")
                        .header("X-Participant-Kind", "team")
                        .header("X-Participant-Id", "5"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", containsString("12 second")));
    }

    @Test
    void revertReturnsFreshInstance() throws Exception {
        when(sandboxManager.revert(TEAM, 42)).thenReturn(new ProvisionOutcome(instance(), true));

        mockMvc.perform(post("/api/v1/instances/42/revert")
                        .header("X-Participant-Kind", "team")
                        .header("X-Participant-Id", "5"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.handle").value("c1"));
    }
}
