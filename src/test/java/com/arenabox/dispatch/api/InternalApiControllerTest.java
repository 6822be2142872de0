package com.arenabox.dispatch.api;

import com.arenabox.core.model.Participant;
import com.arenabox.sandbox.SandboxManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InternalApiController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class InternalApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SandboxManager sandboxManager;

    @Test
    void solveTearsDownInstances() throws Exception {
        when(sandboxManager.onSolve(Participant.user("17"), 42)).thenReturn(1);

        mockMvc.perform(post("/api/internal/solves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"participant_kind\":\"user\",\"participant_id\":\"17\",\"challenge_id\":42}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.removed").value(1));
    }

    @Test
    void missingFieldsAreRejected() throws Exception {
        mockMvc.perform(post("/api/internal/solves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"participant_kind\":\"user\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(sandboxManager);
    }

    @Test
    void unknownParticipantKindIsRejected() throws Exception {
        mockMvc.perform(post("/api/internal/solves")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"participant_kind\":\"squad\",\"participant_id\":\"3\",\"challenge_id\":1}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(sandboxManager);
    }
}
