package com.arenabox.dispatch.api;

import com.arenabox.core.error.ConflictException;
import com.arenabox.core.error.PolicyViolationException;
import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.SecretInfo;
import com.arenabox.secrets.SecretVault;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SecretController.class)
@Import({ParticipantResolver.class, IdentityProperties.class})
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SecretControllerTest {

    private static final String BODY = "{\"name\":\"db_password\",\"value\":\"hunter2\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SecretVault secretVault;

    @Test
    void listWrapsSecretsInData() throws Exception {
        when(secretVault.list()).thenReturn(List.of(new SecretInfo("id1", "db_password")));

        mockMvc.perform(get("/api/v1/admin/secrets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].id").value("id1"))
                .andExpect(jsonPath("$.data[0].name").value("db_password"));
    }

    @Test
    @DisplayName("create over HTTPS passes the secure flag and admin identity")
    void createOverTls() throws Exception {
        when(secretVault.create("db_password", "hunter2", true, "alice"))
                .thenReturn(new SecretInfo("new-id", "db_password"));

        mockMvc.perform(post("/api/v1/admin/secrets")
                        .secure(true)
                        .header("X-Admin-User", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("new-id"))
                .andExpect(jsonPath("$.value").doesNotExist());
    }

    @Test
    void createOverPlainHttpIsRefused() throws Exception {
        when(secretVault.create("db_password", "hunter2", false, "unknown"))
                .thenThrow(new PolicyViolationException("Secrets can only be created over TLS"));

        mockMvc.perform(post("/api/v1/admin/secrets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void deleteOfReferencedSecretIsConflict() throws Exception {
        doThrow(new ConflictException("Secret id1 is in use by challenge(s): pwn (12)"))
                .when(secretVault).delete("id1", "alice");

        mockMvc.perform(delete("/api/v1/admin/secrets/id1").header("X-Admin-User", "alice"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Secret id1 is in use by challenge(s): pwn (12)"));
    }

    @Test
    void deleteReturnsSuccess() throws Exception {
        mockMvc.perform(delete("/api/v1/admin/secrets/id2").header("X-Admin-User", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(secretVault).delete("id2", "alice");
    }

    @Test
    void deleteAllReportsCounts() throws Exception {
        when(secretVault.deleteAll("alice")).thenReturn(new BulkResult(2, 1, List.of("b: in use")));

        mockMvc.perform(delete("/api/v1/admin/secrets").header("X-Admin-User", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.deleted").value(2))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.errors[0]").value("b: in use"));
    }
}
