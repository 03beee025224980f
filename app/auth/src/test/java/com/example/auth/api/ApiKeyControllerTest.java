package com.example.auth.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.auth.config.AuthSecurityConfig;
import com.example.auth.model.ApiKeyRecord;
import com.example.auth.repository.ApiKeyRepository;
import com.example.auth.security.ApiErrorWriter;
import com.example.auth.security.AuthenticationFailureLimiter;
import com.example.auth.security.CredentialDispatcher;
import com.example.auth.security.FixedWindowRateLimiter;
import com.example.auth.service.ApiKeyLastUsedRecorder;
import com.example.auth.service.ApiKeyNotFoundException;
import com.example.auth.service.ApiKeyService;
import com.example.auth.service.ApiKeyValidator;
import com.example.auth.service.AuthMetrics;
import com.example.auth.service.GeneratedApiKey;
import com.example.auth.service.InvalidApiKeyRequestException;
import com.example.auth.service.TokenCodec;
import com.example.common.config.TimeConfig;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({AuthController.class, ApiKeyController.class})
@AutoConfigureMockMvc
@Import({
  AuthSecurityConfig.class,
  TimeConfig.class,
  TokenCodec.class,
  ApiKeyValidator.class,
  CredentialDispatcher.class,
  ApiErrorWriter.class,
  FixedWindowRateLimiter.class,
  AuthenticationFailureLimiter.class
})
@TestPropertySource(
    properties = "auth.token.secret=test-secret-0123456789abcdef-0123456789abcdef")
class ApiKeyControllerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private MockMvc mockMvc;
  @Autowired private TokenCodec tokenCodec;

  @MockitoBean private ApiKeyService apiKeyService;
  @MockitoBean private ApiKeyRepository apiKeyRepository;
  @MockitoBean private ApiKeyLastUsedRecorder lastUsedRecorder;
  @MockitoBean private AuthMetrics authMetrics;

  private String bearer;

  @BeforeEach
  void setUp() {
    bearer = "Bearer " + tokenCodec.issuePair("user-1", "u1@x.com", "admin").accessToken();
  }

  @Test
  void createReturnsRawKeyOnce() throws Exception {
    when(apiKeyService.generate(eq("user-1"), eq("ci"), anyList(), isNull()))
        .thenReturn(new GeneratedApiKey("crm_" + "ef".repeat(32), record()));

    mockMvc
        .perform(
            post("/api/v1/api-keys")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"ci","permissions":["messages:read"]}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value("key-1"))
        .andExpect(jsonPath("$.key").value("crm_" + "ef".repeat(32)))
        .andExpect(jsonPath("$.key_prefix").value("crm_efefefef"))
        .andExpect(jsonPath("$.key_hash").doesNotExist());
  }

  @Test
  void createRejectsMissingName() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/api-keys")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"permissions\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void createRejectsUnknownPermission() throws Exception {
    when(apiKeyService.generate(eq("user-1"), eq("ci"), anyList(), any()))
        .thenThrow(new InvalidApiKeyRequestException("unknown permission: send_message"));

    mockMvc
        .perform(
            post("/api/v1/api-keys")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"ci\",\"permissions\":[\"send_message\"]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("unknown permission: send_message"));
  }

  @Test
  void listReturnsOwnersKeys() throws Exception {
    when(apiKeyService.list("user-1")).thenReturn(List.of(record()));

    mockMvc
        .perform(get("/api/v1/api-keys").header("Authorization", bearer))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("ci"))
        .andExpect(jsonPath("$[0].permissions[0]").value("messages:read"))
        .andExpect(jsonPath("$[0].key").doesNotExist());
  }

  @Test
  void revokeReturnsNoContent() throws Exception {
    mockMvc
        .perform(delete("/api/v1/api-keys/key-1").header("Authorization", bearer))
        .andExpect(status().isNoContent());

    verify(apiKeyService).revoke("user-1", "key-1");
  }

  @Test
  void revokeOfMissingKeyIsNotFound() throws Exception {
    doThrow(new ApiKeyNotFoundException("api key not found"))
        .when(apiKeyService)
        .revoke("user-1", "key-9");

    mockMvc
        .perform(delete("/api/v1/api-keys/key-9").header("Authorization", bearer))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  private static ApiKeyRecord record() {
    return new ApiKeyRecord(
        "key-1",
        "user-1",
        "ci",
        "hash",
        "crm_efefefef",
        Set.of("messages:read"),
        null,
        null,
        null,
        CREATED_AT);
  }
}
