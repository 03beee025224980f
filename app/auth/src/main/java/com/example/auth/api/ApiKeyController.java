package com.example.auth.api;

import com.example.auth.api.request.CreateApiKeyRequest;
import com.example.auth.api.response.ApiKeyResponse;
import com.example.auth.api.response.CreatedApiKeyResponse;
import com.example.auth.model.AuthenticatedIdentity;
import com.example.auth.service.ApiKeyService;
import com.example.auth.service.GeneratedApiKey;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/api-keys")
@RequiredArgsConstructor
public class ApiKeyController {

  private final ApiKeyService apiKeyService;

  @GetMapping
  public ResponseEntity<List<ApiKeyResponse>> list(
      @AuthenticationPrincipal AuthenticatedIdentity identity) {
    return ResponseEntity.ok(
        apiKeyService.list(identity.userId()).stream().map(ApiKeyResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<CreatedApiKeyResponse> create(
      @AuthenticationPrincipal AuthenticatedIdentity identity,
      @Valid @RequestBody CreateApiKeyRequest request) {
    final GeneratedApiKey generated =
        apiKeyService.generate(
            identity.userId(), request.name(), request.permissions(), request.expiresInDays());
    return ResponseEntity.status(HttpStatus.CREATED).body(CreatedApiKeyResponse.from(generated));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> revoke(
      @AuthenticationPrincipal AuthenticatedIdentity identity, @PathVariable("id") String id) {
    apiKeyService.revoke(identity.userId(), id);
    return ResponseEntity.noContent().build();
  }
}
