package com.example.auth.api.response;

import com.example.auth.model.ApiKeyRecord;
import java.time.Instant;
import java.util.List;

/** API key metadata. The verifier hash is never part of a response. */
public record ApiKeyResponse(
    String id,
    String userId,
    String name,
    String keyPrefix,
    List<String> permissions,
    Instant expiresAt,
    Instant revokedAt,
    Instant lastUsedAt,
    Instant createdAt) {

  public static ApiKeyResponse from(ApiKeyRecord record) {
    return new ApiKeyResponse(
        record.id(),
        record.ownerUserId(),
        record.displayName(),
        record.keyPrefix(),
        record.permissions().stream().sorted().toList(),
        record.expiresAt(),
        record.revokedAt(),
        record.lastUsedAt(),
        record.createdAt());
  }
}
