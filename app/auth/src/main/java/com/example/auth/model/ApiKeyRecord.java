/*
 * どこで: app/auth/src/main/java/com/example/auth/model/ApiKeyRecord.java
 * 何を: api_keys テーブル相当のドメインレコード
 * なぜ: 鍵そのものではなく検証子 (hash) と表示用 prefix だけを保持するため
 */
package com.example.auth.model;

import java.time.Instant;
import java.util.Set;

public record ApiKeyRecord(
    String id,
    String ownerUserId,
    String displayName,
    String keyHash,
    String keyPrefix,
    Set<String> permissions,
    Instant expiresAt,
    Instant revokedAt,
    Instant lastUsedAt,
    Instant createdAt) {

  public ApiKeyRecord {
    permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
  }

  public boolean isRevoked() {
    return revokedAt != null;
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && now.isAfter(expiresAt);
  }
}
