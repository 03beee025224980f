/*
 * どこで: Auth リポジトリ層
 * 何を: API キーレコードの永続化インターフェース
 * なぜ: 検証ロジックを DB 実装から切り離してテストで差し替えられるようにするため
 */
package com.example.auth.repository;

import com.example.auth.model.ApiKeyRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ApiKeyRepository {

  Optional<ApiKeyRecord> findByKeyHash(String keyHash);

  List<ApiKeyRecord> findByOwnerUserId(String ownerUserId);

  ApiKeyRecord insert(ApiKeyRecord record);

  /** Returns {@code false} when no unrevoked key with this id belongs to the owner. */
  boolean markRevoked(String id, String ownerUserId, Instant revokedAt);

  /** Moves {@code last_used_at} forward only; older timestamps are ignored. */
  void touchLastUsed(String id, Instant usedAt);
}
