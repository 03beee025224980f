/*
 * どこで: Auth サービス層
 * 何を: API キーの発行・一覧・失効を扱う
 * なぜ: 生キーは発行時に一度だけ返し、永続化するのは SHA-256 検証子と表示用 prefix のみに限定するため
 */
package com.example.auth.service;

import com.example.auth.model.ApiKeyRecord;
import com.example.auth.repository.ApiKeyRepository;
import com.google.common.annotations.VisibleForTesting;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ApiKeyService {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyService.class);

  @VisibleForTesting static final String KEY_PREFIX = "crm_";
  private static final int KEY_RANDOM_BYTES = 32;
  @VisibleForTesting static final int DISPLAY_PREFIX_LENGTH = 12;
  private static final int MAX_NAME_LENGTH = 100;

  private final ApiKeyRepository apiKeyRepository;
  private final Clock clock;
  private final SecureRandom secureRandom = new SecureRandom();

  public ApiKeyService(ApiKeyRepository apiKeyRepository, Clock clock) {
    this.apiKeyRepository = apiKeyRepository;
    this.clock = clock;
  }

  /**
   * 役割:
   * - 新しい API キーを発行し、検証子のみを保存する。
   *
   * 期待動作:
   * - permissions が空なら全カタログ権限 (ワイルドカードを除く) を付与する。
   * - 未知の権限文字列が含まれる場合は InvalidApiKeyRequestException で拒否する。
   * - expiresInDays が null なら無期限とする。
   */
  public GeneratedApiKey generate(
      String ownerUserId, String name, Collection<String> permissions, Integer expiresInDays) {
    if (ownerUserId == null || ownerUserId.isBlank()) {
      throw new InvalidApiKeyRequestException("owner is required");
    }
    if (name == null || name.isBlank() || name.length() > MAX_NAME_LENGTH) {
      throw new InvalidApiKeyRequestException("name must be 1-" + MAX_NAME_LENGTH + " characters");
    }
    if (expiresInDays != null && expiresInDays <= 0) {
      throw new InvalidApiKeyRequestException("expiresInDays must be positive");
    }
    final Set<String> granted = resolvePermissions(permissions);

    final String rawKey = newRawKey();
    final Instant now = Instant.now(clock);
    final Instant expiresAt =
        expiresInDays == null ? null : now.plus(Duration.ofDays(expiresInDays));
    final ApiKeyRecord saved =
        apiKeyRepository.insert(
            new ApiKeyRecord(
                UUID.randomUUID().toString(),
                ownerUserId,
                name.trim(),
                ApiKeyHasher.hash(rawKey),
                rawKey.substring(0, DISPLAY_PREFIX_LENGTH),
                granted,
                expiresAt,
                null,
                null,
                now));
    logger.info(
        "api key created id={} owner={} prefix={} permissions={}",
        saved.id(),
        ownerUserId,
        saved.keyPrefix(),
        saved.permissions().size());
    return new GeneratedApiKey(rawKey, saved);
  }

  public List<ApiKeyRecord> list(String ownerUserId) {
    return apiKeyRepository.findByOwnerUserId(ownerUserId);
  }

  public void revoke(String ownerUserId, String apiKeyId) {
    if (!apiKeyRepository.markRevoked(apiKeyId, ownerUserId, Instant.now(clock))) {
      throw new ApiKeyNotFoundException("api key not found");
    }
    logger.info("api key revoked id={} owner={}", apiKeyId, ownerUserId);
  }

  private Set<String> resolvePermissions(Collection<String> requested) {
    if (requested == null || requested.isEmpty()) {
      return Set.copyOf(ApiKeyPermissions.CATALOGUE);
    }
    final Set<String> granted = new LinkedHashSet<>();
    for (String permission : requested) {
      final String normalized = permission == null ? "" : permission.trim();
      if (!ApiKeyPermissions.isAssignable(normalized)) {
        throw new InvalidApiKeyRequestException("unknown permission: " + normalized);
      }
      granted.add(normalized);
    }
    return granted;
  }

  private String newRawKey() {
    final byte[] bytes = new byte[KEY_RANDOM_BYTES];
    secureRandom.nextBytes(bytes);
    return KEY_PREFIX + HexFormat.of().formatHex(bytes);
  }
}
