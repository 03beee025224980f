package com.example.auth.service;

import com.example.auth.model.ApiKeyRecord;
import com.example.auth.repository.ApiKeyRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ApiKeyValidator {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyValidator.class);

  private final ApiKeyRepository apiKeyRepository;
  private final ApiKeyLastUsedRecorder lastUsedRecorder;
  private final Clock clock;

  /**
   * 役割:
   * - 提示された生キーを hash 化し、保存済みの検証子と照合する。
   *
   * 期待動作:
   * - 失効 (revoked) は期限切れより優先して REVOKED を返す。
   * - DB 障害は NOT_FOUND と混同せず INTERNAL とし、再試行はしない。
   * - 成功時のみ last_used_at をベストエフォートで更新する。
   */
  public ApiKeyRecord validate(String rawKey) {
    if (rawKey == null || rawKey.isBlank()) {
      throw new ApiKeyValidationException(
          ApiKeyValidationException.Reason.NOT_FOUND, "api key not found");
    }
    final String keyHash = ApiKeyHasher.hash(rawKey);
    final Optional<ApiKeyRecord> found;
    try {
      found = apiKeyRepository.findByKeyHash(keyHash);
    } catch (DataAccessException ex) {
      logger.error("api key lookup failed", ex);
      throw new ApiKeyValidationException(
          ApiKeyValidationException.Reason.INTERNAL, "api key lookup failed", ex);
    }

    final ApiKeyRecord record =
        found
            .filter(candidate -> ApiKeyHasher.matches(keyHash, candidate.keyHash()))
            .orElseThrow(
                () ->
                    new ApiKeyValidationException(
                        ApiKeyValidationException.Reason.NOT_FOUND, "api key not found"));

    final Instant now = Instant.now(clock);
    if (record.isRevoked()) {
      logger.info("revoked api key presented id={} prefix={}", record.id(), record.keyPrefix());
      throw new ApiKeyValidationException(
          ApiKeyValidationException.Reason.REVOKED, "api key has been revoked");
    }
    if (record.isExpiredAt(now)) {
      logger.info("expired api key presented id={} prefix={}", record.id(), record.keyPrefix());
      throw new ApiKeyValidationException(
          ApiKeyValidationException.Reason.EXPIRED, "api key has expired");
    }

    lastUsedRecorder.record(record.id(), now);
    return record;
  }

  public boolean hasPermission(ApiKeyRecord record, String permission) {
    return record != null && ApiKeyPermissions.grants(record.permissions(), permission);
  }
}
