package com.example.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.auth.model.ApiKeyRecord;
import com.example.auth.repository.ApiKeyRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class ApiKeyValidatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
  private static final String RAW_KEY = "crm_" + "ab".repeat(32);

  @Mock private ApiKeyRepository apiKeyRepository;
  @Mock private ApiKeyLastUsedRecorder lastUsedRecorder;

  private ApiKeyValidator validator;

  @BeforeEach
  void setUp() {
    validator =
        new ApiKeyValidator(apiKeyRepository, lastUsedRecorder, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void validKeyIsReturnedAndLastUsedIsRecorded() {
    final ApiKeyRecord record = record(null, null, Set.of("messages:read"));
    when(apiKeyRepository.findByKeyHash(ApiKeyHasher.hash(RAW_KEY)))
        .thenReturn(Optional.of(record));

    final ApiKeyRecord validated = validator.validate(RAW_KEY);

    assertThat(validated).isEqualTo(record);
    verify(lastUsedRecorder).record("key-1", NOW);
  }

  @Test
  void unknownKeyIsNotFound() {
    when(apiKeyRepository.findByKeyHash(anyString())).thenReturn(Optional.empty());

    assertReason(RAW_KEY, ApiKeyValidationException.Reason.NOT_FOUND);
    verify(lastUsedRecorder, never()).record(anyString(), any());
  }

  @Test
  void blankKeyIsNotFoundWithoutLookup() {
    assertReason("  ", ApiKeyValidationException.Reason.NOT_FOUND);
    verify(apiKeyRepository, never()).findByKeyHash(anyString());
  }

  @Test
  void revokedKeyIsRevokedEvenBeforeExpiry() {
    final ApiKeyRecord record =
        record(NOW.plus(Duration.ofDays(30)), NOW.minus(Duration.ofHours(1)), Set.of("*"));
    when(apiKeyRepository.findByKeyHash(anyString())).thenReturn(Optional.of(record));

    assertReason(RAW_KEY, ApiKeyValidationException.Reason.REVOKED);
  }

  @Test
  void revocationWinsOverExpiry() {
    final ApiKeyRecord record =
        record(NOW.minus(Duration.ofDays(1)), NOW.minus(Duration.ofDays(2)), Set.of("*"));
    when(apiKeyRepository.findByKeyHash(anyString())).thenReturn(Optional.of(record));

    assertReason(RAW_KEY, ApiKeyValidationException.Reason.REVOKED);
  }

  @Test
  void expiredKeyIsExpired() {
    final ApiKeyRecord record = record(NOW.minus(Duration.ofSeconds(1)), null, Set.of("*"));
    when(apiKeyRepository.findByKeyHash(anyString())).thenReturn(Optional.of(record));

    assertReason(RAW_KEY, ApiKeyValidationException.Reason.EXPIRED);
    verify(lastUsedRecorder, never()).record(anyString(), any());
  }

  @Test
  void persistenceFailureIsInternalNotNotFound() {
    when(apiKeyRepository.findByKeyHash(anyString()))
        .thenThrow(new QueryTimeoutException("statement timed out"));

    assertReason(RAW_KEY, ApiKeyValidationException.Reason.INTERNAL);
  }

  @Test
  void hasPermissionChecksMembership() {
    final ApiKeyRecord record = record(null, null, Set.of("messages:read"));

    assertThat(validator.hasPermission(record, "messages:read")).isTrue();
    assertThat(validator.hasPermission(record, "send_message")).isFalse();
    assertThat(validator.hasPermission(null, "messages:read")).isFalse();
  }

  private void assertReason(String rawKey, ApiKeyValidationException.Reason reason) {
    assertThatThrownBy(() -> validator.validate(rawKey))
        .isInstanceOfSatisfying(
            ApiKeyValidationException.class, ex -> assertThat(ex.reason()).isEqualTo(reason));
  }

  private static ApiKeyRecord record(
      Instant expiresAt, Instant revokedAt, Set<String> permissions) {
    return new ApiKeyRecord(
        "key-1",
        "user-1",
        "ci",
        ApiKeyHasher.hash(RAW_KEY),
        RAW_KEY.substring(0, 12),
        permissions,
        expiresAt,
        revokedAt,
        null,
        NOW.minus(Duration.ofDays(10)));
  }
}
