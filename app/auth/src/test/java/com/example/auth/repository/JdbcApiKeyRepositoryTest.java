package com.example.auth.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.auth.model.ApiKeyRecord;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JdbcApiKeyRepositoryTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
  }

  // Postgres の timestamptz はマイクロ秒精度のため、比較用の値も揃える
  private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

  @Autowired private ApiKeyRepository apiKeyRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM api_keys", new MapSqlParameterSource());
  }

  @Test
  void insertAndFindByKeyHash() {
    apiKeyRepository.insert(record("key-1", "user-1", "hash-1", NOW));

    final Optional<ApiKeyRecord> found = apiKeyRepository.findByKeyHash("hash-1");

    assertThat(found).isPresent();
    assertThat(found.get().ownerUserId()).isEqualTo("user-1");
    assertThat(found.get().permissions()).containsExactlyInAnyOrder("messages:read", "chats:*");
    assertThat(found.get().expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
    assertThat(found.get().revokedAt()).isNull();
    assertThat(apiKeyRepository.findByKeyHash("unknown")).isEmpty();
  }

  @Test
  void keyHashIsUnique() {
    apiKeyRepository.insert(record("key-1", "user-1", "hash-1", NOW));

    assertThatThrownBy(() -> apiKeyRepository.insert(record("key-2", "user-2", "hash-1", NOW)))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void findByOwnerListsNewestFirst() {
    apiKeyRepository.insert(record("key-old", "user-1", "hash-1", NOW.minus(Duration.ofDays(2))));
    apiKeyRepository.insert(record("key-new", "user-1", "hash-2", NOW));
    apiKeyRepository.insert(record("key-other", "user-2", "hash-3", NOW));

    final List<ApiKeyRecord> keys = apiKeyRepository.findByOwnerUserId("user-1");

    assertThat(keys).extracting(ApiKeyRecord::id).containsExactly("key-new", "key-old");
  }

  @Test
  void markRevokedOnlyOnceAndOnlyForOwner() {
    apiKeyRepository.insert(record("key-1", "user-1", "hash-1", NOW));

    assertThat(apiKeyRepository.markRevoked("key-1", "user-2", NOW)).isFalse();
    assertThat(apiKeyRepository.markRevoked("key-1", "user-1", NOW)).isTrue();
    assertThat(apiKeyRepository.markRevoked("key-1", "user-1", NOW.plusSeconds(5))).isFalse();

    assertThat(apiKeyRepository.findByKeyHash("hash-1").orElseThrow().revokedAt()).isEqualTo(NOW);
  }

  @Test
  void touchLastUsedOnlyMovesForward() {
    apiKeyRepository.insert(record("key-1", "user-1", "hash-1", NOW));

    apiKeyRepository.touchLastUsed("key-1", NOW.plusSeconds(10));
    apiKeyRepository.touchLastUsed("key-1", NOW.plusSeconds(5));

    assertThat(apiKeyRepository.findByKeyHash("hash-1").orElseThrow().lastUsedAt())
        .isEqualTo(NOW.plusSeconds(10));
  }

  private static ApiKeyRecord record(String id, String userId, String keyHash, Instant createdAt) {
    return new ApiKeyRecord(
        id,
        userId,
        "ci",
        keyHash,
        "crm_01234567",
        Set.of("messages:read", "chats:*"),
        NOW.plus(Duration.ofDays(30)),
        null,
        null,
        createdAt);
  }
}
