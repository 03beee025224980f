package com.example.auth.repository;

import com.example.auth.model.ApiKeyRecord;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class JdbcApiKeyRepository implements ApiKeyRepository {

  private static final String COLUMNS =
      """
      id, user_id, name, key_hash, key_prefix, permissions,
      expires_at, revoked_at, last_used_at, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<ApiKeyRecord> findByKeyHash(String keyHash) {
    final String sql =
        "SELECT " + COLUMNS + """
        FROM api_keys
        WHERE key_hash = :keyHash
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("keyHash", keyHash);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<ApiKeyRecord> findByOwnerUserId(String ownerUserId) {
    final String sql =
        "SELECT " + COLUMNS + """
        FROM api_keys
        WHERE user_id = :userId
        ORDER BY created_at DESC
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("userId", ownerUserId), this::mapRow);
  }

  @Override
  public ApiKeyRecord insert(ApiKeyRecord record) {
    final String sql =
        """
        INSERT INTO api_keys (
          id, user_id, name, key_hash, key_prefix, permissions, expires_at, created_at)
        VALUES (:id, :userId, :name, :keyHash, :keyPrefix, :permissions, :expiresAt, :createdAt)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("userId", record.ownerUserId())
            .addValue("name", record.displayName())
            .addValue("keyHash", record.keyHash())
            .addValue("keyPrefix", record.keyPrefix())
            .addValue("permissions", record.permissions().stream().sorted().toArray(String[]::new))
            .addValue("expiresAt", toTimestamp(record.expiresAt()))
            .addValue("createdAt", Timestamp.from(record.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  @Override
  public boolean markRevoked(String id, String ownerUserId, Instant revokedAt) {
    final String sql =
        """
        UPDATE api_keys
        SET revoked_at = :revokedAt
        WHERE id = :id AND user_id = :userId AND revoked_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("userId", ownerUserId)
            .addValue("revokedAt", Timestamp.from(revokedAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  @Override
  public void touchLastUsed(String id, Instant usedAt) {
    final String sql =
        """
        UPDATE api_keys
        SET last_used_at = :usedAt
        WHERE id = :id AND (last_used_at IS NULL OR last_used_at < :usedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("usedAt", Timestamp.from(usedAt));
    jdbcTemplate.update(sql, params);
  }

  private ApiKeyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ApiKeyRecord(
        rs.getString("id"),
        rs.getString("user_id"),
        rs.getString("name"),
        rs.getString("key_hash"),
        rs.getString("key_prefix"),
        readPermissions(rs.getArray("permissions")),
        toInstant(rs.getTimestamp("expires_at")),
        toInstant(rs.getTimestamp("revoked_at")),
        toInstant(rs.getTimestamp("last_used_at")),
        rs.getTimestamp("created_at").toInstant());
  }

  private Set<String> readPermissions(Array array) throws SQLException {
    if (array == null) {
      return Set.of();
    }
    try {
      final Object[] values = (Object[]) array.getArray();
      final Set<String> permissions = new LinkedHashSet<>();
      for (Object value : values) {
        if (value instanceof String permission && !permission.isBlank()) {
          permissions.add(permission);
        }
      }
      return permissions;
    } finally {
      array.free();
    }
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
