package com.albatross.adapter.out.persistence;

import com.albatross.application.port.out.ApiKeyReadModel;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class JdbcApiKeyReadModel implements ApiKeyReadModel {

    private final JdbcTemplate jdbc;

    private static final RowMapper<ApiKeyView> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp revokedAt = rs.getTimestamp("revoked_at");
        return new ApiKeyView(
            rs.getString("key_id"),
            rs.getString("user_id"),
            rs.getString("tenant_id"),
            rs.getString("key_name"),
            rs.getTimestamp("created_at").toInstant(),
            revokedAt != null ? revokedAt.toInstant() : null
        );
    };

    public JdbcApiKeyReadModel(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean insert(ApiKeyView apiKey, String apiKeyHash) {
        int rows = jdbc.update("""
            INSERT INTO user_api_keys (key_id, user_id, tenant_id, key_name, api_key_hash, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (key_id) DO NOTHING
            """,
            apiKey.keyId(),
            apiKey.userId(),
            apiKey.tenantId(),
            apiKey.keyName(),
            apiKeyHash,
            Timestamp.from(apiKey.createdAt())
        );
        return rows > 0;
    }

    @Override
    public int revoke(String keyId, Instant revokedAt) {
        return jdbc.update(
            "UPDATE user_api_keys SET revoked_at = ? WHERE key_id = ? AND revoked_at IS NULL",
            Timestamp.from(revokedAt),
            keyId
        );
    }

    @Override
    public List<ApiKeyView> findByUser(String userId) {
        return jdbc.query("""
            SELECT key_id, user_id, tenant_id, key_name, created_at, revoked_at
            FROM user_api_keys
            WHERE user_id = ?
            ORDER BY created_at DESC
            """,
            ROW_MAPPER,
            userId
        );
    }
}
