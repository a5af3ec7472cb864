package com.albatross.adapter.out.persistence;

import com.albatross.application.port.out.UserReadModel;
import com.albatross.domain.model.Role;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcUserReadModel implements UserReadModel {

    private static final String COLUMNS =
        "user_id, tenant_id, username, email, role, password_hash, created_at, last_login_at";

    private final JdbcTemplate jdbc;

    private static final RowMapper<UserView> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp lastLogin = rs.getTimestamp("last_login_at");
        return new UserView(
            rs.getString("user_id"),
            rs.getString("tenant_id"),
            rs.getString("username"),
            rs.getString("email"),
            Role.parse(rs.getString("role")).orElseThrow(() -> new IllegalStateException("Unknown role in users table")),
            rs.getString("password_hash"),
            rs.getTimestamp("created_at").toInstant(),
            lastLogin != null ? lastLogin.toInstant() : null
        );
    };

    public JdbcUserReadModel(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean insert(UserView user) {
        int rows = jdbc.update("""
            INSERT INTO users (user_id, tenant_id, username, email, role, password_hash, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (user_id) DO NOTHING
            """,
            user.userId(),
            user.tenantId(),
            user.username(),
            user.email(),
            user.role().label(),
            user.passwordHash(),
            Timestamp.from(user.createdAt())
        );
        return rows > 0;
    }

    @Override
    public int updatePasswordHash(String userId, String passwordHash) {
        return jdbc.update(
            "UPDATE users SET password_hash = ?, updated_at = NOW() WHERE user_id = ?",
            passwordHash,
            userId
        );
    }

    @Override
    public int updateLastLogin(String userId, Instant lastLoginAt) {
        return jdbc.update(
            "UPDATE users SET last_login_at = ? WHERE user_id = ?",
            Timestamp.from(lastLoginAt),
            userId
        );
    }

    @Override
    public Optional<UserView> findById(String userId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE user_id = ?", ROW_MAPPER, userId)
            .stream().findFirst();
    }

    @Override
    public Optional<UserView> findByUsername(String username) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE username = ?", ROW_MAPPER, username)
            .stream().findFirst();
    }

    @Override
    public Optional<UserView> findByEmail(String email) {
        return jdbc.query("SELECT " + COLUMNS + " FROM users WHERE email = ?", ROW_MAPPER, email)
            .stream().findFirst();
    }

    @Override
    public List<UserView> findAll() {
        return jdbc.query("SELECT " + COLUMNS + " FROM users ORDER BY created_at DESC", ROW_MAPPER);
    }

    @Override
    public List<UserView> findByTenant(String tenantId) {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM users WHERE tenant_id = ? ORDER BY created_at DESC",
            ROW_MAPPER,
            tenantId
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count != null ? count : 0;
    }
}
