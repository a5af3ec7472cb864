package com.albatross.adapter.out.persistence;

import com.albatross.application.port.out.TenantReadModel;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcTenantReadModel implements TenantReadModel {

    private final JdbcTemplate jdbc;

    private static final RowMapper<TenantView> ROW_MAPPER = (rs, rowNum) -> new TenantView(
        rs.getString("tenant_id"),
        rs.getString("name"),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcTenantReadModel(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean insert(TenantView tenant) {
        int rows = jdbc.update("""
            INSERT INTO tenants (tenant_id, name, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (tenant_id) DO NOTHING
            """,
            tenant.tenantId(),
            tenant.name(),
            Timestamp.from(tenant.createdAt())
        );
        return rows > 0;
    }

    @Override
    public Optional<TenantView> findById(String tenantId) {
        return jdbc.query(
            "SELECT tenant_id, name, created_at FROM tenants WHERE tenant_id = ?",
            ROW_MAPPER,
            tenantId
        ).stream().findFirst();
    }

    @Override
    public List<TenantView> findAll() {
        return jdbc.query("SELECT tenant_id, name, created_at FROM tenants ORDER BY created_at DESC", ROW_MAPPER);
    }
}
