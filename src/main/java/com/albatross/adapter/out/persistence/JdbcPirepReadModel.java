package com.albatross.adapter.out.persistence;

import com.albatross.application.port.out.PirepReadModel;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class JdbcPirepReadModel implements PirepReadModel {

    private final JdbcTemplate jdbc;

    private static final RowMapper<PirepView> ROW_MAPPER = (rs, rowNum) -> new PirepView(
        rs.getString("pirep_id"),
        rs.getString("tenant_id"),
        rs.getString("user_id"),
        rs.getString("aircraft_id"),
        rs.getString("departure_icao"),
        rs.getString("arrival_icao"),
        rs.getString("flight_number"),
        rs.getDouble("flight_time_hours"),
        rs.getString("remarks"),
        rs.getTimestamp("submitted_at").toInstant()
    );

    public JdbcPirepReadModel(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean insert(PirepView pirep) {
        int rows = jdbc.update("""
            INSERT INTO pireps (pirep_id, tenant_id, user_id, aircraft_id, departure_icao, arrival_icao,
                                flight_number, flight_time_hours, remarks, submitted_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (pirep_id) DO NOTHING
            """,
            pirep.pirepId(),
            pirep.tenantId(),
            pirep.userId(),
            pirep.aircraftId(),
            pirep.departureIcao(),
            pirep.arrivalIcao(),
            pirep.flightNumber(),
            pirep.flightTimeHours(),
            pirep.remarks(),
            Timestamp.from(pirep.submittedAt())
        );
        return rows > 0;
    }

    @Override
    public List<PirepView> findByTenant(String tenantId) {
        return jdbc.query("""
            SELECT pirep_id, tenant_id, user_id, aircraft_id, departure_icao, arrival_icao,
                   flight_number, flight_time_hours, remarks, submitted_at
            FROM pireps
            WHERE tenant_id = ?
            ORDER BY submitted_at DESC
            """,
            ROW_MAPPER,
            tenantId
        );
    }
}
