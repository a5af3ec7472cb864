package com.albatross.adapter.out.persistence;

import com.albatross.application.port.out.EventStore;
import com.albatross.application.port.out.OutboxRepository;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.NewEvent;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL event log. The version check and the inserts share one SERIALIZABLE transaction;
 * a serialization failure or a duplicate {@code (aggregate_id, sequence)} means another writer won.
 * Each appended event gets an {@code event_outbox} marker in the same transaction.
 */
@Repository
@ConditionalOnProperty(name = "app.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcEventStore implements EventStore, OutboxRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final RowMapper<StoredEvent> ROW_MAPPER = (rs, rowNum) -> new StoredEvent(
        rs.getString("aggregate_id"),
        rs.getLong("sequence"),
        rs.getString("event_type"),
        rs.getBytes("payload")
    );

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public JdbcEventStore(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
    }

    @Override
    public List<StoredEvent> load(String aggregateId) {
        return jdbc.query(
            "SELECT aggregate_id, sequence, event_type, payload FROM events WHERE aggregate_id = ? ORDER BY sequence ASC",
            ROW_MAPPER,
            aggregateId
        );
    }

    @Override
    public Result<Long, CoreError> save(String aggregateId, long expectedVersion, List<NewEvent> events) {
        if (events.isEmpty()) {
            return Result.success(expectedVersion);
        }
        try {
            return transactionTemplate.execute(status -> {
                long current = currentVersion(aggregateId);
                if (current != expectedVersion) {
                    status.setRollbackOnly();
                    log.debug("Version mismatch: aggregateId={}, expected={}, actual={}", aggregateId, expectedVersion, current);
                    return Result.failure(new CoreError.Concurrency(expectedVersion, current));
                }
                append(aggregateId, current, events);
                return Result.success(current + events.size());
            });
        } catch (DuplicateKeyException | ConcurrencyFailureException e) {
            long actual = currentVersion(aggregateId);
            log.warn("Concurrent append lost: aggregateId={}, expected={}, actual={}", aggregateId, expectedVersion, actual);
            return Result.failure(new CoreError.Concurrency(expectedVersion, actual));
        }
    }

    private void append(String aggregateId, long current, List<NewEvent> events) {
        Timestamp now = Timestamp.from(Instant.now());
        List<Object[]> eventRows = new ArrayList<>(events.size());
        List<Object[]> outboxRows = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            NewEvent event = events.get(i);
            long sequence = current + i + 1;
            eventRows.add(new Object[]{aggregateId, sequence, event.eventType(), event.payload(), event.tenantId(), now});
            outboxRows.add(new Object[]{aggregateId, sequence, now});
        }
        jdbc.batchUpdate(
            "INSERT INTO events (aggregate_id, sequence, event_type, payload, tenant_id, timestamp) VALUES (?, ?, ?, ?, ?, ?)",
            eventRows
        );
        jdbc.batchUpdate(
            "INSERT INTO event_outbox (aggregate_id, sequence, created_at) VALUES (?, ?, ?)",
            outboxRows
        );
    }

    @Override
    public long currentVersion(String aggregateId) {
        Long version = jdbc.queryForObject(
            "SELECT COALESCE(MAX(sequence), 0) FROM events WHERE aggregate_id = ?",
            Long.class,
            aggregateId
        );
        return version != null ? version : 0;
    }

    @Override
    public List<StoredEvent> findUnpublished(Instant olderThan, int limit) {
        return jdbc.query("""
            SELECT e.aggregate_id, e.sequence, e.event_type, e.payload
            FROM event_outbox o
            JOIN events e ON e.aggregate_id = o.aggregate_id AND e.sequence = o.sequence
            WHERE o.processed_at IS NULL AND o.created_at < ?
            ORDER BY o.created_at, o.aggregate_id, o.sequence
            LIMIT ?
            FOR UPDATE OF o SKIP LOCKED
            """,
            ROW_MAPPER,
            Timestamp.from(olderThan),
            limit
        );
    }

    @Override
    public void markPublished(String aggregateId, List<Long> sequences) {
        if (sequences.isEmpty()) {
            return;
        }
        String placeholders = String.join(",", sequences.stream().map(s -> "?").toList());
        String sql = "UPDATE event_outbox SET processed_at = NOW() WHERE processed_at IS NULL AND aggregate_id = ? AND sequence IN (" + placeholders + ")";
        List<Object> params = new ArrayList<>(sequences.size() + 1);
        params.add(aggregateId);
        params.addAll(sequences);
        jdbc.update(sql, params.toArray());
    }

    @Override
    public void deleteProcessedOlderThan(Instant threshold) {
        jdbc.update(
            "DELETE FROM event_outbox WHERE processed_at IS NOT NULL AND processed_at < ?",
            Timestamp.from(threshold)
        );
    }

    @Override
    public long countUnpublished() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM event_outbox WHERE processed_at IS NULL",
            Long.class
        );
        return count != null ? count : 0;
    }
}
