package com.albatross.application.port.out;

import com.albatross.domain.model.StoredEvent;

import java.time.Instant;
import java.util.List;

/**
 * Markers written next to each stored event until the bus has confirmed it.
 */
public interface OutboxRepository {

    /**
     * Unpublished events whose marker is older than {@code olderThan}, oldest first.
     * The JDBC variant locks the returned rows until the surrounding transaction ends.
     */
    List<StoredEvent> findUnpublished(Instant olderThan, int limit);

    void markPublished(String aggregateId, List<Long> sequences);

    void deleteProcessedOlderThan(Instant threshold);

    long countUnpublished();
}
