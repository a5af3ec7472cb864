package com.albatross.application.port.out;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight change notice pushed to realtime clients after a projection is applied.
 * {@code data} never carries password or key hashes.
 */
public record Notification(
    String eventType,
    Instant timestamp,
    Map<String, Object> data,
    String tenantId,
    String aggregateId,
    Long version
) {
}
