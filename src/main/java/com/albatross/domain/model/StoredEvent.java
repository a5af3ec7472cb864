package com.albatross.domain.model;

/**
 * One persisted entry of an aggregate's log. For a fixed aggregate id, {@code sequence}
 * starts at 1 and increases without gaps.
 */
public record StoredEvent(
    String aggregateId,
    long sequence,
    String eventType,
    byte[] payload
) {
}
