package com.albatross.domain.model;

/**
 * An encoded event about to be appended. The store assigns the sequence.
 */
public record NewEvent(
    String eventType,
    byte[] payload,
    String tenantId
) {
}
