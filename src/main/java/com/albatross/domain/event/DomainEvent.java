package com.albatross.domain.event;

import java.time.Instant;

public sealed interface DomainEvent permits UserEvent, TenantEvent, PirepEvent {

    String aggregateId();

    /**
     * Tenant the event belongs to, or null for platform-level users.
     */
    String tenantId();

    Instant occurredAt();

    default String eventType() {
        return EventType.of(this).typeName();
    }
}
