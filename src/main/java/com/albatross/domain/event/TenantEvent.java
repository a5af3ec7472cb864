package com.albatross.domain.event;

import java.time.Instant;

public sealed interface TenantEvent extends DomainEvent {

    record Created(
        String tenantId,
        String name,
        Instant occurredAt
    ) implements TenantEvent {

        @Override
        public String aggregateId() {
            return tenantId;
        }
    }
}
