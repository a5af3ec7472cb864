package com.albatross.domain.event;

import java.time.Instant;

public sealed interface PirepEvent extends DomainEvent {

    record Submitted(
        String pirepId,
        String tenantId,
        String userId,
        String aircraftId,
        String departureIcao,
        String arrivalIcao,
        String flightNumber,
        double flightTimeHours,
        String remarks,
        Instant occurredAt
    ) implements PirepEvent {

        @Override
        public String aggregateId() {
            return pirepId;
        }
    }
}
