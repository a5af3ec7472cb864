package com.albatross.application.port.out;

import java.time.Instant;
import java.util.List;

public interface PirepReadModel {

    boolean insert(PirepView pirep);

    List<PirepView> findByTenant(String tenantId);

    record PirepView(
        String pirepId,
        String tenantId,
        String userId,
        String aircraftId,
        String departureIcao,
        String arrivalIcao,
        String flightNumber,
        double flightTimeHours,
        String remarks,
        Instant submittedAt
    ) {
    }
}
