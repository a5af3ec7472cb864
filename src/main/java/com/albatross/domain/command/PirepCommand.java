package com.albatross.domain.command;

public sealed interface PirepCommand {

    record Submit(
        String pirepId,
        String tenantId,
        String userId,
        String aircraftId,
        String departureIcao,
        String arrivalIcao,
        String flightNumber,
        double flightTimeHours,
        String remarks
    ) implements PirepCommand {
    }
}
