package com.albatross.application.port.in;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;

public interface SubmitPirepUseCase {

    /**
     * Submits a report for the caller's own user and tenant.
     */
    Result<String, CoreError> submitPirep(AuthenticatedUser actor, PirepDetails details);

    record PirepDetails(
        String aircraftId,
        String departureIcao,
        String arrivalIcao,
        String flightNumber,
        double flightTimeHours,
        String remarks
    ) {
    }
}
