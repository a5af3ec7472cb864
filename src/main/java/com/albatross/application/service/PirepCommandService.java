package com.albatross.application.service;

import com.albatross.application.port.in.SubmitPirepUseCase;
import com.albatross.application.port.out.IdGenerator;
import com.albatross.domain.command.PirepCommand;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PirepCommandService implements SubmitPirepUseCase {

    private static final Logger log = LoggerFactory.getLogger(PirepCommandService.class);

    private final AggregateCommandExecutor executor;
    private final IdGenerator idGenerator;

    public PirepCommandService(AggregateCommandExecutor executor, IdGenerator idGenerator) {
        this.executor = executor;
        this.idGenerator = idGenerator;
    }

    @Override
    public Result<String, CoreError> submitPirep(AuthenticatedUser actor, PirepDetails details) {
        if (actor == null) {
            return Result.failure(new CoreError.Unauthorized("Authentication required"));
        }
        if (!actor.hasTenant()) {
            return Result.failure(new CoreError.Validation("Pilot reports can only be filed by tenant members"));
        }

        String pirepId = idGenerator.generate().toString();
        PirepCommand.Submit command = new PirepCommand.Submit(
            pirepId,
            actor.tenantId(),
            actor.userId(),
            details.aircraftId(),
            details.departureIcao(),
            details.arrivalIcao(),
            details.flightNumber(),
            details.flightTimeHours(),
            details.remarks()
        );
        log.debug("Submitting pirep: pirepId={}, userId={}, flight={}", pirepId, actor.userId(), details.flightNumber());
        return executor.execute(AggregateDefinition.PIREP, pirepId, command)
            .map(outcome -> pirepId);
    }
}
