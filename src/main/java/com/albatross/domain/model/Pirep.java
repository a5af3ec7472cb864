package com.albatross.domain.model;

import com.albatross.domain.command.PirepCommand;
import com.albatross.domain.error.PirepError;
import com.albatross.domain.event.PirepEvent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pilot report. Submitted once and immutable afterwards.
 */
public class Pirep implements Aggregate<PirepCommand, PirepEvent, PirepError> {

    private String pirepId;
    private String tenantId;
    private String userId;
    private String aircraftId;
    private String departureIcao;
    private String arrivalIcao;
    private String flightNumber;
    private double flightTimeHours;
    private String remarks;
    private Instant submittedAt;
    private long version;

    @Override
    public String aggregateId() {
        return pirepId;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public void apply(PirepEvent event) {
        if (event instanceof PirepEvent.Submitted submitted) {
            this.pirepId = submitted.pirepId();
            this.tenantId = submitted.tenantId();
            this.userId = submitted.userId();
            this.aircraftId = submitted.aircraftId();
            this.departureIcao = submitted.departureIcao();
            this.arrivalIcao = submitted.arrivalIcao();
            this.flightNumber = submitted.flightNumber();
            this.flightTimeHours = submitted.flightTimeHours();
            this.remarks = submitted.remarks();
            this.submittedAt = submitted.occurredAt();
        }
        version++;
    }

    @Override
    public Result<List<PirepEvent>, PirepError> handle(PirepCommand command) {
        PirepCommand.Submit submit = (PirepCommand.Submit) command;
        if (version > 0) {
            return Result.failure(new PirepError.AlreadyExists(pirepId));
        }
        Map<String, String> required = new LinkedHashMap<>();
        required.put("pirepId", submit.pirepId());
        required.put("tenantId", submit.tenantId());
        required.put("userId", submit.userId());
        required.put("aircraftId", submit.aircraftId());
        required.put("departureIcao", submit.departureIcao());
        required.put("arrivalIcao", submit.arrivalIcao());
        required.put("flightNumber", submit.flightNumber());
        for (Map.Entry<String, String> field : required.entrySet()) {
            if (field.getValue() == null || field.getValue().isBlank()) {
                return Result.failure(new PirepError.InvalidInput(field.getKey() + " is required"));
            }
        }
        if (!(submit.flightTimeHours() > 0)) {
            return Result.failure(new PirepError.InvalidInput("flightTimeHours must be positive"));
        }
        return Result.success(List.of(new PirepEvent.Submitted(
            submit.pirepId(),
            submit.tenantId(),
            submit.userId(),
            submit.aircraftId(),
            submit.departureIcao().trim().toUpperCase(),
            submit.arrivalIcao().trim().toUpperCase(),
            submit.flightNumber().trim(),
            submit.flightTimeHours(),
            submit.remarks(),
            Instant.now()
        )));
    }

    public String pirepId() {
        return pirepId;
    }

    public String tenantId() {
        return tenantId;
    }

    public String userId() {
        return userId;
    }

    public String aircraftId() {
        return aircraftId;
    }

    public String departureIcao() {
        return departureIcao;
    }

    public String arrivalIcao() {
        return arrivalIcao;
    }

    public String flightNumber() {
        return flightNumber;
    }

    public double flightTimeHours() {
        return flightTimeHours;
    }

    public String remarks() {
        return remarks;
    }

    public Instant submittedAt() {
        return submittedAt;
    }
}
