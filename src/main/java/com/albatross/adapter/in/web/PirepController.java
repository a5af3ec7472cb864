package com.albatross.adapter.in.web;

import com.albatross.application.port.in.QueryReadModelsUseCase;
import com.albatross.application.port.in.SubmitPirepUseCase;
import com.albatross.application.port.out.PirepReadModel.PirepView;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.Result;
import com.albatross.infrastructure.context.RequestContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/pireps")
@Tag(name = "Pilot reports", description = "Flight reports filed by tenant pilots")
public class PirepController {

    private final SubmitPirepUseCase submitPirepUseCase;
    private final QueryReadModelsUseCase queryReadModelsUseCase;

    public PirepController(SubmitPirepUseCase submitPirepUseCase, QueryReadModelsUseCase queryReadModelsUseCase) {
        this.submitPirepUseCase = submitPirepUseCase;
        this.queryReadModelsUseCase = queryReadModelsUseCase;
    }

    @PostMapping
    @Operation(summary = "Submit a pilot report", description = "Filed for the caller's own user and tenant")
    public ResponseEntity<?> submitPirep(@Valid @RequestBody SubmitPirepRequest request) {
        Result<String, CoreError> result = submitPirepUseCase.submitPirep(
            RequestContext.getUser(),
            new SubmitPirepUseCase.PirepDetails(
                request.aircraftId(),
                request.departureIcao(),
                request.arrivalIcao(),
                request.flightNumber(),
                request.flightTimeHours(),
                request.remarks()
            ));
        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new PirepCreatedResponse(result.getOrThrow()))
            : ErrorResponses.from(result.errorOrNull());
    }

    @GetMapping
    @Operation(summary = "List pilot reports of a tenant")
    public ResponseEntity<?> listPireps(
            @Parameter(description = "Tenant ID, required for platform admins")
            @RequestParam(name = "tenant_id", required = false) String tenantId) {
        Result<List<PirepView>, CoreError> result = queryReadModelsUseCase.listPireps(RequestContext.getUser(), tenantId);
        return result.isSuccess()
            ? ResponseEntity.ok(ListResponse.of(result.getOrThrow().stream().map(PirepResponse::from).toList()))
            : ErrorResponses.from(result.errorOrNull());
    }

    public record SubmitPirepRequest(
        @JsonProperty("aircraft_id") @NotBlank String aircraftId,
        @JsonProperty("departure_icao") @NotBlank String departureIcao,
        @JsonProperty("arrival_icao") @NotBlank String arrivalIcao,
        @JsonProperty("flight_number") @NotBlank String flightNumber,
        @JsonProperty("flight_time_hours") @NotNull @Positive Double flightTimeHours,
        String remarks
    ) {}

    public record PirepCreatedResponse(@JsonProperty("pirep_id") String pirepId) {}

    public record PirepResponse(
        @JsonProperty("pirep_id") String pirepId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("aircraft_id") String aircraftId,
        @JsonProperty("departure_icao") String departureIcao,
        @JsonProperty("arrival_icao") String arrivalIcao,
        @JsonProperty("flight_number") String flightNumber,
        @JsonProperty("flight_time_hours") double flightTimeHours,
        String remarks,
        @JsonProperty("submitted_at") Instant submittedAt
    ) {
        public static PirepResponse from(PirepView pirep) {
            return new PirepResponse(
                pirep.pirepId(), pirep.userId(), pirep.aircraftId(), pirep.departureIcao(), pirep.arrivalIcao(),
                pirep.flightNumber(), pirep.flightTimeHours(), pirep.remarks(), pirep.submittedAt());
        }
    }
}
