package com.albatross.adapter.in.web;

import com.albatross.application.port.in.CreateTenantUseCase;
import com.albatross.application.port.in.QueryReadModelsUseCase;
import com.albatross.application.port.out.TenantReadModel.TenantView;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.Result;
import com.albatross.infrastructure.context.RequestContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/tenants")
@Tag(name = "Tenants", description = "Tenant management")
public class TenantController {

    private final CreateTenantUseCase createTenantUseCase;
    private final QueryReadModelsUseCase queryReadModelsUseCase;

    public TenantController(CreateTenantUseCase createTenantUseCase, QueryReadModelsUseCase queryReadModelsUseCase) {
        this.createTenantUseCase = createTenantUseCase;
        this.queryReadModelsUseCase = queryReadModelsUseCase;
    }

    @PostMapping
    @Operation(summary = "Create a tenant", description = "Platform admins only")
    public ResponseEntity<?> createTenant(@Valid @RequestBody CreateTenantRequest request) {
        Result<String, CoreError> result = createTenantUseCase.createTenant(RequestContext.getUser(), request.name());
        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new TenantCreatedResponse(result.getOrThrow()))
            : ErrorResponses.from(result.errorOrNull());
    }

    @GetMapping
    @Operation(summary = "List tenants", description = "Platform admins see every tenant, everyone else their own")
    public ResponseEntity<?> listTenants() {
        Result<List<TenantView>, CoreError> result = queryReadModelsUseCase.listTenants(RequestContext.getUser());
        return result.isSuccess()
            ? ResponseEntity.ok(ListResponse.of(result.getOrThrow().stream().map(TenantResponse::from).toList()))
            : ErrorResponses.from(result.errorOrNull());
    }

    public record CreateTenantRequest(@NotBlank String name) {}

    public record TenantCreatedResponse(@JsonProperty("tenant_id") String tenantId) {}

    public record TenantResponse(
        @JsonProperty("tenant_id") String tenantId,
        String name,
        @JsonProperty("created_at") Instant createdAt
    ) {
        public static TenantResponse from(TenantView tenant) {
            return new TenantResponse(tenant.tenantId(), tenant.name(), tenant.createdAt());
        }
    }
}
