package com.albatross.domain.model;

import com.albatross.domain.command.TenantCommand;
import com.albatross.domain.error.TenantError;
import com.albatross.domain.event.TenantEvent;

import java.time.Instant;
import java.util.List;

/**
 * Tenant aggregate. Created once; every later command is rejected.
 */
public class Tenant implements Aggregate<TenantCommand, TenantEvent, TenantError> {

    private String tenantId;
    private String name;
    private Instant createdAt;
    private long version;

    @Override
    public String aggregateId() {
        return tenantId;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public void apply(TenantEvent event) {
        if (event instanceof TenantEvent.Created created) {
            this.tenantId = created.tenantId();
            this.name = created.name();
            this.createdAt = created.occurredAt();
        }
        version++;
    }

    @Override
    public Result<List<TenantEvent>, TenantError> handle(TenantCommand command) {
        TenantCommand.Create create = (TenantCommand.Create) command;
        if (version > 0) {
            return Result.failure(new TenantError.AlreadyExists(tenantId));
        }
        if (create.tenantId() == null || create.tenantId().isBlank()) {
            return Result.failure(new TenantError.InvalidInput("Tenant ID cannot be empty"));
        }
        if (create.name() == null || create.name().isBlank()) {
            return Result.failure(new TenantError.InvalidInput("Tenant name cannot be empty"));
        }
        return Result.success(List.of(new TenantEvent.Created(create.tenantId(), create.name().trim(), Instant.now())));
    }

    public String tenantId() {
        return tenantId;
    }

    public String name() {
        return name;
    }

    public Instant createdAt() {
        return createdAt;
    }
}
