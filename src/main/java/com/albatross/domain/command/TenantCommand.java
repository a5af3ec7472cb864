package com.albatross.domain.command;

public sealed interface TenantCommand {

    record Create(String tenantId, String name) implements TenantCommand {
    }
}
