package com.albatross.domain.event;

import com.albatross.domain.model.Role;

import java.time.Instant;

public sealed interface UserEvent extends DomainEvent {

    String userId();

    @Override
    default String aggregateId() {
        return userId();
    }

    record Registered(
        String userId,
        String username,
        String email,
        String passwordHash,
        Role role,
        String tenantId,
        Instant occurredAt
    ) implements UserEvent {
    }

    record PasswordChanged(
        String userId,
        String tenantId,
        String passwordHash,
        Instant occurredAt
    ) implements UserEvent {
    }

    record ApiKeyGenerated(
        String userId,
        String tenantId,
        String keyId,
        String keyName,
        String apiKeyHash,
        Instant occurredAt
    ) implements UserEvent {
    }

    record ApiKeyRevoked(
        String userId,
        String tenantId,
        String keyId,
        Instant occurredAt
    ) implements UserEvent {
    }

    record LoggedIn(
        String userId,
        String tenantId,
        Instant occurredAt
    ) implements UserEvent {
    }
}
