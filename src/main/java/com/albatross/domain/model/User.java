package com.albatross.domain.model;

import com.albatross.domain.command.UserCommand;
import com.albatross.domain.error.UserError;
import com.albatross.domain.event.UserEvent;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User aggregate. Owns credentials and API keys; a user exists once {@code UserRegistered} is applied.
 */
public class User implements Aggregate<UserCommand, UserEvent, UserError> {

    private String userId;
    private String username;
    private String email;
    private String passwordHash;
    private Role role;
    private String tenantId;
    private Instant lastLoginAt;
    private final Map<String, ApiKey> apiKeys = new LinkedHashMap<>();
    private long version;

    public record ApiKey(String keyId, String keyName, String keyHash, Instant createdAt) {
    }

    @Override
    public String aggregateId() {
        return userId;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public void apply(UserEvent event) {
        if (event instanceof UserEvent.Registered registered) {
            this.userId = registered.userId();
            this.username = registered.username();
            this.email = registered.email();
            this.passwordHash = registered.passwordHash();
            this.role = registered.role();
            this.tenantId = registered.tenantId();
        } else if (event instanceof UserEvent.PasswordChanged changed) {
            this.passwordHash = changed.passwordHash();
        } else if (event instanceof UserEvent.ApiKeyGenerated generated) {
            apiKeys.put(generated.keyId(),
                new ApiKey(generated.keyId(), generated.keyName(), generated.apiKeyHash(), generated.occurredAt()));
        } else if (event instanceof UserEvent.ApiKeyRevoked revoked) {
            apiKeys.remove(revoked.keyId());
        } else if (event instanceof UserEvent.LoggedIn loggedIn) {
            this.lastLoginAt = loggedIn.occurredAt();
        }
        version++;
    }

    @Override
    public Result<List<UserEvent>, UserError> handle(UserCommand command) {
        if (command instanceof UserCommand.Register register) {
            return handleRegister(register);
        }
        if (version == 0 || !command.userId().equals(userId)) {
            return Result.failure(new UserError.NotFound(command.userId()));
        }
        if (command instanceof UserCommand.ChangePassword change) {
            return handleChangePassword(change);
        }
        if (command instanceof UserCommand.GenerateApiKey generate) {
            return handleGenerateApiKey(generate);
        }
        if (command instanceof UserCommand.RevokeApiKey revoke) {
            return handleRevokeApiKey(revoke);
        }
        return Result.success(List.of(new UserEvent.LoggedIn(userId, tenantId, Instant.now())));
    }

    private Result<List<UserEvent>, UserError> handleRegister(UserCommand.Register command) {
        if (version > 0) {
            return Result.failure(new UserError.AlreadyExists(userId));
        }
        if (isBlank(command.userId()) || isBlank(command.username())
                || isBlank(command.email()) || isBlank(command.passwordHash())) {
            return Result.failure(new UserError.InvalidInput("User ID, username, email and password are required"));
        }
        if (command.role() == null) {
            return Result.failure(new UserError.InvalidInput("Role is required"));
        }
        boolean hasTenant = !isBlank(command.tenantId());
        if (command.role() == Role.PLATFORM_ADMIN && hasTenant) {
            return Result.failure(new UserError.InvalidInput("PlatformAdmin cannot belong to a tenant"));
        }
        if (command.role() != Role.PLATFORM_ADMIN && !hasTenant) {
            return Result.failure(UserError.TenantIdRequired.INSTANCE);
        }
        return Result.success(List.of(new UserEvent.Registered(
            command.userId(),
            command.username().trim(),
            command.email().trim(),
            command.passwordHash(),
            command.role(),
            hasTenant ? command.tenantId() : null,
            Instant.now()
        )));
    }

    private Result<List<UserEvent>, UserError> handleChangePassword(UserCommand.ChangePassword command) {
        if (isBlank(command.newPasswordHash())) {
            return Result.failure(new UserError.InvalidInput("New password hash cannot be empty"));
        }
        return Result.success(List.of(
            new UserEvent.PasswordChanged(userId, tenantId, command.newPasswordHash(), Instant.now())));
    }

    private Result<List<UserEvent>, UserError> handleGenerateApiKey(UserCommand.GenerateApiKey command) {
        if (isBlank(command.keyId()) || isBlank(command.keyName()) || isBlank(command.apiKeyHash())) {
            return Result.failure(new UserError.InvalidInput("Key id, key name and key hash are required"));
        }
        if (apiKeys.containsKey(command.keyId())) {
            return Result.failure(new UserError.InvalidInput("API key already exists: " + command.keyId()));
        }
        return Result.success(List.of(new UserEvent.ApiKeyGenerated(
            userId, tenantId, command.keyId(), command.keyName().trim(), command.apiKeyHash(), Instant.now())));
    }

    private Result<List<UserEvent>, UserError> handleRevokeApiKey(UserCommand.RevokeApiKey command) {
        if (!apiKeys.containsKey(command.keyId())) {
            return Result.failure(new UserError.ApiKeyNotFound(command.keyId()));
        }
        return Result.success(List.of(
            new UserEvent.ApiKeyRevoked(userId, tenantId, command.keyId(), Instant.now())));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String userId() {
        return userId;
    }

    public String username() {
        return username;
    }

    public String email() {
        return email;
    }

    public String passwordHash() {
        return passwordHash;
    }

    public Role role() {
        return role;
    }

    public String tenantId() {
        return tenantId;
    }

    public Instant lastLoginAt() {
        return lastLoginAt;
    }

    public Map<String, ApiKey> apiKeys() {
        return Collections.unmodifiableMap(apiKeys);
    }

    public boolean hasApiKey(String keyId) {
        return apiKeys.containsKey(keyId);
    }

    public AuthenticatedUser toIdentity() {
        return new AuthenticatedUser(userId, tenantId, role);
    }
}
