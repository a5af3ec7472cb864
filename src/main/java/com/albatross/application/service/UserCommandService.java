package com.albatross.application.service;

import com.albatross.application.port.in.ChangePasswordUseCase;
import com.albatross.application.port.in.ManageApiKeysUseCase;
import com.albatross.application.port.in.RegisterUserUseCase;
import com.albatross.application.port.out.CredentialStore;
import com.albatross.application.port.out.CredentialStoreException;
import com.albatross.application.port.out.IdGenerator;
import com.albatross.application.port.out.PasswordHasher;
import com.albatross.application.port.out.SecretGenerator;
import com.albatross.application.port.out.UserReadModel;
import com.albatross.domain.authz.AccessPolicy;
import com.albatross.domain.authz.AccessRequirement;
import com.albatross.domain.command.UserCommand;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.Role;
import com.albatross.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class UserCommandService implements RegisterUserUseCase, ChangePasswordUseCase, ManageApiKeysUseCase {

    private static final Logger log = LoggerFactory.getLogger(UserCommandService.class);

    private final AggregateCommandExecutor executor;
    private final UserReadModel userReadModel;
    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final SecretGenerator secretGenerator;
    private final IdGenerator idGenerator;

    public UserCommandService(
            AggregateCommandExecutor executor,
            UserReadModel userReadModel,
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            SecretGenerator secretGenerator,
            IdGenerator idGenerator) {
        this.executor = executor;
        this.userReadModel = userReadModel;
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.secretGenerator = secretGenerator;
        this.idGenerator = idGenerator;
    }

    @Override
    public Result<String, CoreError> registerUser(
            AuthenticatedUser actor, String username, String email, String password, Role role, String tenantId) {
        log.debug("Registering user: username={}, role={}, tenantId={}", username, role, tenantId);

        Result<Void, CoreError> allowed = role == Role.PLATFORM_ADMIN
            ? AccessPolicy.authorize(actor, AccessRequirement.PlatformAdminOnly.INSTANCE)
            : AccessPolicy.authorize(actor, new AccessRequirement.SelfOrTenantAdmin(null, tenantId));
        if (allowed.isFailure()) {
            log.warn("Registration denied: actor={}, tenantId={}", actor != null ? actor.userId() : null, tenantId);
            return Result.failure(allowed.errorOrNull());
        }
        return register(username, email, password, role, tenantId);
    }

    @Override
    public Result<String, CoreError> bootstrapAdmin(String username, String email, String password) {
        long existing;
        try {
            existing = userReadModel.count();
        } catch (DataAccessException e) {
            log.error("Failed to count users for bootstrap", e);
            return Result.failure(new CoreError.Infrastructure("Failed to read users: " + e.getMessage()));
        }
        if (existing > 0) {
            log.warn("Bootstrap rejected: {} users already exist", existing);
            return Result.failure(new CoreError.Forbidden("Bootstrap is only allowed before any user exists"));
        }
        log.info("Bootstrapping platform admin: username={}", username);
        return register(username, email, password, Role.PLATFORM_ADMIN, null);
    }

    private Result<String, CoreError> register(
            String username, String email, String password, Role role, String tenantId) {
        if (password == null || password.isBlank()) {
            return Result.failure(new CoreError.Validation("Password is required"));
        }
        if (username != null && userReadModel.findByUsername(username.trim()).isPresent()) {
            return Result.failure(new CoreError.AlreadyExists("Username already taken: " + username.trim()));
        }
        // users.email is unique in the read model; a duplicate would never project
        if (email != null && userReadModel.findByEmail(email.trim()).isPresent()) {
            return Result.failure(new CoreError.AlreadyExists("Email already registered: " + email.trim()));
        }

        String userId = idGenerator.generate().toString();
        UserCommand.Register command = new UserCommand.Register(
            userId, username, email, passwordHasher.hash(password), role, tenantId);

        return executor.execute(AggregateDefinition.USER, userId, command)
            .map(outcome -> userId);
    }

    @Override
    public Result<Void, CoreError> changePassword(AuthenticatedUser actor, String userId, String newPassword) {
        if (newPassword == null || newPassword.isBlank()) {
            return Result.failure(new CoreError.Validation("New password is required"));
        }
        UserCommand.ChangePassword command = new UserCommand.ChangePassword(userId, passwordHasher.hash(newPassword));
        return executor.execute(AggregateDefinition.USER, userId, command, user -> authorizeOn(actor, userId, user))
            .map(outcome -> null);
    }

    @Override
    public Result<GeneratedApiKey, CoreError> generateApiKey(AuthenticatedUser actor, String userId, String keyName) {
        String keyId = "key_" + idGenerator.generate();
        String secret = secretGenerator.newSecret();
        UserCommand.GenerateApiKey command =
            new UserCommand.GenerateApiKey(userId, keyId, keyName, secretGenerator.digest(secret));

        var result = executor.execute(AggregateDefinition.USER, userId, command, user -> authorizeOn(actor, userId, user));
        if (result.isFailure()) {
            return Result.failure(result.errorOrNull());
        }

        User user = result.getOrThrow().aggregate();
        try {
            credentialStore.store(secret, user.toIdentity(), null);
            credentialStore.indexKey(keyId, secret);
        } catch (CredentialStoreException e) {
            log.error("API key persisted but not cached: userId={}, keyId={}", userId, keyId, e);
            return Result.failure(new CoreError.Infrastructure("Failed to cache API key: " + e.getMessage()));
        }

        log.info("API key generated: userId={}, keyId={}", userId, keyId);
        return Result.success(new GeneratedApiKey(keyId, secret));
    }

    @Override
    public Result<Void, CoreError> revokeApiKey(AuthenticatedUser actor, String userId, String keyId) {
        UserCommand.RevokeApiKey command = new UserCommand.RevokeApiKey(userId, keyId);
        var result = executor.execute(AggregateDefinition.USER, userId, command, user -> authorizeOn(actor, userId, user));
        if (result.isFailure()) {
            return Result.failure(result.errorOrNull());
        }

        try {
            credentialStore.tokenForKey(keyId).ifPresent(credentialStore::revoke);
            credentialStore.removeKeyIndex(keyId);
        } catch (CredentialStoreException e) {
            log.error("API key revoked but still cached: userId={}, keyId={}", userId, keyId, e);
            return Result.failure(new CoreError.Infrastructure("Failed to evict API key: " + e.getMessage()));
        }

        log.info("API key revoked: userId={}, keyId={}", userId, keyId);
        return Result.success(null);
    }

    private static Result<Void, CoreError> authorizeOn(AuthenticatedUser actor, String targetUserId, User target) {
        if (target.version() == 0) {
            return Result.failure(new CoreError.NotFound("User not found: " + targetUserId));
        }
        return AccessPolicy.authorize(actor, new AccessRequirement.SelfOrTenantAdmin(targetUserId, target.tenantId()));
    }
}
