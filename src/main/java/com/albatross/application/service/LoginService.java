package com.albatross.application.service;

import com.albatross.application.port.in.LoginUseCase;
import com.albatross.application.port.out.CredentialStore;
import com.albatross.application.port.out.CredentialStoreException;
import com.albatross.application.port.out.PasswordHasher;
import com.albatross.application.port.out.UserReadModel;
import com.albatross.application.port.out.UserReadModel.UserView;
import com.albatross.domain.command.UserCommand;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;
import com.albatross.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

@Service
public class LoginService implements LoginUseCase {

    private static final Logger log = LoggerFactory.getLogger(LoginService.class);

    private static final CoreError INVALID_CREDENTIALS = new CoreError.Unauthorized("Invalid username or password");

    private final AggregateCommandExecutor executor;
    private final UserReadModel userReadModel;
    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final AppProperties appProperties;

    public LoginService(
            AggregateCommandExecutor executor,
            UserReadModel userReadModel,
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            AppProperties appProperties) {
        this.executor = executor;
        this.userReadModel = userReadModel;
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.appProperties = appProperties;
    }

    @Override
    public Result<Session, CoreError> login(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            return Result.failure(new CoreError.Validation("Username and password are required"));
        }
        log.info("Login attempt: username={}", username);

        Optional<UserView> found;
        try {
            found = userReadModel.findByUsername(username.trim());
        } catch (DataAccessException e) {
            log.error("User lookup failed during login", e);
            return Result.failure(new CoreError.Infrastructure("User lookup failed: " + e.getMessage()));
        }
        if (found.isEmpty() || !passwordHasher.verify(password, found.get().passwordHash())) {
            log.warn("Login failed: username={}", username);
            return Result.failure(INVALID_CREDENTIALS);
        }

        UserView user = found.get();
        var recorded = executor.execute(AggregateDefinition.USER, user.userId(), new UserCommand.Login(user.userId()));
        if (recorded.isFailure()) {
            return Result.failure(recorded.errorOrNull());
        }

        String token = "api-key-" + UUID.randomUUID();
        AuthenticatedUser identity = recorded.getOrThrow().aggregate().toIdentity();
        try {
            credentialStore.store(token, identity, Duration.ofSeconds(appProperties.getCredentials().getSessionTtlSeconds()));
        } catch (CredentialStoreException e) {
            log.error("Failed to cache session token: userId={}", user.userId(), e);
            return Result.failure(new CoreError.Infrastructure("Failed to create session: " + e.getMessage()));
        }

        log.info("Login succeeded: userId={}, role={}", user.userId(), identity.role().label());
        return Result.success(new Session(token, user.userId()));
    }
}
