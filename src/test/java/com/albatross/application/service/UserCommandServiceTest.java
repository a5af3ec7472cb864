package com.albatross.application.service;

import com.albatross.adapter.out.cache.InMemoryCredentialStore;
import com.albatross.adapter.out.persistence.InMemoryEventStore;
import com.albatross.adapter.out.serialization.JacksonEventCodec;
import com.albatross.application.port.in.ManageApiKeysUseCase.GeneratedApiKey;
import com.albatross.application.port.out.EventPublisher;
import com.albatross.application.port.out.IdGenerator;
import com.albatross.application.port.out.MetricsPort;
import com.albatross.application.port.out.PasswordHasher;
import com.albatross.application.port.out.SecretGenerator;
import com.albatross.application.port.out.UserReadModel;
import com.albatross.application.port.out.UserReadModel.UserView;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Role;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("UserCommandService")
class UserCommandServiceTest {

    private static final String TENANT_ID = "t-1";
    private static final AuthenticatedUser PLATFORM_ADMIN = new AuthenticatedUser("admin", null, Role.PLATFORM_ADMIN);
    private static final AuthenticatedUser TENANT_ADMIN = new AuthenticatedUser("ta", TENANT_ID, Role.TENANT_ADMIN);

    @Mock
    private UserReadModel userReadModel;

    @Mock
    private PasswordHasher passwordHasher;

    @Mock
    private SecretGenerator secretGenerator;

    @Mock
    private IdGenerator idGenerator;

    @Mock
    private EventPublisher eventPublisher;

    @Mock
    private MetricsPort metrics;

    private InMemoryEventStore store;
    private InMemoryCredentialStore credentialStore;
    private UserCommandService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        credentialStore = new InMemoryCredentialStore();
        AggregateCommandExecutor executor = new AggregateCommandExecutor(
            store, store, eventPublisher, new JacksonEventCodec(new ObjectMapper().registerModule(new JavaTimeModule())), metrics);
        service = new UserCommandService(executor, userReadModel, credentialStore, passwordHasher, secretGenerator, idGenerator);

        when(idGenerator.generate()).thenAnswer(invocation -> UUID.randomUUID());
        when(passwordHasher.hash(anyString())).thenAnswer(invocation -> "hashed:" + invocation.getArgument(0));
        when(secretGenerator.newSecret()).thenReturn("s3cret-value");
        when(secretGenerator.digest("s3cret-value")).thenReturn("digest");
        when(userReadModel.findByUsername(anyString())).thenReturn(Optional.empty());
        when(userReadModel.findByEmail(anyString())).thenReturn(Optional.empty());
    }

    private String registerPilot() {
        return service.registerUser(TENANT_ADMIN, "maverick", "mav@example.com", "pw", Role.PILOT, TENANT_ID).getOrThrow();
    }

    @Nested
    @DisplayName("registerUser")
    class RegisterUserTests {

        @Test
        @DisplayName("Should let a tenant admin register a pilot in their tenant")
        void shouldRegisterPilot() {
            // When
            String userId = registerPilot();

            // Then
            assertEquals(1, store.currentVersion(userId));
            verify(eventPublisher).publish(eq("user." + userId), any());
        }

        @Test
        @DisplayName("Should forbid a tenant admin registering into another tenant")
        void shouldForbidOtherTenant() {
            // When
            var result = service.registerUser(TENANT_ADMIN, "x", "x@example.com", "pw", Role.PILOT, "t-2");

            // Then
            assertInstanceOf(CoreError.Forbidden.class, result.errorOrNull());
        }

        @Test
        @DisplayName("Should let only platform admins register platform admins")
        void shouldGuardPlatformAdminRole() {
            assertInstanceOf(CoreError.Forbidden.class,
                service.registerUser(TENANT_ADMIN, "root2", "r@example.com", "pw", Role.PLATFORM_ADMIN, null).errorOrNull());
            assertTrue(service.registerUser(PLATFORM_ADMIN, "root2", "r@example.com", "pw", Role.PLATFORM_ADMIN, null).isSuccess());
        }

        @Test
        @DisplayName("Should reject a username that is already taken")
        void shouldRejectTakenUsername() {
            // Given
            when(userReadModel.findByUsername("maverick")).thenReturn(Optional.of(
                new UserView("u-0", TENANT_ID, "maverick", "m@example.com", Role.PILOT, "h", Instant.now(), null)));

            // When
            var result = service.registerUser(TENANT_ADMIN, "maverick", "mav@example.com", "pw", Role.PILOT, TENANT_ID);

            // Then
            assertInstanceOf(CoreError.AlreadyExists.class, result.errorOrNull());
        }

        @Test
        @DisplayName("Should reject an email that is already registered")
        void shouldRejectTakenEmail() {
            // Given
            when(userReadModel.findByEmail("mav@example.com")).thenReturn(Optional.of(
                new UserView("u-0", TENANT_ID, "goose", "mav@example.com", Role.PILOT, "h", Instant.now(), null)));

            // When
            var result = service.registerUser(TENANT_ADMIN, "maverick", "mav@example.com", "pw", Role.PILOT, TENANT_ID);

            // Then
            assertInstanceOf(CoreError.AlreadyExists.class, result.errorOrNull());
            assertTrue(result.errorOrNull().message().contains("mav@example.com"));
            verify(eventPublisher, never()).publish(anyString(), any());
        }

        @Test
        @DisplayName("Should require an actor")
        void shouldRequireActor() {
            var result = service.registerUser(null, "x", "x@example.com", "pw", Role.PILOT, TENANT_ID);
            assertInstanceOf(CoreError.Unauthorized.class, result.errorOrNull());
        }
    }

    @Nested
    @DisplayName("bootstrapAdmin")
    class BootstrapTests {

        @Test
        @DisplayName("Should create the first platform admin")
        void shouldBootstrapWhenEmpty() {
            // Given
            when(userReadModel.count()).thenReturn(0L);

            // When
            var result = service.bootstrapAdmin("root", "root@example.com", "pw");

            // Then
            assertTrue(result.isSuccess());
        }

        @Test
        @DisplayName("Should refuse once any user exists")
        void shouldRefuseWhenUsersExist() {
            // Given
            when(userReadModel.count()).thenReturn(1L);

            // When
            var result = service.bootstrapAdmin("root", "root@example.com", "pw");

            // Then
            assertInstanceOf(CoreError.Forbidden.class, result.errorOrNull());
        }
    }

    @Nested
    @DisplayName("API keys")
    class ApiKeyTests {

        @Test
        @DisplayName("Register, generate, revoke, then a second revoke fails with not found")
        void shouldRunKeyLifecycle() {
            // Given
            String userId = registerPilot();
            AuthenticatedUser self = new AuthenticatedUser(userId, TENANT_ID, Role.PILOT);

            // When
            GeneratedApiKey key = service.generateApiKey(self, userId, "ci").getOrThrow();

            // Then
            assertEquals("s3cret-value", key.apiKey());
            assertTrue(key.keyId().startsWith("key_"));
            assertEquals(Optional.of(self), credentialStore.resolve("s3cret-value"));

            // When
            var revoked = service.revokeApiKey(self, userId, key.keyId());
            var revokedAgain = service.revokeApiKey(self, userId, key.keyId());

            // Then
            assertTrue(revoked.isSuccess());
            assertTrue(credentialStore.resolve("s3cret-value").isEmpty());
            assertInstanceOf(CoreError.NotFound.class, revokedAgain.errorOrNull());
            assertTrue(revokedAgain.errorOrNull().message().contains(key.keyId()));
            assertEquals(3, store.currentVersion(userId));
        }

        @Test
        @DisplayName("Should forbid a pilot generating keys for a colleague")
        void shouldForbidColleague() {
            // Given
            String userId = registerPilot();
            AuthenticatedUser colleague = new AuthenticatedUser("other", TENANT_ID, Role.PILOT);

            // When
            var result = service.generateApiKey(colleague, userId, "ci");

            // Then
            assertInstanceOf(CoreError.Forbidden.class, result.errorOrNull());
            assertEquals(1, store.currentVersion(userId));
        }

        @Test
        @DisplayName("Should report an unknown user as not found to a tenant admin")
        void shouldReportUnknownUserToTenantAdmin() {
            // When
            var generated = service.generateApiKey(TENANT_ADMIN, "no-such-user", "ci");
            var revoked = service.revokeApiKey(TENANT_ADMIN, "no-such-user", "key_1");
            var changed = service.changePassword(TENANT_ADMIN, "no-such-user", "new-pw");

            // Then
            assertInstanceOf(CoreError.NotFound.class, generated.errorOrNull());
            assertInstanceOf(CoreError.NotFound.class, revoked.errorOrNull());
            assertInstanceOf(CoreError.NotFound.class, changed.errorOrNull());
            assertEquals(0, store.currentVersion("no-such-user"));
        }

        @Test
        @DisplayName("Should report an unknown user as not found")
        void shouldReportUnknownUser() {
            var result = service.generateApiKey(PLATFORM_ADMIN, "ghost", "ci");
            assertInstanceOf(CoreError.NotFound.class, result.errorOrNull());
        }
    }

    @Test
    @DisplayName("Should let a tenant admin change a member's password")
    void shouldChangePassword() {
        // Given
        String userId = registerPilot();

        // When
        var result = service.changePassword(TENANT_ADMIN, userId, "new-pw");

        // Then
        assertTrue(result.isSuccess());
        assertEquals(2, store.currentVersion(userId));
    }
}
