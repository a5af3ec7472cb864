package com.albatross.application.service;

import com.albatross.application.port.out.ApiKeyReadModel;
import com.albatross.application.port.out.ApiKeyReadModel.ApiKeyView;
import com.albatross.application.port.out.PirepReadModel;
import com.albatross.application.port.out.PirepReadModel.PirepView;
import com.albatross.application.port.out.TenantReadModel;
import com.albatross.application.port.out.TenantReadModel.TenantView;
import com.albatross.application.port.out.UserReadModel;
import com.albatross.application.port.out.UserReadModel.UserView;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReadModelQueryService")
class ReadModelQueryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final AuthenticatedUser PLATFORM_ADMIN = new AuthenticatedUser("admin", null, Role.PLATFORM_ADMIN);
    private static final AuthenticatedUser TENANT_ADMIN = new AuthenticatedUser("ta", "t-1", Role.TENANT_ADMIN);
    private static final AuthenticatedUser PILOT = new AuthenticatedUser("u-1", "t-1", Role.PILOT);

    @Mock
    private TenantReadModel tenantReadModel;

    @Mock
    private UserReadModel userReadModel;

    @Mock
    private ApiKeyReadModel apiKeyReadModel;

    @Mock
    private PirepReadModel pirepReadModel;

    private ReadModelQueryService service;

    @BeforeEach
    void setUp() {
        service = new ReadModelQueryService(tenantReadModel, userReadModel, apiKeyReadModel, pirepReadModel);
    }

    private static UserView user(String userId, String tenantId, Role role) {
        return new UserView(userId, tenantId, userId + "-name", userId + "@example.com", role, "hash", NOW, null);
    }

    private static PirepView pirep(String pirepId, String tenantId) {
        return new PirepView(pirepId, tenantId, "u-1", "N1", "KJFK", "KBOS", "AA1", 1.2, null, NOW);
    }

    @Nested
    @DisplayName("listTenants")
    class ListTenantsTests {

        @Test
        @DisplayName("Should return every tenant to a platform admin")
        void shouldListAllForPlatformAdmin() {
            // Given
            List<TenantView> all = List.of(new TenantView("t-1", "One", NOW), new TenantView("t-2", "Two", NOW));
            when(tenantReadModel.findAll()).thenReturn(all);

            // When / Then
            assertEquals(all, service.listTenants(PLATFORM_ADMIN).getOrThrow());
        }

        @Test
        @DisplayName("Should return only the caller's own tenant to tenant members")
        void shouldListOwnTenant() {
            // Given
            TenantView own = new TenantView("t-1", "One", NOW);
            when(tenantReadModel.findById("t-1")).thenReturn(Optional.of(own));

            // When / Then
            assertEquals(List.of(own), service.listTenants(PILOT).getOrThrow());
            verify(tenantReadModel, never()).findAll();
        }
    }

    @Nested
    @DisplayName("listUsers")
    class ListUsersTests {

        @Test
        @DisplayName("Should scope a tenant admin to their tenant")
        void shouldScopeTenantAdmin() {
            // Given
            List<UserView> members = List.of(user("ta", "t-1", Role.TENANT_ADMIN), user("u-1", "t-1", Role.PILOT));
            when(userReadModel.findByTenant("t-1")).thenReturn(members);

            // When / Then
            assertEquals(members, service.listUsers(TENANT_ADMIN).getOrThrow());
        }

        @Test
        @DisplayName("Should show a pilot only themselves")
        void shouldShowPilotThemselves() {
            // Given
            UserView self = user("u-1", "t-1", Role.PILOT);
            when(userReadModel.findById("u-1")).thenReturn(Optional.of(self));

            // When / Then
            assertEquals(List.of(self), service.listUsers(PILOT).getOrThrow());
        }

        @Test
        @DisplayName("Should require authentication")
        void shouldRequireActor() {
            assertInstanceOf(CoreError.Unauthorized.class, service.listUsers(null).errorOrNull());
        }
    }

    @Nested
    @DisplayName("listApiKeys")
    class ListApiKeysTests {

        @Test
        @DisplayName("Should let a user list their own keys")
        void shouldListOwnKeys() {
            // Given
            List<ApiKeyView> keys = List.of(new ApiKeyView("key_1", "u-1", "t-1", "ci", NOW, null));
            when(userReadModel.findById("u-1")).thenReturn(Optional.of(user("u-1", "t-1", Role.PILOT)));
            when(apiKeyReadModel.findByUser("u-1")).thenReturn(keys);

            // When / Then
            assertEquals(keys, service.listApiKeys(PILOT, "u-1").getOrThrow());
        }

        @Test
        @DisplayName("Should forbid a pilot reading a colleague's keys")
        void shouldForbidColleague() {
            // Given
            when(userReadModel.findById("u-2")).thenReturn(Optional.of(user("u-2", "t-1", Role.PILOT)));

            // When
            var result = service.listApiKeys(PILOT, "u-2");

            // Then
            assertInstanceOf(CoreError.Forbidden.class, result.errorOrNull());
            verifyNoInteractions(apiKeyReadModel);
        }

        @Test
        @DisplayName("Should report an unknown user as not found")
        void shouldReportUnknownUser() {
            // Given
            when(userReadModel.findById("ghost")).thenReturn(Optional.empty());

            // When / Then
            assertInstanceOf(CoreError.NotFound.class, service.listApiKeys(PLATFORM_ADMIN, "ghost").errorOrNull());
        }
    }

    @Nested
    @DisplayName("listPireps")
    class ListPirepsTests {

        @Test
        @DisplayName("Should require a platform admin to name the tenant")
        void shouldRequireTenantForPlatformAdmin() {
            assertInstanceOf(CoreError.Validation.class, service.listPireps(PLATFORM_ADMIN, null).errorOrNull());
        }

        @Test
        @DisplayName("Should let a platform admin read any tenant")
        void shouldReadAnyTenant() {
            // Given
            when(pirepReadModel.findByTenant("t-9")).thenReturn(List.of(pirep("p-1", "t-9")));

            // When / Then
            assertEquals(1, service.listPireps(PLATFORM_ADMIN, "t-9").getOrThrow().size());
        }

        @Test
        @DisplayName("Should default tenant members to their own tenant")
        void shouldDefaultToOwnTenant() {
            // Given
            when(pirepReadModel.findByTenant("t-1")).thenReturn(List.of(pirep("p-1", "t-1"), pirep("p-2", "t-1")));

            // When / Then
            assertEquals(2, service.listPireps(PILOT, null).getOrThrow().size());
        }

        @Test
        @DisplayName("Should forbid reading another tenant's reports")
        void shouldForbidOtherTenant() {
            // When
            var result = service.listPireps(TENANT_ADMIN, "t-2");

            // Then
            assertInstanceOf(CoreError.Forbidden.class, result.errorOrNull());
            verifyNoInteractions(pirepReadModel);
        }
    }
}
