package com.albatross.domain.authz;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AccessPolicy")
class AccessPolicyTest {

    private static final AuthenticatedUser PLATFORM_ADMIN = new AuthenticatedUser("admin", null, Role.PLATFORM_ADMIN);
    private static final AuthenticatedUser TENANT_ADMIN = new AuthenticatedUser("ta", "t-1", Role.TENANT_ADMIN);
    private static final AuthenticatedUser PILOT = new AuthenticatedUser("pilot", "t-1", Role.PILOT);

    @Test
    @DisplayName("Should require an authenticated actor")
    void shouldRequireActor() {
        var result = AccessPolicy.authorize(null, AccessRequirement.PlatformAdminOnly.INSTANCE);
        assertInstanceOf(CoreError.Unauthorized.class, result.errorOrNull());
    }

    @Nested
    @DisplayName("PlatformAdminOnly")
    class PlatformAdminOnlyTests {

        @Test
        @DisplayName("Should allow platform admins only")
        void shouldAllowPlatformAdminOnly() {
            assertTrue(AccessPolicy.authorize(PLATFORM_ADMIN, AccessRequirement.PlatformAdminOnly.INSTANCE).isSuccess());
            assertInstanceOf(CoreError.Forbidden.class,
                AccessPolicy.authorize(TENANT_ADMIN, AccessRequirement.PlatformAdminOnly.INSTANCE).errorOrNull());
            assertInstanceOf(CoreError.Forbidden.class,
                AccessPolicy.authorize(PILOT, AccessRequirement.PlatformAdminOnly.INSTANCE).errorOrNull());
        }
    }

    @Nested
    @DisplayName("SelfOrTenantAdmin")
    class SelfOrTenantAdminTests {

        @Test
        @DisplayName("Should allow acting on oneself")
        void shouldAllowSelf() {
            var result = AccessPolicy.authorize(PILOT, new AccessRequirement.SelfOrTenantAdmin("pilot", "t-1"));
            assertTrue(result.isSuccess());
        }

        @Test
        @DisplayName("Should allow a tenant admin within the same tenant")
        void shouldAllowTenantAdminSameTenant() {
            var result = AccessPolicy.authorize(TENANT_ADMIN, new AccessRequirement.SelfOrTenantAdmin("pilot", "t-1"));
            assertTrue(result.isSuccess());
        }

        @Test
        @DisplayName("Should forbid a tenant admin of another tenant")
        void shouldForbidOtherTenant() {
            var result = AccessPolicy.authorize(TENANT_ADMIN, new AccessRequirement.SelfOrTenantAdmin("x", "t-2"));
            assertInstanceOf(CoreError.Forbidden.class, result.errorOrNull());
        }

        @Test
        @DisplayName("Should forbid a pilot acting on a colleague")
        void shouldForbidPilotOnColleague() {
            var result = AccessPolicy.authorize(PILOT, new AccessRequirement.SelfOrTenantAdmin("colleague", "t-1"));
            assertInstanceOf(CoreError.Forbidden.class, result.errorOrNull());
        }

        @Test
        @DisplayName("Should let a platform admin act anywhere")
        void shouldAllowPlatformAdmin() {
            var result = AccessPolicy.authorize(PLATFORM_ADMIN, new AccessRequirement.SelfOrTenantAdmin("x", "t-9"));
            assertTrue(result.isSuccess());
        }
    }
}
