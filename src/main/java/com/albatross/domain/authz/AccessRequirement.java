package com.albatross.domain.authz;

/**
 * What a command needs from its caller.
 */
public sealed interface AccessRequirement {

    record PlatformAdminOnly() implements AccessRequirement {
        public static final PlatformAdminOnly INSTANCE = new PlatformAdminOnly();
    }

    /**
     * Satisfied by a platform admin, by the target user acting on themself,
     * or by a tenant admin of the target tenant.
     */
    record SelfOrTenantAdmin(String targetUserId, String targetTenantId) implements AccessRequirement {
    }
}
