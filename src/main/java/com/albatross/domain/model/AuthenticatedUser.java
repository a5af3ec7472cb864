package com.albatross.domain.model;

/**
 * Identity resolved from a credential: who is calling, in which tenant, with which role.
 * {@code tenantId} is null for platform admins.
 */
public record AuthenticatedUser(String userId, String tenantId, Role role) {

    public AuthenticatedUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    public boolean hasTenant() {
        return tenantId != null && !tenantId.isBlank();
    }
}
