package com.albatross.domain.authz;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.Role;

import java.util.Objects;

public final class AccessPolicy {

    private AccessPolicy() {}

    public static Result<Void, CoreError> authorize(AuthenticatedUser actor, AccessRequirement requirement) {
        if (actor == null) {
            return Result.failure(new CoreError.Unauthorized("Authentication required"));
        }
        return authorize(actor.userId(), actor.tenantId(), actor.role(), requirement);
    }

    public static Result<Void, CoreError> authorize(
            String actorUserId,
            String actorTenantId,
            Role actorRole,
            AccessRequirement requirement) {
        if (actorRole == Role.PLATFORM_ADMIN) {
            return Result.success(null);
        }
        if (requirement instanceof AccessRequirement.SelfOrTenantAdmin target) {
            if (actorUserId != null && actorUserId.equals(target.targetUserId())) {
                return Result.success(null);
            }
            if (actorRole == Role.TENANT_ADMIN
                    && actorTenantId != null
                    && Objects.equals(actorTenantId, target.targetTenantId())) {
                return Result.success(null);
            }
            return Result.failure(new CoreError.Forbidden("Insufficient permissions for this user or tenant"));
        }
        return Result.failure(new CoreError.Forbidden("Platform admin role required"));
    }
}
