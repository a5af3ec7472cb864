package com.albatross.application.service;

import com.albatross.application.port.in.QueryReadModelsUseCase;
import com.albatross.application.port.out.ApiKeyReadModel;
import com.albatross.application.port.out.ApiKeyReadModel.ApiKeyView;
import com.albatross.application.port.out.PirepReadModel;
import com.albatross.application.port.out.PirepReadModel.PirepView;
import com.albatross.application.port.out.TenantReadModel;
import com.albatross.application.port.out.TenantReadModel.TenantView;
import com.albatross.application.port.out.UserReadModel;
import com.albatross.application.port.out.UserReadModel.UserView;
import com.albatross.domain.authz.AccessPolicy;
import com.albatross.domain.authz.AccessRequirement;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class ReadModelQueryService implements QueryReadModelsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ReadModelQueryService.class);

    private final TenantReadModel tenantReadModel;
    private final UserReadModel userReadModel;
    private final ApiKeyReadModel apiKeyReadModel;
    private final PirepReadModel pirepReadModel;

    public ReadModelQueryService(
            TenantReadModel tenantReadModel,
            UserReadModel userReadModel,
            ApiKeyReadModel apiKeyReadModel,
            PirepReadModel pirepReadModel) {
        this.tenantReadModel = tenantReadModel;
        this.userReadModel = userReadModel;
        this.apiKeyReadModel = apiKeyReadModel;
        this.pirepReadModel = pirepReadModel;
    }

    @Override
    @Transactional(readOnly = true)
    public Result<List<TenantView>, CoreError> listTenants(AuthenticatedUser actor) {
        if (actor == null) {
            return Result.failure(new CoreError.Unauthorized("Authentication required"));
        }
        log.debug("Listing tenants: userId={}, role={}", actor.userId(), actor.role());
        return switch (actor.role()) {
            case PLATFORM_ADMIN -> Result.success(tenantReadModel.findAll());
            case TENANT_ADMIN, PILOT -> Result.success(actor.hasTenant()
                ? tenantReadModel.findById(actor.tenantId()).map(List::of).orElse(List.of())
                : List.of());
        };
    }

    @Override
    @Transactional(readOnly = true)
    public Result<List<UserView>, CoreError> listUsers(AuthenticatedUser actor) {
        if (actor == null) {
            return Result.failure(new CoreError.Unauthorized("Authentication required"));
        }
        log.debug("Listing users: userId={}, role={}", actor.userId(), actor.role());
        return switch (actor.role()) {
            case PLATFORM_ADMIN -> Result.success(userReadModel.findAll());
            case TENANT_ADMIN -> Result.success(actor.hasTenant() ? userReadModel.findByTenant(actor.tenantId()) : List.of());
            case PILOT -> Result.success(userReadModel.findById(actor.userId()).map(List::of).orElse(List.of()));
        };
    }

    @Override
    @Transactional(readOnly = true)
    public Result<List<ApiKeyView>, CoreError> listApiKeys(AuthenticatedUser actor, String userId) {
        Optional<UserView> target = userReadModel.findById(userId);
        if (target.isEmpty()) {
            return Result.failure(new CoreError.NotFound("User not found: " + userId));
        }
        Result<Void, CoreError> allowed = AccessPolicy.authorize(
            actor, new AccessRequirement.SelfOrTenantAdmin(userId, target.get().tenantId()));
        if (allowed.isFailure()) {
            return Result.failure(allowed.errorOrNull());
        }
        return Result.success(apiKeyReadModel.findByUser(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<List<PirepView>, CoreError> listPireps(AuthenticatedUser actor, String tenantId) {
        if (actor == null) {
            return Result.failure(new CoreError.Unauthorized("Authentication required"));
        }
        boolean hasTenantFilter = tenantId != null && !tenantId.isBlank();
        if (actor.role() == Role.PLATFORM_ADMIN) {
            if (!hasTenantFilter) {
                return Result.failure(new CoreError.Validation("tenant_id is required"));
            }
            return Result.success(pirepReadModel.findByTenant(tenantId));
        }
        if (!actor.hasTenant()) {
            return Result.success(List.of());
        }
        if (hasTenantFilter && !tenantId.equals(actor.tenantId())) {
            log.warn("Cross-tenant pirep read denied: userId={}, tenantId={}", actor.userId(), tenantId);
            return Result.failure(new CoreError.Forbidden("Cannot read pilot reports of another tenant"));
        }
        return Result.success(pirepReadModel.findByTenant(actor.tenantId()));
    }
}
