package com.albatross.application.service;

import com.albatross.application.port.in.CreateTenantUseCase;
import com.albatross.application.port.out.IdGenerator;
import com.albatross.domain.authz.AccessPolicy;
import com.albatross.domain.authz.AccessRequirement;
import com.albatross.domain.command.TenantCommand;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TenantCommandService implements CreateTenantUseCase {

    private static final Logger log = LoggerFactory.getLogger(TenantCommandService.class);

    private final AggregateCommandExecutor executor;
    private final IdGenerator idGenerator;

    public TenantCommandService(AggregateCommandExecutor executor, IdGenerator idGenerator) {
        this.executor = executor;
        this.idGenerator = idGenerator;
    }

    @Override
    public Result<String, CoreError> createTenant(AuthenticatedUser actor, String name) {
        Result<Void, CoreError> allowed = AccessPolicy.authorize(actor, AccessRequirement.PlatformAdminOnly.INSTANCE);
        if (allowed.isFailure()) {
            log.warn("Tenant creation denied: actor={}", actor != null ? actor.userId() : null);
            return Result.failure(allowed.errorOrNull());
        }

        String tenantId = idGenerator.generate().toString();
        log.debug("Creating tenant: tenantId={}, name={}", tenantId, name);
        return executor.execute(AggregateDefinition.TENANT, tenantId, new TenantCommand.Create(tenantId, name))
            .map(outcome -> tenantId);
    }
}
