package com.albatross.application.port.in;

import com.albatross.application.port.out.ApiKeyReadModel.ApiKeyView;
import com.albatross.application.port.out.PirepReadModel.PirepView;
import com.albatross.application.port.out.TenantReadModel.TenantView;
import com.albatross.application.port.out.UserReadModel.UserView;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;

import java.util.List;

/**
 * Role-scoped reads: platform admins see everything, tenant admins their tenant, pilots themselves.
 */
public interface QueryReadModelsUseCase {

    Result<List<TenantView>, CoreError> listTenants(AuthenticatedUser actor);

    Result<List<UserView>, CoreError> listUsers(AuthenticatedUser actor);

    Result<List<ApiKeyView>, CoreError> listApiKeys(AuthenticatedUser actor, String userId);

    /**
     * @param tenantId required for platform admins, optional for tenant members who always read their own tenant
     */
    Result<List<PirepView>, CoreError> listPireps(AuthenticatedUser actor, String tenantId);
}
