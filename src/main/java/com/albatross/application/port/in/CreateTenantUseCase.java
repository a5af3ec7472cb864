package com.albatross.application.port.in;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;

public interface CreateTenantUseCase {
    Result<String, CoreError> createTenant(AuthenticatedUser actor, String name);
}
