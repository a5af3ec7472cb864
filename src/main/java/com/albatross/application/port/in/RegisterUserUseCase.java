package com.albatross.application.port.in;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.Role;

public interface RegisterUserUseCase {

    /**
     * @return the generated user id
     */
    Result<String, CoreError> registerUser(
        AuthenticatedUser actor, String username, String email, String password, Role role, String tenantId);

    /**
     * Registers the first PlatformAdmin. Only allowed while no user exists.
     */
    Result<String, CoreError> bootstrapAdmin(String username, String email, String password);
}
