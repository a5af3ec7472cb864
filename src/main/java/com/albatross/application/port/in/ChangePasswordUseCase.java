package com.albatross.application.port.in;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;

public interface ChangePasswordUseCase {
    Result<Void, CoreError> changePassword(AuthenticatedUser actor, String userId, String newPassword);
}
