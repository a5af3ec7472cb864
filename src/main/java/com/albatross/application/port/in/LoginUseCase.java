package com.albatross.application.port.in;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.Result;

public interface LoginUseCase {

    Result<Session, CoreError> login(String username, String password);

    record Session(String apiKey, String userId) {
    }
}
