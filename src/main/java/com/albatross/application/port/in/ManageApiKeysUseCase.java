package com.albatross.application.port.in;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Result;

public interface ManageApiKeysUseCase {

    Result<GeneratedApiKey, CoreError> generateApiKey(AuthenticatedUser actor, String userId, String keyName);

    Result<Void, CoreError> revokeApiKey(AuthenticatedUser actor, String userId, String keyId);

    /**
     * The secret is returned once and only its digest is stored in the event log.
     */
    record GeneratedApiKey(String keyId, String apiKey) {
    }
}
