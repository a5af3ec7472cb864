package com.albatross.domain.command;

import com.albatross.domain.model.Role;

public sealed interface UserCommand {

    String userId();

    record Register(
        String userId,
        String username,
        String email,
        String passwordHash,
        Role role,
        String tenantId
    ) implements UserCommand {
    }

    record ChangePassword(String userId, String newPasswordHash) implements UserCommand {
    }

    /**
     * The key id and hash are generated by the caller; the aggregate only records them.
     */
    record GenerateApiKey(String userId, String keyId, String keyName, String apiKeyHash) implements UserCommand {
    }

    record RevokeApiKey(String userId, String keyId) implements UserCommand {
    }

    record Login(String userId) implements UserCommand {
    }
}
