package com.albatross.application.port.out;

import java.time.Instant;
import java.util.List;

public interface ApiKeyReadModel {

    boolean insert(ApiKeyView apiKey, String apiKeyHash);

    /**
     * Sets {@code revoked_at} on an active key.
     *
     * @return number of rows changed, 0 when the key is unknown or already revoked
     */
    int revoke(String keyId, Instant revokedAt);

    List<ApiKeyView> findByUser(String userId);

    record ApiKeyView(
        String keyId,
        String userId,
        String tenantId,
        String keyName,
        Instant createdAt,
        Instant revokedAt
    ) {
    }
}
