package com.albatross.application.port.out;

import com.albatross.domain.model.AuthenticatedUser;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps bearer tokens (API key secrets and session tokens) to caller identities.
 */
public interface CredentialStore {

    Optional<AuthenticatedUser> resolve(String token);

    /**
     * @param ttl null keeps the entry until it is revoked
     */
    void store(String token, AuthenticatedUser identity, Duration ttl);

    void revoke(String token);

    void indexKey(String keyId, String token);

    Optional<String> tokenForKey(String keyId);

    void removeKeyIndex(String keyId);
}
