package com.albatross.adapter.out.cache;

import com.albatross.application.port.out.CredentialStore;
import com.albatross.domain.model.AuthenticatedUser;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "app.credentials.type", havingValue = "memory")
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, Entry> tokens = new ConcurrentHashMap<>();
    private final Map<String, String> keyIndex = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCredentialStore() {
        this(Clock.systemUTC());
    }

    InMemoryCredentialStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<AuthenticatedUser> resolve(String token) {
        Entry entry = tokens.get(token);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            tokens.remove(token, entry);
            return Optional.empty();
        }
        return Optional.of(entry.identity());
    }

    @Override
    public void store(String token, AuthenticatedUser identity, Duration ttl) {
        Instant now = clock.instant();
        pruneExpired(now);
        Instant expiresAt = ttl != null ? now.plus(ttl) : null;
        tokens.put(token, new Entry(identity, expiresAt));
    }

    private void pruneExpired(Instant now) {
        tokens.entrySet().removeIf(e -> e.getValue().isExpiredAt(now));
    }

    int size() {
        return tokens.size();
    }

    @Override
    public void revoke(String token) {
        tokens.remove(token);
    }

    @Override
    public void indexKey(String keyId, String token) {
        keyIndex.put(keyId, token);
    }

    @Override
    public Optional<String> tokenForKey(String keyId) {
        return Optional.ofNullable(keyIndex.get(keyId));
    }

    @Override
    public void removeKeyIndex(String keyId) {
        keyIndex.remove(keyId);
    }

    private record Entry(AuthenticatedUser identity, Instant expiresAt) {

        boolean isExpiredAt(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
