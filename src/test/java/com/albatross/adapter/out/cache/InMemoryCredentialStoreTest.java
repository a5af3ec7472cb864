package com.albatross.adapter.out.cache;

import com.albatross.domain.model.AuthenticatedUser;
import com.albatross.domain.model.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCredentialStore")
class InMemoryCredentialStoreTest {

    private static final AuthenticatedUser PILOT = new AuthenticatedUser("u-1", "t-1", Role.PILOT);

    private MutableClock clock;
    private InMemoryCredentialStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryCredentialStore(clock);
    }

    @Test
    @DisplayName("Should resolve a stored token until it is revoked")
    void shouldResolveUntilRevoked() {
        // Given
        store.store("secret", PILOT, null);

        // Then
        assertEquals(Optional.of(PILOT), store.resolve("secret"));
        store.revoke("secret");
        assertTrue(store.resolve("secret").isEmpty());
    }

    @Test
    @DisplayName("Should expire session tokens after their TTL")
    void shouldExpireAfterTtl() {
        // Given
        store.store("session", PILOT, Duration.ofMinutes(5));

        // When
        clock.advance(Duration.ofMinutes(4));
        Optional<AuthenticatedUser> beforeExpiry = store.resolve("session");
        clock.advance(Duration.ofMinutes(1));

        // Then
        assertTrue(beforeExpiry.isPresent());
        assertTrue(store.resolve("session").isEmpty());
    }

    @Test
    @DisplayName("Should drop expired sessions that are never looked up again")
    void shouldPruneExpiredOnStore() {
        // Given
        store.store("session-1", PILOT, Duration.ofMinutes(5));
        store.store("session-2", PILOT, Duration.ofMinutes(5));
        store.store("api-key", PILOT, null);
        clock.advance(Duration.ofMinutes(6));

        // When
        store.store("session-3", PILOT, Duration.ofMinutes(5));

        // Then
        assertEquals(2, store.size());
        assertEquals(Optional.of(PILOT), store.resolve("api-key"));
        assertEquals(Optional.of(PILOT), store.resolve("session-3"));
    }

    @Test
    @DisplayName("Should map key ids to their token")
    void shouldIndexKeys() {
        // Given
        store.indexKey("key_1", "secret");

        // Then
        assertEquals(Optional.of("secret"), store.tokenForKey("key_1"));
        store.removeKeyIndex("key_1");
        assertTrue(store.tokenForKey("key_1").isEmpty());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
