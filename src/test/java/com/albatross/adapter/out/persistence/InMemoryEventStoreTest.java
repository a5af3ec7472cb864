package com.albatross.adapter.out.persistence;

import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.NewEvent;
import com.albatross.domain.model.StoredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryEventStore")
class InMemoryEventStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static NewEvent event(String type, String body) {
        return new NewEvent(type, body.getBytes(StandardCharsets.UTF_8), "t-1");
    }

    @Nested
    @DisplayName("save and load")
    class SaveLoadTests {

        @Test
        @DisplayName("Should return saved events in sequence order")
        void shouldRoundTrip() {
            // Given
            store.save("agg-1", 0, List.of(event("UserRegistered", "{\"a\":1}"), event("PasswordChanged", "{\"b\":2}")));

            // When
            List<StoredEvent> loaded = store.load("agg-1");

            // Then
            assertEquals(2, loaded.size());
            assertEquals(1, loaded.get(0).sequence());
            assertEquals("UserRegistered", loaded.get(0).eventType());
            assertArrayEquals("{\"a\":1}".getBytes(StandardCharsets.UTF_8), loaded.get(0).payload());
            assertEquals(2, loaded.get(1).sequence());
            assertEquals(2, store.currentVersion("agg-1"));
        }

        @Test
        @DisplayName("Should return an empty stream for an unknown aggregate")
        void shouldLoadEmptyStream() {
            assertTrue(store.load("missing").isEmpty());
            assertEquals(0, store.currentVersion("missing"));
        }

        @Test
        @DisplayName("Should treat an empty batch as a no-op")
        void shouldIgnoreEmptyBatch() {
            // When
            var result = store.save("agg-1", 0, List.of());

            // Then
            assertEquals(0L, result.getOrThrow());
            assertTrue(store.load("agg-1").isEmpty());
            assertEquals(0, store.countUnpublished());
        }

        @Test
        @DisplayName("Should reject a stale expected version")
        void shouldRejectStaleVersion() {
            // Given
            store.save("agg-1", 0, List.of(event("UserRegistered", "{}")));

            // When
            var result = store.save("agg-1", 0, List.of(event("PasswordChanged", "{}")));

            // Then
            assertEquals(new CoreError.Concurrency(0, 1), result.errorOrNull());
            assertEquals(1, store.load("agg-1").size());
        }
    }

    @Test
    @DisplayName("Exactly one of two concurrent writers at the same version wins")
    void concurrentSavesHaveOneWinner() throws Exception {
        // Given
        store.save("agg-1", 0, List.of(event("UserRegistered", "{}")));
        CountDownLatch start = new CountDownLatch(1);
        Callable<Boolean> writer = () -> {
            start.await();
            return store.save("agg-1", 1, List.of(event("PasswordChanged", "{}"))).isSuccess();
        };
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            // When
            Future<Boolean> first = pool.submit(writer);
            Future<Boolean> second = pool.submit(writer);
            start.countDown();

            // Then
            int winners = (first.get(5, TimeUnit.SECONDS) ? 1 : 0) + (second.get(5, TimeUnit.SECONDS) ? 1 : 0);
            assertEquals(1, winners);
            assertEquals(2, store.currentVersion("agg-1"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Nested
    @DisplayName("outbox markers")
    class OutboxTests {

        @Test
        @DisplayName("Should expose appended events as unpublished until marked")
        void shouldTrackUnpublished() {
            // Given
            store.save("agg-1", 0, List.of(event("UserRegistered", "{}"), event("PasswordChanged", "{}")));

            // When
            List<StoredEvent> pending = store.findUnpublished(NOW.plusSeconds(1), 10);
            store.markPublished("agg-1", List.of(1L));

            // Then
            assertEquals(2, pending.size());
            assertEquals(1, store.countUnpublished());
            assertEquals(2, store.findUnpublished(NOW.plusSeconds(1), 10).get(0).sequence());
        }

        @Test
        @DisplayName("Should hide entries younger than the cutoff")
        void shouldRespectCutoff() {
            // Given
            store.save("agg-1", 0, List.of(event("UserRegistered", "{}")));

            // Then
            assertTrue(store.findUnpublished(NOW, 10).isEmpty());
        }

        @Test
        @DisplayName("Should delete processed entries older than the threshold")
        void shouldDeleteProcessed() {
            // Given
            store.save("agg-1", 0, List.of(event("UserRegistered", "{}"), event("PasswordChanged", "{}")));
            store.markPublished("agg-1", List.of(1L, 2L));

            // When
            store.deleteProcessedOlderThan(NOW.plusSeconds(1));

            // Then
            assertEquals(0, store.countUnpublished());
            assertTrue(store.findUnpublished(NOW.plusSeconds(1), 10).isEmpty());
            assertEquals(2, store.load("agg-1").size());
        }
    }
}
