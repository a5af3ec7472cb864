package com.albatross.adapter.out.persistence;

import com.albatross.application.port.out.EventStore;
import com.albatross.application.port.out.OutboxRepository;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.model.NewEvent;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.StoredEvent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local event log. The version check and append for one aggregate run inside a single
 * {@link ConcurrentHashMap#compute} call, so concurrent saves on the same id are serialized.
 */
@Repository
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryEventStore implements EventStore, OutboxRepository {

    private final Map<String, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final Map<OutboxKey, OutboxMarker> outbox = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<StoredEvent> load(String aggregateId) {
        return streams.getOrDefault(aggregateId, List.of());
    }

    @Override
    public Result<Long, CoreError> save(String aggregateId, long expectedVersion, List<NewEvent> events) {
        if (events.isEmpty()) {
            return Result.success(expectedVersion);
        }
        AtomicReference<Result<Long, CoreError>> outcome = new AtomicReference<>();
        streams.compute(aggregateId, (id, existing) -> {
            List<StoredEvent> current = existing != null ? existing : List.of();
            long actual = current.size();
            if (actual != expectedVersion) {
                outcome.set(Result.failure(new CoreError.Concurrency(expectedVersion, actual)));
                return existing;
            }
            Instant now = clock.instant();
            List<StoredEvent> next = new ArrayList<>(current);
            for (NewEvent event : events) {
                StoredEvent stored = new StoredEvent(id, next.size() + 1L, event.eventType(), event.payload());
                next.add(stored);
                outbox.put(new OutboxKey(id, stored.sequence()), new OutboxMarker(stored, now, null));
            }
            outcome.set(Result.success((long) next.size()));
            return List.copyOf(next);
        });
        return outcome.get();
    }

    @Override
    public long currentVersion(String aggregateId) {
        return load(aggregateId).size();
    }

    @Override
    public List<StoredEvent> findUnpublished(Instant olderThan, int limit) {
        return outbox.values().stream()
            .filter(marker -> marker.processedAt() == null && marker.createdAt().isBefore(olderThan))
            .sorted(Comparator.comparing(OutboxMarker::createdAt)
                .thenComparing(marker -> marker.event().aggregateId())
                .thenComparingLong(marker -> marker.event().sequence()))
            .limit(limit)
            .map(OutboxMarker::event)
            .toList();
    }

    @Override
    public void markPublished(String aggregateId, List<Long> sequences) {
        Instant now = clock.instant();
        for (Long sequence : sequences) {
            outbox.computeIfPresent(new OutboxKey(aggregateId, sequence),
                (key, marker) -> marker.processedAt() != null ? marker : new OutboxMarker(marker.event(), marker.createdAt(), now));
        }
    }

    @Override
    public void deleteProcessedOlderThan(Instant threshold) {
        outbox.values().removeIf(marker -> marker.processedAt() != null && marker.processedAt().isBefore(threshold));
    }

    @Override
    public long countUnpublished() {
        return outbox.values().stream().filter(marker -> marker.processedAt() == null).count();
    }

    private record OutboxKey(String aggregateId, long sequence) {
    }

    private record OutboxMarker(StoredEvent event, Instant createdAt, Instant processedAt) {
    }
}
