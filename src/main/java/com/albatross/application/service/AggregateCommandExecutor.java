package com.albatross.application.service;

import com.albatross.application.port.out.EventCodec;
import com.albatross.application.port.out.EventPublishException;
import com.albatross.application.port.out.EventPublisher;
import com.albatross.application.port.out.EventStore;
import com.albatross.application.port.out.MetricsPort;
import com.albatross.application.port.out.OutboxRepository;
import com.albatross.domain.error.CoreError;
import com.albatross.domain.event.DomainEvent;
import com.albatross.domain.model.Aggregate;
import com.albatross.domain.model.NewEvent;
import com.albatross.domain.model.Result;
import com.albatross.domain.model.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs the load, fold, decide, persist, publish cycle for any aggregate.
 * Nothing is persisted when the command is rejected; no retry happens on a concurrency conflict.
 */
@Component
public class AggregateCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(AggregateCommandExecutor.class);

    private final EventStore eventStore;
    private final OutboxRepository outboxRepository;
    private final EventPublisher eventPublisher;
    private final EventCodec eventCodec;
    private final MetricsPort metrics;

    public AggregateCommandExecutor(
            EventStore eventStore,
            OutboxRepository outboxRepository,
            EventPublisher eventPublisher,
            EventCodec eventCodec,
            MetricsPort metrics) {
        this.eventStore = eventStore;
        this.outboxRepository = outboxRepository;
        this.eventPublisher = eventPublisher;
        this.eventCodec = eventCodec;
        this.metrics = metrics;
    }

    public <A extends Aggregate<C, E, X>, C, E extends DomainEvent, X>
    Result<CommandOutcome<A, E>, CoreError> execute(
            AggregateDefinition<A, C, E, X> definition,
            String aggregateId,
            C command) {
        return execute(definition, aggregateId, command, aggregate -> Result.success(null));
    }

    /**
     * @param guard checked against the rebuilt aggregate before the command is handled,
     *              typically an authorization rule that needs the aggregate's tenant
     */
    public <A extends Aggregate<C, E, X>, C, E extends DomainEvent, X>
    Result<CommandOutcome<A, E>, CoreError> execute(
            AggregateDefinition<A, C, E, X> definition,
            String aggregateId,
            C command,
            Function<A, Result<Void, CoreError>> guard) {
        String entity = definition.kind().entity();
        log.debug("Executing command: aggregate={}, id={}, command={}",
            entity, aggregateId, command.getClass().getSimpleName());

        Result<A, CoreError> rebuilt = rebuild(definition, aggregateId);
        if (rebuilt.isFailure()) {
            return Result.failure(rebuilt.errorOrNull());
        }
        A aggregate = rebuilt.getOrThrow();
        long versionBefore = aggregate.version();

        Result<Void, CoreError> allowed = guard.apply(aggregate);
        if (allowed.isFailure()) {
            log.warn("Command denied: aggregate={}, id={}, reason={}", entity, aggregateId, allowed.errorOrNull().message());
            metrics.incrementCommandsRejected(entity);
            return Result.failure(allowed.errorOrNull());
        }

        Result<List<E>, X> decision = aggregate.handle(command);
        if (decision.isFailure()) {
            CoreError error = definition.errorMapper().apply(decision.errorOrNull());
            log.warn("Command rejected: aggregate={}, id={}, error={}", entity, aggregateId, error.message());
            metrics.incrementCommandsRejected(entity);
            return Result.failure(error);
        }

        List<E> events = decision.getOrThrow();
        if (events.isEmpty()) {
            return Result.success(new CommandOutcome<>(aggregate, events, versionBefore));
        }

        List<NewEvent> encoded = new ArrayList<>(events.size());
        for (E event : events) {
            Result<NewEvent, CoreError> newEvent = eventCodec.encode(event);
            if (newEvent.isFailure()) {
                return Result.failure(newEvent.errorOrNull());
            }
            encoded.add(newEvent.getOrThrow());
        }

        Result<Long, CoreError> saved;
        try {
            saved = eventStore.save(aggregateId, versionBefore, encoded);
        } catch (DataAccessException e) {
            log.error("Failed to persist events: aggregate={}, id={}", entity, aggregateId, e);
            return Result.failure(new CoreError.Infrastructure("Failed to persist events: " + e.getMessage()));
        }
        if (saved.isFailure()) {
            if (saved.errorOrNull() instanceof CoreError.Concurrency) {
                metrics.incrementConcurrencyConflicts();
            }
            log.warn("Save rejected: aggregate={}, id={}, error={}", entity, aggregateId, saved.errorOrNull().message());
            return Result.failure(saved.errorOrNull());
        }
        long newVersion = saved.getOrThrow();
        events.forEach(aggregate::apply);

        Result<Void, CoreError> published = publish(definition, aggregateId, versionBefore, encoded);
        if (published.isFailure()) {
            return Result.failure(published.errorOrNull());
        }

        metrics.incrementCommandsAccepted(entity);
        log.info("Command accepted: aggregate={}, id={}, events={}, version={}",
            entity, aggregateId, events.size(), newVersion);
        return Result.success(new CommandOutcome<>(aggregate, events, newVersion));
    }

    private <A extends Aggregate<C, E, X>, C, E extends DomainEvent, X>
    Result<A, CoreError> rebuild(AggregateDefinition<A, C, E, X> definition, String aggregateId) {
        List<StoredEvent> history;
        try {
            history = eventStore.load(aggregateId);
        } catch (DataAccessException e) {
            log.error("Failed to load events: id={}", aggregateId, e);
            return Result.failure(new CoreError.Infrastructure("Failed to load events: " + e.getMessage()));
        }

        A aggregate = definition.factory().get();
        for (StoredEvent stored : history) {
            Result<DomainEvent, CoreError> decoded = eventCodec.decode(stored.eventType(), stored.payload());
            if (decoded.isFailure()) {
                log.error("Undecodable event in stream: id={}, sequence={}, type={}",
                    aggregateId, stored.sequence(), stored.eventType());
                return Result.failure(decoded.errorOrNull());
            }
            DomainEvent event = decoded.getOrThrow();
            if (!definition.eventClass().isInstance(event)) {
                return Result.failure(new CoreError.Deserialization(
                    "Event " + stored.eventType() + " does not belong to a " + definition.kind().entity() + " stream"));
            }
            aggregate.apply(definition.eventClass().cast(event));
        }
        return Result.success(aggregate);
    }

    private Result<Void, CoreError> publish(
            AggregateDefinition<?, ?, ?, ?> definition,
            String aggregateId,
            long versionBefore,
            List<NewEvent> encoded) {
        String routingKey = definition.kind().routingKey(aggregateId);
        List<Long> sequences = new ArrayList<>(encoded.size());
        try {
            for (int i = 0; i < encoded.size(); i++) {
                NewEvent event = encoded.get(i);
                long sequence = versionBefore + i + 1;
                eventPublisher.publish(routingKey, new StoredEvent(aggregateId, sequence, event.eventType(), event.payload()));
                sequences.add(sequence);
            }
        } catch (EventPublishException e) {
            // Persisted but unconfirmed; the outbox relay picks these up later.
            log.error("Events persisted but not published: routingKey={}, published={}/{}",
                routingKey, sequences.size(), encoded.size(), e);
            markPublished(aggregateId, sequences);
            return Result.failure(new CoreError.Infrastructure("Event publish failed: " + e.getMessage()));
        }
        metrics.incrementEventsPublished(sequences.size());
        markPublished(aggregateId, sequences);
        return Result.success(null);
    }

    private void markPublished(String aggregateId, List<Long> sequences) {
        if (sequences.isEmpty()) {
            return;
        }
        try {
            outboxRepository.markPublished(aggregateId, sequences);
        } catch (DataAccessException e) {
            log.warn("Could not mark outbox entries published, relay will resend: id={}, sequences={}",
                aggregateId, sequences, e);
        }
    }
}
