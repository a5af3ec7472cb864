package com.albatross.infrastructure.metrics;

import com.albatross.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;

    private final Counter concurrencyConflicts;
    private final Counter eventsPublished;
    private final Counter outboxEventsRelayed;
    private final Counter projectionsApplied;
    private final Counter projectionsSkipped;
    private final Counter projectionsDropped;
    private final Counter notificationsPublished;
    private final Counter realtimeConnections;
    private final Timer projectionDuration;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.concurrencyConflicts = Counter.builder("concurrency_conflicts_total")
            .description("Saves rejected because the stream moved past the expected version")
            .register(registry);

        this.eventsPublished = Counter.builder("events_published_total")
            .description("Events confirmed by the bus after a command")
            .register(registry);

        this.outboxEventsRelayed = Counter.builder("outbox_events_relayed_total")
            .description("Unpublished events delivered by the outbox relay")
            .register(registry);

        this.projectionsApplied = Counter.builder("projections_applied_total")
            .description("Events applied to the read models")
            .register(registry);

        this.projectionsSkipped = Counter.builder("projections_skipped_total")
            .description("Events skipped as unknown or already projected")
            .register(registry);

        this.projectionsDropped = Counter.builder("projections_dropped_total")
            .description("Messages dropped after a decode or apply failure")
            .register(registry);

        this.notificationsPublished = Counter.builder("notifications_published_total")
            .description("Notifications published for realtime clients")
            .register(registry);

        this.realtimeConnections = Counter.builder("realtime_connections_total")
            .description("WebSocket connections accepted")
            .register(registry);

        this.projectionDuration = Timer.builder("projection_duration_seconds")
            .description("Time taken to apply one event to the read models")
            .register(registry);
    }

    @Override
    public void incrementCommandsAccepted(String aggregate) {
        Counter.builder("commands_accepted_total")
            .description("Commands that produced persisted events")
            .tag("aggregate", aggregate)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementCommandsRejected(String aggregate) {
        Counter.builder("commands_rejected_total")
            .description("Commands rejected by authorization or aggregate rules")
            .tag("aggregate", aggregate)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementConcurrencyConflicts() {
        concurrencyConflicts.increment();
    }

    @Override
    public void incrementEventsPublished(int count) {
        eventsPublished.increment(count);
    }

    @Override
    public void incrementOutboxEventsRelayed(int count) {
        outboxEventsRelayed.increment(count);
    }

    @Override
    public void incrementProjectionsApplied() {
        projectionsApplied.increment();
    }

    @Override
    public void incrementProjectionsSkipped() {
        projectionsSkipped.increment();
    }

    @Override
    public void incrementProjectionsDropped() {
        projectionsDropped.increment();
    }

    @Override
    public void incrementNotificationsPublished() {
        notificationsPublished.increment();
    }

    @Override
    public void incrementRealtimeConnections() {
        realtimeConnections.increment();
    }

    @Override
    public void incrementRealtimeFramesRejected(String reason) {
        Counter.builder("realtime_frames_rejected_total")
            .description("Inbound WebSocket frames answered with an error")
            .tag("reason", reason)
            .register(registry)
            .increment();
    }

    @Override
    public <T> T recordProjection(Supplier<T> operation) {
        return projectionDuration.record(operation);
    }
}
