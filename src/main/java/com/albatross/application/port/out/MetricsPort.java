package com.albatross.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementCommandsAccepted(String aggregate);

    void incrementCommandsRejected(String aggregate);

    void incrementConcurrencyConflicts();

    void incrementEventsPublished(int count);

    void incrementOutboxEventsRelayed(int count);

    void incrementProjectionsApplied();

    void incrementProjectionsSkipped();

    void incrementProjectionsDropped();

    void incrementNotificationsPublished();

    void incrementRealtimeConnections();

    void incrementRealtimeFramesRejected(String reason);

    <T> T recordProjection(Supplier<T> operation);
}
