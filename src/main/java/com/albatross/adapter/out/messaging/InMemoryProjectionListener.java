package com.albatross.adapter.out.messaging;

import com.albatross.application.port.in.ProjectEventUseCase;
import com.albatross.application.port.out.MetricsPort;
import com.albatross.domain.model.AggregateKind;
import com.albatross.domain.model.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * Binds the projection worker to every entity pattern of the in-process bus.
 */
@Component
@ConditionalOnExpression("'${app.bus.type:kafka}' == 'memory' and ${app.projection.enabled:true}")
public class InMemoryProjectionListener {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProjectionListener.class);

    private final ProjectEventUseCase projectEventUseCase;
    private final MetricsPort metrics;

    public InMemoryProjectionListener(InMemoryEventBus eventBus, ProjectEventUseCase projectEventUseCase, MetricsPort metrics) {
        this.projectEventUseCase = projectEventUseCase;
        this.metrics = metrics;
        for (AggregateKind kind : AggregateKind.values()) {
            eventBus.subscribe(kind.entity() + ".*", this::onEvent);
        }
    }

    void onEvent(String routingKey, StoredEvent event) {
        var result = projectEventUseCase.project(event.eventType(), event.aggregateId(), event.sequence(), event.payload());
        if (result.isFailure()) {
            log.error("Dropping event: routingKey={}, type={}, error={}",
                routingKey, event.eventType(), result.errorOrNull().message());
            metrics.incrementProjectionsDropped();
        }
    }
}
