package com.albatross.domain.model;

/**
 * Aggregate types known to the system. The entity name is the first segment of the
 * bus routing key ({@code user.<id>}) and of realtime channel names ({@code user:<id>:updates}).
 */
public enum AggregateKind {
    USER("user"),
    TENANT("tenant"),
    PIREP("pirep");

    private final String entity;

    AggregateKind(String entity) {
        this.entity = entity;
    }

    public String entity() {
        return entity;
    }

    public String routingKey(String aggregateId) {
        return entity + "." + aggregateId;
    }
}
