package com.albatross.application.port.out;

import com.albatross.domain.model.StoredEvent;

public interface EventPublisher {

    /**
     * Publishes one stored event under {@code <entity>.<aggregateId>} and blocks until the broker confirms.
     * Publishing without any consumer bound is not an error.
     *
     * @throws EventPublishException when the broker rejects the message or does not confirm in time
     */
    void publish(String routingKey, StoredEvent event);
}
