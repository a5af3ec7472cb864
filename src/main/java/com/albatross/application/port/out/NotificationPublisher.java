package com.albatross.application.port.out;

/**
 * Fire-and-forget fan-out channel. Nothing is persisted; offline subscribers miss messages.
 */
public interface NotificationPublisher {

    /**
     * @throws NotificationException when the transport fails
     */
    void publish(String channel, Notification notification);
}
