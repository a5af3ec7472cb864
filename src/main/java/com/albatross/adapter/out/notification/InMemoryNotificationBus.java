package com.albatross.adapter.out.notification;

import com.albatross.application.port.out.Notification;
import com.albatross.application.port.out.NotificationPublisher;
import com.albatross.application.port.out.NotificationSubscriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers notifications synchronously to every registered listener in this process.
 */
@Component
@ConditionalOnProperty(name = "app.notifications.type", havingValue = "memory")
public class InMemoryNotificationBus implements NotificationPublisher, NotificationSubscriber {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationBus.class);

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final ObjectMapper objectMapper;

    public InMemoryNotificationBus(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String channel, Notification notification) {
        String payload = NotificationEnvelope.toJson(objectMapper, notification).toString();
        for (Listener listener : listeners) {
            try {
                listener.onMessage(channel, payload);
            } catch (RuntimeException e) {
                log.warn("Notification listener failed: channel={}, error={}", channel, e.getMessage());
            }
        }
    }

    @Override
    public Subscription subscribe(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }
}
