package com.albatross.adapter.out.messaging;

import com.albatross.application.port.out.EventPublisher;
import com.albatross.domain.model.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

/**
 * Synchronous in-process bus. A binding is either an exact routing key or {@code <entity>.*}.
 * Subscriber failures are logged and never reach the publisher.
 */
@Component
@ConditionalOnProperty(name = "app.bus.type", havingValue = "memory")
public class InMemoryEventBus implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<Binding> bindings = new CopyOnWriteArrayList<>();

    public void subscribe(String bindingPattern, BiConsumer<String, StoredEvent> handler) {
        bindings.add(new Binding(bindingPattern, handler));
        log.debug("Bound handler to pattern={}", bindingPattern);
    }

    @Override
    public void publish(String routingKey, StoredEvent event) {
        for (Binding binding : bindings) {
            if (!binding.matches(routingKey)) {
                continue;
            }
            try {
                binding.handler().accept(routingKey, event);
            } catch (RuntimeException e) {
                log.error("Subscriber failed: pattern={}, routingKey={}, type={}",
                    binding.pattern(), routingKey, event.eventType(), e);
            }
        }
    }

    private record Binding(String pattern, BiConsumer<String, StoredEvent> handler) {

        boolean matches(String routingKey) {
            if (pattern.endsWith(".*")) {
                String prefix = pattern.substring(0, pattern.length() - 1);
                return routingKey.startsWith(prefix) && routingKey.indexOf('.', prefix.length()) < 0;
            }
            return pattern.equals(routingKey);
        }
    }
}
