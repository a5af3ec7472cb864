package com.albatross.adapter.out.notification;

import com.albatross.application.port.out.NotificationSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Component
@ConditionalOnProperty(name = "app.notifications.type", havingValue = "redis", matchIfMissing = true)
public class RedisNotificationSubscriber implements NotificationSubscriber {

    private static final Logger log = LoggerFactory.getLogger(RedisNotificationSubscriber.class);

    private static final List<Topic> TOPICS = List.of(new PatternTopic("user:*"), new PatternTopic("tenant:*"));

    private final RedisMessageListenerContainer listenerContainer;

    public RedisNotificationSubscriber(RedisMessageListenerContainer listenerContainer) {
        this.listenerContainer = listenerContainer;
    }

    @Override
    public Subscription subscribe(Listener listener) {
        MessageListener messageListener = (message, pattern) -> listener.onMessage(
            new String(message.getChannel(), StandardCharsets.UTF_8),
            new String(message.getBody(), StandardCharsets.UTF_8)
        );
        listenerContainer.addMessageListener(messageListener, TOPICS);
        log.debug("Notification listener registered");
        return () -> {
            listenerContainer.removeMessageListener(messageListener);
            log.debug("Notification listener removed");
        };
    }
}
