package com.albatross.adapter.out.notification;

import com.albatross.application.port.out.Notification;
import com.albatross.application.port.out.NotificationException;
import com.albatross.application.port.out.NotificationPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.notifications.type", havingValue = "redis", matchIfMissing = true)
public class RedisNotificationPublisher implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(RedisNotificationPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisNotificationPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String channel, Notification notification) {
        String payload = NotificationEnvelope.toJson(objectMapper, notification).toString();
        try {
            Long receivers = redisTemplate.convertAndSend(channel, payload);
            log.debug("Published notification: channel={}, type={}, receivers={}", channel, notification.eventType(), receivers);
        } catch (DataAccessException e) {
            throw new NotificationException("Failed to publish to " + channel, e);
        }
    }
}
