package com.albatross.adapter.out.notification;

import com.albatross.application.port.out.Notification;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Wire form of a notification:
 * {@code {"event_type", "ts", "data", "meta": {"tenant_id", "aggregate_id", "version"}}}.
 */
final class NotificationEnvelope {

    private NotificationEnvelope() {}

    static ObjectNode toJson(ObjectMapper objectMapper, Notification notification) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("event_type", notification.eventType());
        envelope.put("ts", notification.timestamp().toString());
        envelope.set("data", objectMapper.valueToTree(notification.data()));

        ObjectNode meta = envelope.putObject("meta");
        meta.put("tenant_id", notification.tenantId());
        meta.put("aggregate_id", notification.aggregateId());
        if (notification.version() != null) {
            meta.put("version", notification.version());
        } else {
            meta.putNull("version");
        }
        return envelope;
    }
}
