package com.albatross.adapter.in.websocket;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
public sealed interface ServerFrame {

    String INVALID_MESSAGE = "invalid_message";
    String RATE_LIMITED = "rate_limited";

    @JsonTypeName("error")
    record Error(String code, String message) implements ServerFrame {}

    @JsonTypeName("heartbeat")
    record Heartbeat(String ts) implements ServerFrame {}

    @JsonTypeName("pong")
    record Pong(String id) implements ServerFrame {}

    @JsonTypeName("event")
    record Event(String channel, JsonNode payload) implements ServerFrame {}

    @JsonTypeName("ack")
    record SubscribeAck(String action, List<String> channels, List<String> accepted, List<String> rejected)
            implements ServerFrame {
        public SubscribeAck(List<String> channels, List<String> accepted, List<String> rejected) {
            this("subscribe", channels, accepted, rejected);
        }
    }

    @JsonTypeName("ack")
    record UnsubscribeAck(String action, List<String> channels, List<String> removed, List<String> missing)
            implements ServerFrame {
        public UnsubscribeAck(List<String> channels, List<String> removed, List<String> missing) {
            this("unsubscribe", channels, removed, missing);
        }
    }
}
