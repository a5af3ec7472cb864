package com.albatross.adapter.in.websocket;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Optional;

/**
 * Frames a realtime client may send, discriminated by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientFrame.Subscribe.class, name = "subscribe"),
    @JsonSubTypes.Type(value = ClientFrame.Unsubscribe.class, name = "unsubscribe"),
    @JsonSubTypes.Type(value = ClientFrame.Ping.class, name = "ping")
})
public sealed interface ClientFrame {

    record Subscribe(List<String> channels) implements ClientFrame {}

    record Unsubscribe(List<String> channels) implements ClientFrame {}

    record Ping(String id) implements ClientFrame {}

    /**
     * Empty for unknown types, malformed JSON, or a (un)subscribe without a channel list.
     */
    static Optional<ClientFrame> parse(ObjectMapper objectMapper, String text) {
        ClientFrame frame;
        try {
            frame = objectMapper.readValue(text, ClientFrame.class);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (frame instanceof Subscribe subscribe && subscribe.channels() == null) {
            return Optional.empty();
        }
        if (frame instanceof Unsubscribe unsubscribe && unsubscribe.channels() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(frame);
    }
}
