package com.example.fleet.core.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Wire envelope for all slave-link traffic. {@code id} correlates a request with
 * its reply and is echoed back unchanged; {@code data} is interpreted per type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(MessageType type, String id, Instant timestamp, JsonNode data) {

    public static Message of(MessageType type, String id, JsonNode data) {
        return new Message(type, id, Instant.now(), data);
    }

    public static Message control(MessageType type) {
        return new Message(type, null, Instant.now(), null);
    }

    public Message receivedAt(Instant at) {
        return new Message(type, id, at, data);
    }
}
