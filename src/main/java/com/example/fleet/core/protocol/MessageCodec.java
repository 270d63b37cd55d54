package com.example.fleet.core.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Text-frame codec for {@link Message} envelopes and their typed payloads.
 */
public class MessageCodec {
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public String encode(Message message) {
        try {
            return om.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + message.type().wireName() + " message", e);
        }
    }

    public Message decode(String frame) {
        JsonNode node;
        try {
            node = om.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame", e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Frame is not a JSON object");
        }
        String typeName = node.path("type").asText("");
        MessageType type = MessageType.fromWire(typeName)
                .orElseThrow(() -> new ProtocolException("Unknown message type: " + typeName));
        String id = node.hasNonNull("id") ? node.get("id").asText() : null;
        JsonNode data = node.hasNonNull("data") ? node.get("data") : null;
        return new Message(type, id, parseTimestamp(node.path("timestamp")), data);
    }

    public <T> T payload(Message message, Class<T> payloadType) {
        if (message.data() == null) {
            throw new ProtocolException("Missing payload for " + message.type().wireName() + " message");
        }
        try {
            return om.treeToValue(message.data(), payloadType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid payload for " + message.type().wireName() + " message", e);
        }
    }

    public JsonNode toData(Object payload) {
        return om.valueToTree(payload);
    }

    private Instant parseTimestamp(JsonNode ts) {
        if (!ts.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(ts.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
