package com.example.fleet.core.slave;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Immutable registry lifecycle event. {@code tools} is empty for events that carry none.
 */
public record RegistryNotification(String hostId, EventType eventType, List<JsonNode> tools) {

    public RegistryNotification {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static RegistryNotification of(String hostId, EventType eventType) {
        return new RegistryNotification(hostId, eventType, List.of());
    }

    public enum EventType {
        CONNECTED("connected"),
        DISCONNECTED("disconnected"),
        TOOLS_UPDATED("tools_updated"),
        // never emitted: the link server correlates replies to tool calls itself
        RESPONSE("response");

        private final String label;

        EventType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
