package com.example.fleet.core.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of slave-link message types. The wire values are the compatibility
 * surface between master and slave builds and must never be renamed.
 */
public enum MessageType {
    REGISTER("register"),
    HEARTBEAT("heartbeat"),
    TOOL_UPDATE("tool_update"),
    TOOL_CALL("tool_call"),
    RESPONSE("response"),
    ERROR("error"),
    RESTART("restart"),
    UPGRADE("upgrade"),
    MASTER_TOOLS("master_tools"),
    MASTER_TOOL_CALL("master_tool_call");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst();
    }
}
