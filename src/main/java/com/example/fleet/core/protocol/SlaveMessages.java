package com.example.fleet.core.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public class SlaveMessages {

    public record Register(String hostname, String version, List<JsonNode> tools) {
        public Register {
            tools = tools == null ? List.of() : tools;
        }
    }

    public record ToolCall(String tool, JsonNode arguments) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolCallResponse(boolean success, JsonNode result, String error) {
        public static ToolCallResponse ok(JsonNode result) {
            return new ToolCallResponse(true, result, null);
        }

        public static ToolCallResponse failed(String error) {
            return new ToolCallResponse(false, null, error);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record MasterTools(
            Map<String, List<JsonNode>> servers,
            @JsonProperty("context_mappings") Map<String, List<String>> contextMappings
    ) {}

    public record MasterToolCall(String server, String tool, JsonNode arguments) {}

    public record ErrorPayload(String error) {}

    public record RegisterAck(String status) {
        public static final RegisterAck REGISTERED = new RegisterAck("registered");
    }
}
