package com.example.fleet.adapter.mcp.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

public class JsonRpcModels {
    static final int PARSE_ERROR = -32700;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32603;
    static final int TOOL_FAILED = -32000;
    static final int TOOL_NOT_FOUND = -32004;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Response(String jsonrpc, JsonNode id, JsonNode result, Error error) {
        public static Response ok(JsonNode id, JsonNode result) {
            return new Response("2.0", id, result, null);
        }
        public static Response err(JsonNode id, int code, String message) {
            return new Response("2.0", id, null, new Error(code, message));
        }
    }
    public record Error(int code, String message) {}
}
