package com.example.fleet.adapter.mcp.ws;

import com.example.fleet.core.proxy.ToolCallException;
import com.example.fleet.core.proxy.ToolProxy;
import com.example.fleet.core.proxy.UnknownToolException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * JSON-RPC endpoint for MCP consumers: {@code initialize}, {@code tools/list} and
 * {@code tools/call} over the aggregated tool set of the master and its slaves.
 */
@Slf4j
@Component
public class McpWebSocketHandler implements WebSocketHandler {
    private static final String PARSE_ERROR_FRAME =
            "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}";

    private final ToolProxy proxy;
    private final ObjectMapper om = new ObjectMapper();

    public McpWebSocketHandler(ToolProxy proxy) {
        this.proxy = proxy;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        Flux<WebSocketMessage> output = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .flatMap(this::route)
                .map(session::textMessage);
        return session.send(output);
    }

    Mono<String> route(String text) {
        JsonNode node;
        try {
            node = om.readTree(text);
        } catch (JsonProcessingException e) {
            return Mono.just(PARSE_ERROR_FRAME);
        }
        JsonNode id = node.hasNonNull("id") ? node.get("id") : NullNode.getInstance();
        String method = node.path("method").asText();
        Mono<JsonRpcModels.Response> response = switch (method) {
            case "initialize" -> Mono.just(JsonRpcModels.Response.ok(id, initializeResult()));
            case "tools/list" -> Mono.fromCallable(() -> toolsListResult())
                    .subscribeOn(Schedulers.boundedElastic())
                    .map(result -> JsonRpcModels.Response.ok(id, result));
            case "tools/call" -> toolsCall(id, node.path("params"));
            default -> Mono.just(JsonRpcModels.Response.err(id, JsonRpcModels.METHOD_NOT_FOUND, "Method not found"));
        };
        return response
                .onErrorResume(e -> {
                    log.error("JSON-RPC {} failed", method, e);
                    return Mono.just(JsonRpcModels.Response.err(id, JsonRpcModels.INTERNAL_ERROR, "Internal error"));
                })
                .map(this::write);
    }

    private JsonNode initializeResult() {
        ObjectNode result = om.createObjectNode();
        result.putObject("serverInfo").put("name", "mcp-fleet").put("version", "0.1.0");
        result.putObject("capabilities").putObject("tools");
        return result;
    }

    private JsonNode toolsListResult() {
        ObjectNode result = om.createObjectNode();
        result.putArray("tools").addAll(proxy.listAllTools());
        return result;
    }

    private Mono<JsonRpcModels.Response> toolsCall(JsonNode id, JsonNode params) {
        // MCP clients send "name"; older callers of this endpoint send "tool"
        String tool = params.path("name").asText(params.path("tool").asText());
        if (tool.isEmpty()) {
            return Mono.just(JsonRpcModels.Response.err(id, JsonRpcModels.INVALID_PARAMS, "Missing tool name"));
        }
        JsonNode arguments = params.path("arguments").isMissingNode() ? om.createObjectNode() : params.get("arguments");
        return Mono.fromCallable(() -> proxy.callTool(tool, arguments))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> {
                    ObjectNode wrapped = om.createObjectNode();
                    wrapped.set("content", result);
                    return JsonRpcModels.Response.ok(id, wrapped);
                })
                .onErrorResume(UnknownToolException.class, e ->
                        Mono.just(JsonRpcModels.Response.err(id, JsonRpcModels.TOOL_NOT_FOUND, e.getMessage())))
                .onErrorResume(ToolCallException.class, e ->
                        Mono.just(JsonRpcModels.Response.err(id, JsonRpcModels.TOOL_FAILED, e.getMessage())));
    }

    private String write(JsonRpcModels.Response response) {
        try {
            return om.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unserializable JSON-RPC response", e);
        }
    }
}
