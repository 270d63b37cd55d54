package com.example.fleet.adapter.mcp;

import com.example.fleet.core.proxy.ToolProxy;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST view of the aggregated tool set. Failures are rendered by {@code ApiExceptionHandler}.
 */
@RestController
@RequestMapping(path = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
public class McpController {
    private final ToolProxy proxy;

    public McpController(ToolProxy proxy) {
        this.proxy = proxy;
    }

    @GetMapping("/tools")
    public Mono<Map<String, List<JsonNode>>> listTools() {
        return Mono.fromCallable(() -> Map.of("tools", proxy.listAllTools()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public record CallReq(String tool, JsonNode arguments) {}

    @PostMapping("/tools/call")
    public Mono<Map<String, Object>> call(@RequestBody CallReq req) {
        if (req.tool() == null || req.tool().isBlank()) {
            return Mono.error(new IllegalArgumentException("tool is required"));
        }
        return Mono.fromCallable(() -> {
                    JsonNode result = proxy.callTool(req.tool(), req.arguments());
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("ok", true);
                    body.put("result", result);
                    return body;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
