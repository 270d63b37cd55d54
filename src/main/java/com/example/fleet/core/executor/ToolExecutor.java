package com.example.fleet.core.executor;

import com.example.fleet.core.proxy.ToolCallException;
import com.example.fleet.core.registry.ToolHandle;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import feign.Client;
import feign.Request;
import feign.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Executes master-local tools described by an {@code http} or {@code feign} block.
 * Blocking; callers run it off the event loop.
 */
@Slf4j
@Component
public class ToolExecutor {
    private final ObjectMapper om = new ObjectMapper();
    private final TemplateEngine tpl = new TemplateEngine();
    private final Map<String, String> secrets;
    private final Client feignClient = new feign.okhttp.OkHttpClient();

    public ToolExecutor() {
        this(System.getenv());
    }

    ToolExecutor(Map<String, String> secrets) {
        this.secrets = secrets;
    }

    /**
     * @throws ToolCallException if the tool type is unsupported or the call fails
     */
    public JsonNode execute(ToolHandle handle, JsonNode args) {
        String type = handle.config().type();
        try {
            return switch (type) {
                case "http" -> execHttp(handle, args);
                case "feign" -> execFeign(handle, args);
                default -> throw new ToolCallException("Unsupported type: " + type);
            };
        } catch (ToolCallException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Tool {} failed: {}", handle.config().name(), e.getMessage());
            throw new ToolCallException("Tool " + handle.config().name() + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode execHttp(ToolHandle handle, JsonNode args) throws IOException {
        JsonNode http = handle.config().http();
        String method = http.path("method").asText("GET");
        int timeoutMs = http.path("timeoutMs").asInt(3000);
        String url = withQuery(tpl.render(http.path("url").asText(), args, secrets), http.path("query"), args);

        WebClient client = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().responseTimeout(Duration.ofMillis(timeoutMs))))
                .build();

        HttpHeaders headers = new HttpHeaders();
        renderHeaders(http.path("headers"), args).forEach(headers::add);

        WebClient.RequestBodySpec bodySpec = client.method(HttpMethod.valueOf(method)).uri(url).headers(h -> h.addAll(headers));
        WebClient.RequestHeadersSpec<?> reqSpec = bodySpec;
        if (http.has("body")) {
            String bodyStr = tpl.render(http.get("body").toString(), args, secrets);
            reqSpec = bodySpec.contentType(MediaType.APPLICATION_JSON).body(BodyInserters.fromValue(bodyStr));
        }

        String resp = reqSpec.retrieve().bodyToMono(String.class).block(Duration.ofMillis(timeoutMs + 500L));
        return parse(resp);
    }

    private JsonNode execFeign(ToolHandle handle, JsonNode args) throws IOException {
        JsonNode feign = handle.config().feign();
        String baseUrl = feign.path("baseUrl").asText();
        String method = feign.path("method").asText("GET");
        int timeoutMs = feign.path("timeoutMs").asInt(3000);
        String path = tpl.render(feign.path("path").asText(), args, secrets);

        Map<String, Collection<String>> headers = new LinkedHashMap<>();
        renderHeaders(feign.path("headers"), args).forEach((k, v) -> headers.put(k, List.of(v)));

        byte[] body = new byte[0];
        if (feign.has("body")) {
            body = tpl.render(feign.get("body").toString(), args, secrets).getBytes(StandardCharsets.UTF_8);
            headers.putIfAbsent("Content-Type", List.of("application/json"));
        }

        Request req = Request.create(Request.HttpMethod.valueOf(method), baseUrl + path, headers, body,
                StandardCharsets.UTF_8, null);
        Request.Options options = new Request.Options(timeoutMs, TimeUnit.MILLISECONDS, timeoutMs, TimeUnit.MILLISECONDS, true);
        try (Response resp = feignClient.execute(req, options)) {
            if (resp.status() >= 400) {
                throw new ToolCallException("HTTP " + resp.status() + " from " + baseUrl + path);
            }
            if (resp.body() == null) {
                return NullNode.getInstance();
            }
            try (InputStream in = resp.body().asInputStream()) {
                return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
    }

    private Map<String, String> renderHeaders(JsonNode headerNode, JsonNode args) {
        Map<String, String> rendered = new LinkedHashMap<>();
        Iterator<String> f = headerNode.fieldNames();
        while (f.hasNext()) {
            String k = f.next();
            rendered.put(k, tpl.render(headerNode.get(k).asText(), args, secrets));
        }
        return rendered;
    }

    private String withQuery(String url, JsonNode query, JsonNode args) {
        Iterator<String> f = query.fieldNames();
        StringBuilder sb = new StringBuilder(url);
        boolean first = !url.contains("?");
        while (f.hasNext()) {
            String k = f.next();
            String v = tpl.render(query.get(k).asText(), args, secrets);
            sb.append(first ? '?' : '&').append(k).append('=').append(v);
            first = false;
        }
        return sb.toString();
    }

    private JsonNode parse(String body) throws IOException {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        return om.readTree(body);
    }
}
