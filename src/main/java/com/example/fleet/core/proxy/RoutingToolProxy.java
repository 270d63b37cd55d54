package com.example.fleet.core.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Copy-on-write routing table. Readers work on an immutable snapshot; writers
 * replace it atomically.
 */
@Slf4j
public class RoutingToolProxy implements ToolProxy {
    static final String SEPARATOR = "_";
    static final String SERVER_FIELD = "_server";

    private record Route(ProxyClient client, boolean enabled) {
        Route withEnabled(boolean value) {
            return new Route(client, value);
        }
    }

    private final AtomicReference<Map<String, Route>> snapshot = new AtomicReference<>(Map.of());

    @Override
    public synchronized void registerSlaveClient(String name, ProxyClient client) {
        Route existing = snapshot.get().get(name);
        if (existing != null && !existing.client().isRemote()) {
            throw new IllegalStateException("name " + name + " is already used by a local server");
        }
        boolean enabled = existing == null || existing.enabled();
        update(routes -> put(routes, name, new Route(client, enabled)));
        if (existing != null && existing.client() != client) {
            existing.client().close();
        }
        log.debug("Registered slave client {}", name);
    }

    @Override
    public synchronized boolean unregisterSlaveClient(String name) {
        Route existing = snapshot.get().get(name);
        if (existing == null || !existing.client().isRemote()) {
            return false;
        }
        update(routes -> remove(routes, name));
        existing.client().close();
        return true;
    }

    @Override
    public synchronized void registerLocalClient(ProxyClient client) {
        Route existing = snapshot.get().get(client.getName());
        if (existing != null && existing.client().isRemote()) {
            log.warn("Local server {} shadows connected slave of the same name", client.getName());
        }
        update(routes -> put(routes, client.getName(), new Route(client, true)));
    }

    @Override
    public synchronized boolean unregisterLocalClient(String name) {
        Route existing = snapshot.get().get(name);
        if (existing == null || existing.client().isRemote()) {
            return false;
        }
        update(routes -> remove(routes, name));
        existing.client().close();
        return true;
    }

    @Override
    public Optional<ProxyClient> getClient(String name) {
        return Optional.ofNullable(snapshot.get().get(name)).map(Route::client);
    }

    @Override
    public List<ProxyClient> getLocalClients() {
        return snapshot.get().values().stream()
                .filter(r -> !r.client().isRemote())
                .map(Route::client)
                .sorted(Comparator.comparing(ProxyClient::getName))
                .toList();
    }

    @Override
    public synchronized void setClientEnabled(String name, boolean enabled) {
        Route existing = snapshot.get().get(name);
        if (existing == null || existing.enabled() == enabled) {
            return;
        }
        update(routes -> put(routes, name, existing.withEnabled(enabled)));
        log.info("Client {} {}", name, enabled ? "enabled" : "disabled");
    }

    @Override
    public boolean isClientEnabled(String name) {
        Route route = snapshot.get().get(name);
        return route != null && route.enabled();
    }

    @Override
    public List<JsonNode> listAllTools() {
        List<JsonNode> all = new ArrayList<>();
        snapshot.get().entrySet().stream()
                .filter(e -> e.getValue().enabled())
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> {
                    String serverName = e.getKey();
                    try {
                        for (JsonNode tool : e.getValue().client().listTools()) {
                            if (tool instanceof ObjectNode obj && obj.path("name").isTextual()) {
                                ObjectNode copy = obj.deepCopy();
                                copy.put("name", serverName + SEPARATOR + obj.get("name").asText());
                                copy.put(SERVER_FIELD, serverName);
                                all.add(copy);
                            }
                        }
                    } catch (RuntimeException ex) {
                        log.warn("Failed to list tools from {}", serverName, ex);
                    }
                });
        return all;
    }

    @Override
    public JsonNode callTool(String qualifiedName, JsonNode arguments) {
        Map<String, Route> routes = snapshot.get();
        String serverName = null;
        for (String candidate : routes.keySet()) {
            String prefix = candidate + SEPARATOR;
            if (qualifiedName.length() > prefix.length() && qualifiedName.startsWith(prefix)
                    && (serverName == null || candidate.length() > serverName.length())) {
                serverName = candidate;
            }
        }
        if (serverName == null) {
            throw new UnknownToolException(qualifiedName);
        }
        Route route = routes.get(serverName);
        if (!route.enabled()) {
            throw new ToolCallException("server " + serverName + " is disabled");
        }
        return route.client().callTool(qualifiedName.substring(serverName.length() + SEPARATOR.length()), arguments);
    }

    private void update(UnaryOperator<Map<String, Route>> change) {
        snapshot.set(Collections.unmodifiableMap(change.apply(new LinkedHashMap<>(snapshot.get()))));
    }

    private static Map<String, Route> put(Map<String, Route> routes, String name, Route route) {
        routes.put(name, route);
        return routes;
    }

    private static Map<String, Route> remove(Map<String, Route> routes, String name) {
        routes.remove(name);
        return routes;
    }
}
