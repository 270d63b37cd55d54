package com.example.fleet.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Master-local tools, grouped by the server they are published under.
 */
@Component
public class ToolRegistry {
    private final AtomicReference<Map<String, Map<String, ToolHandle>>> snapshot = new AtomicReference<>(Map.of());

    public Set<String> serverNames() {
        return snapshot.get().keySet();
    }

    public List<JsonNode> listServer(String server) {
        Map<String, ToolHandle> tools = snapshot.get().getOrDefault(server, Map.of());
        List<JsonNode> res = new ArrayList<>();
        for (ToolHandle h : tools.values()) {
            ToolConfig c = h.config();
            ObjectNode m = JsonNodeFactory.instance.objectNode();
            m.put("name", c.name());
            m.put("description", c.description());
            m.set("inputSchema", c.inputSchema());
            res.add(m);
        }
        return res;
    }

    public Optional<ToolHandle> get(String server, String name) {
        return Optional.ofNullable(snapshot.get().getOrDefault(server, Map.of()).get(name));
    }

    /**
     * @return whether the new snapshot differs from the previous one
     */
    public boolean replace(Map<String, Map<String, ToolHandle>> newSnap) {
        Map<String, Map<String, ToolHandle>> copy = new TreeMap<>();
        newSnap.forEach((server, tools) -> copy.put(server, Collections.unmodifiableMap(new TreeMap<>(tools))));
        Map<String, Map<String, ToolHandle>> previous = snapshot.getAndSet(Collections.unmodifiableMap(copy));
        return !previous.equals(copy);
    }
}
