package com.example.fleet.core.config;

import com.example.fleet.config.FleetProperties;
import com.example.fleet.core.registry.ToolConfig;
import com.example.fleet.core.registry.ToolHandle;
import com.example.fleet.core.registry.ToolRegistry;
import com.example.fleet.infra.db.ToolRepository;
import com.example.fleet.infra.db.ToolRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Polls {@code mcp_tool} and rebuilds the master-local tool snapshot whenever a
 * row changed since the last pass.
 */
@Slf4j
@Component
public class DbRefresher {
    private final ToolRepository repo;
    private final ToolRegistry registry;
    private final LocalServerSync sync;
    private final String defaultServer;
    private final ObjectMapper om = new ObjectMapper();
    private volatile Instant lastSeen = Instant.EPOCH;

    public DbRefresher(ToolRepository repo, ToolRegistry registry, LocalServerSync sync, FleetProperties props) {
        this.repo = repo;
        this.registry = registry;
        this.sync = sync;
        this.defaultServer = props.getLocal().getDefaultServer();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void refreshNow() {
        doRefresh(true);
    }

    @Scheduled(fixedDelayString = "${app.db-refresh-interval-ms:1000}")
    public void refresh() {
        try {
            doRefresh(false);
        } catch (DataAccessException e) {
            log.warn("Tool refresh failed, keeping previous snapshot: {}", e.getMessage());
        }
    }

    synchronized void doRefresh(boolean force) {
        List<ToolRow> changedRows = repo.findChangedSince(lastSeen);
        if (!force && changedRows.isEmpty()) {
            return;
        }
        // disabled rows still advance the watermark
        for (ToolRow r : changedRows) {
            if (r.updatedAt().isAfter(lastSeen)) {
                lastSeen = r.updatedAt();
            }
        }

        // rebuild from every enabled row so disabled and deleted tools drop out
        Map<String, Map<String, ToolHandle>> snap = new HashMap<>();
        for (ToolRow r : repo.findAllEnabled()) {
            try {
                ToolConfig cfg = parse(r);
                snap.computeIfAbsent(cfg.server(), k -> new HashMap<>()).put(cfg.name(), new ToolHandle(cfg));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping tool row {} ({}): {}", r.id(), r.name(), e.getMessage());
            }
        }

        boolean changed = registry.replace(snap);
        if (changed) {
            log.info("Local tool snapshot rebuilt: {} servers, {} tools", snap.size(),
                    snap.values().stream().mapToInt(Map::size).sum());
        }
        sync.sync(changed);
    }

    private ToolConfig parse(ToolRow r) throws JsonProcessingException {
        JsonNode node = om.readTree(r.configJson());
        String name = node.path("name").asText(r.name());
        String type = node.path("type").asText();
        if (name.isBlank() || type.isBlank()) {
            throw new IllegalArgumentException("name and type are required");
        }
        JsonNode schema = node.path("inputSchema");
        return new ToolConfig(
                name,
                node.path("description").asText(null),
                node.path("server").asText(defaultServer),
                type,
                schema.isObject() ? schema : om.createObjectNode(),
                node.path("http"),
                node.path("feign")
        );
    }
}
