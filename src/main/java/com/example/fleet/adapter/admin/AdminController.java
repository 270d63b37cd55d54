package com.example.fleet.adapter.admin;

import com.example.fleet.core.config.DbRefresher;
import com.example.fleet.core.slave.SlaveLinkServer;
import com.example.fleet.core.store.ContextStore;
import com.example.fleet.infra.db.JdbcContextStore;
import com.example.fleet.infra.db.ToolRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Master-local tool definitions and the context to server mapping pushed to slaves.
 */
@RestController
@RequestMapping(path = "/admin", produces = MediaType.APPLICATION_JSON_VALUE)
public class AdminController {
    private final ToolRepository repo;
    private final DbRefresher refresher;
    private final JdbcContextStore contexts;
    private final SlaveLinkServer linkServer;

    public AdminController(ToolRepository repo, DbRefresher refresher, JdbcContextStore contexts,
                           SlaveLinkServer linkServer) {
        this.repo = repo;
        this.refresher = refresher;
        this.contexts = contexts;
        this.linkServer = linkServer;
    }

    public record UpsertReq(String name, boolean enabled, JsonNode configJson) {}

    @PostMapping("/tools")
    public Map<String, Object> upsert(@RequestBody UpsertReq req) {
        if (req.name() == null || req.name().isBlank() || req.configJson() == null || !req.configJson().isObject()) {
            throw new IllegalArgumentException("name and configJson object are required");
        }
        repo.upsert(req.name(), req.enabled(), req.configJson().toString());
        refresher.refreshNow();
        return Map.of("ok", true);
    }

    @DeleteMapping("/tools/{name}")
    public Map<String, Object> disable(@PathVariable("name") String name) {
        if (!repo.setEnabled(name, false)) {
            throw new IllegalArgumentException("no tool named " + name);
        }
        refresher.refreshNow();
        return Map.of("ok", true);
    }

    /**
     * @see ContextStore#contextServerMappings()
     */
    @GetMapping("/contexts")
    public Map<String, List<String>> contexts() {
        return contexts.contextServerMappings();
    }

    public record ContextServerReq(boolean enabled) {}

    @PutMapping("/contexts/{context}/servers/{server}")
    public Map<String, Object> setContextServer(@PathVariable("context") String context,
                                                @PathVariable("server") String server,
                                                @RequestBody ContextServerReq req) {
        contexts.enableServer(context, server, req.enabled());
        linkServer.broadcastMasterTools();
        return Map.of("ok", true);
    }
}
