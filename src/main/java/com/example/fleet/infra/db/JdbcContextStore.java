package com.example.fleet.infra.db;

import com.example.fleet.core.store.ContextStore;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class JdbcContextStore implements ContextStore {
    private final JdbcTemplate jdbc;

    public JdbcContextStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Map<String, List<String>> contextServerMappings() {
        Map<String, List<String>> mappings = new LinkedHashMap<>();
        jdbc.query("SELECT context_name, server_name FROM mcp_context_server WHERE enabled=TRUE "
                        + "ORDER BY context_name, server_name",
                rs -> {
                    mappings.computeIfAbsent(rs.getString("context_name"), k -> new ArrayList<>())
                            .add(rs.getString("server_name"));
                });
        return mappings;
    }

    public void enableServer(String context, String server, boolean enabled) {
        int updated = jdbc.update("UPDATE mcp_context_server SET enabled=? WHERE context_name=? AND server_name=?",
                enabled, context, server);
        if (updated == 0) {
            jdbc.update("INSERT INTO mcp_context_server(context_name, server_name, enabled) VALUES (?,?,?)",
                    context, server, enabled);
        }
    }
}
