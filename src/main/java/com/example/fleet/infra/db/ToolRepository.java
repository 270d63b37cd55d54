package com.example.fleet.infra.db;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class ToolRepository {
    private final JdbcTemplate jdbc;

    public ToolRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    private static final RowMapper<ToolRow> MAPPER = (rs, rowNum) -> new ToolRow(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getBoolean("enabled"),
            rs.getString("config_json"),
            rs.getTimestamp("updated_at").toInstant()
    );

    public List<ToolRow> findAllEnabled() {
        return jdbc.query("SELECT id,name,enabled,config_json,updated_at FROM mcp_tool WHERE enabled=TRUE", MAPPER);
    }

    public List<ToolRow> findChangedSince(Instant since) {
        return jdbc.query("SELECT id,name,enabled,config_json,updated_at FROM mcp_tool WHERE updated_at > ?",
                ps -> ps.setTimestamp(1, Timestamp.from(since)), MAPPER);
    }

    public void upsert(String name, boolean enabled, String configJson) {
        int updated = jdbc.update("UPDATE mcp_tool SET enabled=?, config_json=?, updated_at=CURRENT_TIMESTAMP WHERE name=?",
                enabled, configJson, name);
        if (updated == 0) {
            jdbc.update("INSERT INTO mcp_tool(name, enabled, config_json) VALUES (?,?,?)",
                    name, enabled, configJson);
        }
    }

    public boolean setEnabled(String name, boolean enabled) {
        return jdbc.update("UPDATE mcp_tool SET enabled=?, updated_at=CURRENT_TIMESTAMP WHERE name=?",
                enabled, name) > 0;
    }
}
