package com.example.fleet.infra.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolRepositoryTest {
    private EmbeddedDatabase db;
    private ToolRepository repo;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        repo = new ToolRepository(new JdbcTemplate(db));
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void testUpsert_insertsThenUpdates() {
        repo.upsert("weather", true, "{\"name\":\"weather\"}");
        repo.upsert("weather", true, "{\"name\":\"weather\",\"type\":\"http\"}");

        List<ToolRow> rows = repo.findAllEnabled();
        assertEquals(1, rows.size());
        assertTrue(rows.get(0).configJson().contains("http"));
    }

    @Test
    void testSetEnabled_hidesRowButKeepsItChanged() {
        repo.upsert("weather", true, "{}");

        assertTrue(repo.setEnabled("weather", false));
        assertFalse(repo.setEnabled("ghost", false));

        assertTrue(repo.findAllEnabled().isEmpty());
        assertEquals(1, repo.findChangedSince(Instant.EPOCH).size());
        assertFalse(repo.findChangedSince(Instant.EPOCH).get(0).enabled());
    }
}
