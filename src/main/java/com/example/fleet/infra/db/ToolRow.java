package com.example.fleet.infra.db;

import java.time.Instant;

public record ToolRow(long id, String name, boolean enabled, String configJson, Instant updatedAt) {}
