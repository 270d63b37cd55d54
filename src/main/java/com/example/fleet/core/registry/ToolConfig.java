package com.example.fleet.core.registry;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolConfig(
        String name,
        String description,
        String server, // master-local server the tool is published under
        String type, // http | feign
        JsonNode inputSchema,
        JsonNode http,
        JsonNode feign
) {}
