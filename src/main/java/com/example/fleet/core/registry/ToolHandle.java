package com.example.fleet.core.registry;

public record ToolHandle(ToolConfig config) {}
