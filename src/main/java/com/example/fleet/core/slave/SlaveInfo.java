package com.example.fleet.core.slave;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Roster read-model: persisted metadata merged with live connection state.
 * Built on demand by {@link SlaveRegistry#getAllSlaves()}, never stored.
 */
public record SlaveInfo(
        String hostId,
        String certSerial,
        String platform,
        String version,
        Instant issuedAt,
        Instant expiresAt,
        Instant lastHeartbeat,
        Instant connectedAt,
        boolean enabled,
        ConnectionStatus status,
        int toolCount,
        List<JsonNode> tools
) {}
