package com.example.fleet.core.store;

import java.time.Instant;

/**
 * Persisted roster entry for a paired slave.
 */
public record SlaveRecord(
        String hostId,
        String certSerial,
        String platform,
        String version,
        Instant issuedAt,
        Instant expiresAt,
        Instant lastSeen,
        boolean enabled
) {}
