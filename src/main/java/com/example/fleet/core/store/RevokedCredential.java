package com.example.fleet.core.store;

import java.time.Instant;

public record RevokedCredential(String id, String hostId, String certSerial, Instant revokedAt, String reason) {}
