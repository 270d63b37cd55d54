package com.example.fleet.core.slave;

/**
 * Authenticated identity presented by a connecting slave.
 *
 * @param hostId     certificate subject common name
 * @param certSerial certificate serial in lower-case hex, or null when not presented
 */
public record SlaveIdentity(String hostId, String certSerial) {}
