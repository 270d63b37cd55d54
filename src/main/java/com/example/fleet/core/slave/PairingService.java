package com.example.fleet.core.slave;

/**
 * Validates per-slave identities at connect time. Issuing identities (pairing
 * codes, CSR signing) is owned by the certificate authority and lives elsewhere.
 */
public interface PairingService {

    enum Verdict {
        ACCEPTED,
        UNKNOWN,
        REVOKED
    }

    Verdict verify(SlaveIdentity identity);
}
