package com.example.fleet.core.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable slave roster and revocation list. Implementations report failures as
 * {@link org.springframework.dao.DataAccessException}.
 */
public interface SlaveStore {

    SlaveRecord createSlave(String hostId, String certSerial, String platform, Instant issuedAt, Instant expiresAt);

    Optional<SlaveRecord> findSlave(String hostId);

    List<SlaveRecord> listSlaves();

    void updateLastSeen(String hostId);

    void updateSlaveEnabled(String hostId, boolean enabled);

    void updateSlaveVersion(String hostId, String version);

    void revokeCredential(String hostId, String certSerial, String reason);

    boolean isCredentialRevoked(String certSerial);

    /**
     * Newest revocation first.
     */
    List<RevokedCredential> listRevokedCredentials();
}
