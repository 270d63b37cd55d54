package com.example.fleet.core.slave;

import com.example.fleet.core.store.SlaveRecord;
import com.example.fleet.core.store.SlaveStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Checks a presented identity against the persisted roster and the revocation list.
 */
@Slf4j
public class StorePairingService implements PairingService {
    private final SlaveStore store;

    public StorePairingService(SlaveStore store) {
        this.store = store;
    }

    @Override
    public Verdict verify(SlaveIdentity identity) {
        Optional<SlaveRecord> record = store.findSlave(identity.hostId());
        if (record.isEmpty()) {
            log.warn("Rejected connection from unknown slave {}", identity.hostId());
            return Verdict.UNKNOWN;
        }
        String recorded = record.get().certSerial();
        String presented = identity.certSerial();
        if (store.isCredentialRevoked(recorded) || (presented != null && store.isCredentialRevoked(presented))) {
            log.warn("Rejected connection from revoked slave {}", identity.hostId());
            return Verdict.REVOKED;
        }
        if (presented != null && !presented.equalsIgnoreCase(recorded)) {
            log.warn("Rejected slave {}: certificate {} is not the one on record", identity.hostId(), presented);
            return Verdict.UNKNOWN;
        }
        return Verdict.ACCEPTED;
    }
}
