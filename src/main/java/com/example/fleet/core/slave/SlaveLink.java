package com.example.fleet.core.slave;

/**
 * One authenticated transport session, before and after it registers.
 */
public class SlaveLink {
    private final SlaveIdentity identity;
    private final SlaveTransport transport;

    public SlaveLink(SlaveIdentity identity, SlaveTransport transport) {
        this.identity = identity;
        this.transport = transport;
    }

    public String getHostId() {
        return identity.hostId();
    }

    public SlaveIdentity getIdentity() {
        return identity;
    }

    public SlaveTransport getTransport() {
        return transport;
    }

    @Override
    public String toString() {
        return "SlaveLink[" + identity.hostId() + "]";
    }
}
