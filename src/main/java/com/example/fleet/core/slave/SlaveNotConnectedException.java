package com.example.fleet.core.slave;

import com.example.fleet.core.FleetException;

public class SlaveNotConnectedException extends FleetException {
    private final String hostId;

    public SlaveNotConnectedException(String hostId) {
        super("slave " + hostId + " not connected");
        this.hostId = hostId;
    }

    public String getHostId() {
        return hostId;
    }
}
