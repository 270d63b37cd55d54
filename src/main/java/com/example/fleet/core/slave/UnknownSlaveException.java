package com.example.fleet.core.slave;

import com.example.fleet.core.FleetException;

public class UnknownSlaveException extends FleetException {

    public UnknownSlaveException(String hostId) {
        super("unknown slave " + hostId);
    }
}
