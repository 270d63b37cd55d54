package com.example.fleet.core.slave;

import com.example.fleet.core.FleetException;

public class TransportException extends FleetException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
