package com.example.fleet.core.slave;

import com.example.fleet.core.FleetException;

public class RevocationException extends FleetException {

    public RevocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
