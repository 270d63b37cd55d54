package com.example.fleet.core.protocol;

import com.example.fleet.core.FleetException;

/**
 * A frame could not be decoded, or carried a type outside the closed message set.
 */
public class ProtocolException extends FleetException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
