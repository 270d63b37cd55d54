package com.example.fleet.core.proxy;

import com.example.fleet.core.FleetException;

public class ToolCallException extends FleetException {

    public ToolCallException(String message) {
        super(message);
    }

    public ToolCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
