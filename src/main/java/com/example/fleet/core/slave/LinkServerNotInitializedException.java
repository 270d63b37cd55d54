package com.example.fleet.core.slave;

import com.example.fleet.core.FleetException;

public class LinkServerNotInitializedException extends FleetException {

    public LinkServerNotInitializedException() {
        super("slave server not initialized");
    }
}
