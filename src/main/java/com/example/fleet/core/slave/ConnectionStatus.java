package com.example.fleet.core.slave;

public enum ConnectionStatus {
    CONNECTED,
    DISCONNECTED,
    // display only; the registry never stores it
    RECONNECTING
}
