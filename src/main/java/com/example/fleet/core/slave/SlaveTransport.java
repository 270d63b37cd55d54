package com.example.fleet.core.slave;

/**
 * Outbound half of a slave link. Opaque to the registry beyond send and close.
 */
public interface SlaveTransport {

    /**
     * Writes one text frame, blocking at most for the configured write timeout.
     *
     * @throws TransportException if the link is closed or the write did not complete
     */
    void send(String frame);

    /**
     * Closes the link. Idempotent.
     */
    void close();

    boolean isOpen();
}
