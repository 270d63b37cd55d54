package com.example.fleet.core.slave;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * In-memory transport that records outbound frames.
 */
public class RecordingTransport implements SlaveTransport {
    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private final AtomicInteger closeCalls = new AtomicInteger();
    private volatile boolean closed;
    private volatile boolean failSends;

    @Override
    public void send(String frame) {
        if (closed || failSends) {
            throw new TransportException("link closed");
        }
        frames.add(frame);
    }

    @Override
    public void close() {
        closed = true;
        closeCalls.incrementAndGet();
    }

    @Override
    public boolean isOpen() {
        return !closed;
    }

    public void failSends() {
        failSends = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int closeCalls() {
        return closeCalls.get();
    }

    public String nextFrame() throws InterruptedException {
        String frame = frames.poll(2, TimeUnit.SECONDS);
        assertNotNull(frame, "expected an outbound frame");
        return frame;
    }

    public int pendingFrames() {
        return frames.size();
    }
}
