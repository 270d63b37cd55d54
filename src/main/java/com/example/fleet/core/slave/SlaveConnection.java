package com.example.fleet.core.slave;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Live state of one slave link. Tools, status and heartbeat are guarded by a
 * connection-local lock so updating one slave never contends with registry-wide
 * enumeration.
 */
public class SlaveConnection {
    private final String hostId;
    private final SlaveTransport transport;
    private final String certSerial;
    private final Instant connectedAt;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private List<JsonNode> tools;
    private ConnectionStatus status = ConnectionStatus.CONNECTED;
    private Instant lastHeartbeat;

    public SlaveConnection(String hostId, SlaveTransport transport, String certSerial,
                           List<JsonNode> tools, Instant now) {
        this.hostId = hostId;
        this.transport = transport;
        this.certSerial = certSerial;
        this.connectedAt = now;
        this.lastHeartbeat = now;
        this.tools = copyOf(tools);
    }

    public String getHostId() {
        return hostId;
    }

    public SlaveTransport getTransport() {
        return transport;
    }

    public String getCertSerial() {
        return certSerial;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public void updateTools(List<JsonNode> newTools) {
        List<JsonNode> copy = copyOf(newTools);
        lock.writeLock().lock();
        try {
            tools = copy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Deep copy of the advertised tools; mutating it has no effect on this connection.
     */
    public List<JsonNode> getTools() {
        lock.readLock().lock();
        try {
            return copyOf(tools);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getToolCount() {
        lock.readLock().lock();
        try {
            return tools.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getLastHeartbeat() {
        lock.readLock().lock();
        try {
            return lastHeartbeat;
        } finally {
            lock.readLock().unlock();
        }
    }

    void touch(Instant at) {
        lock.writeLock().lock();
        try {
            lastHeartbeat = at;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ConnectionStatus getStatus() {
        lock.readLock().lock();
        try {
            return status;
        } finally {
            lock.readLock().unlock();
        }
    }

    void markDisconnected() {
        lock.writeLock().lock();
        try {
            status = ConnectionStatus.DISCONNECTED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isConnected() {
        return getStatus() == ConnectionStatus.CONNECTED;
    }

    private static List<JsonNode> copyOf(List<JsonNode> source) {
        if (source == null) {
            return List.of();
        }
        return source.stream().<JsonNode>map(JsonNode::deepCopy).toList();
    }

    @Override
    public String toString() {
        return String.format("SlaveConnection[host=%s, status=%s, tools=%d]", hostId, getStatus(), getToolCount());
    }
}
