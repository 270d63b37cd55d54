package com.example.fleet.core.slave;

import com.example.fleet.core.proxy.ProxyClient;
import com.example.fleet.core.proxy.ToolCallException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Tool-Proxy client backed by a live slave link. The tool list is cached from the
 * connection until {@link #invalidateToolCache()} is called.
 */
public class SlaveProxyClient implements ProxyClient {
    private final String hostId;
    private final SlaveConnection connection;
    private final SlaveLinkServer server;
    // guarded by this; the generation stops a listing that raced an invalidation from caching its result
    private List<JsonNode> cachedTools;
    private long cacheGeneration;

    public SlaveProxyClient(String hostId, SlaveConnection connection, SlaveLinkServer server) {
        this.hostId = hostId;
        this.connection = connection;
        this.server = server;
    }

    @Override
    public String getName() {
        return hostId;
    }

    @Override
    public boolean isRemote() {
        return true;
    }

    @Override
    public List<JsonNode> listTools() {
        long generation;
        synchronized (this) {
            if (cachedTools != null) {
                return cachedTools;
            }
            generation = cacheGeneration;
        }
        List<JsonNode> tools = connection.getTools();
        synchronized (this) {
            if (generation == cacheGeneration) {
                cachedTools = tools;
            }
        }
        return tools;
    }

    @Override
    public JsonNode callTool(String toolName, JsonNode arguments) {
        try {
            return server.sendToolCall(hostId, toolName, arguments);
        } catch (SlaveNotConnectedException e) {
            throw new ToolCallException("failed to call tool: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        return connection.isConnected() && connection.getTransport().isOpen();
    }

    @Override
    public synchronized int getCachedToolCount() {
        return cachedTools == null ? -1 : cachedTools.size();
    }

    @Override
    public synchronized void invalidateToolCache() {
        cacheGeneration++;
        cachedTools = null;
    }
}
