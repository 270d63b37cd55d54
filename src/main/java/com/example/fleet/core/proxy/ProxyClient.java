package com.example.fleet.core.proxy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A named source of tools routed by the {@link ToolProxy}: either a master-local
 * server or a connected slave.
 */
public interface ProxyClient {

    String getName();

    /**
     * Whether this client is backed by a remote slave rather than a master-local server.
     */
    boolean isRemote();

    List<JsonNode> listTools();

    /**
     * @param toolName tool name without the client prefix
     * @throws ToolCallException if the call failed or timed out
     */
    JsonNode callTool(String toolName, JsonNode arguments);

    boolean isConnected();

    /**
     * @return cached tool count, or -1 when nothing is cached
     */
    int getCachedToolCount();

    void invalidateToolCache();

    default void close() {
    }
}
