package com.example.fleet.core.executor;

import com.example.fleet.core.proxy.ProxyClient;
import com.example.fleet.core.proxy.UnknownToolException;
import com.example.fleet.core.registry.ToolHandle;
import com.example.fleet.core.registry.ToolRegistry;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Tool-Proxy client for one master-local server. Always reads the current
 * {@link ToolRegistry} snapshot, so there is no cache to invalidate.
 */
public class LocalToolClient implements ProxyClient {
    private final String server;
    private final ToolRegistry registry;
    private final ToolExecutor executor;

    public LocalToolClient(String server, ToolRegistry registry, ToolExecutor executor) {
        this.server = server;
        this.registry = registry;
        this.executor = executor;
    }

    @Override
    public String getName() {
        return server;
    }

    @Override
    public boolean isRemote() {
        return false;
    }

    @Override
    public List<JsonNode> listTools() {
        return registry.listServer(server);
    }

    @Override
    public JsonNode callTool(String toolName, JsonNode arguments) {
        ToolHandle handle = registry.get(server, toolName)
                .orElseThrow(() -> new UnknownToolException(server + "_" + toolName));
        return executor.execute(handle, arguments);
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public int getCachedToolCount() {
        return registry.listServer(server).size();
    }

    @Override
    public void invalidateToolCache() {
    }
}
