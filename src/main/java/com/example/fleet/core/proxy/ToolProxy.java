package com.example.fleet.core.proxy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Routing table from callable tool names to the client that executes them.
 */
public interface ToolProxy {

    /**
     * Registers or replaces the slave-backed client for {@code name}.
     *
     * @throws IllegalStateException if a master-local server already uses the name
     */
    void registerSlaveClient(String name, ProxyClient client);

    /**
     * @return false when no slave-backed client was registered under the name
     */
    boolean unregisterSlaveClient(String name);

    void registerLocalClient(ProxyClient client);

    boolean unregisterLocalClient(String name);

    Optional<ProxyClient> getClient(String name);

    /**
     * Master-local clients, enabled or not, ordered by name.
     */
    List<ProxyClient> getLocalClients();

    void setClientEnabled(String name, boolean enabled);

    boolean isClientEnabled(String name);

    /**
     * Union of all enabled clients' tools, each named {@code <client>_<tool>} and
     * tagged with a {@code _server} field.
     */
    List<JsonNode> listAllTools();

    /**
     * @param qualifiedName tool name in {@code <client>_<tool>} form
     * @throws UnknownToolException if no client owns the tool
     * @throws ToolCallException    if the owning client is disabled or the call fails
     */
    JsonNode callTool(String qualifiedName, JsonNode arguments);
}
