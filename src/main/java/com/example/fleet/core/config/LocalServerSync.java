package com.example.fleet.core.config;

import com.example.fleet.core.executor.LocalToolClient;
import com.example.fleet.core.executor.ToolExecutor;
import com.example.fleet.core.proxy.ProxyClient;
import com.example.fleet.core.proxy.ToolProxy;
import com.example.fleet.core.registry.ToolRegistry;
import com.example.fleet.core.slave.SlaveLinkServer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Keeps one {@link LocalToolClient} per master-local server registered with the
 * Tool-Proxy and pushes the inventory to connected slaves when it changes.
 */
@Slf4j
@Component
public class LocalServerSync {
    private final ToolRegistry registry;
    private final ToolExecutor executor;
    private final ToolProxy proxy;
    private final SlaveLinkServer linkServer;

    public LocalServerSync(ToolRegistry registry, ToolExecutor executor, ToolProxy proxy, SlaveLinkServer linkServer) {
        this.registry = registry;
        this.executor = executor;
        this.proxy = proxy;
        this.linkServer = linkServer;
    }

    public synchronized void sync(boolean inventoryChanged) {
        Set<String> servers = registry.serverNames();
        for (String server : servers) {
            boolean registered = proxy.getClient(server).filter(c -> !c.isRemote()).isPresent();
            if (!registered) {
                proxy.registerLocalClient(new LocalToolClient(server, registry, executor));
                log.info("Local server {} published", server);
            }
        }
        for (ProxyClient client : proxy.getLocalClients()) {
            if (!servers.contains(client.getName())) {
                proxy.unregisterLocalClient(client.getName());
                log.info("Local server {} withdrawn", client.getName());
            }
        }
        if (inventoryChanged) {
            linkServer.broadcastMasterTools();
        }
    }
}
