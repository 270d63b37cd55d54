package com.example.fleet.core.config;

import com.example.fleet.core.executor.ToolExecutor;
import com.example.fleet.core.proxy.ProxyClient;
import com.example.fleet.core.proxy.RoutingToolProxy;
import com.example.fleet.core.registry.ToolConfig;
import com.example.fleet.core.registry.ToolHandle;
import com.example.fleet.core.registry.ToolRegistry;
import com.example.fleet.core.slave.SlaveLinkServer;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LocalServerSyncTest {
    private ToolRegistry registry;
    private RoutingToolProxy proxy;
    private SlaveLinkServer linkServer;
    private LocalServerSync sync;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        proxy = new RoutingToolProxy();
        linkServer = mock(SlaveLinkServer.class);
        sync = new LocalServerSync(registry, mock(ToolExecutor.class), proxy, linkServer);
    }

    @Test
    void testSync_publishesNewServersAndBroadcasts() {
        registry.replace(Map.of("web", Map.of("weather", handle("weather", "web"))));

        sync.sync(true);

        ProxyClient web = proxy.getClient("web").orElseThrow();
        assertFalse(web.isRemote());
        assertEquals("web_weather", proxy.listAllTools().get(0).get("name").asText());
        verify(linkServer).broadcastMasterTools();
    }

    @Test
    void testSync_withdrawsRemovedServers() {
        registry.replace(Map.of("web", Map.of("weather", handle("weather", "web"))));
        sync.sync(true);

        registry.replace(Map.of());
        sync.sync(true);

        assertTrue(proxy.getClient("web").isEmpty());
        verify(linkServer, times(2)).broadcastMasterTools();
    }

    @Test
    void testSync_unchangedInventoryIsNotBroadcast() {
        registry.replace(Map.of("web", Map.of("weather", handle("weather", "web"))));
        sync.sync(false);

        assertTrue(proxy.getClient("web").isPresent());
        verifyNoInteractions(linkServer);
    }

    @Test
    void testSync_keepsExistingClientInstance() {
        registry.replace(Map.of("web", Map.of("weather", handle("weather", "web"))));
        sync.sync(true);
        ProxyClient first = proxy.getClient("web").orElseThrow();

        sync.sync(false);

        assertSame(first, proxy.getClient("web").orElseThrow());
    }

    private static ToolHandle handle(String name, String server) {
        return new ToolHandle(new ToolConfig(name, null, server, "http",
                JsonNodeFactory.instance.objectNode(), JsonNodeFactory.instance.objectNode(), null));
    }
}
