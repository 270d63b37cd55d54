package com.example.fleet.config;

import com.example.fleet.adapter.mcp.ws.McpWebSocketHandler;
import com.example.fleet.adapter.slave.SlaveIdentityFilter;
import com.example.fleet.adapter.slave.SlaveWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;

import java.util.Map;

@Configuration
public class WebSocketConfig implements WebFluxConfigurer {

    @Bean
    public SimpleUrlHandlerMapping webSocketMapping(McpWebSocketHandler mcpHandler, SlaveWebSocketHandler slaveHandler,
                                                    FleetProperties props) {
        return new SimpleUrlHandlerMapping(Map.of(
                "/mcp/ws", mcpHandler,
                props.getLink().getPath(), slaveHandler), -1);
    }

    @Override
    public WebSocketService getWebSocketService() {
        HandshakeWebSocketService service = new HandshakeWebSocketService();
        // carries the identity resolved by SlaveIdentityFilter into the session
        service.setSessionAttributePredicate(SlaveIdentityFilter.IDENTITY_ATTRIBUTE::equals);
        return service;
    }
}
