package com.example.fleet.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "fleet")
public class FleetProperties {

    private Registry registry = new Registry();
    private Link link = new Link();
    private Local local = new Local();

    @Data
    public static class Registry {
        private Duration heartbeatTimeout = Duration.ofMinutes(2);
        private Duration sweepInterval = Duration.ofSeconds(30);
        private int notificationCapacity = 10;
    }

    @Data
    public static class Link {
        private String path = "/slave/connect";
        private Duration toolCallTimeout = Duration.ofSeconds(30);
        private Duration writeTimeout = Duration.ofSeconds(10);
        private int outboundBuffer = 256;
        // accept X-Slave-Host / X-Slave-Cert-Serial from a TLS-terminating proxy
        private boolean trustForwardedIdentity = false;
        private int masterToolCallThreads = 4;
    }

    @Data
    public static class Local {
        private String defaultServer = "local";
    }
}
