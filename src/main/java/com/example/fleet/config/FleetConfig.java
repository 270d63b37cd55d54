package com.example.fleet.config;

import com.example.fleet.core.protocol.MessageCodec;
import com.example.fleet.core.proxy.RoutingToolProxy;
import com.example.fleet.core.proxy.ToolProxy;
import com.example.fleet.core.slave.PairingService;
import com.example.fleet.core.slave.SlaveLinkServer;
import com.example.fleet.core.slave.SlaveManager;
import com.example.fleet.core.slave.SlaveRegistry;
import com.example.fleet.core.slave.StorePairingService;
import com.example.fleet.core.store.ContextStore;
import com.example.fleet.core.store.SlaveStore;
import com.example.fleet.infra.db.JdbcContextStore;
import com.example.fleet.infra.db.JdbcSlaveStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the fleet core. The core classes carry no Spring annotations.
 */
@Configuration
public class FleetConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MessageCodec messageCodec() {
        return new MessageCodec();
    }

    @Bean
    public JdbcSlaveStore slaveStore(JdbcTemplate jdbc, Clock clock) {
        return new JdbcSlaveStore(jdbc, clock);
    }

    @Bean
    public JdbcContextStore contextStore(JdbcTemplate jdbc) {
        return new JdbcContextStore(jdbc);
    }

    @Bean
    public ToolProxy toolProxy() {
        return new RoutingToolProxy();
    }

    @Bean
    public SlaveRegistry slaveRegistry(SlaveStore store, MeterRegistry meterRegistry, Clock clock, FleetProperties props) {
        FleetProperties.Registry cfg = props.getRegistry();
        return new SlaveRegistry(store, meterRegistry, clock,
                cfg.getHeartbeatTimeout(), cfg.getSweepInterval(), cfg.getNotificationCapacity());
    }

    @Bean
    public PairingService pairingService(SlaveStore store) {
        return new StorePairingService(store);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService masterToolExecutor(FleetProperties props) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(props.getLink().getMasterToolCallThreads(), r -> {
            Thread t = new Thread(r, "master-tool-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public SlaveLinkServer slaveLinkServer(SlaveRegistry registry, ToolProxy toolProxy, ContextStore contextStore,
                                           SlaveStore store, PairingService pairing, MessageCodec codec,
                                           ExecutorService masterToolExecutor, FleetProperties props) {
        return new SlaveLinkServer(registry, toolProxy, contextStore, store, pairing, codec, masterToolExecutor,
                props.getLink().getToolCallTimeout());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SlaveManager slaveManager(SlaveRegistry registry, ToolProxy toolProxy, SlaveStore store,
                                     PairingService pairing, SlaveLinkServer server) {
        SlaveManager manager = new SlaveManager(registry, toolProxy, store, pairing);
        manager.attachServer(server);
        return manager;
    }
}
