package com.example.fleet.core.slave;

import com.example.fleet.core.proxy.ProxyClient;
import com.example.fleet.core.proxy.ToolProxy;
import com.example.fleet.core.store.RevokedCredential;
import com.example.fleet.core.store.SlaveRecord;
import com.example.fleet.core.store.SlaveStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bridges registry lifecycle events into the Tool-Proxy routing table and exposes
 * the administrative operations that span the registry and the credential store.
 * <p>
 * A single consumer drains the registry's notification queue, so events for one
 * host are applied in the order they were emitted.
 */
@Slf4j
public class SlaveManager {
    private final SlaveRegistry registry;
    private final ToolProxy proxy;
    private final SlaveStore store;
    private final PairingService pairing;

    private volatile SlaveLinkServer server;
    private ExecutorService eventLoop;

    public SlaveManager(SlaveRegistry registry, ToolProxy proxy, SlaveStore store, PairingService pairing) {
        this.registry = registry;
        this.proxy = proxy;
        this.store = store;
        this.pairing = pairing;
    }

    public void attachServer(SlaveLinkServer server) {
        this.server = server;
        log.info("Slave link server attached");
    }

    public synchronized void start() {
        if (eventLoop != null) {
            return;
        }
        registry.start();
        eventLoop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "slave-manager-events");
            t.setDaemon(true);
            return t;
        });
        eventLoop.execute(this::monitorRegistry);
        log.info("Slave manager started");
    }

    public synchronized void stop() {
        if (eventLoop != null) {
            eventLoop.shutdownNow();
            try {
                if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Slave manager event loop did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            eventLoop = null;
        }
        SlaveLinkServer s = server;
        if (s != null) {
            s.stop();
        }
        registry.stop();
        log.info("Slave manager stopped");
    }

    private void monitorRegistry() {
        BlockingQueue<RegistryNotification> channel = registry.getNotificationChannel();
        while (!Thread.currentThread().isInterrupted()) {
            RegistryNotification notification;
            try {
                notification = channel.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                handleNotification(notification);
            } catch (RuntimeException e) {
                log.error("Failed to handle {} event for slave {}",
                        notification.eventType().label(), notification.hostId(), e);
            }
        }
    }

    void handleNotification(RegistryNotification notification) {
        switch (notification.eventType()) {
            case CONNECTED -> handleSlaveConnected(notification);
            case DISCONNECTED -> handleSlaveDisconnected(notification);
            case TOOLS_UPDATED -> handleToolsUpdated(notification);
            // not produced by the registry; replies are matched in SlaveLinkServer
            case RESPONSE -> log.trace("Ignoring response event for slave {}", notification.hostId());
        }
    }

    private void handleSlaveConnected(RegistryNotification notification) {
        String hostId = notification.hostId();
        log.info("Slave connected, registering with proxy: host={}, tools={}", hostId, notification.tools().size());

        Optional<SlaveConnection> connection = registry.getConnection(hostId);
        if (connection.isEmpty()) {
            log.error("Failed to get slave connection for {}", hostId);
            return;
        }
        SlaveLinkServer s = server;
        if (s == null) {
            log.error("Cannot route to slave {}: link server not attached", hostId);
            return;
        }

        try {
            proxy.registerSlaveClient(hostId, new SlaveProxyClient(hostId, connection.get(), s));
        } catch (IllegalStateException e) {
            log.error("Failed to register slave {} with proxy: {}", hostId, e.getMessage());
            return;
        }

        boolean enabled = true;
        try {
            enabled = store.findSlave(hostId).map(SlaveRecord::enabled).orElse(true);
        } catch (DataAccessException e) {
            log.warn("Failed to read enablement for slave {}, routing stays enabled", hostId, e);
        }
        proxy.setClientEnabled(hostId, enabled);
        log.info("Slave {} registered with proxy{}", hostId, enabled ? "" : " (disabled)");
    }

    private void handleSlaveDisconnected(RegistryNotification notification) {
        log.info("Slave disconnected, unregistering from proxy: host={}", notification.hostId());
        if (!proxy.unregisterSlaveClient(notification.hostId())) {
            log.warn("Slave {} was not registered with proxy", notification.hostId());
        }
    }

    private void handleToolsUpdated(RegistryNotification notification) {
        log.info("Slave tools updated: host={}, tools={}", notification.hostId(), notification.tools().size());
        proxy.getClient(notification.hostId()).ifPresent(ProxyClient::invalidateToolCache);
    }

    public SlaveRegistry getRegistry() {
        return registry;
    }

    public Optional<SlaveLinkServer> getServer() {
        return Optional.ofNullable(server);
    }

    public PairingService getPairingService() {
        return pairing;
    }

    /**
     * Revokes a slave's credential. The revocation record is written first; if that
     * write fails nothing else happens and {@link RevocationException} is thrown.
     * Once recorded, any live session is dropped (already gone counts as done) and
     * the slave is disabled in the roster.
     *
     * @throws UnknownSlaveException if the host has no persisted record
     * @throws RevocationException   if the revocation could not be recorded
     */
    public void revokeCredential(String hostname, String reason) {
        SlaveRecord slave = store.findSlave(hostname)
                .orElseThrow(() -> new UnknownSlaveException(hostname));

        try {
            store.revokeCredential(hostname, slave.certSerial(), reason);
        } catch (DataAccessException e) {
            throw new RevocationException("failed to revoke credential for " + hostname, e);
        }
        log.info("Revoked credential {} of slave {}: {}", slave.certSerial(), hostname, reason);

        if (!registry.unregister(hostname)) {
            log.debug("Slave {} was not connected at revocation", hostname);
        }

        try {
            store.updateSlaveEnabled(hostname, false);
        } catch (DataAccessException e) {
            log.warn("Failed to disable slave {}", hostname, e);
        }
    }

    public List<RevokedCredential> listRevokedCredentials() {
        return store.listRevokedCredentials();
    }

    /**
     * @throws UnknownSlaveException if the host has no persisted record
     */
    public void setSlaveEnabled(String hostname, boolean enabled) {
        if (store.findSlave(hostname).isEmpty()) {
            throw new UnknownSlaveException(hostname);
        }
        store.updateSlaveEnabled(hostname, enabled);
        proxy.setClientEnabled(hostname, enabled);
        log.info("Slave {} {}", hostname, enabled ? "enabled" : "disabled");
    }

    public void restartSlave(String hostname) {
        requireServer().sendRestart(hostname);
    }

    public void upgradeSlave(String hostname) {
        requireServer().sendUpgrade(hostname);
    }

    private SlaveLinkServer requireServer() {
        SlaveLinkServer s = server;
        if (s == null) {
            throw new LinkServerNotInitializedException();
        }
        return s;
    }
}
