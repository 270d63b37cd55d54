package com.example.fleet.core.slave;

import com.example.fleet.core.slave.RegistryNotification.EventType;
import com.example.fleet.core.store.SlaveRecord;
import com.example.fleet.core.store.SlaveStore;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative in-memory map of live slave links.
 * <p>
 * The outer lock guards the host id to connection map; each {@link SlaveConnection}
 * carries its own lock for tool and heartbeat mutation. Lifecycle events are
 * offered to a bounded queue while the outer lock is held, so events for one host
 * are enqueued in transition order. When the queue is full the event is dropped
 * and counted rather than stalling the caller.
 * <p>
 * Stale links are evicted by a sweeper started with {@link #start()}.
 */
@Slf4j
public class SlaveRegistry {
    private final SlaveStore store;
    private final Clock clock;
    private final Duration heartbeatTimeout;
    private final Duration sweepInterval;

    private final Map<String, SlaveConnection> connections = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final BlockingQueue<RegistryNotification> notifications;

    private final Map<EventType, Counter> droppedCounters = new EnumMap<>(EventType.class);
    private final Counter evictionCounter;

    private ScheduledExecutorService sweeper;

    public SlaveRegistry(SlaveStore store, MeterRegistry meterRegistry, Clock clock,
                         Duration heartbeatTimeout, Duration sweepInterval, int notificationCapacity) {
        this.store = store;
        this.clock = clock;
        this.heartbeatTimeout = heartbeatTimeout;
        this.sweepInterval = sweepInterval;
        this.notifications = new ArrayBlockingQueue<>(notificationCapacity);

        for (EventType type : EventType.values()) {
            droppedCounters.put(type, Counter.builder("fleet.registry.notifications.dropped")
                    .description("Registry notifications dropped because the queue was full")
                    .tag("event", type.label())
                    .register(meterRegistry));
        }
        this.evictionCounter = Counter.builder("fleet.registry.evictions")
                .description("Slave links evicted after heartbeat timeout")
                .register(meterRegistry);
        Gauge.builder("fleet.registry.connected", this, SlaveRegistry::connectionCount)
                .description("Number of live slave links")
                .register(meterRegistry);
    }

    /**
     * Records a live link for {@code hostId}. An existing link for the same host is
     * closed and superseded; that is how a slave reconnects after a network blip.
     */
    public void register(String hostId, SlaveTransport transport, String certSerial, List<JsonNode> tools) {
        SlaveConnection connection = new SlaveConnection(hostId, transport, certSerial, tools, clock.instant());

        lock.writeLock().lock();
        try {
            SlaveConnection existing = connections.get(hostId);
            if (existing != null) {
                log.info("Slave {} re-registered, closing superseded link", hostId);
                existing.markDisconnected();
                closeQuietly(existing);
            }
            connections.put(hostId, connection);
            notify(new RegistryNotification(hostId, EventType.CONNECTED, connection.getTools()));
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Slave {} registered with {} tools (cert {})", hostId, connection.getToolCount(), certSerial);
        persistLastSeen(hostId);
    }

    /**
     * Removes the link for {@code hostId}. No-op, and no notification, when absent.
     *
     * @return whether a live link was removed
     */
    public boolean unregister(String hostId) {
        lock.writeLock().lock();
        try {
            SlaveConnection connection = connections.remove(hostId);
            if (connection == null) {
                return false;
            }
            evict(connection);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Slave {} unregistered", hostId);
        return true;
    }

    /**
     * Removes the link for {@code hostId} only while it is still backed by {@code transport}.
     * A superseded link that closes late must not evict its successor.
     */
    public boolean unregisterTransport(String hostId, SlaveTransport transport) {
        lock.writeLock().lock();
        try {
            SlaveConnection connection = connections.get(hostId);
            if (connection == null || connection.getTransport() != transport) {
                return false;
            }
            connections.remove(hostId);
            evict(connection);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Slave {} link closed", hostId);
        return true;
    }

    public void updateTools(String hostId, List<JsonNode> tools) {
        lock.readLock().lock();
        try {
            SlaveConnection connection = connections.get(hostId);
            if (connection == null) {
                throw new SlaveNotConnectedException(hostId);
            }
            connection.updateTools(tools);
            notify(new RegistryNotification(hostId, EventType.TOOLS_UPDATED, connection.getTools()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void updateHeartbeat(String hostId) {
        SlaveConnection connection = getConnection(hostId)
                .orElseThrow(() -> new SlaveNotConnectedException(hostId));
        connection.touch(clock.instant());
        log.debug("Heartbeat from slave {}", hostId);
        persistLastSeen(hostId);
    }

    public Optional<SlaveConnection> getConnection(String hostId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(hostId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SlaveConnection> getConnectedSlaves() {
        lock.readLock().lock();
        try {
            return connections.values().stream()
                    .filter(SlaveConnection::isConnected)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isConnected(String hostId) {
        return getConnection(hostId).map(SlaveConnection::isConnected).orElse(false);
    }

    /**
     * Persisted roster merged with live state. Hosts known only to the store report
     * {@link ConnectionStatus#DISCONNECTED} with their last persisted sighting.
     *
     * @throws DataAccessException if the roster cannot be read
     */
    public List<SlaveInfo> getAllSlaves() {
        List<SlaveRecord> records = store.listSlaves();
        List<SlaveInfo> slaves = new ArrayList<>(records.size());
        for (SlaveRecord r : records) {
            SlaveConnection live = getConnection(r.hostId()).orElse(null);
            if (live != null) {
                List<JsonNode> tools = live.getTools();
                slaves.add(new SlaveInfo(r.hostId(), r.certSerial(), r.platform(), r.version(),
                        r.issuedAt(), r.expiresAt(), live.getLastHeartbeat(), live.getConnectedAt(),
                        r.enabled(), live.getStatus(), tools.size(), tools));
            } else {
                slaves.add(new SlaveInfo(r.hostId(), r.certSerial(), r.platform(), r.version(),
                        r.issuedAt(), r.expiresAt(), r.lastSeen(), null,
                        r.enabled(), ConnectionStatus.DISCONNECTED, 0, List.of()));
            }
        }
        return slaves;
    }

    public BlockingQueue<RegistryNotification> getNotificationChannel() {
        return notifications;
    }

    public double droppedNotifications() {
        return droppedCounters.values().stream().mapToDouble(Counter::count).sum();
    }

    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Evicts every link whose last heartbeat is older than the timeout, exactly as
     * {@link #unregister(String)} would.
     *
     * @return number of evicted links
     */
    public int sweepStaleConnections() {
        Instant now = clock.instant();
        List<String> evicted = new ArrayList<>();

        lock.writeLock().lock();
        try {
            Iterator<SlaveConnection> it = connections.values().iterator();
            while (it.hasNext()) {
                SlaveConnection connection = it.next();
                if (Duration.between(connection.getLastHeartbeat(), now).compareTo(heartbeatTimeout) > 0) {
                    it.remove();
                    evict(connection);
                    evicted.add(connection.getHostId());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (String hostId : evicted) {
            log.warn("Slave {} heartbeat timeout, marked as disconnected", hostId);
            evictionCounter.increment();
        }
        return evicted.size();
    }

    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "slave-liveness-sweeper");
            t.setDaemon(true);
            return t;
        });
        long periodMs = sweepInterval.toMillis();
        sweeper.scheduleWithFixedDelay(this::sweepSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Liveness sweep started (interval {}, timeout {})", sweepInterval, heartbeatTimeout);
    }

    public synchronized void stop() {
        if (sweeper == null) {
            return;
        }
        sweeper.shutdownNow();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Liveness sweeper did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sweeper = null;
        log.info("Liveness sweep stopped");
    }

    public synchronized boolean isRunning() {
        return sweeper != null;
    }

    private void sweepSafely() {
        try {
            sweepStaleConnections();
        } catch (RuntimeException e) {
            log.error("Liveness sweep failed", e);
        }
    }

    // caller holds the write lock
    private void evict(SlaveConnection connection) {
        connection.markDisconnected();
        closeQuietly(connection);
        notify(RegistryNotification.of(connection.getHostId(), EventType.DISCONNECTED));
    }

    private void notify(RegistryNotification notification) {
        if (!notifications.offer(notification)) {
            droppedCounters.get(notification.eventType()).increment();
            log.warn("Notification queue full, dropped {} event for slave {}",
                    notification.eventType().label(), notification.hostId());
        }
    }

    private void closeQuietly(SlaveConnection connection) {
        try {
            connection.getTransport().close();
        } catch (RuntimeException e) {
            log.warn("Failed to close link for slave {}", connection.getHostId(), e);
        }
    }

    private void persistLastSeen(String hostId) {
        try {
            store.updateLastSeen(hostId);
        } catch (DataAccessException e) {
            log.warn("Failed to update last seen for slave {}", hostId, e);
        }
    }
}
