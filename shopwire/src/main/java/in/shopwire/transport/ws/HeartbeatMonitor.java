package in.shopwire.transport.ws;

import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.metrics.RealtimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Liveness sweeper for registered connections.
 *
 * One task runs every tick over all connections:
 * - ALIVE and quiet for pingInterval: send a ping, move to AWAITING_PONG
 * - AWAITING_PONG past its deadline: remove and close (1001 HEARTBEAT_TIMEOUT)
 * - session expired: remove and close (SESSION_EXPIRED)
 *
 * Usage:
 * <pre>
 * HeartbeatMonitor heartbeat = new HeartbeatMonitor(registry, pingInterval, pongTimeout, tick, clock, metrics);
 * heartbeat.start();
 * // When a pong arrives:
 * heartbeat.recordPong(connection);
 * heartbeat.stop();
 * </pre>
 */
public class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final ConnectionRegistry registry;
    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final Duration tick;
    private final Clock clock;
    private final RealtimeMetrics metrics;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> sweepTask;
    private volatile boolean running = false;

    public HeartbeatMonitor(ConnectionRegistry registry, Duration pingInterval, Duration pongTimeout,
                            Duration tick, Clock clock, RealtimeMetrics metrics) {
        this.registry = registry;
        this.pingInterval = pingInterval;
        this.pongTimeout = pongTimeout;
        this.tick = tick;
        this.clock = clock;
        this.metrics = metrics;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ws-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("Heartbeat monitor already running");
            return;
        }

        log.info("Starting heartbeat monitor (ping interval: {}ms, pong timeout: {}ms, tick: {}ms)",
            pingInterval.toMillis(), pongTimeout.toMillis(), tick.toMillis());

        running = true;
        sweepTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (Exception e) {
                log.error("Heartbeat sweep failed", e);
            }
        }, tick.toMillis(), tick.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping heartbeat monitor");
        running = false;

        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Pong (or client ping) received on a connection.
     */
    public void recordPong(Connection connection) {
        if (!connection.recordActivity(clock.instant())) {
            log.debug("Late pong on {} ignored (deadline {})", connection.getId(), connection.getPongDeadline());
        }
    }

    /**
     * One pass over the registry.
     */
    SweepResult sweep() {
        Instant now = clock.instant();
        int pinged = 0;
        int evicted = 0;
        int expired = 0;

        for (Connection connection : registry.snapshot()) {
            ConnectionIdentity identity = connection.getIdentity();
            if (identity != null && identity.isExpired(now)) {
                if (evict(connection, ErrorCode.SESSION_EXPIRED)) {
                    log.info("WS session expired: {} (user={})", connection.getId(), identity.userId());
                    expired++;
                }
                continue;
            }

            if (connection.isPongOverdue(now)) {
                if (evict(connection, ErrorCode.HEARTBEAT_TIMEOUT)) {
                    metrics.recordHeartbeatEviction();
                    log.info("WS heartbeat timeout: {} (last seen {}, deadline {})",
                        connection.getId(), connection.getLastSeen(), connection.getPongDeadline());
                    evicted++;
                }
                continue;
            }

            if (connection.beginPingIfIdle(now, pingInterval, pongTimeout)) {
                connection.send(WireFrames.ping(now.toEpochMilli()));
                log.debug("Ping sent to {}", connection.getId());
                pinged++;
            }
        }

        return new SweepResult(pinged, evicted, expired);
    }

    private boolean evict(Connection connection, ErrorCode reason) {
        if (!registry.remove(connection.getId(), reason.name())) {
            return false;
        }
        try {
            connection.close(reason);
        } catch (RuntimeException e) {
            log.warn("Failed to close {}: {}", connection.getId(), e.toString());
        }
        return true;
    }

    record SweepResult(int pinged, int evicted, int expired) {
    }
}
