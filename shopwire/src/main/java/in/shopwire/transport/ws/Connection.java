package in.shopwire.transport.ws;

import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.common.Namespace;
import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.domain.connection.HeartbeatState;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One accepted WebSocket connection.
 *
 * The identity is bound once, after authentication. Subscription changes are
 * made by {@link ConnectionRegistry} while holding this object's monitor.
 */
public final class Connection {
    private final String id;
    private final WsTransport transport;
    private final OutboundQueue outbound;
    private final FixedWindowRateLimiter rateLimiter;
    private final Instant connectedAt;

    private final AtomicReference<ConnectionIdentity> identity = new AtomicReference<>();
    private final Set<Namespace> namespaces = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean removed = new AtomicBoolean(false);
    private final AtomicInteger violations = new AtomicInteger();

    // Guarded by heartbeatLock
    private final Object heartbeatLock = new Object();
    private HeartbeatState heartbeatState = HeartbeatState.ALIVE;
    private Instant lastSeen;
    private Instant pongDeadline;
    private Instant lastPingSentAt;
    private volatile long lastLatencyMs = -1;

    public Connection(String id, WsTransport transport, OutboundQueue outbound,
                      FixedWindowRateLimiter rateLimiter, Instant connectedAt) {
        this.id = id;
        this.transport = transport;
        this.outbound = outbound;
        this.rateLimiter = rateLimiter;
        this.connectedAt = connectedAt;
        this.lastSeen = connectedAt;
    }

    public static String newId() {
        return "conn_" + UUID.randomUUID();
    }

    public String getId() {
        return id;
    }

    public WsTransport getTransport() {
        return transport;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    // ═══════════════════════════════════════════════════════════════
    // Identity
    // ═══════════════════════════════════════════════════════════════

    /**
     * Bind the authenticated identity. Returns false if one is already bound.
     */
    public boolean bind(ConnectionIdentity boundIdentity) {
        return identity.compareAndSet(null, boundIdentity);
    }

    public ConnectionIdentity getIdentity() {
        return identity.get();
    }

    public boolean isAuthenticated() {
        return identity.get() != null;
    }

    // ═══════════════════════════════════════════════════════════════
    // Subscriptions (mutated by the registry under this monitor)
    // ═══════════════════════════════════════════════════════════════

    public Set<Namespace> getNamespaces() {
        return Set.copyOf(namespaces);
    }

    public boolean isSubscribed(Namespace namespace) {
        return namespaces.contains(namespace);
    }

    boolean addNamespace(Namespace namespace) {
        return namespaces.add(namespace);
    }

    boolean removeNamespace(Namespace namespace) {
        return namespaces.remove(namespace);
    }

    // ═══════════════════════════════════════════════════════════════
    // Liveness
    // ═══════════════════════════════════════════════════════════════

    /**
     * Any inbound pong or ping: the peer is alive. A reply that arrives after
     * the pong deadline does not rescue the connection; the next sweep evicts it.
     *
     * @return false if the activity came too late to count
     */
    public boolean recordActivity(Instant now) {
        synchronized (heartbeatLock) {
            if (heartbeatState == HeartbeatState.AWAITING_PONG) {
                if (pongDeadline.isBefore(now)) {
                    return false;
                }
                if (lastPingSentAt != null) {
                    lastLatencyMs = Duration.between(lastPingSentAt, now).toMillis();
                }
            }
            heartbeatState = HeartbeatState.ALIVE;
            lastSeen = now;
            pongDeadline = null;
            return true;
        }
    }

    /**
     * Move to AWAITING_PONG if the connection has been quiet for at least
     * {@code pingInterval}.
     *
     * @return true if the caller should send a ping now
     */
    boolean beginPingIfIdle(Instant now, Duration pingInterval, Duration pongTimeout) {
        synchronized (heartbeatLock) {
            if (heartbeatState != HeartbeatState.ALIVE) {
                return false;
            }
            if (lastSeen.plus(pingInterval).isAfter(now)) {
                return false;
            }
            heartbeatState = HeartbeatState.AWAITING_PONG;
            lastPingSentAt = now;
            pongDeadline = now.plus(pongTimeout);
            return true;
        }
    }

    boolean isPongOverdue(Instant now) {
        synchronized (heartbeatLock) {
            return heartbeatState == HeartbeatState.AWAITING_PONG && pongDeadline.isBefore(now);
        }
    }

    public HeartbeatState getHeartbeatState() {
        synchronized (heartbeatLock) {
            return heartbeatState;
        }
    }

    public Instant getLastSeen() {
        synchronized (heartbeatLock) {
            return lastSeen;
        }
    }

    public Instant getPongDeadline() {
        synchronized (heartbeatLock) {
            return pongDeadline;
        }
    }

    /**
     * Round trip of the last answered server ping, or -1 if none yet.
     */
    public long getLastLatencyMs() {
        return lastLatencyMs;
    }

    // ═══════════════════════════════════════════════════════════════
    // Inbound policing
    // ═══════════════════════════════════════════════════════════════

    public boolean tryAcquireFrame() {
        return rateLimiter.tryAcquire();
    }

    public int recordViolation() {
        return violations.incrementAndGet();
    }

    public int getViolations() {
        return violations.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // Outbound
    // ═══════════════════════════════════════════════════════════════

    public OutboundQueue.OfferResult send(String frame) {
        return outbound.offer(frame);
    }

    public OutboundQueue getOutbound() {
        return outbound;
    }

    public boolean isRemoved() {
        return removed.get();
    }

    /**
     * Flag the connection as gone. Only the first caller gets true.
     */
    boolean markRemoved() {
        return removed.compareAndSet(false, true);
    }

    /**
     * Drop pending frames and close the socket with the code's close code and
     * its name as reason.
     */
    public void close(ErrorCode code) {
        outbound.close();
        transport.close(code.closeCode(), code.name());
    }

    /**
     * Send an error frame, let the queue drain, then close with the code.
     */
    public void closeAfterError(ErrorCode code, String message) {
        outbound.offer(WireFrames.error(code, message));
        outbound.finish(() -> transport.close(code.closeCode(), code.name()));
    }

    @Override
    public String toString() {
        ConnectionIdentity bound = identity.get();
        return "Connection{" + id + (bound == null ? ", pending" : ", user=" + bound.userId() + ", role=" + bound.role().wireName()) + "}";
    }
}
