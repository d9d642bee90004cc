package in.shopwire.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import in.shopwire.auth.Authenticator;
import in.shopwire.config.RealtimeConfig;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.common.Namespace;
import in.shopwire.domain.common.RealtimeException;
import in.shopwire.domain.common.VisibilityMatrix;
import in.shopwire.domain.connection.AuthCredential;
import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.metrics.RealtimeMetrics;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Undertow-native WebSocket endpoint with:
 * - Auth frame after connect (pending connections are not in the registry)
 * - Namespace subscriptions checked against the visibility matrix
 * - Per-frame payload ceiling, rate limit and protocol-violation budget
 * - Ping / pong liveness shared with the {@link HeartbeatMonitor}
 *
 * Frame handling runs on Undertow I/O threads and never blocks: writes go
 * through each connection's outbound queue, and the session lookup completes
 * asynchronously.
 */
public final class WsHub {
    private static final Logger log = LoggerFactory.getLogger(WsHub.class);

    private final RealtimeConfig config;
    private final ConnectionRegistry registry;
    private final Authenticator authenticator;
    private final HeartbeatMonitor heartbeat;
    private final Executor deliveryExecutor;
    private final RealtimeMetrics metrics;
    private final Clock clock;

    // Channel -> Connection (pending and registered)
    private final ConcurrentMap<WebSocketChannel, Connection> channels = new ConcurrentHashMap<>();

    // ConnectionId -> auth deadline task
    private final ConcurrentMap<String, ScheduledFuture<?>> authDeadlines = new ConcurrentHashMap<>();

    // ConnectionIds with an auth lookup in flight
    private final Set<String> authenticating = ConcurrentHashMap.newKeySet();

    // ConnectionIds accepted but not yet admitted to the registry
    private final Set<String> pendingIds = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-auth-timeout");
        t.setDaemon(true);
        return t;
    });

    public WsHub(RealtimeConfig config, ConnectionRegistry registry, Authenticator authenticator,
                 HeartbeatMonitor heartbeat, Executor deliveryExecutor, RealtimeMetrics metrics, Clock clock) {
        this.config = config;
        this.registry = registry;
        this.authenticator = authenticator;
        this.heartbeat = heartbeat;
        this.deliveryExecutor = deliveryExecutor;
        this.metrics = metrics;
        this.clock = clock;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                Connection connection = accept(new UndertowWsTransport(channel));
                channels.put(channel, connection);

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        handleFrame(connection, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        cleanup(ch, "client_close");
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("WS error on {}: {}", connection.getId(), error.toString());
                        cleanup(ch, "transport_error");
                        super.onError(ch, error);
                    }

                    @Override
                    protected long getMaxTextBufferSize() {
                        // Hard cap; frames between the soft and hard limit get an error frame instead
                        return config.getMaxPayloadBytes() * 4L;
                    }
                });
                channel.addCloseTask(ch -> cleanup(ch, "closed"));
                channel.resumeReceives();
            }
        });
    }

    /**
     * Set up a pending connection: welcome frame and auth deadline.
     */
    Connection accept(WsTransport transport) {
        String id = Connection.newId();
        OutboundQueue outbound = new OutboundQueue(id, transport, deliveryExecutor, config.getOutboundQueueCapacity());
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(
            config.getRateLimitMaxEvents(), config.getRateLimitWindow(), clock);
        Connection connection = new Connection(id, transport, outbound, limiter, clock.instant());

        ScheduledFuture<?> deadline = scheduler.schedule(() -> expireIfPending(connection),
            config.getAuthTimeout().toMillis(), TimeUnit.MILLISECONDS);
        authDeadlines.put(id, deadline);
        pendingIds.add(id);

        log.info("WS connected: {} from {} (pending auth)", id, transport.remoteAddress());
        connection.send(WireFrames.connected(id, clock.millis()));
        return connection;
    }

    // ═══════════════════════════════════════════════════════════════
    // Inbound frames
    // ═══════════════════════════════════════════════════════════════

    void handleFrame(Connection connection, String raw) {
        if (connection.isRemoved()) {
            return;
        }
        if (exceedsPayloadCeiling(raw)) {
            violation(connection, ErrorCode.PAYLOAD_TOO_LARGE,
                "Frame exceeds " + config.getMaxPayloadBytes() + " bytes");
            return;
        }

        JsonNode frame;
        try {
            frame = WireFrames.parse(raw);
        } catch (Exception e) {
            violation(connection, ErrorCode.INVALID_FRAME, "Invalid JSON");
            return;
        }
        JsonNode typeNode = frame == null ? null : frame.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            violation(connection, ErrorCode.INVALID_FRAME, "Missing 'type'");
            return;
        }
        String type = typeNode.asText();
        JsonNode data = frame.get("data");

        // Pongs answer our own pings, so they are not counted
        if (!WireFrames.TYPE_PONG.equals(type) && !connection.tryAcquireFrame()) {
            metrics.recordRateLimitHit();
            log.debug("Rate limit hit on {}", connection.getId());
            connection.send(WireFrames.error(ErrorCode.RATE_LIMITED));
            return;
        }

        try {
            switch (type) {
                case WireFrames.TYPE_AUTH -> handleAuth(connection, data);
                case WireFrames.TYPE_SUBSCRIBE -> handleSubscription(connection, data, true);
                case WireFrames.TYPE_UNSUBSCRIBE -> handleSubscription(connection, data, false);
                case WireFrames.TYPE_PING -> {
                    heartbeat.recordPong(connection);
                    connection.send(WireFrames.pong(clock.millis()));
                }
                case WireFrames.TYPE_PONG -> heartbeat.recordPong(connection);
                default -> violation(connection, ErrorCode.INVALID_FRAME, "Unknown frame type: " + type);
            }
        } catch (RealtimeException e) {
            if (e.getCode() == ErrorCode.UNKNOWN_CONNECTION) {
                log.debug("Frame for removed connection {} ignored", connection.getId());
                return;
            }
            connection.send(WireFrames.error(e.getCode(), e.getMessage()));
        } catch (Exception e) {
            log.warn("Failed to handle '{}' frame on {}: {}", type, connection.getId(), e.toString());
            connection.send(WireFrames.error(ErrorCode.INVALID_FRAME, "Could not process frame"));
        }
    }

    private boolean exceedsPayloadCeiling(String raw) {
        int max = config.getMaxPayloadBytes();
        // UTF-8 uses at most 3 bytes per UTF-16 char
        if ((long) raw.length() * 3 <= max) {
            return false;
        }
        return raw.getBytes(StandardCharsets.UTF_8).length > max;
    }

    private void handleAuth(Connection connection, JsonNode data) {
        if (connection.isAuthenticated()) {
            connection.send(WireFrames.error(ErrorCode.ADMISSION_REJECTED, "Already authenticated"));
            return;
        }
        if (!authenticating.add(connection.getId())) {
            connection.send(WireFrames.error(ErrorCode.ADMISSION_REJECTED, "Authentication already in progress"));
            return;
        }

        authenticator.authenticateAsync(AuthCredential.fromJson(data))
            .whenComplete((identity, error) -> {
                authenticating.remove(connection.getId());
                if (error != null) {
                    rejectAuth(connection, error);
                } else {
                    admit(connection, identity);
                }
            });
    }

    private void admit(Connection connection, ConnectionIdentity identity) {
        if (!connection.getTransport().isOpen()) {
            log.debug("Connection {} closed before authentication finished", connection.getId());
            return;
        }
        try {
            registry.admit(connection, identity);
        } catch (RealtimeException e) {
            metrics.recordAdmissionRejected(e.getCode());
            log.info("WS admission rejected: {} ({}: {})", connection.getId(), e.getCode(), e.getMessage());
            cancelAuthDeadline(connection.getId());
            connection.closeAfterError(e.getCode(), e.getMessage());
            return;
        }
        cancelAuthDeadline(connection.getId());
        pendingIds.remove(connection.getId());
        heartbeat.recordPong(connection);
        connection.send(WireFrames.authAck(connection.getId(), identity));
    }

    private void rejectAuth(Connection connection, Throwable error) {
        Throwable cause = error.getCause() != null && !(error instanceof RealtimeException) ? error.getCause() : error;
        RealtimeException rejection = cause instanceof RealtimeException
            ? (RealtimeException) cause
            : new RealtimeException(ErrorCode.UNAUTHENTICATED, "Authentication failed", cause);

        metrics.recordAdmissionRejected(rejection.getCode());
        log.info("WS auth rejected: {} ({}: {})", connection.getId(), rejection.getCode(), rejection.getMessage());
        cancelAuthDeadline(connection.getId());
        connection.closeAfterError(rejection.getCode(), rejection.getMessage());
    }

    private void handleSubscription(Connection connection, JsonNode data, boolean subscribe) {
        ConnectionIdentity identity = connection.getIdentity();
        if (identity == null) {
            connection.send(WireFrames.error(ErrorCode.NOT_AUTHENTICATED));
            return;
        }

        JsonNode namespaceNode = data == null ? null : data.get("namespace");
        String name = namespaceNode != null && namespaceNode.isTextual() ? namespaceNode.asText() : null;
        Optional<Namespace> namespace = Namespace.fromWire(name);
        if (namespace.isEmpty()) {
            connection.send(WireFrames.error(ErrorCode.INVALID_NAMESPACE, "Unknown namespace: " + name, name));
            return;
        }

        if (subscribe) {
            if (!VisibilityMatrix.isEntitled(identity.role(), namespace.get())) {
                log.info("WS subscribe denied: {} (role={}, namespace={})",
                    connection.getId(), identity.role().wireName(), namespace.get().wireName());
                connection.send(WireFrames.error(ErrorCode.FORBIDDEN_NAMESPACE,
                    "No permission for namespace: " + namespace.get().wireName(), namespace.get().wireName()));
                return;
            }
            registry.subscribe(connection.getId(), namespace.get());
        } else {
            registry.unsubscribe(connection.getId(), namespace.get());
        }

        String action = subscribe ? WireFrames.TYPE_SUBSCRIBE : WireFrames.TYPE_UNSUBSCRIBE;
        log.debug("WS {}: {} -> {}", action, connection.getId(), namespace.get().wireName());
        connection.send(WireFrames.subscriptionAck(action, connection.getId(), namespace.get()));
    }

    private void violation(Connection connection, ErrorCode code, String message) {
        metrics.recordProtocolViolation(code);
        int count = connection.recordViolation();
        if (count < config.getMaxViolations()) {
            connection.send(WireFrames.error(code, message));
            return;
        }

        log.warn("WS policy violation limit reached on {} ({} violations, last {})",
            connection.getId(), count, code);
        if (connection.isAuthenticated()) {
            registry.remove(connection.getId(), ErrorCode.POLICY_VIOLATION.name());
        }
        cancelAuthDeadline(connection.getId());
        connection.closeAfterError(ErrorCode.POLICY_VIOLATION, "Too many protocol violations");
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    private void expireIfPending(Connection connection) {
        authDeadlines.remove(connection.getId());
        if (connection.isAuthenticated() || !connection.getTransport().isOpen()) {
            return;
        }
        metrics.recordAdmissionRejected(ErrorCode.AUTH_TIMEOUT);
        log.info("WS auth timeout: {} after {}ms", connection.getId(), config.getAuthTimeout().toMillis());
        connection.closeAfterError(ErrorCode.AUTH_TIMEOUT, "No auth frame within " + config.getAuthTimeout().toMillis() + "ms");
    }

    private void cancelAuthDeadline(String connectionId) {
        ScheduledFuture<?> deadline = authDeadlines.remove(connectionId);
        if (deadline != null) {
            deadline.cancel(false);
        }
    }

    private void cleanup(WebSocketChannel channel, String reason) {
        Connection connection = channels.remove(channel);
        if (connection != null) {
            release(connection, reason);
        }
    }

    /**
     * Forget a connection whose socket is gone.
     */
    void release(Connection connection, String reason) {
        cancelAuthDeadline(connection.getId());
        authenticating.remove(connection.getId());
        pendingIds.remove(connection.getId());
        if (connection.isAuthenticated()) {
            registry.remove(connection.getId(), reason);
        } else {
            log.info("WS disconnected before auth: {} ({})", connection.getId(), reason);
        }
        connection.getOutbound().close();
    }

    /**
     * Close pending connections and stop the auth deadline scheduler.
     * Registered connections are closed by {@link ConnectionRegistry#drain}.
     */
    public void stop() {
        int pending = 0;
        for (Connection connection : channels.values()) {
            if (!connection.isAuthenticated()) {
                connection.close(ErrorCode.SHUTTING_DOWN);
                pending++;
            }
        }
        scheduler.shutdownNow();
        log.info("WsHub stopped ({} pending connections closed)", pending);
    }

    /**
     * Sockets that completed the upgrade but have not been admitted yet.
     * They count toward capacity at the upgrade gate.
     */
    public int getPendingCount() {
        return pendingIds.size();
    }
}
