package in.shopwire.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.connection.AuthCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Consumer side of the realtime protocol: one logical subscription kept alive
 * across physical reconnects.
 *
 * Every state transition runs on the client's single scheduler thread, so the
 * state machine itself needs no locking. Public methods only enqueue work.
 *
 * Usage:
 * <pre>
 * RealtimeClient client = RealtimeClient.builder()
 *     .uri(URI.create("ws://localhost:3001/ws"))
 *     .credentials(() -> session.toCredential())
 *     .listener(new ClientListener() {
 *         public void onEvent(ClientEvent event) { render(event); }
 *     })
 *     .build();
 * client.subscribe("orders");
 * client.connect();
 * </pre>
 */
public final class RealtimeClient {
    private static final Logger log = LoggerFactory.getLogger(RealtimeClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Server error codes after which retrying cannot help. */
    static final Set<ErrorCode> TERMINAL_CODES = EnumSet.of(
        ErrorCode.UNAUTHENTICATED,
        ErrorCode.SESSION_EXPIRED,
        ErrorCode.SESSION_REVOKED,
        ErrorCode.ORIGIN_NOT_ALLOWED,
        ErrorCode.POLICY_VIOLATION
    );

    private final URI uri;
    private final Supplier<AuthCredential> credentials;
    private final ClientTransport transport;
    private final ReconnectionPolicy policy;
    private final Duration heartbeatInterval;
    private final int maxMissedHeartbeats;
    private final Duration handshakeTimeout;
    private final int offlineQueueCapacity;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private final List<ClientListener> listeners = new CopyOnWriteArrayList<>();

    // ═══ State below is only touched on the executor thread ═══
    private volatile ClientState state = ClientState.DISCONNECTED;
    private final Set<String> desired = new LinkedHashSet<>();
    private final Set<String> awaitingAck = new LinkedHashSet<>();
    private final Deque<String> offlineQueue = new ArrayDeque<>();
    private ClientTransport.Socket socket;
    private long generation = 0;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> handshakeTask;
    private boolean authAcked;
    private boolean pingOutstanding;
    private int missedHeartbeats;
    private long lastPingSentAt;

    private final AtomicLong latencyMs = new AtomicLong(-1);

    private RealtimeClient(Builder b) {
        this.uri = b.uri;
        this.credentials = b.credentials;
        this.transport = b.transport;
        this.policy = b.policy;
        this.heartbeatInterval = b.heartbeatInterval;
        this.maxMissedHeartbeats = b.maxMissedHeartbeats;
        this.handshakeTimeout = b.handshakeTimeout != null
            ? b.handshakeTimeout
            : b.heartbeatInterval.multipliedBy(b.maxMissedHeartbeats);
        this.offlineQueueCapacity = b.offlineQueueCapacity;
        this.clock = b.clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "realtime-client");
            t.setDaemon(true);
            return t;
        });
        this.listeners.addAll(b.listeners);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ═══════════════════════════════════════════════════════════════
    // Public API
    // ═══════════════════════════════════════════════════════════════

    public void connect() {
        executor.execute(() -> {
            if (state != ClientState.DISCONNECTED && state != ClientState.OFFLINE) {
                log.debug("connect() ignored in state {}", state);
                return;
            }
            policy.reset();
            openSocket();
        });
    }

    /**
     * Close the socket and stop reconnecting. {@link #connect()} may be called again later.
     */
    public void disconnect() {
        executor.execute(() -> {
            cancelReconnect();
            cancelHandshakeTimeout();
            stopHeartbeat();
            generation++;
            if (socket != null) {
                socket.close(1000, "client disconnect");
                socket = null;
            }
            awaitingAck.clear();
            authAcked = false;
            transition(ClientState.DISCONNECTED);
        });
    }

    /**
     * Disconnect and release the client thread.
     */
    public void close() {
        disconnect();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Add a namespace to the desired set. Sent now once the server has
     * acknowledged auth, otherwise replayed after the next authentication.
     */
    public void subscribe(String namespace) {
        executor.execute(() -> {
            if (!desired.add(namespace) || !authAcked) {
                return;
            }
            if (state == ClientState.AUTHENTICATING) {
                // Joins the resubscribe round still in flight
                awaitingAck.add(namespace);
            }
            sendNow(frame("subscribe", namespace));
        });
    }

    public void unsubscribe(String namespace) {
        executor.execute(() -> {
            if (!desired.remove(namespace) || !authAcked) {
                return;
            }
            sendNow(frame("unsubscribe", namespace));
            if (awaitingAck.remove(namespace) && state == ClientState.AUTHENTICATING && awaitingAck.isEmpty()) {
                markSubscribed();
            }
        });
    }

    /**
     * Send a raw frame; queued (oldest dropped when full) until subscribed.
     */
    public void send(String text) {
        executor.execute(() -> {
            if (state == ClientState.SUBSCRIBED && socket != null) {
                sendNow(text);
                return;
            }
            if (offlineQueue.size() >= offlineQueueCapacity) {
                offlineQueue.pollFirst();
            }
            offlineQueue.addLast(text);
        });
    }

    public void addListener(ClientListener listener) {
        listeners.add(listener);
    }

    public ClientState getState() {
        return state;
    }

    /**
     * Round trip of the last answered client ping, or -1.
     */
    public long getLatencyMs() {
        return latencyMs.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // Connection lifecycle (executor thread)
    // ═══════════════════════════════════════════════════════════════

    private void openSocket() {
        reconnectTask = null;
        long attempt = ++generation;
        authAcked = false;
        transition(ClientState.CONNECTING);
        log.info("Connecting to {}", uri);
        armHandshakeTimeout(attempt);

        transport.open(uri, new ClientTransport.Listener() {
            @Override
            public void onText(String text) {
                onExecutor(attempt, () -> handleFrame(text));
            }

            @Override
            public void onClose(int code, String reason) {
                onExecutor(attempt, () -> handleClose(code, reason));
            }

            @Override
            public void onError(Throwable error) {
                onExecutor(attempt, () -> connectionLost("transport error: " + error));
            }
        }).whenComplete((opened, error) -> onExecutor(attempt, () -> {
            if (error != null) {
                connectionLost("connect failed: " + error);
                return;
            }
            socket = opened;
            transition(ClientState.AUTHENTICATING);
            sendNow(authFrame());
        }));
    }

    private void onExecutor(long attempt, Runnable task) {
        try {
            executor.execute(() -> {
                if (attempt == generation) {
                    task.run();
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Client closed, dropping callback");
        }
    }

    private void handleFrame(String text) {
        JsonNode frame;
        try {
            frame = MAPPER.readTree(text);
        } catch (Exception e) {
            log.warn("Ignoring malformed frame: {}", e.getMessage());
            return;
        }
        String type = frame.path("type").asText("");

        switch (type) {
            case "connected" -> log.debug("Server assigned {}", frame.path("connectionId").asText());
            case "ack" -> handleAck(frame);
            case "error" -> handleError(frame);
            case "ping" -> sendNow("{\"type\":\"pong\"}");
            case "pong" -> {
                if (pingOutstanding) {
                    latencyMs.set(clock.millis() - lastPingSentAt);
                }
                pingOutstanding = false;
                missedHeartbeats = 0;
            }
            default -> {
                ClientEvent event = new ClientEvent(type, frame.path("namespace").asText(null),
                    frame.path("payload"), frame.path("timestamp").asLong());
                notifyListeners(l -> l.onEvent(event));
            }
        }
    }

    private void handleAck(JsonNode frame) {
        String action = frame.path("action").asText("");
        switch (action) {
            case "auth" -> {
                if (state != ClientState.AUTHENTICATING) {
                    return;
                }
                authAcked = true;
                awaitingAck.clear();
                awaitingAck.addAll(desired);
                if (awaitingAck.isEmpty()) {
                    markSubscribed();
                    return;
                }
                for (String namespace : awaitingAck) {
                    sendNow(frame("subscribe", namespace));
                }
            }
            case "subscribe" -> {
                awaitingAck.remove(frame.path("namespace").asText());
                if (state == ClientState.AUTHENTICATING && awaitingAck.isEmpty()) {
                    markSubscribed();
                }
            }
            default -> log.debug("Ack for {}", action);
        }
    }

    private void handleError(JsonNode frame) {
        ErrorCode code = ErrorCode.fromWire(frame.path("code").asText(null));
        String message = frame.path("message").asText("");
        log.warn("Server error {}: {}", code, message);
        notifyListeners(l -> l.onError(code, message));

        if (code != null && TERMINAL_CODES.contains(code)) {
            goOffline(code);
            return;
        }

        // A namespace we may not see is dropped from the desired set instead of blocking resubscription
        if (code == ErrorCode.FORBIDDEN_NAMESPACE || code == ErrorCode.INVALID_NAMESPACE) {
            String rejected = frame.path("namespace").asText(null);
            if (rejected != null) {
                desired.remove(rejected);
                awaitingAck.remove(rejected);
            }
            if (state == ClientState.AUTHENTICATING && authAcked && awaitingAck.isEmpty()) {
                markSubscribed();
            }
            return;
        }

        // Anything else during the handshake (rate limited, capacity) leaves it stalled: start over
        if (state == ClientState.AUTHENTICATING) {
            connectionLost("handshake failed: " + code);
        }
    }

    private void handleClose(int code, String reason) {
        socket = null;
        ErrorCode errorCode = ErrorCode.fromWire(reason);
        if (errorCode != null && TERMINAL_CODES.contains(errorCode)) {
            goOffline(errorCode);
            return;
        }
        connectionLost("closed " + code + " " + reason);
    }

    private void markSubscribed() {
        cancelHandshakeTimeout();
        transition(ClientState.SUBSCRIBED);
        policy.recordSuccess();
        missedHeartbeats = 0;
        pingOutstanding = false;
        startHeartbeat();

        while (!offlineQueue.isEmpty()) {
            sendNow(offlineQueue.pollFirst());
        }
        log.info("Connected and subscribed to {}", desired);
        notifyListeners(ClientListener::onConnected);
    }

    /**
     * Unexpected loss of the connection: back off and retry, or give up.
     */
    private void connectionLost(String why) {
        if (state == ClientState.OFFLINE || state == ClientState.DISCONNECTED || state == ClientState.RECONNECTING) {
            return;
        }
        cancelHandshakeTimeout();
        stopHeartbeat();
        generation++;
        if (socket != null) {
            socket.close(1000, "reconnecting");
            socket = null;
        }
        awaitingAck.clear();
        authAcked = false;

        if (!policy.shouldRetry()) {
            log.warn("Giving up after {} attempts ({})", policy.getAttemptCount(), why);
            goOffline(null);
            return;
        }

        Duration delay = policy.getNextDelay();
        policy.recordFailure();
        int attempt = policy.getAttemptCount();
        log.info("Connection lost ({}), reconnect attempt {} in {}ms", why, attempt, delay.toMillis());
        transition(ClientState.RECONNECTING);
        notifyListeners(l -> l.onReconnecting(attempt, delay));
        reconnectTask = executor.schedule(this::openSocket, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void goOffline(ErrorCode reason) {
        cancelReconnect();
        cancelHandshakeTimeout();
        stopHeartbeat();
        generation++;
        if (socket != null) {
            socket.close(1000, "offline");
            socket = null;
        }
        awaitingAck.clear();
        authAcked = false;
        transition(ClientState.OFFLINE);
        notifyListeners(l -> l.onOffline(reason));
    }

    /**
     * Connect, auth and the resubscribe round must all finish within the
     * handshake timeout, or the attempt counts as a lost connection.
     */
    private void armHandshakeTimeout(long attempt) {
        cancelHandshakeTimeout();
        handshakeTask = executor.schedule(() -> {
            if (attempt != generation) {
                return;
            }
            if (state == ClientState.CONNECTING || state == ClientState.AUTHENTICATING) {
                log.warn("Handshake not finished within {}ms (state {}, awaiting {})",
                    handshakeTimeout.toMillis(), state, awaitingAck);
                connectionLost("handshake timeout");
            }
        }, handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelHandshakeTimeout() {
        if (handshakeTask != null) {
            handshakeTask.cancel(false);
            handshakeTask = null;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Heartbeat (executor thread)
    // ═══════════════════════════════════════════════════════════════

    private void startHeartbeat() {
        stopHeartbeat();
        heartbeatTask = executor.scheduleAtFixedRate(this::heartbeatTick,
            heartbeatInterval.toMillis(), heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    private void heartbeatTick() {
        if (state != ClientState.SUBSCRIBED) {
            return;
        }
        if (pingOutstanding) {
            missedHeartbeats++;
            if (missedHeartbeats >= maxMissedHeartbeats) {
                log.warn("{} heartbeats unanswered, reconnecting", missedHeartbeats);
                connectionLost("heartbeat timeout");
                return;
            }
        }
        lastPingSentAt = clock.millis();
        pingOutstanding = true;
        sendNow("{\"type\":\"ping\"}");
    }

    // ═══════════════════════════════════════════════════════════════

    private void sendNow(String text) {
        ClientTransport.Socket current = socket;
        if (current == null) {
            return;
        }
        long attempt = generation;
        current.send(text).whenComplete((ignored, error) -> {
            if (error != null) {
                onExecutor(attempt, () -> connectionLost("send failed: " + error));
            }
        });
    }

    private String authFrame() {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", "auth");
        frame.set("data", MAPPER.valueToTree(credentials.get()));
        return frame.toString();
    }

    private static String frame(String type, String namespace) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", type);
        frame.putObject("data").put("namespace", namespace);
        return frame.toString();
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void transition(ClientState next) {
        ClientState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.debug("State {} -> {}", previous, next);
        notifyListeners(l -> l.onStateChange(previous, next));
    }

    private void notifyListeners(Consumer<ClientListener> call) {
        for (ClientListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Exception e) {
                log.error("Client listener threw", e);
            }
        }
    }

    /**
     * Builder for RealtimeClient.
     */
    public static final class Builder {
        private URI uri;
        private Supplier<AuthCredential> credentials;
        private ClientTransport transport;
        private ReconnectionPolicy policy = ReconnectionPolicy.forRealtimeClient();
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int maxMissedHeartbeats = 2;
        private Duration handshakeTimeout;
        private int offlineQueueCapacity = 100;
        private Clock clock = Clock.systemUTC();
        private final List<ClientListener> listeners = new CopyOnWriteArrayList<>();

        public Builder uri(URI uri) {
            this.uri = uri;
            return this;
        }

        /**
         * Called on every (re)connect, so a refreshed session is picked up.
         */
        public Builder credentials(Supplier<AuthCredential> credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder transport(ClientTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder policy(ReconnectionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
                throw new IllegalArgumentException("Heartbeat interval must be positive");
            }
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder maxMissedHeartbeats(int maxMissedHeartbeats) {
            if (maxMissedHeartbeats <= 0) {
                throw new IllegalArgumentException("Max missed heartbeats must be positive");
            }
            this.maxMissedHeartbeats = maxMissedHeartbeats;
            return this;
        }

        /**
         * Defaults to heartbeatInterval * maxMissedHeartbeats.
         */
        public Builder handshakeTimeout(Duration handshakeTimeout) {
            if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
                throw new IllegalArgumentException("Handshake timeout must be positive");
            }
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder offlineQueueCapacity(int offlineQueueCapacity) {
            if (offlineQueueCapacity <= 0) {
                throw new IllegalArgumentException("Offline queue capacity must be positive");
            }
            this.offlineQueueCapacity = offlineQueueCapacity;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder listener(ClientListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public RealtimeClient build() {
            if (uri == null) {
                throw new IllegalArgumentException("URI is required");
            }
            if (credentials == null) {
                throw new IllegalArgumentException("Credentials supplier is required");
            }
            if (transport == null) {
                transport = new JdkClientTransport();
            }
            return new RealtimeClient(this);
        }
    }
}
