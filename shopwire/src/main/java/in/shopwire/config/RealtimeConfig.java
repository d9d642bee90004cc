package in.shopwire.config;

import in.shopwire.util.Env;

import java.time.Duration;
import java.util.List;

/**
 * Tunables of the realtime server. Read once at startup and never mutated.
 *
 * Usage:
 * <pre>
 * RealtimeConfig config = RealtimeConfig.fromEnv();      // production
 * RealtimeConfig config = RealtimeConfig.builder()       // tests
 *     .maxConnections(3)
 *     .pingInterval(Duration.ofMillis(200))
 *     .build();
 * </pre>
 */
public final class RealtimeConfig {

    private final int port;
    private final String host;
    private final String path;
    private final int maxConnections;
    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final Duration heartbeatTick;
    private final Duration rateLimitWindow;
    private final int rateLimitMaxEvents;
    private final List<String> allowedOrigins;
    private final int maxPayloadBytes;
    private final int maxViolations;
    private final Duration authTimeout;
    private final int outboundQueueCapacity;
    private final int deliveryThreads;
    private final int broadcastQueueCapacity;

    private RealtimeConfig(Builder b) {
        this.port = b.port;
        this.host = b.host;
        this.path = b.path;
        this.maxConnections = b.maxConnections;
        this.pingInterval = b.pingInterval;
        this.pongTimeout = b.pongTimeout;
        this.heartbeatTick = b.heartbeatTick;
        this.rateLimitWindow = b.rateLimitWindow;
        this.rateLimitMaxEvents = b.rateLimitMaxEvents;
        this.allowedOrigins = List.copyOf(b.allowedOrigins);
        this.maxPayloadBytes = b.maxPayloadBytes;
        this.maxViolations = b.maxViolations;
        this.authTimeout = b.authTimeout;
        this.outboundQueueCapacity = b.outboundQueueCapacity;
        this.deliveryThreads = b.deliveryThreads;
        this.broadcastQueueCapacity = b.broadcastQueueCapacity;
    }

    /**
     * Load configuration from environment variables (or system properties), falling back to defaults.
     */
    public static RealtimeConfig fromEnv() {
        Builder defaults = new Builder();
        return builder()
            .port(Env.getInt("WS_PORT", defaults.port))
            .host(Env.get("WS_HOST", defaults.host))
            .path(Env.get("WS_PATH", defaults.path))
            .maxConnections(Env.getInt("WS_MAX_CONNECTIONS", defaults.maxConnections))
            .pingInterval(Duration.ofMillis(Env.getLong("WS_PING_INTERVAL_MS", defaults.pingInterval.toMillis())))
            .pongTimeout(Duration.ofMillis(Env.getLong("WS_PONG_TIMEOUT_MS", defaults.pongTimeout.toMillis())))
            .heartbeatTick(Duration.ofMillis(Env.getLong("WS_HEARTBEAT_TICK_MS", defaults.heartbeatTick.toMillis())))
            .rateLimitWindow(Duration.ofMillis(Env.getLong("WS_RATE_LIMIT_WINDOW_MS", defaults.rateLimitWindow.toMillis())))
            .rateLimitMaxEvents(Env.getInt("WS_RATE_LIMIT_MAX_EVENTS", defaults.rateLimitMaxEvents))
            .allowedOrigins(Env.getList("ALLOWED_ORIGINS", defaults.allowedOrigins))
            .maxPayloadBytes(Env.getInt("WS_MAX_PAYLOAD_BYTES", defaults.maxPayloadBytes))
            .maxViolations(Env.getInt("WS_MAX_VIOLATIONS", defaults.maxViolations))
            .authTimeout(Duration.ofMillis(Env.getLong("WS_AUTH_TIMEOUT_MS", defaults.authTimeout.toMillis())))
            .outboundQueueCapacity(Env.getInt("WS_OUTBOUND_QUEUE_CAPACITY", defaults.outboundQueueCapacity))
            .deliveryThreads(Env.getInt("WS_DELIVERY_THREADS", defaults.deliveryThreads))
            .broadcastQueueCapacity(Env.getInt("WS_BROADCAST_QUEUE_CAPACITY", defaults.broadcastQueueCapacity))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getPort() { return port; }
    public String getHost() { return host; }
    public String getPath() { return path; }
    public int getMaxConnections() { return maxConnections; }
    public Duration getPingInterval() { return pingInterval; }
    public Duration getPongTimeout() { return pongTimeout; }
    public Duration getHeartbeatTick() { return heartbeatTick; }
    public Duration getRateLimitWindow() { return rateLimitWindow; }
    public int getRateLimitMaxEvents() { return rateLimitMaxEvents; }
    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public int getMaxPayloadBytes() { return maxPayloadBytes; }
    public int getMaxViolations() { return maxViolations; }
    public Duration getAuthTimeout() { return authTimeout; }
    public int getOutboundQueueCapacity() { return outboundQueueCapacity; }
    public int getDeliveryThreads() { return deliveryThreads; }
    public int getBroadcastQueueCapacity() { return broadcastQueueCapacity; }

    public boolean allowsAllOrigins() {
        return allowedOrigins.contains("*");
    }

    @Override
    public String toString() {
        return "RealtimeConfig{port=" + port + ", path=" + path + ", maxConnections=" + maxConnections
            + ", pingInterval=" + pingInterval + ", pongTimeout=" + pongTimeout
            + ", rateLimit=" + rateLimitMaxEvents + "/" + rateLimitWindow
            + ", allowedOrigins=" + allowedOrigins + ", maxPayloadBytes=" + maxPayloadBytes + "}";
    }

    /**
     * Builder for RealtimeConfig. Each setter validates its own argument;
     * {@link #build()} checks cross-field constraints.
     */
    public static final class Builder {
        private int port = 3001;
        private String host = "0.0.0.0";
        private String path = "/ws";
        private int maxConnections = 10_000;
        private Duration pingInterval = Duration.ofSeconds(30);
        private Duration pongTimeout = Duration.ofSeconds(5);
        private Duration heartbeatTick = Duration.ofSeconds(1);
        private Duration rateLimitWindow = Duration.ofSeconds(60);
        private int rateLimitMaxEvents = 100;
        private List<String> allowedOrigins = List.of("*");
        private int maxPayloadBytes = 1024 * 1024;
        private int maxViolations = 5;
        private Duration authTimeout = Duration.ofSeconds(10);
        private int outboundQueueCapacity = 256;
        private int deliveryThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private int broadcastQueueCapacity = 100_000;

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder path(String path) {
            if (path == null || !path.startsWith("/")) {
                throw new IllegalArgumentException("Path must start with '/'");
            }
            this.path = path;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = positive(maxConnections, "Max connections");
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = positive(pingInterval, "Ping interval");
            return this;
        }

        public Builder pongTimeout(Duration pongTimeout) {
            this.pongTimeout = positive(pongTimeout, "Pong timeout");
            return this;
        }

        public Builder heartbeatTick(Duration heartbeatTick) {
            this.heartbeatTick = positive(heartbeatTick, "Heartbeat tick");
            return this;
        }

        public Builder rateLimitWindow(Duration rateLimitWindow) {
            this.rateLimitWindow = positive(rateLimitWindow, "Rate limit window");
            return this;
        }

        public Builder rateLimitMaxEvents(int rateLimitMaxEvents) {
            this.rateLimitMaxEvents = positive(rateLimitMaxEvents, "Rate limit");
            return this;
        }

        public Builder allowedOrigins(List<String> allowedOrigins) {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                throw new IllegalArgumentException("Allowed origins must not be empty (use \"*\" to allow all)");
            }
            this.allowedOrigins = allowedOrigins;
            return this;
        }

        public Builder maxPayloadBytes(int maxPayloadBytes) {
            this.maxPayloadBytes = positive(maxPayloadBytes, "Max payload");
            return this;
        }

        public Builder maxViolations(int maxViolations) {
            this.maxViolations = positive(maxViolations, "Max violations");
            return this;
        }

        public Builder authTimeout(Duration authTimeout) {
            this.authTimeout = positive(authTimeout, "Auth timeout");
            return this;
        }

        public Builder outboundQueueCapacity(int outboundQueueCapacity) {
            this.outboundQueueCapacity = positive(outboundQueueCapacity, "Outbound queue capacity");
            return this;
        }

        public Builder deliveryThreads(int deliveryThreads) {
            this.deliveryThreads = positive(deliveryThreads, "Delivery threads");
            return this;
        }

        public Builder broadcastQueueCapacity(int broadcastQueueCapacity) {
            this.broadcastQueueCapacity = positive(broadcastQueueCapacity, "Broadcast queue capacity");
            return this;
        }

        public RealtimeConfig build() {
            if (heartbeatTick.compareTo(pongTimeout) > 0) {
                throw new IllegalArgumentException("Heartbeat tick cannot exceed pong timeout");
            }
            return new RealtimeConfig(this);
        }

        private static int positive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
