package in.shopwire.bootstrap;

import in.shopwire.auth.Authenticator;
import in.shopwire.auth.RevocationListSessionValidator;
import in.shopwire.config.RealtimeConfig;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.metrics.PrometheusRealtimeMetrics;
import in.shopwire.service.broadcast.EventBroadcaster;
import in.shopwire.service.broadcast.EventEmitter;
import in.shopwire.transport.http.AdmissionHandler;
import in.shopwire.transport.http.CorsHandler;
import in.shopwire.transport.http.IntrospectionHandler;
import in.shopwire.transport.http.PrometheusMetricsHandler;
import in.shopwire.transport.ws.ConnectionRegistry;
import in.shopwire.transport.ws.HeartbeatMonitor;
import in.shopwire.transport.ws.WsHub;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shopwire realtime server.
 *
 * Wires:
 * - Connection registry with capacity limit and namespace index
 * - Authenticator backed by the session revocation list
 * - WebSocket hub (auth frame, subscriptions, rate limit, heartbeat)
 * - Event broadcaster and the typed emitter used by domain services
 * - HTTP: /info, /stats (admin), /health, /metrics
 *
 * {@link #start()} and {@link #shutdown()} are explicit so tests can run the
 * whole server in-process; {@link #main} adds a JVM shutdown hook.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Duration SESSION_LOOKUP_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration REVOCATION_CLEANUP_INTERVAL = Duration.ofMinutes(10);

    private final RealtimeConfig config;
    private final Clock clock;
    private final PrometheusRealtimeMetrics metrics;
    private final RevocationListSessionValidator sessions;
    private final Authenticator authenticator;
    private final ConnectionRegistry registry;
    private final ExecutorService deliveryPool;
    private final HeartbeatMonitor heartbeat;
    private final WsHub hub;
    private final EventBroadcaster broadcaster;
    private final EventEmitter emitter;
    private final ScheduledExecutorService maintenance;
    private final Undertow server;

    private volatile boolean started = false;
    private volatile boolean stopped = false;

    public App(RealtimeConfig config) {
        this(config, Clock.systemUTC(), new CollectorRegistry());
    }

    public App(RealtimeConfig config, Clock clock, CollectorRegistry collectors) {
        this.config = config;
        this.clock = clock;

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        this.metrics = new PrometheusRealtimeMetrics(collectors);

        // ═══════════════════════════════════════════════════════════════
        // Session validation
        // ═══════════════════════════════════════════════════════════════
        this.sessions = new RevocationListSessionValidator(clock);
        this.authenticator = new Authenticator(sessions, SESSION_LOOKUP_TIMEOUT, clock, metrics);

        // ═══════════════════════════════════════════════════════════════
        // Connection registry + WebSocket hub
        // ═══════════════════════════════════════════════════════════════
        this.registry = new ConnectionRegistry(config.getMaxConnections(), metrics);
        this.deliveryPool = Executors.newFixedThreadPool(config.getDeliveryThreads(), daemonFactory("ws-delivery"));
        this.heartbeat = new HeartbeatMonitor(registry, config.getPingInterval(), config.getPongTimeout(),
            config.getHeartbeatTick(), clock, metrics);
        this.hub = new WsHub(config, registry, authenticator, heartbeat, deliveryPool, metrics, clock);

        // ═══════════════════════════════════════════════════════════════
        // Event broadcaster
        // ═══════════════════════════════════════════════════════════════
        this.broadcaster = new EventBroadcaster(registry, metrics, config.getBroadcastQueueCapacity());
        this.emitter = new EventEmitter(broadcaster);

        this.maintenance = Executors.newSingleThreadScheduledExecutor(daemonFactory("session-cleanup"));

        // ═══════════════════════════════════════════════════════════════
        // HTTP routes
        // ═══════════════════════════════════════════════════════════════
        IntrospectionHandler introspection = new IntrospectionHandler(config, registry, authenticator, clock);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(collectors);

        RoutingHandler routes = Handlers.routing()
            .get(config.getPath(), new AdmissionHandler(config, registry, hub::getPendingCount, metrics,
                hub.websocketHandler()))
            .get("/info", introspection::info)
            .get("/stats", introspection::stats)
            .get("/health", introspection::health)
            .get("/metrics", metricsHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Shopwire realtime\n\n" +
                    "WS:   ws://" + config.getHost() + ":" + config.getPort() + config.getPath() + "\n" +
                    "HTTP: GET /info, /stats (admin), /health, /metrics\n"
                );
            });

        this.server = Undertow.builder()
            .addHttpListener(config.getPort(), config.getHost())
            .setHandler(new CorsHandler(config, routes))
            .build();
    }

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Shopwire Realtime Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        RealtimeConfig config = RealtimeConfig.fromEnv();
        log.info("Config: {}", config);

        App app = new App(config, Clock.systemUTC(), CollectorRegistry.defaultRegistry);
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown"));
        app.start();
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;

        heartbeat.start();
        log.info("✓ Heartbeat monitor started (ping every {}ms, pong timeout {}ms)",
            config.getPingInterval().toMillis(), config.getPongTimeout().toMillis());

        broadcaster.start();
        log.info("✓ Event broadcaster started");

        long cleanupMs = REVOCATION_CLEANUP_INTERVAL.toMillis();
        maintenance.scheduleAtFixedRate(this::cleanupRevocations, cleanupMs, cleanupMs, TimeUnit.MILLISECONDS);

        server.start();
        log.info("✓ Realtime server started on ws://{}:{}{} (max {} connections)",
            config.getHost(), getPort(), config.getPath(), config.getMaxConnections());
    }

    /**
     * Stop accepting work, close every connection with 1001 and release threads.
     * Safe to call more than once and while broadcasts are in flight.
     */
    public synchronized void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        log.info("Shutting down realtime server ({} connections)", registry.size());

        heartbeat.stop();
        broadcaster.stop();
        hub.stop();
        int closed = registry.drain(ErrorCode.SHUTTING_DOWN);
        log.info("✓ Closed {} connections", closed);

        maintenance.shutdownNow();
        deliveryPool.shutdown();
        try {
            if (!deliveryPool.awaitTermination(5, TimeUnit.SECONDS)) {
                deliveryPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (started) {
            server.stop();
        }
        log.info("✓ Realtime server stopped");
    }

    private void cleanupRevocations() {
        try {
            int pruned = sessions.cleanup();
            if (pruned > 0) {
                log.info("Pruned {} expired session revocations", pruned);
            }
        } catch (Exception e) {
            log.error("Revocation cleanup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        if (!started || stopped || server.getListenerInfo().isEmpty()) {
            return config.getPort();
        }
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public EventEmitter getEmitter() {
        return emitter;
    }

    public EventBroadcaster getBroadcaster() {
        return broadcaster;
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    public RevocationListSessionValidator getSessions() {
        return sessions;
    }

    private static ThreadFactory daemonFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
