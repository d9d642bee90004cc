package in.shopwire.metrics;

import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.common.Role;
import in.shopwire.domain.event.DeliveryReport;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of RealtimeMetrics.
 *
 * Key Metrics:
 * - ws_connections_active{role} - Registered connections
 * - ws_connections_closed_total{role, reason} - Connections that left the registry
 * - ws_admission_rejected_total{code} - Refused handshakes and auth attempts
 * - ws_events_total{type, outcome} - Broadcasts (accepted / rejected)
 * - ws_deliveries_total{result} - Per-connection deliveries (delivered / dropped / skipped)
 * - ws_rate_limit_hits_total - Frames refused by the inbound limiter
 * - ws_heartbeat_evictions_total - Connections evicted for missing pongs
 *
 * Usage:
 * <pre>
 * PrometheusRealtimeMetrics metrics = new PrometheusRealtimeMetrics(new CollectorRegistry());
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusRealtimeMetrics implements RealtimeMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusRealtimeMetrics.class);

    private final CollectorRegistry registry;

    // Connection metrics
    private final Gauge activeConnections;
    private final Counter closedConnections;
    private final Counter admissionRejected;

    // Authentication metrics
    private final Counter authCounter;
    private final Histogram authLatency;

    // Broadcast metrics
    private final Counter eventCounter;
    private final Counter deliveryCounter;
    private final Histogram fanOut;
    private final Counter broadcastQueueOverflow;

    // Inbound policing
    private final Counter rateLimitHits;
    private final Counter protocolViolations;
    private final Counter heartbeatEvictions;

    public PrometheusRealtimeMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRealtimeMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.activeConnections = Gauge.build()
            .name("ws_connections_active")
            .help("Registered WebSocket connections")
            .labelNames("role")
            .register(registry);

        this.closedConnections = Counter.build()
            .name("ws_connections_closed_total")
            .help("Connections removed from the registry")
            .labelNames("role", "reason")
            .register(registry);

        this.admissionRejected = Counter.build()
            .name("ws_admission_rejected_total")
            .help("Connections refused before registration")
            .labelNames("code")
            .register(registry);

        this.authCounter = Counter.build()
            .name("ws_authentications_total")
            .help("Authentication attempts")
            .labelNames("status")
            .register(registry);

        this.authLatency = Histogram.build()
            .name("ws_authentication_latency_seconds")
            .help("Authentication latency in seconds")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.eventCounter = Counter.build()
            .name("ws_events_total")
            .help("Events handed to the broadcaster")
            .labelNames("type", "outcome")
            .register(registry);

        this.deliveryCounter = Counter.build()
            .name("ws_deliveries_total")
            .help("Per-connection delivery outcomes")
            .labelNames("result")
            .register(registry);

        this.fanOut = Histogram.build()
            .name("ws_broadcast_fanout")
            .help("Eligible connections per broadcast")
            .buckets(0, 1, 10, 100, 1000, 10000)
            .register(registry);

        this.broadcastQueueOverflow = Counter.build()
            .name("ws_broadcast_queue_overflow_total")
            .help("Events dropped because the dispatcher queue was full")
            .register(registry);

        this.rateLimitHits = Counter.build()
            .name("ws_rate_limit_hits_total")
            .help("Inbound frames refused by the rate limiter")
            .register(registry);

        this.protocolViolations = Counter.build()
            .name("ws_protocol_violations_total")
            .help("Oversized or malformed inbound frames")
            .labelNames("code")
            .register(registry);

        this.heartbeatEvictions = Counter.build()
            .name("ws_heartbeat_evictions_total")
            .help("Connections evicted for missing the pong deadline")
            .register(registry);

        log.info("[PrometheusRealtimeMetrics] Initialized");
    }

    @Override
    public void recordConnectionOpened(Role role) {
        activeConnections.labels(role.wireName()).inc();
    }

    @Override
    public void recordConnectionClosed(Role role, String reason) {
        activeConnections.labels(role.wireName()).dec();
        closedConnections.labels(role.wireName(), reason).inc();
    }

    @Override
    public void recordAdmissionRejected(ErrorCode code) {
        admissionRejected.labels(code.name()).inc();
    }

    @Override
    public void recordAuthentication(boolean success, Duration latency) {
        authCounter.labels(success ? "success" : "failure").inc();
        authLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordBroadcast(DeliveryReport report) {
        eventCounter.labels(report.eventType(), report.accepted() ? "accepted" : "rejected").inc();
        if (!report.accepted()) {
            return;
        }
        deliveryCounter.labels("delivered").inc(report.delivered());
        deliveryCounter.labels("dropped").inc(report.dropped());
        deliveryCounter.labels("skipped").inc(report.skipped());
        fanOut.observe(report.eligible());
    }

    @Override
    public void recordBroadcastQueueOverflow() {
        broadcastQueueOverflow.inc();
    }

    @Override
    public void recordRateLimitHit() {
        rateLimitHits.inc();
    }

    @Override
    public void recordProtocolViolation(ErrorCode code) {
        protocolViolations.labels(code.name()).inc();
    }

    @Override
    public void recordHeartbeatEviction() {
        heartbeatEvictions.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
