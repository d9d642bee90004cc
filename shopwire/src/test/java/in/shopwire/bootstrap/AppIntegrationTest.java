package in.shopwire.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.shopwire.auth.Authenticator;
import in.shopwire.client.ClientEvent;
import in.shopwire.client.ClientListener;
import in.shopwire.client.ClientState;
import in.shopwire.client.JdkClientTransport;
import in.shopwire.client.RealtimeClient;
import in.shopwire.client.ReconnectionPolicy;
import in.shopwire.config.RealtimeConfig;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.connection.AuthCredential;
import in.shopwire.domain.event.payload.OrderSummary;
import in.shopwire.service.broadcast.EventEmitter;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test: the whole server on an ephemeral port, driven over real
 * HTTP and WebSocket connections.
 *
 * Tests:
 * - /info, /health, /metrics
 * - /stats requires an admin bearer credential
 * - Disallowed origins are refused before the upgrade
 * - Client authenticates, subscribes and receives only its own order events
 * - Revoked sessions are refused
 * - Shutdown closes clients with a retryable code
 */
public class AppIntegrationTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ORIGIN = "https://shop.example";
    private static final Duration WAIT = Duration.ofSeconds(10);

    private App app;
    private HttpClient http;
    private final List<RealtimeClient> clients = new ArrayList<>();

    @BeforeEach
    public void setUp() {
        RealtimeConfig config = RealtimeConfig.builder()
            .port(0)
            .host("localhost")
            .allowedOrigins(List.of(ORIGIN))
            .maxConnections(10)
            .build();
        app = new App(config, Clock.systemUTC(), new CollectorRegistry());
        app.start();

        http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        clients.forEach(RealtimeClient::close);
        app.shutdown();
    }

    // ═══════════════════════════════════════════════════════════════
    // HTTP endpoints
    // ═══════════════════════════════════════════════════════════════

    @Test
    public void testInfoEndpoint() throws Exception {
        HttpResponse<String> response = get("/info", null);

        assertEquals(200, response.statusCode());
        JsonNode info = MAPPER.readTree(response.body());
        assertEquals("/ws", info.path("path").asText());
        assertTrue(info.path("namespaces").toString().contains("\"orders\""));
        assertTrue(info.path("eventTypes").path("orders").toString().contains("order:created"));
        assertEquals(100, info.path("limits").path("rateLimitMaxEvents").asInt());
    }

    @Test
    public void testHealthAndMetrics() throws Exception {
        HttpResponse<String> health = get("/health", null);
        assertEquals(200, health.statusCode());
        assertEquals("ok", MAPPER.readTree(health.body()).path("status").asText());

        HttpResponse<String> metrics = get("/metrics", null);
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("ws_connections_active"), "Realtime metrics should be exported");
    }

    @Test
    @DisplayName("/stats: 401 without credential, 403 for non-admin, 200 for admin")
    public void testStatsRequiresAdmin() throws Exception {
        assertEquals(401, get("/stats", null).statusCode());
        assertEquals(401, get("/stats", "Bearer not-base64!").statusCode());
        assertEquals(403, get("/stats", bearer("u1", "customer", "sess-c")).statusCode());

        HttpResponse<String> response = get("/stats", bearer("admin-1", "admin", "sess-a"));
        assertEquals(200, response.statusCode());
        JsonNode stats = MAPPER.readTree(response.body());
        assertEquals(0, stats.path("totalConnections").asInt());
        assertEquals(10, stats.path("maxConnections").asInt());
        assertTrue(stats.has("uptimeSeconds"));
    }

    @Test
    public void testDisallowedOriginRejected() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + "/ws"))
            .header("Origin", "https://evil.example")
            .GET()
            .build();

        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(403, response.statusCode());
        assertEquals("ORIGIN_NOT_ALLOWED", MAPPER.readTree(response.body()).path("code").asText());
    }

    @Test
    public void testUnknownPathIs404() throws Exception {
        assertEquals(404, get("/nope", null).statusCode());
    }

    // ═══════════════════════════════════════════════════════════════
    // WebSocket flow
    // ═══════════════════════════════════════════════════════════════

    @Test
    public void testClientReceivesOwnOrderEvents() throws Exception {
        Recorder recorder = new Recorder();
        RealtimeClient client = newClient("u1", "customer", "sess-1", recorder, ReconnectionPolicy.forRealtimeClient());
        client.subscribe("orders");
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        EventEmitter emitter = app.getEmitter();
        emitter.emitOrderEvent(EventEmitter.OrderKind.UPDATED,
            new OrderSummary("o-other", "N-2", "u2", "paid", null, new BigDecimal("10.00"), 1));
        emitter.emitOrderEvent(EventEmitter.OrderKind.UPDATED,
            new OrderSummary("o-mine", "N-1", "u1", "paid", null, new BigDecimal("25.50"), 2));

        awaitTrue(() -> !recorder.events.isEmpty(), "order event should arrive");
        Thread.sleep(200);
        assertEquals(1, recorder.events.size(), "Another customer's order must not be delivered");
        ClientEvent event = recorder.events.get(0);
        assertEquals("order:updated", event.type());
        assertEquals("orders", event.namespace());
        assertEquals("o-mine", event.payload().path("orderId").asText());

        HttpResponse<String> stats = get("/stats", bearer("admin-1", "admin", "sess-a"));
        JsonNode body = MAPPER.readTree(stats.body());
        assertEquals(1, body.path("totalConnections").asInt());
        assertEquals(1, body.path("connectionsByNamespace").path("orders").asInt());
    }

    @Test
    public void testForbiddenNamespaceReported() {
        Recorder recorder = new Recorder();
        RealtimeClient client = newClient("u1", "customer", "sess-1", recorder, ReconnectionPolicy.forRealtimeClient());
        client.subscribe("orders");
        client.subscribe("payments");
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe to what it may see");
        assertEquals(List.of(ErrorCode.FORBIDDEN_NAMESPACE), recorder.errors);
    }

    @Test
    public void testRevokedSessionRefused() {
        app.getSessions().revoke("sess-revoked", Instant.now().plusSeconds(3600));
        Recorder recorder = new Recorder();
        RealtimeClient client = newClient("u1", "customer", "sess-revoked", recorder,
            ReconnectionPolicy.forRealtimeClient());
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.OFFLINE, "revoked client should go offline");
        assertEquals(List.of(ErrorCode.SESSION_REVOKED), recorder.offline);
        assertEquals(0, app.getRegistry().size());
    }

    @Test
    public void testShutdownClosesClientsRetryably() {
        Recorder recorder = new Recorder();
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(50))
            .maxDelay(Duration.ofMillis(50))
            .multiplier(2.0)
            .maxAttempts(1)
            .build();
        RealtimeClient client = newClient("staff-1", "staff", "sess-s", recorder, policy);
        client.subscribe("inventory");
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        app.shutdown();

        awaitTrue(() -> client.getState() == ClientState.OFFLINE, "client should give up once the server is gone");
        assertEquals(1, recorder.reconnects.size(), "Shutdown close is retryable");
        assertEquals(0, app.getRegistry().size());
    }

    // ═══════════════════════════════════════════════════════════════

    private RealtimeClient newClient(String userId, String role, String sessionId,
                                     Recorder recorder, ReconnectionPolicy policy) {
        RealtimeClient client = RealtimeClient.builder()
            .uri(URI.create("ws://localhost:" + app.getPort() + "/ws"))
            .credentials(() -> credential(userId, role, sessionId))
            .transport(new JdkClientTransport(ORIGIN))
            .policy(policy)
            .listener(recorder)
            .build();
        clients.add(client);
        return client;
    }

    private static AuthCredential credential(String userId, String role, String sessionId) {
        return new AuthCredential(userId, role, sessionId, Instant.now().plusSeconds(3600).toEpochMilli());
    }

    private static String bearer(String userId, String role, String sessionId) {
        return "Bearer " + Authenticator.encodeBearer(credential(userId, role, sessionId));
    }

    private String baseUrl() {
        return "http://localhost:" + app.getPort();
    }

    private HttpResponse<String> get(String path, String authorization) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + path))
            .timeout(Duration.ofSeconds(5))
            .GET();
        if (authorization != null) {
            request.header("Authorization", authorization);
        }
        return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static void awaitTrue(BooleanSupplier condition, String message) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out: " + message);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting: " + message);
            }
        }
    }

    private static final class Recorder implements ClientListener {
        final List<ClientEvent> events = new CopyOnWriteArrayList<>();
        final List<ErrorCode> errors = new CopyOnWriteArrayList<>();
        final List<ErrorCode> offline = new CopyOnWriteArrayList<>();
        final List<Duration> reconnects = new CopyOnWriteArrayList<>();

        @Override
        public void onEvent(ClientEvent event) {
            events.add(event);
        }

        @Override
        public void onError(ErrorCode code, String message) {
            errors.add(code);
        }

        @Override
        public void onReconnecting(int attempt, Duration delay) {
            reconnects.add(delay);
        }

        @Override
        public void onOffline(ErrorCode reason) {
            offline.add(reason);
        }
    }
}
