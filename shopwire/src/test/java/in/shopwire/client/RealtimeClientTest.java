package in.shopwire.client;

import com.fasterxml.jackson.databind.JsonNode;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.connection.AuthCredential;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RealtimeClient against a scripted transport.
 *
 * Tests:
 * - Desired namespaces are re-subscribed before onConnected fires
 * - Business events reach the listener
 * - Retryable server close triggers reconnect and resubscription
 * - Backoff delays grow to the cap, then the client goes offline
 * - Terminal errors go offline without retrying
 * - Unanswered heartbeats force a reconnect
 * - Forbidden namespaces are dropped instead of blocking
 * - Subscription changes during the resubscribe round are sent
 * - A stalled or refused handshake reconnects instead of hanging
 * - Offline queue flushes once subscribed
 * - Server pings are answered
 * - disconnect() stops reconnecting
 */
class RealtimeClientTest {

    private static final Duration WAIT = Duration.ofSeconds(3);

    private FakeClientTransport transport;
    private RecordingListener listener;
    private RealtimeClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeClientTransport();
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private RealtimeClient newClient(Duration heartbeatInterval) {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(20))
            .maxDelay(Duration.ofMillis(80))
            .multiplier(2.0)
            .maxAttempts(4)
            .build();
        client = RealtimeClient.builder()
            .uri(URI.create("ws://localhost:3001/ws"))
            .credentials(() -> new AuthCredential("u1", "customer", "sess-1",
                System.currentTimeMillis() + 3_600_000))
            .transport(transport)
            .policy(policy)
            .heartbeatInterval(heartbeatInterval)
            .listener(listener)
            .build();
        return client;
    }

    private RealtimeClient newClient() {
        return newClient(Duration.ofSeconds(30));
    }

    // ═══════════════════════════════════════════════════════════════

    @Test
    void testResubscribesBeforeConnected() {
        List<Integer> subscribeFramesAtConnect = new CopyOnWriteArrayList<>();
        listener.onConnectedHook = () ->
            subscribeFramesAtConnect.add(transport.lastSocket().framesOfType("subscribe").size());

        newClient();
        client.subscribe("orders");
        client.subscribe("products");
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");
        assertEquals(List.of(2), subscribeFramesAtConnect,
            "Both subscribe frames must be sent before onConnected");

        FakeClientTransport.FakeSocket socket = transport.lastSocket();
        JsonNode auth = socket.framesOfType("auth").get(0);
        assertEquals("u1", auth.path("data").path("userId").asText());
        assertEquals("sess-1", auth.path("data").path("sessionId").asText());
        assertEquals(List.of("orders", "products"), socket.framesOfType("subscribe").stream()
            .map(f -> f.path("data").path("namespace").asText())
            .collect(Collectors.toList()));
        assertEquals(List.of(ClientState.CONNECTING, ClientState.AUTHENTICATING, ClientState.SUBSCRIBED),
            listener.states);
    }

    @Test
    void testConnectWithoutNamespacesSubscribesImmediately() {
        newClient();
        client.connect();

        awaitTrue(() -> listener.connected.size() == 1, "onConnected should fire once");
        assertTrue(transport.lastSocket().framesOfType("subscribe").isEmpty());
    }

    @Test
    void testEventsDelivered() {
        newClient();
        client.subscribe("orders");
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        transport.lastSocket().push(
            "{\"type\":\"order:updated\",\"namespace\":\"orders\",\"payload\":{\"orderId\":\"o1\"},\"timestamp\":5}");

        awaitTrue(() -> listener.events.size() == 1, "event should arrive");
        ClientEvent event = listener.events.get(0);
        assertEquals("order:updated", event.type());
        assertEquals("orders", event.namespace());
        assertEquals("o1", event.payload().path("orderId").asText());
        assertEquals(5L, event.timestamp());
    }

    @Test
    void testRetryableCloseReconnectsAndResubscribes() {
        newClient();
        client.subscribe("orders");
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        FakeClientTransport.FakeSocket first = transport.lastSocket();
        first.serverClose(1001, "SHUTTING_DOWN");

        awaitTrue(() -> listener.connected.size() == 2, "client should reconnect");
        assertEquals(2, transport.opens.get());
        FakeClientTransport.FakeSocket second = transport.lastSocket();
        assertNotSame(first, second);
        assertEquals(1, second.framesOfType("auth").size(), "New socket must re-authenticate");
        assertEquals("orders", second.framesOfType("subscribe").get(0).path("data").path("namespace").asText());
        assertEquals(1, listener.reconnecting.size());
        assertEquals(ClientState.SUBSCRIBED, client.getState());
    }

    @Test
    void testBackoffThenOffline() {
        transport.failAllOpens = true;
        newClient();
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.OFFLINE, "client should give up");

        List<Long> delays = listener.reconnecting.stream()
            .map(Duration::toMillis)
            .collect(Collectors.toList());
        assertEquals(List.of(20L, 40L, 80L, 80L), delays, "Delays double up to the cap");
        for (int i = 1; i < delays.size(); i++) {
            assertTrue(delays.get(i) >= delays.get(i - 1), "Delays must not decrease");
        }
        assertEquals(5, transport.opens.get(), "Initial attempt plus four retries");
        assertEquals(1, listener.offline.size());
        assertNull(listener.offline.get(0), "Exhausted retries carry no error code");
    }

    @Test
    void testSuccessResetsBackoff() {
        transport.failNextOpens.set(2);
        newClient();
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should eventually connect");
        assertEquals(3, transport.opens.get());

        transport.lastSocket().serverClose(1001, "HEARTBEAT_TIMEOUT");
        awaitTrue(() -> listener.connected.size() == 2, "client should reconnect");
        assertEquals(Duration.ofMillis(20), listener.reconnecting.get(listener.reconnecting.size() - 1),
            "Backoff restarts from the initial delay after a success");
    }

    @Test
    void testTerminalErrorGoesOffline() {
        transport.responder = frame -> "auth".equals(frame.path("type").asText())
            ? List.of(FakeClientTransport.error("UNAUTHENTICATED", "Invalid authentication"))
            : List.of();
        newClient();
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.OFFLINE, "client should go offline");
        assertEquals(List.of(ErrorCode.UNAUTHENTICATED), listener.offline);
        assertEquals(List.of(ErrorCode.UNAUTHENTICATED), listener.errors);
        sleep(150);
        assertEquals(1, transport.opens.get(), "Terminal errors must not be retried");
        assertTrue(listener.reconnecting.isEmpty());
    }

    @Test
    void testTerminalCloseReasonGoesOffline() {
        newClient();
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        transport.lastSocket().serverClose(1008, "SESSION_EXPIRED");

        awaitTrue(() -> client.getState() == ClientState.OFFLINE, "client should go offline");
        assertEquals(List.of(ErrorCode.SESSION_EXPIRED), listener.offline);
        sleep(150);
        assertEquals(1, transport.opens.get());
    }

    @Test
    void testMissedHeartbeatsReconnect() {
        transport.responder = frame -> "ping".equals(frame.path("type").asText())
            ? List.of()
            : FakeClientTransport.cooperativeServer(frame);
        newClient(Duration.ofMillis(50));
        client.connect();

        awaitTrue(() -> transport.opens.get() >= 2, "unanswered pings should force a reconnect");
        assertFalse(listener.reconnecting.isEmpty());
        assertTrue(transport.sockets.get(0).closed, "Dead socket is closed");
        assertTrue(transport.sockets.get(0).framesOfType("ping").size() >= 2);
    }

    @Test
    void testLatencyFromAnsweredPing() {
        newClient(Duration.ofMillis(30));
        assertEquals(-1, client.getLatencyMs());
        client.connect();

        awaitTrue(() -> client.getLatencyMs() >= 0, "latency should be measured");
        sleep(100);
        assertEquals(1, transport.opens.get(), "Answered pings keep the connection");
    }

    @Test
    void testForbiddenNamespaceDropped() {
        transport.responder = frame -> {
            if ("subscribe".equals(frame.path("type").asText())
                    && "payments".equals(frame.path("data").path("namespace").asText())) {
                return List.of(FakeClientTransport.error("FORBIDDEN_NAMESPACE",
                    "No permission for namespace: payments", "payments"));
            }
            return FakeClientTransport.cooperativeServer(frame);
        };
        newClient();
        client.subscribe("orders");
        client.subscribe("payments");
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should not block on payments");
        assertEquals(List.of(ErrorCode.FORBIDDEN_NAMESPACE), listener.errors);

        transport.lastSocket().serverClose(1001, "SHUTTING_DOWN");
        awaitTrue(() -> listener.connected.size() == 2, "client should reconnect");
        assertEquals(List.of("orders"), transport.lastSocket().framesOfType("subscribe").stream()
                .map(f -> f.path("data").path("namespace").asText())
                .collect(Collectors.toList()),
            "Forbidden namespace is not requested again");
    }

    @Test
    void testRejectedNamespaceReadFromField() {
        transport.responder = frame -> {
            if ("subscribe".equals(frame.path("type").asText())
                    && "payments".equals(frame.path("data").path("namespace").asText())) {
                return List.of(FakeClientTransport.error("FORBIDDEN_NAMESPACE",
                    "Role customer may not read: this stream", "payments"));
            }
            return FakeClientTransport.cooperativeServer(frame);
        };
        newClient();
        client.subscribe("payments");
        client.subscribe("orders");
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED,
            "client should subscribe whatever the message wording");
        assertEquals(1, listener.connected.size());
    }

    @Test
    void testSubscribeDuringResubscribeIsSent() {
        transport.responder = withheldAck("orders");
        newClient();
        client.subscribe("orders");
        client.connect();
        awaitTrue(() -> transport.sockets.size() == 1
            && transport.lastSocket().framesOfType("subscribe").size() == 1, "orders subscribe should go out");

        client.subscribe("inventory");

        awaitTrue(() -> transport.lastSocket().framesOfType("subscribe").size() == 2,
            "inventory subscribe should go out before the round finishes");
        sleep(50);
        assertEquals(ClientState.AUTHENTICATING, client.getState(), "orders ack is still outstanding");
        assertTrue(listener.connected.isEmpty());

        transport.lastSocket().push("{\"type\":\"ack\",\"action\":\"subscribe\",\"namespace\":\"orders\"}");

        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");
        assertEquals(1, listener.connected.size());
        assertEquals(List.of("orders", "inventory"), transport.lastSocket().framesOfType("subscribe").stream()
            .map(f -> f.path("data").path("namespace").asText())
            .collect(Collectors.toList()));

        transport.responder = FakeClientTransport::cooperativeServer;
        transport.lastSocket().serverClose(1001, "SHUTTING_DOWN");
        awaitTrue(() -> listener.connected.size() == 2, "client should reconnect");
        assertEquals(2, transport.lastSocket().framesOfType("subscribe").size(),
            "Namespace added mid-round is part of the desired set");
    }

    @Test
    void testUnsubscribeDuringResubscribeIsSent() {
        transport.responder = withheldAck("orders");
        newClient();
        client.subscribe("orders");
        client.subscribe("products");
        client.connect();
        awaitTrue(() -> transport.sockets.size() == 1
            && transport.lastSocket().framesOfType("subscribe").size() == 2, "both subscribes should go out");

        client.unsubscribe("orders");

        awaitTrue(() -> transport.lastSocket().framesOfType("unsubscribe").size() == 1,
            "unsubscribe should reach the server");
        assertEquals("orders",
            transport.lastSocket().framesOfType("unsubscribe").get(0).path("data").path("namespace").asText());
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED,
            "dropping the only outstanding namespace completes the round");
        assertEquals(1, listener.connected.size());
    }

    @Test
    void testUnsubscribeBeforeAuthAckSendsNothing() {
        transport.responder = frame -> List.of();
        newClient();
        client.subscribe("orders");
        client.connect();
        awaitTrue(() -> transport.sockets.size() == 1
            && transport.lastSocket().framesOfType("auth").size() == 1, "auth should go out");

        client.unsubscribe("orders");
        sleep(50);

        assertTrue(transport.lastSocket().framesOfType("unsubscribe").isEmpty());
        assertTrue(transport.lastSocket().framesOfType("subscribe").isEmpty());
    }

    @Test
    void testRefusedHandshakeReconnects() {
        transport.responder = frame -> "subscribe".equals(frame.path("type").asText())
            ? List.of(FakeClientTransport.error("RATE_LIMITED", "Rate limit exceeded"))
            : FakeClientTransport.cooperativeServer(frame);
        newClient();
        client.subscribe("orders");
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.OFFLINE, "client should retry then give up");
        assertEquals(5, transport.opens.get(), "Initial attempt plus four retries");
        assertTrue(listener.errors.contains(ErrorCode.RATE_LIMITED));
        assertTrue(listener.connected.isEmpty());
        assertTrue(transport.sockets.get(0).closed, "Stalled socket is closed");
    }

    @Test
    void testLostSubscribeAckReconnects() {
        transport.responder = withheldAck("orders");
        newClient(Duration.ofMillis(50));
        client.subscribe("orders");
        client.connect();

        awaitTrue(() -> transport.opens.get() >= 2, "handshake timeout should force a reconnect");
        assertTrue(transport.sockets.get(0).closed);
        assertFalse(listener.reconnecting.isEmpty());
        assertTrue(listener.connected.isEmpty());

        transport.responder = FakeClientTransport::cooperativeServer;
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should recover once acks flow");
        sleep(200);
        assertEquals(ClientState.SUBSCRIBED, client.getState(), "Timeout is disarmed after subscribing");
    }

    @Test
    void testOfflineQueueFlushedAfterSubscribe() {
        newClient();
        client.subscribe("orders");
        client.send("{\"type\":\"cart.touch\"}");
        client.connect();

        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");
        awaitTrue(() -> transport.lastSocket().framesOfType("cart.touch").size() == 1, "queued frame should flush");

        List<String> sent = transport.lastSocket().sentFrames();
        int subscribeAt = indexOfType(sent, "subscribe");
        int queuedAt = indexOfType(sent, "cart.touch");
        assertTrue(queuedAt > subscribeAt, "Queued frames go out after resubscription");
    }

    @Test
    void testSendWhileSubscribedGoesStraightOut() {
        newClient();
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        client.send("{\"type\":\"cart.touch\"}");

        awaitTrue(() -> transport.lastSocket().framesOfType("cart.touch").size() == 1, "frame should be sent");
    }

    @Test
    void testSubscribeWhileConnectedSendsFrame() {
        newClient();
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        client.subscribe("inventory");
        client.unsubscribe("inventory");

        awaitTrue(() -> transport.lastSocket().framesOfType("unsubscribe").size() == 1, "unsubscribe should be sent");
        assertEquals(1, transport.lastSocket().framesOfType("subscribe").size());
    }

    @Test
    void testServerPingAnswered() {
        newClient();
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        transport.lastSocket().push("{\"type\":\"ping\",\"timestamp\":1}");

        awaitTrue(() -> transport.lastSocket().framesOfType("pong").size() == 1, "client should pong");
    }

    @Test
    void testDisconnectStopsReconnecting() {
        newClient();
        client.connect();
        awaitTrue(() -> client.getState() == ClientState.SUBSCRIBED, "client should subscribe");

        FakeClientTransport.FakeSocket socket = transport.lastSocket();
        client.disconnect();

        awaitTrue(() -> client.getState() == ClientState.DISCONNECTED, "client should disconnect");
        assertTrue(socket.closed);
        // Late close from the old socket must be ignored
        socket.serverClose(1001, "SHUTTING_DOWN");
        sleep(150);
        assertEquals(1, transport.opens.get());
        assertTrue(listener.reconnecting.isEmpty());
        assertEquals(ClientState.DISCONNECTED, client.getState());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> RealtimeClient.builder().build());
        assertThrows(IllegalArgumentException.class, () -> RealtimeClient.builder()
            .uri(URI.create("ws://localhost/ws")).build());
        assertThrows(IllegalArgumentException.class, () -> RealtimeClient.builder()
            .heartbeatInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RealtimeClient.builder()
            .offlineQueueCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> RealtimeClient.builder()
            .handshakeTimeout(Duration.ofMillis(-1)));
    }

    @Test
    void testTerminalCodes() {
        assertTrue(RealtimeClient.TERMINAL_CODES.contains(ErrorCode.SESSION_REVOKED));
        assertFalse(RealtimeClient.TERMINAL_CODES.contains(ErrorCode.RATE_LIMITED));
        assertFalse(RealtimeClient.TERMINAL_CODES.contains(ErrorCode.HEARTBEAT_TIMEOUT));
        for (ErrorCode code : RealtimeClient.TERMINAL_CODES) {
            assertFalse(code.isRetryable(), code + " is terminal so it cannot be retryable");
        }
    }

    // ═══════════════════════════════════════════════════════════════

    /**
     * Cooperative server that never acks the subscribe for one namespace.
     */
    private static Function<JsonNode, List<String>> withheldAck(String namespace) {
        return frame -> "subscribe".equals(frame.path("type").asText())
                && namespace.equals(frame.path("data").path("namespace").asText())
            ? List.of()
            : FakeClientTransport.cooperativeServer(frame);
    }

    private static int indexOfType(List<String> frames, String type) {
        for (int i = 0; i < frames.size(); i++) {
            if (frames.get(i).contains("\"type\":\"" + type + "\"")) {
                return i;
            }
        }
        return -1;
    }

    private static void awaitTrue(BooleanSupplier condition, String message) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out: " + message);
            }
            sleep(5);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static final class RecordingListener implements ClientListener {
        final List<ClientState> states = new CopyOnWriteArrayList<>();
        final List<Object> connected = new CopyOnWriteArrayList<>();
        final List<ClientEvent> events = new CopyOnWriteArrayList<>();
        final List<ErrorCode> errors = new CopyOnWriteArrayList<>();
        final List<Duration> reconnecting = new CopyOnWriteArrayList<>();
        final List<ErrorCode> offline = new CopyOnWriteArrayList<>();
        volatile Runnable onConnectedHook = () -> { };

        @Override
        public void onStateChange(ClientState previous, ClientState current) {
            states.add(current);
        }

        @Override
        public void onConnected() {
            onConnectedHook.run();
            connected.add(Boolean.TRUE);
        }

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
            reconnecting.add(delay);
        }

        @Override
        public void onOffline(ErrorCode reason) {
            offline.add(reason);
        }
    }
}
