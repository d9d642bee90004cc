package in.shopwire.transport.http;

import in.shopwire.config.RealtimeConfig;
import in.shopwire.metrics.RealtimeMetrics;
import in.shopwire.transport.ws.ConnectionRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Capacity pre-check at the upgrade gate.
 *
 * Tests:
 * - Requests pass while there is room
 * - Sockets waiting for auth count toward the limit
 */
class AdmissionCapacityTest {

    private Undertow server;
    private HttpClient httpClient;
    private AtomicInteger pending;
    private int port;

    @BeforeEach
    void setUp() {
        RealtimeConfig config = RealtimeConfig.builder().maxConnections(2).build();
        ConnectionRegistry registry = new ConnectionRegistry(config.getMaxConnections(), RealtimeMetrics.NOOP);
        pending = new AtomicInteger();

        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(new AdmissionHandler(config, registry, pending::get, RealtimeMetrics.NOOP,
                exchange -> exchange.getResponseSender().send("upgrade")))
            .build();
        server.start();
        port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void testPassesWithRoom() throws Exception {
        pending.set(1);

        HttpResponse<String> response = get();

        assertEquals(200, response.statusCode());
        assertEquals("upgrade", response.body());
    }

    @Test
    void testPendingSocketsCountTowardCapacity() throws Exception {
        pending.set(2);

        HttpResponse<String> response = get();

        assertEquals(503, response.statusCode(), "Pending sockets fill the gate even with an empty registry");
        assertTrue(response.body().contains("\"code\":\"CAPACITY_EXCEEDED\""), response.body());
    }

    private HttpResponse<String> get() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + port + "/ws"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
