package in.shopwire.transport.http;

import in.shopwire.config.RealtimeConfig;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.metrics.RealtimeMetrics;
import in.shopwire.transport.ws.ConnectionRegistry;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.function.IntSupplier;

/**
 * Guards the WebSocket upgrade: origin allow-list, then a capacity pre-check.
 * The pre-check counts registered connections plus sockets still waiting for
 * their auth frame. Requests that pass are handed to the handshake handler.
 */
public final class AdmissionHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(AdmissionHandler.class);

    private final RealtimeConfig config;
    private final ConnectionRegistry registry;
    private final IntSupplier pendingConnections;
    private final RealtimeMetrics metrics;
    private final HttpHandler next;

    public AdmissionHandler(RealtimeConfig config, ConnectionRegistry registry, IntSupplier pendingConnections,
                            RealtimeMetrics metrics, HttpHandler next) {
        this.config = config;
        this.registry = registry;
        this.pendingConnections = pendingConnections;
        this.metrics = metrics;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        if (!isOriginAllowed(config, origin)) {
            log.warn("WS upgrade rejected: origin {} not allowed (remote={})", origin, exchange.getSourceAddress());
            reject(exchange, StatusCodes.FORBIDDEN, ErrorCode.ORIGIN_NOT_ALLOWED);
            return;
        }

        int pending = pendingConnections.getAsInt();
        if (!registry.hasCapacity() || registry.size() + pending >= registry.getMaxConnections()) {
            log.warn("WS upgrade rejected: at capacity ({} registered, {} pending, max {})",
                registry.size(), pending, registry.getMaxConnections());
            reject(exchange, StatusCodes.SERVICE_UNAVAILABLE, ErrorCode.CAPACITY_EXCEEDED);
            return;
        }

        next.handleRequest(exchange);
    }

    /**
     * "*" allows every origin. A missing Origin header is allowed: only browsers send one.
     */
    public static boolean isOriginAllowed(RealtimeConfig config, String origin) {
        if (origin == null || origin.isEmpty() || config.allowsAllOrigins()) {
            return true;
        }
        for (String allowed : config.getAllowedOrigins()) {
            if (allowed.equalsIgnoreCase(origin)) {
                return true;
            }
        }
        return false;
    }

    private void reject(HttpServerExchange exchange, int status, ErrorCode code) {
        metrics.recordAdmissionRejected(code);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(
            "{\"error\":\"" + code.defaultMessage() + "\",\"code\":\"" + code.name() + "\"}", StandardCharsets.UTF_8);
    }
}
