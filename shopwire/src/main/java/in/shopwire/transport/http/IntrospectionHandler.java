package in.shopwire.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.shopwire.auth.Authenticator;
import in.shopwire.config.RealtimeConfig;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.common.EventType;
import in.shopwire.domain.common.Namespace;
import in.shopwire.domain.common.RealtimeException;
import in.shopwire.domain.common.VisibilityMatrix;
import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.transport.ws.ConnectionRegistry;
import in.shopwire.transport.ws.RegistryStats;
import in.shopwire.transport.ws.WireFrames;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Read-only HTTP endpoints.
 *
 * GET /info   - capabilities: namespaces, event types, roles, protocol frames, limits
 * GET /stats  - registry snapshot (admin only, Bearer credential)
 * GET /health - liveness for load balancers
 */
public final class IntrospectionHandler {
    private static final Logger log = LoggerFactory.getLogger(IntrospectionHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RealtimeConfig config;
    private final ConnectionRegistry registry;
    private final Authenticator authenticator;
    private final Clock clock;
    private final Instant startedAt;

    public IntrospectionHandler(RealtimeConfig config, ConnectionRegistry registry,
                                Authenticator authenticator, Clock clock) {
        this.config = config;
        this.registry = registry;
        this.authenticator = authenticator;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * GET /info
     */
    public void info(HttpServerExchange exchange) {
        try {
            ObjectNode info = MAPPER.createObjectNode();
            info.put("service", "shopwire-realtime");
            info.put("path", config.getPath());

            ArrayNode namespaces = info.putArray("namespaces");
            for (Namespace namespace : Namespace.values()) {
                namespaces.add(namespace.wireName());
            }

            ObjectNode eventTypes = info.putObject("eventTypes");
            for (EventType type : EventType.values()) {
                ArrayNode bucket = eventTypes.has(type.namespace().wireName())
                    ? (ArrayNode) eventTypes.get(type.namespace().wireName())
                    : eventTypes.putArray(type.namespace().wireName());
                bucket.add(type.wireName());
            }

            info.set("roles", MAPPER.valueToTree(VisibilityMatrix.describe()));

            ObjectNode protocol = info.putObject("protocol");
            ArrayNode client = protocol.putArray("client");
            client.add(WireFrames.TYPE_AUTH).add(WireFrames.TYPE_SUBSCRIBE).add(WireFrames.TYPE_UNSUBSCRIBE)
                .add(WireFrames.TYPE_PING).add(WireFrames.TYPE_PONG);
            ArrayNode server = protocol.putArray("server");
            server.add(WireFrames.TYPE_CONNECTED).add(WireFrames.TYPE_ACK).add(WireFrames.TYPE_ERROR)
                .add(WireFrames.TYPE_PING).add(WireFrames.TYPE_PONG).add("<eventType>");

            ObjectNode limits = info.putObject("limits");
            limits.put("maxConnections", config.getMaxConnections());
            limits.put("pingIntervalMs", config.getPingInterval().toMillis());
            limits.put("pongTimeoutMs", config.getPongTimeout().toMillis());
            limits.put("authTimeoutMs", config.getAuthTimeout().toMillis());
            limits.put("rateLimitWindowMs", config.getRateLimitWindow().toMillis());
            limits.put("rateLimitMaxEvents", config.getRateLimitMaxEvents());
            limits.put("maxPayloadBytes", config.getMaxPayloadBytes());
            limits.put("maxViolations", config.getMaxViolations());

            ArrayNode errorCodes = info.putArray("errorCodes");
            for (ErrorCode code : ErrorCode.values()) {
                ObjectNode entry = errorCodes.addObject();
                entry.put("code", code.name());
                entry.put("retryable", code.isRetryable());
            }

            sendJson(exchange, info);
        } catch (Exception e) {
            log.error("Failed to build /info: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to build info");
        }
    }

    /**
     * GET /stats (admin only)
     */
    public void stats(HttpServerExchange exchange) {
        // The session lookup may wait; keep it off the I/O thread
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::stats);
            return;
        }

        ConnectionIdentity identity;
        try {
            identity = authenticator.authenticate(
                Authenticator.parseBearer(exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION)));
        } catch (RealtimeException e) {
            log.info("/stats rejected: {}", e.getCode());
            sendError(exchange, StatusCodes.UNAUTHORIZED, "Unauthorized");
            return;
        }
        if (!requireAdmin(exchange, identity)) {
            return;
        }

        try {
            RegistryStats stats = registry.stats();
            ObjectNode body = MAPPER.valueToTree(stats);
            body.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).getSeconds());
            body.put("timestamp", clock.millis());
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to build /stats: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get stats");
        }
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        try {
            ObjectNode body = MAPPER.createObjectNode();
            body.put("status", registry.isDraining() ? "draining" : "ok");
            body.put("connections", registry.size());
            sendJson(exchange, body);
        } catch (Exception e) {
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get health");
        }
    }

    private boolean requireAdmin(HttpServerExchange exchange, ConnectionIdentity identity) {
        if (!identity.isAdmin()) {
            log.info("requireAdmin: role is not admin, got: {}", identity.role().wireName());
            sendError(exchange, StatusCodes.FORBIDDEN, "Admin access required");
            return false;
        }
        return true;
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(error.toString(), StandardCharsets.UTF_8);
    }
}
