package in.shopwire.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.common.Namespace;
import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.domain.event.RealtimeEvent;

/**
 * Server-to-client JSON frames.
 */
public final class WireFrames {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String TYPE_AUTH = "auth";
    public static final String TYPE_SUBSCRIBE = "subscribe";
    public static final String TYPE_UNSUBSCRIBE = "unsubscribe";
    public static final String TYPE_PING = "ping";
    public static final String TYPE_PONG = "pong";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_ACK = "ack";
    public static final String TYPE_CONNECTED = "connected";

    private WireFrames() {
    }

    /**
     * {"type": "order:created", "namespace": "orders", "payload": {...}, "timestamp": 1700000000000}
     */
    public static String event(RealtimeEvent event) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", event.type().wireName());
        frame.put("namespace", event.namespace().wireName());
        frame.set("payload", event.payload());
        frame.put("timestamp", event.timestamp());
        return write(frame);
    }

    public static String ping(long timestamp) {
        return heartbeat(TYPE_PING, timestamp);
    }

    public static String pong(long timestamp) {
        return heartbeat(TYPE_PONG, timestamp);
    }

    private static String heartbeat(String type, long timestamp) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", type);
        frame.put("timestamp", timestamp);
        return write(frame);
    }

    public static String error(ErrorCode code) {
        return error(code, code.defaultMessage());
    }

    public static String error(ErrorCode code, String message) {
        return error(code, message, null);
    }

    /**
     * Error about a single namespace. The raw requested name goes in the
     * "namespace" field so clients need not parse the message.
     */
    public static String error(ErrorCode code, String message, String namespace) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", TYPE_ERROR);
        frame.put("code", code.name());
        frame.put("message", message == null ? code.defaultMessage() : message);
        frame.put("retryable", code.isRetryable());
        if (namespace != null) {
            frame.put("namespace", namespace);
        }
        return write(frame);
    }

    public static String connected(String connectionId, long timestamp) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", TYPE_CONNECTED);
        frame.put("connectionId", connectionId);
        frame.put("timestamp", timestamp);
        return write(frame);
    }

    /**
     * Acknowledges a successful auth frame.
     */
    public static String authAck(String connectionId, ConnectionIdentity identity) {
        ObjectNode frame = ack(TYPE_AUTH, connectionId);
        frame.put("userId", identity.userId());
        frame.put("role", identity.role().wireName());
        return write(frame);
    }

    public static String subscriptionAck(String action, String connectionId, Namespace namespace) {
        ObjectNode frame = ack(action, connectionId);
        frame.put("namespace", namespace.wireName());
        return write(frame);
    }

    private static ObjectNode ack(String action, String connectionId) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("type", TYPE_ACK);
        frame.put("action", action);
        frame.put("connectionId", connectionId);
        return frame;
    }

    public static JsonNode parse(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    private static String write(JsonNode frame) {
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            // A tree built from ObjectNode cannot fail to serialize
            throw new IllegalStateException("Failed to serialize frame", e);
        }
    }
}
