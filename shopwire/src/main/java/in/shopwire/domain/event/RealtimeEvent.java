package in.shopwire.domain.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import in.shopwire.domain.common.EventType;
import in.shopwire.domain.common.Namespace;
import in.shopwire.domain.common.Role;

import java.util.Objects;

/**
 * Business event to fan out to realtime connections.
 *
 * Immutable: the payload is deep-copied on the way in and on the way out,
 * so nothing downstream of construction can change what subscribers see.
 */
public record RealtimeEvent(
    EventType type,
    JsonNode payload,
    String targetUserId,     // null: not user-scoped
    Role minimumRole,        // null: no role floor beyond the visibility matrix
    long timestamp           // epoch millis
) {
    public RealtimeEvent {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
        if (targetUserId != null && targetUserId.isBlank()) {
            targetUserId = null;
        }
    }

    /**
     * Create an untargeted event stamped with the current time.
     */
    public static RealtimeEvent of(EventType type, JsonNode payload) {
        return new RealtimeEvent(type, payload, null, null, System.currentTimeMillis());
    }

    public Namespace namespace() {
        return type.namespace();
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    public boolean isTargeted() {
        return targetUserId != null;
    }

    public RealtimeEvent targetedAt(String userId) {
        return new RealtimeEvent(type, payload, userId, minimumRole, timestamp);
    }

    public RealtimeEvent withMinimumRole(Role role) {
        return new RealtimeEvent(type, payload, targetUserId, role, timestamp);
    }
}
