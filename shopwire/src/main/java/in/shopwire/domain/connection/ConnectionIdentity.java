package in.shopwire.domain.connection;

import in.shopwire.domain.common.Role;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity bound to a connection after successful authentication. Immutable.
 */
public record ConnectionIdentity(
    String userId,
    Role role,
    String sessionId,
    Instant expiresAt
) {
    public ConnectionIdentity {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
