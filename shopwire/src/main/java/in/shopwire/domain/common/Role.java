package in.shopwire.domain.common;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of roles a connection can be bound to.
 *
 * Rank orders roles for minimum-role filters (ADMIN highest).
 * Restricted roles only see user-targeted events addressed to themselves.
 */
public enum Role {
    ADMIN("admin", 4, false),
    MANAGER("manager", 3, false),
    STAFF("staff", 2, false),
    CUSTOMER("customer", 1, true),
    GUEST("guest", 0, true);

    private final String wireName;
    private final int rank;
    private final boolean restricted;

    Role(String wireName, int rank, boolean restricted) {
        this.wireName = wireName;
        this.rank = rank;
        this.restricted = restricted;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isRestricted() {
        return restricted;
    }

    public boolean isAtLeast(Role other) {
        return rank >= other.rank;
    }

    public static Optional<Role> fromWire(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.wireName.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
