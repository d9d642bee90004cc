package in.shopwire.domain.common;

import java.util.Locale;
import java.util.Optional;

/**
 * Topic namespaces connections subscribe to. Every event belongs to exactly one.
 */
public enum Namespace {
    ORDERS("orders"),
    CUSTOMERS("customers"),
    PRODUCTS("products"),
    INVENTORY("inventory"),
    PAYMENTS("payments"),
    SYSTEM("system");

    private final String wireName;

    Namespace(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a namespace from its wire name (case-insensitive).
     */
    public static Optional<Namespace> fromWire(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Namespace ns : values()) {
            if (ns.wireName.equals(normalized)) {
                return Optional.of(ns);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
