package in.shopwire.domain.common;

import java.util.Optional;

/**
 * Business event types pushed to realtime clients.
 * Each type is bound to exactly one namespace; wire names are {@code <entity>:<action>}.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════
    ORDER_CREATED("order:created", Namespace.ORDERS),
    ORDER_UPDATED("order:updated", Namespace.ORDERS),
    ORDER_STATUS_CHANGED("order:status_changed", Namespace.ORDERS),
    ORDER_DELETED("order:deleted", Namespace.ORDERS),

    // ═══════════════════════════════════════════════════════════════
    // CUSTOMERS
    // ═══════════════════════════════════════════════════════════════
    CUSTOMER_ACTIVITY("customer:activity", Namespace.CUSTOMERS),
    CUSTOMER_VIEWING_PRODUCT("customer:viewing_product", Namespace.CUSTOMERS),
    CUSTOMER_ONLINE("customer:online", Namespace.CUSTOMERS),
    CUSTOMER_OFFLINE("customer:offline", Namespace.CUSTOMERS),
    CUSTOMER_ADDED_TO_CART("customer:added_to_cart", Namespace.CUSTOMERS),

    // ═══════════════════════════════════════════════════════════════
    // INVENTORY
    // ═══════════════════════════════════════════════════════════════
    INVENTORY_UPDATED("inventory:updated", Namespace.INVENTORY),
    INVENTORY_LOW_STOCK("inventory:low_stock", Namespace.INVENTORY),
    INVENTORY_OUT_OF_STOCK("inventory:out_of_stock", Namespace.INVENTORY),
    INVENTORY_RESTOCKED("inventory:restocked", Namespace.INVENTORY),

    // ═══════════════════════════════════════════════════════════════
    // PRODUCTS
    // ═══════════════════════════════════════════════════════════════
    PRODUCT_CREATED("product:created", Namespace.PRODUCTS),
    PRODUCT_UPDATED("product:updated", Namespace.PRODUCTS),
    PRODUCT_PRICE_CHANGED("product:price_changed", Namespace.PRODUCTS),
    PRODUCT_DELETED("product:deleted", Namespace.PRODUCTS),

    // ═══════════════════════════════════════════════════════════════
    // PAYMENTS
    // ═══════════════════════════════════════════════════════════════
    PAYMENT_RECEIVED("payment:received", Namespace.PAYMENTS),
    PAYMENT_FAILED("payment:failed", Namespace.PAYMENTS),
    PAYMENT_REFUNDED("payment:refunded", Namespace.PAYMENTS),

    // ═══════════════════════════════════════════════════════════════
    // SYSTEM
    // ═══════════════════════════════════════════════════════════════
    SYSTEM_NOTIFICATION("system:notification", Namespace.SYSTEM),
    SYSTEM_ALERT("system:alert", Namespace.SYSTEM),
    SYSTEM_MAINTENANCE("system:maintenance", Namespace.SYSTEM);

    private final String wireName;
    private final Namespace namespace;

    EventType(String wireName, Namespace namespace) {
        this.wireName = wireName;
        this.namespace = namespace;
    }

    public String wireName() {
        return wireName;
    }

    public Namespace namespace() {
        return namespace;
    }

    public static Optional<EventType> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (EventType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
