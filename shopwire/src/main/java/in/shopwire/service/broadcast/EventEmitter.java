package in.shopwire.service.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.shopwire.domain.common.EventType;
import in.shopwire.domain.common.Role;
import in.shopwire.domain.event.RealtimeEvent;
import in.shopwire.domain.event.payload.CustomerActivity;
import in.shopwire.domain.event.payload.OrderSummary;
import in.shopwire.domain.event.payload.PaymentSummary;
import in.shopwire.domain.event.payload.ProductSummary;
import in.shopwire.domain.event.payload.StockSummary;
import in.shopwire.domain.event.payload.SystemNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed, fire-and-forget event API for the rest of the platform.
 *
 * Every method returns immediately and never throws: events are handed to
 * {@link EventBroadcaster#publish} and failures are only logged.
 *
 * Usage:
 * <pre>
 * emitter.emitOrderEvent(EventEmitter.OrderKind.CREATED, order);
 * emitter.emitInventoryEvent(EventEmitter.InventoryKind.UPDATED, StockSummary.update("p1", "Mug", "MUG-1", 12, 3));
 * emitter.emitPaymentEvent(EventEmitter.PaymentKind.RECEIVED, payment, Role.MANAGER);
 * </pre>
 */
public final class EventEmitter {
    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Stock at or below this raises a low-stock alert after an inventory update. */
    public static final int LOW_STOCK_THRESHOLD = 10;
    /** Stock at or below this makes the alert critical. */
    public static final int CRITICAL_STOCK_THRESHOLD = 5;

    private final EventBroadcaster broadcaster;

    public EventEmitter(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    // ═══════════════════════════════════════════════════════════════
    // ORDER EVENTS
    // ═══════════════════════════════════════════════════════════════

    public enum OrderKind {
        CREATED(EventType.ORDER_CREATED, Role.STAFF),
        UPDATED(EventType.ORDER_UPDATED, null),
        STATUS_CHANGED(EventType.ORDER_STATUS_CHANGED, null),
        DELETED(EventType.ORDER_DELETED, Role.MANAGER);

        private final EventType type;
        private final Role defaultMinimumRole;

        OrderKind(EventType type, Role defaultMinimumRole) {
            this.type = type;
            this.defaultMinimumRole = defaultMinimumRole;
        }
    }

    public void emitOrderEvent(OrderKind kind, OrderSummary order) {
        emitOrderEvent(kind, order, null);
    }

    /**
     * Order events are addressed to the order's customer, so customers only see
     * their own orders. Orders without a customer are staff-only.
     */
    public void emitOrderEvent(OrderKind kind, OrderSummary order, Role minimumRole) {
        Role floor = minimumRole != null ? minimumRole : kind.defaultMinimumRole;
        String customerId = order == null ? null : order.customerId();
        if (floor == null && customerId == null) {
            floor = Role.STAFF;
        }
        emit(kind.type, order, customerId, floor);
    }

    // ═══════════════════════════════════════════════════════════════
    // INVENTORY EVENTS
    // ═══════════════════════════════════════════════════════════════

    public enum InventoryKind {
        UPDATED(EventType.INVENTORY_UPDATED),
        LOW_STOCK(EventType.INVENTORY_LOW_STOCK),
        OUT_OF_STOCK(EventType.INVENTORY_OUT_OF_STOCK),
        RESTOCKED(EventType.INVENTORY_RESTOCKED);

        private final EventType type;

        InventoryKind(EventType type) {
            this.type = type;
        }
    }

    public void emitInventoryEvent(InventoryKind kind, StockSummary stock) {
        emitInventoryEvent(kind, stock, null);
    }

    /**
     * An UPDATED event is followed by an out-of-stock event when stock hits
     * zero, or a low-stock alert when it is at or below {@link #LOW_STOCK_THRESHOLD}.
     */
    public void emitInventoryEvent(InventoryKind kind, StockSummary stock, Role minimumRole) {
        emit(kind.type, stock, null, minimumRole);
        if (kind != InventoryKind.UPDATED || stock == null) {
            return;
        }

        int level = stock.newStock();
        if (level == 0) {
            emit(EventType.INVENTORY_OUT_OF_STOCK, stock.asOutOfStock(), null, minimumRole);
        } else if (level > 0 && level <= LOW_STOCK_THRESHOLD) {
            String severity = level <= CRITICAL_STOCK_THRESHOLD ? "critical" : "low";
            emit(EventType.INVENTORY_LOW_STOCK, stock.asAlert(LOW_STOCK_THRESHOLD, severity), null, minimumRole);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // PRODUCT EVENTS
    // ═══════════════════════════════════════════════════════════════

    public enum ProductKind {
        CREATED(EventType.PRODUCT_CREATED, null),
        UPDATED(EventType.PRODUCT_UPDATED, null),
        PRICE_CHANGED(EventType.PRODUCT_PRICE_CHANGED, null),
        DELETED(EventType.PRODUCT_DELETED, Role.MANAGER);

        private final EventType type;
        private final Role defaultMinimumRole;

        ProductKind(EventType type, Role defaultMinimumRole) {
            this.type = type;
            this.defaultMinimumRole = defaultMinimumRole;
        }
    }

    public void emitProductEvent(ProductKind kind, ProductSummary product) {
        emitProductEvent(kind, product, null);
    }

    public void emitProductEvent(ProductKind kind, ProductSummary product, Role minimumRole) {
        emit(kind.type, product, null, minimumRole != null ? minimumRole : kind.defaultMinimumRole);
    }

    // ═══════════════════════════════════════════════════════════════
    // PAYMENT EVENTS
    // ═══════════════════════════════════════════════════════════════

    public enum PaymentKind {
        RECEIVED(EventType.PAYMENT_RECEIVED),
        FAILED(EventType.PAYMENT_FAILED),
        REFUNDED(EventType.PAYMENT_REFUNDED);

        private final EventType type;

        PaymentKind(EventType type) {
            this.type = type;
        }
    }

    public void emitPaymentEvent(PaymentKind kind, PaymentSummary payment) {
        emitPaymentEvent(kind, payment, null);
    }

    /**
     * Targeted at the paying customer.
     */
    public void emitPaymentEvent(PaymentKind kind, PaymentSummary payment, Role minimumRole) {
        emit(kind.type, payment, payment == null ? null : payment.customerId(), minimumRole);
    }

    // ═══════════════════════════════════════════════════════════════
    // CUSTOMER EVENTS
    // ═══════════════════════════════════════════════════════════════

    public enum CustomerKind {
        ACTIVITY(EventType.CUSTOMER_ACTIVITY, null),
        VIEWING_PRODUCT(EventType.CUSTOMER_VIEWING_PRODUCT, Role.MANAGER),
        ONLINE(EventType.CUSTOMER_ONLINE, null),
        OFFLINE(EventType.CUSTOMER_OFFLINE, null),
        ADDED_TO_CART(EventType.CUSTOMER_ADDED_TO_CART, Role.MANAGER);

        private final EventType type;
        private final Role defaultMinimumRole;

        CustomerKind(EventType type, Role defaultMinimumRole) {
            this.type = type;
            this.defaultMinimumRole = defaultMinimumRole;
        }
    }

    public void emitCustomerActivity(CustomerKind kind, CustomerActivity activity) {
        emitCustomerActivity(kind, activity, null);
    }

    public void emitCustomerActivity(CustomerKind kind, CustomerActivity activity, Role minimumRole) {
        emit(kind.type, activity, null, minimumRole != null ? minimumRole : kind.defaultMinimumRole);
    }

    /**
     * ONLINE or OFFLINE depending on {@code activity.online()}.
     */
    public void emitCustomerPresence(CustomerActivity activity) {
        boolean online = activity != null && Boolean.TRUE.equals(activity.online());
        emitCustomerActivity(online ? CustomerKind.ONLINE : CustomerKind.OFFLINE, activity, null);
    }

    // ═══════════════════════════════════════════════════════════════
    // SYSTEM EVENTS
    // ═══════════════════════════════════════════════════════════════

    public enum SystemKind {
        NOTIFICATION(EventType.SYSTEM_NOTIFICATION),
        ALERT(EventType.SYSTEM_ALERT),
        MAINTENANCE(EventType.SYSTEM_MAINTENANCE);

        private final EventType type;

        SystemKind(EventType type) {
            this.type = type;
        }
    }

    public void emitSystemNotification(SystemKind kind, SystemNotice notice) {
        emitSystemNotification(kind, notice, null);
    }

    public void emitSystemNotification(SystemKind kind, SystemNotice notice, Role minimumRole) {
        emit(kind.type, notice, null, minimumRole);
    }

    // ═══════════════════════════════════════════════════════════════

    private void emit(EventType type, Object payload, String targetUserId, Role minimumRole) {
        try {
            JsonNode tree = payload == null ? null : MAPPER.valueToTree(payload);
            RealtimeEvent event = new RealtimeEvent(type, tree, targetUserId, minimumRole, System.currentTimeMillis());
            broadcaster.publish(event).whenComplete((report, error) -> {
                if (error != null) {
                    log.warn("Event {} failed: {}", type.wireName(), error.toString());
                } else if (!report.accepted()) {
                    log.warn("Event {} was not broadcast", type.wireName());
                }
            });
            log.debug("Emitted {}", type.wireName());
        } catch (Exception e) {
            log.error("Failed to emit {}", type.wireName(), e);
        }
    }
}
