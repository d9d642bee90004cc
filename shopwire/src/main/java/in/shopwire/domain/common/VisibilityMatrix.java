package in.shopwire.domain.common;

import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.domain.event.RealtimeEvent;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role-visibility matrix: which roles may see which namespaces.
 *
 * This is the only place that decides visibility. Subscription checks and
 * broadcast filtering both go through it.
 */
public final class VisibilityMatrix {

    private static final Map<Role, Set<Namespace>> ENTITLEMENTS = new EnumMap<>(Role.class);

    static {
        ENTITLEMENTS.put(Role.ADMIN, EnumSet.allOf(Namespace.class));
        ENTITLEMENTS.put(Role.MANAGER, EnumSet.of(
            Namespace.ORDERS, Namespace.CUSTOMERS, Namespace.PRODUCTS, Namespace.INVENTORY, Namespace.PAYMENTS));
        ENTITLEMENTS.put(Role.STAFF, EnumSet.of(
            Namespace.ORDERS, Namespace.CUSTOMERS, Namespace.PRODUCTS, Namespace.INVENTORY));
        ENTITLEMENTS.put(Role.CUSTOMER, EnumSet.of(Namespace.PRODUCTS, Namespace.ORDERS));
        ENTITLEMENTS.put(Role.GUEST, EnumSet.of(Namespace.PRODUCTS));
    }

    private VisibilityMatrix() {
    }

    /**
     * Whether a role may subscribe to (and receive events of) a namespace.
     */
    public static boolean isEntitled(Role role, Namespace namespace) {
        if (role == null || namespace == null) {
            return false;
        }
        return ENTITLEMENTS.get(role).contains(namespace);
    }

    /**
     * Whether a connection bound to {@code identity} may see {@code event}.
     *
     * Requires namespace entitlement, the event's minimum role (if any) and, for
     * restricted roles, that a targeted event is addressed to this user.
     */
    public static boolean canSee(ConnectionIdentity identity, RealtimeEvent event) {
        Role role = identity.role();
        if (!isEntitled(role, event.namespace())) {
            return false;
        }
        if (event.minimumRole() != null && !role.isAtLeast(event.minimumRole())) {
            return false;
        }
        if (event.isTargeted() && role.isRestricted()) {
            return event.targetUserId().equals(identity.userId());
        }
        return true;
    }

    public static Set<Namespace> namespacesFor(Role role) {
        return Collections.unmodifiableSet(ENTITLEMENTS.get(role));
    }

    /**
     * Wire-friendly view of the matrix: role name -> namespace names.
     */
    public static Map<String, List<String>> describe() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        for (Map.Entry<Role, Set<Namespace>> entry : ENTITLEMENTS.entrySet()) {
            table.put(entry.getKey().wireName(),
                entry.getValue().stream().map(Namespace::wireName).collect(Collectors.toList()));
        }
        return table;
    }
}
