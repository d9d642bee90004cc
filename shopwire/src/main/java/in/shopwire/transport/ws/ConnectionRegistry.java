package in.shopwire.transport.ws;

import in.shopwire.domain.common.ErrorCode;
import in.shopwire.domain.common.Namespace;
import in.shopwire.domain.common.RealtimeException;
import in.shopwire.domain.common.Role;
import in.shopwire.domain.connection.ConnectionIdentity;
import in.shopwire.metrics.RealtimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live, authenticated connections and their namespace and user indexes.
 *
 * Lookups never lock. A connection's own monitor serializes its subscription
 * changes against its removal, so a removed connection can never reappear in
 * a namespace index.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final int maxConnections;
    private final RealtimeMetrics metrics;

    // ConnectionId -> Connection
    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();

    // Namespace -> ConnectionIds (map itself is fixed after construction)
    private final Map<Namespace, Set<String>> namespaceIndex = new EnumMap<>(Namespace.class);

    // UserId -> ConnectionIds (for targeted lookups)
    private final ConcurrentMap<String, Set<String>> userIndex = new ConcurrentHashMap<>();

    // Slots reserved by admit, released by remove
    private final AtomicInteger reserved = new AtomicInteger();
    private volatile boolean draining = false;

    public ConnectionRegistry(int maxConnections, RealtimeMetrics metrics) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("Max connections must be positive");
        }
        this.maxConnections = maxConnections;
        this.metrics = metrics;
        for (Namespace namespace : Namespace.values()) {
            namespaceIndex.put(namespace, ConcurrentHashMap.newKeySet());
        }
    }

    /**
     * Register an authenticated connection.
     *
     * @return the connection id
     * @throws RealtimeException CAPACITY_EXCEEDED when full; ADMISSION_REJECTED when
     *         draining or the connection is already bound, removed or closed
     */
    public String admit(Connection connection, ConnectionIdentity identity) {
        if (draining) {
            throw new RealtimeException(ErrorCode.ADMISSION_REJECTED, "Registry is draining");
        }
        if (connection.isRemoved() || !connection.getTransport().isOpen()) {
            throw new RealtimeException(ErrorCode.ADMISSION_REJECTED, "Connection already closed");
        }
        if (!reserveSlot()) {
            throw new RealtimeException(ErrorCode.CAPACITY_EXCEEDED,
                "Maximum connections reached (" + maxConnections + ")");
        }
        if (!connection.bind(identity)) {
            reserved.decrementAndGet();
            throw new RealtimeException(ErrorCode.ADMISSION_REJECTED, "Connection already admitted");
        }

        String id = connection.getId();
        connections.put(id, connection);
        userIndex.computeIfAbsent(identity.userId(), k -> ConcurrentHashMap.newKeySet()).add(id);

        metrics.recordConnectionOpened(identity.role());

        // Drain or close may have raced with the checks above
        if (draining || !connection.getTransport().isOpen()) {
            remove(id, ErrorCode.ADMISSION_REJECTED.name());
            throw new RealtimeException(ErrorCode.ADMISSION_REJECTED, "Connection closed during admission");
        }

        log.info("WS admitted: {} (user={}, role={}, remote={})",
            id, identity.userId(), identity.role().wireName(), connection.getTransport().remoteAddress());
        return id;
    }

    private boolean reserveSlot() {
        while (true) {
            int current = reserved.get();
            if (current >= maxConnections) {
                return false;
            }
            if (reserved.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Remove a connection from every index. Idempotent.
     *
     * @return true if this call removed it
     */
    public boolean remove(String connectionId) {
        return remove(connectionId, "closed");
    }

    public boolean remove(String connectionId, String reason) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        synchronized (connection) {
            if (!connection.markRemoved()) {
                return false;
            }
            for (Namespace namespace : connection.getNamespaces()) {
                namespaceIndex.get(namespace).remove(connectionId);
                connection.removeNamespace(namespace);
            }
        }

        ConnectionIdentity identity = connection.getIdentity();
        userIndex.computeIfPresent(identity.userId(), (userId, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
        connections.remove(connectionId);
        reserved.decrementAndGet();

        metrics.recordConnectionClosed(identity.role(), reason);
        log.info("WS removed: {} (user={}, reason={})", connectionId, identity.userId(), reason);
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // Subscriptions
    // ═══════════════════════════════════════════════════════════════

    /**
     * Add a namespace to the connection's subscriptions. Entitlement is checked
     * by the caller against the visibility matrix.
     *
     * @return false if it was already subscribed
     */
    public boolean subscribe(String connectionId, Namespace namespace) {
        Connection connection = require(connectionId);
        synchronized (connection) {
            if (connection.isRemoved()) {
                throw unknown(connectionId);
            }
            namespaceIndex.get(namespace).add(connectionId);
            return connection.addNamespace(namespace);
        }
    }

    public boolean subscribe(String connectionId, String namespace) {
        return subscribe(connectionId, parseNamespace(namespace));
    }

    public boolean unsubscribe(String connectionId, Namespace namespace) {
        Connection connection = require(connectionId);
        synchronized (connection) {
            if (connection.isRemoved()) {
                throw unknown(connectionId);
            }
            namespaceIndex.get(namespace).remove(connectionId);
            return connection.removeNamespace(namespace);
        }
    }

    public boolean unsubscribe(String connectionId, String namespace) {
        return unsubscribe(connectionId, parseNamespace(namespace));
    }

    public static Namespace parseNamespace(String namespace) {
        return Namespace.fromWire(namespace)
            .orElseThrow(() -> new RealtimeException(ErrorCode.INVALID_NAMESPACE, "Unknown namespace: " + namespace));
    }

    // ═══════════════════════════════════════════════════════════════
    // Lookups (snapshots)
    // ═══════════════════════════════════════════════════════════════

    /**
     * Live connections subscribed to a namespace. The list is a snapshot; a
     * connection in it may be removed while the caller iterates.
     */
    public List<Connection> connectionsFor(Namespace namespace) {
        List<Connection> result = new ArrayList<>();
        for (String id : namespaceIndex.get(namespace)) {
            Connection connection = connections.get(id);
            if (connection != null && !connection.isRemoved()) {
                result.add(connection);
            }
        }
        return List.copyOf(result);
    }

    public List<Connection> connectionsForUser(String userId) {
        Set<String> ids = userIndex.get(userId);
        if (ids == null) {
            return List.of();
        }
        List<Connection> result = new ArrayList<>();
        for (String id : ids) {
            Connection connection = connections.get(id);
            if (connection != null && !connection.isRemoved()) {
                result.add(connection);
            }
        }
        return List.copyOf(result);
    }

    public Optional<Connection> get(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection == null || connection.isRemoved()) {
            return Optional.empty();
        }
        return Optional.of(connection);
    }

    public List<Connection> snapshot() {
        List<Connection> result = new ArrayList<>();
        for (Connection connection : connections.values()) {
            if (!connection.isRemoved()) {
                result.add(connection);
            }
        }
        return List.copyOf(result);
    }

    public int size() {
        return connections.size();
    }

    /**
     * Whether an admit right now would find a free slot.
     */
    public boolean hasCapacity() {
        return !draining && reserved.get() < maxConnections;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public boolean isDraining() {
        return draining;
    }

    public RegistryStats stats() {
        List<Connection> live = snapshot();
        Map<String, Integer> byRole = new LinkedHashMap<>();
        for (Role role : Role.values()) {
            byRole.put(role.wireName(), 0);
        }
        Map<String, Integer> byNamespace = new LinkedHashMap<>();
        for (Namespace namespace : Namespace.values()) {
            byNamespace.put(namespace.wireName(), 0);
        }
        Set<String> users = new HashSet<>();
        int authenticated = 0;

        for (Connection connection : live) {
            ConnectionIdentity identity = connection.getIdentity();
            if (identity == null) {
                continue;
            }
            authenticated++;
            users.add(identity.userId());
            byRole.merge(identity.role().wireName(), 1, Integer::sum);
            for (Namespace namespace : connection.getNamespaces()) {
                byNamespace.merge(namespace.wireName(), 1, Integer::sum);
            }
        }

        return new RegistryStats(live.size(), authenticated, byRole, byNamespace, users.size(), maxConnections);
    }

    /**
     * Close every connection with the given code and stop admitting new ones.
     *
     * @return number of connections closed
     */
    public int drain(ErrorCode code) {
        draining = true;
        int closed = 0;
        for (Connection connection : snapshot()) {
            if (remove(connection.getId(), code.name())) {
                closeQuietly(connection, code);
                closed++;
            }
        }
        log.info("WS registry drained: {} connections closed ({})", closed, code);
        return closed;
    }

    private static void closeQuietly(Connection connection, ErrorCode code) {
        try {
            connection.close(code);
        } catch (RuntimeException e) {
            log.warn("Failed to close {}: {}", connection.getId(), e.toString());
        }
    }

    private Connection require(String connectionId) {
        Connection connection = connectionId == null ? null : connections.get(connectionId);
        if (connection == null) {
            throw unknown(connectionId);
        }
        return connection;
    }

    private static RealtimeException unknown(String connectionId) {
        return new RealtimeException(ErrorCode.UNKNOWN_CONNECTION, "Unknown connection: " + connectionId);
    }

    Map<Namespace, Set<String>> namespaceIndexView() {
        return Collections.unmodifiableMap(namespaceIndex);
    }
}
