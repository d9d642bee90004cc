package in.shopwire.transport.ws;

import java.util.Map;

/**
 * Point-in-time view of the registry, served by {@code GET /stats}.
 */
public record RegistryStats(
    int totalConnections,
    int authenticatedConnections,
    Map<String, Integer> connectionsByRole,
    Map<String, Integer> connectionsByNamespace,
    int uniqueUsers,
    int maxConnections
) {
    public RegistryStats {
        connectionsByRole = Map.copyOf(connectionsByRole);
        connectionsByNamespace = Map.copyOf(connectionsByNamespace);
    }
}
