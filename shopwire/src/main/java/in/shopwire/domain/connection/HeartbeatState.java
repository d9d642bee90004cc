package in.shopwire.domain.connection;

/**
 * Liveness state of a connection as seen by the heartbeat monitor.
 * Eviction is terminal and represented by removal from the registry.
 */
public enum HeartbeatState {
    ALIVE,
    AWAITING_PONG
}
