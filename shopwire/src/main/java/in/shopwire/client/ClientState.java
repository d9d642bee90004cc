package in.shopwire.client;

/**
 * Lifecycle of a {@link RealtimeClient}.
 *
 * DISCONNECTED -> CONNECTING -> AUTHENTICATING -> SUBSCRIBED
 * any live state -> RECONNECTING -> CONNECTING (after backoff)
 * RECONNECTING or a terminal server error -> OFFLINE
 */
public enum ClientState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    SUBSCRIBED,
    RECONNECTING,
    OFFLINE;

    public boolean isLive() {
        return this == CONNECTING || this == AUTHENTICATING || this == SUBSCRIBED;
    }
}
