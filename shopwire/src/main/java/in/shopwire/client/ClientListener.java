package in.shopwire.client;

import in.shopwire.domain.common.ErrorCode;

import java.time.Duration;

/**
 * Callbacks from a {@link RealtimeClient}. All methods run on the client's
 * own thread and default to no-ops.
 */
public interface ClientListener {

    default void onStateChange(ClientState previous, ClientState current) {
    }

    /**
     * Authenticated and every desired namespace re-subscribed.
     */
    default void onConnected() {
    }

    default void onEvent(ClientEvent event) {
    }

    /**
     * Error frame from the server. Terminal codes are followed by {@link #onOffline}.
     */
    default void onError(ErrorCode code, String message) {
    }

    default void onReconnecting(int attempt, Duration delay) {
    }

    /**
     * Gave up: retries exhausted ({@code reason} null) or a terminal error.
     */
    default void onOffline(ErrorCode reason) {
    }
}
