package in.shopwire.client;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens WebSocket connections for a {@link RealtimeClient}.
 */
public interface ClientTransport {

    /**
     * Open a socket. The future completes once the handshake succeeds; it
     * completes exceptionally when the connection cannot be made.
     */
    CompletableFuture<Socket> open(URI uri, Listener listener);

    interface Socket {
        CompletableFuture<Void> send(String text);

        void close(int code, String reason);
    }

    interface Listener {
        void onText(String text);

        void onClose(int code, String reason);

        void onError(Throwable error);
    }
}
