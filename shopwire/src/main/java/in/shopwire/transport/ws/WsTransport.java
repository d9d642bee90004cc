package in.shopwire.transport.ws;

/**
 * Server side of one WebSocket, as seen by the registry and the broadcaster.
 *
 * Implementations must not block in {@link #send}: completion is reported
 * through the callback, usually from an I/O thread.
 */
public interface WsTransport {

    void send(String text, SendCallback callback);

    /**
     * Send a close frame and release the socket. Safe to call more than once.
     */
    void close(int code, String reason);

    boolean isOpen();

    String remoteAddress();

    interface SendCallback {
        void onComplete();

        void onError(Throwable error);
    }
}
