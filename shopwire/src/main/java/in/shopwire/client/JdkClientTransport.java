package in.shopwire.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link ClientTransport} on {@code java.net.http.WebSocket}.
 */
public final class JdkClientTransport implements ClientTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkClientTransport.class);

    private final HttpClient httpClient;
    private final String origin;

    public JdkClientTransport() {
        this(null);
    }

    /**
     * @param origin Origin header to send, or null for none
     */
    public JdkClientTransport(String origin) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.origin = origin;
    }

    @Override
    public CompletableFuture<Socket> open(URI uri, Listener listener) {
        WebSocket.Builder builder = httpClient.newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(10));
        if (origin != null) {
            builder.header("Origin", origin);
        }

        return builder.buildAsync(uri, new WebSocket.Listener() {
            private final StringBuilder buf = new StringBuilder();

            @Override
            public void onOpen(WebSocket webSocket) {
                webSocket.request(1);
            }

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                buf.append(data);
                if (last) {
                    String msg = buf.toString();
                    buf.setLength(0);
                    listener.onText(msg);
                }
                webSocket.request(1);
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                listener.onClose(statusCode, reason);
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public void onError(WebSocket webSocket, Throwable error) {
                listener.onError(error);
            }
        }).thenApply(JdkSocket::new);
    }

    /**
     * Serializes sends: the JDK WebSocket rejects a send while another is pending.
     */
    private static final class JdkSocket implements Socket {
        private final WebSocket webSocket;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        JdkSocket(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public synchronized CompletableFuture<Void> send(String text) {
            tail = tail
                .exceptionally(error -> null)
                .thenCompose(ignored -> webSocket.sendText(text, true))
                .thenApply(ws -> null);
            return tail;
        }

        @Override
        public void close(int code, String reason) {
            if (webSocket.isOutputClosed()) {
                return;
            }
            webSocket.sendClose(code, reason).whenComplete((ws, error) -> {
                if (error != null) {
                    log.debug("Close failed, aborting: {}", error.toString());
                    webSocket.abort();
                }
            });
        }
    }
}
