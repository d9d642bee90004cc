package in.shopwire.transport.ws;

import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@link WsTransport} over an Undertow {@link WebSocketChannel}.
 */
final class UndertowWsTransport implements WsTransport {
    private static final Logger log = LoggerFactory.getLogger(UndertowWsTransport.class);

    private final WebSocketChannel channel;

    UndertowWsTransport(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public void send(String text, SendCallback callback) {
        WebSockets.sendText(text, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                callback.onComplete();
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                callback.onError(throwable);
            }
        });
    }

    @Override
    public void close(int code, String reason) {
        if (!channel.isOpen() || channel.isCloseFrameSent()) {
            return;
        }
        WebSockets.sendClose(code, reason, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                // Undertow finishes the close handshake
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.debug("Close frame to {} failed: {}", remoteAddress(), throwable.toString());
                forceClose();
            }
        });
    }

    private void forceClose() {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close channel {}: {}", remoteAddress(), e.toString());
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.getSourceAddress());
    }
}
