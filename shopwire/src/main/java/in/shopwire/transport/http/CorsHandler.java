package in.shopwire.transport.http;

import in.shopwire.config.RealtimeConfig;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;

/**
 * CORS for the HTTP endpoints. Echoes an allowed Origin and answers preflight requests.
 */
public final class CorsHandler implements HttpHandler {
    private static final HttpString ALLOW_ORIGIN = HttpString.tryFromString("Access-Control-Allow-Origin");
    private static final HttpString ALLOW_METHODS = HttpString.tryFromString("Access-Control-Allow-Methods");
    private static final HttpString ALLOW_HEADERS = HttpString.tryFromString("Access-Control-Allow-Headers");
    private static final HttpString MAX_AGE = HttpString.tryFromString("Access-Control-Max-Age");

    private final RealtimeConfig config;
    private final HttpHandler next;

    public CorsHandler(RealtimeConfig config, HttpHandler next) {
        this.config = config;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        if (origin != null && AdmissionHandler.isOriginAllowed(config, origin)) {
            exchange.getResponseHeaders()
                .put(ALLOW_ORIGIN, config.allowsAllOrigins() ? "*" : origin)
                .put(ALLOW_METHODS, "GET, OPTIONS")
                .put(ALLOW_HEADERS, "Content-Type, Authorization")
                .put(MAX_AGE, "3600");
            if (!config.allowsAllOrigins()) {
                exchange.getResponseHeaders().put(Headers.VARY, "Origin");
            }
        }

        if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(StatusCodes.NO_CONTENT);
            exchange.endExchange();
            return;
        }
        next.handleRequest(exchange);
    }
}
