package in.shopwire.transport.http;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * HTTP handler for the Prometheus /metrics endpoint.
 *
 * Example output:
 * <pre>
 * # HELP ws_connections_active Registered WebSocket connections
 * # TYPE ws_connections_active gauge
 * ws_connections_active{role="admin",} 2.0
 * ws_connections_active{role="customer",} 131.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        try {
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);

            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String body = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseSender().send(body);
            log.debug("Served metrics ({} bytes)", body.length());
        } catch (IOException e) {
            log.error("Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
