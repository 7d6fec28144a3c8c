package in.brainlog.metrics;

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
 * Serves the registry in Prometheus text format at /metrics.
 *
 * Example output:
 * <pre>
 * # HELP auth_logins_total Total number of login attempts by outcome
 * # TYPE auth_logins_total counter
 * auth_logins_total{outcome="success",} 42.0
 * auth_logins_total{outcome="invalid_credentials",} 3.0
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
            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String body = writer.toString();

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(body);

            log.debug("[PrometheusMetricsHandler] Served metrics ({} bytes)", body.length());

        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics");
        }
    }
}
