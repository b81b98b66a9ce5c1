package in.optionsnap.infrastructure.metrics;

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
 * Undertow handler serving the Prometheus text exposition format.
 *
 * Example output:
 * <pre>
 * # HELP snapshot_cycles_total Total number of snapshot refresh cycles
 * # TYPE snapshot_cycles_total counter
 * snapshot_cycles_total{outcome="SUCCESS",} 42.0
 * snapshot_cycles_total{outcome="PARTIAL",} 3.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
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
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
