package in.trendbook.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.trendbook.infrastructure.metrics.PrometheusMetricsHandler;
import in.trendbook.service.book.OrderBookEngine;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Read-only HTTP endpoints for operators.
 *
 * Routes:
 * - GET /metrics - Prometheus text format
 * - GET /book    - top of book and depth as JSON
 * - GET /health  - 200 "OK", or 503 "RESYNC" while the book waits for a snapshot
 */
public final class MonitoringServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MonitoringServer.class);

    private final String host;
    private final int port;
    private final Undertow server;

    public MonitoringServer(String host, int port, CollectorRegistry registry, OrderBookEngine book) {
        this.host = host;
        this.port = port;

        BooleanSupplier healthy = () -> !book.resyncRequired();
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(registry))
            .get("/book", new BookSnapshotHandler(book, new ObjectMapper()))
            .get("/health", exchange -> {
                boolean ok = healthy.getAsBoolean();
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
                exchange.setStatusCode(ok ? 200 : 503);
                exchange.getResponseSender().send(ok ? "OK" : "RESYNC");
            });

        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(routes)
            .build();
    }

    public void start() {
        server.start();
        log.info("✓ Monitoring server listening on http://{}:{} (/metrics, /book, /health)", host, port);
    }

    public void stop() {
        server.stop();
        log.info("Monitoring server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
