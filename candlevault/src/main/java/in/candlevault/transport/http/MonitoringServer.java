package in.candlevault.transport.http;

import in.candlevault.infrastructure.metrics.PrometheusMetricsHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Undertow server for /metrics and the /api operational endpoints.
 */
public final class MonitoringServer {
    private static final Logger log = LoggerFactory.getLogger(MonitoringServer.class);

    private final Undertow server;

    public MonitoringServer(String host, int port, PrometheusMetricsHandler metricsHandler, MonitoringHandler api) {
        this(host, port, metricsHandler, api, null);
    }

    /**
     * @param marketData liquidation and order book reads; null leaves those routes out
     */
    public MonitoringServer(String host, int port, PrometheusMetricsHandler metricsHandler, MonitoringHandler api,
                            MarketDataHandler marketData) {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/gaps", api::gaps)
            .get("/api/completeness", api::completeness)
            .get("/api/alerts", api::alerts)
            .post("/api/gaps/{id}/requeue", api::requeueGap)
            .post("/api/breakers/{id}/reset", api::resetBreaker)
            .post("/api/reconcile", api::reconcile);
        if (marketData != null) {
            routes.get("/api/liquidations", marketData::liquidations)
                .get("/api/orderbook", marketData::orderBook);
        }

        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(new BlockingHandler(routes))
            .build();
    }

    public void start() {
        server.start();
        log.info("✓ Monitoring server listening on port {}", port());
    }

    public void stop() {
        server.stop();
        log.info("Monitoring server stopped");
    }

    /**
     * Bound port, after {@link #start()}.
     */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }
}
