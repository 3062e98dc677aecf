package in.candlevault.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.candlevault.application.monitoring.AlertService;
import in.candlevault.application.service.IngestionCoordinator;
import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.Gap;
import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TimeRange;
import in.candlevault.domain.monitoring.Alert;
import in.candlevault.domain.repository.GapRepository;
import in.candlevault.service.gap.GapDetector;
import in.candlevault.service.gap.RecoveryOrchestrator;
import in.candlevault.service.resilience.CircuitBreakerRegistry;
import in.candlevault.service.resilience.HealthTracker;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP handler for the operational endpoints.
 *
 * - GET  /api/health - per-source health and breaker states
 * - GET  /api/gaps?symbol=&interval=&status= - stored gaps of a series
 * - GET  /api/completeness - coverage report for every configured series
 * - GET  /api/alerts - most recent alerts
 * - POST /api/gaps/{id}/requeue - move a FAILED gap back to PENDING
 * - POST /api/breakers/{id}/reset - force a breaker CLOSED
 * - POST /api/reconcile?symbol=&interval=&from=&to= - cross-source re-fetch of a stored range
 */
public final class MonitoringHandler {
    private static final Logger log = LoggerFactory.getLogger(MonitoringHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    private static final int RECENT_ALERTS = 50;

    private final List<SeriesKey> series;
    private final HealthTracker health;
    private final CircuitBreakerRegistry breakers;
    private final GapRepository gaps;
    private final GapDetector detector;
    private final RecoveryOrchestrator orchestrator;
    private final IngestionCoordinator coordinator;
    private final Deque<Alert> recentAlerts = new ArrayDeque<>();

    public MonitoringHandler(List<SeriesKey> series, HealthTracker health, CircuitBreakerRegistry breakers,
                             GapRepository gaps, GapDetector detector, RecoveryOrchestrator orchestrator,
                             IngestionCoordinator coordinator, AlertService alerts) {
        this.series = List.copyOf(series);
        this.health = health;
        this.breakers = breakers;
        this.gaps = gaps;
        this.detector = detector;
        this.orchestrator = orchestrator;
        this.coordinator = coordinator;
        alerts.addListener(this::remember);
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", coordinator.isRunning() ? "RUNNING" : "STOPPED");
            body.put("timestamp", Instant.now());
            body.put("sources", health.snapshotAll());
            body.put("breakers", breakers.snapshot());
            sendJson(exchange, StatusCodes.OK, body);
        } catch (Exception e) {
            log.error("Failed to get health: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get health: " + e.getMessage());
        }
    }

    /**
     * GET /api/gaps?symbol=BTCUSDT&interval=1h[&status=FAILED]
     */
    public void gaps(HttpServerExchange exchange) {
        try {
            SeriesKey key = seriesParam(exchange);
            String statusParam = param(exchange, "status");
            GapStatus status = statusParam == null ? null : GapStatus.valueOf(statusParam.toUpperCase());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("series", key.toString());
            body.put("gaps", gaps.listGaps(key.symbol(), key.interval(), status));
            body.put("completeness", detector.completeness(key));
            sendJson(exchange, StatusCodes.OK, body);

        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Failed to list gaps: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to list gaps: " + e.getMessage());
        }
    }

    /**
     * GET /api/completeness
     */
    public void completeness(HttpServerExchange exchange) {
        try {
            List<GapDetector.Completeness> reports = new ArrayList<>();
            for (SeriesKey key : series) {
                reports.add(detector.completeness(key));
            }
            sendJson(exchange, StatusCodes.OK, Map.of("series", reports));
        } catch (Exception e) {
            log.error("Failed to compute completeness: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to compute completeness: " + e.getMessage());
        }
    }

    /**
     * GET /api/alerts
     */
    public void alerts(HttpServerExchange exchange) {
        try {
            List<Alert> snapshot;
            synchronized (recentAlerts) {
                snapshot = new ArrayList<>(recentAlerts);
            }
            sendJson(exchange, StatusCodes.OK, Map.of("alerts", snapshot));
        } catch (Exception e) {
            log.error("Failed to get alerts: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get alerts: " + e.getMessage());
        }
    }

    /**
     * POST /api/gaps/{id}/requeue
     */
    public void requeueGap(HttpServerExchange exchange) {
        String id = param(exchange, "id");
        try {
            Optional<Gap> requeued = orchestrator.requeue(id);
            if (requeued.isPresent()) {
                sendJson(exchange, StatusCodes.OK, requeued.get());
            } else if (gaps.findById(id).isPresent()) {
                sendError(exchange, StatusCodes.CONFLICT, "Gap " + id + " is not FAILED");
            } else {
                sendError(exchange, StatusCodes.NOT_FOUND, "Gap not found: " + id);
            }
        } catch (Exception e) {
            log.error("Failed to requeue gap {}: {}", id, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to requeue gap: " + e.getMessage());
        }
    }

    /**
     * POST /api/breakers/{id}/reset
     */
    public void resetBreaker(HttpServerExchange exchange) {
        String id = param(exchange, "id");
        try {
            if (!breakers.reset(id)) {
                sendError(exchange, StatusCodes.NOT_FOUND, "No breaker for source: " + id);
                return;
            }
            log.info("[Monitoring] Breaker for {} reset by operator", id);
            sendJson(exchange, StatusCodes.OK, Map.of("source", id, "state", breakers.get(id).getState()));
        } catch (Exception e) {
            log.error("Failed to reset breaker {}: {}", id, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to reset breaker: " + e.getMessage());
        }
    }

    /**
     * POST /api/reconcile?symbol=BTCUSDT&interval=1h&from=2024-01-01T00:00:00Z&to=2024-01-02T00:00:00Z
     */
    public void reconcile(HttpServerExchange exchange) {
        try {
            SeriesKey key = seriesParam(exchange);
            Instant from = instantParam(exchange, "from");
            Instant to = instantParam(exchange, "to");
            FetchTask task = coordinator.submitReconciliation(key, new TimeRange(from, to));
            sendJson(exchange, StatusCodes.ACCEPTED, Map.of("task", task.toString()));

        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, e.getMessage());
        } catch (Exception e) {
            log.error("Failed to queue reconciliation: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to queue reconciliation: " + e.getMessage());
        }
    }

    private void remember(Alert alert) {
        synchronized (recentAlerts) {
            recentAlerts.addFirst(alert);
            while (recentAlerts.size() > RECENT_ALERTS) {
                recentAlerts.removeLast();
            }
        }
    }

    private SeriesKey seriesParam(HttpServerExchange exchange) {
        String symbol = param(exchange, "symbol");
        String interval = param(exchange, "interval");
        if (symbol == null || interval == null) {
            throw new IllegalArgumentException("symbol and interval are required");
        }
        return SeriesKey.of(symbol.toUpperCase(), Interval.fromCode(interval));
    }

    private Instant instantParam(HttpServerExchange exchange, String name) {
        String value = param(exchange, name);
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }

    private static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
