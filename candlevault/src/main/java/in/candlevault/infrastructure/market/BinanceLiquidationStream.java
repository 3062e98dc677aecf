package in.candlevault.infrastructure.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.candlevault.domain.market.LiquidationEvent;
import in.candlevault.domain.market.LiquidationSide;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.service.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Binance USDⓈ-M futures force-order stream ({@code <symbol>@forceOrder}).
 *
 * One combined websocket carries every configured symbol. Events are pushed to
 * the sink as they arrive. The exchange offers no history for this feed, so
 * liquidations during a disconnect are lost; the stream reconnects with
 * exponential backoff and logs each outage window.
 *
 * Message (combined form):
 * <pre>
 * {"stream":"btcusdt@forceOrder","data":{"e":"forceOrder","E":1700000000123,
 *   "o":{"s":"BTCUSDT","S":"SELL","q":"0.014","p":"9910","ap":"9910","X":"FILLED","T":1700000000120}}}
 * </pre>
 */
public final class BinanceLiquidationStream {
    private static final Logger log = LoggerFactory.getLogger(BinanceLiquidationStream.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String STREAM_NAME = "binance-liquidations";

    private final URI uri;
    private final List<String> symbols;
    private final Consumer<LiquidationEvent> sink;
    private final RetryPolicy reconnectPolicy;
    private final IngestionMetrics metrics;
    private final Clock clock;
    private final HttpClient httpClient;
    private final ScheduledExecutorService reconnectTimer;

    private final AtomicReference<WebSocket> wsRef = new AtomicReference<>(null);
    private final AtomicInteger failedAttempts = new AtomicInteger(0);

    private volatile boolean connected = false;
    private volatile boolean stopped = false;
    private volatile Instant disconnectedAt;

    public BinanceLiquidationStream(String streamUrl, List<String> symbols, Consumer<LiquidationEvent> sink,
                                    RetryPolicy reconnectPolicy, IngestionMetrics metrics, Clock clock) {
        this.symbols = List.copyOf(symbols);
        this.uri = URI.create(combinedStreamUrl(streamUrl, symbols));
        this.sink = sink;
        this.reconnectPolicy = reconnectPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.reconnectTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "liquidation-stream-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    static String combinedStreamUrl(String streamUrl, List<String> symbols) {
        String base = streamUrl.endsWith("/") ? streamUrl.substring(0, streamUrl.length() - 1) : streamUrl;
        return base + "/stream?streams=" + symbols.stream()
            .map(s -> s.toLowerCase(Locale.ROOT) + "@forceOrder")
            .collect(Collectors.joining("/"));
    }

    public void start() {
        log.info("[LIQ STREAM] Connecting for {} symbol(s): {}", symbols.size(), symbols);
        connect();
    }

    public void stop() {
        stopped = true;
        reconnectTimer.shutdownNow();
        WebSocket ws = wsRef.getAndSet(null);
        connected = false;
        metrics.recordStreamConnected(STREAM_NAME, false);
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown")
                .exceptionally(e -> {
                    log.debug("[LIQ STREAM] Close handshake failed: {}", e.getMessage());
                    return null;
                });
        }
        log.info("[LIQ STREAM] Stopped");
    }

    public boolean isConnected() {
        return connected;
    }

    private void connect() {
        if (stopped) {
            return;
        }
        httpClient.newWebSocketBuilder()
            .buildAsync(uri, new WebSocket.Listener() {
                private final StringBuilder buf = new StringBuilder();

                @Override
                public void onOpen(WebSocket webSocket) {
                    wsRef.set(webSocket);
                    connected = true;
                    failedAttempts.set(0);
                    metrics.recordStreamConnected(STREAM_NAME, true);
                    Instant since = disconnectedAt;
                    if (since != null) {
                        log.warn("[LIQ STREAM] Reconnected after outage {} .. {}; liquidations in that window are not recoverable",
                            since, clock.instant());
                        disconnectedAt = null;
                    } else {
                        log.info("[LIQ STREAM] ✓ Connected");
                    }
                    webSocket.request(1);
                }

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    buf.append(data);
                    if (last) {
                        String msg = buf.toString();
                        buf.setLength(0);
                        handleMessage(msg);
                    }
                    webSocket.request(1);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                    log.warn("[LIQ STREAM] Disconnected: {} {}", statusCode, reason);
                    onDisconnect();
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public void onError(WebSocket webSocket, Throwable error) {
                    log.error("[LIQ STREAM] WebSocket error: {}", error.getMessage());
                    onDisconnect();
                }
            })
            .exceptionally(e -> {
                log.warn("[LIQ STREAM] Connect failed: {}", e.getMessage());
                onDisconnect();
                return null;
            });
    }

    private void onDisconnect() {
        wsRef.set(null);
        connected = false;
        metrics.recordStreamConnected(STREAM_NAME, false);
        if (disconnectedAt == null) {
            disconnectedAt = clock.instant();
        }
        if (stopped) {
            return;
        }
        Duration delay = reconnectPolicy.baseDelayFor(failedAttempts.getAndIncrement());
        log.info("[LIQ STREAM] Reconnecting in {}ms", delay.toMillis());
        reconnectTimer.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void handleMessage(String msg) {
        Optional<LiquidationEvent> event;
        try {
            event = parseMessage(msg);
        } catch (IllegalArgumentException e) {
            log.warn("[LIQ STREAM] Dropping malformed message: {}", e.getMessage());
            return;
        }
        event.ifPresent(e -> {
            metrics.recordLiquidationEvent(e.symbol(), e.side());
            sink.accept(e);
        });
    }

    /**
     * Parse one stream message, combined or raw.
     *
     * @return the liquidation, or empty for non force-order messages
     * @throws IllegalArgumentException if a force-order message is malformed
     */
    public static Optional<LiquidationEvent> parseMessage(String msg) {
        JsonNode root;
        try {
            root = MAPPER.readTree(msg);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unparsable JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode data = root.has("data") ? root.get("data") : root;
        if (!"forceOrder".equals(data.path("e").asText())) {
            return Optional.empty();
        }
        JsonNode order = data.path("o");
        if (!order.isObject()) {
            throw new IllegalArgumentException("forceOrder without order payload");
        }
        String symbol = order.path("s").asText("");
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("forceOrder without symbol");
        }
        try {
            // Average fill price; the limit price "p" is the fallback for unfilled orders
            String price = order.hasNonNull("ap") && new BigDecimal(order.get("ap").asText()).signum() > 0
                ? order.get("ap").asText()
                : order.path("p").asText();
            String quantity = order.hasNonNull("z") && new BigDecimal(order.get("z").asText()).signum() > 0
                ? order.get("z").asText()
                : order.path("q").asText();
            long tradeTime = order.has("T") ? order.get("T").asLong() : data.path("E").asLong();
            return Optional.of(new LiquidationEvent(
                symbol,
                LiquidationSide.fromOrderSide(order.path("S").asText()),
                new BigDecimal(price),
                new BigDecimal(quantity),
                Instant.ofEpochMilli(tradeTime)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad number in " + order, e);
        }
    }
}
