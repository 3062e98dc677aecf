package in.candlevault.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.candlevault.application.monitoring.AlertService;
import in.candlevault.application.service.FetchTaskHandler;
import in.candlevault.application.service.IngestionCoordinator;
import in.candlevault.application.service.LiquidationCollector;
import in.candlevault.application.service.OrderBookCollector;
import in.candlevault.application.service.TaskScheduler;
import in.candlevault.config.ConfigLoader;
import in.candlevault.config.IngestionConfig;
import in.candlevault.config.MarketActivityConfig;
import in.candlevault.config.SourceConfig;
import in.candlevault.domain.error.ConfigurationException;
import in.candlevault.domain.repository.DataPointRepository;
import in.candlevault.domain.repository.GapRepository;
import in.candlevault.domain.repository.MarketActivityRepository;
import in.candlevault.infrastructure.market.BinanceLiquidationStream;
import in.candlevault.infrastructure.market.BinanceOrderBookClient;
import in.candlevault.infrastructure.metrics.PrometheusIngestionMetrics;
import in.candlevault.infrastructure.metrics.PrometheusMetricsHandler;
import in.candlevault.infrastructure.persistence.InMemoryDataPointRepository;
import in.candlevault.infrastructure.persistence.InMemoryGapRepository;
import in.candlevault.infrastructure.persistence.InMemoryMarketActivityRepository;
import in.candlevault.infrastructure.persistence.PostgresDataPointRepository;
import in.candlevault.infrastructure.persistence.PostgresGapRepository;
import in.candlevault.infrastructure.persistence.PostgresMarketActivityRepository;
import in.candlevault.infrastructure.persistence.SchemaMigration;
import in.candlevault.infrastructure.source.ProviderHttpClient;
import in.candlevault.infrastructure.source.SourceAdapter;
import in.candlevault.infrastructure.source.SourceAdapterFactory;
import in.candlevault.service.gap.GapDetector;
import in.candlevault.service.gap.RecoveryOrchestrator;
import in.candlevault.service.market.TimeBucketAggregator;
import in.candlevault.service.resilience.CircuitBreakerRegistry;
import in.candlevault.service.resilience.HealthTracker;
import in.candlevault.service.resilience.RetryPolicy;
import in.candlevault.service.resilience.SlidingWindowRateLimiter;
import in.candlevault.service.source.SourceSelector;
import in.candlevault.service.validation.DataValidator;
import in.candlevault.transport.http.MarketDataHandler;
import in.candlevault.transport.http.MonitoringHandler;
import in.candlevault.transport.http.MonitoringServer;
import in.candlevault.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point: load configuration, wire the engine, run until stopped.
 *
 * Environment (besides what {@link ConfigLoader} reads):
 * - STORE: postgres (default) or memory
 * - DB_URL, DB_USER, DB_PASS, DB_POOL_SIZE: PostgreSQL connection
 * - HTTP_PORT: monitoring server port (default 9090, 0 disables it)
 * - RUN_DURATION_MINUTES: stop after this many minutes (default 0, run until killed)
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== CandleVault Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        IngestionConfig config;
        try {
            config = ConfigLoader.load();
            StartupConfigValidator.validate(config, SourceAdapterFactory.SUPPORTED, Instant.now(clock));
        } catch (ConfigurationException e) {
            log.error("❌ Invalid configuration:");
            e.getProblems().forEach(p -> log.error("   - {}", p));
            System.exit(1);
            return;
        }
        log.info("Series: {}", config.getSeries());
        for (SourceConfig source : config.getSources()) {
            log.info("Source: {}", source);
        }

        int httpPort = Env.getInt("HTTP_PORT", 9090);
        int runMinutes = Env.getInt("RUN_DURATION_MINUTES", 0);
        String store = Env.get("STORE", "postgres");

        // ═══════════════════════════════════════════════════════════════
        // Persistence
        // ═══════════════════════════════════════════════════════════════
        DataPointRepository points;
        GapRepository gaps;
        MarketActivityRepository marketActivity;
        HikariDataSource dataSource = null;
        if ("memory".equalsIgnoreCase(store)) {
            points = new InMemoryDataPointRepository();
            gaps = new InMemoryGapRepository();
            marketActivity = new InMemoryMarketActivityRepository();
            log.warn("Using in-memory store: collected data is lost on exit");
        } else {
            dataSource = createDataSource();
            new SchemaMigration(dataSource).migrate();
            points = new PostgresDataPointRepository(dataSource);
            gaps = new PostgresGapRepository(dataSource);
            marketActivity = new PostgresMarketActivityRepository(dataSource);
        }

        // ═══════════════════════════════════════════════════════════════
        // Metrics & alerts
        // ═══════════════════════════════════════════════════════════════
        PrometheusIngestionMetrics metrics = new PrometheusIngestionMetrics();
        AlertService alerts = new AlertService();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Sources & resilience
        // ═══════════════════════════════════════════════════════════════
        List<SourceAdapter> adapters = SourceAdapterFactory.createAll(config.getEnabledSources());
        SlidingWindowRateLimiter rateLimiter = new SlidingWindowRateLimiter(
            config.getRateLimitWindow(), config.getRateLimitMaxWait(), metrics);
        for (SourceConfig source : config.getEnabledSources()) {
            rateLimiter.register(source.id(), source.requestsPerWindow());
        }
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.fromConfig(config, clock, metrics);
        HealthTracker health = HealthTracker.fromConfig(config, clock, metrics);
        SourceSelector selector = new SourceSelector(adapters, rateLimiter, breakers, health, metrics);

        // ═══════════════════════════════════════════════════════════════
        // Ingestion pipeline
        // ═══════════════════════════════════════════════════════════════
        FetchTaskHandler handler = new FetchTaskHandler(selector, DataValidator.fromConfig(config), points, metrics);
        TaskScheduler scheduler = new TaskScheduler(config.getWorkerPoolSize(), handler,
            RetryPolicy.fromConfig(config), metrics);
        GapDetector detector = new GapDetector(points, gaps, config.getCollectionStart(),
            config.getMaxBackfillAge(), clock, metrics);
        RecoveryOrchestrator orchestrator = new RecoveryOrchestrator(gaps, points, scheduler::submit,
            config.getMaxActiveGaps(), config.getBackfillChunkIntervals(), config.getGapMaxAttempts(),
            clock, alerts);
        IngestionCoordinator coordinator = new IngestionCoordinator(config.getSeries(), config.getLivePeriod(),
            config.getLiveLookbackIntervals(), config.getDetectionPeriod(), config.getShutdownGrace(),
            scheduler, selector, detector, orchestrator, alerts, clock);

        // ═══════════════════════════════════════════════════════════════
        // Liquidations & order book
        // ═══════════════════════════════════════════════════════════════
        MarketActivityConfig market = config.getMarketActivity();
        LiquidationCollector liquidations = null;
        BinanceLiquidationStream liquidationStream = null;
        if (market.liquidationsEnabled()) {
            liquidations = new LiquidationCollector(TimeBucketAggregator.liquidations(market.liquidationInterval()),
                marketActivity, market.flushPeriod(), metrics, clock);
            RetryPolicy reconnect = RetryPolicy.builder()
                .baseDelay(Duration.ofSeconds(5))
                .maxDelay(Duration.ofMinutes(5))
                .maxAttempts(1)
                .jitter(0.0)
                .build();
            liquidationStream = new BinanceLiquidationStream(market.liquidationStreamUrl(),
                market.liquidationSymbols(), liquidations::onEvent, reconnect, metrics, clock);
        }
        OrderBookCollector orderBook = null;
        if (market.orderBookEnabled()) {
            String sourceId = MarketActivityConfig.ORDER_BOOK_SOURCE_ID;
            rateLimiter.register(sourceId, market.orderBookRequestsPerWindow());
            health.register(sourceId);
            BinanceOrderBookClient client = new BinanceOrderBookClient(sourceId, market.orderBookBaseUrl(),
                new ProviderHttpClient(Duration.ofSeconds(10)), clock);
            orderBook = new OrderBookCollector(market.orderBookSymbols(), market.orderBookDepth(),
                market.orderBookPollPeriod(), market.flushPeriod(), client, rateLimiter, breakers, health,
                TimeBucketAggregator.orderBook(market.orderBookInterval()), marketActivity, metrics, clock);
        }

        // ═══════════════════════════════════════════════════════════════
        // Monitoring HTTP server
        // ═══════════════════════════════════════════════════════════════
        MonitoringServer server = null;
        if (httpPort > 0) {
            MonitoringHandler api = new MonitoringHandler(config.getSeries(), health, breakers, gaps,
                detector, orchestrator, coordinator, alerts);
            server = new MonitoringServer("0.0.0.0", httpPort,
                new PrometheusMetricsHandler(metrics.getRegistry()), api, new MarketDataHandler(marketActivity));
            server.start();
        }

        // ═══════════════════════════════════════════════════════════════
        // Run
        // ═══════════════════════════════════════════════════════════════
        CountDownLatch stopped = new CountDownLatch(1);
        MonitoringServer finalServer = server;
        HikariDataSource finalDataSource = dataSource;
        BinanceLiquidationStream finalStream = liquidationStream;
        LiquidationCollector finalLiquidations = liquidations;
        OrderBookCollector finalOrderBook = orderBook;
        Runnable shutdown = () -> {
            log.info("Shutting down CandleVault...");
            coordinator.stop();
            if (finalStream != null) {
                finalStream.stop();
                finalLiquidations.stop();
            }
            if (finalOrderBook != null) {
                finalOrderBook.stop();
            }
            if (finalServer != null) {
                finalServer.stop();
            }
            if (finalDataSource != null) {
                finalDataSource.close();
            }
            stopped.countDown();
            log.info("CandleVault stopped");
        };
        Thread hook = new Thread(shutdown, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        coordinator.start();
        if (liquidations != null) {
            liquidations.start();
            liquidationStream.start();
        }
        if (orderBook != null) {
            orderBook.start();
        }
        log.info("✓ CandleVault started");

        if (runMinutes > 0) {
            if (!stopped.await(runMinutes, TimeUnit.MINUTES)) {
                log.info("Run duration of {} minute(s) reached", runMinutes);
                Runtime.getRuntime().removeShutdownHook(hook);
                shutdown.run();
            }
        } else {
            stopped.await();
        }
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/candlevault");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("candlevault-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
