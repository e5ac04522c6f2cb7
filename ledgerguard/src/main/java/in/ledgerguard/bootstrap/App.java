package in.ledgerguard.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.ledgerguard.application.monitoring.AlertService;
import in.ledgerguard.application.monitoring.AlertingAnomalyNotifier;
import in.ledgerguard.application.port.output.AnomalyNotifier;
import in.ledgerguard.application.port.output.LedgerRepository;
import in.ledgerguard.application.service.AnomalyTracker;
import in.ledgerguard.application.service.BotTradeWindow;
import in.ledgerguard.application.service.ExchangeCalls;
import in.ledgerguard.application.service.LedgerGuardEngine;
import in.ledgerguard.application.service.LifecycleRecovery;
import in.ledgerguard.application.service.PendingOrderResolver;
import in.ledgerguard.application.service.PositionLifecycleController;
import in.ledgerguard.application.service.PositionSizer;
import in.ledgerguard.application.service.PositionSlotRegistry;
import in.ledgerguard.application.service.ReconciliationEngine;
import in.ledgerguard.application.service.StrategyAssessmentLoop;
import in.ledgerguard.application.service.StrategyCoordinator;
import in.ledgerguard.application.service.TradeLedgerStore;
import in.ledgerguard.config.EngineConfig;
import in.ledgerguard.config.StrategyCatalog;
import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.config.StrategyConfigLoader;
import in.ledgerguard.domain.trade.MatchTolerance;
import in.ledgerguard.infrastructure.common.RetryPolicy;
import in.ledgerguard.infrastructure.exchange.PaperExchangeGateway;
import in.ledgerguard.infrastructure.metrics.HealthHandler;
import in.ledgerguard.infrastructure.metrics.PrometheusLedgerMetrics;
import in.ledgerguard.infrastructure.metrics.PrometheusMetricsHandler;
import in.ledgerguard.infrastructure.persistence.JsonFileLedgerRepository;
import in.ledgerguard.infrastructure.persistence.LedgerSchemaMigration;
import in.ledgerguard.infrastructure.persistence.PostgresLedgerRepository;
import in.ledgerguard.infrastructure.signal.QueuedSignalSource;
import in.ledgerguard.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the ledger, slot registry, lifecycle controller, reconciliation engine and
 * assessment loop, then serves /metrics and /health.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== LedgerGuard Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        EngineConfig config = EngineConfig.fromEnv();
        List<StrategyConfig> strategyConfigs = new StrategyConfigLoader().load(config.strategiesFile());
        StartupConfigValidator.validate(config, strategyConfigs);

        Clock clock = Clock.systemUTC();
        StrategyCatalog catalog = new StrategyCatalog(strategyConfigs, config.defaultCooldown());

        // ═══════════════════════════════════════════════════════════════
        // Monitoring
        // ═══════════════════════════════════════════════════════════════
        PrometheusLedgerMetrics metrics = new PrometheusLedgerMetrics();
        AlertService alertService = new AlertService();
        AnomalyNotifier notifier = new AlertingAnomalyNotifier(alertService, metrics);
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Ledger
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        LedgerRepository repository;
        if (EngineConfig.BACKEND_POSTGRES.equals(config.ledgerBackend())) {
            dataSource = createDataSource();
            new LedgerSchemaMigration(dataSource).migrate();
            repository = new PostgresLedgerRepository(dataSource, clock);
        } else {
            repository = new JsonFileLedgerRepository(config.ledgerFile(), config.archiveFile(), clock);
            log.info("Ledger: file={}, archive={}", config.ledgerFile(), config.archiveFile());
        }

        RetryPolicy writeRetry = RetryPolicy.builder()
            .initialDelay(config.retryInitialDelay())
            .maxDelay(config.retryInitialDelay().multipliedBy(10))
            .multiplier(2.0)
            .maxAttempts(config.retryAttempts())
            .build();
        MatchTolerance tolerance = MatchTolerance.withRelative(config.matchTolerance());
        TradeLedgerStore ledger = new TradeLedgerStore(repository, writeRetry, tolerance,
            notifier, alertService, metrics, clock);

        // ═══════════════════════════════════════════════════════════════
        // Exchange
        // ═══════════════════════════════════════════════════════════════
        PaperExchangeGateway gateway = new PaperExchangeGateway(clock);
        ExchangeCalls exchange = new ExchangeCalls(gateway, RetryPolicy.forExchangeReads(),
            config.exchangeCallTimeout(), metrics);
        log.info("✓ Exchange: paper");

        // ═══════════════════════════════════════════════════════════════
        // Lifecycle
        // ═══════════════════════════════════════════════════════════════
        StrategyCoordinator coordinator = new StrategyCoordinator();
        PositionSlotRegistry registry = new PositionSlotRegistry(catalog, clock);
        PendingOrderResolver resolver = new PendingOrderResolver(ledger, registry, exchange, clock);
        BotTradeWindow botTradeWindow = new BotTradeWindow(config.botTradeProtection(), clock);

        PositionLifecycleController controller = new PositionLifecycleController(
            ledger, registry, exchange, coordinator, catalog, PositionSizer.marginTimesLeverage(),
            resolver, botTradeWindow, metrics,
            new PositionLifecycleController.Settings(config.confirmTimeout(), config.confirmPollInterval()),
            clock);

        ReconciliationEngine reconciliation = new ReconciliationEngine(
            ledger, registry, exchange, coordinator, catalog, resolver, botTradeWindow,
            new AnomalyTracker(), notifier, metrics, tolerance,
            new ReconciliationEngine.Settings(config.reconcileInterval(), config.cycleDeadline(),
                config.pendingGrace(), config.fillsLookback(), config.attributionWindow(), config.startupGrace()),
            clock);

        QueuedSignalSource signals = new QueuedSignalSource();
        StrategyAssessmentLoop assessment = new StrategyAssessmentLoop(
            catalog, controller, signals, registry, ledger, exchange);

        LedgerGuardEngine engine = new LedgerGuardEngine(
            ledger, new LifecycleRecovery(ledger, registry, resolver, alertService),
            controller, reconciliation, assessment, coordinator,
            config.staleThreshold(), config.retention(), clock);
        engine.start();

        // ═══════════════════════════════════════════════════════════════
        // HTTP: /metrics, /health
        // ═══════════════════════════════════════════════════════════════
        Undertow server = null;
        if (config.metricsPort() > 0) {
            PathHandler routes = Handlers.path()
                .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
                .addExactPath("/health", new HealthHandler(engine::isRunning, () -> {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("active_positions", ledger.activeRecords().size());
                    details.put("slots", registry.stats());
                    details.put("reconciliation", reconciliation.getMetrics());
                    details.put("ledger_last_updated", ledger.lastUpdated());
                    return details;
                }));
            server = Undertow.builder()
                .addHttpListener(config.metricsPort(), "0.0.0.0")
                .setHandler(routes)
                .build();
            server.start();
            log.info("✓ Metrics server started on http://localhost:{}/metrics", config.metricsPort());
        }

        Undertow httpServer = server;
        HikariDataSource pool = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            engine.shutdown();
            if (httpServer != null) {
                httpServer.stop();
            }
            if (pool != null) {
                pool.close();
            }
        }, "ledgerguard-shutdown"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== LedgerGuard started: {} strategies ===", catalog.size());
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/ledgerguard");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 5);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("ledgerguard-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }
}
