package in.ledgerguard.bootstrap;

import in.ledgerguard.config.EngineConfig;
import in.ledgerguard.config.StrategyCatalog;
import in.ledgerguard.config.StrategyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Invalid configuration is a hard gate:
 * it throws IllegalStateException and the engine refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private static final BigDecimal MAX_TOLERANCE = new BigDecimal("0.5");

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException listing every problem found
     */
    public static void validate(EngineConfig config, List<StrategyConfig> strategies) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> errors = new ArrayList<>();
        validateEngine(config, errors);
        validateStrategies(strategies, errors);

        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("  ✗ {}", e));
            throw new IllegalStateException(
                "❌ INVALID CONFIG: " + errors.size() + " problem(s)\n  - "
                    + String.join("\n  - ", errors)
                    + "\nSystem refuses to start.");
        }

        log.info("✓ Ledger backend: {}", config.ledgerBackend());
        log.info("✓ Strategies: {}", strategies.size());
        log.info("✓ Mode: {}", config.paperMode() ? "PAPER" : "LIVE");
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateEngine(EngineConfig config, List<String> errors) {
        String backend = config.ledgerBackend();
        if (!EngineConfig.BACKEND_JSON.equals(backend) && !EngineConfig.BACKEND_POSTGRES.equals(backend)) {
            errors.add("LEDGER_BACKEND must be '" + EngineConfig.BACKEND_JSON + "' or '"
                + EngineConfig.BACKEND_POSTGRES + "', got '" + backend + "'");
        }
        if (!config.paperMode()) {
            errors.add("PAPER_MODE=false but no live exchange adapter is available; set PAPER_MODE=true");
        }
        if (config.retryAttempts() < 1) {
            errors.add("LEDGER_WRITE_ATTEMPTS must be >= 1");
        }
        if (config.matchTolerance().signum() <= 0 || config.matchTolerance().compareTo(MAX_TOLERANCE) >= 0) {
            errors.add("MATCH_TOLERANCE must be in (0, 0.5), got " + config.matchTolerance());
        }

        requirePositive("LEDGER_WRITE_RETRY_DELAY", config.retryInitialDelay(), errors);
        requirePositive("STALE_THRESHOLD", config.staleThreshold(), errors);
        requirePositive("LEDGER_RETENTION", config.retention(), errors);
        requirePositive("CONFIRM_TIMEOUT", config.confirmTimeout(), errors);
        requirePositive("CONFIRM_POLL_INTERVAL", config.confirmPollInterval(), errors);
        requirePositive("EXCHANGE_CALL_TIMEOUT", config.exchangeCallTimeout(), errors);
        requirePositive("RECONCILE_INTERVAL", config.reconcileInterval(), errors);
        requirePositive("RECONCILE_CYCLE_DEADLINE", config.cycleDeadline(), errors);
        requirePositive("FILLS_LOOKBACK", config.fillsLookback(), errors);
        requirePositive("ATTRIBUTION_WINDOW", config.attributionWindow(), errors);
        requireNotNegative("DEFAULT_COOLDOWN", config.defaultCooldown(), errors);
        requireNotNegative("PENDING_GRACE", config.pendingGrace(), errors);
        requireNotNegative("BOT_TRADE_PROTECTION", config.botTradeProtection(), errors);
        requireNotNegative("STARTUP_GRACE", config.startupGrace(), errors);

        if (config.cycleDeadline().compareTo(config.reconcileInterval()) > 0) {
            errors.add("RECONCILE_CYCLE_DEADLINE must not exceed RECONCILE_INTERVAL");
        }
        if (config.confirmPollInterval().compareTo(config.confirmTimeout()) >= 0) {
            errors.add("CONFIRM_POLL_INTERVAL must be shorter than CONFIRM_TIMEOUT");
        }
        if (config.metricsPort() < 0 || config.metricsPort() > 65535) {
            errors.add("METRICS_PORT out of range: " + config.metricsPort());
        }
    }

    private static void validateStrategies(List<StrategyConfig> strategies, List<String> errors) {
        if (strategies.isEmpty()) {
            errors.add("no strategies configured");
        }
        Set<String> names = new HashSet<>();
        for (StrategyConfig strategy : strategies) {
            errors.addAll(strategy.validate());
            if (strategy.name() != null && !names.add(strategy.name())) {
                errors.add("duplicate strategy name: " + strategy.name());
            }
            if (StrategyCatalog.UNATTRIBUTED.equals(strategy.name())) {
                errors.add("strategy name '" + StrategyCatalog.UNATTRIBUTED + "' is reserved");
            }
        }
    }

    private static void requirePositive(String name, Duration value, List<String> errors) {
        if (value == null || value.isNegative() || value.isZero()) {
            errors.add(name + " must be positive");
        }
    }

    private static void requireNotNegative(String name, Duration value, List<String> errors) {
        if (value == null || value.isNegative()) {
            errors.add(name + " must not be negative");
        }
    }
}
