package in.ledgerguard.config;

import in.ledgerguard.util.Env;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Engine-level settings read from environment variables or system properties.
 */
public record EngineConfig(
        String ledgerBackend,
        Path ledgerFile,
        Path archiveFile,
        Path strategiesFile,
        int retryAttempts,
        Duration retryInitialDelay,
        Duration staleThreshold,
        Duration retention,
        BigDecimal matchTolerance,
        Duration defaultCooldown,
        Duration confirmTimeout,
        Duration confirmPollInterval,
        Duration exchangeCallTimeout,
        Duration reconcileInterval,
        Duration cycleDeadline,
        Duration pendingGrace,
        Duration fillsLookback,
        Duration attributionWindow,
        Duration botTradeProtection,
        Duration startupGrace,
        int metricsPort,
        boolean paperMode) {

    public static final String BACKEND_JSON = "json";
    public static final String BACKEND_POSTGRES = "postgres";

    public static EngineConfig fromEnv() {
        return new EngineConfig(
            Env.get("LEDGER_BACKEND", BACKEND_JSON),
            Path.of(Env.get("LEDGER_FILE", "data/trade_ledger.json")),
            Path.of(Env.get("LEDGER_ARCHIVE_FILE", "data/trade_ledger_archive.json")),
            Path.of(Env.get("STRATEGIES_FILE", "config/strategies.json")),
            Env.getInt("LEDGER_WRITE_ATTEMPTS", 3),
            Env.getDuration("LEDGER_WRITE_RETRY_DELAY", Duration.ofMillis(200)),
            Env.getDuration("STALE_THRESHOLD", Duration.ofHours(6)),
            Env.getDuration("LEDGER_RETENTION", Duration.ofDays(30)),
            Env.getDecimal("MATCH_TOLERANCE", new BigDecimal("0.01")),
            Env.getDuration("DEFAULT_COOLDOWN", StrategyConfig.DEFAULT_COOLDOWN),
            Env.getDuration("CONFIRM_TIMEOUT", Duration.ofSeconds(10)),
            Env.getDuration("CONFIRM_POLL_INTERVAL", Duration.ofMillis(250)),
            Env.getDuration("EXCHANGE_CALL_TIMEOUT", Duration.ofSeconds(5)),
            Env.getDuration("RECONCILE_INTERVAL", Duration.ofSeconds(30)),
            Env.getDuration("RECONCILE_CYCLE_DEADLINE", Duration.ofSeconds(20)),
            Env.getDuration("PENDING_GRACE", Duration.ofMinutes(2)),
            Env.getDuration("FILLS_LOOKBACK", Duration.ofHours(24)),
            Env.getDuration("ATTRIBUTION_WINDOW", Duration.ofHours(1)),
            Env.getDuration("BOT_TRADE_PROTECTION", Duration.ofSeconds(120)),
            Env.getDuration("STARTUP_GRACE", Duration.ofMinutes(3)),
            Env.getInt("METRICS_PORT", 9102),
            Env.getBool("PAPER_MODE", true)
        );
    }
}
