package in.ledgerguard.application.service;

import in.ledgerguard.application.port.input.PositionLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Owns startup and shutdown ordering.
 *
 * STARTUP:  load ledger → stale sweep → archive → recovery → reconciliation → assessment
 * SHUTDOWN: stop accepting signals → stop schedulers → drain coordinator
 */
public final class LedgerGuardEngine {
    private static final Logger log = LoggerFactory.getLogger(LedgerGuardEngine.class);

    private final TradeLedgerStore ledger;
    private final LifecycleRecovery recovery;
    private final PositionLifecycleService lifecycle;
    private final ReconciliationEngine reconciliation;
    private final StrategyAssessmentLoop assessment;
    private final StrategyCoordinator coordinator;
    private final Duration staleThreshold;
    private final Duration retention;
    private final Clock clock;

    private volatile boolean running = false;

    public LedgerGuardEngine(TradeLedgerStore ledger,
                             LifecycleRecovery recovery,
                             PositionLifecycleService lifecycle,
                             ReconciliationEngine reconciliation,
                             StrategyAssessmentLoop assessment,
                             StrategyCoordinator coordinator,
                             Duration staleThreshold,
                             Duration retention,
                             Clock clock) {
        this.ledger = ledger;
        this.recovery = recovery;
        this.lifecycle = lifecycle;
        this.reconciliation = reconciliation;
        this.assessment = assessment;
        this.coordinator = coordinator;
        this.staleThreshold = staleThreshold;
        this.retention = retention;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        ledger.load();

        List<?> swept = ledger.sweepStale(staleThreshold);
        int archived = ledger.archiveClosedBefore(clock.instant().minus(retention));
        log.info("Ledger housekeeping: {} stale closed, {} archived (retention {}d)",
            swept.size(), archived, retention.toDays());

        LifecycleRecovery.RecoveryReport report = recovery.recover();
        log.info("Recovered {} occupied slots", report.occupiedSlots());

        reconciliation.start();
        assessment.start();
        running = true;
        log.info("LedgerGuard engine started");
    }

    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        log.info("LedgerGuard engine shutting down...");
        lifecycle.beginShutdown();
        assessment.stop();
        reconciliation.stop();
        coordinator.shutdown();
        running = false;
        log.info("LedgerGuard engine stopped");
    }

    public boolean isRunning() {
        return running;
    }
}
