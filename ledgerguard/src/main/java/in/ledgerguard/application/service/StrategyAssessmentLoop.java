package in.ledgerguard.application.service;

import in.ledgerguard.application.port.input.PositionLifecycleService;
import in.ledgerguard.application.port.output.SignalSource;
import in.ledgerguard.config.StrategyCatalog;
import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.domain.common.CloseResult;
import in.ledgerguard.domain.common.OpenResult;
import in.ledgerguard.domain.signal.ExitDecision;
import in.ledgerguard.domain.signal.TradingSignal;
import in.ledgerguard.domain.trade.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * One scheduled assessment per strategy.
 *
 * Flat:        ask the signal source for an entry and open it (skipped while cooling down)
 * In position: failsafe at the mark price, then ask the signal source whether to exit
 */
public final class StrategyAssessmentLoop {
    private static final Logger log = LoggerFactory.getLogger(StrategyAssessmentLoop.class);

    private final StrategyCatalog strategies;
    private final PositionLifecycleService lifecycle;
    private final SignalSource signals;
    private final PositionSlotRegistry registry;
    private final TradeLedgerStore ledger;
    private final ExchangeCalls exchange;
    private final ScheduledExecutorService scheduler;

    public StrategyAssessmentLoop(StrategyCatalog strategies,
                                  PositionLifecycleService lifecycle,
                                  SignalSource signals,
                                  PositionSlotRegistry registry,
                                  TradeLedgerStore ledger,
                                  ExchangeCalls exchange) {
        this.strategies = strategies;
        this.lifecycle = lifecycle;
        this.signals = signals;
        this.registry = registry;
        this.ledger = ledger;
        this.exchange = exchange;
        int threads = Math.max(1, Math.min(strategies.size(), 4));
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "strategy-assessment");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        for (StrategyConfig config : strategies.all()) {
            long period = config.assessmentInterval().toMillis();
            scheduler.scheduleWithFixedDelay(() -> safeTick(config), period, period, TimeUnit.MILLISECONDS);
            log.info("Assessment scheduled for {} ({}) every {}s",
                config.name(), config.symbol(), config.assessmentInterval().toSeconds());
        }
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void safeTick(StrategyConfig config) {
        try {
            tick(config);
        } catch (Exception e) {
            log.error("Assessment of {} failed: {}", config.name(), e.getMessage(), e);
        }
    }

    /**
     * Assess one strategy once.
     */
    public void tick(StrategyConfig config) {
        if (!lifecycle.isAcceptingSignals()) {
            return;
        }
        String strategy = config.name();

        Optional<TradeRecord> position = registry.holder(strategy).flatMap(ledger::get)
            .filter(TradeRecord::isActive);
        if (position.isEmpty()) {
            assessEntry(config);
            return;
        }

        TradeRecord record = position.get();
        Optional<BigDecimal> mark = exchange.markPrice(config.symbol());
        if (mark.isEmpty()) {
            log.debug("No mark price for {}, skipping exit assessment of {}", config.symbol(), strategy);
            return;
        }

        Optional<CloseResult> failsafe = lifecycle.checkFailsafe(strategy, mark.get());
        if (failsafe.isPresent()) {
            return;
        }

        Optional<ExitDecision> exit = signals.evaluateExit(config, record, mark.get());
        if (exit.isPresent()) {
            CloseResult result = lifecycle.closePosition(strategy, exit.get().reason(), mark.get());
            if (!result.isSuccess()) {
                log.warn("Exit of {} ({}) failed: {} {}", strategy, exit.get().reason(),
                    result.outcome(), result.message());
            }
        }
    }

    private void assessEntry(StrategyConfig config) {
        if (registry.isBlocked(config.name())) {
            return;
        }
        Optional<TradingSignal> signal = signals.nextSignal(config);
        if (signal.isEmpty()) {
            return;
        }
        OpenResult result = lifecycle.openPosition(config.name(), signal.get());
        if (!result.isSuccess()) {
            log.info("Entry signal for {} not opened: {} {}", config.name(), result.outcome(), result.message());
        }
    }
}
