package in.ledgerguard.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Symbols the engine itself traded recently.
 *
 * A position that appears right after our own fill may not be in the snapshot
 * or ledger yet; ghost detection skips such symbols until the window passes.
 */
public final class BotTradeWindow {
    private final Duration protection;
    private final Clock clock;
    private final Map<String, Instant> lastTraded = new ConcurrentHashMap<>();

    public BotTradeWindow(Duration protection, Clock clock) {
        this.protection = protection;
        this.clock = clock;
    }

    public void register(String symbol) {
        lastTraded.put(symbol, clock.instant());
    }

    public boolean isProtected(String symbol) {
        Instant traded = lastTraded.get(symbol);
        if (traded == null) {
            return false;
        }
        if (clock.instant().isBefore(traded.plus(protection))) {
            return true;
        }
        lastTraded.remove(symbol, traded);
        return false;
    }
}
