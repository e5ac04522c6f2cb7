package in.ledgerguard.domain.exchange;

import in.ledgerguard.domain.trade.PositionSide;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Live positions fetched for one reconciliation pass. Never persisted.
 */
public record ReconciliationSnapshot(List<LivePosition> positions, Instant fetchedAt) {

    public ReconciliationSnapshot {
        positions = List.copyOf(positions);
    }

    public boolean hasPosition(String symbol, PositionSide side) {
        return find(symbol, side).isPresent();
    }

    public Optional<LivePosition> find(String symbol, PositionSide side) {
        return positions.stream()
            .filter(p -> p.symbol().equals(symbol) && p.side() == side)
            .findFirst();
    }
}
