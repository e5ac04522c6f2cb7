package in.ledgerguard.domain.signal;

import in.ledgerguard.domain.trade.PositionSide;

public enum SignalType {
    BUY,
    SELL;

    public PositionSide positionSide() {
        return this == BUY ? PositionSide.LONG : PositionSide.SHORT;
    }
}
