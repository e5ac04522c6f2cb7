package in.ledgerguard.domain.trade;

/**
 * Well-known exit reasons written to {@code TradeRecord.exitReason}.
 *
 * The record stores the label string, so externally supplied reasons
 * (manual closes, healing passes) can be recorded as well.
 */
public enum ExitReason {
    SIGNAL_EXIT("signal exit"),
    STOP_LOSS("stop-loss"),
    TAKE_PROFIT("take-profit"),
    MAX_LOSS_FAILSAFE("max-loss failsafe"),
    MANUAL("manual"),
    ORDER_REJECTED("order rejected"),
    CONFIRMATION_TIMEOUT("confirmation timeout"),
    STALE_AUTO_CLOSED("stale-auto-closed"),
    ORPHAN_RECOVERED("orphan-recovered"),
    ORPHAN_UNRESOLVED("orphan-unresolved");

    private final String label;

    ExitReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
