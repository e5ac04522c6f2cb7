package in.ledgerguard.domain.common;

import in.ledgerguard.domain.trade.TradeRecord;

/**
 * Result of a close attempt.
 *
 * On failure the record is still OPEN and the strategy's slot stays occupied.
 */
public record CloseResult(Outcome outcome, TradeRecord record, ErrorCategory category, String message) {

    public enum Outcome {
        CLOSED,
        NO_OPEN_POSITION,
        CLOSE_ORDER_FAILED,
        LEDGER_WRITE_FAILED
    }

    public static CloseResult closed(TradeRecord record) {
        return new CloseResult(Outcome.CLOSED, record, null, "closed");
    }

    public static CloseResult failed(Outcome outcome, TradeRecord record, ErrorCategory category, String message) {
        return new CloseResult(outcome, record, category, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.CLOSED;
    }
}
