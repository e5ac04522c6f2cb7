package in.ledgerguard.domain.common;

import in.ledgerguard.domain.trade.TradeRecord;

/**
 * Result of an open attempt.
 *
 * @param outcome   What happened
 * @param record    Latest ledger record for the attempt (null when nothing was written)
 * @param category  Failure category (null on success)
 * @param message   Human readable detail
 */
public record OpenResult(Outcome outcome, TradeRecord record, ErrorCategory category, String message) {

    public enum Outcome {
        OPENED,
        REJECTED_SHUTTING_DOWN,
        REJECTED_UNKNOWN_STRATEGY,
        REJECTED_SLOT_OCCUPIED,
        REJECTED_COOLDOWN,
        REJECTED_INVALID_SIGNAL,
        INTENT_WRITE_FAILED,
        ORDER_REJECTED,
        CONFIRMATION_TIMEOUT
    }

    public static OpenResult opened(TradeRecord record) {
        return new OpenResult(Outcome.OPENED, record, null, "opened");
    }

    public static OpenResult failed(Outcome outcome, TradeRecord record, ErrorCategory category, String message) {
        return new OpenResult(outcome, record, category, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.OPENED;
    }
}
