package in.ledgerguard.domain.signal;

import in.ledgerguard.domain.trade.ExitReason;

/**
 * Strategy decision to leave the current position.
 *
 * @param reason Exit reason label stored on the record
 * @param detail Optional free text for logs
 */
public record ExitDecision(String reason, String detail) {

    public static ExitDecision of(ExitReason reason) {
        return new ExitDecision(reason.label(), null);
    }

    public static ExitDecision of(ExitReason reason, String detail) {
        return new ExitDecision(reason.label(), detail);
    }
}
