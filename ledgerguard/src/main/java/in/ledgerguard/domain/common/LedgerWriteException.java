package in.ledgerguard.domain.common;

/**
 * Thrown when a ledger write cannot be made durable, including the emergency fallback.
 */
public class LedgerWriteException extends LedgerGuardException {
    private final String tradeId;

    public LedgerWriteException(String tradeId, String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
        this.tradeId = tradeId;
    }

    public LedgerWriteException(String tradeId, String message) {
        super(ErrorCategory.TRANSIENT, message);
        this.tradeId = tradeId;
    }

    public String getTradeId() {
        return tradeId;
    }
}
