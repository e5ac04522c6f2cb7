package in.ledgerguard.domain.common;

/**
 * Exchange call failed after bounded retries or timed out.
 *
 * Carries the operation name for logging and metrics.
 */
public class ExchangeUnavailableException extends LedgerGuardException {
    private final String operation;

    public ExchangeUnavailableException(String operation, String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
