package in.ledgerguard.domain.common;

/**
 * Base exception for the engine. Every failure carries its {@link ErrorCategory}.
 */
public class LedgerGuardException extends RuntimeException {
    private final ErrorCategory category;

    public LedgerGuardException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public LedgerGuardException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    @Override
    public String toString() {
        return String.format("%s[%s]: %s", getClass().getSimpleName(), category, getMessage());
    }
}
