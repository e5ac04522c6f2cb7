package in.ledgerguard.domain.common;

/**
 * Thrown when an operation would break a ledger or slot invariant.
 */
public class InvariantViolationException extends LedgerGuardException {

    public InvariantViolationException(String message) {
        super(ErrorCategory.INVARIANT_VIOLATION, message);
    }
}
