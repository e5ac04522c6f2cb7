package in.ledgerguard.infrastructure.persistence;

import in.ledgerguard.domain.common.ErrorCategory;
import in.ledgerguard.domain.common.LedgerGuardException;

/**
 * I/O or database failure inside a ledger backend.
 */
public class LedgerStorageException extends LedgerGuardException {

    public LedgerStorageException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
    }
}
