package uk.gegc.clubaccess.shared.exception;

/**
 * Fatal ledger write failure. The surrounding transaction is rolled back.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
