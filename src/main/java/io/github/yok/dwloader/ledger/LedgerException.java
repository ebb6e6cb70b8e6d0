package io.github.yok.dwloader.ledger;

/**
 * Failure to read or write the run ledger, or an illegal run transition.
 *
 * @author Yasuharu.Okawauchi
 */
public class LedgerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
