package io.github.yok.dwloader.core;

/**
 * Raised when a source extract cannot be read into its landing table: missing or unreadable file,
 * malformed CSV, or a landing table that does not match the load contract.
 *
 * @author Yasuharu.Okawauchi
 */
public class LoadException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
