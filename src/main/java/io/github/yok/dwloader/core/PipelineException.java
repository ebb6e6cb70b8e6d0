package io.github.yok.dwloader.core;

/**
 * Checked base exception of failures that are scoped to one load unit. The orchestrator catches it
 * at the unit boundary and records it in the run ledger.
 *
 * @author Yasuharu.Okawauchi
 */
public class PipelineException extends Exception {

    private static final long serialVersionUID = 1L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
