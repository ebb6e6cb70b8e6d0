package io.github.yok.dwloader.core;

/**
 * Raised when a landing table cannot be merged into its target: unknown key column, mismatched
 * target key, or a constraint violation while writing.
 *
 * @author Yasuharu.Okawauchi
 */
public class MergeException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public MergeException(String message) {
        super(message);
    }

    public MergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
