package io.github.yok.dwloader.core;

/**
 * Signals an upstream data defect that must not be resolved silently, such as overlapping validity
 * intervals or a fact that matches more than one dimension version.
 *
 * @author Yasuharu.Okawauchi
 */
public class IntegrityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IntegrityException(String message) {
        super(message);
    }
}
