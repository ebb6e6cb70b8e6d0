package io.github.yok.dwloader.config;

import java.util.Locale;

/**
 * Behavior of a run after one of its units failed.
 *
 * @author Yasuharu.Okawauchi
 */
public enum FaultPolicy {
    // Record the failure and go on with the next unit; the process exits with 0
    CONTINUE_ON_ERROR,
    // Record the failure, skip the remaining units; the process exits with a non-zero code
    ABORT_ON_ERROR;

    /**
     * Parses a CLI value ({@code continue} / {@code abort}) or a constant name.
     *
     * @param value value to parse
     * @return matching policy
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static FaultPolicy fromCliValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "continue":
            case "continue_on_error":
                return CONTINUE_ON_ERROR;
            case "abort":
            case "abort_on_error":
                return ABORT_ON_ERROR;
            default:
                throw new IllegalArgumentException("Unknown fault policy: " + value);
        }
    }
}
