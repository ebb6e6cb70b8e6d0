package io.github.yok.dwloader.ledger;

import java.util.Arrays;

/**
 * Status of one unit of a run, stored by its label.
 *
 * @author Yasuharu.Okawauchi
 */
public enum UnitStatus {
    SUCCESS("Success"),
    ERROR("Error"),
    // Not attempted because an earlier unit failed under ABORT_ON_ERROR
    SKIPPED("Skipped");

    private final String label;

    UnitStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Looks up a status by its stored label.
     *
     * @param label stored label
     * @return status
     * @throws IllegalArgumentException if the label is unknown
     */
    public static UnitStatus fromLabel(String label) {
        return Arrays.stream(values()).filter(s -> s.label.equalsIgnoreCase(label)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown unit status: " + label));
    }
}
