package io.github.yok.dwloader.ledger;

import java.util.Arrays;

/**
 * Status of a run record, stored by its label.
 *
 * @author Yasuharu.Okawauchi
 */
public enum RunStatus {
    IN_PROGRESS("In Progress"),
    SUCCESS("Success"),
    ERROR("Error");

    private final String label;

    RunStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    /**
     * Looks up a status by its stored label.
     *
     * @param label stored label
     * @return status
     * @throws IllegalArgumentException if the label is unknown
     */
    public static RunStatus fromLabel(String label) {
        return Arrays.stream(values()).filter(s -> s.label.equalsIgnoreCase(label)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown run status: " + label));
    }
}
