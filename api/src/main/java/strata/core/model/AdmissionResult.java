package strata.core.model;

public enum AdmissionResult {
    ADMITTED,
    REJECTED_TOO_LARGE,
    /** Conditional admission skipped because a live entry already exists. */
    ALREADY_PRESENT;

    public boolean admitted() {
        return this == ADMITTED;
    }
}
