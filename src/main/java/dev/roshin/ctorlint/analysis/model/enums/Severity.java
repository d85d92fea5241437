package dev.roshin.ctorlint.analysis.model.enums;

/**
 * How loudly a diagnostic is reported.
 */
public enum Severity {
    /**
     * Not shown to the user, fixes are still offered
     */
    HIDDEN,
    INFO,
    WARNING,
    ERROR;

    /**
     * Lower-case label used in console output, e.g. "warning".
     */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
