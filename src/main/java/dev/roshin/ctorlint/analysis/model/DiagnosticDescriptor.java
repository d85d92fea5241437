package dev.roshin.ctorlint.analysis.model;

import dev.roshin.ctorlint.analysis.model.enums.Severity;

/**
 * Static identity of a rule: what it reports and how.
 *
 * @param id               stable rule identifier, used to match fixes to diagnostics
 * @param title            short human-readable title
 * @param messageFormat    message attached to every diagnostic of the rule
 * @param category         rule category (e.g., "Formatting")
 * @param defaultSeverity  severity of reported diagnostics
 * @param enabledByDefault whether the rule runs without explicit opt-in
 * @param description      longer description of the rule
 */
public record DiagnosticDescriptor(
        String id,
        String title,
        String messageFormat,
        String category,
        Severity defaultSeverity,
        boolean enabledByDefault,
        String description
) {
    @Override
    public String toString() {
        return id + " (" + title + ")";
    }
}
