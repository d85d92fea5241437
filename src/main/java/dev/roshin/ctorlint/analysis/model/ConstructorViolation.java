package dev.roshin.ctorlint.analysis.model;

/**
 * A constructor whose parameter layout broke a rule.
 *
 * @param location   where the offending parameter is
 * @param diagnostic the diagnostic produced by the rule
 */
public record ConstructorViolation(
        SourceLocation location,
        Diagnostic diagnostic
) {
    /**
     * Single-line console form: {@code path:line:column: warning ID: message}.
     */
    public String toConsoleLine() {
        return String.format("%s:%d:%d: %s %s: %s",
                location.filePath(), location.lineNumber(), location.columnNumber(),
                diagnostic.severity().label(), diagnostic.ruleId(), diagnostic.message());
    }

    @Override
    public String toString() {
        return String.format("Violation[%s] at %s", diagnostic.ruleId(), location);
    }
}
