package dev.roshin.ctorlint.analysis.model;

import dev.roshin.ctorlint.analysis.model.enums.Severity;

import java.util.Objects;

/**
 * A rule violation anchored at a location in a document.
 *
 * @param descriptor the rule that produced the diagnostic
 * @param location   span of the offending element
 */
public record Diagnostic(
        DiagnosticDescriptor descriptor,
        SourceSpan location
) {
    public Diagnostic {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(location, "location");
    }

    public String ruleId() {
        return descriptor.id();
    }

    public Severity severity() {
        return descriptor.defaultSeverity();
    }

    public String message() {
        return descriptor.messageFormat();
    }

    @Override
    public String toString() {
        return String.format("%s %s at %s: %s", severity().label(), ruleId(), location.start(), message());
    }
}
