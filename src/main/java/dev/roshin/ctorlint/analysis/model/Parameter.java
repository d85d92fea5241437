package dev.roshin.ctorlint.analysis.model;

import java.util.Objects;

/**
 * One entry of a constructor parameter list.
 *
 * @param leadingTrivia  trivia between the preceding {@code (} or {@code ,} and the parameter
 * @param text           verbatim annotations, modifiers, type and name of the parameter
 * @param trailingTrivia trivia between the parameter and the following {@code ,};
 *                       empty for the last parameter
 * @param name           the declared parameter name
 */
public record Parameter(
        Trivia leadingTrivia,
        String text,
        Trivia trailingTrivia,
        String name
) {
    public Parameter {
        Objects.requireNonNull(leadingTrivia, "leadingTrivia");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(trailingTrivia, "trailingTrivia");
        Objects.requireNonNull(name, "name");
    }

    public Parameter withLeadingTrivia(Trivia trivia) {
        return new Parameter(trivia, text, trailingTrivia, name);
    }

    @Override
    public String toString() {
        return "Parameter[" + text + "]";
    }
}
