package dev.roshin.ctorlint.analysis.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable view of a constructor declaration, from the start of its line through the
 * closing parenthesis of its parameter list.
 * <p>
 * Positions of the parameters are not stored. {@link #parameterSpans()} derives them from
 * {@link #span()}'s start and the node's own text, so a node built by a rewrite reports the
 * positions a re-parse of its text would give.
 *
 * @param declaringType       dot separated qualified name of the type declaring the constructor
 * @param leadingTrivia       text in front of the header on its line, usually indentation
 * @param header              verbatim text from the start of the declaration through {@code (}
 * @param parameters          the parameter list in declaration order
 * @param closingTrivia       trivia between the last parameter (or {@code (}) and {@code )}
 * @param span                location of the node in its document, {@code )} included
 * @param formattingRequested whether the node must be passed through the normalizer
 */
public record ConstructorDeclaration(
        String declaringType,
        Trivia leadingTrivia,
        String header,
        List<Parameter> parameters,
        Trivia closingTrivia,
        SourceSpan span,
        boolean formattingRequested
) {
    public ConstructorDeclaration {
        Objects.requireNonNull(declaringType, "declaringType");
        Objects.requireNonNull(leadingTrivia, "leadingTrivia");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(closingTrivia, "closingTrivia");
        Objects.requireNonNull(span, "span");
        parameters = List.copyOf(parameters);
    }

    public int parameterCount() {
        return parameters.size();
    }

    /**
     * Spans of the parameters' text, trivia excluded, in parameter order.
     */
    public List<SourceSpan> parameterSpans() {
        List<SourceSpan> spans = new ArrayList<>(parameters.size());
        SourcePoint cursor = span.start().advance(header);
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (i > 0) {
                cursor = cursor.advance(",");
            }
            cursor = cursor.advance(parameter.leadingTrivia().text());
            SourcePoint start = cursor;
            cursor = cursor.advance(parameter.text());
            spans.add(new SourceSpan(start, cursor));
            cursor = cursor.advance(parameter.trailingTrivia().text());
        }
        return spans;
    }

    public ConstructorDeclaration withParameters(List<Parameter> newParameters) {
        return new ConstructorDeclaration(declaringType, leadingTrivia, header, newParameters,
                closingTrivia, span, formattingRequested);
    }

    public ConstructorDeclaration withFormattingRequested(boolean requested) {
        return new ConstructorDeclaration(declaringType, leadingTrivia, header, parameters,
                closingTrivia, span, requested);
    }

    /**
     * Renders the node from its header through the closing parenthesis. The leading trivia is
     * not part of the output, matching {@link #span()}.
     */
    public String toSourceText() {
        StringBuilder text = new StringBuilder(header);
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (i > 0) {
                text.append(',');
            }
            text.append(parameter.leadingTrivia().text())
                    .append(parameter.text())
                    .append(parameter.trailingTrivia().text());
        }
        return text.append(closingTrivia.text()).append(')').toString();
    }

    /**
     * Short display form, e.g. {@code Order(id, customer, lines)}.
     */
    public String signature() {
        String simpleName = declaringType.substring(declaringType.lastIndexOf('.') + 1);
        return parameters.stream()
                .map(Parameter::name)
                .collect(Collectors.joining(", ", simpleName + "(", ")"));
    }

    @Override
    public String toString() {
        return String.format("%s at %s", signature(), span);
    }
}
