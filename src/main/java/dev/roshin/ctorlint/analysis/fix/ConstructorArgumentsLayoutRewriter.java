package dev.roshin.ctorlint.analysis.fix;

import dev.roshin.ctorlint.analysis.model.ConstructorDeclaration;
import dev.roshin.ctorlint.analysis.model.Parameter;
import dev.roshin.ctorlint.analysis.model.SourceSpan;
import dev.roshin.ctorlint.analysis.model.Trivia;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Moves every parameter that ends on the same line as its predecessor onto a line of its own.
 * <p>
 * The rewrite only swaps leading trivia for a bare line break and flags the node for
 * formatting. Indentation is left to {@link dev.roshin.ctorlint.analysis.format.ParameterListNormalizer}.
 * Must only be called for a constructor the rule reported.
 */
public class ConstructorArgumentsLayoutRewriter {

    private final String lineSeparator;

    public ConstructorArgumentsLayoutRewriter() {
        this("\n");
    }

    public ConstructorArgumentsLayoutRewriter(String lineSeparator) {
        this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
    }

    public ConstructorDeclaration rewrite(ConstructorDeclaration constructor) {
        List<Parameter> parameters = constructor.parameters();
        List<SourceSpan> spans = constructor.parameterSpans();
        List<Parameter> newParameters = new ArrayList<>(parameters.size());

        // The first parameter anchors the list
        newParameters.add(parameters.get(0));
        int previousEndLine = spans.get(0).endLine();

        for (int i = 1; i < parameters.size(); i++) {
            int currentEndLine = spans.get(i).endLine();
            if (previousEndLine == currentEndLine) {
                newParameters.add(parameters.get(i).withLeadingTrivia(Trivia.lineBreak(lineSeparator)));
            } else {
                newParameters.add(parameters.get(i));
            }
            previousEndLine = currentEndLine;
        }

        return constructor
                .withParameters(newParameters)
                .withFormattingRequested(true);
    }
}
