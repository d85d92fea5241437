package dev.roshin.ctorlint.analysis.rule;

import dev.roshin.ctorlint.analysis.model.ConstructorDeclaration;
import dev.roshin.ctorlint.analysis.model.Diagnostic;
import dev.roshin.ctorlint.analysis.model.DiagnosticDescriptor;
import dev.roshin.ctorlint.analysis.model.SourceSpan;
import dev.roshin.ctorlint.analysis.model.enums.Severity;

import java.util.List;
import java.util.Optional;

/**
 * Checks the line layout of constructor parameter lists.
 * <p>
 * Up to two parameters may share a line. With three or more, every parameter has to end on
 * its own line. Only the first parameter ending on the same line as its predecessor is
 * reported; the fix corrects every such parameter at once.
 * <p>
 * Stateless and safe to share between threads.
 */
public class ConstructorArgumentsRule {

    public static final String DIAGNOSTIC_ID = "ConstructorArguments";

    public static final DiagnosticDescriptor DESCRIPTOR = new DiagnosticDescriptor(
            DIAGNOSTIC_ID,
            "Constructor argument formatting",
            "Constructor should have 2 arguments in line, if has 3 or more arguments each argument should be on a new line.",
            "Formatting",
            Severity.WARNING,
            true,
            "Enforces constructor argument formatting."
    );

    /**
     * Smallest parameter count for which the one-per-line layout is enforced.
     */
    static final int MIN_CHECKED_PARAMETERS = 3;

    /**
     * Evaluates one constructor.
     *
     * @return the diagnostic anchored at the first parameter that ends on its predecessor's
     * line, or empty when the layout is fine
     */
    public Optional<Diagnostic> evaluate(ConstructorDeclaration constructor) {
        if (constructor.parameterCount() < MIN_CHECKED_PARAMETERS) {
            return Optional.empty();
        }

        List<SourceSpan> spans = constructor.parameterSpans();
        int previousEndLine = spans.get(0).endLine();

        for (int i = 1; i < spans.size(); i++) {
            int currentEndLine = spans.get(i).endLine();
            if (previousEndLine == currentEndLine) {
                return Optional.of(new Diagnostic(DESCRIPTOR, spans.get(i)));
            }
            previousEndLine = currentEndLine;
        }
        return Optional.empty();
    }
}
