package dev.roshin.ctorlint.analysis.fix;

import dev.roshin.ctorlint.analysis.format.ParameterListNormalizer;
import dev.roshin.ctorlint.analysis.model.CodeAction;
import dev.roshin.ctorlint.analysis.model.ConstructorDeclaration;
import dev.roshin.ctorlint.analysis.model.Diagnostic;
import dev.roshin.ctorlint.analysis.model.SourceDocument;
import dev.roshin.ctorlint.analysis.rule.ConstructorArgumentsRule;
import dev.roshin.ctorlint.analysis.spoon.SpoonConstructorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Offers the layout fix for {@value ConstructorArgumentsRule#DIAGNOSTIC_ID} diagnostics.
 * <p>
 * The action rewrites the constructor, normalizes its indentation and substitutes the
 * result for the constructor's span in the document it is applied to.
 */
public class ConstructorArgumentsCodeFixProvider {
    private static final Logger log = LoggerFactory.getLogger(ConstructorArgumentsCodeFixProvider.class);

    public static final String TITLE = "Fix constructor argument formatting";

    private final SpoonConstructorCollector collector;
    private final ParameterListNormalizer normalizer;

    public ConstructorArgumentsCodeFixProvider(SpoonConstructorCollector collector,
                                               ParameterListNormalizer normalizer) {
        this.collector = collector;
        this.normalizer = normalizer;
    }

    public Set<String> fixableDiagnosticIds() {
        return Set.of(ConstructorArgumentsRule.DIAGNOSTIC_ID);
    }

    /**
     * Finds the constructor the diagnostic points into and returns the fix for it.
     *
     * @return empty if the diagnostic belongs to another rule or no constructor of
     * {@code document} contains its location
     */
    public Optional<CodeAction> codeFixFor(SourceDocument document, Diagnostic diagnostic) {
        if (!fixableDiagnosticIds().contains(diagnostic.ruleId())) {
            return Optional.empty();
        }
        int offset = diagnostic.location().start().offset();
        Optional<ConstructorDeclaration> constructor = collector.collect(document).stream()
                .filter(c -> c.span().contains(offset))
                .findFirst();

        if (constructor.isEmpty()) {
            log.warn("No constructor at offset {} of {}", offset, document.fileName());
        }
        return constructor.map(this::codeFixFor);
    }

    /**
     * The fix for a constructor node already read from the document the action is applied to.
     */
    public CodeAction codeFixFor(ConstructorDeclaration constructor) {
        return new CodeAction(TITLE, TITLE, document -> fix(document, constructor));
    }

    private SourceDocument fix(SourceDocument document, ConstructorDeclaration constructor) {
        ConstructorArgumentsLayoutRewriter rewriter = new ConstructorArgumentsLayoutRewriter(document.lineSeparator());
        ConstructorDeclaration rewritten = normalizer.normalize(rewriter.rewrite(constructor));
        log.debug("Rewrote {} in {}", constructor.signature(), document.fileName());
        return document.replace(constructor.span(), rewritten.toSourceText());
    }
}
