package dev.roshin.ctorlint.analysis.fix;

import com.google.common.base.Preconditions;
import dev.roshin.ctorlint.analysis.model.ConstructorDeclaration;
import dev.roshin.ctorlint.analysis.model.Diagnostic;
import dev.roshin.ctorlint.analysis.model.SourceDocument;
import dev.roshin.ctorlint.analysis.rule.ConstructorArgumentsRule;
import dev.roshin.ctorlint.analysis.spoon.SpoonConstructorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Applies every constructor layout fix of a document.
 * <p>
 * Each round re-parses the current text and re-evaluates the rule, then applies the fix for
 * the first diagnostic. Diagnostics are never carried from one round to the next since their
 * spans go stale as soon as a fix is applied.
 */
public class BatchFixer {
    private static final Logger log = LoggerFactory.getLogger(BatchFixer.class);

    private final SpoonConstructorCollector collector;
    private final ConstructorArgumentsRule rule;
    private final ConstructorArgumentsCodeFixProvider fixProvider;
    private final int maxIterations;

    public BatchFixer(SpoonConstructorCollector collector,
                      ConstructorArgumentsRule rule,
                      ConstructorArgumentsCodeFixProvider fixProvider,
                      int maxIterations) {
        Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive, got: %s", maxIterations);
        this.collector = collector;
        this.rule = rule;
        this.fixProvider = fixProvider;
        this.maxIterations = maxIterations;
    }

    /**
     * Result of fixing one document.
     *
     * @param document     the fixed document
     * @param appliedFixes number of fixes applied
     */
    public record FixResult(SourceDocument document, int appliedFixes) {
        public boolean changed() {
            return appliedFixes > 0;
        }
    }

    /**
     * Fixes the document until the rule reports nothing.
     *
     * @throws IllegalStateException if the document still has violations after the
     *                               configured number of rounds
     * @throws CancellationException if the thread is interrupted between two rounds
     */
    public FixResult fixAll(SourceDocument document) {
        SourceDocument current = document;
        int applied = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Fixing " + document.fileName() + " was cancelled");
            }
            Optional<Finding> finding = firstFinding(current);
            if (finding.isEmpty()) {
                break;
            }
            Preconditions.checkState(applied < maxIterations,
                    "%s still has violations after %s fixes", document.fileName(), applied);

            Finding first = finding.get();
            log.debug("Fixing {} reported at {}", first.constructor().signature(), first.diagnostic().location().start());
            current = fixProvider.codeFixFor(first.constructor()).apply(current);
            applied++;
        }

        if (applied > 0) {
            log.info("Applied {} constructor layout fixes to {}", applied, document.fileName());
        }
        return new FixResult(current, applied);
    }

    private Optional<Finding> firstFinding(SourceDocument document) {
        for (ConstructorDeclaration constructor : collector.collect(document)) {
            Optional<Diagnostic> diagnostic = rule.evaluate(constructor);
            if (diagnostic.isPresent()) {
                return Optional.of(new Finding(constructor, diagnostic.get()));
            }
        }
        return Optional.empty();
    }

    private record Finding(ConstructorDeclaration constructor, Diagnostic diagnostic) {
    }
}
