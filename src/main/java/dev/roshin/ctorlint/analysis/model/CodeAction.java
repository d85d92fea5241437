package dev.roshin.ctorlint.analysis.model;

import java.util.function.UnaryOperator;

/**
 * A fix offered for a diagnostic.
 *
 * @param title           text shown to the user
 * @param equivalenceKey  groups actions that do the same thing, used by fix-all
 * @param changedDocument produces the fixed document; never modifies its input
 */
public record CodeAction(
        String title,
        String equivalenceKey,
        UnaryOperator<SourceDocument> changedDocument
) {
    public SourceDocument apply(SourceDocument document) {
        return changedDocument.apply(document);
    }

    @Override
    public String toString() {
        return "CodeAction[" + title + "]";
    }
}
