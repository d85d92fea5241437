package dev.roshin.ctorlint.analysis.model;

import java.time.Duration;
import java.util.List;

/**
 * Contains metadata and statistics about the analysis run.
 *
 * @param totalFilesScanned         Number of Java source files processed
 * @param totalTypesAnalyzed        Number of types in the model
 * @param totalConstructorsAnalyzed Number of constructors the rule was evaluated on
 * @param warnings                  Problems not tied to a single constructor (unreadable roots, parse failure)
 * @param analysisTime              Duration of the analysis
 * @param hadErrors                 Whether any errors occurred during analysis
 * @param skippedConstructors       Constructors that could not be turned into a syntax node
 */
public record AnalysisMetadata(
        int totalFilesScanned,
        int totalTypesAnalyzed,
        int totalConstructorsAnalyzed,
        List<String> warnings,
        Duration analysisTime,
        boolean hadErrors,
        List<String> skippedConstructors
) {
    @Override
    public String toString() {
        return String.format(
                "Analysis: %d files, %d types, %d constructors in %s. Warnings: %d, Skipped: %d, Errors: %s",
                totalFilesScanned, totalTypesAnalyzed, totalConstructorsAnalyzed,
                analysisTime, warnings.size(), skippedConstructors.size(), hadErrors
        );
    }
}
