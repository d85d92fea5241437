package dev.roshin.ctorlint.analysis.model;

import java.util.List;

/**
 * Outcome of applying every available fix to a project.
 *
 * @param analysis      the analysis the fixes were derived from
 * @param changedFiles  files rewritten on disk, relative to the project root
 * @param appliedFixes  number of code actions applied across all files
 */
public record FixReport(
        AnalysisReport analysis,
        List<String> changedFiles,
        int appliedFixes
) {
    @Override
    public String toString() {
        return String.format("FixReport[fixes=%d, files=%d]", appliedFixes, changedFiles.size());
    }
}
