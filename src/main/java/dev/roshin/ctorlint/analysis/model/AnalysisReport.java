package dev.roshin.ctorlint.analysis.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The complete output of an analysis run.
 *
 * @param projectPath       The root path of the analyzed Maven project
 * @param analysisTimestamp When the analysis was performed
 * @param violations        All violations, ordered by file and line
 * @param metadata          Statistics, warnings, and diagnostic information
 */
public record AnalysisReport(
        Path projectPath,
        LocalDateTime analysisTimestamp,
        List<ConstructorViolation> violations,
        AnalysisMetadata metadata
) {
    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    /**
     * Files (relative to the project root) containing at least one violation.
     */
    public Set<String> affectedFiles() {
        Set<String> files = new TreeSet<>();
        violations.forEach(v -> files.add(v.location().filePath()));
        return files;
    }

    @Override
    public String toString() {
        return String.format(
                "AnalysisReport[project=%s, timestamp=%s, violations=%d in %d files]",
                projectPath.getFileName(), analysisTimestamp, violations.size(), affectedFiles().size()
        );
    }
}
