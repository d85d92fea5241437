package dev.roshin.ctorlint.analysis.core;

import dev.roshin.ctorlint.analysis.config.AnalysisConfig;
import dev.roshin.ctorlint.analysis.fix.BatchFixer;
import dev.roshin.ctorlint.analysis.fix.ConstructorArgumentsCodeFixProvider;
import dev.roshin.ctorlint.analysis.format.ParameterListNormalizer;
import dev.roshin.ctorlint.analysis.model.*;
import dev.roshin.ctorlint.analysis.pom.PomAnalyzer;
import dev.roshin.ctorlint.analysis.rule.ConstructorArgumentsRule;
import dev.roshin.ctorlint.analysis.spoon.SpoonConstructorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.stream.Stream;

/**
 * Main entry point for checking and fixing constructor parameter layout in Maven projects.
 * Uses Spoon to locate constructors and {@link ConstructorArgumentsRule} to evaluate them.
 */
public class ConstructorLayoutAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ConstructorLayoutAnalyzer.class);

    private static final String POM_FILE = "pom.xml";

    private static final Comparator<ConstructorViolation> VIOLATION_ORDER = Comparator
            .comparing((ConstructorViolation v) -> v.location().filePath())
            .thenComparingInt(v -> v.location().lineNumber())
            .thenComparingInt(v -> v.location().columnNumber());

    private final PomAnalyzer pomAnalyzer;
    private final ConstructorArgumentsRule rule;

    public ConstructorLayoutAnalyzer() {
        this.pomAnalyzer = new PomAnalyzer();
        this.rule = new ConstructorArgumentsRule();
    }

    /**
     * Checks every constructor of the given Maven project.
     *
     * @param projectRoot Root directory of the Maven project to analyze
     * @param config      Analysis configuration parameters
     * @return Report with all violations, ordered by file and line
     * @throws IllegalArgumentException if project structure is invalid
     * @throws CancellationException    if the calling thread is interrupted
     */
    public AnalysisReport getReport(Path projectRoot, AnalysisConfig config) {
        log.info("Starting analysis of project: {}", projectRoot);
        LocalDateTime startTime = LocalDateTime.now();
        long startMs = System.currentTimeMillis();
        Path root = projectRoot.toAbsolutePath().normalize();

        validateProject(root);
        PomAnalyzer.SourceLayout layout = pomAnalyzer.scanPom(root);
        List<Path> sourceRoots = layout.sourceRoots(config.includeTests());
        if (sourceRoots.isEmpty()) {
            throw new IllegalArgumentException("No source directory found for " + layout.artifactId());
        }
        log.info("Analyzing {} ({} source roots)", layout.artifactId(), sourceRoots.size());

        SpoonConstructorCollector collector = new SpoonConstructorCollector(config.skipGeneratedCode());
        SpoonConstructorCollector.CollectionResult collection;
        try {
            collection = collector.collect(sourceRoots);
        } catch (Exception e) {
            log.error("Failed to collect constructors", e);
            return createErrorReport(root, startTime, startMs,
                    "Failed to parse project: " + e.getMessage());
        }

        // Nodes are immutable, evaluation needs no coordination
        Thread caller = Thread.currentThread();
        List<ConstructorViolation> violations = collection.constructors().parallelStream()
                .map(constructor -> {
                    if (caller.isInterrupted()) {
                        throw new CancellationException("Analysis of " + root + " was cancelled");
                    }
                    return evaluate(root, constructor);
                })
                .flatMap(Optional::stream)
                .sorted(VIOLATION_ORDER)
                .toList();

        List<String> warnings = new ArrayList<>();
        AnalysisMetadata metadata = new AnalysisMetadata(
                countJavaFiles(sourceRoots, warnings),
                collection.typeCount(),
                collection.constructors().size(),
                List.copyOf(warnings),
                Duration.ofMillis(System.currentTimeMillis() - startMs),
                false,
                collection.skipped()
        );
        log.info("Analysis completed: {}. Violations: {}", metadata, violations.size());

        return new AnalysisReport(root, startTime, violations, metadata);
    }

    /**
     * Analyzes the project and applies every available fix, writing changed files back.
     * Files are fixed one after the other; each fix is followed by a fresh evaluation.
     *
     * @param projectRoot Root directory of the Maven project
     * @param config      Analysis configuration parameters
     * @return the analysis the fixes were based on and the files that changed
     * @throws UncheckedIOException if a file cannot be read or written
     */
    public FixReport fixProject(Path projectRoot, AnalysisConfig config) {
        AnalysisReport report = getReport(projectRoot, config);
        if (report.metadata().hadErrors() || !report.hasViolations()) {
            return new FixReport(report, List.of(), 0);
        }

        SpoonConstructorCollector collector = new SpoonConstructorCollector(config.skipGeneratedCode());
        ConstructorArgumentsCodeFixProvider fixProvider = new ConstructorArgumentsCodeFixProvider(
                collector, new ParameterListNormalizer(config.formatOptions()));
        BatchFixer fixer = new BatchFixer(collector, rule, fixProvider, config.maxFixIterations());

        List<String> changedFiles = new ArrayList<>();
        int appliedFixes = 0;
        for (String relativePath : report.affectedFiles()) {
            Path file = report.projectPath().resolve(relativePath);
            SourceDocument document = new SourceDocument(file, readFile(file));

            BatchFixer.FixResult result = fixer.fixAll(document);
            if (result.changed()) {
                writeFile(file, result.document().text());
                changedFiles.add(relativePath);
                appliedFixes += result.appliedFixes();
            }
        }

        log.info("Fixed {} files with {} fixes", changedFiles.size(), appliedFixes);
        return new FixReport(report, List.copyOf(changedFiles), appliedFixes);
    }

    private Optional<ConstructorViolation> evaluate(Path root, SpoonConstructorCollector.CollectedConstructor collected) {
        ConstructorDeclaration node = collected.node();
        return rule.evaluate(node).map(diagnostic -> {
            SourcePoint start = diagnostic.location().start();
            SourceLocation location = new SourceLocation(
                    relativize(root, collected.file()),
                    node.declaringType(),
                    node.signature(),
                    start.line(),
                    start.column()
            );
            log.debug("Found violation: {}", location);
            return new ConstructorViolation(location, diagnostic);
        });
    }

    /**
     * Validates basic project structure requirements.
     */
    private void validateProject(Path projectRoot) {
        if (!Files.exists(projectRoot)) {
            throw new IllegalArgumentException("Project path does not exist: " + projectRoot);
        }

        if (!Files.isDirectory(projectRoot)) {
            throw new IllegalArgumentException("Project path is not a directory: " + projectRoot);
        }

        Path pomFile = projectRoot.resolve(POM_FILE);
        if (!Files.exists(pomFile)) {
            log.warn("No pom.xml found at: {}", pomFile);
            throw new IllegalArgumentException("No pom.xml found in project root");
        }

        log.debug("Project validation passed: {}", projectRoot);
    }

    /**
     * Counts Java source files below the given roots. Roots that cannot be walked are
     * reported in {@code warnings}.
     */
    private int countJavaFiles(List<Path> sourceRoots, List<String> warnings) {
        int count = 0;
        for (Path root : sourceRoots) {
            try (Stream<Path> files = Files.walk(root)) {
                count += (int) files
                        .filter(Files::isRegularFile)
                        .filter(p -> p.toString().endsWith(".java"))
                        .count();
            } catch (IOException e) {
                log.warn("Could not count Java files in {}", root, e);
                warnings.add("Could not list " + root + ": " + e.getMessage());
            }
        }
        return count;
    }

    private static String relativize(Path root, Path file) {
        return root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static String readFile(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }

    private static void writeFile(Path file, String text) {
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
    }

    /**
     * Creates an error report when analysis fails.
     */
    private AnalysisReport createErrorReport(Path projectRoot, LocalDateTime startTime,
                                             long startMs, String errorMessage) {
        List<String> warnings = new ArrayList<>();
        warnings.add("CRITICAL: " + errorMessage);

        AnalysisMetadata metadata = new AnalysisMetadata(
                0, 0, 0,
                warnings,
                Duration.ofMillis(System.currentTimeMillis() - startMs),
                true, // hadErrors
                List.of()
        );

        return new AnalysisReport(projectRoot, startTime, List.of(), metadata);
    }
}
