package dev.roshin.ctorlint.analysis.config;

import java.util.Objects;

/**
 * Configuration parameters for analyzing and fixing a project.
 *
 * @param includeTests      Also analyze the test source directory. Default: false
 * @param skipGeneratedCode Skip constructors of types annotated {@code @Generated}. Default: true
 * @param maxFixIterations  Upper bound of fix rounds per file before fix-all gives up.
 *                          Default: 1000
 * @param formatOptions     How fixed parameter lists are indented
 */
public record AnalysisConfig(
        boolean includeTests,
        boolean skipGeneratedCode,
        int maxFixIterations,
        FormatOptions formatOptions
) {
    /**
     * Default configuration: main sources only, generated code skipped.
     */
    public static final AnalysisConfig DEFAULT = new AnalysisConfig(false, true, 1000, FormatOptions.DEFAULT);

    /**
     * Creates a config with validation.
     */
    public AnalysisConfig {
        if (maxFixIterations < 1) {
            throw new IllegalArgumentException(
                    "maxFixIterations must be positive, got: " + maxFixIterations
            );
        }
        Objects.requireNonNull(formatOptions, "formatOptions");
    }

    public AnalysisConfig withIncludeTests(boolean include) {
        return new AnalysisConfig(include, skipGeneratedCode, maxFixIterations, formatOptions);
    }

    public AnalysisConfig withSkipGeneratedCode(boolean skip) {
        return new AnalysisConfig(includeTests, skip, maxFixIterations, formatOptions);
    }

    public AnalysisConfig withMaxFixIterations(int iterations) {
        return new AnalysisConfig(includeTests, skipGeneratedCode, iterations, formatOptions);
    }

    public AnalysisConfig withFormatOptions(FormatOptions options) {
        return new AnalysisConfig(includeTests, skipGeneratedCode, maxFixIterations, options);
    }
}
