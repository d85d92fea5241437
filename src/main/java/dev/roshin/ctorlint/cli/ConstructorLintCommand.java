package dev.roshin.ctorlint.cli;

import dev.roshin.ctorlint.analysis.config.AnalysisConfig;
import dev.roshin.ctorlint.analysis.config.FormatOptions;
import dev.roshin.ctorlint.analysis.core.ConstructorLayoutAnalyzer;
import dev.roshin.ctorlint.analysis.model.AnalysisReport;
import dev.roshin.ctorlint.analysis.model.ConstructorViolation;
import dev.roshin.ctorlint.analysis.model.DiagnosticDescriptor;
import dev.roshin.ctorlint.analysis.model.FixReport;
import dev.roshin.ctorlint.analysis.rule.ConstructorArgumentsRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line entry point: checks a Maven project and optionally fixes it in place.
 */
@CommandLine.Command(name = "ctorlint", mixinStandardHelpOptions = true, version = "ctorlint 1.0.0",
        description = "Checks that constructors with 3 or more parameters declare each parameter on its own line")
public class ConstructorLintCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ConstructorLintCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_FAILURE = 2;

    @CommandLine.Parameters(index = "0", defaultValue = ".", paramLabel = "PROJECT",
            description = "Root of the Maven project (default: current directory)")
    private Path projectRoot;

    @CommandLine.Option(names = "--fix", description = "Apply all fixes and write the files back")
    private boolean fix;

    @CommandLine.Option(names = "--include-tests", description = "Also check the test source directory")
    private boolean includeTests;

    @CommandLine.Option(names = "--include-generated", description = "Also check types annotated @Generated")
    private boolean includeGenerated;

    @CommandLine.Option(names = "--continuation-indent", paramLabel = "COLUMNS",
            description = "Indentation added for wrapped parameters when not aligned (default: ${DEFAULT-VALUE})")
    private int continuationIndent = FormatOptions.DEFAULT.continuationIndent();

    @CommandLine.Option(names = "--no-align", description = "Do not align wrapped parameters under the first one")
    private boolean noAlign;

    @CommandLine.Option(names = "--list-rules", description = "Print the rules this tool checks and exit")
    private boolean listRules;

    @CommandLine.Option(names = "--max-fix-iterations", paramLabel = "COUNT",
            description = "Give up fixing a file after this many fixes (default: ${DEFAULT-VALUE})")
    private int maxFixIterations = AnalysisConfig.DEFAULT.maxFixIterations();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final ConstructorLayoutAnalyzer analyzer;

    public ConstructorLintCommand() {
        this(new ConstructorLayoutAnalyzer());
    }

    ConstructorLintCommand(ConstructorLayoutAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new ConstructorLintCommand()).execute(args));
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (listRules) {
            printRule(ConstructorArgumentsRule.DESCRIPTOR, out);
            return EXIT_OK;
        }

        AnalysisConfig config;
        try {
            config = toConfig();
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            if (fix) {
                FixReport fixReport = analyzer.fixProject(projectRoot, config);
                if (fixReport.analysis().metadata().hadErrors()) {
                    return failed(fixReport.analysis(), err);
                }
                fixReport.changedFiles().forEach(file -> out.println("Fixed " + file));
                out.printf("%d fixes applied to %d files%n", fixReport.appliedFixes(), fixReport.changedFiles().size());
                return EXIT_OK;
            }

            AnalysisReport report = analyzer.getReport(projectRoot, config);
            if (report.metadata().hadErrors()) {
                return failed(report, err);
            }
            report.violations().stream()
                    .map(ConstructorViolation::toConsoleLine)
                    .forEach(out::println);
            out.printf("%d violations in %d files%n", report.violations().size(), report.affectedFiles().size());
            return report.hasViolations() ? EXIT_VIOLATIONS : EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Analysis of {} failed", projectRoot, e);
            err.println("ERROR: analysis failed: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private AnalysisConfig toConfig() {
        FormatOptions formatOptions = FormatOptions.DEFAULT
                .withContinuationIndent(continuationIndent)
                .withAlignment(!noAlign);
        return AnalysisConfig.DEFAULT
                .withIncludeTests(includeTests)
                .withSkipGeneratedCode(!includeGenerated)
                .withMaxFixIterations(maxFixIterations)
                .withFormatOptions(formatOptions);
    }

    private static void printRule(DiagnosticDescriptor descriptor, PrintWriter out) {
        out.printf("%s [%s, %s, %s]: %s%n",
                descriptor.id(),
                descriptor.category(),
                descriptor.defaultSeverity().label(),
                descriptor.enabledByDefault() ? "enabled" : "disabled",
                descriptor.title());
        out.println("    " + descriptor.description());
    }

    private static int failed(AnalysisReport report, PrintWriter err) {
        report.metadata().warnings().forEach(warning -> err.println("ERROR: " + warning));
        return EXIT_FAILURE;
    }
}
