package dev.roshin.ctorlint.analysis.core;

import dev.roshin.ctorlint.analysis.config.AnalysisConfig;
import dev.roshin.ctorlint.analysis.model.AnalysisReport;
import dev.roshin.ctorlint.analysis.model.ConstructorViolation;
import dev.roshin.ctorlint.analysis.model.FixReport;
import dev.roshin.ctorlint.analysis.rule.ConstructorArgumentsRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConstructorLayoutAnalyzerTest {

    private static final String POM = """
            <project xmlns="http://maven.apache.org/POM/4.0.0">
                <modelVersion>4.0.0</modelVersion>
                <groupId>demo</groupId>
                <artifactId>shop</artifactId>
                <version>1.0</version>
            </project>
            """;

    private static final String POINT = """
            package demo;

            public class Point {
                public Point(int x, int y, int z) {
                }

                public Point(int x, int y) {
                    this(x, y, 0);
                }
            }
            """;

    private static final String LINE = """
            package demo.geometry;

            public class Line {
                public Line(int fromX,
                            int fromY,
                            int toX, int toY) {
                }
            }
            """;

    private static final String POINT_TEST = """
            package demo;

            class PointFixture {
                PointFixture(int a, int b, int c) {
                }
            }
            """;

    @TempDir
    Path project;

    private final ConstructorLayoutAnalyzer analyzer = new ConstructorLayoutAnalyzer();

    @BeforeEach
    void createProject() throws Exception {
        Files.writeString(project.resolve("pom.xml"), POM);
        Path main = project.resolve("src/main/java/demo");
        Files.createDirectories(main.resolve("geometry"));
        Files.writeString(main.resolve("Point.java"), POINT);
        Files.writeString(main.resolve("geometry/Line.java"), LINE);
        Path test = project.resolve("src/test/java/demo");
        Files.createDirectories(test);
        Files.writeString(test.resolve("PointFixture.java"), POINT_TEST);
    }

    @Test
    void reportsViolationsOrderedByFileAndLine() {
        AnalysisReport report = analyzer.getReport(project, AnalysisConfig.DEFAULT);

        assertFalse(report.metadata().hadErrors());
        assertEquals(2, report.violations().size());

        assertEquals(List.of("src/main/java/demo/Point.java", "src/main/java/demo/geometry/Line.java"),
                report.violations().stream().map(v -> v.location().filePath()).toList());

        ConstructorViolation point = report.violations().stream()
                .filter(v -> v.location().filePath().endsWith("Point.java"))
                .findFirst().orElseThrow();
        assertEquals(4, point.location().lineNumber());
        assertEquals(25, point.location().columnNumber());
        assertEquals("demo.Point", point.location().className());
        assertEquals("Point(x, y, z)", point.location().constructorSignature());
        assertEquals(ConstructorArgumentsRule.DIAGNOSTIC_ID, point.diagnostic().ruleId());

        ConstructorViolation wrapped = report.violations().stream()
                .filter(v -> v.location().filePath().endsWith("Line.java"))
                .findFirst().orElseThrow();
        assertEquals(6, wrapped.location().lineNumber());

        assertEquals(Set.of("src/main/java/demo/Point.java", "src/main/java/demo/geometry/Line.java"),
                report.affectedFiles());
        assertEquals(2, report.metadata().totalFilesScanned());
        assertEquals(3, report.metadata().totalConstructorsAnalyzed());
    }

    @Test
    void testSourcesAreCheckedOnRequest() {
        AnalysisReport report = analyzer.getReport(project, AnalysisConfig.DEFAULT.withIncludeTests(true));

        assertEquals(3, report.violations().size());
        assertTrue(report.affectedFiles().contains("src/test/java/demo/PointFixture.java"));
    }

    @Test
    void fixProjectRewritesFilesUntilTheyAreClean() throws Exception {
        FixReport fixReport = analyzer.fixProject(project, AnalysisConfig.DEFAULT);

        assertEquals(2, fixReport.appliedFixes());
        assertEquals(List.of("src/main/java/demo/Point.java", "src/main/java/demo/geometry/Line.java"),
                fixReport.changedFiles().stream().sorted().toList());
        assertEquals("""
                package demo;

                public class Point {
                    public Point(int x,
                                 int y,
                                 int z) {
                    }

                    public Point(int x, int y) {
                        this(x, y, 0);
                    }
                }
                """, Files.readString(project.resolve("src/main/java/demo/Point.java")));
        assertEquals("""
                package demo.geometry;

                public class Line {
                    public Line(int fromX,
                                int fromY,
                                int toX,
                                int toY) {
                    }
                }
                """, Files.readString(project.resolve("src/main/java/demo/geometry/Line.java")));
        assertEquals(POINT_TEST, Files.readString(project.resolve("src/test/java/demo/PointFixture.java")));

        assertFalse(analyzer.getReport(project, AnalysisConfig.DEFAULT).hasViolations());
    }

    @Test
    void cleanProjectNeedsNoFixes() throws Exception {
        analyzer.fixProject(project, AnalysisConfig.DEFAULT);

        FixReport second = analyzer.fixProject(project, AnalysisConfig.DEFAULT);

        assertEquals(0, second.appliedFixes());
        assertTrue(second.changedFiles().isEmpty());
    }

    @Test
    void skippedConstructorsAreKeptApartFromWarnings() throws Exception {
        // the escaped comma is a separator for the compiler but not for the text scanner
        Files.writeString(project.resolve("src/main/java/demo/Odd.java"), """
                package demo;

                public class Odd {
                    Odd(int a\\u002C int b, int c) {
                    }

                    static class Inner {
                        Inner(int x, int y, int z) {
                        }
                    }
                }
                """);

        AnalysisReport report = analyzer.getReport(project, AnalysisConfig.DEFAULT);

        assertEquals(1, report.metadata().skippedConstructors().size());
        assertTrue(report.metadata().warnings().isEmpty());
        ConstructorViolation inner = report.violations().stream()
                .filter(v -> v.location().filePath().endsWith("Odd.java"))
                .findFirst().orElseThrow();
        assertEquals("demo.Odd.Inner", inner.location().className());
        assertEquals("Inner(x, y, z)", inner.location().constructorSignature());
    }

    @Test
    void rejectsDirectoriesWithoutPom(@TempDir Path empty) {
        assertThrows(IllegalArgumentException.class, () -> analyzer.getReport(empty, AnalysisConfig.DEFAULT));
        assertThrows(IllegalArgumentException.class,
                () -> analyzer.getReport(empty.resolve("missing"), AnalysisConfig.DEFAULT));
    }

    @Test
    void rejectsProjectsWithoutSources(@TempDir Path bare) throws Exception {
        Files.writeString(bare.resolve("pom.xml"), POM);

        assertThrows(IllegalArgumentException.class, () -> analyzer.getReport(bare, AnalysisConfig.DEFAULT));
    }
}
