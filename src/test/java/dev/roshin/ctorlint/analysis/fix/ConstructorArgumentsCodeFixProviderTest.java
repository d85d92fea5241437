package dev.roshin.ctorlint.analysis.fix;

import dev.roshin.ctorlint.analysis.format.ParameterListNormalizer;
import dev.roshin.ctorlint.analysis.model.*;
import dev.roshin.ctorlint.analysis.model.enums.Severity;
import dev.roshin.ctorlint.analysis.rule.ConstructorArgumentsRule;
import dev.roshin.ctorlint.analysis.spoon.SpoonConstructorCollector;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConstructorArgumentsCodeFixProviderTest {

    private static final String SOURCE = """
            package demo;

            public class Point {
                public Point(int x, int y, int z) {
                }
            }
            """;

    private static final String FIXED = """
            package demo;

            public class Point {
                public Point(int x,
                             int y,
                             int z) {
                }
            }
            """;

    private final SpoonConstructorCollector collector = new SpoonConstructorCollector(true);
    private final ConstructorArgumentsRule rule = new ConstructorArgumentsRule();
    private final ConstructorArgumentsCodeFixProvider provider =
            new ConstructorArgumentsCodeFixProvider(collector, new ParameterListNormalizer());

    @Test
    void offersTheFixForTheReportedConstructor() {
        SourceDocument document = new SourceDocument(Path.of("Point.java"), SOURCE);
        Diagnostic diagnostic = rule.evaluate(collector.collect(document).get(0)).orElseThrow();

        CodeAction action = provider.codeFixFor(document, diagnostic).orElseThrow();
        SourceDocument fixed = action.apply(document);

        assertEquals("Fix constructor argument formatting", action.title());
        assertEquals(action.title(), action.equivalenceKey());
        assertEquals(FIXED, fixed.text());
        assertEquals(SOURCE, document.text());
    }

    @Test
    void fixesOnlyTheConstructorTheDiagnosticPointsInto() {
        String source = "package demo;\n\nclass Pair { Pair(int a, int b, int c) {} Pair(long a, long b, long c) {} }\n";
        SourceDocument document = new SourceDocument(Path.of("Pair.java"), source);
        Diagnostic second = rule.evaluate(collector.collect(document).get(1)).orElseThrow();

        SourceDocument fixed = provider.codeFixFor(document, second).orElseThrow().apply(document);

        String prefix = "class Pair { Pair(int a, int b, int c) {} Pair(";
        String indent = " ".repeat(prefix.length());
        assertEquals("package demo;\n\n" + prefix + "long a,\n" + indent + "long b,\n" + indent + "long c) {} }\n",
                fixed.text());
    }

    @Test
    void fixableIdsContainOnlyTheConstructorArgumentsRule() {
        assertEquals(Set.of("ConstructorArguments"), provider.fixableDiagnosticIds());
    }

    @Test
    void ignoresDiagnosticsOfOtherRules() {
        SourceDocument document = new SourceDocument(Path.of("Point.java"), SOURCE);
        DiagnosticDescriptor other = new DiagnosticDescriptor("Other", "Other", "other", "Style",
                Severity.INFO, true, "other rule");
        SourceSpan span = collector.collect(document).get(0).parameterSpans().get(1);

        assertEquals(Optional.empty(), provider.codeFixFor(document, new Diagnostic(other, span)));
    }

    @Test
    void keepsCarriageReturnLineFeeds() {
        String crlf = SOURCE.replace("\n", "\r\n");
        SourceDocument document = new SourceDocument(Path.of("Point.java"), crlf);
        Diagnostic diagnostic = rule.evaluate(collector.collect(document).get(0)).orElseThrow();

        SourceDocument fixed = provider.codeFixFor(document, diagnostic).orElseThrow().apply(document);

        assertEquals(FIXED.replace("\n", "\r\n"), fixed.text());
    }
}
