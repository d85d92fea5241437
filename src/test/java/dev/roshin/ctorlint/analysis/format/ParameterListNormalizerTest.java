package dev.roshin.ctorlint.analysis.format;

import dev.roshin.ctorlint.analysis.config.FormatOptions;
import dev.roshin.ctorlint.analysis.fix.ConstructorArgumentsLayoutRewriter;
import dev.roshin.ctorlint.analysis.model.ConstructorDeclaration;
import dev.roshin.ctorlint.analysis.rule.ConstructorArgumentsRule;
import org.junit.jupiter.api.Test;

import static dev.roshin.ctorlint.analysis.testutil.ConstructorNodes.parse;
import static org.junit.jupiter.api.Assertions.*;

class ParameterListNormalizerTest {

    private final ConstructorArgumentsLayoutRewriter rewriter = new ConstructorArgumentsLayoutRewriter();
    private final ParameterListNormalizer normalizer = new ParameterListNormalizer();

    @Test
    void leavesNodesWithoutTheFormattingFlagAlone() {
        ConstructorDeclaration node = parse("Foo", "Foo(int a,\nint b,\nint c) {}");

        assertSame(node, normalizer.normalize(node));
    }

    @Test
    void alignsWrappedParametersUnderTheFirstOne() {
        ConstructorDeclaration node = rewriter.rewrite(parse("Foo", "    Foo(int a, int b, int c) {}"));

        ConstructorDeclaration normalized = normalizer.normalize(node);

        assertEquals("Foo(int a,\n        int b,\n        int c)", normalized.toSourceText());
        assertFalse(normalized.formattingRequested());
    }

    @Test
    void alignmentFollowsTheHeaderLineNotTheAnnotationsAboveIt() {
        String source = "    @Inject\n    public Foo(String a, String b, String c) {}";
        ConstructorDeclaration node = rewriter.rewrite(parse("Foo", source));

        ConstructorDeclaration normalized = normalizer.normalize(node);

        String indent = " ".repeat("    public Foo(".length());
        assertEquals("public Foo(String a,\n" + indent + "String b,\n" + indent + "String c)",
                normalized.toSourceText());
    }

    @Test
    void keepsTabsWhenAligning() {
        ConstructorDeclaration node = rewriter.rewrite(parse("Foo", "\tFoo(int a, int b, int c) {}"));

        ConstructorDeclaration normalized = normalizer.normalize(node);

        assertEquals("Foo(int a,\n\t    int b,\n\t    int c)", normalized.toSourceText());
    }

    @Test
    void followsAFirstParameterThatIsAlreadyOnItsOwnLine() {
        ConstructorDeclaration node = rewriter.rewrite(parse("Foo", "    Foo(\n            int a, int b, int c) {}"));

        ConstructorDeclaration normalized = normalizer.normalize(node);

        assertEquals("Foo(\n            int a,\n            int b,\n            int c)", normalized.toSourceText());
    }

    @Test
    void usesContinuationIndentWhenAlignmentIsOff() {
        ParameterListNormalizer continuation = new ParameterListNormalizer(new FormatOptions(8, false));
        ConstructorDeclaration node = rewriter.rewrite(parse("Foo", "    Foo(int a, int b, int c) {}"));

        ConstructorDeclaration normalized = continuation.normalize(node);

        assertEquals("Foo(int a,\n            int b,\n            int c)", normalized.toSourceText());
    }

    @Test
    void keepsBlankLinesAndReindentsExistingWraps() {
        ConstructorDeclaration node = parse("Foo", "Foo(int a,\n\n  int b,\n int c) {}").withFormattingRequested(true);

        ConstructorDeclaration normalized = normalizer.normalize(node);

        assertEquals("Foo(int a,\n\n    int b,\n    int c)", normalized.toSourceText());
    }

    @Test
    void doesNotTouchTriviaHoldingComments() {
        ConstructorDeclaration node = rewriter.rewrite(parse("Foo", "Foo(int a, // x\n int b, int c) {}"));

        ConstructorDeclaration normalized = normalizer.normalize(node);

        assertEquals("Foo(int a, // x\n int b,\n    int c)", normalized.toSourceText());
    }

    @Test
    void normalizedNodeStillPassesTheRule() {
        ConstructorArgumentsRule rule = new ConstructorArgumentsRule();
        ConstructorDeclaration node = rewriter.rewrite(parse("Foo", "  Foo(int a, int b,\n int c, int d, int e) {}"));

        ConstructorDeclaration normalized = normalizer.normalize(node);

        assertTrue(rule.evaluate(normalized).isEmpty());
        assertEquals(5, normalized.parameterCount());
    }

    @Test
    void emptyParameterListOnlyClearsTheFlag() {
        ConstructorDeclaration node = parse("Foo", "Foo( ) {}").withFormattingRequested(true);

        ConstructorDeclaration normalized = normalizer.normalize(node);

        assertFalse(normalized.formattingRequested());
        assertEquals("Foo( )", normalized.toSourceText());
    }
}
