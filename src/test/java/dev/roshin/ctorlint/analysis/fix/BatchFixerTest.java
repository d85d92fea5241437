package dev.roshin.ctorlint.analysis.fix;

import dev.roshin.ctorlint.analysis.format.ParameterListNormalizer;
import dev.roshin.ctorlint.analysis.model.SourceDocument;
import dev.roshin.ctorlint.analysis.rule.ConstructorArgumentsRule;
import dev.roshin.ctorlint.analysis.spoon.SpoonConstructorCollector;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class BatchFixerTest {

    private static final String ORDER = """
            package demo;

            public class Order {
                private final long id;

                public Order(String id, String customer, int quantity) {
                    this(Long.parseLong(id), customer, quantity, false);
                }

                public Order(long id, String customer,
                             int quantity, boolean express) {
                    this.id = id;
                }

                public Order(long id, String customer) {
                    this(id, customer, 1, false);
                }
            }
            """;

    private static final String FIXED_ORDER = """
            package demo;

            public class Order {
                private final long id;

                public Order(String id,
                             String customer,
                             int quantity) {
                    this(Long.parseLong(id), customer, quantity, false);
                }

                public Order(long id,
                             String customer,
                             int quantity,
                             boolean express) {
                    this.id = id;
                }

                public Order(long id, String customer) {
                    this(id, customer, 1, false);
                }
            }
            """;

    private final SpoonConstructorCollector collector = new SpoonConstructorCollector(true);
    private final ConstructorArgumentsRule rule = new ConstructorArgumentsRule();

    private BatchFixer fixer(int maxIterations) {
        return new BatchFixer(collector, rule,
                new ConstructorArgumentsCodeFixProvider(collector, new ParameterListNormalizer()), maxIterations);
    }

    @Test
    void fixesEveryConstructorOfTheDocument() {
        BatchFixer.FixResult result = fixer(100).fixAll(new SourceDocument(Path.of("Order.java"), ORDER));

        assertEquals(FIXED_ORDER, result.document().text());
        assertEquals(2, result.appliedFixes());
        assertTrue(result.changed());
        assertTrue(collector.collect(result.document()).stream().allMatch(c -> rule.evaluate(c).isEmpty()));
    }

    @Test
    void cleanDocumentIsLeftAsIs() {
        SourceDocument document = new SourceDocument(Path.of("Order.java"), FIXED_ORDER);

        BatchFixer.FixResult result = fixer(100).fixAll(document);

        assertSame(document, result.document());
        assertFalse(result.changed());
    }

    @Test
    void givesUpAfterTheConfiguredNumberOfFixes() {
        BatchFixer batchFixer = fixer(1);
        SourceDocument document = new SourceDocument(Path.of("Order.java"), ORDER);

        assertThrows(IllegalStateException.class, () -> batchFixer.fixAll(document));
    }

    @Test
    void stopsWhenTheThreadIsInterrupted() {
        BatchFixer batchFixer = fixer(100);
        SourceDocument document = new SourceDocument(Path.of("Order.java"), ORDER);

        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> batchFixer.fixAll(document));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsNonPositiveIterationLimits() {
        assertThrows(IllegalArgumentException.class, () -> fixer(0));
    }
}
