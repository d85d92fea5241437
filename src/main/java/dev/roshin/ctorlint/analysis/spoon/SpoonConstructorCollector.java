package dev.roshin.ctorlint.analysis.spoon;

import dev.roshin.ctorlint.analysis.model.ConstructorDeclaration;
import dev.roshin.ctorlint.analysis.model.SourceDocument;
import dev.roshin.ctorlint.analysis.syntax.ConstructorNodeFactory;
import dev.roshin.ctorlint.analysis.syntax.LineMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtType;
import spoon.reflect.visitor.filter.TypeFilter;
import spoon.support.compiler.VirtualFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Locates constructors with Spoon and turns each of them into a {@link ConstructorDeclaration}.
 * <p>
 * Spoon provides the declarations and a start offset; the parameter list itself is sliced
 * from the document text so that trivia is kept verbatim.
 */
public class SpoonConstructorCollector {
    private static final Logger log = LoggerFactory.getLogger(SpoonConstructorCollector.class);

    private static final int COMPLIANCE_LEVEL = 17;
    private static final String GENERATED_ANNOTATION = "Generated";

    private final boolean skipGeneratedCode;
    private final ConstructorNodeFactory nodeFactory = new ConstructorNodeFactory();

    public SpoonConstructorCollector(boolean skipGeneratedCode) {
        this.skipGeneratedCode = skipGeneratedCode;
    }

    /**
     * A constructor node together with the file it was read from.
     */
    public record CollectedConstructor(Path file, ConstructorDeclaration node) {
    }

    /**
     * Everything collected from a set of source roots.
     *
     * @param constructors nodes ordered by file and position
     * @param typeCount    number of types in the Spoon model
     * @param skipped      constructors that could not be turned into nodes, with the reason
     */
    public record CollectionResult(List<CollectedConstructor> constructors,
                                   int typeCount,
                                   List<String> skipped) {
    }

    /**
     * Collects the constructors of a single in-memory document, in source order.
     *
     * @throws IllegalStateException if Spoon cannot build a model of the document
     */
    public List<ConstructorDeclaration> collect(SourceDocument document) {
        Launcher launcher = newLauncher();
        launcher.addInputResource(new VirtualFile(document.text(), document.fileName()));

        CtModel model = buildModel(launcher, document.fileName());
        LineMap lineMap = new LineMap(document.text());
        List<String> skipped = new ArrayList<>();

        List<ConstructorDeclaration> nodes = new ArrayList<>();
        List<CtConstructor<?>> constructors = model.getElements(new TypeFilter<>(CtConstructor.class));
        for (CtConstructor<?> constructor : constructors) {
            toNode(constructor, document.text(), lineMap, skipped).ifPresent(nodes::add);
        }
        nodes.sort(Comparator.comparingInt(n -> n.span().start().offset()));

        skipped.forEach(reason -> log.warn("Skipped constructor in {}: {}", document.fileName(), reason));
        return nodes;
    }

    /**
     * Collects the constructors of every Java file below the given source roots.
     *
     * @throws IllegalStateException if Spoon cannot build a model of the sources
     */
    public CollectionResult collect(List<Path> sourceRoots) {
        log.info("Building Spoon model for {} source roots", sourceRoots.size());

        Launcher launcher = newLauncher();
        for (Path root : sourceRoots) {
            launcher.addInputResource(root.toString());
        }
        CtModel model = buildModel(launcher, sourceRoots.toString());
        int typeCount = model.getAllTypes().size();
        log.info("Spoon model built successfully, {} types", typeCount);

        Map<Path, SourceDocument> documents = new HashMap<>();
        Map<Path, LineMap> lineMaps = new HashMap<>();
        List<CollectedConstructor> collected = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        List<CtConstructor<?>> constructors = model.getElements(new TypeFilter<>(CtConstructor.class));
        log.debug("Scanning {} constructors", constructors.size());

        for (CtConstructor<?> constructor : constructors) {
            if (constructor.isImplicit()) {
                continue;
            }
            SourcePosition position = constructor.getPosition();
            if (!position.isValidPosition() || position.getFile() == null) {
                skipped.add(describe(constructor) + ": no source position");
                continue;
            }
            Path file = position.getFile().toPath().toAbsolutePath().normalize();
            SourceDocument document = documents.computeIfAbsent(file, SpoonConstructorCollector::read);
            LineMap lineMap = lineMaps.computeIfAbsent(file, f -> new LineMap(document.text()));

            toNode(constructor, document.text(), lineMap, skipped)
                    .ifPresent(node -> collected.add(new CollectedConstructor(file, node)));
        }

        collected.sort(Comparator
                .comparing((CollectedConstructor c) -> c.file().toString())
                .thenComparingInt(c -> c.node().span().start().offset()));

        skipped.forEach(reason -> log.warn("Skipped constructor {}", reason));
        log.info("Collected {} constructors, skipped {}", collected.size(), skipped.size());
        return new CollectionResult(List.copyOf(collected), typeCount, List.copyOf(skipped));
    }

    private Optional<ConstructorDeclaration> toNode(CtConstructor<?> constructor,
                                                    String text,
                                                    LineMap lineMap,
                                                    List<String> skipped) {
        if (constructor.isImplicit() || constructor.isCompactConstructor()) {
            // no parameter list in the source
            return Optional.empty();
        }
        SourcePosition position = constructor.getPosition();
        if (!position.isValidPosition()) {
            skipped.add(describe(constructor) + ": no source position");
            return Optional.empty();
        }

        CtType<?> declaringType = constructor.getDeclaringType();
        if (skipGeneratedCode && isGenerated(declaringType)) {
            log.debug("Skipping generated type {}", declaringType.getQualifiedName());
            return Optional.empty();
        }

        Optional<ConstructorDeclaration> node = nodeFactory.create(
                text,
                lineMap,
                position.getSourceStart(),
                declaringType.getSimpleName(),
                declaringType.getQualifiedName().replace('$', '.')
        );

        if (node.isEmpty()) {
            skipped.add(describe(constructor) + ": parameter list not found");
            return Optional.empty();
        }

        int expected = constructor.getParameters().size();
        if (node.get().parameterCount() != expected) {
            skipped.add(String.format("%s: found %d parameters, expected %d",
                    describe(constructor), node.get().parameterCount(), expected));
            return Optional.empty();
        }
        return node;
    }

    /**
     * True when the type or any enclosing type carries a {@code @Generated} annotation.
     */
    private boolean isGenerated(CtType<?> type) {
        CtType<?> current = type;
        while (current != null) {
            boolean generated = current.getAnnotations().stream()
                    .anyMatch(a -> GENERATED_ANNOTATION.equals(a.getAnnotationType().getSimpleName()));
            if (generated) {
                return true;
            }
            current = current.getDeclaringType();
        }
        return false;
    }

    private Launcher newLauncher() {
        Launcher launcher = new Launcher();
        launcher.getEnvironment().setComplianceLevel(COMPLIANCE_LEVEL);
        launcher.getEnvironment().setNoClasspath(true); // Work without full classpath
        launcher.getEnvironment().setIgnoreDuplicateDeclarations(true);
        launcher.getEnvironment().setShouldCompile(false);
        launcher.getEnvironment().setCommentEnabled(false); // Trivia is read from the text
        launcher.getEnvironment().setEncoding(StandardCharsets.UTF_8);
        return launcher;
    }

    private CtModel buildModel(Launcher launcher, String description) {
        try {
            return launcher.buildModel();
        } catch (Exception e) {
            log.error("Failed to build Spoon model for {}", description, e);
            throw new IllegalStateException("Parsing failed for " + description + ": " + e.getMessage(), e);
        }
    }

    private static SourceDocument read(Path file) {
        try {
            return new SourceDocument(file, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }

    private static String describe(CtConstructor<?> constructor) {
        try {
            if (constructor.getPosition().isValidPosition()) {
                return constructor.getSignature() + " at " + constructor.getPosition();
            }
        } catch (Exception e) {
            log.debug("Could not describe constructor position: {}", e.getMessage());
        }
        return constructor.getSignature();
    }
}
