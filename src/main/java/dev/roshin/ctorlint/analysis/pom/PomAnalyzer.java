package dev.roshin.ctorlint.analysis.pom;

import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the source directories of a Maven project from its {@code pom.xml}.
 */
public class PomAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(PomAnalyzer.class);

    private static final String POM_FILE = "pom.xml";
    private static final String DEFAULT_SOURCE_DIRECTORY = "src/main/java";
    private static final String DEFAULT_TEST_SOURCE_DIRECTORY = "src/test/java";

    /**
     * Reads the project layout. A missing or unreadable pom falls back to Maven's defaults.
     */
    public SourceLayout scanPom(Path projectPath) {
        Path pomFile = projectPath.resolve(POM_FILE);
        String artifactId = projectPath.getFileName() != null ? projectPath.getFileName().toString() : "unknown";
        String sourceDirectory = DEFAULT_SOURCE_DIRECTORY;
        String testSourceDirectory = DEFAULT_TEST_SOURCE_DIRECTORY;

        if (!Files.exists(pomFile)) {
            log.error("No pom.xml found at path: {}", projectPath);
            return new SourceLayout(artifactId, projectPath.resolve(sourceDirectory), projectPath.resolve(testSourceDirectory));
        }

        MavenXpp3Reader reader = new MavenXpp3Reader();
        try (Reader fileReader = Files.newBufferedReader(pomFile, StandardCharsets.UTF_8)) {
            Model model = reader.read(fileReader);

            if (model.getArtifactId() != null) {
                artifactId = model.getArtifactId();
            }
            Build build = model.getBuild();
            if (build != null) {
                if (build.getSourceDirectory() != null) {
                    sourceDirectory = build.getSourceDirectory();
                    log.debug("Found source directory: {}", sourceDirectory);
                }
                if (build.getTestSourceDirectory() != null) {
                    testSourceDirectory = build.getTestSourceDirectory();
                    log.debug("Found test source directory: {}", testSourceDirectory);
                }
            }
        } catch (Exception e) {
            log.error("Failed to parse pom.xml, using default source directories", e);
        }

        return new SourceLayout(
                artifactId,
                resolve(projectPath, sourceDirectory),
                resolve(projectPath, testSourceDirectory)
        );
    }

    private static Path resolve(Path projectPath, String directory) {
        String expanded = directory.replace("${project.basedir}", projectPath.toString())
                .replace("${basedir}", projectPath.toString());
        return projectPath.resolve(expanded).normalize();
    }

    /**
     * Source directories of a project.
     *
     * @param artifactId          artifact id from the pom, the directory name if it has none
     * @param sourceDirectory     main Java sources
     * @param testSourceDirectory test Java sources
     */
    public record SourceLayout(String artifactId, Path sourceDirectory, Path testSourceDirectory) {

        /**
         * Existing source roots to analyze.
         */
        public List<Path> sourceRoots(boolean includeTests) {
            List<Path> roots = new ArrayList<>();
            if (Files.isDirectory(sourceDirectory)) {
                roots.add(sourceDirectory);
            }
            if (includeTests && Files.isDirectory(testSourceDirectory)) {
                roots.add(testSourceDirectory);
            }
            return roots;
        }
    }
}
