package dev.roshin.ctorlint.analysis.model;

/**
 * Captures where in the analyzed project a violation was found.
 *
 * @param filePath             Path to the source file, relative to the project root
 * @param className            Fully qualified name of the declaring class
 * @param constructorSignature Constructor with its parameter names, e.g. {@code Order(id, customer, lines)}
 * @param lineNumber           Line of the offending parameter
 * @param columnNumber         Column of the offending parameter
 */
public record SourceLocation(
        String filePath,
        String className,
        String constructorSignature,
        int lineNumber,
        int columnNumber
) {
    @Override
    public String toString() {
        return String.format("%s [%s:%d:%d]", constructorSignature, filePath, lineNumber, columnNumber);
    }
}
