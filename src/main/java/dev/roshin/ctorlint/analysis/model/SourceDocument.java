package dev.roshin.ctorlint.analysis.model;

import com.google.common.base.Preconditions;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The full text of one source file. Edits produce new documents.
 *
 * @param path location of the file; only its file name matters for parsing
 * @param text the file content
 */
public record SourceDocument(
        Path path,
        String text
) {
    private static final String DEFAULT_LINE_SEPARATOR = "\n";

    public SourceDocument {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(text, "text");
    }

    public String fileName() {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }

    /**
     * The first line separator used in the document, {@code \n} when it has a single line.
     */
    public String lineSeparator() {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                return "\n";
            }
            if (c == '\r') {
                return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? "\r\n" : "\r";
            }
        }
        return DEFAULT_LINE_SEPARATOR;
    }

    /**
     * Returns a document where {@code span} is replaced with {@code replacement}.
     */
    public SourceDocument replace(SourceSpan span, String replacement) {
        int start = span.start().offset();
        int end = span.end().offset();
        Preconditions.checkArgument(end <= text.length(),
                "Span %s lies outside of %s (%s chars)", span, fileName(), text.length());
        return new SourceDocument(path, text.substring(0, start) + replacement + text.substring(end));
    }

    @Override
    public String toString() {
        return "SourceDocument[" + path + ", " + text.length() + " chars]";
    }
}
