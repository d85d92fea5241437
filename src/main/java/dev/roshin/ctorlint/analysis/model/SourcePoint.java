package dev.roshin.ctorlint.analysis.model;

/**
 * A position inside a source document.
 *
 * @param offset 0-based character offset from the start of the document
 * @param line   1-based line number
 * @param column 1-based column number
 */
public record SourcePoint(
        int offset,
        int line,
        int column
) {
    /**
     * The first character of a document.
     */
    public static final SourcePoint START = new SourcePoint(0, 1, 1);

    /**
     * Returns the point reached after reading {@code text} from this point.
     * {@code \n}, {@code \r\n} and a lone {@code \r} each count as one line break.
     */
    public SourcePoint advance(String text) {
        int newOffset = offset;
        int newLine = line;
        int newColumn = column;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            newOffset++;
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                continue;
            }
            if (c == '\n' || c == '\r') {
                newLine++;
                newColumn = 1;
            } else {
                newColumn++;
            }
        }
        return new SourcePoint(newOffset, newLine, newColumn);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
