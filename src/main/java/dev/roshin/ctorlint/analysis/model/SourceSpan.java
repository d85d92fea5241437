package dev.roshin.ctorlint.analysis.model;

/**
 * A contiguous region of a source document.
 *
 * @param start first character of the region
 * @param end   point right after the last character (exclusive)
 */
public record SourceSpan(
        SourcePoint start,
        SourcePoint end
) {
    public SourceSpan {
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException(
                    "Span end " + end + " precedes start " + start
            );
        }
    }

    public int startLine() {
        return start.line();
    }

    /**
     * Line of the last character in the span. This is the line a parameter "ends on".
     */
    public int endLine() {
        return end.line();
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean contains(int offset) {
        return offset >= start.offset() && offset < end.offset();
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + "]";
    }
}
