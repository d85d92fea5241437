package dev.roshin.ctorlint.analysis.syntax;

import com.google.common.base.Preconditions;
import dev.roshin.ctorlint.analysis.model.SourcePoint;

import java.util.Arrays;

/**
 * Maps character offsets of a document to line and column numbers.
 * Line breaks are counted the same way as {@link SourcePoint#advance(String)} counts them.
 */
public final class LineMap {

    private final int length;
    private final int[] lineStarts;

    public LineMap(String text) {
        this.length = text.length();
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
            }
            if (c == '\n' || c == '\r') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Position of {@code offset}; the document length itself is a valid offset.
     */
    public SourcePoint pointAt(int offset) {
        int index = lineIndex(offset);
        return new SourcePoint(offset, index + 1, offset - lineStarts[index] + 1);
    }

    /**
     * Offset of the first character of the line containing {@code offset}.
     */
    public int lineStartOf(int offset) {
        return lineStarts[lineIndex(offset)];
    }

    private int lineIndex(int offset) {
        Preconditions.checkArgument(offset >= 0 && offset <= length,
                "Offset %s outside of document of length %s", offset, length);
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index : -index - 2;
    }
}
