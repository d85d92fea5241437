package dev.roshin.ctorlint.analysis.model;

import com.google.common.base.CharMatcher;

import java.util.Objects;

/**
 * Non-semantic source text (whitespace, line breaks, comments) attached to a node.
 *
 * @param text the verbatim trivia text, possibly empty
 */
public record Trivia(String text) {

    public static final Trivia EMPTY = new Trivia("");

    private static final CharMatcher LINE_BREAK = CharMatcher.anyOf("\r\n");

    public Trivia {
        Objects.requireNonNull(text, "text");
    }

    /**
     * A single line break token.
     */
    public static Trivia lineBreak(String lineSeparator) {
        return new Trivia(lineSeparator);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public boolean containsLineBreak() {
        return LINE_BREAK.matchesAnyOf(text);
    }

    /**
     * Counts line breaks, {@code \r\n} being one break.
     */
    public int lineBreakCount() {
        return SourcePoint.START.advance(text).line() - 1;
    }

    /**
     * True when the trivia holds nothing but whitespace, i.e. no comment.
     */
    public boolean isWhitespace() {
        return CharMatcher.whitespace().matchesAllOf(text);
    }

    @Override
    public String toString() {
        return "Trivia[" + text.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t") + "]";
    }
}
