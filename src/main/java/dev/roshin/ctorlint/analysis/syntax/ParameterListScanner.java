package dev.roshin.ctorlint.analysis.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lexical scanner locating a constructor's parameter list in Java source text and slicing it
 * into parameters.
 * <p>
 * Whitespace and comments are trivia. A comma splits parameters only outside of parentheses,
 * brackets, braces and generic angle brackets, and never inside string, character or
 * text-block literals.
 */
public final class ParameterListScanner {

    /**
     * Offsets of one parameter.
     *
     * @param leadingStart offset right after the preceding {@code (} or {@code ,}
     * @param textStart    first character of the parameter text
     * @param textEnd      offset right after the last character of the parameter text
     * @param trailingEnd  offset of the following {@code ,}; equals {@code textEnd} for the last parameter
     */
    public record Slice(int leadingStart, int textStart, int textEnd, int trailingEnd) {
    }

    /**
     * A located parameter list.
     *
     * @param nameOffset  offset of the constructor name
     * @param openParen   offset of {@code (}
     * @param closeParen  offset of {@code )}
     * @param parameters  the parameters in order
     */
    public record Result(int nameOffset, int openParen, int closeParen, List<Slice> parameters) {
    }

    /**
     * Scans {@code text} from {@code from} for {@code constructorName} followed by a parameter list.
     *
     * @return empty when no such list is found before the declaration body or a {@code ;},
     * or when the list is malformed
     */
    public Optional<Result> scan(String text, int from, String constructorName) {
        int nameOffset = findName(text, from, constructorName);
        if (nameOffset < 0) {
            return Optional.empty();
        }
        int openParen = skipTrivia(text, nameOffset + constructorName.length());
        return scanList(text, nameOffset, openParen);
    }

    private int findName(String text, int from, String name) {
        int parenDepth = 0;
        char previous = 0;
        int i = Math.max(0, from);
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int afterComment = skipComment(text, i);
            if (afterComment > i) {
                i = afterComment;
                continue;
            }
            if (c == '"' || c == '\'') {
                i = skipLiteral(text, i);
                previous = c;
                continue;
            }
            if (Character.isJavaIdentifierStart(c)) {
                int end = i + 1;
                while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
                    end++;
                }
                if (parenDepth == 0 && previous != '@' && previous != '.'
                        && text.startsWith(name, i) && end - i == name.length()) {
                    int next = skipTrivia(text, end);
                    if (next < text.length() && text.charAt(next) == '(') {
                        return i;
                    }
                }
                previous = 'a';
                i = end;
                continue;
            }
            if (c == '(') {
                parenDepth++;
            } else if (c == ')') {
                parenDepth--;
            } else if (parenDepth == 0 && (c == '{' || c == ';')) {
                return -1;
            }
            previous = c;
            i++;
        }
        return -1;
    }

    private Optional<Result> scanList(String text, int nameOffset, int openParen) {
        List<Slice> slices = new ArrayList<>();
        int parens = 0;
        int brackets = 0;
        int braces = 0;
        int angles = 0;
        int segmentStart = openParen + 1;
        int textStart = -1;
        int textEnd = -1;

        int i = openParen + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int afterComment = skipComment(text, i);
            if (afterComment > i) {
                i = afterComment;
                continue;
            }
            if (c == ')' && parens == 0) {
                if (textStart >= 0) {
                    slices.add(new Slice(segmentStart, textStart, textEnd, textEnd));
                } else if (!slices.isEmpty()) {
                    // trailing comma
                    return Optional.empty();
                }
                return Optional.of(new Result(nameOffset, openParen, i, List.copyOf(slices)));
            }
            if (c == ',' && parens == 0 && brackets == 0 && braces == 0 && angles == 0) {
                if (textStart < 0) {
                    return Optional.empty();
                }
                slices.add(new Slice(segmentStart, textStart, textEnd, i));
                segmentStart = i + 1;
                textStart = -1;
                textEnd = -1;
                i++;
                continue;
            }

            if (textStart < 0) {
                textStart = i;
            }
            if (c == '"' || c == '\'') {
                i = skipLiteral(text, i);
                textEnd = i;
                continue;
            }
            switch (c) {
                case '(' -> parens++;
                case ')' -> parens--;
                case '[' -> brackets++;
                case ']' -> brackets = Math.max(0, brackets - 1);
                case '{' -> braces++;
                case '}' -> braces = Math.max(0, braces - 1);
                case '<' -> {
                    if (parens == 0 && brackets == 0 && braces == 0) {
                        angles++;
                    }
                }
                case '>' -> {
                    if (parens == 0 && brackets == 0 && braces == 0) {
                        angles = Math.max(0, angles - 1);
                    }
                }
                default -> {
                }
            }
            i++;
            textEnd = i;
        }
        return Optional.empty();
    }

    /**
     * Offset of the first character at or after {@code from} that is neither whitespace nor comment.
     */
    static int skipTrivia(String text, int from) {
        int i = from;
        while (i < text.length()) {
            if (Character.isWhitespace(text.charAt(i))) {
                i++;
                continue;
            }
            int afterComment = skipComment(text, i);
            if (afterComment == i) {
                break;
            }
            i = afterComment;
        }
        return i;
    }

    /**
     * Offset after the comment starting at {@code i}, or {@code i} if none starts there.
     * A line comment ends before its line break.
     */
    static int skipComment(String text, int i) {
        if (text.startsWith("//", i)) {
            int end = i + 2;
            while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
                end++;
            }
            return end;
        }
        if (text.startsWith("/*", i)) {
            int close = text.indexOf("*/", i + 2);
            return close < 0 ? text.length() : close + 2;
        }
        return i;
    }

    /**
     * Offset after the string, character or text-block literal starting at {@code i}.
     */
    static int skipLiteral(String text, int i) {
        if (text.startsWith("\"\"\"", i)) {
            int end = i + 3;
            while (end < text.length()) {
                if (text.charAt(end) == '\\') {
                    end += 2;
                } else if (text.startsWith("\"\"\"", end)) {
                    return end + 3;
                } else {
                    end++;
                }
            }
            return text.length();
        }
        char quote = text.charAt(i);
        int end = i + 1;
        while (end < text.length()) {
            char c = text.charAt(end);
            if (c == '\\') {
                end += 2;
                continue;
            }
            end++;
            if (c == quote || c == '\n') {
                break;
            }
        }
        return Math.min(end, text.length());
    }
}
