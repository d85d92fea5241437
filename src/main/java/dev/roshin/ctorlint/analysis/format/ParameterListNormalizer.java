package dev.roshin.ctorlint.analysis.format;

import com.google.common.base.CharMatcher;
import dev.roshin.ctorlint.analysis.config.FormatOptions;
import dev.roshin.ctorlint.analysis.model.ConstructorDeclaration;
import dev.roshin.ctorlint.analysis.model.Parameter;
import dev.roshin.ctorlint.analysis.model.Trivia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes the indentation of wrapped parameters for nodes flagged as needing formatting.
 * <p>
 * Only leading trivia made of whitespace and at least one line break is touched. The number
 * of line breaks is kept, so normalizing never changes which line a parameter ends on
 * relative to its neighbours.
 */
public class ParameterListNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ParameterListNormalizer.class);

    private static final CharMatcher LINE_BREAK = CharMatcher.anyOf("\r\n");
    private static final CharMatcher HORIZONTAL_SPACE = CharMatcher.anyOf(" \t\f");

    private final FormatOptions options;

    public ParameterListNormalizer() {
        this(FormatOptions.DEFAULT);
    }

    public ParameterListNormalizer(FormatOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Returns the node with wrapped parameters re-indented and the formatting flag cleared.
     * Nodes without the flag are returned as they are.
     */
    public ConstructorDeclaration normalize(ConstructorDeclaration constructor) {
        if (!constructor.formattingRequested()) {
            return constructor;
        }
        List<Parameter> parameters = constructor.parameters();
        if (parameters.isEmpty()) {
            return constructor.withFormattingRequested(false);
        }

        String indentation = indentationFor(constructor);
        log.debug("Indenting wrapped parameters of {} with {} columns", constructor.signature(), indentation.length());

        List<Parameter> normalized = new ArrayList<>(parameters.size());
        normalized.add(parameters.get(0));
        for (int i = 1; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            Trivia trivia = parameter.leadingTrivia();
            if (trivia.isWhitespace() && trivia.containsLineBreak()) {
                normalized.add(parameter.withLeadingTrivia(reindent(trivia, indentation)));
            } else {
                normalized.add(parameter);
            }
        }

        return constructor
                .withParameters(normalized)
                .withFormattingRequested(false);
    }

    private String indentationFor(ConstructorDeclaration constructor) {
        Trivia firstLeading = constructor.parameters().get(0).leadingTrivia();

        if (firstLeading.containsLineBreak()) {
            // First parameter already sits on its own line: follow it
            return leadingWhitespace(lastLine(firstLeading.text()));
        }

        String headerLine = lastLine(constructor.leadingTrivia().text() + constructor.header());
        if (options.alignWithFirstParameter()) {
            return blankOut(headerLine + firstLeading.text());
        }
        return leadingWhitespace(headerLine) + " ".repeat(options.continuationIndent());
    }

    /**
     * Keeps the line breaks of {@code trivia} and ends it with {@code indentation}.
     */
    private static Trivia reindent(Trivia trivia, String indentation) {
        String text = trivia.text();
        int lastBreak = LINE_BREAK.lastIndexIn(text);
        String breaks = HORIZONTAL_SPACE.removeFrom(text.substring(0, lastBreak + 1));
        return new Trivia(breaks + indentation);
    }

    private static String lastLine(String text) {
        return text.substring(LINE_BREAK.lastIndexIn(text) + 1);
    }

    private static String leadingWhitespace(String line) {
        int end = HORIZONTAL_SPACE.negate().indexIn(line);
        return end < 0 ? line : line.substring(0, end);
    }

    /**
     * Same visual width as {@code text}: tabs are kept, everything else becomes a space.
     */
    private static String blankOut(String text) {
        StringBuilder blank = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            blank.append(text.charAt(i) == '\t' ? '\t' : ' ');
        }
        return blank.toString();
    }
}
