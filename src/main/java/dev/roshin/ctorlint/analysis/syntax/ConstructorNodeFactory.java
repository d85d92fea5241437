package dev.roshin.ctorlint.analysis.syntax;

import dev.roshin.ctorlint.analysis.model.ConstructorDeclaration;
import dev.roshin.ctorlint.analysis.model.Parameter;
import dev.roshin.ctorlint.analysis.model.SourceSpan;
import dev.roshin.ctorlint.analysis.model.Trivia;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds {@link ConstructorDeclaration} nodes from document text.
 */
public class ConstructorNodeFactory {

    private final ParameterListScanner scanner = new ParameterListScanner();

    /**
     * Creates the node for the constructor named {@code constructorName} whose declaration
     * starts at or after {@code searchFrom}.
     *
     * @param text            the whole document
     * @param lineMap         line map of {@code text}
     * @param searchFrom      offset at or before the constructor name; when it lies on the
     *                        name's line the header starts there
     * @param constructorName simple name of the declaring type
     * @param declaringType   qualified name of the declaring type
     * @return empty when no parameter list follows the name (e.g., compact record constructors)
     */
    public Optional<ConstructorDeclaration> create(String text,
                                                   LineMap lineMap,
                                                   int searchFrom,
                                                   String constructorName,
                                                   String declaringType) {
        Optional<ParameterListScanner.Result> scanned = scanner.scan(text, searchFrom, constructorName);
        if (scanned.isEmpty()) {
            return Optional.empty();
        }
        ParameterListScanner.Result result = scanned.get();

        int lineStart = lineMap.lineStartOf(result.nameOffset());
        // Another declaration may end earlier on the same line
        int headerStart = Math.max(lineStart, searchFrom);
        while (headerStart < result.nameOffset() && isHorizontalSpace(text.charAt(headerStart))) {
            headerStart++;
        }

        List<Parameter> parameters = new ArrayList<>(result.parameters().size());
        int closingStart = result.openParen() + 1;
        for (ParameterListScanner.Slice slice : result.parameters()) {
            String parameterText = text.substring(slice.textStart(), slice.textEnd());
            parameters.add(new Parameter(
                    new Trivia(text.substring(slice.leadingStart(), slice.textStart())),
                    parameterText,
                    new Trivia(text.substring(slice.textEnd(), slice.trailingEnd())),
                    parameterName(parameterText)
            ));
            closingStart = slice.textEnd();
        }

        return Optional.of(new ConstructorDeclaration(
                declaringType,
                new Trivia(text.substring(lineStart, headerStart)),
                text.substring(headerStart, result.openParen() + 1),
                parameters,
                new Trivia(text.substring(closingStart, result.closeParen())),
                new SourceSpan(lineMap.pointAt(headerStart), lineMap.pointAt(result.closeParen() + 1)),
                false
        ));
    }

    /**
     * The declared name: the last identifier of the parameter text, array dimensions skipped.
     */
    static String parameterName(String parameterText) {
        int end = parameterText.length();
        while (end > 0) {
            char c = parameterText.charAt(end - 1);
            if (Character.isWhitespace(c) || c == '[' || c == ']') {
                end--;
            } else {
                break;
            }
        }
        int start = end;
        while (start > 0 && Character.isJavaIdentifierPart(parameterText.charAt(start - 1))) {
            start--;
        }
        return start < end ? parameterText.substring(start, end) : parameterText;
    }

    private static boolean isHorizontalSpace(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }
}
