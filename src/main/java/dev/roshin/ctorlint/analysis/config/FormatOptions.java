package dev.roshin.ctorlint.analysis.config;

/**
 * Settings of the parameter list normalizer.
 *
 * @param continuationIndent      Spaces added to the header line's indentation for wrapped
 *                                parameters when they are not aligned. Default: 8
 * @param alignWithFirstParameter Align wrapped parameters under the first one when it shares
 *                                the line of the opening parenthesis. Default: true
 */
public record FormatOptions(
        int continuationIndent,
        boolean alignWithFirstParameter
) {
    /**
     * Default formatting: align under the first parameter, 8-space continuation otherwise.
     */
    public static final FormatOptions DEFAULT = new FormatOptions(8, true);

    public FormatOptions {
        if (continuationIndent < 0) {
            throw new IllegalArgumentException(
                    "continuationIndent must not be negative, got: " + continuationIndent
            );
        }
    }

    public FormatOptions withContinuationIndent(int indent) {
        return new FormatOptions(indent, alignWithFirstParameter);
    }

    public FormatOptions withAlignment(boolean align) {
        return new FormatOptions(continuationIndent, align);
    }
}
