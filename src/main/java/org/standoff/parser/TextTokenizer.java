package org.standoff.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits character data into the units between which anchors may be placed: maximal runs of
 * letters, maximal runs of decimal digits, runs of spaces, and single other characters (including
 * single newlines and tabs). Numeric characters that are not decimal digits, such as {@code ²}
 * or Roman numerals, belong to letter runs.
 */
public final class TextTokenizer {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{Nl}\\p{No}]+|\\p{Nd}+| +|\\s|.", Pattern.DOTALL);

    private TextTokenizer() {
        // Private constructor to prevent instantiation
    }

    /**
     * Tokenizes a piece of text. The concatenation of the result is always the input.
     *
     * @param content The text to split.
     * @return The non-empty tokens, in order.
     */
    public static List<String> tokenize(String content) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(content);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
