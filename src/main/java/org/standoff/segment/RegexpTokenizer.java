package org.standoff.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A tokenizer driven by a regular expression, which either matches the tokens themselves
 * or, with {@code gaps}, the separators between them. Patterns given as strings are compiled
 * with Unicode character classes, so {@code \s} also matches e.g. the no-break space.
 */
public class RegexpTokenizer implements SpanTokenizer {

    private final Pattern pattern;
    private final boolean gaps;

    public RegexpTokenizer(String regex, boolean gaps) {
        this(Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS), gaps);
    }

    public RegexpTokenizer(Pattern pattern, boolean gaps) {
        this.pattern = pattern;
        this.gaps = gaps;
    }

    @Override
    public List<TextSpan> spanTokenize(String text) {
        if (gaps) {
            return gapSpans(pattern, text);
        }
        List<TextSpan> spans = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            spans.add(new TextSpan(matcher.start(), matcher.end()));
        }
        return spans;
    }

    /**
     * Returns the spans between the matches of {@code separator}. Empty spans are dropped,
     * except the final one.
     *
     * @param separator The separator pattern.
     * @param text The string to split.
     * @return The spans between separators.
     */
    static List<TextSpan> gapSpans(Pattern separator, String text) {
        List<TextSpan> spans = new ArrayList<>();
        int left = 0;
        Matcher matcher = separator.matcher(text);
        while (matcher.find()) {
            if (matcher.start() != left) {
                spans.add(new TextSpan(left, matcher.start()));
            }
            left = matcher.end();
        }
        spans.add(new TextSpan(left, text.length()));
        return spans;
    }
}
