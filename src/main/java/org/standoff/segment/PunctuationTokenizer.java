package org.standoff.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A simple sentence splitter that ends a sentence after every {@code .}, {@code !} or
 * {@code ?} and the whitespace following it, regardless of context. Meant for text that
 * lacks the whitespace a statistical sentence splitter relies on.
 */
public class PunctuationTokenizer implements SpanTokenizer {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s*", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public List<TextSpan> spanTokenize(String text) {
        List<TextSpan> result = new ArrayList<>();
        Integer sentenceStart = null;
        for (TextSpan gap : RegexpTokenizer.gapSpans(SENTENCE_END, text)) {
            if (sentenceStart != null) {
                result.add(new TextSpan(sentenceStart, gap.start()));
            }
            sentenceStart = gap.start();
        }
        result.add(new TextSpan(sentenceStart == null ? 0 : sentenceStart, text.length()));
        return result;
    }
}
