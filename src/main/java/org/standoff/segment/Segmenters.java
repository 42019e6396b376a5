package org.standoff.segment;

import java.util.Arrays;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The built-in tokenizers, by name.
 */
public enum Segmenters {

    WHITESPACE("whitespace", () -> new RegexpTokenizer("\\s+", true)),
    LINEBREAKS("linebreaks", () -> new RegexpTokenizer("\\s*\\n\\s*", true)),
    BLANKLINES("blanklines", () -> new RegexpTokenizer("\\s*\\n\\s*\\n\\s*", true)),
    PUNCTUATION("punctuation", PunctuationTokenizer::new),
    PUNKT_WORD("punkt_word", PunktWordTokenizer::new);

    private final String segmenterName;
    private final Supplier<SpanTokenizer> factory;

    Segmenters(String segmenterName, Supplier<SpanTokenizer> factory) {
        this.segmenterName = segmenterName;
        this.factory = factory;
    }

    public String segmenterName() {
        return segmenterName;
    }

    public SpanTokenizer create() {
        return factory.get();
    }

    /**
     * Creates the tokenizer registered under {@code name}.
     *
     * @param name A segmenter name, e.g. {@code whitespace}.
     * @return A new tokenizer.
     * @throws IllegalArgumentException if no segmenter has that name.
     */
    public static SpanTokenizer byName(String name) {
        for (Segmenters segmenter : values()) {
            if (segmenter.segmenterName.equals(name)) {
                return segmenter.create();
            }
        }
        throw new IllegalArgumentException("Unknown segmenter '" + name + "'. Available segmenters: " + available());
    }

    public static String available() {
        return Arrays.stream(values()).map(Segmenters::segmenterName).sorted().collect(Collectors.joining(", "));
    }
}
