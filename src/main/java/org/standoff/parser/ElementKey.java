package org.standoff.parser;

import java.util.Locale;

/**
 * An element name, optionally qualified by one of its attributes. The empty attribute
 * stands for the element itself.
 *
 * @param element The lower-cased element name.
 * @param attribute The lower-cased attribute name, or the empty string.
 */
public record ElementKey(String element, String attribute) {

    /** Separates element and attribute in the configuration syntax. */
    public static final String ATTRIBUTE_SEPARATOR = ":";

    public ElementKey {
        if (element == null || element.isBlank()) {
            throw new IllegalArgumentException("Element name must not be empty");
        }
        element = element.toLowerCase(Locale.ROOT);
        attribute = attribute == null ? "" : attribute.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses {@code element[:attribute]}. Only the first separator splits.
     *
     * @param spec The element specification.
     * @return The parsed key.
     */
    public static ElementKey parse(String spec) {
        String trimmed = spec.trim();
        int ix = trimmed.indexOf(ATTRIBUTE_SEPARATOR);
        if (ix < 0) {
            return new ElementKey(trimmed, "");
        }
        return new ElementKey(trimmed.substring(0, ix), trimmed.substring(ix + 1));
    }

    public static ElementKey element(String element) {
        return new ElementKey(element, "");
    }

    public boolean isElement() {
        return attribute.isEmpty();
    }

    @Override
    public String toString() {
        return attribute.isEmpty() ? element : element + ATTRIBUTE_SEPARATOR + attribute;
    }
}
