package org.standoff.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The validated, immutable configuration of a {@link PseudoXmlParser}.
 * <p>
 * Configuration strings ({@code element[:attribute]}, {@code +}-joined groups) are parsed once
 * by the {@link Builder}; overlapping skip and annotate sets are rejected when the configuration
 * is built, before any document is read.
 */
public final class ParserConfig {

    /** Default name of the metadata element whose contents are not anchored. */
    public static final String DEFAULT_HEADER_ELEMENT = "teiheader";

    /** Joins several elements feeding the same group. */
    public static final String GROUP_SEPARATOR = "+";

    private final Map<ElementKey, String> annotations;
    private final Set<ElementKey> skipped;
    private final Map<String, Set<String>> overlaps;
    private final String headerElement;

    private ParserConfig(Builder builder) {
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.annotations));
        this.skipped = Collections.unmodifiableSet(new LinkedHashSet<>(builder.skipped));
        Map<String, Set<String>> overlapCopy = new HashMap<>();
        builder.overlaps.forEach((k, v) -> overlapCopy.put(k, Collections.unmodifiableSet(new HashSet<>(v))));
        this.overlaps = Collections.unmodifiableMap(overlapCopy);
        this.headerElement = builder.headerElement;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the annotation store a key is recorded in.
     * @param key An element or element attribute.
     * @return The store name, or {@code null} if the key is not annotated.
     */
    public String annotationFor(ElementKey key) {
        return annotations.get(key);
    }

    public boolean isAnnotated(ElementKey key) {
        return annotations.containsKey(key);
    }

    public boolean isSkipped(ElementKey key) {
        return skipped.contains(key);
    }

    /**
     * Checks whether closing {@code closing} while {@code open} is still open is an expected overlap.
     */
    public boolean canOverlap(String closing, String open) {
        return overlaps.getOrDefault(closing, Set.of()).contains(open);
    }

    /**
     * Returns the distinct annotation store names, in configuration order.
     */
    public Set<String> annotationNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(annotations.values()));
    }

    public Map<ElementKey, String> annotations() {
        return annotations;
    }

    public Set<ElementKey> skipped() {
        return skipped;
    }

    public String headerElement() {
        return headerElement;
    }

    /**
     * Builds a {@link ParserConfig}.
     */
    public static final class Builder {

        private final Map<ElementKey, String> annotations = new LinkedHashMap<>();
        private final Set<ElementKey> skipped = new LinkedHashSet<>();
        private final Map<String, Set<String>> overlaps = new HashMap<>();
        private String headerElement = DEFAULT_HEADER_ELEMENT;

        private Builder() {
        }

        /**
         * Records every element of a {@code +}-joined group in the given annotation store.
         *
         * @param elementGroup For example {@code "s"}, {@code "w:pos"} or {@code "head+p"}.
         * @param annotation The store name.
         * @return this builder.
         */
        public Builder annotate(String elementGroup, String annotation) {
            if (annotation == null || annotation.isBlank()) {
                throw new IllegalArgumentException("Annotation name must not be empty for: " + elementGroup);
            }
            for (String element : splitGroup(elementGroup)) {
                annotations.put(ElementKey.parse(element), annotation);
            }
            return this;
        }

        /**
         * Pairs two parallel lists, as given on a command line.
         */
        public Builder annotate(List<String> elementGroups, List<String> annotationNames) {
            if (elementGroups.size() != annotationNames.size()) {
                throw new IllegalArgumentException(String.format(
                        "elements and annotations must be the same length (%d != %d)",
                        elementGroups.size(), annotationNames.size()));
            }
            for (int i = 0; i < elementGroups.size(); i++) {
                annotate(elementGroups.get(i), annotationNames.get(i));
            }
            return this;
        }

        public Builder skip(String element) {
            skipped.add(ElementKey.parse(element));
            return this;
        }

        public Builder skip(List<String> elements) {
            elements.forEach(this::skip);
            return this;
        }

        /**
         * Declares that the elements of a {@code +}-joined group may overlap each other.
         */
        public Builder overlap(String elementGroup) {
            List<String> names = splitGroup(elementGroup).stream()
                    .map(n -> n.toLowerCase(Locale.ROOT))
                    .toList();
            for (String first : names) {
                for (String second : names) {
                    if (!first.equals(second)) {
                        overlaps.computeIfAbsent(first, k -> new HashSet<>()).add(second);
                    }
                }
            }
            return this;
        }

        public Builder overlap(List<String> elementGroups) {
            elementGroups.forEach(this::overlap);
            return this;
        }

        public Builder headerElement(String headerElement) {
            if (headerElement == null || headerElement.isBlank()) {
                throw new IllegalArgumentException("Header element must not be empty");
            }
            this.headerElement = headerElement.toLowerCase(Locale.ROOT);
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return The configuration.
         * @throws IllegalArgumentException if an element is both skipped and annotated.
         */
        public ParserConfig build() {
            Set<ElementKey> both = new LinkedHashSet<>(skipped);
            both.retainAll(annotations.keySet());
            if (!both.isEmpty()) {
                throw new IllegalArgumentException("skip and elements must be disjoint, both contain: " + both);
            }
            return new ParserConfig(this);
        }

        private static List<String> splitGroup(String group) {
            if (group == null || group.isBlank()) {
                throw new IllegalArgumentException("Empty element group");
            }
            return List.of(group.trim().split("\\" + GROUP_SEPARATOR));
        }
    }
}
