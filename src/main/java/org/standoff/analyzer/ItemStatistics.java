package org.standoff.analyzer;

import org.standoff.markup.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Frequency, first occurrence per file and attribute names of one analyzed item
 * (an element, a character or a reference).
 */
public class ItemStatistics {

    private long frequency;
    private final Map<String, SourceLocation> firstOccurrence = new LinkedHashMap<>();
    private final Set<String> attributes = new TreeSet<>();

    void record(String document, SourceLocation location) {
        frequency++;
        firstOccurrence.putIfAbsent(document, location);
    }

    void addAttribute(String attribute) {
        attributes.add(attribute);
    }

    public long frequency() {
        return frequency;
    }

    /**
     * Returns, per document, where the item was first seen.
     */
    public Map<String, SourceLocation> firstOccurrence() {
        return Collections.unmodifiableMap(firstOccurrence);
    }

    public Set<String> attributes() {
        return Collections.unmodifiableSet(attributes);
    }
}
