package org.standoff.anchor;

import org.apache.commons.math3.random.Well19937c;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Deterministic generator of short, collision-free hexadecimal identifiers, backed by
 * Apache Commons Math {@link Well19937c}.
 * <p>
 * One generator belongs to one document: it is seeded from a string (normally the document
 * prefix) so that parsing the same document twice yields the same anchors, independently of
 * whatever else the process has parsed before. Instances are not thread-safe.
 */
public final class IdentifierGenerator {

    /** Identifier width used before {@link #reset(String, long)} sizes it for a document. */
    public static final int DEFAULT_LENGTH = 10;

    private static final char EDGE_SEPARATOR = ':';
    private static final char SPAN_SEPARATOR = '-';

    private Well19937c rng;
    private int length = DEFAULT_LENGTH;

    /**
     * Creates a generator seeded with the given string.
     * @param seed The seed, usually the document prefix.
     */
    public IdentifierGenerator(String seed) {
        this.rng = new Well19937c(hashString(seed));
    }

    /**
     * Creates a generator seeded with the given string and sized for {@code maxIdentifiers}.
     * @param seed The seed, usually the document prefix.
     * @param maxIdentifiers Upper bound of identifiers the document may need.
     */
    public IdentifierGenerator(String seed, long maxIdentifiers) {
        this(seed);
        reset(seed, maxIdentifiers);
    }

    /**
     * Re-seeds the generator and sizes the identifier width so that {@code maxIdentifiers}
     * draws are unlikely to collide. The width is {@code floor(log16(maxIdentifiers) + 1.5)}.
     *
     * @param seed The new seed.
     * @param maxIdentifiers Upper bound of identifiers; values below 1 keep the current width.
     */
    public void reset(String seed, long maxIdentifiers) {
        if (maxIdentifiers > 0) {
            int width = (int) (Math.log(maxIdentifiers) / Math.log(16) + 1.5);
            this.length = Math.max(1, Math.min(15, width));
        }
        this.rng = new Well19937c(hashString(seed));
    }

    /**
     * Returns the number of hex digits of each generated identifier, excluding the prefix.
     * @return The identifier width.
     */
    public int length() {
        return length;
    }

    /**
     * Draws a fresh identifier. The separator characters of the edge encoding are removed from
     * the prefix. The result is not added to {@code existing}; that is the caller's job.
     *
     * @param prefix A prefix put in front of the random digits.
     * @param existing Identifiers already in use.
     * @return An identifier not contained in {@code existing}.
     */
    public String newIdentifier(String prefix, Set<String> existing) {
        String safePrefix = stripSeparators(prefix);
        long mask = (1L << (length * 4)) - 1;
        while (true) {
            long bits = rng.nextLong() & mask;
            String identifier = safePrefix + String.format("%0" + length + "x", bits);
            if (!existing.contains(identifier)) {
                return identifier;
            }
        }
    }

    private static String stripSeparators(String prefix) {
        if (prefix == null) return "";
        StringBuilder sb = new StringBuilder(prefix.length());
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (c != EDGE_SEPARATOR && c != SPAN_SEPARATOR) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Hashes a string using the FNV-1a 64-bit algorithm.
     * @param s The string to hash.
     * @return The hashed value.
     */
    private static long hashString(String s) {
        if (s == null) return 0L;
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        long h = 1469598103934665603L; // FNV-1a 64-bit offset basis
        for (byte value : b) {
            h ^= (value & 0xFF);
            h *= 1099511628211L; // FNV-1a prime
        }
        return h;
    }
}
