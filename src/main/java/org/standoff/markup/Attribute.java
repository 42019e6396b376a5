package org.standoff.markup;

/**
 * An attribute of a start tag, with its references already resolved.
 *
 * @param name The lower-cased attribute name.
 * @param value The value, empty when the attribute was written without one.
 */
public record Attribute(String name, String value) {
}
