package org.standoff.parser;

import org.standoff.markup.Attribute;
import org.standoff.markup.SourceLocation;

import java.util.List;

/**
 * An element whose start tag has been seen but whose end tag has not.
 *
 * @param name The element name.
 * @param attributes The attributes, followed by the implicit empty attribute.
 * @param startAnchor The anchor at the position of the start tag.
 * @param location Where the start tag was found.
 */
record OpenElement(String name, List<Attribute> attributes, String startAnchor, SourceLocation location) {

    String describe() {
        return "<" + name + "> [" + startAnchor + ":]";
    }
}
