package org.standoff.markup;

import java.util.List;

/**
 * Receives the markup events produced by {@link MarkupScanner}, in source order.
 */
public interface MarkupHandler {

    /**
     * A start tag {@code <name attr="value">}. Self-closing tags are reported as a start
     * tag immediately followed by {@link #endTag}.
     *
     * @param name The lower-cased element name.
     * @param attributes The attributes in source order.
     * @param location Where the tag starts.
     */
    void startTag(String name, List<Attribute> attributes, SourceLocation location);

    void endTag(String name, SourceLocation location);

    /**
     * Character data between markup. Literal {@code <}, {@code >} and {@code &} that do not
     * start a tag or a reference are part of the data.
     */
    void text(String data, SourceLocation location);

    /**
     * A numeric reference such as {@code &#228;} or {@code &#xE4;}.
     *
     * @param reference The part between {@code &#} and {@code ;}, e.g. {@code 228} or {@code xE4}.
     * @param location Where the reference starts.
     */
    void characterReference(String reference, SourceLocation location);

    void entityReference(String name, SourceLocation location);

    void comment(String comment, SourceLocation location);

    /**
     * The contents of a {@code <![CDATA[...]]>} section, taken literally.
     */
    default void cdata(String data, SourceLocation location) {
        text(data, location);
    }

    /**
     * A processing instruction; {@code data} is everything between {@code <?} and {@code >}.
     */
    default void processingInstruction(String data, SourceLocation location) {
    }

    /**
     * A declaration; {@code declaration} is everything between {@code <!} and {@code >}.
     */
    default void declaration(String declaration, SourceLocation location) {
    }
}
