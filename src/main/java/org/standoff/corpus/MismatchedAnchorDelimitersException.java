package org.standoff.corpus;

import java.io.IOException;

/**
 * Thrown when a corpus text contains an anchor delimiter that is neither doubled nor
 * closed by a matching delimiter.
 */
public class MismatchedAnchorDelimitersException extends IOException {

    private final int offset;

    /**
     * Constructs a new exception.
     * @param source A description of the corpus text, usually its file name.
     * @param offset The offset of the unmatched delimiter in the encoded text.
     */
    public MismatchedAnchorDelimitersException(String source, int offset) {
        super(String.format("Mismatched anchor delimiters in corpus text %s at offset %d: %s",
                source, offset, CorpusTextCodec.DELIMITER));
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
