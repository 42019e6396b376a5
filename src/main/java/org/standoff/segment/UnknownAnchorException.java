package org.standoff.segment;

/**
 * Thrown when an edge refers to an anchor that the corpus text does not contain.
 */
public class UnknownAnchorException extends IllegalStateException {

    private final String anchor;

    /**
     * Constructs a new exception.
     * @param anchor The unresolvable anchor.
     * @param edge The edge that refers to it.
     */
    public UnknownAnchorException(String anchor, String edge) {
        super(String.format("Unknown anchor '%s' in edge %s", anchor, edge));
        this.anchor = anchor;
    }

    public String getAnchor() {
        return anchor;
    }
}
