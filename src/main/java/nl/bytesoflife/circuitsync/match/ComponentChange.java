package nl.bytesoflife.circuitsync.match;

/**
 * Attribute of a matched component that differs between the files and the description.
 */
public enum ComponentChange {
    VALUE,
    FOOTPRINT,
    LIBRARY,
    REFERENCE,
    /** The description moved or rotated the component explicitly. */
    PLACEMENT
}
