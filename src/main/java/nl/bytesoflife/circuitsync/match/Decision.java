package nl.bytesoflife.circuitsync.match;

/**
 * What the merge does with one element.
 */
public enum Decision {
    KEEP,
    UPDATE,
    ADD,
    REMOVE
}
