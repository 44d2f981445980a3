package nl.bytesoflife.circuitsync.model;

import nl.bytesoflife.circuitsync.CircuitSyncException;

/**
 * The same identity token or the same reference designator is used by two elements.
 */
public class IdentityConflictException extends CircuitSyncException {

    private final String identity;

    public IdentityConflictException(String identity, String first, String second) {
        super("Identity '" + identity + "' is used by both " + first + " and " + second);
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
