package nl.bytesoflife.circuitsync.model;

import nl.bytesoflife.circuitsync.CircuitSyncException;

/**
 * A net membership names a component, pin or child sheet that does not exist.
 */
public class UnresolvedReferenceException extends CircuitSyncException {

    private final String netName;
    private final String reference;

    public UnresolvedReferenceException(String netName, String reference, String message) {
        super("Net '" + netName + "' references " + reference + ": " + message);
        this.netName = netName;
        this.reference = reference;
    }

    public String getNetName() {
        return netName;
    }

    public String getReference() {
        return reference;
    }
}
