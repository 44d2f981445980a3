package nl.bytesoflife.circuitsync;

/**
 * Base class of every error raised while synchronizing a circuit with its KiCad files.
 */
public class CircuitSyncException extends RuntimeException {

    public CircuitSyncException(String message) {
        super(message);
    }

    public CircuitSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
