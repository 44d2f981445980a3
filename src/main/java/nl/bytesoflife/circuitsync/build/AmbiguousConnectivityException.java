package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.CircuitSyncException;
import nl.bytesoflife.circuitsync.model.Position;

import java.util.Collection;
import java.util.List;

/**
 * Wiring on a sheet that cannot be turned into one consistent set of nets, for example one wire
 * group carrying two different label names.
 */
public class AmbiguousConnectivityException extends CircuitSyncException {

    private final String fileName;
    private final Position position;
    private final List<String> names;

    public AmbiguousConnectivityException(String fileName, Position position, Collection<String> names, String detail) {
        super(detail + " in " + fileName + (position != null ? " at (" + position.x() + ", " + position.y() + ")" : "")
                + (names.isEmpty() ? "" : ": " + String.join(", ", names)));
        this.fileName = fileName;
        this.position = position;
        this.names = List.copyOf(names);
    }

    public String getFileName() {
        return fileName;
    }

    public Position getPosition() {
        return position;
    }

    public List<String> getNames() {
        return names;
    }
}
