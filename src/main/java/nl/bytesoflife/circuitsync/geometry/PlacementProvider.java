package nl.bytesoflife.circuitsync.geometry;

import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.Position;
import org.locationtech.jts.geom.Envelope;

import java.util.List;
import java.util.Map;

/**
 * Chooses positions for components that have none yet. Results are keyed by
 * {@link Component#getKey()}.
 */
public interface PlacementProvider {

    Map<String, Position> place(List<Component> components, List<Connection> connections,
                                double boardWidth, double boardHeight);

    /**
     * Same as {@link #place(List, List, double, double)} but avoids areas already in use.
     */
    default Map<String, Position> place(List<Component> components, List<Connection> connections,
                                        double boardWidth, double boardHeight, List<Envelope> occupied) {
        return place(components, connections, boardWidth, boardHeight);
    }

    /**
     * Two components joined by at least one net.
     */
    record Connection(String from, String to) {}
}
