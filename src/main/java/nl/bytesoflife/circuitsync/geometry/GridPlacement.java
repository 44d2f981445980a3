package nl.bytesoflife.circuitsync.geometry;

import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.Position;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places new components row by row on a fixed grid, skipping cells that already hold something.
 */
public class GridPlacement implements PlacementProvider {

    private static final Logger log = LoggerFactory.getLogger(GridPlacement.class);

    public static final double DEFAULT_CELL = 25.4;
    public static final double DEFAULT_MARGIN = 12.7;

    private final double cellSize;
    private final double margin;

    public GridPlacement() {
        this(DEFAULT_CELL, DEFAULT_MARGIN);
    }

    public GridPlacement(double cellSize, double margin) {
        if (cellSize <= 0) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellSize);
        }
        this.cellSize = cellSize;
        this.margin = margin;
    }

    @Override
    public Map<String, Position> place(List<Component> components, List<Connection> connections,
                                       double boardWidth, double boardHeight) {
        return place(components, connections, boardWidth, boardHeight, List.of());
    }

    @Override
    public Map<String, Position> place(List<Component> components, List<Connection> connections,
                                       double boardWidth, double boardHeight, List<Envelope> occupied) {
        SpatialIndex<Envelope> index = new SpatialIndex<>();
        for (Envelope envelope : occupied) {
            index.insert(envelope, envelope);
        }
        int columns = Math.max(1, (int) Math.floor((boardWidth - 2 * margin) / cellSize));
        int rows = Math.max(1, (int) Math.floor((boardHeight - 2 * margin) / cellSize));

        Map<String, Position> result = new LinkedHashMap<>();
        int cell = 0;
        for (Component component : components) {
            while (isOccupied(index, cell, columns)) {
                cell++;
            }
            if (cell / columns >= rows) {
                log.warn("Sheet is full, placing {} below the drawing area", component.getKey());
            }
            Position position = center(cell, columns);
            result.put(component.getKey(), position);
            index.insert(cellEnvelope(cell, columns), cellEnvelope(cell, columns));
            cell++;
        }
        return result;
    }

    private boolean isOccupied(SpatialIndex<Envelope> index, int cell, int columns) {
        Envelope area = cellEnvelope(cell, columns);
        for (Envelope envelope : index.query(area)) {
            if (envelope.intersects(area)) return true;
        }
        return false;
    }

    private Envelope cellEnvelope(int cell, int columns) {
        Position center = center(cell, columns);
        double half = cellSize / 2 - Position.GRID;
        return new Envelope(center.x() - half, center.x() + half, center.y() - half, center.y() + half);
    }

    private Position center(int cell, int columns) {
        int column = cell % columns;
        int row = cell / columns;
        return new Position(margin + cellSize * (column + 0.5), margin + cellSize * (row + 0.5)).snapToGrid();
    }
}
