package nl.bytesoflife.circuitsync.geometry;

import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.Position;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeometryTest {

    @Test
    void segmentContainment() {
        Segment segment = new Segment(new Position(0, 0), new Position(10, 0));
        assertTrue(segment.contains(new Position(0, 0)));
        assertTrue(segment.containsInInterior(new Position(5, 0)));
        assertFalse(segment.containsInInterior(new Position(10, 0)));
        assertFalse(segment.contains(new Position(5, 1)));
    }

    @Test
    void segmentConnections() {
        Segment horizontal = new Segment(new Position(0, 0), new Position(10, 0));
        assertFalse(horizontal.connectsTo(new Segment(new Position(5, -5), new Position(5, 5))), "crossing");
        assertTrue(horizontal.connectsTo(new Segment(new Position(5, 0), new Position(5, 5))), "tee");
        assertTrue(horizontal.connectsTo(new Segment(new Position(10, 0), new Position(10, 5))), "corner");
        assertFalse(horizontal.connectsTo(new Segment(new Position(0, 1), new Position(10, 1))), "parallel");
    }

    @Test
    void pinTransformFlipsYAndRotates() {
        Position origin = new Position(100, 100);
        assertEquals(new Position(100, 96.19), PinTransform.toSheet(origin, 0, null, 0, 3.81));
        assertEquals(new Position(96.19, 100), PinTransform.toSheet(origin, 90, null, 0, 3.81));
        assertEquals(new Position(100, 103.81), PinTransform.toSheet(origin, 180, null, 0, 3.81));
        assertEquals(new Position(103.81, 100), PinTransform.toSheet(origin, 0, "y", -3.81, 0));
    }

    @Test
    void gridPlacementFillsRows() {
        List<Component> components = List.of(new Component("R1"), new Component("R2"));
        Map<String, Position> placed = new GridPlacement().place(components, List.of(), 297, 210);

        assertEquals(new Position(25.4, 25.4), placed.get("R1"));
        assertEquals(new Position(50.8, 25.4), placed.get("R2"));
    }

    @Test
    void gridPlacementSkipsOccupiedCells() {
        List<Component> components = List.of(new Component("R1"));
        List<Envelope> occupied = List.of(new Envelope(20, 30, 20, 30));
        Map<String, Position> placed = new GridPlacement().place(components, List.of(), 297, 210, occupied);

        assertEquals(new Position(50.8, 25.4), placed.get("R1"));
    }

    @Test
    void spatialIndexAcceptsInsertsAfterQuery() {
        SpatialIndex<String> index = new SpatialIndex<>();
        index.insert(new Position(1, 1), "a");
        assertEquals(List.of("a"), index.queryNeighbors(new Position(1, 1), 0.01));
        index.insert(new Position(5, 5), "b");
        assertEquals(List.of("b"), index.queryNeighbors(new Position(5, 5), 0.01));
        assertEquals(2, index.size());
    }
}
