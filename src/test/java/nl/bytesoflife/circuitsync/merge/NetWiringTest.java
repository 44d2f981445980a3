package nl.bytesoflife.circuitsync.merge;

import nl.bytesoflife.circuitsync.geometry.Segment;
import nl.bytesoflife.circuitsync.model.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetWiringTest {

    private static Position p(double x, double y) {
        return new Position(x, y);
    }

    @Test
    void starHubGetsJunction() {
        Position hub = p(25.4, 25.4);
        List<Position> pins = List.of(p(35.56, 25.4), p(25.4, 35.56), p(15.24, 25.4));
        List<Segment> wires = List.of(
                new Segment(hub, pins.get(0)),
                new Segment(hub, pins.get(1)),
                new Segment(hub, pins.get(2)));

        assertEquals(List.of(hub), NetWiring.junctionPoints(wires, pins));
    }

    @Test
    void twoPointWireHasNoJunction() {
        List<Position> pins = List.of(p(0, 0), p(10.16, 0));

        assertTrue(NetWiring.junctionPoints(List.of(new Segment(pins.get(0), pins.get(1))), pins).isEmpty());
    }

    @Test
    void teeOnWireInteriorGetsJunction() {
        List<Position> pins = List.of(p(0, 0), p(20.32, 0), p(10.16, 10.16));
        List<Segment> wires = List.of(
                new Segment(p(0, 0), p(20.32, 0)),
                new Segment(p(10.16, 0), p(10.16, 10.16)));

        assertEquals(List.of(p(10.16, 0)), NetWiring.junctionPoints(wires, pins));
    }

    @Test
    void bendIsNotAJunction() {
        List<Position> pins = List.of(p(0, 0), p(10.16, 10.16));
        List<Segment> wires = List.of(
                new Segment(p(0, 0), p(10.16, 0)),
                new Segment(p(10.16, 0), p(10.16, 10.16)));

        assertTrue(NetWiring.junctionPoints(wires, pins).isEmpty());
    }
}
