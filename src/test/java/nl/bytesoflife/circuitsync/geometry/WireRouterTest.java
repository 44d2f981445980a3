package nl.bytesoflife.circuitsync.geometry;

import nl.bytesoflife.circuitsync.model.Position;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WireRouterTest {

    private static final Position A = new Position(0, 0);
    private static final Position B = new Position(10.16, 0);

    private static Set<String> own(Position... points) {
        return Arrays.stream(points).map(Position::key).collect(Collectors.toSet());
    }

    @Test
    void routesStraightWhenAligned() {
        List<Segment> route = new WireRouter().route(A, B, own(A, B)).orElseThrow();
        assertEquals(List.of(new Segment(A, B)), route);
    }

    @Test
    void routesLShapeHorizontalFirst() {
        Position c = new Position(10.16, 7.62);
        List<Segment> route = new WireRouter().route(A, c, own(A, c)).orElseThrow();
        assertEquals(2, route.size());
        assertEquals(new Position(10.16, 0), route.get(0).end());
    }

    @Test
    void detoursAroundForeignPoint() {
        WireRouter router = new WireRouter().addObstacle(new Position(5.08, 0));
        List<Segment> route = router.route(A, B, own(A, B)).orElseThrow();

        assertEquals(3, route.size());
        assertEquals(-2.54, route.get(1).start().y(), 1e-9);
        assertEquals(-2.54, route.get(1).end().y(), 1e-9);
    }

    @Test
    void ownPointsDoNotBlock() {
        Position middle = new Position(5.08, 0);
        WireRouter router = new WireRouter().addObstacle(middle);
        List<Segment> route = router.route(A, B, own(A, B, middle)).orElseThrow();
        assertEquals(1, route.size());
    }

    @Test
    void plainCrossingIsAllowed() {
        WireRouter router = new WireRouter().addWire(new Segment(new Position(5.08, -5.08), new Position(5.08, 5.08)));
        List<Segment> route = router.route(A, B, own(A, B)).orElseThrow();
        assertEquals(1, route.size());
    }

    @Test
    void touchingForeignWireIsNotAllowed() {
        WireRouter router = new WireRouter().addWire(new Segment(new Position(5.08, 0), new Position(5.08, 5.08)));
        List<Segment> route = router.route(A, B, own(A, B)).orElseThrow();

        assertEquals(3, route.size());
        for (Segment segment : route) {
            assertFalse(segment.contains(new Position(5.08, 0)));
        }
    }

    @Test
    void freePointAvoidsOccupiedSpot() {
        Position taken = new Position(25.4, 25.4);
        WireRouter router = new WireRouter().addObstacle(taken);

        Position free = router.findFreePoint(taken, Set.of());
        assertFalse(free.sameAs(taken));
        assertTrue(router.isFree(free, Set.of()));
        assertEquals(2.54, Math.max(Math.abs(free.x() - taken.x()), Math.abs(free.y() - taken.y())), 1e-9);
    }
}
