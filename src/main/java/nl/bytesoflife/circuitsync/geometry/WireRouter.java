package nl.bytesoflife.circuitsync.geometry;

import nl.bytesoflife.circuitsync.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Orthogonal wire router for one schematic sheet. A route may touch only the connection points of
 * its own net; touching any other point or wire would join two nets.
 */
public class WireRouter {

    private static final Logger log = LoggerFactory.getLogger(WireRouter.class);

    public static final double STEP = 2.54;
    private static final int MAX_DETOUR_STEPS = 40;
    private static final double SEARCH = 1e-3;

    private final SpatialIndex<Position> points = new SpatialIndex<>();
    private final SpatialIndex<Segment> wires = new SpatialIndex<>();

    public WireRouter addObstacle(Position point) {
        points.insert(point, point);
        return this;
    }

    public WireRouter addObstacles(Collection<Position> obstacles) {
        for (Position point : obstacles) {
            addObstacle(point);
        }
        return this;
    }

    public WireRouter addWire(Segment wire) {
        wires.insert(wire, wire);
        return this;
    }

    public WireRouter addWires(Collection<Segment> newWires) {
        for (Segment wire : newWires) {
            addWire(wire);
        }
        return this;
    }

    /**
     * Finds a route from {@code from} to {@code to}: straight, then either L shape, then detours
     * through parallel channels in {@link #STEP} increments.
     *
     * @param own keys ({@link Position#key()}) of the points that belong to the net being routed
     */
    public Optional<List<Segment>> route(Position from, Position to, Set<String> own) {
        if (from.sameAs(to)) {
            return Optional.of(List.of());
        }
        for (List<Position> candidate : candidates(from, to)) {
            List<Segment> segments = toSegments(candidate);
            if (isClear(segments, own)) {
                return Optional.of(segments);
            }
        }
        log.debug("No clear route from {} to {}", from, to);
        return Optional.empty();
    }

    /**
     * True when a point can host a new item of the given net without touching anything else.
     */
    public boolean isFree(Position point, Set<String> own) {
        if (own.contains(point.key())) {
            return true;
        }
        for (Position obstacle : points.queryNeighbors(point, SEARCH)) {
            if (obstacle.sameAs(point)) return false;
        }
        for (Segment wire : wires.queryNeighbors(point, SEARCH)) {
            if (wire.contains(point)) return false;
        }
        return true;
    }

    /**
     * Nearest free grid point around {@code preferred}, searched in growing rings.
     */
    public Position findFreePoint(Position preferred, Set<String> own) {
        Position start = preferred.snapToGrid();
        if (isFree(start, own)) return start;
        for (int ring = 1; ring <= MAX_DETOUR_STEPS; ring++) {
            for (int dx = -ring; dx <= ring; dx++) {
                for (int dy = -ring; dy <= ring; dy++) {
                    if (Math.abs(dx) != ring && Math.abs(dy) != ring) continue;
                    Position candidate = start.translate(dx * STEP, dy * STEP).rounded();
                    if (isFree(candidate, own)) return candidate;
                }
            }
        }
        return start;
    }

    private List<List<Position>> candidates(Position a, Position b) {
        List<List<Position>> result = new ArrayList<>();
        if (sameCoordinate(a.x(), b.x()) || sameCoordinate(a.y(), b.y())) {
            result.add(List.of(a, b));
        } else {
            result.add(List.of(a, new Position(b.x(), a.y()), b));
            result.add(List.of(a, new Position(a.x(), b.y()), b));
        }
        for (int k = 1; k <= MAX_DETOUR_STEPS; k++) {
            for (int sign : new int[]{-1, 1}) {
                double channelY = a.y() + sign * k * STEP;
                result.add(List.of(a, new Position(a.x(), channelY).rounded(),
                        new Position(b.x(), channelY).rounded(), b));
            }
            for (int sign : new int[]{-1, 1}) {
                double channelX = a.x() + sign * k * STEP;
                result.add(List.of(a, new Position(channelX, a.y()).rounded(),
                        new Position(channelX, b.y()).rounded(), b));
            }
        }
        return result;
    }

    private static List<Segment> toSegments(List<Position> path) {
        List<Segment> segments = new ArrayList<>();
        for (int i = 1; i < path.size(); i++) {
            Segment segment = new Segment(path.get(i - 1), path.get(i));
            if (!segment.isDegenerate()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private boolean isClear(List<Segment> segments, Set<String> own) {
        for (Segment segment : segments) {
            for (Position point : points.queryNeighbors(segment, SEARCH)) {
                if (!own.contains(point.key()) && segment.contains(point)) {
                    return false;
                }
            }
            for (Segment wire : wires.queryNeighbors(segment, SEARCH)) {
                if (segment.connectsTo(wire)) {
                    return false;
                }
            }
        }
        // corners of the route itself must not double back over one another
        for (int i = 0; i < segments.size(); i++) {
            for (int j = i + 2; j < segments.size(); j++) {
                if (segments.get(i).connectsTo(segments.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean sameCoordinate(double a, double b) {
        return Math.abs(a - b) < 1e-4;
    }
}
