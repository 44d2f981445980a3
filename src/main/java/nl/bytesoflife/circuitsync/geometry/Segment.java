package nl.bytesoflife.circuitsync.geometry;

import nl.bytesoflife.circuitsync.model.Position;
import org.locationtech.jts.algorithm.LineIntersector;
import org.locationtech.jts.algorithm.RobustLineIntersector;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

/**
 * A straight wire segment between two sheet points.
 */
public record Segment(Position start, Position end) {

    private static final GeometryFactory FACTORY = new GeometryFactory();
    private static final double TOLERANCE = 1e-3;

    public double length() {
        return start.distanceTo(end);
    }

    public boolean isDegenerate() {
        return start.sameAs(end);
    }

    public LineString toLineString() {
        return FACTORY.createLineString(new Coordinate[]{toCoordinate(start), toCoordinate(end)});
    }

    public Envelope getEnvelope() {
        return new Envelope(start.x(), end.x(), start.y(), end.y());
    }

    public boolean hasEndpoint(Position point) {
        return start.sameAs(point) || end.sameAs(point);
    }

    /**
     * True when the point lies anywhere on the segment, endpoints included.
     */
    public boolean contains(Position point) {
        return toLineString().isWithinDistance(FACTORY.createPoint(toCoordinate(point)), TOLERANCE);
    }

    /**
     * True when the point lies on the segment but is not one of its endpoints.
     */
    public boolean containsInInterior(Position point) {
        return contains(point) && !hasEndpoint(point);
    }

    /**
     * True when the two segments share a point in a way that connects them electrically: shared
     * endpoints, an endpoint on the other's interior, or a collinear overlap. A plain crossing of
     * two interiors is not a connection.
     */
    public boolean connectsTo(Segment other) {
        LineIntersector intersector = new RobustLineIntersector();
        intersector.computeIntersection(toCoordinate(start), toCoordinate(end),
                toCoordinate(other.start), toCoordinate(other.end));
        return intersector.hasIntersection() && !intersector.isProper();
    }

    static Coordinate toCoordinate(Position position) {
        return new Coordinate(position.x(), position.y());
    }
}
