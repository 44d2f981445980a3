package nl.bytesoflife.circuitsync.merge;

import nl.bytesoflife.circuitsync.geometry.Segment;
import nl.bytesoflife.circuitsync.geometry.WireRouter;
import nl.bytesoflife.circuitsync.kicad.SchematicContents;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.LabelKind;
import nl.bytesoflife.circuitsync.kicad.SymbolLibrary;
import nl.bytesoflife.circuitsync.model.Net;
import nl.bytesoflife.circuitsync.model.NetMember;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Draws the nets of one sheet: a wire for two connection points, a star from a free hub for
 * more, junctions where three or more items meet and one naming label per net.
 */
class NetWiring {

    private static final Logger log = LoggerFactory.getLogger(NetWiring.class);

    static final Position FIRST_FREE_SPOT = new Position(12.7, 12.7);

    private final SDocument document;
    private final SchematicContents contents;
    private final WireRouter router = new WireRouter();
    private final NodeFactory nodes;
    private final MergeReport report;

    NetWiring(SDocument document, SymbolLibrary library, NodeFactory nodes, MergeReport report) {
        this.document = document;
        this.contents = SchematicContents.read(document, library);
        this.nodes = nodes;
        this.report = report;
        for (SchematicContents.PlacedSymbol symbol : contents.getSymbols()) {
            symbol.pins().forEach(pin -> router.addObstacle(pin.position()));
        }
        contents.getLabels().forEach(label -> router.addObstacle(label.position()));
        contents.getJunctions().forEach(junction -> router.addObstacle(junction.position()));
        contents.getNoConnects().forEach(router::addObstacle);
        for (SchematicContents.SheetSymbol sheet : contents.getSheets()) {
            sheet.pins().forEach(pin -> router.addObstacle(pin.position()));
        }
        contents.getWires().forEach(wire -> router.addWire(wire.segment()));
    }

    void draw(List<Net> nets) {
        List<Net> ordered = new ArrayList<>(nets);
        ordered.sort(Comparator.comparing(Net::getName));
        for (Net net : ordered) {
            draw(net);
        }
    }

    private void draw(Net net) {
        List<Position> points = connectionPoints(net);
        Set<String> own = new LinkedHashSet<>();
        points.forEach(p -> own.add(p.key()));

        List<Segment> wires = new ArrayList<>();
        List<Position> labelPoints = new ArrayList<>();
        Position hub = null;
        if (points.size() == 2) {
            connect(points.get(0), points.get(1), own, wires, labelPoints);
        } else if (points.size() > 2) {
            hub = router.findFreePoint(centroid(points), own);
            own.add(hub.key());
            for (Position point : points) {
                connect(hub, point, own, wires, labelPoints);
            }
        }

        for (Segment wire : wires) {
            MergeState.insertTopLevel(document, nodes.wire(wire.start(), wire.end()));
        }
        report.wiresAdded(wires.size());

        for (Position point : junctionPoints(wires, points)) {
            MergeState.insertTopLevel(document, nodes.junction(point));
            report.junctionAdded();
        }

        Position namePoint = points.isEmpty() ? router.findFreePoint(FIRST_FREE_SPOT, own) : points.get(0);
        labelPoints.add(0, namePoint);
        Set<String> labelled = new LinkedHashSet<>();
        for (Position point : labelPoints) {
            if (!labelled.add(point.key())) continue;
            MergeState.insertTopLevel(document, label(net, point));
            report.labelAdded();
        }

        router.addWires(wires);
        router.addObstacles(points);
        router.addObstacles(labelPoints);
        if (hub != null) router.addObstacle(hub);
        log.debug("Net {}: {} points, {} wires, {} labels", net.getKey(), points.size(), wires.size(), labelled.size());
    }

    private void connect(Position from, Position to, Set<String> own, List<Segment> wires, List<Position> labelPoints) {
        Optional<List<Segment>> route = router.route(from, to, own);
        if (route.isPresent()) {
            wires.addAll(route.get());
        } else {
            report.unrouted();
            labelPoints.add(to);
            labelPoints.add(from);
        }
    }

    private List<Position> connectionPoints(Net net) {
        Map<String, Position> points = new LinkedHashMap<>();
        for (NetMember member : net.getMembers()) {
            Optional<Position> position = member.isComponentPin()
                    ? contents.findPinPosition(member.owner(), member.pin())
                    : contents.findSheetPinPosition(member.owner(), member.pin());
            if (position.isPresent()) {
                points.putIfAbsent(position.get().key(), position.get());
            } else {
                String warning = "Net " + net.getKey() + ": no position for " + member + ", left unconnected";
                log.warn(warning);
                report.warn(warning);
            }
        }
        return new ArrayList<>(points.values());
    }

    private static Position centroid(List<Position> points) {
        double x = 0;
        double y = 0;
        for (Position p : points) {
            x += p.x();
            y += p.y();
        }
        return new Position(x / points.size(), y / points.size());
    }

    /**
     * Points where three or more items meet: a wire end counts once, a wire passing through
     * counts twice, a connection point once.
     */
    static List<Position> junctionPoints(List<Segment> wires, List<Position> points) {
        Map<String, Position> candidates = new LinkedHashMap<>();
        for (Segment wire : wires) {
            candidates.putIfAbsent(wire.start().key(), wire.start());
            candidates.putIfAbsent(wire.end().key(), wire.end());
        }
        Map<String, Integer> pinCount = new HashMap<>();
        for (Position point : points) {
            pinCount.merge(point.key(), 1, Integer::sum);
        }
        List<Position> result = new ArrayList<>();
        for (Position candidate : candidates.values()) {
            int count = pinCount.getOrDefault(candidate.key(), 0);
            for (Segment wire : wires) {
                if (wire.hasEndpoint(candidate)) {
                    count++;
                } else if (wire.containsInInterior(candidate)) {
                    count += 2;
                }
            }
            if (count >= 3) result.add(candidate);
        }
        return result;
    }

    private SList label(Net net, Position at) {
        return switch (net.getScope()) {
            case GLOBAL_POWER -> nodes.label(LabelKind.GLOBAL, net.getName(), at, net.getDirection());
            case HIERARCHICAL -> nodes.label(LabelKind.HIERARCHICAL, net.getName(), at,
                    net.getDirection() == null ? PortDirection.BIDIRECTIONAL : net.getDirection());
            case LOCAL -> nodes.label(LabelKind.LOCAL, net.getName(), at, null);
        };
    }
}
