package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.build.ConnectedGroup.SheetSymbolPin;
import nl.bytesoflife.circuitsync.build.ConnectedGroup.SymbolPin;
import nl.bytesoflife.circuitsync.geometry.SpatialIndex;
import nl.bytesoflife.circuitsync.kicad.SchematicContents;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.Junction;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.Label;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.PlacedPin;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.PlacedSymbol;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.SheetPin;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.SheetSymbol;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.Wire;
import nl.bytesoflife.circuitsync.model.Position;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Union-find over the connectable items of one sheet.
 * <ul>
 *   <li>items at the same point join (wire endpoints, pins, labels, sheet pins, junctions)</li>
 *   <li>an item on the interior of a wire joins that wire, so a junction joins every wire through it</li>
 *   <li>a wire endpoint on another wire's interior joins both wires</li>
 *   <li>two wires crossing without a junction stay apart</li>
 *   <li>labels of the same kind and name join; global labels also join power symbols of that name</li>
 * </ul>
 */
public class ConnectivityResolver {

    private static final double SEARCH = 1e-3;

    private final List<Object> items = new ArrayList<>();
    private final List<Position> anchors = new ArrayList<>();
    private int[] parent;

    public List<ConnectedGroup> resolve(SchematicContents contents) {
        items.clear();
        anchors.clear();
        for (PlacedSymbol symbol : contents.getSymbols()) {
            for (PlacedPin pin : symbol.pins()) {
                add(new SymbolPin(symbol, pin), pin.position());
            }
        }
        for (Label label : contents.getLabels()) {
            add(label, label.position());
        }
        for (SheetSymbol sheet : contents.getSheets()) {
            for (SheetPin pin : sheet.pins()) {
                add(new SheetSymbolPin(sheet, pin), pin.position());
            }
        }
        for (Junction junction : contents.getJunctions()) {
            add(junction, junction.position());
        }
        int firstWire = items.size();
        for (Wire wire : contents.getWires()) {
            add(wire, null);
        }

        parent = new int[items.size()];
        for (int i = 0; i < parent.length; i++) parent[i] = i;

        Map<String, Integer> byPoint = new HashMap<>();
        SpatialIndex<Integer> wireIndex = new SpatialIndex<>();
        for (int i = 0; i < firstWire; i++) {
            joinAt(byPoint, anchors.get(i), i);
        }
        for (int w = firstWire; w < items.size(); w++) {
            Wire wire = (Wire) items.get(w);
            joinAt(byPoint, wire.segment().start(), w);
            joinAt(byPoint, wire.segment().end(), w);
            wireIndex.insert(wire.segment(), w);
        }

        for (int i = 0; i < firstWire; i++) {
            Position point = anchors.get(i);
            for (int w : wireIndex.queryNeighbors(point, SEARCH)) {
                if (((Wire) items.get(w)).segment().containsInInterior(point)) {
                    union(i, w);
                }
            }
        }
        for (int w = firstWire; w < items.size(); w++) {
            Wire wire = (Wire) items.get(w);
            for (Position end : List.of(wire.segment().start(), wire.segment().end())) {
                for (int other : wireIndex.queryNeighbors(end, SEARCH)) {
                    if (other != w && ((Wire) items.get(other)).segment().containsInInterior(end)) {
                        union(w, other);
                    }
                }
            }
        }

        Map<String, Integer> byName = new HashMap<>();
        for (int i = 0; i < firstWire; i++) {
            String nameKey = nameKey(items.get(i));
            if (nameKey != null) {
                Integer first = byName.putIfAbsent(nameKey, i);
                if (first != null) union(first, i);
            }
        }

        Map<Integer, ConnectedGroup> groups = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            ConnectedGroup group = groups.computeIfAbsent(find(i), k -> new ConnectedGroup());
            Object item = items.get(i);
            if (item instanceof SymbolPin pin) {
                group.addPin(pin);
            } else if (item instanceof Label label) {
                group.addLabel(label);
            } else if (item instanceof SheetSymbolPin pin) {
                group.addSheetPin(pin);
            } else if (item instanceof Junction junction) {
                group.addJunction(junction);
            } else if (item instanceof Wire wire) {
                group.addWire(wire);
            }
        }
        return new ArrayList<>(groups.values());
    }

    private static String nameKey(Object item) {
        if (item instanceof Label label) {
            return switch (label.kind()) {
                case LOCAL -> "local:" + label.name();
                case HIERARCHICAL -> "hierarchical:" + label.name();
                case GLOBAL -> "global:" + label.name();
            };
        }
        if (item instanceof SymbolPin pin && pin.symbol().power()) {
            return "global:" + pin.symbol().value();
        }
        return null;
    }

    private void add(Object item, Position anchor) {
        items.add(item);
        anchors.add(anchor);
    }

    private void joinAt(Map<String, Integer> byPoint, Position point, int item) {
        Integer first = byPoint.putIfAbsent(point.key(), item);
        if (first != null) union(first, item);
    }

    private int find(int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private void union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra != rb) {
            parent[Math.max(ra, rb)] = Math.min(ra, rb);
        }
    }
}
