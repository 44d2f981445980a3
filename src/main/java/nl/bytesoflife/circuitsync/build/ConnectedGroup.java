package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.kicad.SchematicContents.Junction;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.Label;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.LabelKind;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.PlacedPin;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.PlacedSymbol;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.SheetPin;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.SheetSymbol;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.Wire;
import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.parser.SNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Items on one sheet that are electrically joined.
 */
public class ConnectedGroup {

    public record SymbolPin(PlacedSymbol symbol, PlacedPin pin) {}

    public record SheetSymbolPin(SheetSymbol sheet, SheetPin pin) {}

    private final List<SymbolPin> pins = new ArrayList<>();
    private final List<SymbolPin> powerPins = new ArrayList<>();
    private final List<Label> labels = new ArrayList<>();
    private final List<SheetSymbolPin> sheetPins = new ArrayList<>();
    private final List<Wire> wires = new ArrayList<>();
    private final List<Junction> junctions = new ArrayList<>();

    void addPin(SymbolPin pin) {
        if (pin.symbol().power()) {
            powerPins.add(pin);
        } else {
            pins.add(pin);
        }
    }

    void addLabel(Label label) {
        labels.add(label);
    }

    void addSheetPin(SheetSymbolPin pin) {
        sheetPins.add(pin);
    }

    void addWire(Wire wire) {
        wires.add(wire);
    }

    void addJunction(Junction junction) {
        junctions.add(junction);
    }

    public List<SymbolPin> getPins() {
        return pins;
    }

    public List<SymbolPin> getPowerPins() {
        return powerPins;
    }

    public List<Label> getLabels() {
        return labels;
    }

    public List<SheetSymbolPin> getSheetPins() {
        return sheetPins;
    }

    public List<Wire> getWires() {
        return wires;
    }

    public List<Junction> getJunctions() {
        return junctions;
    }

    public boolean hasMembers() {
        return !pins.isEmpty() || !sheetPins.isEmpty();
    }

    public boolean isNamed() {
        return !labels.isEmpty() || !powerPins.isEmpty();
    }

    /**
     * Distinct names given to the group by labels and power symbols.
     */
    public Set<String> getNames() {
        Set<String> names = new TreeSet<>();
        for (Label label : labels) {
            names.add(label.name());
        }
        for (SymbolPin power : powerPins) {
            names.add(power.symbol().value());
        }
        return names;
    }

    public NetScope getScope() {
        if (!powerPins.isEmpty()) return NetScope.GLOBAL_POWER;
        boolean hierarchical = false;
        for (Label label : labels) {
            if (label.kind() == LabelKind.GLOBAL) return NetScope.GLOBAL_POWER;
            if (label.kind() == LabelKind.HIERARCHICAL) hierarchical = true;
        }
        return hierarchical ? NetScope.HIERARCHICAL : NetScope.LOCAL;
    }

    /**
     * Nodes that belong to this net alone and go away with it: wires, junctions, labels and power
     * symbols. Component symbols and sheet pins are not included.
     */
    public List<SNode.SList> getOwnedNodes() {
        Set<SNode.SList> nodes = new LinkedHashSet<>();
        for (Wire wire : wires) nodes.add(wire.node());
        for (Junction junction : junctions) nodes.add(junction.node());
        for (Label label : labels) nodes.add(label.node());
        for (SymbolPin power : powerPins) nodes.add(power.symbol().node());
        return new ArrayList<>(nodes);
    }

    /**
     * A point of the group, for diagnostics.
     */
    public Position getLocation() {
        if (!labels.isEmpty()) return labels.get(0).position();
        if (!pins.isEmpty()) return pins.get(0).pin().position();
        if (!wires.isEmpty()) return wires.get(0).segment().start();
        if (!sheetPins.isEmpty()) return sheetPins.get(0).pin().position();
        if (!powerPins.isEmpty()) return powerPins.get(0).pin().position();
        return junctions.isEmpty() ? null : junctions.get(0).position();
    }
}
