package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.model.PinType;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A symbol definition, either embedded in a schematic's {@code lib_symbols} or read from a
 * {@code .kicad_sym} library. Pin positions are the connection points in library coordinates.
 */
public class LibSymbol {

    private final String libId;
    private final boolean power;
    private final List<LibPin> pins;
    private final int unitCount;
    private final SNode.SList node;

    public LibSymbol(String libId, boolean power, List<LibPin> pins, SNode.SList node) {
        this.libId = libId;
        this.power = power;
        this.pins = List.copyOf(pins);
        this.node = node;
        int units = 1;
        for (LibPin pin : pins) {
            units = Math.max(units, pin.unit());
        }
        this.unitCount = units;
    }

    public record LibPin(String number, String name, PinType type, int unit, double x, double y) {

        public Pin toPin() {
            return new Pin(number, name, type, unit);
        }
    }

    /**
     * Reads a {@code (symbol "Name" ...)} definition. Units come from the sub-symbol names
     * ({@code Name_<unit>_<style>}); unit 0 holds pins common to all units.
     */
    public static LibSymbol parse(String libId, SNode.SList node) {
        List<LibPin> pins = new ArrayList<>();
        collectPins(node, 0, pins);
        for (SNode.SList sub : SExpressions.findChildren(node, "symbol")) {
            collectPins(sub, unitOf(SExpressions.getAtomValue(sub, 1)), pins);
        }
        boolean power = SExpressions.findChild(node, "power").isPresent();
        return new LibSymbol(libId, power, pins, node);
    }

    private static void collectPins(SNode.SList symbol, int unit, List<LibPin> pins) {
        for (SNode.SList pin : SExpressions.findChildren(symbol, "pin")) {
            PinType type = PinType.fromKicadName(SExpressions.getAtomValue(pin, 1));
            SNode.SList at = SExpressions.findChild(pin, "at").orElse(null);
            double x = at == null ? 0 : SExpressions.getDouble(at, 1, 0);
            double y = at == null ? 0 : SExpressions.getDouble(at, 2, 0);
            String name = SExpressions.childValue(pin, "name");
            String number = SExpressions.childValue(pin, "number");
            if (number == null) continue;
            pins.add(new LibPin(number, name == null ? "" : name, type, unit, x, y));
        }
    }

    static int unitOf(String subSymbolName) {
        String[] parts = subSymbolName.split("_");
        if (parts.length < 3) return 0;
        try {
            return Integer.parseInt(parts[parts.length - 2]);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public String getLibId() {
        return libId;
    }

    public boolean isPower() {
        return power;
    }

    public List<LibPin> getPins() {
        return Collections.unmodifiableList(pins);
    }

    /**
     * Pins of one unit plus the pins shared by all units.
     */
    public List<LibPin> getPins(int unit) {
        return pins.stream().filter(p -> p.unit() == 0 || p.unit() == unit).toList();
    }

    public int getUnitCount() {
        return unitCount;
    }

    public SNode.SList getNode() {
        return node;
    }
}
