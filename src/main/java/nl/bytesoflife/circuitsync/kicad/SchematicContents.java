package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.geometry.PinTransform;
import nl.bytesoflife.circuitsync.geometry.Segment;
import nl.bytesoflife.circuitsync.model.PinType;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of the connectable items on one schematic sheet. Every item keeps the tree node it
 * was read from so that edits can be applied in place.
 */
public class SchematicContents {

    public enum LabelKind {
        LOCAL("label"),
        GLOBAL("global_label"),
        HIERARCHICAL("hierarchical_label");

        private final String tag;

        LabelKind(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        public static Optional<LabelKind> fromTag(String tag) {
            for (LabelKind kind : values()) {
                if (kind.tag.equals(tag)) return Optional.of(kind);
            }
            return Optional.empty();
        }
    }

    public record PlacedPin(String number, String name, PinType type, int unit, Position position) {}

    public record PlacedSymbol(SNode.SList node, String libId, String reference, int unit, String value,
                               String footprint, Position position, int rotation, String mirror,
                               String uuid, boolean power, List<PlacedPin> pins) {

        public Optional<PlacedPin> findPin(String number) {
            return pins.stream().filter(p -> p.number().equals(number)).findFirst();
        }
    }

    public record Wire(SNode.SList node, Segment segment) {}

    public record Junction(SNode.SList node, Position position) {}

    public record Label(SNode.SList node, LabelKind kind, String name, Position position,
                        PortDirection shape) {}

    public record SheetPin(SNode.SList node, String name, PortDirection direction, Position position) {}

    public record SheetSymbol(SNode.SList node, String name, String fileName, String uuid,
                              Position position, double width, double height, List<SheetPin> pins) {

        public Optional<SheetPin> findPin(String name) {
            return pins.stream().filter(p -> p.name().equals(name)).findFirst();
        }
    }

    private final Map<String, LibSymbol> libSymbols = new HashMap<>();
    private final List<PlacedSymbol> symbols = new ArrayList<>();
    private final List<Wire> wires = new ArrayList<>();
    private final List<Junction> junctions = new ArrayList<>();
    private final List<Label> labels = new ArrayList<>();
    private final List<SheetSymbol> sheets = new ArrayList<>();
    private final List<Position> noConnects = new ArrayList<>();

    /**
     * Reads a schematic. Symbol pin geometry comes from the embedded {@code lib_symbols}; the
     * library is consulted only for definitions the file does not embed.
     */
    public static SchematicContents read(SDocument document, SymbolLibrary library) {
        SchematicContents contents = new SchematicContents();
        SNode.SList root = document.getRoot();
        SExpressions.findChild(root, "lib_symbols").ifPresent(lib -> {
            for (SNode.SList symbol : SExpressions.findChildren(lib, "symbol")) {
                String libId = SExpressions.getAtomValue(symbol, 1);
                contents.libSymbols.put(libId, LibSymbol.parse(libId, symbol));
            }
        });

        for (SNode child : root.children()) {
            if (!(child instanceof SNode.SList node)) continue;
            String tag = node.tag();
            switch (tag) {
                case "symbol" -> contents.symbols.add(contents.readSymbol(node, library));
                case "wire" -> contents.readWire(node);
                case "junction" -> contents.junctions.add(new Junction(node, readAt(node)));
                case "no_connect" -> contents.noConnects.add(readAt(node));
                case "sheet" -> contents.sheets.add(readSheet(node));
                default -> LabelKind.fromTag(tag).ifPresent(kind -> contents.labels.add(readLabel(node, kind)));
            }
        }
        return contents;
    }

    private PlacedSymbol readSymbol(SNode.SList node, SymbolLibrary library) {
        String libId = SExpressions.childValue(node, "lib_id");
        String libName = SExpressions.childValue(node, "lib_name");
        SNode.SList at = SExpressions.findChild(node, "at").orElse(null);
        Position position = at == null ? new Position(0, 0)
                : new Position(SExpressions.getDouble(at, 1, 0), SExpressions.getDouble(at, 2, 0));
        int rotation = at == null ? 0 : (int) Math.round(SExpressions.getDouble(at, 3, 0));
        String mirror = SExpressions.childValue(node, "mirror");
        String unitText = SExpressions.childValue(node, "unit");
        int unit = unitText == null ? 1 : Integer.parseInt(unitText);

        LibSymbol definition = libSymbols.get(libName != null ? libName : libId);
        if (definition == null && libId != null && library != null) {
            definition = library.find(libId).orElse(null);
        }
        List<PlacedPin> pins = new ArrayList<>();
        boolean power = false;
        if (definition != null) {
            power = definition.isPower();
            for (LibSymbol.LibPin pin : definition.getPins(unit)) {
                Position sheetPosition = PinTransform.toSheet(position, rotation, mirror, pin.x(), pin.y());
                pins.add(new PlacedPin(pin.number(), pin.name(), pin.type(), pin.unit(), sheetPosition));
            }
        }
        return new PlacedSymbol(node, libId == null ? "" : libId,
                valueOrEmpty(SExpressions.propertyValue(node, "Reference")), unit,
                valueOrEmpty(SExpressions.propertyValue(node, "Value")),
                valueOrEmpty(SExpressions.propertyValue(node, "Footprint")),
                position, rotation, mirror, SExpressions.childValue(node, "uuid"), power, pins);
    }

    private void readWire(SNode.SList node) {
        SExpressions.findChild(node, "pts").ifPresent(pts -> {
            List<SNode.SList> points = SExpressions.findChildren(pts, "xy");
            for (int i = 1; i < points.size(); i++) {
                Segment segment = new Segment(readXy(points.get(i - 1)), readXy(points.get(i)));
                wires.add(new Wire(node, segment));
            }
        });
    }

    private static Label readLabel(SNode.SList node, LabelKind kind) {
        PortDirection shape = PortDirection.fromKicadShape(SExpressions.childValue(node, "shape"));
        return new Label(node, kind, SExpressions.getAtomValue(node, 1), readAt(node), shape);
    }

    private static SheetSymbol readSheet(SNode.SList node) {
        Position position = readAt(node);
        SNode.SList size = SExpressions.findChild(node, "size").orElse(null);
        double width = size == null ? 0 : SExpressions.getDouble(size, 1, 0);
        double height = size == null ? 0 : SExpressions.getDouble(size, 2, 0);
        String name = SExpressions.propertyValue(node, "Sheetname");
        if (name == null) name = SExpressions.propertyValue(node, "Sheet name");
        String file = SExpressions.propertyValue(node, "Sheetfile");
        if (file == null) file = SExpressions.propertyValue(node, "Sheet file");

        List<SheetPin> pins = new ArrayList<>();
        for (SNode.SList pin : SExpressions.findChildren(node, "pin")) {
            pins.add(new SheetPin(pin, SExpressions.getAtomValue(pin, 1),
                    PortDirection.fromKicadShape(SExpressions.getAtomValue(pin, 2)), readAt(pin)));
        }
        return new SheetSymbol(node, valueOrEmpty(name), valueOrEmpty(file),
                SExpressions.childValue(node, "uuid"), position, width, height, pins);
    }

    static Position readAt(SNode.SList node) {
        return SExpressions.findChild(node, "at")
                .map(at -> new Position(SExpressions.getDouble(at, 1, 0), SExpressions.getDouble(at, 2, 0)))
                .orElse(new Position(0, 0));
    }

    private static Position readXy(SNode.SList xy) {
        return new Position(SExpressions.getDouble(xy, 1, 0), SExpressions.getDouble(xy, 2, 0));
    }

    private static String valueOrEmpty(String value) {
        return value == null ? "" : value;
    }

    public Map<String, LibSymbol> getLibSymbols() {
        return libSymbols;
    }

    public List<PlacedSymbol> getSymbols() {
        return symbols;
    }

    public List<Wire> getWires() {
        return wires;
    }

    public List<Junction> getJunctions() {
        return junctions;
    }

    public List<Label> getLabels() {
        return labels;
    }

    public List<SheetSymbol> getSheets() {
        return sheets;
    }

    public List<Position> getNoConnects() {
        return noConnects;
    }

    public Optional<SheetSymbol> findSheet(String name) {
        return sheets.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /**
     * Position of a component pin, searching every unit placed with that reference.
     */
    public Optional<Position> findPinPosition(String reference, String pinNumber) {
        for (PlacedSymbol symbol : symbols) {
            if (symbol.power() || !symbol.reference().equals(reference)) continue;
            Optional<PlacedPin> pin = symbol.findPin(pinNumber);
            if (pin.isPresent()) return Optional.of(pin.get().position());
        }
        return Optional.empty();
    }

    public Optional<Position> findSheetPinPosition(String sheetName, String pinName) {
        return findSheet(sheetName).flatMap(s -> s.findPin(pinName)).map(SheetPin::position);
    }
}
