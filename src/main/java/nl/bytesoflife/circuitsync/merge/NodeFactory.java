package nl.bytesoflife.circuitsync.merge;

import nl.bytesoflife.circuitsync.kicad.SchematicContents.LabelKind;
import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.parser.SNode.SAtom;
import nl.bytesoflife.circuitsync.parser.SNode.SList;

import java.util.List;
import java.util.function.Supplier;

/**
 * Builds the KiCad 7 schematic nodes the merge inserts. Nodes come out unformatted; the caller
 * inserts them through the document's formatter.
 */
class NodeFactory {

    static final double FONT_SIZE = 1.27;
    static final double SHEET_WIDTH = 20.32;
    static final double SHEET_MIN_HEIGHT = 12.7;

    private final Supplier<String> uuids;

    NodeFactory(Supplier<String> uuids) {
        this.uuids = uuids;
    }

    String newUuid() {
        return uuids.get();
    }

    /**
     * One placed symbol unit. Reference and value sit right of the origin, the footprint is hidden.
     */
    SList symbol(String libId, Position at, int rotation, int unit, String uuid, String reference,
                 String value, String footprint, List<Pin> pins, String projectName, String instancePath) {
        SList symbol = SList.tagged("symbol",
                SList.tagged("lib_id", str(libId)),
                at(at, rotation),
                SList.tagged("unit", num(unit)),
                SList.tagged("exclude_from_sim", sym("no")),
                SList.tagged("in_bom", sym("yes")),
                SList.tagged("on_board", sym("yes")),
                SList.tagged("dnp", sym("no")),
                SList.tagged("uuid", str(uuid)),
                property("Reference", reference, at.translate(2.54, -1.27), false),
                property("Value", value, at.translate(2.54, 1.27), false),
                property("Footprint", footprint, at, true));
        for (Pin pin : pins) {
            symbol.add(pinEntry(pin.number()));
        }
        symbol.add(SList.tagged("instances",
                SList.tagged("project", str(projectName),
                        SList.tagged("path", str(instancePath),
                                SList.tagged("reference", str(reference)),
                                SList.tagged("unit", num(unit))))));
        return symbol;
    }

    SList pinEntry(String number) {
        return SList.tagged("pin", str(number), SList.tagged("uuid", str(uuids.get())));
    }

    SList property(String name, String value, Position at, boolean hidden) {
        SList effects = SList.tagged("effects", font());
        if (hidden) {
            effects.add(SList.tagged("hide", sym("yes")));
        }
        return SList.tagged("property", str(name), str(value), at(at, 0), effects);
    }

    SList wire(Position from, Position to) {
        return SList.tagged("wire",
                SList.tagged("pts", xy(from), xy(to)),
                SList.tagged("stroke", SList.tagged("width", num(0)), SList.tagged("type", sym("default"))),
                SList.tagged("uuid", str(uuids.get())));
    }

    SList junction(Position at) {
        return SList.tagged("junction",
                SList.tagged("at", num(at.x()), num(at.y())),
                SList.tagged("diameter", num(0)),
                SList.tagged("color", num(0), num(0), num(0), num(0)),
                SList.tagged("uuid", str(uuids.get())));
    }

    SList label(LabelKind kind, String name, Position at, PortDirection shape) {
        SList label = SList.tagged(kind.getTag(), str(name));
        if (kind != LabelKind.LOCAL) {
            label.add(SList.tagged("shape", sym(shape == null ? "passive" : shape.getKicadShape())));
        }
        label.add(at(at, 0));
        label.add(SList.tagged("fields_autoplaced", sym("yes")));
        label.add(SList.tagged("effects", font(),
                kind == LabelKind.LOCAL ? SList.tagged("justify", sym("left"), sym("bottom"))
                        : SList.tagged("justify", sym("left"))));
        label.add(SList.tagged("uuid", str(uuids.get())));
        return label;
    }

    /**
     * A sheet symbol without pins. {@code at} is the top-left corner.
     */
    SList sheet(String name, String fileName, Position at, double height, String uuid, String projectName,
                String parentInstancePath, int page) {
        return SList.tagged("sheet",
                SList.tagged("at", num(at.x()), num(at.y())),
                SList.tagged("size", num(SHEET_WIDTH), num(height)),
                SList.tagged("fields_autoplaced", sym("yes")),
                SList.tagged("stroke", SList.tagged("width", num(0.1524)), SList.tagged("type", sym("solid"))),
                SList.tagged("fill", SList.tagged("color", num(0), num(0), num(0), num(0))),
                SList.tagged("uuid", str(uuid)),
                SList.tagged("property", str("Sheetname"), str(name), at(at.translate(0, -0.7116).rounded(), 0),
                        SList.tagged("effects", font(), SList.tagged("justify", sym("left"), sym("bottom")))),
                SList.tagged("property", str("Sheetfile"), str(fileName),
                        at(at.translate(0, height + 0.5846).rounded(), 0),
                        SList.tagged("effects", font(), SList.tagged("justify", sym("left"), sym("top")))),
                SList.tagged("instances",
                        SList.tagged("project", str(projectName),
                                SList.tagged("path", str(parentInstancePath),
                                        SList.tagged("page", str(Integer.toString(page)))))));
    }

    /**
     * Pin on a sheet-symbol border: angle 180 on the left edge, 0 on the right edge.
     */
    SList sheetPin(String name, PortDirection direction, Position at, boolean leftEdge) {
        return SList.tagged("pin", str(name), sym(direction.getKicadShape()),
                at(at, leftEdge ? 180 : 0),
                SList.tagged("effects", font(), SList.tagged("justify", sym(leftEdge ? "left" : "right"))),
                SList.tagged("uuid", str(uuids.get())));
    }

    /**
     * Rectangular library symbol for parts missing from every library: half the pins on the left,
     * the rest on the right, 2.54 mm apart.
     */
    SList genericLibSymbol(String libId, List<Pin> pins) {
        String name = libId.contains(":") ? libId.substring(libId.indexOf(':') + 1) : libId;
        int left = (pins.size() + 1) / 2;
        int right = pins.size() - left;
        double halfHeight = Math.max(left, right) * 1.27 + 1.27;

        SList body = SList.tagged("symbol", str(name + "_0_1"),
                SList.tagged("rectangle",
                        SList.tagged("start", num(-5.08), num(halfHeight)),
                        SList.tagged("end", num(5.08), num(-halfHeight)),
                        SList.tagged("stroke", SList.tagged("width", num(0.254)), SList.tagged("type", sym("default"))),
                        SList.tagged("fill", SList.tagged("type", sym("background")))));
        SList unit = SList.tagged("symbol", str(name + "_1_1"));
        for (int i = 0; i < pins.size(); i++) {
            boolean onLeft = i < left;
            int row = onLeft ? i : i - left;
            int rows = onLeft ? left : right;
            double y = new Position(0, (rows - 1) * 1.27 - row * 2.54).rounded().y();
            Pin pin = pins.get(i);
            unit.add(SList.tagged("pin", sym(pin.type().getKicadName()), sym("line"),
                    SList.tagged("at", num(onLeft ? -7.62 : 7.62), num(y), num(onLeft ? 0 : 180)),
                    SList.tagged("length", num(2.54)),
                    SList.tagged("name", str(pin.name().isEmpty() ? "~" : pin.name()), SList.tagged("effects", font())),
                    SList.tagged("number", str(pin.number()), SList.tagged("effects", font()))));
        }
        return SList.tagged("symbol", str(libId),
                SList.tagged("pin_names", SList.tagged("offset", num(1.016))),
                SList.tagged("exclude_from_sim", sym("no")),
                SList.tagged("in_bom", sym("yes")),
                SList.tagged("on_board", sym("yes")),
                property("Reference", "U", new Position(0, -halfHeight - 1.27).rounded(), false),
                property("Value", name, new Position(0, halfHeight + 1.27).rounded(), false),
                property("Footprint", "", new Position(0, 0), true),
                body,
                unit);
    }

    static SList at(Position at, int rotation) {
        return SList.tagged("at", num(at.x()), num(at.y()), num(rotation));
    }

    private static SList xy(Position p) {
        return SList.tagged("xy", num(p.x()), num(p.y()));
    }

    private static SList font() {
        return SList.tagged("font", SList.tagged("size", num(FONT_SIZE), num(FONT_SIZE)));
    }

    static SAtom str(String value) {
        return SAtom.string(value == null ? "" : value);
    }

    static SAtom sym(String value) {
        return SAtom.symbol(value);
    }

    static SAtom num(double value) {
        return SAtom.number(value);
    }
}
