package nl.bytesoflife.circuitsync.model;

import java.util.Collection;

/**
 * Direction of a hierarchical label / sheet pin, spelled as the KiCad {@code shape}.
 */
public enum PortDirection {
    INPUT("input"),
    OUTPUT("output"),
    BIDIRECTIONAL("bidirectional"),
    TRI_STATE("tri_state"),
    PASSIVE("passive");

    private final String kicadShape;

    PortDirection(String kicadShape) {
        this.kicadShape = kicadShape;
    }

    public String getKicadShape() {
        return kicadShape;
    }

    public static PortDirection fromKicadShape(String shape) {
        if (shape == null) return BIDIRECTIONAL;
        return switch (shape.toLowerCase()) {
            case "input" -> INPUT;
            case "output" -> OUTPUT;
            case "tri_state", "3state" -> TRI_STATE;
            case "passive" -> PASSIVE;
            default -> BIDIRECTIONAL;
        };
    }

    /**
     * Direction seen from outside the sheet: only inputs inside means the port is an input,
     * only outputs means an output, anything else is bidirectional.
     */
    public static PortDirection infer(Collection<PinType> pinTypes) {
        boolean inputs = false;
        boolean outputs = false;
        boolean other = false;
        for (PinType type : pinTypes) {
            if (type.isInput()) {
                inputs = true;
            } else if (type.isOutput()) {
                outputs = true;
            } else {
                other = true;
            }
        }
        if (inputs && !outputs && !other) return INPUT;
        if (outputs && !inputs && !other) return OUTPUT;
        return BIDIRECTIONAL;
    }
}
