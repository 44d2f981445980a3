package nl.bytesoflife.circuitsync.model;

import java.util.Map;

/**
 * Electrical type of a symbol pin, named as in the KiCad grammar.
 */
public enum PinType {
    INPUT("input"),
    OUTPUT("output"),
    BIDIRECTIONAL("bidirectional"),
    TRI_STATE("tri_state"),
    PASSIVE("passive"),
    FREE("free"),
    UNSPECIFIED("unspecified"),
    POWER_IN("power_in"),
    POWER_OUT("power_out"),
    OPEN_COLLECTOR("open_collector"),
    OPEN_EMITTER("open_emitter"),
    NO_CONNECT("no_connect");

    private static final Map<String, PinType> KICAD_NAMES = Map.ofEntries(
            Map.entry("input", INPUT),
            Map.entry("output", OUTPUT),
            Map.entry("bidirectional", BIDIRECTIONAL),
            Map.entry("tri_state", TRI_STATE),
            Map.entry("passive", PASSIVE),
            Map.entry("free", FREE),
            Map.entry("unspecified", UNSPECIFIED),
            Map.entry("power_in", POWER_IN),
            Map.entry("power_out", POWER_OUT),
            Map.entry("open_collector", OPEN_COLLECTOR),
            Map.entry("open_emitter", OPEN_EMITTER),
            Map.entry("no_connect", NO_CONNECT),
            // netlist spelling
            Map.entry("unconnected", NO_CONNECT),
            Map.entry("3state", TRI_STATE)
    );

    private final String kicadName;

    PinType(String kicadName) {
        this.kicadName = kicadName;
    }

    public String getKicadName() {
        return kicadName;
    }

    public boolean isOutput() {
        return this == OUTPUT || this == POWER_OUT || this == TRI_STATE
                || this == OPEN_COLLECTOR || this == OPEN_EMITTER;
    }

    public boolean isInput() {
        return this == INPUT || this == POWER_IN;
    }

    public static PinType fromKicadName(String name) {
        if (name == null) return UNSPECIFIED;
        return KICAD_NAMES.getOrDefault(name.toLowerCase(), UNSPECIFIED);
    }
}
