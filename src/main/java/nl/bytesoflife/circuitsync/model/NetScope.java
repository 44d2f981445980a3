package nl.bytesoflife.circuitsync.model;

public enum NetScope {
    /** Visible on one sheet only. */
    LOCAL,
    /** Crosses a sheet boundary through a hierarchical label / sheet pin pair. */
    HIERARCHICAL,
    /** Power and other global nets, joined by name everywhere in the project. */
    GLOBAL_POWER;

    public static NetScope fromName(String name) {
        if (name == null) return null;
        return switch (name.toLowerCase()) {
            case "local" -> LOCAL;
            case "hierarchical" -> HIERARCHICAL;
            case "global", "global_power", "power" -> GLOBAL_POWER;
            default -> throw new IllegalArgumentException("Unknown net scope: " + name);
        };
    }
}
