package nl.bytesoflife.circuitsync.tool;

public enum Severity {
    ERROR,
    WARNING,
    IGNORE;

    public static Severity fromKicadName(String name) {
        if (name == null) return ERROR;
        return switch (name.toLowerCase()) {
            case "error" -> ERROR;
            case "warning" -> WARNING;
            case "ignore", "exclusion" -> IGNORE;
            default -> ERROR;
        };
    }
}
