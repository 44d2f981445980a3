package nl.bytesoflife.circuitsync.tool;

import java.util.List;
import java.util.Locale;

public class ErcViolation {

    private final String sheetPath;
    private final String type;
    private final Severity severity;
    private final String description;
    private final List<String> items;
    private final double x;
    private final double y;

    public ErcViolation(String sheetPath, String type, Severity severity, String description,
                        List<String> items, double x, double y) {
        this.sheetPath = sheetPath;
        this.type = type;
        this.severity = severity;
        this.description = description;
        this.items = List.copyOf(items);
        this.x = x;
        this.y = y;
    }

    public String getSheetPath() { return sheetPath; }
    public String getType() { return type; }
    public Severity getSeverity() { return severity; }
    public String getDescription() { return description; }
    public List<String> getItems() { return items; }
    public double getX() { return x; }
    public double getY() { return y; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ");
        sb.append(type).append(": ");
        sb.append(description);
        sb.append(String.format(Locale.US, " at (%.4f, %.4f)", x, y));
        if (sheetPath != null) {
            sb.append(" on ").append(sheetPath);
        }
        return sb.toString();
    }
}
