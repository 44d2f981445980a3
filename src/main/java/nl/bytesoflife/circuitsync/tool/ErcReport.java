package nl.bytesoflife.circuitsync.tool;

import nl.bytesoflife.circuitsync.parser.JsonParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static nl.bytesoflife.circuitsync.parser.JsonParser.asList;
import static nl.bytesoflife.circuitsync.parser.JsonParser.asObject;
import static nl.bytesoflife.circuitsync.parser.JsonParser.asString;

/**
 * Electrical rule check results as written by {@code kicad-cli sch erc --format json}.
 */
public class ErcReport {

    private final List<ErcViolation> violations = new ArrayList<>();

    public static ErcReport parse(String json) {
        ErcReport report = new ErcReport();
        Map<String, Object> root = new JsonParser().parseObject(json);
        for (Object sheetValue : asList(root.get("sheets"))) {
            Map<String, Object> sheet = asObject(sheetValue);
            String path = asString(sheet.get("path"));
            for (Object violationValue : asList(sheet.get("violations"))) {
                Map<String, Object> violation = asObject(violationValue);
                List<String> items = new ArrayList<>();
                double x = 0;
                double y = 0;
                boolean located = false;
                for (Object itemValue : asList(violation.get("items"))) {
                    Map<String, Object> item = asObject(itemValue);
                    String description = asString(item.get("description"));
                    if (description != null) items.add(description);
                    Map<String, Object> pos = asObject(item.get("pos"));
                    if (!located && pos.containsKey("x")) {
                        x = JsonParser.toDouble(pos.get("x"));
                        y = JsonParser.toDouble(pos.get("y"));
                        located = true;
                    }
                }
                report.violations.add(new ErcViolation(path, asString(violation.get("type")),
                        Severity.fromKicadName(asString(violation.get("severity"))),
                        asString(violation.get("description")), items, x, y));
            }
        }
        return report;
    }

    public List<ErcViolation> getViolations() {
        return Collections.unmodifiableList(violations);
    }

    public List<ErcViolation> getErrors() {
        return violations.stream()
                .filter(v -> v.getSeverity() == Severity.ERROR)
                .toList();
    }

    public List<ErcViolation> getWarnings() {
        return violations.stream()
                .filter(v -> v.getSeverity() == Severity.WARNING)
                .toList();
    }

    public boolean hasErrors() {
        return violations.stream().anyMatch(v -> v.getSeverity() == Severity.ERROR);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ERC Report:\n");
        sb.append("  Violations: ").append(violations.size())
          .append(" (").append(getErrors().size()).append(" errors, ")
          .append(getWarnings().size()).append(" warnings)\n");
        for (ErcViolation v : violations) {
            sb.append("  - ").append(v).append("\n");
        }
        return sb.toString();
    }
}
