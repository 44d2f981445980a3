package nl.bytesoflife.circuitsync.tool;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErcReportTest {

    static final String REPORT = """
            {
              "$schema": "https://schemas.kicad.org/erc.v1.json",
              "source": "demo.kicad_sch",
              "sheets": [
                {"path": "/", "uuid_path": "/1", "violations": [
                  {"type": "pin_not_connected", "severity": "error", "description": "Pin not connected",
                   "items": [{"description": "Symbol R1 Pin 2", "pos": {"x": 1.0033, "y": 1.0414}, "uuid": "a"}]},
                  {"type": "power_pin_not_driven", "severity": "warning", "description": "Input Power pin not driven",
                   "items": [{"description": "Symbol U1 Pin 14"}]}
                ]},
                {"path": "/sensor/", "violations": [
                  {"type": "label_dangling", "severity": "exclusion", "description": "Label not connected", "items": []}
                ]}
              ]
            }
            """;

    @Test
    void readsViolationsPerSheet() {
        ErcReport report = ErcReport.parse(REPORT);

        assertEquals(3, report.getViolations().size());
        assertTrue(report.hasErrors());
        assertEquals(1, report.getErrors().size());
        assertEquals(1, report.getWarnings().size());

        ErcViolation first = report.getViolations().get(0);
        assertEquals("/", first.getSheetPath());
        assertEquals("pin_not_connected", first.getType());
        assertEquals(List.of("Symbol R1 Pin 2"), first.getItems());
        assertEquals(1.0033, first.getX(), 1e-9);
        assertEquals(1.0414, first.getY(), 1e-9);

        ErcViolation excluded = report.getViolations().get(2);
        assertEquals("/sensor/", excluded.getSheetPath());
        assertEquals(Severity.IGNORE, excluded.getSeverity());
    }

    @Test
    void emptyReportHasNoErrors() {
        ErcReport report = ErcReport.parse("{\"sheets\": [{\"path\": \"/\", \"violations\": []}]}");

        assertFalse(report.hasErrors());
        assertTrue(report.getViolations().isEmpty());
        assertTrue(report.toString().contains("Violations: 0"));
    }

    @Test
    void mapsSeverityNames() {
        assertEquals(Severity.ERROR, Severity.fromKicadName("error"));
        assertEquals(Severity.WARNING, Severity.fromKicadName("Warning"));
        assertEquals(Severity.IGNORE, Severity.fromKicadName("ignore"));
        assertEquals(Severity.ERROR, Severity.fromKicadName(null));
    }
}
