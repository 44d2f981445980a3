package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.parser.SExpressionParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchematicContentsTest {

    static final String SCHEMATIC = """
            (kicad_sch
            	(version 20231120)
            	(generator "eeschema")
            	(uuid "00000000-0000-0000-0000-0000000000aa")
            	(paper "A4")
            	(lib_symbols)
            	(symbol
            		(lib_id "Device:R")
            		(at 100.33 100.33 0)
            		(unit 1)
            		(uuid "00000000-0000-0000-0000-000000000001")
            		(property "Reference" "R1" (at 102.87 99.06 0))
            		(property "Value" "10k" (at 102.87 101.6 0))
            		(property "Footprint" "Resistor_SMD:R_0603" (at 100.33 100.33 0))
            	)
            	(symbol
            		(lib_id "power:GND")
            		(at 100.33 110.49 0)
            		(unit 1)
            		(uuid "00000000-0000-0000-0000-000000000002")
            		(property "Reference" "#PWR01" (at 100.33 116.84 0))
            		(property "Value" "GND" (at 100.33 114.3 0))
            	)
            	(wire (pts (xy 100.33 104.14) (xy 100.33 110.49)) (uuid "00000000-0000-0000-0000-000000000003"))
            	(label "SIG" (at 100.33 96.52 0) (uuid "00000000-0000-0000-0000-000000000004"))
            	(sheet (at 150 50) (size 20.32 12.7) (uuid "00000000-0000-0000-0000-000000000005")
            		(property "Sheetname" "sub" (at 150 49 0))
            		(property "Sheetfile" "sub.kicad_sch" (at 150 63.5 0))
            		(pin "DATA" input (at 150 55.88 180) (uuid "00000000-0000-0000-0000-000000000006"))
            	)
            )
            """;

    private SchematicContents read() {
        return SchematicContents.read(new SExpressionParser().parse(SCHEMATIC), KicadSymbolLibrary.bundled());
    }

    @Test
    void readsSymbolsWithLibraryPinGeometry() {
        SchematicContents contents = read();
        assertEquals(2, contents.getSymbols().size());

        SchematicContents.PlacedSymbol resistor = contents.getSymbols().get(0);
        assertEquals("R1", resistor.reference());
        assertEquals("10k", resistor.value());
        assertEquals("Resistor_SMD:R_0603", resistor.footprint());
        assertFalse(resistor.power());
        assertEquals(new Position(100.33, 96.52), contents.findPinPosition("R1", "1").orElseThrow());
        assertEquals(new Position(100.33, 104.14), contents.findPinPosition("R1", "2").orElseThrow());
    }

    @Test
    void powerSymbolsAreNotSearchedForPins() {
        SchematicContents contents = read();
        assertTrue(contents.getSymbols().get(1).power());
        assertTrue(contents.findPinPosition("#PWR01", "1").isEmpty());
    }

    @Test
    void readsWiresLabelsAndSheets() {
        SchematicContents contents = read();
        assertEquals(1, contents.getWires().size());
        assertEquals(1, contents.getLabels().size());
        assertEquals(SchematicContents.LabelKind.LOCAL, contents.getLabels().get(0).kind());
        assertEquals("SIG", contents.getLabels().get(0).name());

        SchematicContents.SheetSymbol sheet = contents.findSheet("sub").orElseThrow();
        assertEquals("sub.kicad_sch", sheet.fileName());
        assertEquals(PortDirection.INPUT, sheet.findPin("DATA").orElseThrow().direction());
        assertEquals(new Position(150, 55.88), contents.findSheetPinPosition("sub", "DATA").orElseThrow());
    }
}
