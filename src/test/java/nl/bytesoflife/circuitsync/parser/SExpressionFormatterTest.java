package nl.bytesoflife.circuitsync.parser;

import nl.bytesoflife.circuitsync.parser.SNode.SAtom;
import nl.bytesoflife.circuitsync.parser.SNode.SList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionFormatterTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void detectsTabIndentation() {
        SDocument document = parser.parse("(kicad_sch\n\t(version 1)\n)\n");
        assertEquals("\t", SExpressionFormatter.detect(document).getIndentUnit());
    }

    @Test
    void detectsSpaceIndentation() {
        SDocument document = parser.parse("(kicad_sch\n  (version 1)\n)\n");
        assertEquals("  ", SExpressionFormatter.detect(document).getIndentUnit());
    }

    @Test
    void appendsInKicadStyle() {
        SDocument document = parser.parse("(kicad_sch\n\t(version 1)\n)\n");
        SList junction = SList.tagged("junction", SList.tagged("at", SAtom.number(1), SAtom.number(2.5)));
        SExpressionFormatter.detect(document).append(document.getRoot(), junction);

        assertEquals("(kicad_sch\n\t(version 1)\n\t(junction\n\t\t(at 1 2.5)\n\t)\n)\n",
                new SExpressionWriter().write(document));
    }

    @Test
    void insertKeepsUntouchedSiblings() {
        String input = "(kicad_sch\n\t(version 1)\n\t(wire (pts (xy 0 0) (xy 1 0)))\n)\n";
        SDocument document = parser.parse(input);
        SList label = SList.tagged("label", SAtom.string("A"));
        SExpressionFormatter.detect(document).insert(document.getRoot(), 2, label);

        assertEquals("(kicad_sch\n\t(version 1)\n\t(label \"A\")\n\t(wire (pts (xy 0 0) (xy 1 0)))\n)\n",
                new SExpressionWriter().write(document));
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, 1",
            "-0.0, 0",
            "2.54000001, 2.54",
            "1.23456, 1.2346",
            "100, 100",
            "-12.7, -12.7"
    })
    void formatsNumbersLikeKicad(double value, String expected) {
        assertEquals(expected, SExpressions.formatNumber(value));
    }
}
