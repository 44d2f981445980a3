package nl.bytesoflife.circuitsync.parser;

import nl.bytesoflife.circuitsync.parser.SNode.SAtom;
import nl.bytesoflife.circuitsync.parser.SNode.SList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();
    private final SExpressionWriter writer = new SExpressionWriter();

    @Test
    void parseNestedLists() {
        SDocument document = parser.parse("(kicad_sch (version 20231120) (paper \"A4\"))");
        SList root = document.getRoot();
        assertEquals("kicad_sch", root.tag());
        assertEquals(3, root.size());
        assertEquals("20231120", SExpressions.childValue(root, "version"));
        assertEquals("A4", SExpressions.childValue(root, "paper"));
    }

    @Test
    void unescapesQuotedStrings() {
        SList root = parser.parse("(property \"Value\" \"say \\\"hi\\\"\\n\")").getRoot();
        SAtom value = (SAtom) root.get(2);
        assertTrue(value.quoted());
        assertEquals("say \"hi\"\n", value.value());
        assertEquals("\"say \\\"hi\\\"\\n\"", value.text());
    }

    @Test
    void writesUnmodifiedDocumentByteForByte() {
        String input = "(kicad_sch\r\n\t(version 20231120)\r\n"
                + "\t(symbol (lib_id \"Device:R\") (at 100.000 50.80 90)\r\n"
                + "  \t(property \"Reference\" \"R1\"))   \r\n"
                + "\t(unknown_node a b (c))\r\n"
                + ")\r\n\r\n";
        SDocument document = parser.parse(input);
        assertEquals(input, writer.write(document));
    }

    @Test
    void hashAtLineStartIsPartOfAtom() {
        String input = "(a\n#b)";
        SDocument document = parser.parse(input);
        assertEquals("#b", SExpressions.getAtomValue(document.getRoot(), 1));
        assertEquals(input, writer.write(document));
    }

    @Test
    void hashInsideLineIsPartOfAtom() {
        SList root = parser.parse("(property \"Reference\" #PWR01)").getRoot();
        assertEquals("#PWR01", SExpressions.getAtomValue(root, 2));
    }

    @Test
    void unterminatedListReportsEndOfInput() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("(a (b c)"));
        assertEquals(1, e.getLine());
        assertEquals(9, e.getColumn());
        assertEquals("<EOF>", e.getToken());
    }

    @Test
    void unterminatedStringReportsItsStart() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("(a\n  \"bc"));
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
        assertEquals("\"bc", e.getToken());
    }

    @Test
    void strayClosingParenthesis() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("(a))"));
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertEquals(")", e.getToken());
    }

    @Test
    void atomAtTopLevel() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("(a)\n  foo"));
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
        assertEquals("foo", e.getToken());
    }

    @Test
    void errorAttributedToFile() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parser.parse("(a"));
        SyntaxException inFile = e.inFile("board.kicad_sch");
        assertEquals("board.kicad_sch", inFile.getSource());
        assertTrue(inFile.getMessage().contains("board.kicad_sch:1:3"), inFile.getMessage());
    }
}
