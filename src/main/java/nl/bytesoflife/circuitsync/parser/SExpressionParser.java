package nl.bytesoflife.circuitsync.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Recursive-descent parser for the KiCad S-expression dialects (schematic, PCB, netlist, symbol
 * library). Keeps all trivia so that {@link SExpressionWriter} can reproduce the input exactly.
 */
public class SExpressionParser {

    private String input;
    private int pos;
    private int[] lineStarts;

    public SDocument parse(String text) {
        this.input = text;
        this.pos = 0;
        this.lineStarts = computeLineStarts(text);
        List<SNode> nodes = new ArrayList<>();
        while (true) {
            String leading = skipTrivia();
            if (pos >= input.length()) {
                return new SDocument(nodes, leading);
            }
            char c = input.charAt(pos);
            if (c == '(') {
                nodes.add(parseList(leading));
            } else if (c == ')') {
                throw error("Unbalanced ')'", pos, ")");
            } else {
                throw error("Expected '(' at top level", pos, peekToken());
            }
        }
    }

    private SNode.SList parseList(String leading) {
        int start = pos;
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (true) {
            String childLeading = skipTrivia();
            if (pos >= input.length()) {
                throw error("Unexpected end of input, expected ')' to close list opened at line "
                        + lineOf(start), pos, "<EOF>");
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children, leading, childLeading, lineOf(start));
            } else if (c == '(') {
                children.add(parseList(childLeading));
            } else if (c == '"') {
                children.add(parseQuotedString(childLeading));
            } else {
                children.add(parseAtom(childLeading));
            }
        }
    }

    private SNode.SAtom parseQuotedString(String leading) {
        int start = pos;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(sb.toString(), input.substring(start, pos), true, leading, lineOf(start));
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                char escaped = input.charAt(pos);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
            pos++;
        }
        String fragment = input.substring(start, Math.min(input.length(), start + 20));
        throw error("Unterminated quoted string", start, fragment);
    }

    private SNode.SAtom parseAtom(String leading) {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw error("Expected atom", pos, peekToken());
        }
        String text = input.substring(start, pos);
        return new SNode.SAtom(text, text, false, leading, lineOf(start));
    }

    private String skipTrivia() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (!Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return input.substring(start, pos);
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw error("Expected '" + expected + "'", pos, peekToken());
        }
        pos++;
    }

    private String peekToken() {
        if (pos >= input.length()) return "<EOF>";
        int end = pos;
        while (end < input.length() && !Character.isWhitespace(input.charAt(end)) && end - pos < 20) {
            end++;
        }
        return end == pos ? String.valueOf(input.charAt(pos)) : input.substring(pos, end);
    }

    private SyntaxException error(String message, int offset, String token) {
        int line = lineOf(offset);
        int column = offset - lineStarts[line - 1] + 1;
        return new SyntaxException(message, line, column, token);
    }

    private int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
