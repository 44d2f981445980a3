package nl.bytesoflife.circuitsync.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small JSON reader for KiCad project files, ERC reports and circuit descriptions. Objects become
 * insertion-ordered maps, arrays lists and numbers Integer, Long or Double. Errors are reported as
 * {@link IllegalArgumentException} with the line and column of the offending character.
 */
public class JsonParser {

    public Object parse(String json) {
        Cursor cursor = new Cursor(json);
        Object value = cursor.value();
        cursor.skipBlanks();
        if (!cursor.atEnd()) {
            throw cursor.error("trailing content after the JSON value");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> parseObject(String json) {
        Object result = parse(json);
        if (result instanceof Map) {
            return (Map<String, Object>) result;
        }
        throw new IllegalArgumentException("Expected a JSON object at the top level");
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object value) {
        return value instanceof List ? (List<Object>) value : List.of();
    }

    public static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    public static double toDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) return Double.parseDouble(s);
        return 0;
    }

    /**
     * Recursive descent over one input string.
     */
    private static final class Cursor {
        private final String text;
        private int index;

        Cursor(String text) {
            this.text = text;
        }

        Object value() {
            skipBlanks();
            if (atEnd()) throw error("unexpected end of input");
            char c = text.charAt(index);
            switch (c) {
                case '{':
                    return object();
                case '[':
                    return array();
                case '"':
                    return string();
                case 't':
                    literal("true");
                    return Boolean.TRUE;
                case 'f':
                    literal("false");
                    return Boolean.FALSE;
                case 'n':
                    literal("null");
                    return null;
                default:
                    if (c == '-' || Character.isDigit(c)) return number();
                    throw error("unexpected character '" + c + "'");
            }
        }

        private Map<String, Object> object() {
            index++;
            Map<String, Object> members = new LinkedHashMap<>();
            skipBlanks();
            if (consume('}')) return members;
            do {
                skipBlanks();
                if (atEnd() || text.charAt(index) != '"') throw error("expected a member name");
                String name = string();
                skipBlanks();
                require(':');
                members.put(name, value());
                skipBlanks();
            } while (consume(','));
            require('}');
            return members;
        }

        private List<Object> array() {
            index++;
            List<Object> elements = new ArrayList<>();
            skipBlanks();
            if (consume(']')) return elements;
            do {
                elements.add(value());
                skipBlanks();
            } while (consume(','));
            require(']');
            return elements;
        }

        private String string() {
            int start = index++;
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (atEnd()) {
                    index = start;
                    throw error("unterminated string");
                }
                char c = text.charAt(index++);
                if (c == '"') return sb.toString();
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (atEnd()) throw error("unterminated escape");
                char escaped = text.charAt(index++);
                switch (escaped) {
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (index + 4 > text.length()) throw error("short unicode escape");
                        try {
                            sb.append((char) Integer.parseInt(text.substring(index, index + 4), 16));
                        } catch (NumberFormatException e) {
                            throw error("bad unicode escape");
                        }
                        index += 4;
                    }
                    default -> sb.append(escaped);
                }
            }
        }

        private Number number() {
            int start = index;
            boolean fraction = false;
            while (!atEnd()) {
                char c = text.charAt(index);
                if (c == '.' || c == 'e' || c == 'E') {
                    fraction = true;
                } else if (!Character.isDigit(c) && c != '-' && c != '+') {
                    break;
                }
                index++;
            }
            String literal = text.substring(start, index);
            try {
                if (fraction) return Double.parseDouble(literal);
                long value = Long.parseLong(literal);
                if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) return (int) value;
                return value;
            } catch (NumberFormatException e) {
                index = start;
                throw error("malformed number '" + literal + "'");
            }
        }

        private void literal(String word) {
            if (!text.startsWith(word, index)) throw error("expected " + word);
            index += word.length();
        }

        private boolean consume(char c) {
            if (!atEnd() && text.charAt(index) == c) {
                index++;
                return true;
            }
            return false;
        }

        private void require(char c) {
            if (!consume(c)) {
                throw error("expected '" + c + "'");
            }
        }

        void skipBlanks() {
            while (!atEnd() && Character.isWhitespace(text.charAt(index))) index++;
        }

        boolean atEnd() {
            return index >= text.length();
        }

        IllegalArgumentException error(String message) {
            int line = 1;
            int column = 1;
            for (int i = 0; i < Math.min(index, text.length()); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            return new IllegalArgumentException("JSON " + message + " at " + line + ":" + column);
        }
    }
}
