package nl.bytesoflife.circuitsync.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of a lossless S-expression tree. Every node remembers the exact source text it was parsed
 * from together with the whitespace (and comments) in front of it, so an untouched subtree writes
 * back byte for byte.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    /**
     * Whitespace and comments preceding this node.
     */
    String leading();

    void setLeading(String leading);

    /**
     * 1-based source line, or 0 for nodes created in memory.
     */
    int line();

    void writeTo(StringBuilder out);

    final class SAtom implements SNode {
        private final String value;
        private final String text;
        private final boolean quoted;
        private final int line;
        private String leading;

        SAtom(String value, String text, boolean quoted, String leading, int line) {
            this.value = value;
            this.text = text;
            this.quoted = quoted;
            this.leading = leading;
            this.line = line;
        }

        public static SAtom symbol(String value) {
            return new SAtom(value, value, false, " ", 0);
        }

        public static SAtom string(String value) {
            return new SAtom(value, quote(value), true, " ", 0);
        }

        public static SAtom number(double value) {
            String text = SExpressions.formatNumber(value);
            return new SAtom(text, text, false, " ", 0);
        }

        public String value() {
            return value;
        }

        public String text() {
            return text;
        }

        public boolean quoted() {
            return quoted;
        }

        public double doubleValue() {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new NumberFormatException("Not a number: '" + value + "' at line " + line);
            }
        }

        @Override
        public String leading() {
            return leading;
        }

        @Override
        public void setLeading(String leading) {
            this.leading = leading;
        }

        @Override
        public int line() {
            return line;
        }

        @Override
        public void writeTo(StringBuilder out) {
            out.append(leading).append(text);
        }

        private static String quote(String value) {
            StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    default -> sb.append(c);
                }
            }
            return sb.append('"').toString();
        }

        @Override
        public String toString() {
            return text;
        }
    }

    final class SList implements SNode {
        private final List<SNode> children;
        private final int line;
        private String leading;
        private String trailing;

        SList(List<SNode> children, String leading, String trailing, int line) {
            this.children = children;
            this.leading = leading;
            this.trailing = trailing;
            this.line = line;
        }

        /**
         * Creates an in-memory list. Formatting trivia is assigned by {@link SExpressionFormatter}.
         */
        public static SList of(SNode... children) {
            SList list = new SList(new ArrayList<>(), "", "", 0);
            for (SNode child : children) {
                list.add(child);
            }
            return list;
        }

        public static SList tagged(String tag, SNode... rest) {
            SList list = of(SAtom.symbol(tag));
            for (SNode child : rest) {
                list.add(child);
            }
            return list;
        }

        public List<SNode> children() {
            return Collections.unmodifiableList(children);
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        public String tag() {
            if (!children.isEmpty() && children.get(0) instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public void add(SNode child) {
            if (children.isEmpty() && child.line() == 0) {
                child.setLeading("");
            }
            children.add(child);
        }

        public void add(int index, SNode child) {
            children.add(index, child);
        }

        public void set(int index, SNode child) {
            SNode old = children.get(index);
            child.setLeading(old.leading());
            children.set(index, child);
        }

        public boolean remove(SNode child) {
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) == child) {
                    children.remove(i);
                    return true;
                }
            }
            return false;
        }

        public int indexOf(SNode child) {
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) == child) return i;
            }
            return -1;
        }

        public String trailing() {
            return trailing;
        }

        public void setTrailing(String trailing) {
            this.trailing = trailing;
        }

        @Override
        public String leading() {
            return leading;
        }

        @Override
        public void setLeading(String leading) {
            this.leading = leading;
        }

        @Override
        public int line() {
            return line;
        }

        @Override
        public void writeTo(StringBuilder out) {
            out.append(leading).append('(');
            for (SNode child : children) {
                child.writeTo(out);
            }
            out.append(trailing).append(')');
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
