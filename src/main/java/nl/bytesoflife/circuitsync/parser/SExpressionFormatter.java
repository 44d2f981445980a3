package nl.bytesoflife.circuitsync.parser;

/**
 * Assigns KiCad-style whitespace to nodes created in memory. Lists made only of atoms stay on one
 * line; every nested list starts on its own line one indent deeper; point lists keep their
 * coordinates on a single line.
 */
public class SExpressionFormatter {

    private final String indentUnit;

    public SExpressionFormatter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /**
     * Uses the indentation found in the document: tabs for KiCad 7 and later, spaces before.
     */
    public static SExpressionFormatter detect(SDocument document) {
        SNode.SList root = document.getRoot();
        for (SNode child : root.children()) {
            String leading = child.leading();
            int nl = leading.lastIndexOf('\n');
            if (nl < 0 || nl == leading.length() - 1) continue;
            String indent = leading.substring(nl + 1);
            if (indent.startsWith("\t")) return new SExpressionFormatter("\t");
            return new SExpressionFormatter(indent);
        }
        return new SExpressionFormatter("\t");
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    /**
     * Formats {@code node} as if it sits at {@code depth} indents.
     */
    public void format(SNode.SList node, int depth) {
        boolean inline = true;
        for (SNode child : node.children()) {
            if (child instanceof SNode.SList) {
                inline = false;
                break;
            }
        }
        boolean points = "pts".equals(node.tag());
        boolean firstList = true;
        for (int i = 0; i < node.size(); i++) {
            SNode child = node.get(i);
            if (i == 0) {
                child.setLeading("");
            } else if (child instanceof SNode.SList list) {
                if (points && !firstList) {
                    list.setLeading(" ");
                } else {
                    list.setLeading(newline(depth + 1));
                }
                firstList = false;
                format(list, depth + 1);
            } else {
                child.setLeading(" ");
            }
        }
        node.setTrailing(inline ? "" : newline(depth));
    }

    /**
     * Inserts a new child into an existing list at {@code index}, formatted to fit its siblings.
     */
    public void insert(SNode.SList parent, int index, SNode.SList child) {
        int depth = depthOf(parent);
        format(child, depth + 1);
        child.setLeading(newline(depth + 1));
        if (!parent.trailing().contains("\n")) {
            parent.setTrailing(newline(depth));
        }
        parent.add(index, child);
    }

    public void append(SNode.SList parent, SNode.SList child) {
        insert(parent, parent.size(), child);
    }

    /**
     * Indentation depth of an existing node, read from the whitespace in front of it.
     */
    public int depthOf(SNode node) {
        String leading = node.leading();
        int nl = leading.lastIndexOf('\n');
        if (nl < 0) return 0;
        String indent = leading.substring(nl + 1);
        if (indentUnit.isEmpty()) return 0;
        int depth = 0;
        int at = 0;
        while (indent.startsWith(indentUnit, at)) {
            depth++;
            at += indentUnit.length();
        }
        return depth;
    }

    private String newline(int depth) {
        return "\n" + indentUnit.repeat(depth);
    }
}
