package nl.bytesoflife.circuitsync.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level expressions of a parsed file plus the trivia after the last one.
 */
public class SDocument {

    private final List<SNode> nodes;
    private String trailing;

    public SDocument(List<SNode> nodes, String trailing) {
        this.nodes = new ArrayList<>(nodes);
        this.trailing = trailing;
    }

    public static SDocument of(SNode.SList root) {
        return new SDocument(List.of(root), "\n");
    }

    public List<SNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * The first top-level list. KiCad files have exactly one.
     */
    public SNode.SList getRoot() {
        for (SNode node : nodes) {
            if (node instanceof SNode.SList list) {
                return list;
            }
        }
        throw new IllegalStateException("Document has no top-level list");
    }

    public String getTrailing() {
        return trailing;
    }

    public void setTrailing(String trailing) {
        this.trailing = trailing;
    }
}
