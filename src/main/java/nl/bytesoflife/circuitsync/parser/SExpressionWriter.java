package nl.bytesoflife.circuitsync.parser;

/**
 * Serializes a tree back to text. Parsed nodes are written from their original text, so only
 * nodes created or edited in memory can differ from the input.
 */
public class SExpressionWriter {

    public String write(SDocument document) {
        StringBuilder out = new StringBuilder();
        for (SNode node : document.getNodes()) {
            node.writeTo(out);
        }
        out.append(document.getTrailing());
        return out.toString();
    }

    public String write(SNode node) {
        StringBuilder out = new StringBuilder();
        node.writeTo(out);
        return out.toString();
    }
}
