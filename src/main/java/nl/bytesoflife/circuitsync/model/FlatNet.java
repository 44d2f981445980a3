package nl.bytesoflife.circuitsync.model;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A net of the flattened netlist: all component pins that are electrically joined across the
 * whole hierarchy.
 */
public record FlatNet(String name, List<Node> nodes) {

    /**
     * One joined pin. The sheet path is null when the node was read from a netlist, which only
     * names the reference.
     */
    public record Node(String reference, String pin, PinType pinType, String pinFunction, String sheetPath) {

        public Node(String reference, String pin, PinType pinType, String pinFunction) {
            this(reference, pin, pinType, pinFunction, null);
        }

        public String key() {
            return reference + "." + pin;
        }
    }

    /**
     * Membership as {@code ref.pin} strings, for comparisons that ignore the net name.
     */
    public Set<String> memberKeys() {
        Set<String> keys = new TreeSet<>();
        for (Node node : nodes) {
            keys.add(node.key());
        }
        return keys;
    }
}
