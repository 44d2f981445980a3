package nl.bytesoflife.circuitsync.model;

/**
 * A named port of a child sheet: the hierarchical label inside the sheet and the pin on the
 * parent's sheet-symbol instance. File-side ports record which half actually exists.
 */
public record HierarchicalPort(String name, PortDirection direction, Position position,
                               boolean labelPresent, boolean pinPresent) {

    public static HierarchicalPort complete(String name, PortDirection direction) {
        return new HierarchicalPort(name, direction, null, true, true);
    }

    public boolean isComplete() {
        return labelPresent && pinPresent;
    }
}
