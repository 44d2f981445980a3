package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.HierarchicalPort;

/**
 * Decision for one port of the child sheet at {@code sheetPath}.
 */
public record PortDecision(Decision decision, String sheetPath, String name,
                           HierarchicalPort previous, HierarchicalPort next) {

    @Override
    public String toString() {
        return decision + " port " + sheetPath + ":" + name;
    }
}
