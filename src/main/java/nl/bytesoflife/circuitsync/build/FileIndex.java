package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.kicad.SchematicFile;
import nl.bytesoflife.circuitsync.parser.SNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Links the elements of a file-side graph back to the tree nodes they were read from.
 * Components are keyed by sheet path plus component key, nets by net key, ports by child sheet
 * path plus port name.
 */
public class FileIndex {

    private final Map<String, SchematicFile> sheetFiles = new HashMap<>();
    private final Map<String, SNode.SList> componentNodes = new HashMap<>();
    private final Map<String, List<SNode.SList>> netNodes = new HashMap<>();
    private final Map<String, SNode.SList> sheetSymbolNodes = new HashMap<>();
    private final Map<String, SNode.SList> sheetPinNodes = new HashMap<>();
    private final Map<String, List<SNode.SList>> hierarchicalLabelNodes = new HashMap<>();

    void putSheetFile(String sheetPath, SchematicFile file) {
        sheetFiles.put(sheetPath, file);
    }

    void putComponent(String sheetPath, String componentKey, SNode.SList node) {
        componentNodes.put(sheetPath + componentKey, node);
    }

    void putNet(String netKey, List<SNode.SList> nodes) {
        netNodes.put(netKey, List.copyOf(nodes));
    }

    void putSheetSymbol(String childPath, SNode.SList node) {
        sheetSymbolNodes.put(childPath, node);
    }

    void putSheetPin(String childPath, String name, SNode.SList node) {
        sheetPinNodes.put(childPath + ":" + name, node);
    }

    void addHierarchicalLabel(String childPath, String name, SNode.SList node) {
        hierarchicalLabelNodes.computeIfAbsent(childPath + ":" + name, k -> new ArrayList<>()).add(node);
    }

    public Optional<SchematicFile> sheetFile(String sheetPath) {
        return Optional.ofNullable(sheetFiles.get(sheetPath));
    }

    public Optional<SNode.SList> componentNode(String sheetPath, String componentKey) {
        return Optional.ofNullable(componentNodes.get(sheetPath + componentKey));
    }

    /**
     * Wires, junctions, labels and power symbols owned by the net.
     */
    public List<SNode.SList> netNodes(String netKey) {
        return netNodes.getOrDefault(netKey, List.of());
    }

    public Optional<SNode.SList> sheetSymbolNode(String childPath) {
        return Optional.ofNullable(sheetSymbolNodes.get(childPath));
    }

    public Optional<SNode.SList> sheetPinNode(String childPath, String name) {
        return Optional.ofNullable(sheetPinNodes.get(childPath + ":" + name));
    }

    public List<SNode.SList> hierarchicalLabelNodes(String childPath, String name) {
        return hierarchicalLabelNodes.getOrDefault(childPath + ":" + name, List.of());
    }
}
