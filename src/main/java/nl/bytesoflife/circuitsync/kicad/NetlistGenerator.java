package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.FlatNet;
import nl.bytesoflife.circuitsync.model.ReferenceOrder;
import nl.bytesoflife.circuitsync.model.Sheet;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionFormatter;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode;
import nl.bytesoflife.circuitsync.parser.SNode.SAtom;
import nl.bytesoflife.circuitsync.parser.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes the flattened circuit as a KiCad {@code export} netlist (version E). An existing netlist
 * is updated in place: net and component blocks whose content did not change keep their text and
 * net code; new blocks are appended with fresh codes. The design date is the only volatile field
 * and is refreshed only when something else changed.
 */
public class NetlistGenerator {

    private static final Logger log = LoggerFactory.getLogger(NetlistGenerator.class);

    public static final String TOOL = "circuit-sync 1.0";

    public record NetlistUpdate(SDocument document, boolean changed) {}

    private record CompEntry(String reference, String value, String footprint, String lib, String part,
                             String sheetNames, String sheetTstamps, String tstamp) {}

    public NetlistUpdate update(SDocument existing, CircuitGraph graph, String sourceFile, String date) {
        List<FlatNet> nets = graph.flatten();
        List<CompEntry> comps = components(graph);
        if (existing == null) {
            return new NetlistUpdate(create(nets, comps, sourceFile, date), true);
        }

        SExpressionFormatter formatter = SExpressionFormatter.detect(existing);
        SList root = existing.getRoot();
        boolean changed = mergeComponents(root, comps, formatter);
        changed |= mergeNets(root, nets, formatter);
        if (changed) {
            SExpressions.findChild(root, "design")
                    .flatMap(design -> SExpressions.findChild(design, "date"))
                    .ifPresent(dateNode -> SExpressions.replaceAtom(dateNode, 1, SAtom.string(date)));
        }
        return new NetlistUpdate(existing, changed);
    }

    private SDocument create(List<FlatNet> nets, List<CompEntry> comps, String sourceFile, String date) {
        SList export = SList.tagged("export", SList.tagged("version", SAtom.string("E")));
        export.add(SList.tagged("design",
                SList.tagged("source", SAtom.string(sourceFile)),
                SList.tagged("date", SAtom.string(date)),
                SList.tagged("tool", SAtom.string(TOOL))));
        SList components = SList.tagged("components");
        for (CompEntry comp : comps) {
            components.add(compNode(comp));
        }
        export.add(components);
        SList netsNode = SList.tagged("nets");
        int code = 1;
        for (FlatNet net : nets) {
            netsNode.add(netNode(code++, net));
        }
        export.add(netsNode);
        new SExpressionFormatter("  ").format(export, 0);
        log.debug("Created netlist with {} components and {} nets", comps.size(), nets.size());
        return SDocument.of(export);
    }

    private boolean mergeComponents(SList root, List<CompEntry> comps, SExpressionFormatter formatter) {
        SList components = SExpressions.findChild(root, "components").orElse(null);
        if (components == null) {
            components = SList.tagged("components");
            formatter.insert(root, indexBefore(root, "nets"), components);
        }
        Map<String, SList> existing = new LinkedHashMap<>();
        for (SList comp : SExpressions.findChildren(components, "comp")) {
            existing.put(SExpressions.childValue(comp, "ref"), comp);
        }
        boolean changed = false;
        Set<String> wanted = new HashSet<>();
        for (CompEntry comp : comps) {
            wanted.add(comp.reference());
            SList node = existing.get(comp.reference());
            if (node == null) {
                formatter.append(components, compNode(comp));
                changed = true;
            } else {
                changed |= setChildValue(node, "value", comp.value(), formatter);
                changed |= setChildValue(node, "footprint", comp.footprint(), formatter);
                changed |= setChildValue(node, "tstamps", comp.tstamp(), formatter);
                Optional<SList> libsource = SExpressions.findChild(node, "libsource");
                if (libsource.isPresent()) {
                    changed |= setChildValue(libsource.get(), "lib", comp.lib(), formatter);
                    changed |= setChildValue(libsource.get(), "part", comp.part(), formatter);
                }
            }
        }
        for (Map.Entry<String, SList> entry : existing.entrySet()) {
            if (!wanted.contains(entry.getKey())) {
                components.remove(entry.getValue());
                changed = true;
            }
        }
        return changed;
    }

    private boolean mergeNets(SList root, List<FlatNet> nets, SExpressionFormatter formatter) {
        SList netsNode = SExpressions.findChild(root, "nets").orElse(null);
        if (netsNode == null) {
            netsNode = SList.tagged("nets");
            formatter.append(root, netsNode);
        }
        Map<String, SList> existing = new LinkedHashMap<>();
        int maxCode = 0;
        for (SList net : SExpressions.findChildren(netsNode, "net")) {
            existing.put(SExpressions.childValue(net, "name"), net);
            try {
                maxCode = Math.max(maxCode, Integer.parseInt(SExpressions.childValue(net, "code")));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric net code in {}", net);
            }
        }
        boolean changed = false;
        Set<String> wanted = new HashSet<>();
        for (FlatNet net : nets) {
            wanted.add(net.name());
            SList node = existing.get(net.name());
            if (node == null) {
                formatter.append(netsNode, netNode(++maxCode, net));
                changed = true;
            } else if (!sameNodes(node, net)) {
                replaceNodes(node, net, formatter);
                changed = true;
            }
        }
        for (Map.Entry<String, SList> entry : existing.entrySet()) {
            if (!wanted.contains(entry.getKey())) {
                netsNode.remove(entry.getValue());
                changed = true;
            }
        }
        return changed;
    }

    private static boolean sameNodes(SList netNode, FlatNet net) {
        Set<String> current = new HashSet<>();
        for (SList node : SExpressions.findChildren(netNode, "node")) {
            current.add(SExpressions.childValue(node, "ref") + "." + SExpressions.childValue(node, "pin")
                    + ":" + SExpressions.childValue(node, "pintype"));
        }
        Set<String> wanted = new HashSet<>();
        for (FlatNet.Node node : net.nodes()) {
            wanted.add(node.reference() + "." + node.pin() + ":" + node.pinType().getKicadName());
        }
        return current.equals(wanted);
    }

    private void replaceNodes(SList netNode, FlatNet net, SExpressionFormatter formatter) {
        for (SList node : SExpressions.findChildren(netNode, "node")) {
            netNode.remove(node);
        }
        for (FlatNet.Node node : net.nodes()) {
            formatter.append(netNode, nodeNode(node));
        }
    }

    private static boolean setChildValue(SList parent, String tag, String value, SExpressionFormatter formatter) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        Optional<SList> child = SExpressions.findChild(parent, tag);
        if (child.isPresent()) {
            return SExpressions.replaceAtom(child.get(), 1, SAtom.string(value));
        }
        formatter.append(parent, SList.tagged(tag, SAtom.string(value)));
        return true;
    }

    private static int indexBefore(SList parent, String tag) {
        for (int i = 0; i < parent.size(); i++) {
            if (tag.equals(SExpressions.getTag(parent.get(i)))) return i;
        }
        return parent.size();
    }

    private static SList compNode(CompEntry comp) {
        SList node = SList.tagged("comp", SList.tagged("ref", SAtom.string(comp.reference())));
        node.add(SList.tagged("value", SAtom.string(comp.value())));
        if (!comp.footprint().isEmpty()) {
            node.add(SList.tagged("footprint", SAtom.string(comp.footprint())));
        }
        node.add(SList.tagged("libsource",
                SList.tagged("lib", SAtom.string(comp.lib())),
                SList.tagged("part", SAtom.string(comp.part())),
                SList.tagged("description", SAtom.string(""))));
        node.add(SList.tagged("sheetpath",
                SList.tagged("names", SAtom.string(comp.sheetNames())),
                SList.tagged("tstamps", SAtom.string(comp.sheetTstamps()))));
        if (comp.tstamp() != null) {
            node.add(SList.tagged("tstamps", SAtom.string(comp.tstamp())));
        }
        return node;
    }

    private static SList netNode(int code, FlatNet net) {
        SList node = SList.tagged("net",
                SList.tagged("code", SAtom.string(Integer.toString(code))),
                SList.tagged("name", SAtom.string(net.name())));
        for (FlatNet.Node member : net.nodes()) {
            node.add(nodeNode(member));
        }
        return node;
    }

    private static SList nodeNode(FlatNet.Node member) {
        SList node = SList.tagged("node",
                SList.tagged("ref", SAtom.string(member.reference())),
                SList.tagged("pin", SAtom.string(member.pin())));
        if (member.pinFunction() != null && !member.pinFunction().isEmpty() && !"~".equals(member.pinFunction())) {
            node.add(SList.tagged("pinfunction", SAtom.string(member.pinFunction())));
        }
        node.add(SList.tagged("pintype", SAtom.string(member.pinType().getKicadName())));
        return node;
    }

    private static List<CompEntry> components(CircuitGraph graph) {
        Map<String, CompEntry> byReference = new LinkedHashMap<>();
        for (Component component : graph.getComponents()) {
            if (byReference.containsKey(component.getReference()) && component.getUnit() != 1) continue;
            String libId = component.getLibId();
            int colon = libId.indexOf(':');
            String lib = colon < 0 ? "" : libId.substring(0, colon);
            String part = colon < 0 ? libId : libId.substring(colon + 1);
            byReference.put(component.getReference(), new CompEntry(component.getReference(), component.getValue(),
                    component.getFootprint(), lib, part, component.getSheetPath(),
                    sheetTstamps(graph, component.getSheetPath()), component.getToken()));
        }
        List<CompEntry> result = new ArrayList<>(byReference.values());
        result.sort((a, b) -> ReferenceOrder.compare(a.reference(), b.reference()));
        return result;
    }

    // "/" for the root, "/<sheet uuid>/..." below it
    private static String sheetTstamps(CircuitGraph graph, String sheetPath) {
        StringBuilder path = new StringBuilder();
        Sheet sheet = graph.findSheet(sheetPath).orElse(null);
        while (sheet != null && !sheet.isRoot()) {
            path.insert(0, "/" + sheet.getToken());
            sheet = graph.findSheet(sheet.getParentPath()).orElse(null);
        }
        return path.append("/").toString();
    }
}
