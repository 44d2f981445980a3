package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.model.FlatNet;
import nl.bytesoflife.circuitsync.model.PinType;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a KiCad {@code export} netlist (version E) back into flat nets and components.
 */
public class NetlistReader {

    public record NetlistComponent(String reference, String value, String footprint, String lib,
                                   String part, String tstamp) {}

    public List<FlatNet> readNets(SDocument document) {
        List<FlatNet> result = new ArrayList<>();
        Optional<SNode.SList> nets = SExpressions.findChild(document.getRoot(), "nets");
        if (nets.isEmpty()) return result;
        for (SNode.SList net : SExpressions.findChildren(nets.get(), "net")) {
            List<FlatNet.Node> nodes = new ArrayList<>();
            for (SNode.SList node : SExpressions.findChildren(net, "node")) {
                String function = SExpressions.childValue(node, "pinfunction");
                nodes.add(new FlatNet.Node(SExpressions.childValue(node, "ref"),
                        SExpressions.childValue(node, "pin"),
                        PinType.fromKicadName(SExpressions.childValue(node, "pintype")),
                        function == null ? "" : function));
            }
            result.add(new FlatNet(SExpressions.childValue(net, "name"), nodes));
        }
        return result;
    }

    public Optional<FlatNet> findNet(SDocument document, String name) {
        return readNets(document).stream().filter(n -> n.name().equals(name)).findFirst();
    }

    public List<NetlistComponent> readComponents(SDocument document) {
        List<NetlistComponent> result = new ArrayList<>();
        Optional<SNode.SList> components = SExpressions.findChild(document.getRoot(), "components");
        if (components.isEmpty()) return result;
        for (SNode.SList comp : SExpressions.findChildren(components.get(), "comp")) {
            String lib = null;
            String part = null;
            Optional<SNode.SList> libsource = SExpressions.findChild(comp, "libsource");
            if (libsource.isPresent()) {
                lib = SExpressions.childValue(libsource.get(), "lib");
                part = SExpressions.childValue(libsource.get(), "part");
            }
            result.add(new NetlistComponent(SExpressions.childValue(comp, "ref"),
                    SExpressions.childValue(comp, "value"), SExpressions.childValue(comp, "footprint"),
                    lib, part, SExpressions.childValue(comp, "tstamps")));
        }
        return result;
    }
}
