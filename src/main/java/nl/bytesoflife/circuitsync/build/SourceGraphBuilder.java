package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.kicad.LibSymbol;
import nl.bytesoflife.circuitsync.kicad.SymbolLibrary;
import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.HierarchicalPort;
import nl.bytesoflife.circuitsync.model.IdentityConflictException;
import nl.bytesoflife.circuitsync.model.Net;
import nl.bytesoflife.circuitsync.model.NetMember;
import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.model.PinType;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.PowerNets;
import nl.bytesoflife.circuitsync.model.Sheet;
import nl.bytesoflife.circuitsync.model.UnresolvedReferenceException;
import nl.bytesoflife.circuitsync.source.CircuitDescription;
import nl.bytesoflife.circuitsync.source.ComponentSpec;
import nl.bytesoflife.circuitsync.source.ConnectionSpec;
import nl.bytesoflife.circuitsync.source.NetSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the circuit graph a description asks for. Each subcircuit becomes a child sheet named
 * after it; nets shared with the parent by name become hierarchical and get a sheet pin on the
 * parent side and a port on the child.
 */
public class SourceGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(SourceGraphBuilder.class);

    private final SymbolLibrary library;

    public SourceGraphBuilder(SymbolLibrary library) {
        this.library = library;
    }

    public CircuitGraph build(CircuitDescription description) {
        CircuitGraph graph = new CircuitGraph();
        Sheet root = graph.addSheet(Sheet.root(description.name()));
        buildSheet(graph, description, root, Set.of());
        graph.validate();
        log.debug("Source graph: {} sheets, {} components, {} nets",
                graph.getSheets().size(), graph.getComponents().size(), graph.getNets().size());
        return graph;
    }

    private void buildSheet(CircuitGraph graph, CircuitDescription description, Sheet sheet, Set<String> parentNames) {
        String path = sheet.getPath();
        Map<String, Set<String>> connectedPins = connectedPins(description);

        for (ComponentSpec spec : description.components()) {
            addComponent(graph, spec, path, connectedPins.getOrDefault(spec.reference(), Set.of()));
        }

        Set<String> declared = new HashSet<>();
        for (NetSpec spec : description.nets()) {
            if (!declared.add(spec.name())) {
                throw new IdentityConflictException(path + spec.name(), "a net on " + path,
                        "another net of the same name");
            }
            NetScope scope = scopeOf(spec, sheet, parentNames);
            Net net = new Net(spec.name(), scope, path);
            for (ConnectionSpec connection : spec.connections()) {
                if (graph.findUnits(path, connection.reference()).isEmpty()) {
                    throw new UnresolvedReferenceException(spec.name(), connection.reference(),
                            "no such component on sheet " + path);
                }
                net.addMember(NetMember.componentPin(connection.reference(), connection.pin()));
            }
            graph.addNet(net);
        }

        for (CircuitDescription sub : description.subcircuits()) {
            Sheet child = graph.addSheet(new Sheet(sub.name(), Sheet.childPath(path, sub.name()), path)
                    .setFileName(sub.name() + ".kicad_sch"));
            buildSheet(graph, sub, child, declared);
            connectPorts(graph, sub, sheet, child);
        }
    }

    private void addComponent(CircuitGraph graph, ComponentSpec spec, String path, Set<String> connectedPins) {
        Optional<LibSymbol> symbol = library.find(spec.libId());
        int units = symbol.map(LibSymbol::getUnitCount).orElse(1);
        for (int unit = 1; unit <= units; unit++) {
            Component component = new Component(spec.reference(), unit)
                    .setValue(spec.value())
                    .setFootprint(spec.footprint())
                    .setLibId(spec.libId())
                    .setSheetPath(path);
            if (unit == 1) {
                component.setToken(spec.token());
                if (spec.hasPlacement()) {
                    component.setPosition(spec.position().rounded())
                            .setRotation(spec.rotation() == null ? 0 : spec.rotation())
                            .setExplicitPlacement(true);
                }
            }
            if (symbol.isPresent()) {
                for (LibSymbol.LibPin pin : symbol.get().getPins(unit)) {
                    component.addPin(pin.toPin());
                }
            } else if (!spec.pins().isEmpty()) {
                spec.pins().forEach(component::addPin);
            } else {
                for (String number : connectedPins) {
                    component.addPin(new Pin(number, "", PinType.PASSIVE));
                }
            }
            graph.addComponent(component);
        }
        if (symbol.isEmpty()) {
            log.debug("Symbol {} of {} not in library, pins taken from the description", spec.libId(), spec.reference());
        }
    }

    private static Map<String, Set<String>> connectedPins(CircuitDescription description) {
        Map<String, Set<String>> pins = new LinkedHashMap<>();
        for (NetSpec net : description.nets()) {
            for (ConnectionSpec connection : net.connections()) {
                pins.computeIfAbsent(connection.reference(), k -> new LinkedHashSet<>()).add(connection.pin());
            }
        }
        return pins;
    }

    private static NetScope scopeOf(NetSpec spec, Sheet sheet, Set<String> parentNames) {
        NetScope scope = spec.scope();
        if (scope == NetScope.HIERARCHICAL && sheet.isRoot()) {
            log.debug("Net {} is declared hierarchical on the root sheet, treated as local", spec.name());
            return NetScope.LOCAL;
        }
        if (scope != null) return scope;
        if (PowerNets.isGlobalName(spec.name())) return NetScope.GLOBAL_POWER;
        if (!sheet.isRoot() && parentNames.contains(spec.name())) return NetScope.HIERARCHICAL;
        return NetScope.LOCAL;
    }

    private void connectPorts(CircuitGraph graph, CircuitDescription description, Sheet parent, Sheet child) {
        for (NetSpec spec : description.nets()) {
            Net net = graph.findNet(child.getPath(), spec.name()).orElseThrow();
            if (net.getScope() != NetScope.HIERARCHICAL) continue;

            Net parentNet = graph.findNet(parent.getPath(), spec.name())
                    .orElseGet(() -> graph.addNet(new Net(spec.name(), NetScope.LOCAL, parent.getPath())));
            parentNet.addMember(NetMember.sheetPin(child.getName(), spec.name()));

            PortDirection direction = spec.direction();
            if (direction == PortDirection.PASSIVE) {
                direction = PortDirection.BIDIRECTIONAL;
            } else if (direction == null) {
                direction = PortDirection.infer(memberPinTypes(graph, net));
            }
            net.setDirection(direction);
            child.putPort(HierarchicalPort.complete(spec.name(), direction));
        }
    }

    private static List<PinType> memberPinTypes(CircuitGraph graph, Net net) {
        List<PinType> types = new ArrayList<>();
        for (NetMember member : net.getMembers()) {
            if (!member.isComponentPin()) continue;
            types.add(graph.findUnitForPin(net.getSheetPath(), member.owner(), member.pin())
                    .flatMap(c -> c.findPin(member.pin()))
                    .map(Pin::type)
                    .orElse(PinType.PASSIVE));
        }
        return types;
    }
}
