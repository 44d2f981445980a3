package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.Net;
import nl.bytesoflife.circuitsync.model.NetMember;
import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.PowerNets;
import nl.bytesoflife.circuitsync.model.ReferenceOrder;
import nl.bytesoflife.circuitsync.model.Sheet;
import nl.bytesoflife.circuitsync.source.Circuit;
import nl.bytesoflife.circuitsync.source.ComponentSpec;
import nl.bytesoflife.circuitsync.source.ConnectionSpec;
import nl.bytesoflife.circuitsync.source.NetSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns a circuit graph back into a description, the inverse of {@link SourceGraphBuilder}.
 * <p>
 * One component spec per package carries the value, footprint, token and placement of its first
 * unit. Placement is always written, so syncing the extracted description leaves every symbol
 * where it is. Sheet pins are left out of the nets: a child net is hierarchical because the
 * parent declares a net of the same name, which an empty net list still does.
 */
public class CircuitExtractor {

    private static final Logger log = LoggerFactory.getLogger(CircuitExtractor.class);

    public Circuit extract(CircuitGraph graph) {
        Circuit circuit = extractSheet(graph, graph.getRoot());
        log.debug("Extracted {} with {} subcircuits", circuit.name(), circuit.subcircuits().size());
        return circuit;
    }

    private Circuit extractSheet(CircuitGraph graph, Sheet sheet) {
        Circuit.Builder builder = Circuit.builder(sheet.getName());

        Map<String, Component> packages = new LinkedHashMap<>();
        List<Component> components = new ArrayList<>(graph.componentsOn(sheet.getPath()));
        components.sort(Comparator.comparing(Component::getReference, ReferenceOrder::compare)
                .thenComparingInt(Component::getUnit));
        for (Component component : components) {
            packages.putIfAbsent(component.getReference(), component);
        }
        for (Component first : packages.values()) {
            ComponentSpec spec = ComponentSpec.of(first.getReference(), first.getLibId(), first.getValue())
                    .withFootprint(first.getFootprint())
                    .withToken(first.getToken());
            if (first.getPosition() != null) {
                spec = spec.at(first.getPosition(), first.getRotation());
            }
            builder.component(spec);
        }

        List<Net> nets = new ArrayList<>(graph.netsOn(sheet.getPath()));
        nets.sort(Comparator.comparing(Net::getName));
        for (Net net : nets) {
            List<ConnectionSpec> connections = new ArrayList<>();
            for (NetMember member : new TreeSet<>(net.getMembers())) {
                if (member.isComponentPin()) {
                    connections.add(new ConnectionSpec(member.owner(), member.pin()));
                }
            }
            NetSpec spec = new NetSpec(net.getName(), explicitScope(graph, sheet, net), null, connections);
            if (net.getScope() == NetScope.HIERARCHICAL && net.getDirection() != null) {
                spec = spec.withDirection(net.getDirection());
            }
            builder.net(spec);
        }

        for (Sheet child : graph.childrenOf(sheet.getPath())) {
            builder.subcircuit(extractSheet(graph, child));
        }
        return builder.build();
    }

    // only what inference from the name and the parent would not give back
    private static NetScope explicitScope(CircuitGraph graph, Sheet sheet, Net net) {
        boolean powerName = PowerNets.isGlobalName(net.getName());
        return switch (net.getScope()) {
            case HIERARCHICAL -> NetScope.HIERARCHICAL;
            case GLOBAL_POWER -> powerName ? null : NetScope.GLOBAL_POWER;
            case LOCAL -> {
                boolean parentDeclares = !sheet.isRoot()
                        && graph.findNet(sheet.getParentPath(), net.getName()).isPresent();
                yield powerName || parentDeclares ? NetScope.LOCAL : null;
            }
        };
    }
}
