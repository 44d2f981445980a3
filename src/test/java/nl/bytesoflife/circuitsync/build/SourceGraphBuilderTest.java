package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.kicad.KicadSymbolLibrary;
import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.FlatNet;
import nl.bytesoflife.circuitsync.model.HierarchicalPort;
import nl.bytesoflife.circuitsync.model.IdentityConflictException;
import nl.bytesoflife.circuitsync.model.Net;
import nl.bytesoflife.circuitsync.model.NetMember;
import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.model.UnresolvedReferenceException;
import nl.bytesoflife.circuitsync.source.Circuit;
import nl.bytesoflife.circuitsync.source.ComponentSpec;
import nl.bytesoflife.circuitsync.source.NetSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SourceGraphBuilderTest {

    private final SourceGraphBuilder builder = new SourceGraphBuilder(KicadSymbolLibrary.bundled());

    @Test
    void infersScopes() {
        Circuit circuit = Circuit.builder("root")
                .component("R1", "Device:R", "10k")
                .component("R2", "Device:R", "10k")
                .net("VCC", "R1.1")
                .net("MID", "R1.2", "R2.1")
                .net(NetSpec.of("OUT", "R2.2").withScope(NetScope.HIERARCHICAL))
                .build();

        CircuitGraph graph = builder.build(circuit);

        assertEquals(NetScope.GLOBAL_POWER, graph.findNet("/", "VCC").orElseThrow().getScope());
        assertEquals(NetScope.LOCAL, graph.findNet("/", "MID").orElseThrow().getScope());
        assertEquals(NetScope.LOCAL, graph.findNet("/", "OUT").orElseThrow().getScope(),
                "hierarchical on the root sheet has nothing to connect to");
    }

    @Test
    void subcircuitNetsSharedWithParentBecomePorts() {
        Circuit filter = Circuit.builder("filter")
                .component("R10", "Device:R", "1k")
                .component("C10", "Device:C", "100n")
                .net("DATA", "R10.1")
                .net("FILTERED", "R10.2", "C10.1")
                .net("GND", "C10.2")
                .build();
        Circuit root = Circuit.builder("root")
                .component("R1", "Device:R", "10k")
                .net("DATA", "R1.2")
                .net("GND", "R1.1")
                .subcircuit(filter)
                .build();

        CircuitGraph graph = builder.build(root);

        assertEquals(2, graph.getSheets().size());
        assertEquals("filter.kicad_sch", graph.requireSheet("/filter/").getFileName());

        Net childData = graph.findNet("/filter/", "DATA").orElseThrow();
        assertEquals(NetScope.HIERARCHICAL, childData.getScope());
        assertEquals(PortDirection.BIDIRECTIONAL, childData.getDirection(), "passive pins only");
        assertEquals(NetScope.LOCAL, graph.findNet("/filter/", "FILTERED").orElseThrow().getScope());
        assertEquals(NetScope.GLOBAL_POWER, graph.findNet("/filter/", "GND").orElseThrow().getScope());

        Net parentData = graph.findNet("/", "DATA").orElseThrow();
        assertTrue(parentData.getMembers().contains(NetMember.sheetPin("filter", "DATA")));

        HierarchicalPort port = graph.requireSheet("/filter/").getPorts().get("DATA");
        assertNotNull(port);
        assertTrue(port.isComplete());

        FlatNet data = graph.flatten().stream().filter(n -> n.name().equals("/DATA")).findFirst().orElseThrow();
        assertEquals(Set.of("R1.2", "R10.1"), data.memberKeys());
        FlatNet gnd = graph.flatten().stream().filter(n -> n.name().equals("GND")).findFirst().orElseThrow();
        assertEquals(Set.of("C10.2", "R1.1"), gnd.memberKeys());
    }

    @Test
    void explicitHierarchicalNetCreatesParentNet() {
        Circuit child = Circuit.builder("io")
                .component("R5", "Device:R", "1k")
                .net(NetSpec.of("EN", "R5.1").withScope(NetScope.HIERARCHICAL).withDirection(PortDirection.PASSIVE))
                .build();
        Circuit root = Circuit.builder("root").subcircuit(child).build();

        CircuitGraph graph = builder.build(root);

        Net parent = graph.findNet("/", "EN").orElseThrow();
        assertEquals(NetScope.LOCAL, parent.getScope());
        assertEquals(Set.of(NetMember.sheetPin("io", "EN")), parent.getMembers());
        assertEquals(PortDirection.BIDIRECTIONAL, graph.findNet("/io/", "EN").orElseThrow().getDirection());
    }

    @Test
    void inputOnlyPortIsInput() {
        Circuit child = Circuit.builder("logic")
                .component("U1", "74xx:74HC00", "74HC00")
                .net(NetSpec.of("A", "U1.1", "U1.2").withScope(NetScope.HIERARCHICAL))
                .build();
        CircuitGraph graph = builder.build(Circuit.builder("root").subcircuit(child).build());

        assertEquals(PortDirection.INPUT, graph.findNet("/logic/", "A").orElseThrow().getDirection());
        assertEquals(PortDirection.INPUT, graph.requireSheet("/logic/").getPorts().get("A").direction());
    }

    @Test
    void instantiatesEveryUnit() {
        Circuit circuit = Circuit.builder("root")
                .component(ComponentSpec.of("U1", "74xx:74HC00", "74HC00").withToken("tok-u1"))
                .net("N1", "U1.1", "U1.4")
                .net("VCC", "U1.14")
                .build();

        CircuitGraph graph = builder.build(circuit);

        List<Component> units = graph.findUnits("/", "U1");
        assertEquals(5, units.size());
        assertEquals("tok-u1", graph.findComponent("/", "U1", 1).orElseThrow().getToken());
        assertNull(graph.findComponent("/", "U1", 2).orElseThrow().getToken());
        assertEquals("U1#5", graph.findUnitForPin("/", "U1", "14").orElseThrow().getKey());
        assertEquals(2, graph.findUnitForPin("/", "U1", "4").orElseThrow().getUnit());
    }

    @Test
    void keepsExplicitPlacementOnFirstUnit() {
        Circuit circuit = Circuit.builder("root")
                .component(ComponentSpec.of("R1", "Device:R", "1k").at(new Position(10.16001, 20.32), 90))
                .build();

        Component r1 = builder.build(circuit).getComponents().get(0);

        assertTrue(r1.isExplicitPlacement());
        assertEquals(new Position(10.16, 20.32), r1.getPosition());
        assertEquals(90, r1.getRotation());
    }

    @Test
    void unknownSymbolTakesConnectedPins() {
        Circuit circuit = Circuit.builder("root")
                .component("J1", "Custom:Header", "HDR")
                .net("A", "J1.1")
                .net("B", "J1.3")
                .build();

        Component j1 = builder.build(circuit).getComponents().get(0);

        assertEquals(2, j1.getPins().size());
        assertTrue(j1.findPin("3").isPresent());
    }

    @Test
    void rejectsUnknownReference() {
        Circuit circuit = Circuit.builder("root")
                .component("R1", "Device:R", "1k")
                .net("A", "R1.1", "R9.2")
                .build();

        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class, () -> builder.build(circuit));
        assertTrue(e.getMessage().contains("R9"));
    }

    @Test
    void rejectsUnknownPin() {
        Circuit circuit = Circuit.builder("root")
                .component("R1", "Device:R", "1k")
                .net("A", "R1.3")
                .build();

        assertThrows(UnresolvedReferenceException.class, () -> builder.build(circuit));
    }

    @Test
    void rejectsDuplicateNetName() {
        Circuit circuit = Circuit.builder("root")
                .component("R1", "Device:R", "1k")
                .net("A", "R1.1")
                .net("A", "R1.2")
                .build();

        assertThrows(IdentityConflictException.class, () -> builder.build(circuit));
    }

    @Test
    void rejectsDuplicateTokens() {
        Circuit circuit = Circuit.builder("root")
                .component(ComponentSpec.of("R1", "Device:R", "1k").withToken("same"))
                .component(ComponentSpec.of("R2", "Device:R", "1k").withToken("same"))
                .build();

        assertThrows(IdentityConflictException.class, () -> builder.build(circuit));
    }
}
