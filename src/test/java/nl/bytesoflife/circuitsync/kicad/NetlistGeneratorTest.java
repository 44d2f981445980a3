package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.FlatNet;
import nl.bytesoflife.circuitsync.model.Net;
import nl.bytesoflife.circuitsync.model.NetMember;
import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.model.PinType;
import nl.bytesoflife.circuitsync.model.Sheet;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionParser;
import nl.bytesoflife.circuitsync.parser.SExpressionWriter;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode.SList;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NetlistGeneratorTest {

    private final NetlistGenerator generator = new NetlistGenerator();
    private final SExpressionWriter writer = new SExpressionWriter();

    private static Component resistor(String reference) {
        return new Component(reference).setLibId("Device:R").setValue("10k").setSheetPath("/")
                .setToken("tok-" + reference)
                .addPin(new Pin("1", "~", PinType.PASSIVE))
                .addPin(new Pin("2", "~", PinType.PASSIVE));
    }

    private static CircuitGraph graph(boolean withSecondNet) {
        CircuitGraph graph = new CircuitGraph();
        graph.addSheet(Sheet.root("demo"));
        graph.addComponent(resistor("R1"));
        graph.addComponent(resistor("R2"));
        graph.addNet(new Net("N1", NetScope.LOCAL, "/")
                .addMember(NetMember.componentPin("R1", "1"))
                .addMember(NetMember.componentPin("R2", "1")));
        if (withSecondNet) {
            graph.addComponent(resistor("R3"));
            graph.addNet(new Net("N2", NetScope.LOCAL, "/")
                    .addMember(NetMember.componentPin("R2", "2"))
                    .addMember(NetMember.componentPin("R3", "1")));
        }
        return graph;
    }

    private static SList net(SDocument document, String name) {
        SList nets = SExpressions.findChild(document.getRoot(), "nets").orElseThrow();
        return SExpressions.findChildren(nets, "net").stream()
                .filter(n -> name.equals(SExpressions.childValue(n, "name")))
                .findFirst().orElseThrow();
    }

    @Test
    void createsExportNetlist() {
        NetlistGenerator.NetlistUpdate update = generator.update(null, graph(false), "demo.kicad_sch", "2024-01-01");
        assertTrue(update.changed());

        List<FlatNet> nets = new NetlistReader().readNets(update.document());
        assertEquals(1, nets.size());
        assertEquals("/N1", nets.get(0).name());
        assertEquals(Set.of("R1.1", "R2.1"), nets.get(0).memberKeys());
        assertEquals(2, new NetlistReader().readComponents(update.document()).size());
        assertEquals("tok-R1", new NetlistReader().readComponents(update.document()).get(0).tstamp());
    }

    @Test
    void unchangedCircuitKeepsNetlistAndDate() {
        String first = writer.write(generator.update(null, graph(false), "demo.kicad_sch", "2024-01-01").document());
        SDocument reread = new SExpressionParser().parse(first);

        NetlistGenerator.NetlistUpdate second = generator.update(reread, graph(false), "demo.kicad_sch", "2025-06-30");
        assertFalse(second.changed());
        assertEquals(first, writer.write(second.document()));
    }

    @Test
    void newNetIsAppendedAndOldBlocksKeepTheirText() {
        String first = writer.write(generator.update(null, graph(false), "demo.kicad_sch", "2024-01-01").document());
        SDocument reread = new SExpressionParser().parse(first);
        String n1Before = writer.write(net(reread, "/N1"));

        NetlistGenerator.NetlistUpdate second = generator.update(reread, graph(true), "demo.kicad_sch", "2025-06-30");
        assertTrue(second.changed());
        assertEquals(n1Before, writer.write(net(second.document(), "/N1")));
        assertEquals("2", SExpressions.childValue(net(second.document(), "/N2"), "code"));

        SList design = SExpressions.findChild(second.document().getRoot(), "design").orElseThrow();
        assertEquals("2025-06-30", SExpressions.childValue(design, "date"));
    }

    @Test
    void removedNetIsDeleted() {
        String first = writer.write(generator.update(null, graph(true), "demo.kicad_sch", "2024-01-01").document());
        SDocument reread = new SExpressionParser().parse(first);

        NetlistGenerator.NetlistUpdate second = generator.update(reread, graph(false), "demo.kicad_sch", "2025-06-30");
        assertTrue(second.changed());
        assertTrue(new NetlistReader().findNet(second.document(), "/N2").isEmpty());
        assertEquals(1, new NetlistReader().readComponents(second.document()).stream()
                .filter(c -> c.reference().equals("R1")).count());
    }
}
