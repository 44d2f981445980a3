package nl.bytesoflife.circuitsync;

import nl.bytesoflife.circuitsync.build.FileCircuit;
import nl.bytesoflife.circuitsync.build.FileGraphBuilder;
import nl.bytesoflife.circuitsync.kicad.KicadProject;
import nl.bytesoflife.circuitsync.kicad.KicadSymbolLibrary;
import nl.bytesoflife.circuitsync.kicad.NetlistReader;
import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.FlatNet;
import nl.bytesoflife.circuitsync.model.IdentityConflictException;
import nl.bytesoflife.circuitsync.model.PinType;
import nl.bytesoflife.circuitsync.model.UnresolvedReferenceException;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionParser;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode.SList;
import nl.bytesoflife.circuitsync.source.Circuit;
import nl.bytesoflife.circuitsync.source.CircuitDescription;
import nl.bytesoflife.circuitsync.source.ComponentSpec;
import nl.bytesoflife.circuitsync.source.ConnectionSpec;
import nl.bytesoflife.circuitsync.source.JsonCircuitReader;
import nl.bytesoflife.circuitsync.source.JsonCircuitWriter;
import nl.bytesoflife.circuitsync.source.NetSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static nl.bytesoflife.circuitsync.SchematicFixtures.uuids;
import static org.junit.jupiter.api.Assertions.*;

class SyncSessionTest {

    private static final String NAME = "demo";

    private static SyncOptions options(int firstUuid) {
        return new SyncOptions()
                .withTokenGenerator(uuids(firstUuid))
                .withClock(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private static SyncResult sync(Path dir, int firstUuid, Circuit circuit) {
        return new SyncSession(options(firstUuid)).sync(dir, NAME, circuit);
    }

    private static CircuitGraph reload(Path dir) {
        FileCircuit file = new FileGraphBuilder(KicadSymbolLibrary.bundled())
                .build(KicadProject.load(dir, NAME, uuids(900)));
        return file.graph();
    }

    private static Optional<FlatNet> flatNet(CircuitGraph graph, String name) {
        return graph.flatten().stream().filter(n -> n.name().equals(name)).findFirst();
    }

    private static Circuit divider() {
        return Circuit.builder("root")
                .component("R1", "Device:R", "10k")
                .component("R2", "Device:R", "10k")
                .component("R3", "Device:R", "4k7")
                .net("VIN", "R1.1")
                .net("MID", "R1.2", "R2.1", "R3.1")
                .net("GND", "R2.2", "R3.2")
                .build();
    }

    @Test
    void createsProjectFromScratch(@TempDir Path dir) throws IOException {
        SyncResult result = sync(dir, 1000, divider());

        assertEquals(SyncStatus.CHANGES_APPLIED, result.status());
        assertTrue(result.warnings().isEmpty(), result.warnings().toString());
        assertTrue(Files.exists(dir.resolve("demo.kicad_sch")));
        assertTrue(Files.exists(dir.resolve("demo.net")));
        assertTrue(Files.exists(dir.resolve("demo.kicad_pro")));
        assertEquals(3, result.writtenFiles().size());
        assertEquals(3, result.report().getAdded().size());
        assertEquals(3, result.report().getMerge().getSymbolsAdded());
        assertEquals(3, result.tokenAssignments().size());

        CircuitGraph graph = reload(dir);
        assertEquals(3, graph.getComponents().size());
        assertEquals(Set.of("R1.2", "R2.1", "R3.1"), flatNet(graph, "/MID").orElseThrow().memberKeys());
        assertEquals(Set.of("R2.2", "R3.2"), flatNet(graph, "GND").orElseThrow().memberKeys());
        for (Component component : graph.getComponents()) {
            assertEquals(result.tokenAssignments().get("/" + component.getKey()), component.getToken());
        }

        SDocument netlist = new SExpressionParser().parse(Files.readString(dir.resolve("demo.net")));
        assertEquals(Set.of("R1.2", "R2.1", "R3.1"),
                new NetlistReader().findNet(netlist, "/MID").orElseThrow().memberKeys());
    }

    @Test
    void secondSyncChangesNothing(@TempDir Path dir) throws IOException {
        sync(dir, 1000, divider());
        String schematic = Files.readString(dir.resolve("demo.kicad_sch"));
        String netlist = Files.readString(dir.resolve("demo.net"));

        SyncResult again = sync(dir, 2000, divider());

        assertEquals(SyncStatus.NO_CHANGES, again.status());
        assertFalse(again.hasChanges());
        assertTrue(again.writtenFiles().isEmpty());
        assertNull(again.report().getMerge());
        assertEquals(schematic, Files.readString(dir.resolve("demo.kicad_sch")));
        assertEquals(netlist, Files.readString(dir.resolve("demo.net")));
    }

    @Test
    void dryRunWritesNothing(@TempDir Path dir) {
        SyncResult result = new SyncSession(options(1000).withDryRun(true)).sync(dir, NAME, divider());

        assertEquals(SyncStatus.CHANGES_APPLIED, result.status());
        assertEquals(3, result.changedFiles().size());
        assertTrue(result.writtenFiles().isEmpty());
        assertFalse(Files.exists(dir.resolve("demo.kicad_sch")));
        assertFalse(Files.exists(dir.resolve("demo.net")));
    }

    private static int junctions(Path dir) throws IOException {
        String schematic = Files.readString(dir.resolve("demo.kicad_sch"));
        int count = 0;
        for (int i = schematic.indexOf("(junction"); i >= 0; i = schematic.indexOf("(junction", i + 1)) {
            count++;
        }
        return count;
    }

    @Test
    void splitsNet(@TempDir Path dir) throws IOException {
        sync(dir, 1000, divider());
        assertEquals(1, junctions(dir), "three pins on MID meet at one junction");
        Map<String, Component> placed = new HashMap<>();
        for (Component component : reload(dir).getComponents()) {
            placed.put(component.getKey(), component);
        }
        Circuit split = Circuit.builder("root")
                .component("R1", "Device:R", "10k")
                .component("R2", "Device:R", "10k")
                .component("R3", "Device:R", "4k7")
                .net("VIN", "R1.1")
                .net("MID", "R1.2", "R2.1")
                .net("TAP", "R3.1")
                .net("GND", "R2.2", "R3.2")
                .build();

        SyncResult result = sync(dir, 2000, split);

        assertEquals(SyncStatus.CHANGES_APPLIED, result.status());
        assertTrue(result.warnings().isEmpty(), result.warnings().toString());
        assertEquals(List.of("/MID"), result.report().getNetsUpdated());
        assertEquals(List.of("/TAP"), result.report().getNetsAdded());
        assertTrue(result.report().getAdded().isEmpty());

        CircuitGraph graph = reload(dir);
        assertEquals(Set.of("R1.2", "R2.1"), flatNet(graph, "/MID").orElseThrow().memberKeys());
        assertEquals(Set.of("R3.1"), flatNet(graph, "/TAP").orElseThrow().memberKeys());
        assertEquals(0, junctions(dir));
        assertEquals(3, graph.getComponents().size());
        for (Component component : graph.getComponents()) {
            Component before = placed.get(component.getKey());
            assertNotNull(before, component.getKey());
            assertEquals(before.getToken(), component.getToken(), component.getKey());
            assertTrue(before.getPosition().sameAs(component.getPosition()), component.getKey());
            assertEquals(before.getRotation(), component.getRotation(), component.getKey());
        }
    }

    @Test
    void updatesValueInPlace(@TempDir Path dir) throws IOException {
        sync(dir, 1000, divider());
        Circuit changed = Circuit.builder("root")
                .component("R1", "Device:R", "22k")
                .component("R2", "Device:R", "10k")
                .component("R3", "Device:R", "4k7")
                .net("VIN", "R1.1")
                .net("MID", "R1.2", "R2.1", "R3.1")
                .net("GND", "R2.2", "R3.2")
                .build();

        SyncResult result = sync(dir, 2000, changed);

        assertEquals(1, result.report().getModified().size());
        assertTrue(result.report().getNetsUpdated().isEmpty());
        assertEquals(0, result.report().getMerge().getWiresAdded());
        assertEquals("22k", reload(dir).findComponent("/", "R1", 1).orElseThrow().getValue());
        assertTrue(Files.readString(dir.resolve("demo.net")).contains("22k"));
    }

    @Test
    void tokenCarriesIdentityAcrossRename(@TempDir Path dir) {
        SyncResult first = sync(dir, 1000, divider());
        String r3Token = first.tokenAssignments().get("/R3");
        Circuit renamed = Circuit.builder("root")
                .component(ComponentSpec.of("R1", "Device:R", "10k").withToken(first.tokenAssignments().get("/R1")))
                .component(ComponentSpec.of("R2", "Device:R", "10k").withToken(first.tokenAssignments().get("/R2")))
                .component(ComponentSpec.of("R7", "Device:R", "4k7").withToken(r3Token))
                .net("VIN", "R1.1")
                .net("MID", "R1.2", "R2.1", "R7.1")
                .net("GND", "R2.2", "R7.2")
                .build();

        SyncResult result = sync(dir, 2000, renamed);

        assertTrue(result.report().getAdded().isEmpty());
        assertTrue(result.report().getRemoved().isEmpty());
        assertEquals("/R3", result.report().getMatched().get("/R7"));
        assertEquals(r3Token, result.tokenAssignments().get("/R7"));

        CircuitGraph graph = reload(dir);
        assertEquals(r3Token, graph.findComponent("/", "R7", 1).orElseThrow().getToken());
        assertTrue(graph.findComponent("/", "R3", 1).isEmpty());
        assertEquals(Set.of("R1.2", "R2.1", "R7.1"), flatNet(graph, "/MID").orElseThrow().memberKeys());
    }

    @Test
    void preservesUserComponentsOnRequest(@TempDir Path dir) {
        sync(dir, 1000, divider());
        Circuit smaller = Circuit.builder("root")
                .component("R1", "Device:R", "10k")
                .component("R2", "Device:R", "10k")
                .net("VIN", "R1.1")
                .net("MID", "R1.2", "R2.1")
                .net("GND", "R2.2")
                .build();

        SyncResult preserved = new SyncSession(options(2000).withPreserveUserComponents(true))
                .sync(dir, NAME, smaller);
        assertEquals(List.of("/R3"), preserved.report().getPreserved());
        assertTrue(reload(dir).findComponent("/", "R3", 1).isPresent());

        SyncResult removed = sync(dir, 3000, smaller);
        assertEquals(List.of("/R3"), removed.report().getRemoved());
        assertTrue(reload(dir).findComponent("/", "R3", 1).isEmpty());
    }

    @Test
    void buildsHierarchyAndRenamesPort(@TempDir Path dir) throws IOException {
        sync(dir, 1000, hierarchy("DATA_IN"));

        assertTrue(Files.exists(dir.resolve("sensor.kicad_sch")));
        CircuitGraph graph = reload(dir);
        assertEquals(2, graph.getSheets().size());
        assertTrue(graph.requireSheet("/sensor/").getPorts().get("DATA_IN").isComplete());
        assertEquals(Set.of("R1.2", "R10.1"), flatNet(graph, "/DATA_IN").orElseThrow().memberKeys());

        SyncResult renamed = sync(dir, 2000, hierarchy("SPI_MOSI"));

        assertTrue(renamed.warnings().isEmpty(), renamed.warnings().toString());
        String child = Files.readString(dir.resolve("sensor.kicad_sch"));
        String root = Files.readString(dir.resolve("demo.kicad_sch"));
        assertFalse(child.contains("DATA_IN"));
        assertFalse(root.contains("DATA_IN"));
        assertTrue(child.contains("SPI_MOSI"));

        CircuitGraph after = reload(dir);
        assertTrue(after.requireSheet("/sensor/").getPorts().get("SPI_MOSI").isComplete());
        assertNull(after.requireSheet("/sensor/").getPorts().get("DATA_IN"));
        assertEquals(Set.of("R1.2", "R10.1"), flatNet(after, "/SPI_MOSI").orElseThrow().memberKeys());

        String netlistText = Files.readString(dir.resolve("demo.net"));
        assertFalse(netlistText.contains("DATA_IN"));
        SDocument netlist = new SExpressionParser().parse(netlistText);
        FlatNet mosi = new NetlistReader().findNet(netlist, "/SPI_MOSI").orElseThrow();
        assertTrue(mosi.nodes().stream().anyMatch(n -> n.reference().equals("R1") && n.pin().equals("2")));
        assertEquals(Set.of("R1.2", "R10.1"), mosi.memberKeys());
    }

    private static Circuit hierarchy(String port) {
        Circuit sensor = Circuit.builder("sensor")
                .component("R10", "Device:R", "1k")
                .net(port, "R10.1")
                .net("GND", "R10.2")
                .build();
        return Circuit.builder("root")
                .component("R1", "Device:R", "10k")
                .net("+5V", "R1.1")
                .net(port, "R1.2")
                .subcircuit(sensor)
                .build();
    }

    @Test
    void exportedDescriptionSyncsBackUnchanged(@TempDir Path dir) throws IOException {
        Circuit original = new JsonCircuitReader().read(new JsonCircuitWriter().write(hierarchy("DATA_IN")));
        SyncResult first = sync(dir, 1000, original);
        String schematic = Files.readString(dir.resolve("demo.kicad_sch"));
        String child = Files.readString(dir.resolve("sensor.kicad_sch"));

        Circuit exported = new SyncSession(options(2000)).export(dir, NAME);

        assertEquals(NAME, exported.name());
        assertEquals(outline(original), outline(exported));
        ComponentSpec r1 = exported.components().get(0);
        assertEquals(first.tokenAssignments().get("/R1"), r1.token());
        assertTrue(r1.hasPlacement());
        assertEquals(first.tokenAssignments().get("/sensor/R10"), exported.subcircuits().get(0).components().get(0).token());

        Circuit reread = new JsonCircuitReader().read(new JsonCircuitWriter().write(exported));
        SyncResult again = sync(dir, 3000, reread);

        assertEquals(SyncStatus.NO_CHANGES, again.status(), again.report().toString());
        assertEquals(schematic, Files.readString(dir.resolve("demo.kicad_sch")));
        assertEquals(child, Files.readString(dir.resolve("sensor.kicad_sch")));
    }

    @Test
    void exportNeedsAnExistingSchematic(@TempDir Path dir) {
        CircuitSyncException e = assertThrows(CircuitSyncException.class,
                () -> new SyncSession(options(1000)).export(dir, NAME));
        assertTrue(e.getMessage().contains("demo.kicad_sch"), e.getMessage());
    }

    // components and net memberships per sheet, without names of the root, tokens or placement
    private static List<String> outline(CircuitDescription circuit) {
        List<String> lines = new ArrayList<>();
        outline(circuit, "/", lines);
        Collections.sort(lines);
        return lines;
    }

    private static void outline(CircuitDescription circuit, String path, List<String> lines) {
        for (ComponentSpec component : circuit.components()) {
            lines.add(path + component.reference() + " " + component.libId() + " " + component.value());
        }
        for (NetSpec net : circuit.nets()) {
            lines.add(path + "net " + net.name() + " " + new TreeSet<>(net.connections().stream()
                    .map(ConnectionSpec::toString).toList()));
        }
        for (CircuitDescription sub : circuit.subcircuits()) {
            outline(sub, path + sub.name() + "/", lines);
        }
    }

    @Test
    void renamingOneNetKeepsOtherNetlistBlocks(@TempDir Path dir) throws IOException {
        sync(dir, 1000, gates("N4"));
        Map<String, String> before = netBlocks(Files.readString(dir.resolve("demo.net")));

        SyncResult result = sync(dir, 2000, gates("OUT"));

        assertEquals(List.of("/N4"), result.report().getNetsRemoved());
        assertEquals(List.of("/OUT"), result.report().getNetsAdded());
        assertTrue(result.report().getNetsUpdated().isEmpty());
        Map<String, String> after = netBlocks(Files.readString(dir.resolve("demo.net")));
        for (String name : new String[] {"/N1", "/N2", "/N3"}) {
            assertNotNull(before.get(name), name);
            assertEquals(before.get(name), after.get(name), name);
        }
        assertFalse(after.containsKey("/N4"));
        assertTrue(after.containsKey("/OUT"));
        assertEquals(Set.of("R4.1", "U1.11"), flatNet(reload(dir), "/OUT").orElseThrow().memberKeys());
    }

    // one net on the output of each of the four gates
    private static Circuit gates(String outputName) {
        return Circuit.builder("root")
                .component("U1", "74xx:74HC00", "74HC00")
                .component("R1", "Device:R", "1k")
                .component("R2", "Device:R", "1k")
                .component("R3", "Device:R", "1k")
                .component("R4", "Device:R", "1k")
                .net("N1", "U1.3", "R1.1")
                .net("N2", "U1.6", "R2.1")
                .net("N3", "U1.8", "R3.1")
                .net(outputName, "U1.11", "R4.1")
                .build();
    }

    private static Map<String, String> netBlocks(String netlist) {
        SList root = new SExpressionParser().parse(netlist).getRoot();
        Map<String, String> blocks = new HashMap<>();
        SList nets = SExpressions.findChild(root, "nets").orElseThrow();
        for (SList net : SExpressions.findChildren(nets, "net")) {
            blocks.put(SExpressions.childValue(net, "name"), net.toString());
        }
        return blocks;
    }

    @Test
    void failedSyncWritesNothing(@TempDir Path dir) throws IOException {
        sync(dir, 1000, divider());
        String schematic = Files.readString(dir.resolve("demo.kicad_sch"));
        Circuit broken = Circuit.builder("root")
                .component("R1", "Device:R", "10k")
                .net("VIN", "R1.1", "R8.1")
                .build();

        assertThrows(UnresolvedReferenceException.class, () -> sync(dir, 2000, broken));
        assertEquals(schematic, Files.readString(dir.resolve("demo.kicad_sch")));
    }

    @Test
    void referenceReusedOnSubcircuitIsRejected(@TempDir Path dir) {
        Circuit sub = Circuit.builder("sub")
                .component("R1", "Device:R", "1k")
                .net("A", "R1.1")
                .net("B", "R1.2")
                .build();
        Circuit root = Circuit.builder("root")
                .component("R1", "Device:R", "22k")
                .net("X", "R1.1")
                .net("Y", "R1.2")
                .subcircuit(sub)
                .build();

        IdentityConflictException e = assertThrows(IdentityConflictException.class, () -> sync(dir, 1000, root));
        assertEquals("R1", e.getIdentity());
        assertFalse(Files.exists(dir.resolve("demo.kicad_sch")));
        assertFalse(Files.exists(dir.resolve("demo.net")));
    }

    @Test
    void preservedComponentsAreMatchedWithTheirSheet() {
        FlatNet net = new FlatNet("/N", List.of(
                new FlatNet.Node("R3", "1", PinType.PASSIVE, "", "/"),
                new FlatNet.Node("R4", "1", PinType.PASSIVE, "", "/sub/")));

        assertEquals(Set.of("R3.1"), SyncSession.withoutPreserved(net, Set.of("/sub/R3", "/sub/R4")));
        assertEquals(Set.of("R3.1", "R4.1"), SyncSession.withoutPreserved(net, Set.of("/R4")));
    }

    @Test
    void ercIsSkippedOnDryRun(@TempDir Path dir) {
        SyncResult result = new SyncSession(options(1000).withDryRun(true).withErc(true)).sync(dir, NAME, divider());

        assertTrue(result.erc().isEmpty());
        assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("ERC skipped")));
    }
}
