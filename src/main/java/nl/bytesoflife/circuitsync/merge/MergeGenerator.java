package nl.bytesoflife.circuitsync.merge;

import nl.bytesoflife.circuitsync.CircuitSyncException;
import nl.bytesoflife.circuitsync.build.FileCircuit;
import nl.bytesoflife.circuitsync.geometry.GridPlacement;
import nl.bytesoflife.circuitsync.geometry.PlacementProvider;
import nl.bytesoflife.circuitsync.kicad.KicadProject;
import nl.bytesoflife.circuitsync.kicad.KicadTemplates;
import nl.bytesoflife.circuitsync.kicad.SchematicContents;
import nl.bytesoflife.circuitsync.kicad.SchematicFile;
import nl.bytesoflife.circuitsync.kicad.SymbolLibrary;
import nl.bytesoflife.circuitsync.match.ComponentChange;
import nl.bytesoflife.circuitsync.match.ComponentDecision;
import nl.bytesoflife.circuitsync.match.Decision;
import nl.bytesoflife.circuitsync.match.NetDecision;
import nl.bytesoflife.circuitsync.match.PortDecision;
import nl.bytesoflife.circuitsync.match.SheetDecision;
import nl.bytesoflife.circuitsync.match.SyncPlan;
import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.Net;
import nl.bytesoflife.circuitsync.model.NetMember;
import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.model.Sheet;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionFormatter;
import nl.bytesoflife.circuitsync.parser.SExpressionParser;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode.SList;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Applies a {@link SyncPlan} to the loaded schematic trees. Only nodes named by a decision are
 * touched; everything else keeps its bytes. Phases run in dependency order: sheets, components,
 * ports, nets, then embedded library cleanup.
 */
public class MergeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MergeGenerator.class);

    /** A4 landscape, the paper size of the generated skeletons. */
    public static final double PAPER_WIDTH = 297;
    public static final double PAPER_HEIGHT = 210;

    private static final double PIN_PITCH = 2.54;

    private final SymbolLibrary library;
    private final PlacementProvider placement;
    private final Supplier<String> tokens;

    public MergeGenerator(SymbolLibrary library, Supplier<String> tokens) {
        this(library, new GridPlacement(), tokens);
    }

    public MergeGenerator(SymbolLibrary library, PlacementProvider placement, Supplier<String> tokens) {
        this.library = library;
        this.placement = placement;
        this.tokens = tokens;
    }

    public MergeReport apply(KicadProject project, FileCircuit file, SyncPlan plan, CircuitGraph source) {
        MergeReport report = new MergeReport();
        NodeFactory nodes = new NodeFactory(tokens);
        MergeState state = new MergeState(project, file, nodes, report);
        LibraryEmbedder embedder = new LibraryEmbedder(library, nodes);

        applySheets(state, plan);
        applyComponents(state, plan, source, embedder);
        applyPorts(state, plan, source);
        applyNets(state, plan);

        for (SchematicFile schematic : project.getSchematics().values()) {
            if (schematic.isModified()) {
                report.libSymbolsRemoved(embedder.removeUnused(schematic.getDocument()));
            }
        }
        log.info("{}", report);
        return report;
    }

    // --- sheets -----------------------------------------------------------------------------

    private void applySheets(MergeState state, SyncPlan plan) {
        List<SheetDecision> decisions = new ArrayList<>(plan.getSheets());
        decisions.sort(Comparator.comparingInt(d -> depth(d.getSheet().getPath())));
        for (SheetDecision decision : decisions) {
            if (decision.decision() == Decision.ADD) {
                addSheet(state, decision.next());
            } else if (decision.decision() == Decision.REMOVE) {
                removeSheet(state, decision.previous());
            }
        }
    }

    private void addSheet(MergeState state, Sheet sheet) {
        SchematicFile parent = state.fileOf(sheet.getParentPath())
                .orElseThrow(() -> new IllegalStateException("No file for sheet " + sheet.getParentPath()));
        String fileName = sheet.getFileName() != null ? sheet.getFileName() : sheet.getName() + ".kicad_sch";
        if (state.project.getSchematic(fileName) != null) {
            throw new CircuitSyncException("Cannot add sheet " + sheet.getPath() + ": file " + fileName
                    + " already belongs to another sheet");
        }
        SDocument childDocument = new SExpressionParser().parse(KicadTemplates.sheetSchematic(tokens.get()));
        SchematicFile child = state.project.addSchematic(fileName, childDocument);

        double height = Math.max(NodeFactory.SHEET_MIN_HEIGHT, (sheet.getPorts().size() + 1) * PIN_PITCH);
        Component pseudo = new Component("sheet:" + sheet.getName());
        Position center = placement.place(List.of(pseudo), List.of(), PAPER_WIDTH, PAPER_HEIGHT,
                occupied(parent.getDocument())).get(pseudo.getKey());
        Position at = center.translate(-NodeFactory.SHEET_WIDTH / 2, -height / 2).snapToGrid();

        String uuid = tokens.get();
        int page = state.project.getSchematics().size();
        SList node = state.nodes.sheet(sheet.getName(), fileName, at, height, uuid, state.project.getName(),
                state.instancePath(sheet.getParentPath()), page);
        MergeState.insertTopLevel(parent.getDocument(), node);
        state.putSheet(sheet.getPath(), child, node, uuid);
        state.report.sheetAdded();
        log.debug("Added sheet {} ({}) at {}", sheet.getPath(), fileName, at);
    }

    private void removeSheet(MergeState state, Sheet sheet) {
        Optional<SList> node = state.sheetSymbolOf(sheet.getPath());
        Optional<SchematicFile> parent = state.fileOf(sheet.getParentPath());
        if (node.isPresent() && parent.isPresent()) {
            MergeState.removeTopLevel(parent.get().getDocument(), node.get());
        }
        state.report.sheetRemoved();
        String warning = "Sheet " + sheet.getPath() + " removed; its file " + sheet.getFileName() + " was kept on disk";
        log.warn(warning);
        state.report.warn(warning);
    }

    // --- components -------------------------------------------------------------------------

    private void applyComponents(MergeState state, SyncPlan plan, CircuitGraph source, LibraryEmbedder embedder) {
        Map<String, List<Component>> added = new TreeMap<>();
        for (ComponentDecision decision : plan.getComponents()) {
            switch (decision.decision()) {
                case REMOVE -> removeComponent(state, decision.previous());
                case UPDATE -> updateComponent(state, decision, embedder);
                case ADD -> added.computeIfAbsent(decision.next().getSheetPath(), k -> new ArrayList<>())
                        .add(decision.next());
                case KEEP -> {
                }
            }
        }
        for (Map.Entry<String, List<Component>> entry : added.entrySet()) {
            addComponents(state, entry.getKey(), entry.getValue(), plan, source, embedder);
        }
    }

    private void removeComponent(MergeState state, Component component) {
        Optional<SList> node = state.file.index().componentNode(component.getSheetPath(), component.getKey());
        Optional<SchematicFile> schematic = state.fileOf(component.getSheetPath());
        if (node.isPresent() && schematic.isPresent()) {
            MergeState.removeTopLevel(schematic.get().getDocument(), node.get());
            state.report.symbolRemoved();
        }
    }

    private void updateComponent(MergeState state, ComponentDecision decision, LibraryEmbedder embedder) {
        Component previous = decision.previous();
        Component next = decision.next();
        SList node = state.file.index().componentNode(previous.getSheetPath(), previous.getKey()).orElse(null);
        SchematicFile schematic = state.fileOf(previous.getSheetPath()).orElse(null);
        if (node == null || schematic == null) {
            state.report.warn("No symbol node for " + previous.getSheetPath() + previous.getKey());
            return;
        }
        SDocument document = schematic.getDocument();
        if (decision.hasChange(ComponentChange.VALUE)) {
            setProperty(state.nodes, document, node, "Value", next.getValue());
        }
        if (decision.hasChange(ComponentChange.FOOTPRINT)) {
            setProperty(state.nodes, document, node, "Footprint", next.getFootprint());
        }
        if (decision.hasChange(ComponentChange.REFERENCE)) {
            setProperty(state.nodes, document, node, "Reference", next.getReference());
            setInstanceReferences(node, next.getReference());
        }
        if (decision.hasChange(ComponentChange.LIBRARY)) {
            changeSymbol(state, document, node, next, embedder);
        }
        if (decision.hasChange(ComponentChange.PLACEMENT)) {
            move(node, next.getPosition(), next.getRotation());
        }
        state.report.symbolUpdated();
        log.debug("Updated {}{} {}", next.getSheetPath(), next.getKey(), decision.changes());
    }

    private static void setProperty(NodeFactory nodes, SDocument document, SList node, String name, String value) {
        Optional<SList> property = SExpressions.findProperty(node, name);
        if (property.isPresent()) {
            SExpressions.replaceAtom(property.get(), 2, NodeFactory.str(value));
            return;
        }
        SList created = nodes.property(name, value, position(node), true);
        int index = indexOfFirst(node, "pin", "instances");
        SExpressionFormatter.detect(document).insert(node, index, created);
    }

    private static void setInstanceReferences(SList node, String reference) {
        SExpressions.findChild(node, "instances").ifPresent(instances -> {
            for (SList project : SExpressions.findChildren(instances, "project")) {
                for (SList path : SExpressions.findChildren(project, "path")) {
                    SExpressions.findChild(path, "reference")
                            .ifPresent(ref -> SExpressions.replaceAtom(ref, 1, NodeFactory.str(reference)));
                }
            }
        });
    }

    private void changeSymbol(MergeState state, SDocument document, SList node, Component next,
                              LibraryEmbedder embedder) {
        SExpressions.findChild(node, "lib_id")
                .ifPresent(libId -> SExpressions.replaceAtom(libId, 1, NodeFactory.str(next.getLibId())));
        SExpressions.findChild(node, "lib_name").ifPresent(node::remove);
        embedder.ensure(document, next.getLibId(), next.getPins());
        for (SList pin : SExpressions.findChildren(node, "pin")) {
            node.remove(pin);
        }
        SExpressionFormatter formatter = SExpressionFormatter.detect(document);
        int index = indexOfFirst(node, "instances");
        for (Pin pin : next.getPins()) {
            formatter.insert(node, index++, state.nodes.pinEntry(pin.number()));
        }
    }

    /**
     * Moves a placed symbol and carries its property texts along by the same offset.
     */
    private static void move(SList node, Position target, int rotation) {
        SList at = SExpressions.findChild(node, "at").orElse(null);
        if (at == null) return;
        double dx = target.x() - SExpressions.getDouble(at, 1, 0);
        double dy = target.y() - SExpressions.getDouble(at, 2, 0);
        SExpressions.replaceAtom(at, 1, NodeFactory.num(target.x()));
        SExpressions.replaceAtom(at, 2, NodeFactory.num(target.y()));
        if (at.size() > 3) {
            SExpressions.replaceAtom(at, 3, NodeFactory.num(rotation));
        } else {
            at.add(NodeFactory.num(rotation));
        }
        for (SList property : SExpressions.findChildren(node, "property")) {
            SExpressions.findChild(property, "at").ifPresent(p -> {
                SExpressions.replaceAtom(p, 1, NodeFactory.num(SExpressions.getDouble(p, 1, 0) + dx));
                SExpressions.replaceAtom(p, 2, NodeFactory.num(SExpressions.getDouble(p, 2, 0) + dy));
            });
        }
    }

    private void addComponents(MergeState state, String sheetPath, List<Component> components, SyncPlan plan,
                               CircuitGraph source, LibraryEmbedder embedder) {
        SchematicFile schematic = state.fileOf(sheetPath)
                .orElseThrow(() -> new IllegalStateException("No file for sheet " + sheetPath));
        SDocument document = schematic.getDocument();

        List<Component> unplaced = new ArrayList<>();
        for (Component component : components) {
            if (component.getPosition() == null) unplaced.add(component);
        }
        Map<String, Position> positions = unplaced.isEmpty() ? Map.of()
                : placement.place(unplaced, connections(source, sheetPath), PAPER_WIDTH, PAPER_HEIGHT,
                occupied(document));

        String instancePath = state.instancePath(sheetPath);
        for (Component component : components) {
            Position at = component.getPosition() != null ? component.getPosition() : positions.get(component.getKey());
            String token = component.getToken() != null ? component.getToken() : tokens.get();
            plan.assignToken(sheetPath + component.getKey(), token);
            if (embedder.ensure(document, component.getLibId(), component.getPins())) {
                state.report.warn("Generated a generic symbol for " + component.getLibId());
            }
            SList node = state.nodes.symbol(component.getLibId(), at, component.getRotation(), component.getUnit(),
                    token, component.getReference(), component.getValue(), component.getFootprint(),
                    component.getPins(), state.project.getName(), instancePath);
            MergeState.insertTopLevel(document, node);
            state.report.symbolAdded();
            log.debug("Added {}{} at {}", sheetPath, component.getKey(), at);
        }
    }

    private static List<PlacementProvider.Connection> connections(CircuitGraph source, String sheetPath) {
        List<PlacementProvider.Connection> connections = new ArrayList<>();
        for (Net net : source.netsOn(sheetPath)) {
            String previous = null;
            for (NetMember member : net.getMembers()) {
                if (!member.isComponentPin()) continue;
                if (previous != null && !previous.equals(member.owner())) {
                    connections.add(new PlacementProvider.Connection(previous, member.owner()));
                }
                previous = member.owner();
            }
        }
        return connections;
    }

    private List<Envelope> occupied(SDocument document) {
        SchematicContents contents = SchematicContents.read(document, library);
        List<Envelope> occupied = new ArrayList<>();
        for (SchematicContents.PlacedSymbol symbol : contents.getSymbols()) {
            Envelope envelope = new Envelope(symbol.position().x(), symbol.position().x(),
                    symbol.position().y(), symbol.position().y());
            symbol.pins().forEach(p -> envelope.expandToInclude(p.position().x(), p.position().y()));
            envelope.expandBy(PIN_PITCH);
            occupied.add(envelope);
        }
        for (SchematicContents.SheetSymbol sheet : contents.getSheets()) {
            occupied.add(new Envelope(sheet.position().x(), sheet.position().x() + sheet.width(),
                    sheet.position().y(), sheet.position().y() + sheet.height()));
        }
        contents.getWires().forEach(w -> occupied.add(w.segment().getEnvelope()));
        for (SchematicContents.Label label : contents.getLabels()) {
            Envelope envelope = new Envelope(label.position().x(), label.position().x(),
                    label.position().y(), label.position().y());
            envelope.expandBy(Position.GRID);
            occupied.add(envelope);
        }
        return occupied;
    }

    // --- ports ------------------------------------------------------------------------------

    private void applyPorts(MergeState state, SyncPlan plan, CircuitGraph source) {
        for (PortDecision decision : plan.getPorts()) {
            if (decision.decision() == Decision.KEEP) continue;
            Optional<SList> sheetNode = state.sheetSymbolOf(decision.sheetPath());
            Sheet sheet = (decision.next() != null ? source : state.file.graph()).requireSheet(decision.sheetPath());
            Optional<SchematicFile> parent = state.fileOf(sheet.getParentPath());
            if (sheetNode.isEmpty() || parent.isEmpty()) {
                state.report.warn("No sheet symbol for " + decision.sheetPath() + ", port " + decision.name() + " skipped");
                continue;
            }
            SDocument document = parent.get().getDocument();
            switch (decision.decision()) {
                case ADD -> addSheetPin(document, sheetNode.get(), decision.name(), decision.next().direction(), state);
                case UPDATE -> {
                    PortDirection direction = decision.next().direction();
                    Optional<SList> pin = findSheetPin(sheetNode.get(), decision.name());
                    if (pin.isPresent()) {
                        SExpressions.replaceAtom(pin.get(), 2, NodeFactory.sym(direction.getKicadShape()));
                    } else {
                        addSheetPin(document, sheetNode.get(), decision.name(), direction, state);
                    }
                    for (SList label : state.file.index().hierarchicalLabelNodes(decision.sheetPath(), decision.name())) {
                        SExpressions.findChild(label, "shape").ifPresent(
                                shape -> SExpressions.replaceAtom(shape, 1, NodeFactory.sym(direction.getKicadShape())));
                    }
                }
                case REMOVE -> {
                    findSheetPin(sheetNode.get(), decision.name()).ifPresent(sheetNode.get()::remove);
                    state.fileOf(decision.sheetPath()).ifPresent(child -> {
                        for (SList label : state.file.index().hierarchicalLabelNodes(decision.sheetPath(), decision.name())) {
                            MergeState.removeTopLevel(child.getDocument(), label);
                        }
                    });
                }
                case KEEP -> {
                }
            }
        }
    }

    private static Optional<SList> findSheetPin(SList sheetNode, String name) {
        for (SList pin : SExpressions.findChildren(sheetNode, "pin")) {
            if (name.equals(SExpressions.getAtomValue(pin, 1))) return Optional.of(pin);
        }
        return Optional.empty();
    }

    /**
     * Adds a pin on the sheet border: inputs on the left edge, everything else on the right, at the
     * first free 2.54 mm slot from the top. The sheet grows when the edge is full.
     */
    private static void addSheetPin(SDocument document, SList sheetNode, String name, PortDirection direction,
                                    MergeState state) {
        SList at = SExpressions.findChild(sheetNode, "at").orElseThrow();
        SList size = SExpressions.findChild(sheetNode, "size").orElseThrow();
        double x = SExpressions.getDouble(at, 1, 0);
        double y = SExpressions.getDouble(at, 2, 0);
        double width = SExpressions.getDouble(size, 1, NodeFactory.SHEET_WIDTH);
        double height = SExpressions.getDouble(size, 2, NodeFactory.SHEET_MIN_HEIGHT);
        boolean left = direction == PortDirection.INPUT;
        double edge = new Position(left ? x : x + width, 0).rounded().x();

        List<Double> used = new ArrayList<>();
        for (SList pin : SExpressions.findChildren(sheetNode, "pin")) {
            SExpressions.findChild(pin, "at").ifPresent(p -> {
                if (Math.abs(SExpressions.getDouble(p, 1, 0) - edge) < 1e-4) used.add(SExpressions.getDouble(p, 2, 0));
            });
        }
        double slot = y + PIN_PITCH;
        while (isUsed(used, slot)) {
            slot += PIN_PITCH;
        }
        Position position = new Position(edge, slot).rounded();
        if (position.y() > y + height - Position.GRID) {
            SExpressions.replaceAtom(size, 2, NodeFactory.num(position.y() - y + PIN_PITCH));
        }
        SList pin = state.nodes.sheetPin(name, direction, position, left);
        SExpressionFormatter.detect(document).insert(sheetNode, indexOfFirst(sheetNode, "instances"), pin);
    }

    private static boolean isUsed(List<Double> used, double y) {
        for (double value : used) {
            if (Math.abs(value - y) < 1e-4) return true;
        }
        return false;
    }

    // --- nets -------------------------------------------------------------------------------

    private void applyNets(MergeState state, SyncPlan plan) {
        Map<String, List<Net>> bySheet = new TreeMap<>();
        for (NetDecision decision : plan.getNets()) {
            if (decision.decision() == Decision.REMOVE || decision.decision() == Decision.UPDATE) {
                Net previous = decision.previous();
                state.fileOf(previous.getSheetPath()).ifPresent(schematic -> {
                    for (SList node : state.file.index().netNodes(previous.getKey())) {
                        if (MergeState.removeTopLevel(schematic.getDocument(), node)) {
                            state.report.itemRemoved();
                        }
                    }
                });
            }
            if (decision.decision() == Decision.ADD || decision.decision() == Decision.UPDATE) {
                bySheet.computeIfAbsent(decision.next().getSheetPath(), k -> new ArrayList<>()).add(decision.next());
            }
        }
        for (Map.Entry<String, List<Net>> entry : bySheet.entrySet()) {
            SchematicFile schematic = state.fileOf(entry.getKey())
                    .orElseThrow(() -> new IllegalStateException("No file for sheet " + entry.getKey()));
            new NetWiring(schematic.getDocument(), library, state.nodes, state.report).draw(entry.getValue());
        }
    }

    // --- helpers ----------------------------------------------------------------------------

    private static int indexOfFirst(SList node, String... tags) {
        for (int i = 1; i < node.size(); i++) {
            String tag = SExpressions.getTag(node.get(i));
            for (String candidate : tags) {
                if (candidate.equals(tag)) return i;
            }
        }
        return node.size();
    }

    private static int depth(String sheetPath) {
        return (int) sheetPath.chars().filter(c -> c == '/').count();
    }

    private static Position position(SList node) {
        return SExpressions.findChild(node, "at")
                .map(at -> new Position(SExpressions.getDouble(at, 1, 0), SExpressions.getDouble(at, 2, 0)))
                .orElse(new Position(0, 0));
    }
}
