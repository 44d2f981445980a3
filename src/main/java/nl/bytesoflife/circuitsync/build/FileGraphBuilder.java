package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.CircuitSyncException;
import nl.bytesoflife.circuitsync.build.ConnectedGroup.SheetSymbolPin;
import nl.bytesoflife.circuitsync.build.ConnectedGroup.SymbolPin;
import nl.bytesoflife.circuitsync.kicad.KicadProject;
import nl.bytesoflife.circuitsync.kicad.SchematicContents;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.Label;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.LabelKind;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.PlacedPin;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.PlacedSymbol;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.SheetPin;
import nl.bytesoflife.circuitsync.kicad.SchematicContents.SheetSymbol;
import nl.bytesoflife.circuitsync.kicad.SchematicFile;
import nl.bytesoflife.circuitsync.kicad.SymbolLibrary;
import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.HierarchicalPort;
import nl.bytesoflife.circuitsync.model.Net;
import nl.bytesoflife.circuitsync.model.NetMember;
import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.ReferenceOrder;
import nl.bytesoflife.circuitsync.model.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the circuit graph of a loaded KiCad project: components from symbol instances, nets
 * from wire connectivity and labels, sheets and ports from sheet symbols and hierarchical labels.
 */
public class FileGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(FileGraphBuilder.class);

    private final SymbolLibrary library;

    public FileGraphBuilder(SymbolLibrary library) {
        this.library = library;
    }

    public FileCircuit build(KicadProject project) {
        CircuitGraph graph = new CircuitGraph();
        FileIndex index = new FileIndex();
        List<String> warnings = new ArrayList<>(project.getWarnings());

        SchematicFile rootFile = project.getRoot();
        Sheet root = graph.addSheet(Sheet.root(project.getName()).setFileName(rootFile.getFileName()));
        Set<String> visited = new HashSet<>();
        visited.add(rootFile.getFileName());
        readSheet(project, rootFile, root, null, graph, index, visited, warnings);

        graph.validate();
        log.debug("File graph: {} sheets, {} components, {} nets",
                graph.getSheets().size(), graph.getComponents().size(), graph.getNets().size());
        return new FileCircuit(graph, index, warnings);
    }

    private void readSheet(KicadProject project, SchematicFile file, Sheet sheet, SheetSymbol instance,
                           CircuitGraph graph, FileIndex index, Set<String> visited, List<String> warnings) {
        String path = sheet.getPath();
        index.putSheetFile(path, file);
        SchematicContents contents = SchematicContents.read(file.getDocument(), library);

        for (PlacedSymbol symbol : contents.getSymbols()) {
            if (symbol.power()) continue;
            Component component = new Component(symbol.reference(), symbol.unit())
                    .setValue(symbol.value())
                    .setFootprint(symbol.footprint())
                    .setLibId(symbol.libId())
                    .setPosition(symbol.position())
                    .setRotation(symbol.rotation())
                    .setMirrored(symbol.mirror() != null)
                    .setToken(symbol.uuid())
                    .setSheetPath(path);
            for (PlacedPin pin : symbol.pins()) {
                component.addPin(new Pin(pin.number(), pin.name(), pin.type(), pin.unit()));
            }
            graph.addComponent(component);
            index.putComponent(path, component.getKey(), symbol.node());
        }

        Map<SheetSymbol, Sheet> children = new LinkedHashMap<>();
        Set<String> childNames = new HashSet<>();
        for (SheetSymbol sheetSymbol : contents.getSheets()) {
            if (!childNames.add(sheetSymbol.name())) {
                throw new AmbiguousConnectivityException(file.getFileName(), sheetSymbol.position(),
                        List.of(sheetSymbol.name()), "Two sheet symbols share one sheet name");
            }
            Set<String> pinNames = new HashSet<>();
            for (SheetPin pin : sheetSymbol.pins()) {
                if (!pinNames.add(pin.name())) {
                    throw new AmbiguousConnectivityException(file.getFileName(), pin.position(),
                            List.of(pin.name()), "Duplicate pin on sheet symbol " + sheetSymbol.name());
                }
            }
            if (sheetSymbol.fileName().isEmpty()) {
                warnings.add("Sheet symbol " + sheetSymbol.name() + " in " + file.getFileName() + " has no file");
                continue;
            }
            if (!visited.add(sheetSymbol.fileName())) {
                throw new CircuitSyncException("Sheet file " + sheetSymbol.fileName()
                        + " is used by more than one sheet symbol; shared sheet files are not supported");
            }
            String childPath = Sheet.childPath(path, sheetSymbol.name());
            Sheet child = graph.addSheet(new Sheet(sheetSymbol.name(), childPath, path)
                    .setToken(sheetSymbol.uuid())
                    .setFileName(sheetSymbol.fileName()));
            index.putSheetSymbol(childPath, sheetSymbol.node());
            for (SheetPin pin : sheetSymbol.pins()) {
                index.putSheetPin(childPath, pin.name(), pin.node());
            }
            children.put(sheetSymbol, child);
        }

        for (ConnectedGroup group : new ConnectivityResolver().resolve(contents)) {
            Net net = toNet(group, path, file.getFileName());
            if (net == null) continue;
            if (graph.findNet(path, net.getName()).isPresent()) {
                throw new AmbiguousConnectivityException(file.getFileName(), group.getLocation(),
                        List.of(net.getName()), "Two separate nets carry the same name");
            }
            graph.addNet(net);
            index.putNet(net.getKey(), group.getOwnedNodes());
        }

        if (instance != null) {
            readPorts(contents, sheet, instance, index);
        }

        for (Map.Entry<SheetSymbol, Sheet> entry : children.entrySet()) {
            SchematicFile childFile = project.getSchematic(entry.getKey().fileName());
            if (childFile == null) {
                warnings.add("Sheet file " + entry.getKey().fileName() + " was not loaded");
                continue;
            }
            readSheet(project, childFile, entry.getValue(), entry.getKey(), graph, index, visited, warnings);
        }
    }

    private Net toNet(ConnectedGroup group, String sheetPath, String fileName) {
        Set<String> names = group.getNames();
        if (names.size() > 1) {
            throw new AmbiguousConnectivityException(fileName, group.getLocation(), names,
                    "Connected items carry different net names");
        }
        int memberCount = group.getPins().size() + group.getSheetPins().size();
        if (!group.isNamed() && memberCount < 2) {
            return null;
        }

        String name;
        boolean named = true;
        if (!names.isEmpty()) {
            name = names.iterator().next();
        } else if (!group.getSheetPins().isEmpty()) {
            name = group.getSheetPins().stream().map(p -> p.pin().name()).sorted().findFirst().orElseThrow();
        } else {
            SymbolPin lowest = group.getPins().stream()
                    .min((a, b) -> {
                        int c = ReferenceOrder.compare(a.symbol().reference(), b.symbol().reference());
                        return c != 0 ? c : ReferenceOrder.compare(a.pin().number(), b.pin().number());
                    })
                    .orElseThrow();
            name = "Net-(" + lowest.symbol().reference() + "-Pad" + lowest.pin().number() + ")";
            named = false;
        }

        Net net = new Net(name, group.getScope(), sheetPath).setNamed(named);
        for (SymbolPin pin : group.getPins()) {
            net.addMember(NetMember.componentPin(pin.symbol().reference(), pin.pin().number()));
        }
        for (SheetSymbolPin pin : group.getSheetPins()) {
            net.addMember(NetMember.sheetPin(pin.sheet().name(), pin.pin().name()));
        }
        if (net.getScope() == NetScope.HIERARCHICAL) {
            group.getLabels().stream()
                    .filter(l -> l.kind() == LabelKind.HIERARCHICAL)
                    .findFirst()
                    .ifPresent(l -> net.setDirection(l.shape()));
        }
        return net;
    }

    private void readPorts(SchematicContents contents, Sheet sheet, SheetSymbol instance, FileIndex index) {
        Map<String, PortDirection> labelShapes = new LinkedHashMap<>();
        for (Label label : contents.getLabels()) {
            if (label.kind() != LabelKind.HIERARCHICAL) continue;
            labelShapes.putIfAbsent(label.name(), label.shape());
            index.addHierarchicalLabel(sheet.getPath(), label.name(), label.node());
        }
        for (SheetPin pin : instance.pins()) {
            boolean labelPresent = labelShapes.containsKey(pin.name());
            sheet.putPort(new HierarchicalPort(pin.name(), pin.direction(), pin.position(), labelPresent, true));
        }
        for (Map.Entry<String, PortDirection> label : labelShapes.entrySet()) {
            if (instance.findPin(label.getKey()).isEmpty()) {
                sheet.putPort(new HierarchicalPort(label.getKey(), label.getValue(), null, true, false));
            }
        }
    }
}
