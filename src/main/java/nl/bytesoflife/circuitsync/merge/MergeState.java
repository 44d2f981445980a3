package nl.bytesoflife.circuitsync.merge;

import nl.bytesoflife.circuitsync.build.FileCircuit;
import nl.bytesoflife.circuitsync.kicad.KicadProject;
import nl.bytesoflife.circuitsync.kicad.SchematicFile;
import nl.bytesoflife.circuitsync.model.Sheet;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionFormatter;
import nl.bytesoflife.circuitsync.parser.SNode;
import nl.bytesoflife.circuitsync.parser.SNode.SList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Trees and identities shared by the phases of one merge: which file holds each sheet, which node
 * is each sheet symbol and which uuid each sheet instance has.
 */
class MergeState {

    private static final List<String> TRAILING_SECTIONS = List.of("sheet_instances", "symbol_instances");

    final KicadProject project;
    final FileCircuit file;
    final NodeFactory nodes;
    final MergeReport report;

    private final Map<String, SchematicFile> files = new HashMap<>();
    private final Map<String, SList> sheetSymbols = new HashMap<>();
    private final Map<String, String> sheetUuids = new HashMap<>();

    MergeState(KicadProject project, FileCircuit file, NodeFactory nodes, MergeReport report) {
        this.project = project;
        this.file = file;
        this.nodes = nodes;
        this.report = report;
        for (Sheet sheet : file.graph().getSheets()) {
            file.index().sheetFile(sheet.getPath()).ifPresent(f -> files.put(sheet.getPath(), f));
            file.index().sheetSymbolNode(sheet.getPath()).ifPresent(n -> sheetSymbols.put(sheet.getPath(), n));
            if (sheet.getToken() != null) {
                sheetUuids.put(sheet.getPath(), sheet.getToken());
            }
        }
    }

    Optional<SchematicFile> fileOf(String sheetPath) {
        return Optional.ofNullable(files.get(sheetPath));
    }

    void putSheet(String sheetPath, SchematicFile schematic, SList sheetSymbol, String uuid) {
        files.put(sheetPath, schematic);
        sheetSymbols.put(sheetPath, sheetSymbol);
        sheetUuids.put(sheetPath, uuid);
    }

    Optional<SList> sheetSymbolOf(String childPath) {
        return Optional.ofNullable(sheetSymbols.get(childPath));
    }

    /**
     * KiCad instance path of a sheet: the root schematic uuid followed by the uuid of every sheet
     * symbol on the way down.
     */
    String instancePath(String sheetPath) {
        StringBuilder path = new StringBuilder("/").append(project.getRoot().getUuid());
        int from = 1;
        int slash;
        while ((slash = sheetPath.indexOf('/', from)) > 0) {
            String uuid = sheetUuids.get(sheetPath.substring(0, slash + 1));
            if (uuid != null) path.append('/').append(uuid);
            from = slash + 1;
        }
        return path.toString();
    }

    /**
     * Inserts a top-level item after the last item with the same tag, or before the instance
     * sections at the end of the file.
     */
    static void insertTopLevel(SDocument document, SList node) {
        SList root = document.getRoot();
        int index = -1;
        for (int i = 1; i < root.size(); i++) {
            if (root.get(i) instanceof SList child && child.tag().equals(node.tag())) {
                index = i + 1;
            }
        }
        if (index < 0) {
            index = root.size();
            for (int i = 1; i < root.size(); i++) {
                if (root.get(i) instanceof SList child && TRAILING_SECTIONS.contains(child.tag())) {
                    index = i;
                    break;
                }
            }
        }
        SExpressionFormatter.detect(document).insert(root, index, node);
    }

    static boolean removeTopLevel(SDocument document, SNode node) {
        return document.getRoot().remove(node);
    }
}
