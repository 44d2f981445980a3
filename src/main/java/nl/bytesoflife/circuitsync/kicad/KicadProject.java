package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionParser;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode;
import nl.bytesoflife.circuitsync.parser.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * A KiCad project loaded into memory: the root schematic, every sheet file it references, the
 * netlist and the project file. Nothing is written back from here; callers collect the modified
 * files and write them.
 */
public class KicadProject {

    private static final Logger log = LoggerFactory.getLogger(KicadProject.class);

    private final Path directory;
    private final String name;
    private final Map<String, SchematicFile> schematics = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();
    private KicadProjectFile projectFile;
    private boolean projectFileNew;
    private SDocument netlist;
    private String netlistText;

    private KicadProject(Path directory, String name) {
        this.directory = directory;
        this.name = name;
    }

    /**
     * Loads {@code <name>.kicad_sch} and the sheets below it. A missing root schematic gives an
     * empty project whose files are created on the first write.
     */
    public static KicadProject load(Path directory, String name, Supplier<String> uuids) {
        KicadProject project = new KicadProject(directory, name);
        SExpressionParser parser = new SExpressionParser();

        Path proFile = directory.resolve(name + ".kicad_pro");
        if (Files.exists(proFile)) {
            project.projectFile = KicadProjectFile.parse(readFile(proFile));
        }

        String rootFileName = project.getRootFileName();
        Path rootPath = directory.resolve(rootFileName);
        if (!Files.exists(rootPath)) {
            log.info("No schematic {} in {}, starting a new project", rootFileName, directory);
            String uuid = uuids.get();
            project.schematics.put(rootFileName, new SchematicFile(rootFileName,
                    parser.parse(KicadTemplates.rootSchematic(uuid)), null));
            if (project.projectFile == null) {
                project.projectFile = KicadProjectFile.create(name, uuid);
                project.projectFileNew = true;
            }
            return project;
        }

        Deque<String> pending = new ArrayDeque<>();
        pending.add(rootFileName);
        while (!pending.isEmpty()) {
            String fileName = pending.poll();
            if (project.schematics.containsKey(fileName)) continue;
            Path path = directory.resolve(fileName);
            SchematicFile file;
            if (Files.exists(path)) {
                String text = readFile(path);
                try {
                    file = new SchematicFile(fileName, parser.parse(text), text);
                } catch (SyntaxException e) {
                    throw e.inFile(path.toString());
                }
            } else {
                project.warn("Sheet file " + fileName + " is missing, treating it as empty");
                file = new SchematicFile(fileName, parser.parse(KicadTemplates.sheetSchematic(uuids.get())), null);
            }
            project.schematics.put(fileName, file);
            for (SNode.SList sheet : SExpressions.findChildren(file.getDocument().getRoot(), "sheet")) {
                String child = SExpressions.propertyValue(sheet, "Sheetfile");
                if (child == null) child = SExpressions.propertyValue(sheet, "Sheet file");
                if (child != null && !child.isEmpty()) {
                    pending.add(child);
                }
            }
        }

        Path netPath = directory.resolve(name + ".net");
        if (Files.exists(netPath)) {
            project.netlistText = readFile(netPath);
            try {
                project.netlist = parser.parse(project.netlistText);
            } catch (SyntaxException e) {
                throw e.inFile(netPath.toString());
            }
        }
        if (project.projectFile == null) {
            project.projectFile = KicadProjectFile.create(name, project.getRoot().getUuid());
            project.projectFileNew = true;
        }
        log.debug("Loaded project {} with {} schematic files", name, project.schematics.size());
        return project;
    }

    private static String readFile(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    private void warn(String message) {
        log.warn(message);
        warnings.add(message);
    }

    public Path getDirectory() {
        return directory;
    }

    public String getName() {
        return name;
    }

    public String getRootFileName() {
        return name + ".kicad_sch";
    }

    public SchematicFile getRoot() {
        return schematics.get(getRootFileName());
    }

    public SchematicFile getSchematic(String fileName) {
        return schematics.get(fileName);
    }

    public Map<String, SchematicFile> getSchematics() {
        return Collections.unmodifiableMap(schematics);
    }

    /**
     * Adds a sheet file created in memory.
     */
    public SchematicFile addSchematic(String fileName, SDocument document) {
        if (schematics.containsKey(fileName)) {
            throw new IllegalArgumentException("Sheet file " + fileName + " is already part of the project");
        }
        if (Files.exists(directory.resolve(fileName))) {
            warn("Replacing unreferenced sheet file " + fileName);
        }
        SchematicFile file = new SchematicFile(fileName, document, null);
        schematics.put(fileName, file);
        return file;
    }

    public KicadProjectFile getProjectFile() {
        return projectFile;
    }

    public boolean isProjectFileNew() {
        return projectFileNew;
    }

    public SDocument getNetlist() {
        return netlist;
    }

    public String getNetlistText() {
        return netlistText;
    }

    public String getNetlistFileName() {
        return name + ".net";
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
