package nl.bytesoflife.circuitsync;

import nl.bytesoflife.circuitsync.build.CircuitExtractor;
import nl.bytesoflife.circuitsync.build.FileCircuit;
import nl.bytesoflife.circuitsync.build.FileGraphBuilder;
import nl.bytesoflife.circuitsync.build.SourceGraphBuilder;
import nl.bytesoflife.circuitsync.kicad.KicadProject;
import nl.bytesoflife.circuitsync.kicad.NetlistGenerator;
import nl.bytesoflife.circuitsync.kicad.SchematicFile;
import nl.bytesoflife.circuitsync.match.ComponentDecision;
import nl.bytesoflife.circuitsync.match.IdentityMatcher;
import nl.bytesoflife.circuitsync.match.SyncPlan;
import nl.bytesoflife.circuitsync.merge.MergeGenerator;
import nl.bytesoflife.circuitsync.merge.MergeReport;
import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.FlatNet;
import nl.bytesoflife.circuitsync.model.HierarchicalPort;
import nl.bytesoflife.circuitsync.model.Sheet;
import nl.bytesoflife.circuitsync.parser.SExpressionWriter;
import nl.bytesoflife.circuitsync.source.Circuit;
import nl.bytesoflife.circuitsync.source.CircuitDescription;
import nl.bytesoflife.circuitsync.tool.ErcReport;
import nl.bytesoflife.circuitsync.tool.ExternalToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * One synchronisation of a circuit description into a KiCad project: load, build both graphs,
 * match, merge, verify, regenerate the netlist and write the changed files. {@link #export} goes
 * the other way and reads a project back into a description.
 * <p>
 * Every file is written only after all in-memory work has succeeded, each through a temporary
 * file in the target directory that is then moved over the original.
 */
public class SyncSession {

    private static final Logger log = LoggerFactory.getLogger(SyncSession.class);

    private static final DateTimeFormatter NETLIST_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final SyncOptions options;

    public SyncSession(SyncOptions options) {
        this.options = options;
    }

    public SyncResult sync(Path projectDir, String projectName, CircuitDescription description) {
        log.info("Syncing {} into project {} in {}", description.name(), projectName, projectDir);

        KicadProject project = KicadProject.load(projectDir, projectName, options.getTokenGenerator());
        FileGraphBuilder fileBuilder = new FileGraphBuilder(options.getSymbolLibrary());
        FileCircuit file = fileBuilder.build(project);
        CircuitGraph source = new SourceGraphBuilder(options.getSymbolLibrary()).build(description);

        SyncPlan plan = IdentityMatcher.withDefaultStrategies()
                .setPreserveUserComponents(options.isPreserveUserComponents())
                .match(file.graph(), source);
        log.debug("{}", plan);

        List<String> warnings = new ArrayList<>(file.warnings());
        MergeReport merge = null;
        FileCircuit merged = file;
        if (!plan.isNoOp()) {
            merge = new MergeGenerator(options.getSymbolLibrary(), options.getPlacement(), options.getTokenGenerator())
                    .apply(project, file, plan, source);
            warnings.addAll(merge.getWarnings());
            log.info("{}", merge);
            merged = fileBuilder.build(project);
            verify(merged.graph(), source, preservedReferences(plan), warnings);
        } else {
            log.info("Schematic is up to date");
        }

        String date = ZonedDateTime.now(options.getClock()).truncatedTo(ChronoUnit.SECONDS).format(NETLIST_DATE);
        NetlistGenerator.NetlistUpdate netlist = new NetlistGenerator()
                .update(project.getNetlist(), merged.graph(), project.getRootFileName(), date);

        Map<Path, String> changes = new LinkedHashMap<>();
        for (SchematicFile schematic : project.getSchematics().values()) {
            if (schematic.isModified()) {
                changes.put(projectDir.resolve(schematic.getFileName()), schematic.write());
            }
        }
        if (netlist.changed()) {
            changes.put(projectDir.resolve(project.getNetlistFileName()),
                    new SExpressionWriter().write(netlist.document()));
        }
        if (project.isProjectFileNew()) {
            changes.put(projectDir.resolve(projectName + ".kicad_pro"), project.getProjectFile().getContent());
        }

        List<Path> written = new ArrayList<>();
        if (options.isDryRun()) {
            log.info("Dry run, {} files not written", changes.size());
        } else {
            try {
                Files.createDirectories(projectDir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create " + projectDir, e);
            }
            for (Map.Entry<Path, String> change : changes.entrySet()) {
                writeAtomically(change.getKey(), change.getValue());
                written.add(change.getKey());
            }
        }

        ErcReport erc = null;
        if (options.isErc()) {
            erc = runErc(projectDir.resolve(project.getRootFileName()), warnings);
        }

        SyncStatus status = changes.isEmpty() ? SyncStatus.NO_CHANGES : SyncStatus.CHANGES_APPLIED;
        SyncResult result = new SyncResult(status, SyncReport.of(plan, merge), plan.getTokenAssignments(),
                warnings, new ArrayList<>(changes.keySet()), written, erc);
        log.info("Sync finished: {}, {} files changed, {} warnings", status, changes.size(), warnings.size());
        return result;
    }

    /**
     * Reads the project back into a description: the other direction of {@link #sync}. Syncing the
     * result into the same project changes nothing.
     */
    public Circuit export(Path projectDir, String projectName) {
        KicadProject project = KicadProject.load(projectDir, projectName, options.getTokenGenerator());
        Path root = projectDir.resolve(project.getRootFileName());
        if (!Files.exists(root)) {
            throw new CircuitSyncException("Cannot export " + projectName + ": no schematic " + root);
        }
        FileCircuit file = new FileGraphBuilder(options.getSymbolLibrary()).build(project);
        for (String warning : file.warnings()) {
            log.warn(warning);
        }
        Circuit circuit = new CircuitExtractor().extract(file.graph());
        log.info("Exported {}: {} components on {} sheets", projectName,
                file.graph().getComponents().size(), file.graph().getSheets().size());
        return circuit;
    }

    private ErcReport runErc(Path schematic, List<String> warnings) {
        if (options.isDryRun() || !Files.exists(schematic)) {
            warnings.add("ERC skipped: " + schematic.getFileName() + " is not on disk");
            return null;
        }
        try {
            ErcReport report = options.getKicadCli().runErc(schematic);
            if (report.hasErrors()) {
                warnings.add("ERC reported " + report.getErrors().size() + " errors");
            }
            return report;
        } catch (ExternalToolException e) {
            log.warn("ERC failed: {}", e.getMessage());
            warnings.add("ERC failed: " + e.getMessage());
            return null;
        }
    }

    private static Set<String> preservedReferences(SyncPlan plan) {
        Set<String> references = new HashSet<>();
        for (ComponentDecision decision : plan.getComponents()) {
            if (decision.preserved()) {
                references.add(decision.previous().getSheetPath() + decision.previous().getReference());
            }
        }
        return references;
    }

    /**
     * Compares the merged schematic with the description: every described net must join exactly
     * its described pins and every described sheet port must have both halves.
     */
    private void verify(CircuitGraph merged, CircuitGraph source, Set<String> preserved, List<String> warnings) {
        List<String> problems = new ArrayList<>();
        Map<String, FlatNet> actual = new LinkedHashMap<>();
        for (FlatNet net : merged.flatten()) {
            actual.put(net.name(), net);
        }
        Set<String> expectedNames = new HashSet<>();
        for (FlatNet expected : source.flatten()) {
            expectedNames.add(expected.name());
            FlatNet found = actual.get(expected.name());
            if (found == null) {
                problems.add("Net " + expected.name() + " is missing from the schematic");
                continue;
            }
            Set<String> members = withoutPreserved(found, preserved);
            if (!members.equals(expected.memberKeys())) {
                problems.add("Net " + expected.name() + " connects " + members + ", expected " + expected.memberKeys());
            }
        }
        for (FlatNet net : actual.values()) {
            if (expectedNames.contains(net.name())) continue;
            Set<String> members = withoutPreserved(net, preserved);
            if (members.size() > 1) {
                problems.add("Unexpected net " + net.name() + " connects " + members);
            }
        }
        for (Sheet sheet : source.getSheets()) {
            Optional<Sheet> mergedSheet = merged.findSheet(sheet.getPath());
            if (mergedSheet.isEmpty()) {
                problems.add("Sheet " + sheet.getPath() + " is missing from the schematic");
                continue;
            }
            for (HierarchicalPort port : sheet.getPorts().values()) {
                HierarchicalPort actualPort = mergedSheet.get().getPorts().get(port.name());
                if (actualPort == null || !actualPort.isComplete()) {
                    problems.add("Port " + sheet.getPath() + ":" + port.name() + " lacks a sheet pin or label");
                }
            }
        }

        if (problems.isEmpty()) {
            log.debug("Merged schematic matches the description");
            return;
        }
        if (options.isStrictVerification()) {
            throw new CircuitSyncException("Merged schematic does not match the description: "
                    + String.join("; ", problems));
        }
        for (String problem : problems) {
            log.warn(problem);
            warnings.add(problem);
        }
    }

    // preserved holds sheet path plus reference
    static Set<String> withoutPreserved(FlatNet net, Set<String> preserved) {
        Set<String> result = new TreeSet<>();
        for (FlatNet.Node node : net.nodes()) {
            if (!preserved.contains(node.sheetPath() + node.reference())) result.add(node.key());
        }
        return result;
    }

    private static void writeAtomically(Path target, String content) {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {}", target);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.debug("Could not delete {}", temp, e);
                }
            }
        }
    }
}
