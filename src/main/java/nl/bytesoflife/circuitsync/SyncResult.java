package nl.bytesoflife.circuitsync;

import nl.bytesoflife.circuitsync.tool.ErcReport;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one sync.
 *
 * @param changedFiles     files whose content differs from disk, written unless the run was dry
 * @param writtenFiles     files actually written
 * @param tokenAssignments identity token of every described component, keyed by sheet path and key
 */
public record SyncResult(SyncStatus status, SyncReport report, Map<String, String> tokenAssignments,
                         List<String> warnings, List<Path> changedFiles, List<Path> writtenFiles,
                         ErcReport ercReport) {

    public SyncResult {
        tokenAssignments = Map.copyOf(tokenAssignments);
        warnings = List.copyOf(warnings);
        changedFiles = List.copyOf(changedFiles);
        writtenFiles = List.copyOf(writtenFiles);
    }

    public boolean hasChanges() {
        return status == SyncStatus.CHANGES_APPLIED;
    }

    public Optional<ErcReport> erc() {
        return Optional.ofNullable(ercReport);
    }
}
