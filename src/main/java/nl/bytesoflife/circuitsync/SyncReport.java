package nl.bytesoflife.circuitsync;

import nl.bytesoflife.circuitsync.match.ComponentDecision;
import nl.bytesoflife.circuitsync.match.Decision;
import nl.bytesoflife.circuitsync.match.NetDecision;
import nl.bytesoflife.circuitsync.match.PortDecision;
import nl.bytesoflife.circuitsync.match.SheetDecision;
import nl.bytesoflife.circuitsync.match.SyncPlan;
import nl.bytesoflife.circuitsync.merge.MergeReport;
import nl.bytesoflife.circuitsync.model.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per element summary of a sync: which components were matched, added, modified, removed or
 * preserved, and which nets, ports and sheets changed.
 */
public class SyncReport {

    private final Map<String, String> matched = new LinkedHashMap<>();
    private final List<String> added = new ArrayList<>();
    private final List<String> modified = new ArrayList<>();
    private final List<String> removed = new ArrayList<>();
    private final List<String> preserved = new ArrayList<>();
    private final List<String> netsAdded = new ArrayList<>();
    private final List<String> netsUpdated = new ArrayList<>();
    private final List<String> netsRemoved = new ArrayList<>();
    private final List<String> portsChanged = new ArrayList<>();
    private final List<String> sheetsAdded = new ArrayList<>();
    private final List<String> sheetsRemoved = new ArrayList<>();
    private MergeReport merge;

    static SyncReport of(SyncPlan plan, MergeReport merge) {
        SyncReport report = new SyncReport();
        report.merge = merge;
        for (SheetDecision sheet : plan.getSheets()) {
            if (sheet.decision() == Decision.ADD) report.sheetsAdded.add(sheet.getSheet().getPath());
            if (sheet.decision() == Decision.REMOVE) report.sheetsRemoved.add(sheet.getSheet().getPath());
        }
        for (ComponentDecision component : plan.getComponents()) {
            switch (component.decision()) {
                case ADD -> report.added.add(label(component.next()));
                case REMOVE -> report.removed.add(label(component.previous()));
                case UPDATE -> {
                    report.matched.put(label(component.next()), label(component.previous()));
                    report.modified.add(label(component.next()) + " " + component.changes());
                }
                case KEEP -> {
                    if (component.preserved()) {
                        report.preserved.add(label(component.previous()));
                    } else {
                        report.matched.put(label(component.next()), label(component.previous()));
                    }
                }
            }
        }
        for (PortDecision port : plan.getPorts()) {
            if (port.decision() != Decision.KEEP) {
                report.portsChanged.add(port.decision() + " " + port.sheetPath() + ":" + port.name());
            }
        }
        for (NetDecision net : plan.getNets()) {
            switch (net.decision()) {
                case ADD -> report.netsAdded.add(net.getNet().getKey());
                case UPDATE -> report.netsUpdated.add(net.getNet().getKey());
                case REMOVE -> report.netsRemoved.add(net.getNet().getKey());
                case KEEP -> { }
            }
        }
        return report;
    }

    private static String label(Component component) {
        return component.getSheetPath() + component.getKey();
    }

    /**
     * Described component to the schematic component it was matched with.
     */
    public Map<String, String> getMatched() {
        return Collections.unmodifiableMap(matched);
    }

    public List<String> getAdded() {
        return Collections.unmodifiableList(added);
    }

    public List<String> getModified() {
        return Collections.unmodifiableList(modified);
    }

    public List<String> getRemoved() {
        return Collections.unmodifiableList(removed);
    }

    public List<String> getPreserved() {
        return Collections.unmodifiableList(preserved);
    }

    public List<String> getNetsAdded() {
        return Collections.unmodifiableList(netsAdded);
    }

    public List<String> getNetsUpdated() {
        return Collections.unmodifiableList(netsUpdated);
    }

    public List<String> getNetsRemoved() {
        return Collections.unmodifiableList(netsRemoved);
    }

    public List<String> getPortsChanged() {
        return Collections.unmodifiableList(portsChanged);
    }

    public List<String> getSheetsAdded() {
        return Collections.unmodifiableList(sheetsAdded);
    }

    public List<String> getSheetsRemoved() {
        return Collections.unmodifiableList(sheetsRemoved);
    }

    /**
     * Edit counts of the merge, or null when nothing had to be merged.
     */
    public MergeReport getMerge() {
        return merge;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Sync Report:\n");
        sb.append("  Components: ").append(matched.size()).append(" matched, ")
          .append(added.size()).append(" added, ")
          .append(modified.size()).append(" modified, ")
          .append(removed.size()).append(" removed, ")
          .append(preserved.size()).append(" preserved\n");
        sb.append("  Nets: ").append(netsAdded.size()).append(" added, ")
          .append(netsUpdated.size()).append(" updated, ")
          .append(netsRemoved.size()).append(" removed\n");
        sb.append("  Sheets: ").append(sheetsAdded.size()).append(" added, ")
          .append(sheetsRemoved.size()).append(" removed; ports changed: ")
          .append(portsChanged.size()).append("\n");
        if (merge != null) {
            sb.append("  ").append(merge).append("\n");
        }
        return sb.toString();
    }
}
