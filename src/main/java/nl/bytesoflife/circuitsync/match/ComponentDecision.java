package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.Component;

import java.util.Set;

/**
 * Decision for one component. {@code previous} is null for {@code ADD}, {@code next} is null for
 * {@code REMOVE} and for preserved components.
 */
public record ComponentDecision(Decision decision, Component previous, Component next,
                                Set<ComponentChange> changes, boolean preserved, String matchedBy) {

    public ComponentDecision {
        changes = Set.copyOf(changes);
    }

    public boolean hasChange(ComponentChange change) {
        return changes.contains(change);
    }

    public String getSheetPath() {
        return next != null ? next.getSheetPath() : previous.getSheetPath();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(decision.name()).append(' ');
        if (previous != null) sb.append(previous.getSheetPath()).append(previous.getKey());
        if (previous != null && next != null) sb.append(" -> ");
        if (next != null) sb.append(next.getSheetPath()).append(next.getKey());
        if (!changes.isEmpty()) sb.append(' ').append(changes);
        if (preserved) sb.append(" (preserved)");
        return sb.toString();
    }
}
