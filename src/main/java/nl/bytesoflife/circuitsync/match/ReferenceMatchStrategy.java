package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs components by sheet path, reference and unit. Components that carry a token are left to
 * {@link TokenMatchStrategy}.
 */
public class ReferenceMatchStrategy implements MatchStrategy {

    @Override
    public List<ComponentMatch> match(List<Component> unmatchedPrevious, List<Component> unmatchedNext) {
        Map<String, Component> byKey = new HashMap<>();
        for (Component previous : unmatchedPrevious) {
            byKey.putIfAbsent(previous.getSheetPath() + previous.getKey(), previous);
        }
        List<ComponentMatch> matches = new ArrayList<>();
        for (Component next : unmatchedNext) {
            if (next.getToken() != null) continue;
            Component previous = byKey.remove(next.getSheetPath() + next.getKey());
            if (previous != null) {
                matches.add(new ComponentMatch(previous, next));
            }
        }
        return matches;
    }

    @Override
    public String getName() {
        return "reference";
    }
}
