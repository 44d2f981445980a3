package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs components carrying the same identity token on the same sheet. A token found on another
 * sheet is left unmatched, so the component is removed there and added here.
 */
public class TokenMatchStrategy implements MatchStrategy {

    @Override
    public List<ComponentMatch> match(List<Component> unmatchedPrevious, List<Component> unmatchedNext) {
        Map<String, Component> byToken = new HashMap<>();
        for (Component previous : unmatchedPrevious) {
            if (previous.getToken() != null) {
                byToken.put(previous.getToken(), previous);
            }
        }
        List<ComponentMatch> matches = new ArrayList<>();
        for (Component next : unmatchedNext) {
            if (next.getToken() == null) continue;
            Component previous = byToken.get(next.getToken());
            if (previous != null && previous.getSheetPath().equals(next.getSheetPath())) {
                matches.add(new ComponentMatch(previous, next));
                byToken.remove(next.getToken());
            }
        }
        return matches;
    }

    @Override
    public String getName() {
        return "token";
    }
}
