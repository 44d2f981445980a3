package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pairs re-referenced components by library id, footprint, value and unit on the same sheet.
 * When several candidates fit, the one closest to the requested position wins, otherwise the first
 * in file order. Only used for descriptions without tokens, where the reference is the sole
 * identity.
 */
public class AttributeMatchStrategy implements MatchStrategy {

    @Override
    public boolean isApplicable(CircuitGraph previous, CircuitGraph next) {
        return !next.hasTokens();
    }

    @Override
    public List<ComponentMatch> match(List<Component> unmatchedPrevious, List<Component> unmatchedNext) {
        List<Component> candidates = new ArrayList<>(unmatchedPrevious);
        List<ComponentMatch> matches = new ArrayList<>();
        for (Component next : unmatchedNext) {
            Component best = null;
            double bestDistance = Double.MAX_VALUE;
            for (Component previous : candidates) {
                if (!sameAttributes(previous, next)) continue;
                if (next.getPosition() == null || previous.getPosition() == null) {
                    best = previous;
                    break;
                }
                double distance = previous.getPosition().distanceTo(next.getPosition());
                if (distance < bestDistance) {
                    best = previous;
                    bestDistance = distance;
                }
            }
            if (best != null) {
                candidates.remove(best);
                matches.add(new ComponentMatch(best, next));
            }
        }
        return matches;
    }

    private static boolean sameAttributes(Component a, Component b) {
        return a.getSheetPath().equals(b.getSheetPath())
                && a.getUnit() == b.getUnit()
                && Objects.equals(a.getLibId(), b.getLibId())
                && Objects.equals(a.getFootprint(), b.getFootprint())
                && Objects.equals(a.getValue(), b.getValue());
    }

    @Override
    public String getName() {
        return "attribute";
    }
}
