package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;

import java.util.List;

/**
 * One way of pairing components of the file graph with components of the description graph.
 * Strategies run in priority order and only see components no earlier strategy has paired.
 */
public interface MatchStrategy {

    List<ComponentMatch> match(List<Component> unmatchedPrevious, List<Component> unmatchedNext);

    String getName();

    default boolean isApplicable(CircuitGraph previous, CircuitGraph next) {
        return true;
    }
}
