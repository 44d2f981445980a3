package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.Component;

/**
 * A pair found by a {@link MatchStrategy}.
 */
public record ComponentMatch(Component previous, Component next) {
}
