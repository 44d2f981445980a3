package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.Net;

public record NetDecision(Decision decision, Net previous, Net next) {

    public Net getNet() {
        return next != null ? next : previous;
    }

    @Override
    public String toString() {
        return decision + " net " + getNet().getKey();
    }
}
