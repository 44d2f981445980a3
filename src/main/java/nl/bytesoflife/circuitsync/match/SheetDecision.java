package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.Sheet;

public record SheetDecision(Decision decision, Sheet previous, Sheet next) {

    public Sheet getSheet() {
        return next != null ? next : previous;
    }

    @Override
    public String toString() {
        return decision + " sheet " + getSheet().getPath();
    }
}
