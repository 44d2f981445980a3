package nl.bytesoflife.circuitsync.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a merge changed in the schematic trees.
 */
public class MergeReport {

    private int sheetsAdded;
    private int sheetsRemoved;
    private int symbolsAdded;
    private int symbolsUpdated;
    private int symbolsRemoved;
    private int wiresAdded;
    private int labelsAdded;
    private int junctionsAdded;
    private int itemsRemoved;
    private int unroutedConnections;
    private int libSymbolsRemoved;
    private final List<String> warnings = new ArrayList<>();

    void sheetAdded() {
        sheetsAdded++;
    }

    void sheetRemoved() {
        sheetsRemoved++;
    }

    void symbolAdded() {
        symbolsAdded++;
    }

    void symbolUpdated() {
        symbolsUpdated++;
    }

    void symbolRemoved() {
        symbolsRemoved++;
    }

    void wiresAdded(int count) {
        wiresAdded += count;
    }

    void labelAdded() {
        labelsAdded++;
    }

    void junctionAdded() {
        junctionsAdded++;
    }

    void itemRemoved() {
        itemsRemoved++;
    }

    void unrouted() {
        unroutedConnections++;
    }

    void libSymbolsRemoved(int count) {
        libSymbolsRemoved += count;
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    public int getSheetsAdded() {
        return sheetsAdded;
    }

    public int getSheetsRemoved() {
        return sheetsRemoved;
    }

    public int getSymbolsAdded() {
        return symbolsAdded;
    }

    public int getSymbolsUpdated() {
        return symbolsUpdated;
    }

    public int getSymbolsRemoved() {
        return symbolsRemoved;
    }

    public int getWiresAdded() {
        return wiresAdded;
    }

    public int getLabelsAdded() {
        return labelsAdded;
    }

    public int getJunctionsAdded() {
        return junctionsAdded;
    }

    /**
     * Wires, junctions, labels and power symbols deleted with their nets.
     */
    public int getItemsRemoved() {
        return itemsRemoved;
    }

    /**
     * Connections joined by a label because no clear wire route existed.
     */
    public int getUnroutedConnections() {
        return unroutedConnections;
    }

    public int getLibSymbolsRemoved() {
        return libSymbolsRemoved;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return "Merge: sheets +" + sheetsAdded + "/-" + sheetsRemoved
                + ", symbols +" + symbolsAdded + "/~" + symbolsUpdated + "/-" + symbolsRemoved
                + ", wires +" + wiresAdded + ", labels +" + labelsAdded + ", junctions +" + junctionsAdded
                + ", removed items " + itemsRemoved;
    }
}
