package nl.bytesoflife.circuitsync.tool;

import java.util.List;

/**
 * Manufacturing and review outputs the external tool can produce.
 */
public enum ExportKind {
    NETLIST(List.of("sch", "export", "netlist"), false),
    BOM(List.of("sch", "export", "bom"), false),
    GERBERS(List.of("pcb", "export", "gerbers"), true),
    DRILL(List.of("pcb", "export", "drill"), true),
    POSITIONS(List.of("pcb", "export", "pos"), true);

    private final List<String> command;
    private final boolean board;

    ExportKind(List<String> command, boolean board) {
        this.command = command;
        this.board = board;
    }

    public List<String> getCommand() {
        return command;
    }

    /**
     * True when the export reads the board file rather than the schematic.
     */
    public boolean isBoard() {
        return board;
    }
}
