package nl.bytesoflife.circuitsync.tool;

import nl.bytesoflife.circuitsync.CircuitSyncException;

/**
 * The external EDA tool could not be started, failed or ran out of time.
 */
public class ExternalToolException extends CircuitSyncException {

    private final int exitCode;
    private final String output;

    public ExternalToolException(String message, int exitCode, String output) {
        super(message);
        this.exitCode = exitCode;
        this.output = output;
    }

    public ExternalToolException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.output = "";
    }

    /**
     * Exit status of the tool, or -1 when it never finished.
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Tail of the combined stdout and stderr.
     */
    public String getOutput() {
        return output;
    }
}
