package nl.bytesoflife.circuitsync.parser;

import nl.bytesoflife.circuitsync.CircuitSyncException;

/**
 * Malformed S-expression input.
 */
public class SyntaxException extends CircuitSyncException {

    private final String detail;
    private final String source;
    private final int line;
    private final int column;
    private final String token;

    public SyntaxException(String message, int line, int column, String token) {
        this(message, null, line, column, token);
    }

    private SyntaxException(String message, String source, int line, int column, String token) {
        super(format(message, source, line, column, token));
        this.detail = message;
        this.source = source;
        this.line = line;
        this.column = column;
        this.token = token;
    }

    /**
     * Same error, attributed to the named file.
     */
    public SyntaxException inFile(String fileName) {
        SyntaxException e = new SyntaxException(detail, fileName, line, column, token);
        e.setStackTrace(getStackTrace());
        return e;
    }

    public String getDetail() {
        return detail;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getToken() {
        return token;
    }

    private static String format(String message, String source, int line, int column, String token) {
        StringBuilder sb = new StringBuilder(message).append(" [");
        if (source != null) {
            sb.append(source).append(':');
        }
        sb.append(line).append(':').append(column).append(", near '").append(token).append("']");
        return sb.toString();
    }
}
