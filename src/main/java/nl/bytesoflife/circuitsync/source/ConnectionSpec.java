package nl.bytesoflife.circuitsync.source;

/**
 * One pin of a net: component reference and pin number.
 */
public record ConnectionSpec(String reference, String pin) {

    /**
     * Parses the {@code R1.2} shorthand.
     */
    public static ConnectionSpec parse(String text) {
        int dot = text.lastIndexOf('.');
        if (dot <= 0 || dot == text.length() - 1) {
            throw new IllegalArgumentException("Connection must look like REF.PIN: " + text);
        }
        return new ConnectionSpec(text.substring(0, dot), text.substring(dot + 1));
    }

    @Override
    public String toString() {
        return reference + "." + pin;
    }
}
