package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionWriter;
import nl.bytesoflife.circuitsync.parser.SExpressions;

/**
 * One {@code .kicad_sch} file of a project: its parsed tree and the text it was loaded from.
 * The text is null for files created during this session.
 */
public class SchematicFile {

    private final String fileName;
    private final SDocument document;
    private final String originalText;

    public SchematicFile(String fileName, SDocument document, String originalText) {
        this.fileName = fileName;
        this.document = document;
        this.originalText = originalText;
    }

    public String getFileName() {
        return fileName;
    }

    public SDocument getDocument() {
        return document;
    }

    public boolean isNew() {
        return originalText == null;
    }

    public String write() {
        return new SExpressionWriter().write(document);
    }

    public boolean isModified() {
        return isNew() || !originalText.equals(write());
    }

    /**
     * The {@code (uuid ...)} of the schematic itself.
     */
    public String getUuid() {
        return SExpressions.childValue(document.getRoot(), "uuid");
    }

    @Override
    public String toString() {
        return fileName;
    }
}
