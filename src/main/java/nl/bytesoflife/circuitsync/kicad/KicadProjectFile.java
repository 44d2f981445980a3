package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.parser.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The parts of a KiCad {@code .kicad_pro} project file (JSON) that the sync reads: the file name
 * recorded in {@code meta} and the {@code sheets} table of (uuid, name) pairs.
 */
public class KicadProjectFile {

    private final String fileName;
    private final List<SheetEntry> sheets;
    private final String content;

    public record SheetEntry(String uuid, String name) {}

    public KicadProjectFile(String fileName, List<SheetEntry> sheets, String content) {
        this.fileName = fileName;
        this.sheets = List.copyOf(sheets);
        this.content = content;
    }

    public static KicadProjectFile parse(String content) {
        Map<String, Object> root = new JsonParser().parseObject(content);
        Map<String, Object> meta = JsonParser.asObject(root.get("meta"));
        String fileName = JsonParser.asString(meta.get("filename"));

        List<SheetEntry> sheets = new ArrayList<>();
        for (Object entry : JsonParser.asList(root.get("sheets"))) {
            List<Object> pair = JsonParser.asList(entry);
            if (pair.size() >= 2) {
                sheets.add(new SheetEntry(JsonParser.asString(pair.get(0)), JsonParser.asString(pair.get(1))));
            }
        }
        return new KicadProjectFile(fileName, sheets, content);
    }

    public static KicadProjectFile parse(InputStream is) throws IOException {
        return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * A minimal project file for a project created from scratch.
     */
    public static KicadProjectFile create(String projectName, String rootUuid) {
        return parse(KicadTemplates.projectFile(projectName, rootUuid));
    }

    public String getFileName() {
        return fileName;
    }

    public List<SheetEntry> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    public String getContent() {
        return content;
    }
}
