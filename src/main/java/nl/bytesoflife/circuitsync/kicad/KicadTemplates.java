package nl.bytesoflife.circuitsync.kicad;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * File skeletons for new projects and sheets, bundled as classpath resources.
 */
public final class KicadTemplates {

    private KicadTemplates() {
    }

    public static String rootSchematic(String uuid) {
        return render("/templates/root.kicad_sch", Map.of("uuid", uuid));
    }

    public static String sheetSchematic(String uuid) {
        return render("/templates/sheet.kicad_sch", Map.of("uuid", uuid));
    }

    public static String projectFile(String name, String rootUuid) {
        return render("/templates/project.kicad_pro", Map.of("name", name, "uuid", rootUuid));
    }

    private static String render(String resource, Map<String, String> variables) {
        String text = load(resource);
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            text = text.replace("${" + entry.getKey() + "}", entry.getValue());
        }
        return text;
    }

    private static String load(String resource) {
        try (InputStream is = KicadTemplates.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load template " + resource, e);
        }
    }
}
