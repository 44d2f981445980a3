package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.parser.SyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class KicadProjectTest {

    @Test
    void missingRootGivesNewProject(@TempDir Path dir) {
        KicadProject project = KicadProject.load(dir, "fresh", () -> "00000000-0000-0000-0000-0000000000ff");

        assertTrue(project.getRoot().isNew());
        assertEquals("00000000-0000-0000-0000-0000000000ff", project.getRoot().getUuid());
        assertTrue(project.isProjectFileNew());
        assertEquals("fresh.kicad_pro", project.getProjectFile().getFileName());
        assertNull(project.getNetlist());
    }

    @Test
    void loadsReferencedSheetsAndWarnsAboutMissingOnes(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("demo.kicad_sch"), SchematicContentsTest.SCHEMATIC);

        KicadProject project = KicadProject.load(dir, "demo", () -> "00000000-0000-0000-0000-0000000000ee");

        assertEquals(2, project.getSchematics().size());
        assertFalse(project.getRoot().isNew());
        assertFalse(project.getRoot().isModified());
        assertTrue(project.getSchematic("sub.kicad_sch").isNew());
        assertEquals(1, project.getWarnings().size());
        assertTrue(project.getWarnings().get(0).contains("sub.kicad_sch"));
    }

    @Test
    void syntaxErrorsNameTheFile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("broken.kicad_sch"), "(kicad_sch\n  (version 1)\n");

        SyntaxException e = assertThrows(SyntaxException.class,
                () -> KicadProject.load(dir, "broken", () -> "u"));
        assertTrue(e.getSource().endsWith("broken.kicad_sch"), e.getSource());
        assertEquals("<EOF>", e.getToken());
    }

    @Test
    void readsProjectFileSheets() {
        KicadProjectFile file = KicadProjectFile.parse("""
                {
                  "meta": { "filename": "demo.kicad_pro", "version": 1 },
                  "sheets": [ ["00000000-0000-0000-0000-0000000000aa", "Root"], ["00000000-0000-0000-0000-000000000005", "sub"] ]
                }
                """);
        assertEquals("demo.kicad_pro", file.getFileName());
        assertEquals(2, file.getSheets().size());
        assertEquals("sub", file.getSheets().get(1).name());
    }
}
