package nl.bytesoflife.circuitsync;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SyncCommandTest {

    private static final String CIRCUIT = """
            {
              "components": {
                "R1": {"symbol": "Device:R", "value": "10k"},
                "R2": {"symbol": "Device:R", "value": "10k"}
              },
              "nets": {
                "MID": ["R1.2", "R2.1"],
                "GND": ["R2.2"]
              }
            }
            """;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        out.reset();
        err.reset();
        return new SyncCommand().run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void exitCodeTellsWhetherFilesChanged(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("circuit.json");
        Files.writeString(json, CIRCUIT, StandardCharsets.UTF_8);
        Path project = dir.resolve("board");

        assertEquals(SyncCommand.EXIT_CHANGES_APPLIED, run(project.toString(), "board", json.toString()));
        assertTrue(out().contains("wrote"));
        assertTrue(out().contains("token /R1 = "));
        assertTrue(Files.exists(project.resolve("board.kicad_sch")));

        assertEquals(SyncCommand.EXIT_NO_CHANGES, run(project.toString(), "board", json.toString()));
        assertFalse(out().contains("wrote"));
    }

    @Test
    void dryRunReportsWithoutWriting(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("circuit.json");
        Files.writeString(json, CIRCUIT, StandardCharsets.UTF_8);
        Path project = dir.resolve("board");

        assertEquals(SyncCommand.EXIT_CHANGES_APPLIED, run(project.toString(), "board", json.toString(), "--dry-run"));
        assertTrue(out().contains("would write"));
        assertFalse(Files.exists(project.resolve("board.kicad_sch")));
    }

    @Test
    void exportWritesDescriptionOfProject(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("circuit.json");
        Files.writeString(json, CIRCUIT, StandardCharsets.UTF_8);
        Path project = dir.resolve("board");
        assertEquals(SyncCommand.EXIT_CHANGES_APPLIED, run(project.toString(), "board", json.toString()));

        Path exported = dir.resolve("exported.json");
        assertEquals(SyncCommand.EXIT_NO_CHANGES, run(project.toString(), "board", exported.toString(), "--export"));
        assertTrue(out().contains("exported " + exported));
        String text = Files.readString(exported);
        assertTrue(text.contains("\"R2\""), text);
        assertTrue(text.contains("\"token\""), text);

        assertEquals(SyncCommand.EXIT_NO_CHANGES, run(project.toString(), "board", exported.toString()));

        assertEquals(SyncCommand.EXIT_NO_CHANGES,
                run(project.toString(), "board", dir.resolve("unused.json").toString(), "--export", "--dry-run"));
        assertTrue(out().contains("\"MID\""));
        assertFalse(Files.exists(dir.resolve("unused.json")));
    }

    @Test
    void exportOfMissingProjectFails(@TempDir Path dir) {
        assertEquals(SyncCommand.EXIT_ERROR,
                run(dir.resolve("none").toString(), "board", dir.resolve("out.json").toString(), "--export"));
        assertTrue(err().startsWith("error: Cannot export board"), err());
    }

    @Test
    void rejectsBadArguments() {
        assertEquals(SyncCommand.EXIT_ERROR, run("only-one"));
        assertTrue(err().startsWith("Usage:"));

        assertEquals(SyncCommand.EXIT_ERROR, run("a", "b", "c", "--verbose"));
        assertTrue(err().contains("Unknown option --verbose"));

        assertEquals(SyncCommand.EXIT_ERROR, run("a", "b", "c", "--kicad-cli"));
        assertTrue(err().contains("Missing value for --kicad-cli"));
    }

    @Test
    void reportsUnreadableDescription(@TempDir Path dir) {
        assertEquals(SyncCommand.EXIT_ERROR, run(dir.toString(), "board", dir.resolve("missing.json").toString()));
        assertTrue(err().startsWith("error: cannot read"));
    }

    @Test
    void reportsInvalidCircuit(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("circuit.json");
        Files.writeString(json, "{\"components\": {}, \"nets\": {\"A\": [\"R9.1\"]}}", StandardCharsets.UTF_8);

        assertEquals(SyncCommand.EXIT_ERROR, run(dir.resolve("board").toString(), "board", json.toString()));
        assertTrue(err().contains("R9"));
        assertFalse(Files.exists(dir.resolve("board").resolve("board.kicad_sch")));
    }
}
