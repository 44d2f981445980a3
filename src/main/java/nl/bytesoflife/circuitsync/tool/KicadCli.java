package nl.bytesoflife.circuitsync.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@code kicad-cli} command line tool for electrical rule checks and exports.
 * <p>
 * Combined stdout and stderr go to a temporary log file, so a chatty process never blocks
 * on a full pipe. A run that exceeds the timeout is killed.
 */
public class KicadCli {

    private static final Logger log = LoggerFactory.getLogger(KicadCli.class);

    public static final String DEFAULT_EXECUTABLE = "kicad-cli";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

    private static final int OUTPUT_TAIL = 2000;

    private final String executable;
    private final Duration timeout;

    public KicadCli() {
        this(DEFAULT_EXECUTABLE, DEFAULT_TIMEOUT);
    }

    public KicadCli(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    public String getExecutable() {
        return executable;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Runs the electrical rule check on a schematic and parses the JSON report.
     */
    public ErcReport runErc(Path schematic) {
        Path report = null;
        try {
            report = Files.createTempFile("erc", ".json");
            run(List.of("sch", "erc", "--format", "json", "--output", report.toString(), schematic.toString()),
                    schematic.getParent());
            String json = Files.readString(report, StandardCharsets.UTF_8);
            ErcReport result = ErcReport.parse(json);
            log.info("ERC on {}: {} violations", schematic.getFileName(), result.getViolations().size());
            return result;
        } catch (IOException e) {
            throw new ExternalToolException("Could not read ERC report for " + schematic, e);
        } finally {
            deleteQuietly(report);
        }
    }

    /**
     * Exports from the project file {@code input} into {@code output}, a file or a directory
     * depending on the export.
     */
    public void export(ExportKind kind, Path input, Path output) {
        List<String> arguments = new ArrayList<>(kind.getCommand());
        arguments.add("--output");
        arguments.add(output.toString());
        arguments.add(input.toString());
        run(arguments, input.getParent());
        log.info("Exported {} from {} to {}", kind, input.getFileName(), output);
    }

    /**
     * Runs the tool with the given arguments and returns its combined output.
     *
     * @throws ExternalToolException when the tool cannot start, exits non-zero or times out
     */
    public String run(List<String> arguments, Path workingDirectory) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(arguments);
        log.debug("Running {}", String.join(" ", command));

        Path logFile = null;
        Process process = null;
        try {
            logFile = Files.createTempFile("kicad-cli", ".log");
            ProcessBuilder pb = new ProcessBuilder(command);
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            pb.redirectErrorStream(true);
            pb.redirectOutput(new File(logFile.toString()));
            process = pb.start();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String output = tail(Files.readString(logFile, StandardCharsets.UTF_8));
            if (!finished) {
                throw new ExternalToolException(executable + " timed out after " + timeout.toSeconds() + "s",
                        -1, output);
            }
            int exit = process.exitValue();
            if (exit != 0) {
                throw new ExternalToolException(executable + " failed with exit code " + exit + ": " + output,
                        exit, output);
            }
            return output;
        } catch (IOException e) {
            throw new ExternalToolException("Could not run " + executable, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException("Interrupted while running " + executable, e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(logFile);
        }
    }

    private static String tail(String output) {
        String trimmed = output.strip();
        return trimmed.length() <= OUTPUT_TAIL ? trimmed : trimmed.substring(trimmed.length() - OUTPUT_TAIL);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}", file, e);
        }
    }
}
