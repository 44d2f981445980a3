package nl.bytesoflife.circuitsync;

import nl.bytesoflife.circuitsync.kicad.KicadSymbolLibrary;
import nl.bytesoflife.circuitsync.source.Circuit;
import nl.bytesoflife.circuitsync.source.JsonCircuitReader;
import nl.bytesoflife.circuitsync.source.JsonCircuitWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * <pre>
 * circuit-sync &lt;project-dir&gt; &lt;project-name&gt; &lt;circuit.json&gt; [--preserve-user-components]
 *     [--dry-run] [--strict] [--erc] [--kicad-cli &lt;path&gt;] [--symbols &lt;dir&gt;] [--export]
 * </pre>
 * Exits with 0 when the project was already up to date, 1 when files were changed and 2 on any
 * error, in which case nothing has been written. With {@code --export} the project is read back
 * into {@code circuit.json} instead (printed when combined with {@code --dry-run}), exiting with
 * 0 on success.
 */
public class SyncCommand {

    private static final Logger log = LoggerFactory.getLogger(SyncCommand.class);

    public static final int EXIT_NO_CHANGES = 0;
    public static final int EXIT_CHANGES_APPLIED = 1;
    public static final int EXIT_ERROR = 2;

    private static final String USAGE = "Usage: circuit-sync <project-dir> <project-name> <circuit.json>"
            + " [--preserve-user-components] [--dry-run] [--strict] [--erc] [--kicad-cli <path>] [--symbols <dir>]"
            + " [--export]";

    public static void main(String[] args) {
        System.exit(new SyncCommand().run(args, System.out, System.err));
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        SyncOptions options = new SyncOptions();
        List<Path> symbolDirectories = new ArrayList<>();
        boolean exportMode = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--preserve-user-components" -> options.withPreserveUserComponents(true);
                case "--dry-run" -> options.withDryRun(true);
                case "--strict" -> options.withStrictVerification(true);
                case "--erc" -> options.withErc(true);
                case "--export" -> exportMode = true;
                case "--kicad-cli", "--symbols" -> {
                    if (i + 1 >= args.length) {
                        err.println("Missing value for " + arg);
                        err.println(USAGE);
                        return EXIT_ERROR;
                    }
                    String value = args[++i];
                    if (arg.equals("--kicad-cli")) {
                        options.withKicadCli(value);
                    } else {
                        symbolDirectories.add(Path.of(value));
                    }
                }
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("Unknown option " + arg);
                        err.println(USAGE);
                        return EXIT_ERROR;
                    }
                    positional.add(arg);
                }
            }
        }
        if (positional.size() != 3) {
            err.println(USAGE);
            return EXIT_ERROR;
        }

        try {
            if (!symbolDirectories.isEmpty()) {
                KicadSymbolLibrary library = KicadSymbolLibrary.bundled();
                symbolDirectories.forEach(library::addDirectory);
                options.withSymbolLibrary(library);
            }
            if (exportMode) {
                return export(options, positional, out);
            }
            Circuit circuit = new JsonCircuitReader().read(Path.of(positional.get(2)));
            SyncResult result = new SyncSession(options).sync(Path.of(positional.get(0)), positional.get(1), circuit);

            out.print(result.report());
            for (Map.Entry<String, String> token : result.tokenAssignments().entrySet()) {
                out.println("  token " + token.getKey() + " = " + token.getValue());
            }
            for (String warning : result.warnings()) {
                out.println("  warning: " + warning);
            }
            for (Path file : result.changedFiles()) {
                out.println((options.isDryRun() ? "  would write " : "  wrote ") + file);
            }
            return result.hasChanges() ? EXIT_CHANGES_APPLIED : EXIT_NO_CHANGES;
        } catch (CircuitSyncException | UncheckedIOException | IllegalArgumentException e) {
            log.debug("Sync failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            log.debug("Cannot access circuit description", e);
            err.println("error: cannot " + (exportMode ? "write " : "read ") + positional.get(2) + ": " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static int export(SyncOptions options, List<String> positional, PrintStream out) throws IOException {
        Circuit circuit = new SyncSession(options).export(Path.of(positional.get(0)), positional.get(1));
        JsonCircuitWriter writer = new JsonCircuitWriter();
        if (options.isDryRun()) {
            out.print(writer.write(circuit));
        } else {
            Path target = Path.of(positional.get(2));
            writer.write(circuit, target);
            out.println("  exported " + target);
        }
        return EXIT_NO_CHANGES;
    }
}
