package nl.bytesoflife.circuitsync.kicad;

import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionParser;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode;
import nl.bytesoflife.circuitsync.parser.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Symbol library backed by {@code .kicad_sym} files. The library name of each symbol is the file
 * name without extension, as in KiCad's global symbol table.
 */
public class KicadSymbolLibrary implements SymbolLibrary {

    private static final Logger log = LoggerFactory.getLogger(KicadSymbolLibrary.class);

    private static final List<String> BUNDLED = List.of("Device", "74xx", "power");

    private final Map<String, LibSymbol> symbols = new LinkedHashMap<>();

    /**
     * The libraries shipped with circuit-sync on the classpath.
     */
    public static KicadSymbolLibrary bundled() {
        KicadSymbolLibrary library = new KicadSymbolLibrary();
        for (String name : BUNDLED) {
            String resource = "/symbols/" + name + ".kicad_sym";
            try (InputStream is = KicadSymbolLibrary.class.getResourceAsStream(resource)) {
                if (is == null) throw new IllegalStateException("Resource not found: " + resource);
                library.addLibrary(name, new String(is.readAllBytes(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load bundled symbols " + resource, e);
            }
        }
        return library;
    }

    /**
     * Adds every {@code .kicad_sym} file in a directory. Later additions win over earlier ones.
     */
    public KicadSymbolLibrary addDirectory(Path directory) {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.kicad_sym")) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String libraryName = fileName.substring(0, fileName.length() - ".kicad_sym".length());
                try {
                    addLibrary(libraryName, Files.readString(file));
                } catch (SyntaxException e) {
                    throw e.inFile(file.toString());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read symbol directory " + directory, e);
        }
        return this;
    }

    public KicadSymbolLibrary addLibrary(String libraryName, String content) {
        SDocument document = new SExpressionParser().parse(content);
        int count = 0;
        for (SNode.SList symbol : SExpressions.findChildren(document.getRoot(), "symbol")) {
            String libId = libraryName + ":" + SExpressions.getAtomValue(symbol, 1);
            symbols.put(libId, LibSymbol.parse(libId, symbol));
            count++;
        }
        log.debug("Loaded {} symbols from library {}", count, libraryName);
        return this;
    }

    @Override
    public Optional<LibSymbol> find(String libId) {
        return Optional.ofNullable(symbols.get(libId));
    }

    public int size() {
        return symbols.size();
    }
}
