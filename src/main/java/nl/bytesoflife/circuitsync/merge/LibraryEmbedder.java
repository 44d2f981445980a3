package nl.bytesoflife.circuitsync.merge;

import nl.bytesoflife.circuitsync.kicad.LibSymbol;
import nl.bytesoflife.circuitsync.kicad.SymbolLibrary;
import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.parser.SDocument;
import nl.bytesoflife.circuitsync.parser.SExpressionFormatter;
import nl.bytesoflife.circuitsync.parser.SExpressionParser;
import nl.bytesoflife.circuitsync.parser.SExpressions;
import nl.bytesoflife.circuitsync.parser.SNode;
import nl.bytesoflife.circuitsync.parser.SNode.SList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the {@code lib_symbols} section of a schematic in step with the symbols placed on it.
 */
class LibraryEmbedder {

    private static final Logger log = LoggerFactory.getLogger(LibraryEmbedder.class);

    private final SymbolLibrary library;
    private final NodeFactory nodes;
    private final SExpressionParser parser = new SExpressionParser();

    LibraryEmbedder(SymbolLibrary library, NodeFactory nodes) {
        this.library = library;
        this.nodes = nodes;
    }

    /**
     * Embeds the definition of {@code libId} unless the document already has it. Symbols missing
     * from the library get a generated rectangle with the given pins.
     *
     * @return true when a generated symbol was used
     */
    boolean ensure(SDocument document, String libId, List<Pin> pins) {
        SList libSymbols = libSymbols(document);
        for (SList existing : SExpressions.findChildren(libSymbols, "symbol")) {
            if (libId.equals(SExpressions.getAtomValue(existing, 1))) return false;
        }
        Optional<LibSymbol> symbol = library.find(libId);
        SList definition;
        boolean generated = symbol.isEmpty();
        if (symbol.isPresent()) {
            definition = copy(symbol.get().getNode());
            definition.set(1, NodeFactory.str(libId));
        } else {
            log.warn("Symbol {} not found in any library, embedding a generic symbol", libId);
            definition = nodes.genericLibSymbol(libId, pins);
        }
        SExpressionFormatter.detect(document).append(libSymbols, definition);
        return generated;
    }

    /**
     * Removes embedded definitions no placed symbol refers to.
     *
     * @return number of definitions removed
     */
    int removeUnused(SDocument document) {
        SList root = document.getRoot();
        Optional<SList> libSymbols = SExpressions.findChild(root, "lib_symbols");
        if (libSymbols.isEmpty()) return 0;
        Set<String> used = new HashSet<>();
        for (SList symbol : SExpressions.findChildren(root, "symbol")) {
            String libName = SExpressions.childValue(symbol, "lib_name");
            used.add(libName != null ? libName : SExpressions.childValue(symbol, "lib_id"));
        }
        int removed = 0;
        for (SList definition : SExpressions.findChildren(libSymbols.get(), "symbol")) {
            if (!used.contains(SExpressions.getAtomValue(definition, 1))) {
                libSymbols.get().remove(definition);
                removed++;
            }
        }
        if (removed > 0 && SExpressions.findChildren(libSymbols.get(), "symbol").isEmpty()) {
            libSymbols.get().setTrailing("");
        }
        return removed;
    }

    private SList libSymbols(SDocument document) {
        SList root = document.getRoot();
        Optional<SList> existing = SExpressions.findChild(root, "lib_symbols");
        if (existing.isPresent()) return existing.get();
        SList created = SList.tagged("lib_symbols");
        int index = 1;
        for (int i = 1; i < root.size(); i++) {
            String tag = SExpressions.getTag(root.get(i));
            if (tag.equals("version") || tag.equals("generator") || tag.equals("generator_version")
                    || tag.equals("uuid") || tag.equals("paper") || tag.equals("title_block")) {
                index = i + 1;
            }
        }
        SExpressionFormatter.detect(document).insert(root, index, created);
        return created;
    }

    private SList copy(SList node) {
        SNode copy = parser.parse(node.toString()).getRoot();
        return (SList) copy;
    }
}
