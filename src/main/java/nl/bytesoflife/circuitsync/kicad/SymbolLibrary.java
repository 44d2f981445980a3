package nl.bytesoflife.circuitsync.kicad;

import java.util.Optional;

/**
 * Lookup of symbol definitions by library id ({@code Library:Name}).
 */
public interface SymbolLibrary {

    Optional<LibSymbol> find(String libId);
}
