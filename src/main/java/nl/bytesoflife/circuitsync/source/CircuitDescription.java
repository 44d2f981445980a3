package nl.bytesoflife.circuitsync.source;

import java.util.List;

/**
 * A resolved circuit description: the components and nets of one sheet plus its subcircuits,
 * each of which becomes a child sheet.
 */
public interface CircuitDescription {

    String name();

    List<ComponentSpec> components();

    List<NetSpec> nets();

    List<? extends CircuitDescription> subcircuits();
}
