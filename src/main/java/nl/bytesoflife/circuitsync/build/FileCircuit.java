package nl.bytesoflife.circuitsync.build;

import nl.bytesoflife.circuitsync.model.CircuitGraph;

import java.util.List;

/**
 * The graph read from a project's files together with the index back into their trees.
 */
public record FileCircuit(CircuitGraph graph, FileIndex index, List<String> warnings) {
}
