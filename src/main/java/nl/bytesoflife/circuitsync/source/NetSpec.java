package nl.bytesoflife.circuitsync.source;

import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.PortDirection;

import java.util.Arrays;
import java.util.List;

/**
 * A net as declared by the description. Scope and direction are optional; when absent they are
 * inferred while building the graph.
 */
public record NetSpec(String name, NetScope scope, PortDirection direction, List<ConnectionSpec> connections) {

    public NetSpec {
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    public static NetSpec of(String name, String... connections) {
        return new NetSpec(name, null, null, Arrays.stream(connections).map(ConnectionSpec::parse).toList());
    }

    public NetSpec withScope(NetScope scope) {
        return new NetSpec(name, scope, direction, connections);
    }

    public NetSpec withDirection(PortDirection direction) {
        return new NetSpec(name, scope, direction, connections);
    }
}
