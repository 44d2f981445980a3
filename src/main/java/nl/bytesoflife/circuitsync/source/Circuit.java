package nl.bytesoflife.circuitsync.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain in-memory circuit description.
 */
public record Circuit(String name, List<ComponentSpec> components, List<NetSpec> nets,
                      List<Circuit> subcircuits) implements CircuitDescription {

    public Circuit {
        components = List.copyOf(components);
        nets = List.copyOf(nets);
        subcircuits = List.copyOf(subcircuits);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final List<ComponentSpec> components = new ArrayList<>();
        private final List<NetSpec> nets = new ArrayList<>();
        private final List<Circuit> subcircuits = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder component(ComponentSpec component) {
            components.add(component);
            return this;
        }

        public Builder component(String reference, String libId, String value) {
            return component(ComponentSpec.of(reference, libId, value));
        }

        public Builder net(NetSpec net) {
            nets.add(net);
            return this;
        }

        public Builder net(String name, String... connections) {
            return net(NetSpec.of(name, connections));
        }

        public Builder subcircuit(Circuit subcircuit) {
            subcircuits.add(subcircuit);
            return this;
        }

        public Circuit build() {
            return new Circuit(name, components, nets, subcircuits);
        }
    }
}
