package nl.bytesoflife.circuitsync.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * The ordered decisions for every sheet, component, port and net, plus the identity token each
 * described component ends up with.
 */
public class SyncPlan {

    private final List<SheetDecision> sheets = new ArrayList<>();
    private final List<ComponentDecision> components = new ArrayList<>();
    private final List<PortDecision> ports = new ArrayList<>();
    private final List<NetDecision> nets = new ArrayList<>();
    private final Map<String, String> tokenAssignments = new LinkedHashMap<>();

    void addSheet(SheetDecision decision) {
        sheets.add(decision);
    }

    void addComponent(ComponentDecision decision) {
        components.add(decision);
    }

    void addPort(PortDecision decision) {
        ports.add(decision);
    }

    void addNet(NetDecision decision) {
        nets.add(decision);
    }

    /**
     * Records the token of a described component, keyed by sheet path plus component key.
     */
    public void assignToken(String componentKey, String token) {
        tokenAssignments.put(componentKey, token);
    }

    public List<SheetDecision> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    public List<ComponentDecision> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public List<PortDecision> getPorts() {
        return Collections.unmodifiableList(ports);
    }

    public List<NetDecision> getNets() {
        return Collections.unmodifiableList(nets);
    }

    public Map<String, String> getTokenAssignments() {
        return Collections.unmodifiableMap(tokenAssignments);
    }

    public List<ComponentDecision> getComponents(Decision decision) {
        return components.stream().filter(d -> d.decision() == decision).toList();
    }

    public List<NetDecision> getNets(Decision decision) {
        return nets.stream().filter(d -> d.decision() == decision).toList();
    }

    public boolean isNoOp() {
        Predicate<Decision> keep = d -> d == Decision.KEEP;
        return Stream.of(
                sheets.stream().map(SheetDecision::decision),
                components.stream().map(ComponentDecision::decision),
                ports.stream().map(PortDecision::decision),
                nets.stream().map(NetDecision::decision)
        ).flatMap(s -> s).allMatch(keep);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Sync plan:\n");
        Stream.of(sheets, components, ports, nets)
                .flatMap(List::stream)
                .forEach(d -> sb.append("  ").append(d).append('\n'));
        return sb.toString();
    }
}
