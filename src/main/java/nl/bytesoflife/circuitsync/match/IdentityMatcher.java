package nl.bytesoflife.circuitsync.match;

import nl.bytesoflife.circuitsync.model.CircuitGraph;
import nl.bytesoflife.circuitsync.model.Component;
import nl.bytesoflife.circuitsync.model.HierarchicalPort;
import nl.bytesoflife.circuitsync.model.Net;
import nl.bytesoflife.circuitsync.model.NetMember;
import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.ReferenceOrder;
import nl.bytesoflife.circuitsync.model.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides, element by element, how the graph read from the files becomes the graph the
 * description asks for. Matching is a pure function of the two graphs.
 */
public class IdentityMatcher {

    private static final Logger log = LoggerFactory.getLogger(IdentityMatcher.class);

    private static final Comparator<Component> COMPONENT_ORDER = Comparator
            .comparing(Component::getSheetPath)
            .thenComparing(Component::getReference, ReferenceOrder::compare)
            .thenComparingInt(Component::getUnit);

    private final List<MatchStrategy> strategies = new ArrayList<>();
    private boolean preserveUserComponents;

    /**
     * Token, then reference, then attribute matching.
     */
    public static IdentityMatcher withDefaultStrategies() {
        return new IdentityMatcher()
                .registerStrategy(new TokenMatchStrategy())
                .registerStrategy(new ReferenceMatchStrategy())
                .registerStrategy(new AttributeMatchStrategy());
    }

    public IdentityMatcher registerStrategy(MatchStrategy strategy) {
        strategies.add(strategy);
        return this;
    }

    public IdentityMatcher setPreserveUserComponents(boolean preserveUserComponents) {
        this.preserveUserComponents = preserveUserComponents;
        return this;
    }

    public SyncPlan match(CircuitGraph previous, CircuitGraph next) {
        SyncPlan plan = new SyncPlan();
        Set<String> removedSheets = matchSheets(previous, next, plan);
        ComponentIndex components = matchComponents(previous, next, removedSheets, plan);
        Set<String> changedPorts = matchPorts(previous, next, removedSheets, plan);
        matchNets(previous, next, removedSheets, components, changedPorts, plan);
        log.debug("{}", plan);
        return plan;
    }

    private Set<String> matchSheets(CircuitGraph previous, CircuitGraph next, SyncPlan plan) {
        for (Sheet sheet : next.getSheets()) {
            plan.addSheet(previous.findSheet(sheet.getPath())
                    .map(p -> new SheetDecision(Decision.KEEP, p, sheet))
                    .orElseGet(() -> new SheetDecision(Decision.ADD, null, sheet)));
        }
        Set<String> removed = new HashSet<>();
        for (Sheet sheet : previous.getSheets()) {
            if (next.findSheet(sheet.getPath()).isPresent() || isUnder(sheet.getPath(), removed)) continue;
            removed.add(sheet.getPath());
            plan.addSheet(new SheetDecision(Decision.REMOVE, sheet, null));
        }
        return removed;
    }

    private ComponentIndex matchComponents(CircuitGraph previous, CircuitGraph next, Set<String> removedSheets,
                                           SyncPlan plan) {
        List<Component> unmatchedPrevious = new ArrayList<>();
        for (Component component : previous.getComponents()) {
            if (!isUnder(component.getSheetPath(), removedSheets)) unmatchedPrevious.add(component);
        }
        List<Component> unmatchedNext = new ArrayList<>(next.getComponents());

        List<ComponentDecision> decisions = new ArrayList<>();
        for (MatchStrategy strategy : strategies) {
            if (!strategy.isApplicable(previous, next)) continue;
            for (ComponentMatch match : strategy.match(List.copyOf(unmatchedPrevious), List.copyOf(unmatchedNext))) {
                unmatchedPrevious.remove(match.previous());
                unmatchedNext.remove(match.next());
                Set<ComponentChange> changes = changesOf(match.previous(), match.next());
                Decision decision = changes.isEmpty() ? Decision.KEEP : Decision.UPDATE;
                decisions.add(new ComponentDecision(decision, match.previous(), match.next(), changes, false,
                        strategy.getName()));
                if (match.previous().getToken() != null) {
                    plan.assignToken(match.next().getSheetPath() + match.next().getKey(), match.previous().getToken());
                }
            }
        }
        for (Component component : unmatchedNext) {
            decisions.add(new ComponentDecision(Decision.ADD, null, component, Set.of(), false, null));
        }
        for (Component component : unmatchedPrevious) {
            if (preserveUserComponents) {
                decisions.add(new ComponentDecision(Decision.KEEP, component, null, Set.of(), true, null));
            } else {
                decisions.add(new ComponentDecision(Decision.REMOVE, component, null, Set.of(), false, null));
            }
        }

        decisions.sort(Comparator.comparing((ComponentDecision d) -> d.previous() != null ? d.previous() : d.next(),
                COMPONENT_ORDER));
        ComponentIndex index = new ComponentIndex();
        for (ComponentDecision decision : decisions) {
            plan.addComponent(decision);
            index.add(decision);
        }
        return index;
    }

    private static Set<ComponentChange> changesOf(Component previous, Component next) {
        Set<ComponentChange> changes = EnumSet.noneOf(ComponentChange.class);
        if (!Objects.equals(previous.getValue(), next.getValue())) changes.add(ComponentChange.VALUE);
        if (!Objects.equals(previous.getFootprint(), next.getFootprint())) changes.add(ComponentChange.FOOTPRINT);
        if (!Objects.equals(previous.getLibId(), next.getLibId())) changes.add(ComponentChange.LIBRARY);
        if (!previous.getReference().equals(next.getReference())) changes.add(ComponentChange.REFERENCE);
        if (next.isExplicitPlacement() && next.getPosition() != null
                && (previous.getPosition() == null || !previous.getPosition().sameAs(next.getPosition())
                || previous.getRotation() != next.getRotation())) {
            changes.add(ComponentChange.PLACEMENT);
        }
        return changes;
    }

    private Set<String> matchPorts(CircuitGraph previous, CircuitGraph next, Set<String> removedSheets,
                                   SyncPlan plan) {
        Set<String> changed = new HashSet<>();
        for (Sheet sheet : next.getSheets()) {
            Map<String, HierarchicalPort> previousPorts = previous.findSheet(sheet.getPath())
                    .map(Sheet::getPorts).orElse(Map.of());
            for (String name : new TreeSet<>(sheet.getPorts().keySet())) {
                HierarchicalPort port = sheet.getPorts().get(name);
                HierarchicalPort old = previousPorts.get(port.name());
                Decision decision;
                if (old == null) {
                    decision = Decision.ADD;
                } else if (old.isComplete() && old.direction() == port.direction()) {
                    decision = Decision.KEEP;
                } else {
                    decision = Decision.UPDATE;
                }
                if (decision != Decision.KEEP) changed.add(sheet.getPath() + ":" + port.name());
                plan.addPort(new PortDecision(decision, sheet.getPath(), port.name(), old, port));
            }
        }
        for (Sheet sheet : previous.getSheets()) {
            if (isUnder(sheet.getPath(), removedSheets)) continue;
            Map<String, HierarchicalPort> nextPorts = next.findSheet(sheet.getPath())
                    .map(Sheet::getPorts).orElse(Map.of());
            for (String name : new TreeSet<>(sheet.getPorts().keySet())) {
                if (!nextPorts.containsKey(name)) {
                    plan.addPort(new PortDecision(Decision.REMOVE, sheet.getPath(), name,
                            sheet.getPorts().get(name), null));
                }
            }
        }
        return changed;
    }

    private void matchNets(CircuitGraph previous, CircuitGraph next, Set<String> removedSheets,
                           ComponentIndex components, Set<String> changedPorts, SyncPlan plan) {
        List<NetDecision> decisions = new ArrayList<>();
        Set<String> handled = new HashSet<>();
        for (Net net : next.getNets()) {
            Net old = previous.findNet(net.getSheetPath(), net.getName()).orElse(null);
            if (old == null) {
                decisions.add(new NetDecision(Decision.ADD, null, net));
                continue;
            }
            handled.add(old.getKey());
            if (old.getScope() != net.getScope()) {
                decisions.add(new NetDecision(Decision.REMOVE, old, null));
                decisions.add(new NetDecision(Decision.ADD, null, net));
            } else if (!significantMembers(old, components).equals(net.getMembers())
                    || touchesChangedElement(net, components, changedPorts, next)) {
                decisions.add(new NetDecision(Decision.UPDATE, old, net));
            } else {
                decisions.add(new NetDecision(Decision.KEEP, old, net));
            }
        }
        for (Net old : previous.getNets()) {
            if (handled.contains(old.getKey()) || isUnder(old.getSheetPath(), removedSheets)) continue;
            if (preserveUserComponents && onlyPreservedMembers(old, components)) {
                decisions.add(new NetDecision(Decision.KEEP, old, null));
            } else {
                decisions.add(new NetDecision(Decision.REMOVE, old, null));
            }
        }
        decisions.sort(Comparator.comparing((NetDecision d) -> d.getNet().getKey())
                .thenComparing(d -> d.decision() == Decision.REMOVE ? 0 : 1));
        decisions.forEach(plan::addNet);
    }

    // members of preserved components do not count against the described membership
    private Set<NetMember> significantMembers(Net old, ComponentIndex components) {
        if (!preserveUserComponents) return old.getMembers();
        Set<NetMember> members = new TreeSet<>();
        for (NetMember member : old.getMembers()) {
            if (member.isComponentPin() && components.isPreserved(old.getSheetPath(), member.owner())) continue;
            members.add(member);
        }
        return members;
    }

    private static boolean onlyPreservedMembers(Net old, ComponentIndex components) {
        boolean any = false;
        for (NetMember member : old.getMembers()) {
            if (!member.isComponentPin() || !components.isPreserved(old.getSheetPath(), member.owner())) {
                return false;
            }
            any = true;
        }
        return any;
    }

    private static boolean touchesChangedElement(Net net, ComponentIndex components, Set<String> changedPorts,
                                                 CircuitGraph next) {
        for (NetMember member : net.getMembers()) {
            if (member.isComponentPin()) {
                if (components.isChanged(net.getSheetPath(), member.owner())) return true;
            } else {
                String childPath = Sheet.childPath(net.getSheetPath(), member.owner());
                if (changedPorts.contains(childPath + ":" + member.pin())) return true;
            }
        }
        if (net.getScope() == NetScope.HIERARCHICAL) {
            return changedPorts.contains(net.getSheetPath() + ":" + net.getName());
        }
        return false;
    }

    private static boolean isUnder(String path, Set<String> roots) {
        for (String root : roots) {
            if (path.startsWith(root)) return true;
        }
        return false;
    }

    /**
     * Component decisions by the reference a net member would use, on either side of the match.
     */
    private static class ComponentIndex {
        private final Map<String, Boolean> changedByNextRef = new HashMap<>();
        private final Set<String> preserved = new HashSet<>();

        void add(ComponentDecision decision) {
            if (decision.preserved()) {
                preserved.add(decision.previous().getSheetPath() + ":" + decision.previous().getReference());
                return;
            }
            if (decision.next() == null) return;
            boolean changed = decision.decision() == Decision.ADD
                    || decision.hasChange(ComponentChange.PLACEMENT)
                    || decision.hasChange(ComponentChange.REFERENCE)
                    || decision.hasChange(ComponentChange.LIBRARY);
            changedByNextRef.merge(decision.next().getSheetPath() + ":" + decision.next().getReference(),
                    changed, Boolean::logicalOr);
        }

        boolean isChanged(String sheetPath, String reference) {
            return changedByNextRef.getOrDefault(sheetPath + ":" + reference, false);
        }

        boolean isPreserved(String sheetPath, String reference) {
            return preserved.contains(sheetPath + ":" + reference);
        }
    }
}
