package nl.bytesoflife.circuitsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Canonical circuit model shared by both graph builders. Components, nets and sheets live in
 * arenas addressed by integer id; every cross reference is an id, a sheet path or a token.
 */
public class CircuitGraph {

    private final List<Component> components = new ArrayList<>();
    private final List<Net> nets = new ArrayList<>();
    private final List<Sheet> sheets = new ArrayList<>();
    private final Map<String, Sheet> sheetsByPath = new LinkedHashMap<>();
    private final Map<String, Net> netsByKey = new HashMap<>();

    public Sheet addSheet(Sheet sheet) {
        if (sheetsByPath.containsKey(sheet.getPath())) {
            throw new IdentityConflictException(sheet.getPath(), "sheet " + sheet.getName(),
                    "sheet " + sheetsByPath.get(sheet.getPath()).getName());
        }
        if (!sheet.isRoot()) {
            Sheet parent = sheetsByPath.get(sheet.getParentPath());
            if (parent == null) {
                throw new IllegalArgumentException("Parent sheet " + sheet.getParentPath() + " not in graph");
            }
            parent.addChildPath(sheet.getPath());
        }
        sheet.setId(sheets.size());
        sheets.add(sheet);
        sheetsByPath.put(sheet.getPath(), sheet);
        return sheet;
    }

    public Component addComponent(Component component) {
        Sheet sheet = requireSheet(component.getSheetPath());
        component.setId(components.size());
        components.add(component);
        sheet.addComponentId(component.getId());
        return component;
    }

    public Net addNet(Net net) {
        Sheet sheet = requireSheet(net.getSheetPath());
        if (netsByKey.containsKey(net.getKey())) {
            throw new IllegalArgumentException("Net " + net.getKey() + " already exists");
        }
        net.setId(nets.size());
        nets.add(net);
        netsByKey.put(net.getKey(), net);
        sheet.addNetId(net.getId());
        return net;
    }

    public List<Component> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public List<Net> getNets() {
        return Collections.unmodifiableList(nets);
    }

    public List<Sheet> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    public Component getComponent(int id) {
        return components.get(id);
    }

    public Net getNet(int id) {
        return nets.get(id);
    }

    public Sheet getRoot() {
        return sheetsByPath.get("/");
    }

    public Optional<Sheet> findSheet(String path) {
        return Optional.ofNullable(sheetsByPath.get(path));
    }

    public Sheet requireSheet(String path) {
        Sheet sheet = sheetsByPath.get(path);
        if (sheet == null) {
            throw new IllegalArgumentException("Unknown sheet " + path);
        }
        return sheet;
    }

    public List<Component> componentsOn(String sheetPath) {
        Sheet sheet = sheetsByPath.get(sheetPath);
        if (sheet == null) return List.of();
        return sheet.getComponentIds().stream().map(components::get).toList();
    }

    public List<Net> netsOn(String sheetPath) {
        Sheet sheet = sheetsByPath.get(sheetPath);
        if (sheet == null) return List.of();
        return sheet.getNetIds().stream().map(nets::get).toList();
    }

    public List<Sheet> childrenOf(String sheetPath) {
        Sheet sheet = sheetsByPath.get(sheetPath);
        if (sheet == null) return List.of();
        return sheet.getChildPaths().stream().map(sheetsByPath::get).toList();
    }

    public Optional<Net> findNet(String sheetPath, String name) {
        return Optional.ofNullable(netsByKey.get(sheetPath + name));
    }

    public Optional<Component> findComponent(String sheetPath, String reference, int unit) {
        for (Component component : componentsOn(sheetPath)) {
            if (component.getReference().equals(reference) && component.getUnit() == unit) {
                return Optional.of(component);
            }
        }
        return Optional.empty();
    }

    /**
     * All units of the component with this reference on the sheet.
     */
    public List<Component> findUnits(String sheetPath, String reference) {
        List<Component> result = new ArrayList<>();
        for (Component component : componentsOn(sheetPath)) {
            if (component.getReference().equals(reference)) {
                result.add(component);
            }
        }
        return result;
    }

    /**
     * The unit instance that carries the given pin, if any unit declares it.
     */
    public Optional<Component> findUnitForPin(String sheetPath, String reference, String pinNumber) {
        Component fallback = null;
        for (Component unit : findUnits(sheetPath, reference)) {
            for (Pin pin : unit.getPins()) {
                if (pin.number().equals(pinNumber) && pin.belongsTo(unit.getUnit())) {
                    return Optional.of(unit);
                }
            }
            if (fallback == null) fallback = unit;
        }
        return Optional.ofNullable(fallback);
    }

    public Optional<Sheet> findChildByName(String parentPath, String childName) {
        return findSheet(Sheet.childPath(parentPath, childName));
    }

    public boolean hasTokens() {
        for (Component component : components) {
            if (component.getToken() != null) return true;
        }
        return false;
    }

    /**
     * Checks token uniqueness, reference uniqueness and that every membership resolves. A reference
     * names one package in the whole project: its units share a sheet, and no other sheet reuses it,
     * since the netlist and the annotation know components by reference alone.
     */
    public void validate() {
        Map<String, String> tokens = new HashMap<>();
        Map<String, String> referenceSheets = new HashMap<>();
        for (Component component : components) {
            String sheet = referenceSheets.putIfAbsent(component.getReference(), component.getSheetPath());
            if (sheet != null && !sheet.equals(component.getSheetPath())) {
                throw new IdentityConflictException(component.getReference(), "a component on " + sheet,
                        "a component on " + component.getSheetPath());
            }
            if (component.getToken() != null) {
                String previous = tokens.putIfAbsent(component.getToken(), component.getSheetPath() + component.getKey());
                if (previous != null) {
                    throw new IdentityConflictException(component.getToken(), previous,
                            component.getSheetPath() + component.getKey());
                }
            }
        }
        for (Sheet sheet : sheets) {
            if (sheet.getToken() != null) {
                String previous = tokens.putIfAbsent(sheet.getToken(), "sheet " + sheet.getPath());
                if (previous != null) {
                    throw new IdentityConflictException(sheet.getToken(), previous, "sheet " + sheet.getPath());
                }
            }
            Set<String> keys = new HashSet<>();
            for (Component component : componentsOn(sheet.getPath())) {
                if (!keys.add(component.getKey())) {
                    throw new IdentityConflictException(component.getKey(),
                            "a component on " + sheet.getPath(), "another component on the same sheet");
                }
            }
        }
        for (Net net : nets) {
            for (NetMember member : net.getMembers()) {
                if (member.isComponentPin()) {
                    validateComponentPin(net, member);
                } else if (findChildByName(net.getSheetPath(), member.owner()).isEmpty()) {
                    throw new UnresolvedReferenceException(net.getName(), "sheet " + member.owner(),
                            "no child sheet with that name on " + net.getSheetPath());
                }
            }
        }
    }

    private void validateComponentPin(Net net, NetMember member) {
        List<Component> units = findUnits(net.getSheetPath(), member.owner());
        if (units.isEmpty()) {
            throw new UnresolvedReferenceException(net.getName(), member.owner(),
                    "no such component on sheet " + net.getSheetPath());
        }
        boolean pinsKnown = false;
        for (Component unit : units) {
            if (!unit.getPins().isEmpty()) {
                pinsKnown = true;
                if (unit.findPin(member.pin()).isPresent()) {
                    return;
                }
            }
        }
        if (pinsKnown) {
            throw new UnresolvedReferenceException(net.getName(), member.toString(), "component has no pin " + member.pin());
        }
    }

    /**
     * Joins sheet nets across the hierarchy (hierarchical label to sheet pin) and across the
     * project (global nets by name) into the flat netlist, sorted by name.
     */
    public List<FlatNet> flatten() {
        int[] parent = new int[nets.size()];
        for (int i = 0; i < parent.length; i++) parent[i] = i;

        Map<String, Integer> globals = new HashMap<>();
        for (Net net : nets) {
            if (net.getScope() == NetScope.GLOBAL_POWER) {
                Integer first = globals.putIfAbsent(net.getName(), net.getId());
                if (first != null) union(parent, first, net.getId());
            }
            for (NetMember member : net.getMembers()) {
                if (member.isComponentPin()) continue;
                String childPath = Sheet.childPath(net.getSheetPath(), member.owner());
                findNet(childPath, member.pin())
                        .filter(child -> child.getScope() == NetScope.HIERARCHICAL)
                        .ifPresent(child -> union(parent, net.getId(), child.getId()));
            }
        }

        Map<Integer, List<Net>> groups = new TreeMap<>();
        for (Net net : nets) {
            groups.computeIfAbsent(find(parent, net.getId()), k -> new ArrayList<>()).add(net);
        }

        List<FlatNet> result = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        for (List<Net> group : groups.values()) {
            List<FlatNet.Node> nodes = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (Net net : group) {
                for (NetMember member : net.getMembers()) {
                    if (!member.isComponentPin()) continue;
                    if (!seen.add(member.owner() + "." + member.pin())) continue;
                    Pin pin = findUnitForPin(net.getSheetPath(), member.owner(), member.pin())
                            .flatMap(c -> c.findPin(member.pin()))
                            .orElse(new Pin(member.pin(), "", PinType.PASSIVE));
                    nodes.add(new FlatNet.Node(member.owner(), member.pin(), pin.type(), pin.name(), net.getSheetPath()));
                }
            }
            if (nodes.isEmpty()) continue;
            nodes.sort(Comparator.comparing(FlatNet.Node::reference, ReferenceOrder::compare)
                    .thenComparing(FlatNet.Node::pin, ReferenceOrder::compare));
            String name = flatName(group);
            String unique = name;
            for (int n = 2; !usedNames.add(unique); n++) {
                unique = name + "_" + n;
            }
            result.add(new FlatNet(unique, nodes));
        }
        result.sort(Comparator.comparing(FlatNet::name));
        return result;
    }

    private static String flatName(List<Net> group) {
        Net best = null;
        for (Net net : group) {
            if (net.getScope() == NetScope.GLOBAL_POWER) {
                return net.getName();
            }
            if (best == null || rank(net) < rank(best)
                    || (rank(net) == rank(best) && net.getSheetPath().compareTo(best.getSheetPath()) < 0)) {
                best = net;
            }
        }
        return best.isNamed() ? best.getSheetPath() + best.getName() : best.getName();
    }

    // named nets first, then the shallowest sheet
    private static int rank(Net net) {
        int depth = (int) net.getSheetPath().chars().filter(c -> c == '/').count();
        return (net.isNamed() ? 0 : 1000) + depth;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) {
            parent[Math.max(ra, rb)] = Math.min(ra, rb);
        }
    }
}
