package nl.bytesoflife.circuitsync.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A net as seen on one sheet. The same electrical net crossing the hierarchy appears once per
 * sheet it touches; {@link CircuitGraph#flatten()} joins them.
 */
public class Net {

    private int id = -1;
    private final String name;
    private final NetScope scope;
    private final String sheetPath;
    private final Set<NetMember> members = new TreeSet<>();
    private PortDirection direction;
    private boolean named = true;

    public Net(String name, NetScope scope, String sheetPath) {
        this.name = name;
        this.scope = scope;
        this.sheetPath = sheetPath;
    }

    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public NetScope getScope() {
        return scope;
    }

    public String getSheetPath() {
        return sheetPath;
    }

    /**
     * Key of the net within the project: sheet path plus name.
     */
    public String getKey() {
        return sheetPath + name;
    }

    public Set<NetMember> getMembers() {
        return Collections.unmodifiableSet(members);
    }

    public Net addMember(NetMember member) {
        members.add(member);
        return this;
    }

    public PortDirection getDirection() {
        return direction;
    }

    public Net setDirection(PortDirection direction) {
        this.direction = direction;
        return this;
    }

    /**
     * False for nets named after a pin because no label names them.
     */
    public boolean isNamed() {
        return named;
    }

    public Net setNamed(boolean named) {
        this.named = named;
        return this;
    }

    @Override
    public String toString() {
        return "Net{" + getKey() + ", " + scope + ", members=" + members + "}";
    }
}
