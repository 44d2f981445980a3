package nl.bytesoflife.circuitsync.model;

/**
 * One connection of a sheet net: either a component pin ({@code owner} is the reference) or a pin
 * of a child sheet-symbol instance ({@code owner} is the child sheet name).
 */
public record NetMember(Kind kind, String owner, String pin) implements Comparable<NetMember> {

    public enum Kind {
        COMPONENT_PIN,
        SHEET_PIN
    }

    public static NetMember componentPin(String reference, String pinNumber) {
        return new NetMember(Kind.COMPONENT_PIN, reference, pinNumber);
    }

    public static NetMember sheetPin(String sheetName, String pinName) {
        return new NetMember(Kind.SHEET_PIN, sheetName, pinName);
    }

    public boolean isComponentPin() {
        return kind == Kind.COMPONENT_PIN;
    }

    @Override
    public int compareTo(NetMember other) {
        int c = kind.compareTo(other.kind);
        if (c != 0) return c;
        c = ReferenceOrder.compare(owner, other.owner);
        if (c != 0) return c;
        return ReferenceOrder.compare(pin, other.pin);
    }

    @Override
    public String toString() {
        return kind == Kind.COMPONENT_PIN ? owner + "." + pin : "sheet " + owner + ":" + pin;
    }
}
