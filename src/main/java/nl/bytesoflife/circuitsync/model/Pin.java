package nl.bytesoflife.circuitsync.model;

/**
 * A pin of a component. Unit 0 means the pin is shared by all units of a multi-unit package.
 */
public record Pin(String number, String name, PinType type, int unit) {

    public Pin(String number, String name, PinType type) {
        this(number, name, type, 0);
    }

    public boolean belongsTo(int componentUnit) {
        return unit == 0 || unit == componentUnit;
    }
}
