package nl.bytesoflife.circuitsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One placed symbol instance. Multi-unit packages have one entry per unit, all sharing the
 * reference designator.
 */
public class Component {

    private int id = -1;
    private final String reference;
    private final int unit;
    private String value = "";
    private String footprint = "";
    private String libId = "";
    private Position position;
    private int rotation;
    private boolean mirrored;
    private boolean explicitPlacement;
    private String token;
    private String sheetPath = "/";
    private final List<Pin> pins = new ArrayList<>();

    public Component(String reference) {
        this(reference, 1);
    }

    public Component(String reference, int unit) {
        this.reference = reference;
        this.unit = unit;
    }

    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public String getReference() {
        return reference;
    }

    public int getUnit() {
        return unit;
    }

    /**
     * Reference and unit, unique within a sheet.
     */
    public String getKey() {
        return unit == 1 ? reference : reference + "#" + unit;
    }

    public String getValue() {
        return value;
    }

    public Component setValue(String value) {
        this.value = value == null ? "" : value;
        return this;
    }

    public String getFootprint() {
        return footprint;
    }

    public Component setFootprint(String footprint) {
        this.footprint = footprint == null ? "" : footprint;
        return this;
    }

    public String getLibId() {
        return libId;
    }

    public Component setLibId(String libId) {
        this.libId = libId == null ? "" : libId;
        return this;
    }

    public Position getPosition() {
        return position;
    }

    public Component setPosition(Position position) {
        this.position = position;
        return this;
    }

    public int getRotation() {
        return rotation;
    }

    public Component setRotation(int rotation) {
        this.rotation = Math.floorMod(rotation, 360);
        return this;
    }

    public boolean isMirrored() {
        return mirrored;
    }

    public Component setMirrored(boolean mirrored) {
        this.mirrored = mirrored;
        return this;
    }

    public boolean isExplicitPlacement() {
        return explicitPlacement;
    }

    public Component setExplicitPlacement(boolean explicitPlacement) {
        this.explicitPlacement = explicitPlacement;
        return this;
    }

    public String getToken() {
        return token;
    }

    public Component setToken(String token) {
        this.token = token;
        return this;
    }

    public String getSheetPath() {
        return sheetPath;
    }

    public Component setSheetPath(String sheetPath) {
        this.sheetPath = sheetPath;
        return this;
    }

    public List<Pin> getPins() {
        return Collections.unmodifiableList(pins);
    }

    public Component addPin(Pin pin) {
        pins.add(pin);
        return this;
    }

    public Optional<Pin> findPin(String number) {
        for (Pin pin : pins) {
            if (pin.number().equals(number)) {
                return Optional.of(pin);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Component{" + sheetPath + getKey() + ", value='" + value + "', lib='" + libId + "'"
                + (token != null ? ", token=" + token : "") + "}";
    }
}
