package nl.bytesoflife.circuitsync.source;

import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.model.Position;

import java.util.List;

/**
 * A component as declared by the description. Position and rotation are only set when the
 * description relocates the component explicitly; the token is the identity carried over from a
 * previous sync.
 */
public record ComponentSpec(String reference, String libId, String value, String footprint, String token,
                            Position position, Integer rotation, List<Pin> pins) {

    public ComponentSpec {
        value = value == null ? "" : value;
        footprint = footprint == null ? "" : footprint;
        pins = pins == null ? List.of() : List.copyOf(pins);
    }

    public static ComponentSpec of(String reference, String libId, String value) {
        return new ComponentSpec(reference, libId, value, "", null, null, null, List.of());
    }

    public ComponentSpec withFootprint(String footprint) {
        return new ComponentSpec(reference, libId, value, footprint, token, position, rotation, pins);
    }

    public ComponentSpec withToken(String token) {
        return new ComponentSpec(reference, libId, value, footprint, token, position, rotation, pins);
    }

    public ComponentSpec withValue(String value) {
        return new ComponentSpec(reference, libId, value, footprint, token, position, rotation, pins);
    }

    public ComponentSpec at(Position position, int rotation) {
        return new ComponentSpec(reference, libId, value, footprint, token, position, rotation, pins);
    }

    public ComponentSpec withPins(List<Pin> pins) {
        return new ComponentSpec(reference, libId, value, footprint, token, position, rotation, pins);
    }

    public boolean hasPlacement() {
        return position != null;
    }
}
