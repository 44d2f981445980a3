package nl.bytesoflife.circuitsync.geometry;

import nl.bytesoflife.circuitsync.model.Position;

/**
 * Maps points from symbol library coordinates (Y up) onto the sheet (Y down) for a placed
 * instance with rotation and mirror.
 */
public final class PinTransform {

    private PinTransform() {
    }

    /**
     * @param origin   the instance {@code (at x y angle)} position
     * @param rotation counter-clockwise rotation in degrees, a multiple of 90
     * @param mirror   {@code "x"} (flip vertically), {@code "y"} (flip horizontally) or null
     * @param libX     X of the point in the library definition
     * @param libY     Y of the point in the library definition
     */
    public static Position toSheet(Position origin, int rotation, String mirror, double libX, double libY) {
        double x = libX;
        double y = -libY;

        double rx;
        double ry;
        switch (Math.floorMod(rotation, 360)) {
            case 90 -> {
                rx = y;
                ry = -x;
            }
            case 180 -> {
                rx = -x;
                ry = -y;
            }
            case 270 -> {
                rx = -y;
                ry = x;
            }
            default -> {
                rx = x;
                ry = y;
            }
        }

        if ("x".equals(mirror)) {
            ry = -ry;
        } else if ("y".equals(mirror)) {
            rx = -rx;
        }
        return new Position(origin.x() + rx, origin.y() + ry).rounded();
    }
}
