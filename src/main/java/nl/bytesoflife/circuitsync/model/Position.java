package nl.bytesoflife.circuitsync.model;

/**
 * A point on a schematic sheet in millimetres, Y pointing down.
 */
public record Position(double x, double y) {

    public static final double GRID = 1.27;
    private static final double EPSILON = 1e-4;

    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    public double distanceTo(Position other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public boolean sameAs(Position other) {
        return Math.abs(x - other.x) < EPSILON && Math.abs(y - other.y) < EPSILON;
    }

    /**
     * Rounded to the four decimals KiCad writes, so computed points compare equal to points read
     * back from a file.
     */
    public Position rounded() {
        return new Position(Math.round(x * 10000) / 10000.0, Math.round(y * 10000) / 10000.0);
    }

    public Position snapToGrid() {
        return new Position(Math.round(x / GRID) * GRID, Math.round(y / GRID) * GRID).rounded();
    }

    /**
     * Key that is equal for points KiCad treats as coincident.
     */
    public String key() {
        return Math.round(x * 1000) + ":" + Math.round(y * 1000);
    }
}
