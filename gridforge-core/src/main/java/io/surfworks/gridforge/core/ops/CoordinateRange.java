package io.surfworks.gridforge.core.ops;

/**
 * A pair of coordinate limits along one axis. The two ends may be given in
 * either order.
 */
public record CoordinateRange(double start, double end) {

    public static CoordinateRange of(double start, double end) {
        return new CoordinateRange(start, end);
    }

    public double min() {
        return Math.min(start, end);
    }

    public double max() {
        return Math.max(start, end);
    }

    public double length() {
        return max() - min();
    }
}
