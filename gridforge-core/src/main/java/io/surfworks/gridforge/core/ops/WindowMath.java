package io.surfworks.gridforge.core.ops;

/**
 * Whole-number checks for windows given in physical units (minutes, meters).
 */
final class WindowMath {

    /** Relative tolerance when deciding whether a ratio of doubles is whole. */
    static final double EPSILON = 1e-9;

    private WindowMath() {
        // Utility class
    }

    /**
     * Returns true if {@code value} is a whole multiple of {@code step}.
     */
    static boolean isMultiple(double value, double step) {
        double ratio = value / step;
        return Math.abs(ratio - Math.rint(ratio)) <= EPSILON * Math.max(1.0, Math.abs(ratio));
    }

    /**
     * Number of whole {@code step}s in {@code value}; only meaningful after {@link #isMultiple}.
     */
    static int blockCount(double value, double step) {
        return (int) Math.rint(value / step);
    }
}
