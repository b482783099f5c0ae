package io.surfworks.gridforge.core.error;

/**
 * Thrown when an aggregation window does not split an axis into whole blocks.
 *
 * <p>The exception message names the axis, its extent and the window so the
 * caller can pick a divisible window:
 * <pre>{@code
 * aggregate: window size 4 does not evenly split axis 0 of extent 6
 * }</pre>
 */
public class DivisibilityException extends ConfigurationException {

    private final int axis;
    private final double extent;
    private final double windowSize;

    /**
     * Creates a DivisibilityException for a block count that does not divide the axis.
     *
     * @param operation the operation that was attempted
     * @param axis the axis being aggregated
     * @param extent the axis extent (samples, or physical length for time/space windows)
     * @param windowSize the requested window (same unit as {@code extent})
     */
    public DivisibilityException(String operation, int axis, double extent, double windowSize) {
        super(operation, String.format("window size %s does not evenly split axis %d of extent %s",
                format(windowSize), axis, format(extent)));
        this.axis = axis;
        this.extent = extent;
        this.windowSize = windowSize;
    }

    private static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    public int axis() {
        return axis;
    }

    public double extent() {
        return extent;
    }

    public double windowSize() {
        return windowSize;
    }
}
