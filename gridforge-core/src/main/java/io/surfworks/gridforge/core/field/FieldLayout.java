package io.surfworks.gridforge.core.field;

import io.surfworks.gridforge.core.error.ShapeException;

/**
 * Axis roles of a field, looked up by layout instead of inferred from rank at
 * each call site.
 *
 * <p>The last two axes are always the spatial (y, x) axes:
 * <ul>
 *   <li>{@link #PLAIN_2D} - a single raster (y, x)</li>
 *   <li>{@link #TIME_SERIES_3D} - a time series (t, y, x)</li>
 *   <li>{@link #ENSEMBLE_4D} - an ensemble time series (member, t, y, x)</li>
 * </ul>
 */
public enum FieldLayout {

    PLAIN_2D(2, -1, -1),
    TIME_SERIES_3D(3, 0, -1),
    ENSEMBLE_4D(4, 1, 0);

    private final int rank;
    private final int timeAxis;
    private final int memberAxis;

    FieldLayout(int rank, int timeAxis, int memberAxis) {
        this.rank = rank;
        this.timeAxis = timeAxis;
        this.memberAxis = memberAxis;
    }

    /**
     * Maps an array rank to its layout.
     *
     * @param shape the array shape
     * @return the layout for {@code shape.length}
     * @throws ShapeException if the rank is not 2, 3 or 4
     */
    public static FieldLayout forShape(int... shape) {
        return switch (shape.length) {
            case 2 -> PLAIN_2D;
            case 3 -> TIME_SERIES_3D;
            case 4 -> ENSEMBLE_4D;
            default -> throw new ShapeException("layout",
                    "the number of dimensions must be 2, 3 or 4, got " + shape.length, shape);
        };
    }

    public int rank() {
        return rank;
    }

    /**
     * Returns the index of the time axis.
     *
     * @return the time axis, or -1 for {@link #PLAIN_2D}
     */
    public int timeAxis() {
        return timeAxis;
    }

    /**
     * Returns the index of the ensemble-member axis.
     *
     * @return the member axis, or -1 unless {@link #ENSEMBLE_4D}
     */
    public int memberAxis() {
        return memberAxis;
    }

    public int yAxis() {
        return rank - 2;
    }

    public int xAxis() {
        return rank - 1;
    }

    public boolean hasTimeAxis() {
        return timeAxis >= 0;
    }
}
