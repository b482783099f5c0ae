package io.surfworks.gridforge.core.ops;

import io.surfworks.gridforge.core.error.ConfigurationException;
import io.surfworks.gridforge.core.error.DivisibilityException;
import io.surfworks.gridforge.core.error.ShapeException;
import io.surfworks.gridforge.core.field.Field;
import io.surfworks.gridforge.core.field.FieldLayout;
import io.surfworks.gridforge.core.metadata.Metadata;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Upscaling of fields onto a coarser grid by block aggregation of both spatial axes.
 *
 * <p>One window length applies to both axes, so the output pixels are square
 * with {@code xpixelsize == ypixelsize == window}. The bounding box does not
 * change. Rates ({@code mm/h}) are averaged and accumulations ({@code mm}) are summed.
 */
public final class SpaceOps {

    private static final Logger LOGGER = Logger.getLogger(SpaceOps.class.getName());

    private static final String OPERATION = "aggregate-space";

    private SpaceOps() {
        // Utility class
    }

    /**
     * Upscales a field/metadata pair.
     *
     * @see #aggregate(Field, Metadata, Double)
     */
    public static GriddedField aggregate(GriddedField input, Double windowMeters) {
        return aggregate(input.field(), input.metadata(), windowMeters);
    }

    /**
     * Upscales a (t, y, x) or (member, t, y, x) field in space.
     *
     * @param field the input field (not modified)
     * @param metadata metadata with {@code unit}, {@code xpixelsize} and {@code ypixelsize}
     * @param windowMeters side length of the output pixels, or null for a plain copy
     * @return the upscaled field and updated metadata
     * @throws ShapeException if the field is not a time series
     * @throws DivisibilityException if the window does not split the y or x extent
     * @throws ConfigurationException if the unit cannot be aggregated, a pixel size is missing,
     *                                or the window is not a positive multiple of the pixel size
     */
    public static GriddedField aggregate(Field field, Metadata metadata, Double windowMeters) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
        if (windowMeters == null) {
            return new GriddedField(field.copy(), metadata);
        }

        FieldLayout layout = field.layout();
        if (!layout.hasTimeAxis()) {
            throw new ShapeException(OPERATION, "the number of dimensions must be 3 or 4", field.shape());
        }
        double ypixelsize = metadata.requireYPixelSize(OPERATION);
        double xpixelsize = metadata.requireXPixelSize(OPERATION);
        if (ypixelsize == windowMeters && xpixelsize == windowMeters) {
            return new GriddedField(field.copy(), metadata);
        }
        if (windowMeters <= 0) {
            throw new ConfigurationException(OPERATION, "window must be positive, got " + windowMeters + " m");
        }

        int yAxis = layout.yAxis();
        int xAxis = layout.xAxis();
        double height = field.extent(yAxis) * ypixelsize;
        double width = field.extent(xAxis) * xpixelsize;
        if (!WindowMath.isMultiple(height, windowMeters)) {
            throw new DivisibilityException(OPERATION, yAxis, height, windowMeters);
        }
        if (!WindowMath.isMultiple(width, windowMeters)) {
            throw new DivisibilityException(OPERATION, xAxis, width, windowMeters);
        }
        if (!WindowMath.isMultiple(windowMeters, ypixelsize) || !WindowMath.isMultiple(windowMeters, xpixelsize)) {
            throw new ConfigurationException(OPERATION, "window of " + windowMeters
                    + " m is not a multiple of the pixel size (" + xpixelsize + ", " + ypixelsize + ")");
        }

        ReductionMethod method = AggregationUnit.forSymbol(OPERATION, metadata.requireUnit(OPERATION)).method();
        Field aggregated = WindowOps.aggregate(field, WindowMath.blockCount(windowMeters, ypixelsize), yAxis, method);
        aggregated = WindowOps.aggregate(aggregated, WindowMath.blockCount(windowMeters, xpixelsize), xAxis, method);

        Metadata updated = metadata.toBuilder()
                .ypixelsize(windowMeters)
                .xpixelsize(windowMeters)
                .build();

        LOGGER.log(Level.FINE, "Upscaled pixels ({0}, {1}) to {2}: {3} -> {4}",
                new Object[]{xpixelsize, ypixelsize, windowMeters,
                        Arrays.toString(field.shape()), Arrays.toString(aggregated.shape())});
        return new GriddedField(aggregated, updated);
    }
}
