package io.surfworks.gridforge.core.ops;

import io.surfworks.gridforge.core.error.ConfigurationException;
import io.surfworks.gridforge.core.error.DivisibilityException;
import io.surfworks.gridforge.core.error.ShapeException;
import io.surfworks.gridforge.core.field.Field;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Block aggregation of one axis of a field.
 *
 * <p>The axis is split into contiguous, non-overlapping blocks of
 * {@code windowSize} slices; block {@code k} covers input indices
 * {@code [k * windowSize, (k + 1) * windowSize)} and becomes output slice
 * {@code k}. All other axes keep their extent and order.
 *
 * <p>Example:
 * <pre>{@code
 * // (12, 100, 100) five-minute frames -> (4, 100, 100) fifteen-minute means
 * Field hourly = WindowOps.aggregate(frames, 3, 0, ReductionMethod.MEAN);
 * }</pre>
 */
public final class WindowOps {

    private static final Logger LOGGER = Logger.getLogger(WindowOps.class.getName());

    private static final String OPERATION = "aggregate";

    private WindowOps() {
        // Utility class
    }

    /**
     * Aggregates an axis by averaging each block.
     *
     * @see #aggregate(Field, int, int, ReductionMethod)
     */
    public static Field aggregate(Field field, int windowSize, int axis) {
        return aggregate(field, windowSize, axis, ReductionMethod.MEAN);
    }

    /**
     * Aggregates an axis with a reduction given by name ({@code sum}, {@code mean},
     * {@code nansum} or {@code nanmean}, any case).
     *
     * @throws ConfigurationException if the method name is unknown
     * @see #aggregate(Field, int, int, ReductionMethod)
     */
    public static Field aggregate(Field field, int windowSize, int axis, String method) {
        return aggregate(field, windowSize, axis, ReductionMethod.fromName(method));
    }

    /**
     * Aggregates an axis into blocks of {@code windowSize} slices.
     *
     * @param field the input field (not modified)
     * @param windowSize number of consecutive slices per block
     * @param axis the axis to aggregate
     * @param method the reduction applied to each block
     * @return a new field with {@code extent(axis) / windowSize} slices along {@code axis}
     * @throws ShapeException if {@code axis} is not an axis of the field
     * @throws ConfigurationException if {@code windowSize} is not positive
     * @throws DivisibilityException if {@code windowSize} does not divide the axis extent
     */
    public static Field aggregate(Field field, int windowSize, int axis, ReductionMethod method) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(method, "method cannot be null");
        int[] shape = field.shape();
        if (axis < 0 || axis >= shape.length) {
            throw new ShapeException(OPERATION, "axis " + axis + " is out of range", shape);
        }
        if (windowSize <= 0) {
            throw new ConfigurationException(OPERATION, "window size must be positive, got " + windowSize);
        }
        int extent = shape[axis];
        if (extent % windowSize != 0) {
            throw new DivisibilityException(OPERATION, axis, extent, windowSize);
        }

        int blocks = extent / windowSize;
        int inner = 1;
        for (int i = axis + 1; i < shape.length; i++) {
            inner *= shape[i];
        }
        int outer = Math.toIntExact(field.elementCount() / ((long) extent * inner));

        double[] input = field.toDoubleArray();
        double[] output = new double[outer * blocks * inner];
        for (int o = 0; o < outer; o++) {
            int inBase = o * extent * inner;
            int outBase = o * blocks * inner;
            for (int k = 0; k < blocks; k++) {
                int blockStart = inBase + k * windowSize * inner;
                for (int i = 0; i < inner; i++) {
                    output[outBase + k * inner + i] = method.reduce(input, blockStart + i, windowSize, inner);
                }
            }
        }

        int[] outShape = shape.clone();
        outShape[axis] = blocks;
        LOGGER.log(Level.FINE, "{0} axis {1} by {2}: {3} -> {4}",
                new Object[]{method, axis, windowSize, Arrays.toString(shape), Arrays.toString(outShape)});
        return Field.of(field.layout(), output, outShape);
    }
}
