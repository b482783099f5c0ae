package io.surfworks.gridforge.core.ops;

import io.surfworks.gridforge.core.error.ConfigurationException;
import io.surfworks.gridforge.core.error.DivisibilityException;
import io.surfworks.gridforge.core.error.ShapeException;
import io.surfworks.gridforge.core.field.Field;
import io.surfworks.gridforge.core.field.FieldLayout;
import io.surfworks.gridforge.core.metadata.Metadata;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Aggregation of a time series of fields into longer time windows.
 *
 * <p>The sampling interval is taken from the first two timestamps, which are
 * assumed evenly spaced. Each output step stands for the block of input steps
 * that ends at it: its timestamp (and lead time) is the block's last one, and
 * {@code accutime} becomes the window length. Rates ({@code mm/h}) are averaged
 * and accumulations ({@code mm}) are summed.
 *
 * <p>Example:
 * <pre>{@code
 * // 12 five-minute rain rates -> 4 fifteen-minute mean rates
 * GriddedField quarterHourly = TimeOps.aggregate(rates, metadata, 15.0);
 * }</pre>
 */
public final class TimeOps {

    private static final Logger LOGGER = Logger.getLogger(TimeOps.class.getName());

    private static final String OPERATION = "aggregate-time";

    private TimeOps() {
        // Utility class
    }

    /**
     * Aggregates a field/metadata pair in time.
     *
     * @see #aggregate(Field, Metadata, Double)
     */
    public static GriddedField aggregate(GriddedField input, Double windowMinutes) {
        return aggregate(input.field(), input.metadata(), windowMinutes);
    }

    /**
     * Aggregates a (t, y, x) or (member, t, y, x) field in time.
     *
     * @param field the input field (not modified)
     * @param metadata metadata with {@code unit} and {@code timestamps}, optionally {@code leadtimes}
     * @param windowMinutes length of the aggregation window in minutes, or null for a plain copy
     * @return the aggregated field and updated metadata
     * @throws ShapeException if the field has no time axis or the timestamps do not match it
     * @throws DivisibilityException if the window does not split the time span
     * @throws ConfigurationException if the unit cannot be aggregated, the window is not a
     *                                positive multiple of the sampling interval, or the
     *                                sampling interval cannot be inferred
     */
    public static GriddedField aggregate(Field field, Metadata metadata, Double windowMinutes) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
        if (windowMinutes == null) {
            return new GriddedField(field.copy(), metadata);
        }

        FieldLayout layout = field.layout();
        if (!layout.hasTimeAxis()) {
            throw new ShapeException(OPERATION, "the number of dimensions must be 3 or 4", field.shape());
        }
        int axis = layout.timeAxis();
        int frames = field.extent(axis);

        List<Instant> timestamps = metadata.requireTimestamps(OPERATION);
        if (timestamps.size() != frames) {
            throw new ShapeException(OPERATION, "the list of timestamps has length " + timestamps.size()
                    + ", but the field contains " + frames + " frames", field.shape());
        }
        if (metadata.hasLeadtimes() && metadata.leadtimes().size() != frames) {
            throw new ShapeException(OPERATION, "the list of leadtimes has length " + metadata.leadtimes().size()
                    + ", but the field contains " + frames + " frames", field.shape());
        }
        if (frames < 2) {
            throw new ConfigurationException(OPERATION,
                    "at least two timestamps are needed to infer the sampling interval");
        }

        double delta = Duration.between(timestamps.get(0), timestamps.get(1)).toMillis() / 60_000.0;
        if (delta <= 0) {
            throw new ConfigurationException(OPERATION,
                    "timestamps must be increasing, got a step of " + delta + " min");
        }
        if (delta == windowMinutes) {
            return new GriddedField(field.copy(), metadata);
        }
        if (windowMinutes <= 0) {
            throw new ConfigurationException(OPERATION, "window must be positive, got " + windowMinutes + " min");
        }
        if (!WindowMath.isMultiple(frames * delta, windowMinutes)) {
            throw new DivisibilityException(OPERATION, axis, frames * delta, windowMinutes);
        }
        if (!WindowMath.isMultiple(windowMinutes, delta)) {
            throw new ConfigurationException(OPERATION, "window of " + windowMinutes
                    + " min is not a multiple of the " + delta + " min sampling interval");
        }

        ReductionMethod method = AggregationUnit.forSymbol(OPERATION, metadata.requireUnit(OPERATION)).method();
        int blockSize = WindowMath.blockCount(windowMinutes, delta);
        Field aggregated = WindowOps.aggregate(field, blockSize, axis, method);

        Metadata.Builder updated = metadata.toBuilder()
                .accutime(windowMinutes)
                .timestamps(lastOfEachBlock(timestamps, blockSize));
        if (metadata.hasLeadtimes()) {
            updated.leadtimes(lastOfEachBlock(metadata.leadtimes(), blockSize));
        }

        LOGGER.log(Level.FINE, "Aggregated {0} frames of {1} min into {2} min windows: {3} -> {4}",
                new Object[]{frames, delta, windowMinutes,
                        Arrays.toString(field.shape()), Arrays.toString(aggregated.shape())});
        return new GriddedField(aggregated, updated.build());
    }

    private static <T> List<T> lastOfEachBlock(List<T> values, int blockSize) {
        List<T> result = new ArrayList<>(values.size() / blockSize);
        for (int i = blockSize - 1; i < values.size(); i += blockSize) {
            result.add(values.get(i));
        }
        return result;
    }
}
