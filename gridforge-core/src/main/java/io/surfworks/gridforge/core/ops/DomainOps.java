package io.surfworks.gridforge.core.ops;

import io.surfworks.gridforge.core.error.ConfigurationException;
import io.surfworks.gridforge.core.error.ShapeException;
import io.surfworks.gridforge.core.field.Field;
import io.surfworks.gridforge.core.field.FieldLayout;
import io.surfworks.gridforge.core.metadata.GridBounds;
import io.surfworks.gridforge.core.metadata.Metadata;
import io.surfworks.gridforge.core.metadata.YOrigin;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cropping and extension of a field's domain to new geographic limits.
 *
 * <p>The resolution never changes: the output grid has
 * {@code (max - min) / pixelsize} cells per axis (truncated) laid out from the
 * new lower limit. Every output cell whose centre falls on a cell of the input
 * grid takes that cell's value; the rest are filled with {@code zerovalue}.
 *
 * <p>Example:
 * <pre>{@code
 * // keep the western half of a 200 x 200 km composite, add 50 km of empty margin to the north
 * GriddedField adjusted = DomainOps.adjust(field, metadata,
 *         CoordinateRange.of(0, 100_000), CoordinateRange.of(0, 250_000));
 * }</pre>
 */
public final class DomainOps {

    private static final Logger LOGGER = Logger.getLogger(DomainOps.class.getName());

    private static final String OPERATION = "adjust-domain";

    private DomainOps() {
        // Utility class
    }

    /**
     * Adjusts the domain of a field/metadata pair.
     *
     * @see #adjust(Field, Metadata, CoordinateRange, CoordinateRange)
     */
    public static GriddedField adjust(GriddedField input, CoordinateRange xlim, CoordinateRange ylim) {
        return adjust(input.field(), input.metadata(), xlim, ylim);
    }

    /**
     * Resizes the domain of a field to new coordinate limits.
     *
     * @param field the input field, any layout (not modified)
     * @param metadata metadata with bounds, pixel sizes and {@code zerovalue}
     * @param xlim new x limits, or null to keep {@code x1, x2}
     * @param ylim new y limits, or null to keep {@code y1, y2}
     * @return the field on the new domain, in the input layout, with updated bounds
     * @throws ConfigurationException if bounds, pixel sizes or {@code zerovalue} are missing
     * @throws ShapeException if the new limits span less than one pixel
     */
    public static GriddedField adjust(Field field, Metadata metadata, CoordinateRange xlim, CoordinateRange ylim) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
        if (xlim == null && ylim == null) {
            return new GriddedField(field.copy(), metadata);
        }

        GridBounds bounds = metadata.requireBounds(OPERATION);
        double xpixelsize = metadata.requireXPixelSize(OPERATION);
        double ypixelsize = metadata.requireYPixelSize(OPERATION);
        double zerovalue = metadata.requireZerovalue(OPERATION);
        if (xlim == null) {
            xlim = CoordinateRange.of(bounds.x1(), bounds.x2());
        }
        if (ylim == null) {
            ylim = CoordinateRange.of(bounds.y1(), bounds.y2());
        }

        Field input = field.promote(FieldLayout.ENSEMBLE_4D);
        int[] inShape = input.shape();
        int oldRows = inShape[2];
        int oldCols = inShape[3];
        int newRows = (int) (ylim.length() / ypixelsize);
        int newCols = (int) (xlim.length() / xpixelsize);
        if (newRows <= 0 || newCols <= 0) {
            throw new ShapeException(OPERATION, "limits x=" + xlim + ", y=" + ylim
                    + " span less than one pixel", new int[]{newRows, newCols});
        }

        // output index + offset = input index
        int colOffset = pixelOffset(xlim.min() - bounds.x1(), xpixelsize, "x");
        int rowOffset = metadata.yorigin() == YOrigin.UPPER
                ? pixelOffset(bounds.y2() - ylim.max(), ypixelsize, "y")
                : pixelOffset(ylim.min() - bounds.y1(), ypixelsize, "y");

        int rowStart = Math.max(0, -rowOffset);
        int rowEnd = Math.min(newRows, oldRows - rowOffset);
        int colStart = Math.max(0, -colOffset);
        int colEnd = Math.min(newCols, oldCols - colOffset);

        int slices = inShape[0] * inShape[1];
        double[] source = input.toDoubleArray();
        double[] target = new double[slices * newRows * newCols];
        Arrays.fill(target, zerovalue);
        for (int s = 0; s < slices; s++) {
            int inBase = s * oldRows * oldCols;
            int outBase = s * newRows * newCols;
            for (int r = rowStart; r < rowEnd; r++) {
                int from = inBase + (r + rowOffset) * oldCols + colStart + colOffset;
                int to = outBase + r * newCols + colStart;
                if (colEnd > colStart) {
                    System.arraycopy(source, from, target, to, colEnd - colStart);
                }
            }
        }

        Field output = Field.of(FieldLayout.ENSEMBLE_4D, target, inShape[0], inShape[1], newRows, newCols)
                .demote(field.layout());
        Metadata updated = metadata.toBuilder()
                .bounds(new GridBounds(xlim.min(), xlim.max(), ylim.min(), ylim.max()))
                .build();

        LOGGER.log(Level.FINE, "Adjusted domain {0} -> {1}: {2} -> {3}",
                new Object[]{bounds, updated.bounds(),
                        Arrays.toString(field.shape()), Arrays.toString(output.shape())});
        return new GriddedField(output, updated);
    }

    private static int pixelOffset(double distance, double pixelsize, String axis) {
        double pixels = distance / pixelsize;
        long rounded = Math.round(pixels);
        if (Math.abs(pixels - rounded) > WindowMath.EPSILON * Math.max(1.0, Math.abs(pixels))) {
            LOGGER.log(Level.WARNING,
                    "New {0} limit is not aligned to the pixel grid ({1} pixels); snapping to {2}",
                    new Object[]{axis, pixels, rounded});
        }
        return Math.toIntExact(rounded);
    }
}
