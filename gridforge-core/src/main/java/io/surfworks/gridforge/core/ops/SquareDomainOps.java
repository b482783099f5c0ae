package io.surfworks.gridforge.core.ops;

import io.surfworks.gridforge.core.error.ConfigurationException;
import io.surfworks.gridforge.core.error.ShapeException;
import io.surfworks.gridforge.core.field.Field;
import io.surfworks.gridforge.core.field.FieldLayout;
import io.surfworks.gridforge.core.metadata.GridBounds;
import io.surfworks.gridforge.core.metadata.Metadata;
import io.surfworks.gridforge.core.metadata.SquareMethod;
import io.surfworks.gridforge.core.metadata.Squared;
import io.surfworks.gridforge.core.metadata.Unmodified;
import io.surfworks.gridforge.core.metadata.YOrigin;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Normalization of rectangular domains into square ones, and its inverse.
 *
 * <p>Squaring changes exactly one spatial axis. {@link SquareMethod#PAD} grows the
 * shorter axis to the longer one, filling with the field's minimum (NaN ignored);
 * {@link SquareMethod#CROP} shrinks the longer axis to the shorter one. The band
 * at the start of the axis is {@code floor(diff / 2)} pixels wide and the band at
 * the end takes the remainder. Bounds move by each band's width, so they stay
 * consistent with the shape. The original extent and the method are recorded as
 * a {@link Squared} domain state.
 *
 * <p>The inverse undoes a pad by cropping the same bands away, which restores the
 * original values exactly. It undoes a crop by padding the same bands back with
 * zeros: the shape is restored but the cropped values are not.
 *
 * <p>Example:
 * <pre>{@code
 * GriddedField square = SquareDomainOps.square(field, metadata, SquareMethod.PAD);
 * GriddedField forecast = nowcast(square);
 * GriddedField restored = SquareDomainOps.inverse(forecast.field(), forecast.metadata());
 * }</pre>
 */
public final class SquareDomainOps {

    private static final Logger LOGGER = Logger.getLogger(SquareDomainOps.class.getName());

    private static final String OPERATION = "square-domain";
    private static final String INVERSE_OPERATION = "square-domain-inverse";

    private static final int Y = 2;
    private static final int X = 3;

    private SquareDomainOps() {
        // Utility class
    }

    /**
     * Squares or restores a domain, selecting the method by name.
     *
     * @param method {@code "pad"} or {@code "crop"}; ignored when {@code inverse} is true,
     *               since the recorded method is used instead
     * @param inverse true to restore a previously squared domain
     * @throws ConfigurationException if the method name is unknown, or inverse is requested
     *                                for a field that was never squared
     */
    public static GriddedField apply(Field field, Metadata metadata, String method, boolean inverse) {
        if (inverse) {
            return inverse(field, metadata);
        }
        return square(field, metadata, SquareMethod.fromKey(method));
    }

    public static GriddedField square(GriddedField input, SquareMethod method) {
        return square(input.field(), input.metadata(), method);
    }

    /**
     * Pads or crops a field into a square domain.
     *
     * @param field the input field, any layout (not modified)
     * @param metadata metadata; bounds are updated when present, which then requires pixel sizes
     * @param method how to square the domain
     * @return the square field in the input layout, with a {@link Squared} domain state;
     *         an already square field is returned as a copy with unchanged metadata
     */
    public static GriddedField square(Field field, Metadata metadata, SquareMethod method) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
        Objects.requireNonNull(method, "method cannot be null");

        Field input = field.promote(FieldLayout.ENSEMBLE_4D);
        int rows = input.extent(Y);
        int cols = input.extent(X);
        if (rows == cols) {
            return new GriddedField(field.copy(), metadata);
        }

        int newDim = method == SquareMethod.PAD ? Math.max(rows, cols) : Math.min(rows, cols);
        int axis = rows != newDim ? Y : X;
        int diff = Math.abs(newDim - input.extent(axis));
        int lead = diff / 2;
        int trail = diff - lead;

        Field output;
        GridBounds bounds;
        if (method == SquareMethod.PAD) {
            output = place(input, newDim, newDim, axis == Y ? lead : 0, axis == X ? lead : 0, input.nanMin());
            bounds = moveEdges(metadata, OPERATION, axis, lead, trail);
        } else {
            output = place(input, newDim, newDim, axis == Y ? -lead : 0, axis == X ? -lead : 0, 0.0);
            bounds = moveEdges(metadata, OPERATION, axis, -lead, -trail);
        }

        Metadata updated = metadata.toBuilder()
                .bounds(bounds)
                .domainState(new Squared(method, rows, cols))
                .build();
        Field result = output.demote(field.layout());

        LOGGER.log(Level.FINE, "Squared domain by {0}: {1} -> {2}",
                new Object[]{method.key(), Arrays.toString(field.shape()), Arrays.toString(result.shape())});
        return new GriddedField(result, updated);
    }

    public static GriddedField inverse(GriddedField input) {
        return inverse(input.field(), input.metadata());
    }

    /**
     * Restores the domain recorded in the metadata's {@link Squared} state.
     *
     * @throws ConfigurationException if the metadata carries no squared domain state
     * @see #inverse(Field, Metadata, Squared)
     */
    public static GriddedField inverse(Field field, Metadata metadata) {
        Objects.requireNonNull(metadata, "metadata cannot be null");
        if (!(metadata.domainState() instanceof Squared squared)) {
            throw new ConfigurationException(INVERSE_OPERATION,
                    "metadata records no squared domain ('orig_domain' and 'square_method')");
        }
        return inverse(field, metadata, squared);
    }

    /**
     * Restores a squared field to its original rectangular extent.
     *
     * <p>The squared state is consumed: the returned metadata is {@link Unmodified}.
     *
     * @param field the squared field, any layout (not modified)
     * @param metadata metadata; bounds are updated when present
     * @param squared the state recorded when the field was squared
     * @return the field with its original spatial extent
     * @throws ShapeException if both spatial axes differ from the recorded extent, or the
     *                        differing axis moved in the wrong direction for the method
     */
    public static GriddedField inverse(Field field, Metadata metadata, Squared squared) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
        Objects.requireNonNull(squared, "squared cannot be null");

        Field input = field.promote(FieldLayout.ENSEMBLE_4D);
        int rows = input.extent(Y);
        int cols = input.extent(X);
        int origRows = squared.originalRows();
        int origCols = squared.originalCols();
        Metadata.Builder updated = metadata.toBuilder().domainState(Unmodified.INSTANCE);

        if (rows == origRows && cols == origCols) {
            return new GriddedField(field.copy(), updated.build());
        }
        if (rows != origRows && cols != origCols) {
            throw new ShapeException(INVERSE_OPERATION, "both spatial axes differ from the original domain ("
                    + origRows + ", " + origCols + ")", field.shape());
        }

        int axis = rows != origRows ? Y : X;
        int current = axis == Y ? rows : cols;
        int original = axis == Y ? origRows : origCols;
        boolean wasPadded = squared.method() == SquareMethod.PAD;
        if (wasPadded ? current < original : current > original) {
            throw new ShapeException(INVERSE_OPERATION, "cannot undo " + squared.method().key()
                    + " of axis " + axis + " from extent " + original, field.shape());
        }
        int diff = Math.abs(current - original);
        int lead = diff / 2;
        int trail = diff - lead;
        int shift = wasPadded ? -lead : lead;

        Field output = place(input, axis == Y ? origRows : rows, axis == X ? origCols : cols,
                axis == Y ? shift : 0, axis == X ? shift : 0, 0.0);
        GridBounds bounds = wasPadded
                ? moveEdges(metadata, INVERSE_OPERATION, axis, -lead, -trail)
                : moveEdges(metadata, INVERSE_OPERATION, axis, lead, trail);
        Field result = output.demote(field.layout());

        LOGGER.log(Level.FINE, "Restored {0} domain: {1} -> {2}",
                new Object[]{squared.method().key(), Arrays.toString(field.shape()), Arrays.toString(result.shape())});
        return new GriddedField(result, updated.bounds(bounds).build());
    }

    // ==================== Internal Helpers ====================

    /**
     * Copies a 4-D field onto a new (rows, cols) grid; output cell (r, c) takes input
     * cell (r - rowShift, c - colShift) when it exists, otherwise {@code fill}.
     */
    private static Field place(Field input, int rows, int cols, int rowShift, int colShift, double fill) {
        int[] shape = input.shape();
        int inRows = shape[Y];
        int inCols = shape[X];
        int slices = shape[0] * shape[1];
        double[] source = input.toDoubleArray();
        double[] target = new double[slices * rows * cols];
        Arrays.fill(target, fill);

        int rowStart = Math.max(0, rowShift);
        int rowEnd = Math.min(rows, inRows + rowShift);
        int colStart = Math.max(0, colShift);
        int colEnd = Math.min(cols, inCols + colShift);
        for (int s = 0; s < slices; s++) {
            for (int r = rowStart; r < rowEnd; r++) {
                int from = (s * inRows + r - rowShift) * inCols + colStart - colShift;
                int to = (s * rows + r) * cols + colStart;
                System.arraycopy(source, from, target, to, colEnd - colStart);
            }
        }
        return Field.of(FieldLayout.ENSEMBLE_4D, target, shape[0], shape[1], rows, cols);
    }

    /**
     * Moves the bounds outward by {@code lead} pixels on the row/column-0 side of
     * {@code axis} and by {@code trail} pixels on the far side (negative moves inward).
     */
    private static GridBounds moveEdges(Metadata metadata, String operation, int axis, int lead, int trail) {
        GridBounds bounds = metadata.bounds();
        if (bounds == null) {
            return null;
        }
        if (axis == X) {
            double xpixelsize = metadata.requireXPixelSize(operation);
            return bounds.withX(bounds.x1() - lead * xpixelsize, bounds.x2() + trail * xpixelsize);
        }
        double ypixelsize = metadata.requireYPixelSize(operation);
        if (metadata.yorigin() == YOrigin.UPPER) {
            return bounds.withY(bounds.y1() - trail * ypixelsize, bounds.y2() + lead * ypixelsize);
        }
        return bounds.withY(bounds.y1() - lead * ypixelsize, bounds.y2() + trail * ypixelsize);
    }
}
