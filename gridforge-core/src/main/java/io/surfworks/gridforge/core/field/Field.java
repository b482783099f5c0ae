package io.surfworks.gridforge.core.field;

import io.surfworks.gridforge.core.error.ShapeException;

import java.util.Arrays;

/**
 * An immutable 2, 3 or 4 dimensional grid of double values in row-major order.
 *
 * <p>The last two axes are always (y, x); the leading axes are described by the
 * field's {@link FieldLayout}. Every factory copies its input and every bulk
 * accessor returns a copy, so a Field can be shared freely between threads and
 * operations never observe each other's results being modified.
 */
public final class Field {
    private final FieldSpec spec;
    private final double[] data;

    private Field(FieldSpec spec, double[] data) {
        this.spec = spec;
        this.data = data;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a zero-filled field; the layout follows from the rank.
     */
    public static Field zeros(int... shape) {
        return full(0.0, shape);
    }

    /**
     * Create a field filled with a constant value.
     */
    public static Field full(double value, int... shape) {
        FieldSpec spec = FieldSpec.of(shape);
        double[] data = new double[Math.toIntExact(spec.elementCount())];
        Arrays.fill(data, value);
        return new Field(spec, data);
    }

    /**
     * Create a field from a flattened row-major array; the layout follows from the rank.
     */
    public static Field of(double[] data, int... shape) {
        return of(FieldSpec.of(shape), data);
    }

    /**
     * Create a field from a flattened row-major array with an explicit layout.
     */
    public static Field of(FieldLayout layout, double[] data, int... shape) {
        return of(FieldSpec.of(layout, shape), data);
    }

    private static Field of(FieldSpec spec, double[] data) {
        if (data.length != spec.elementCount()) {
            throw new IllegalArgumentException(
                "Data length " + data.length + " doesn't match shape " + Arrays.toString(spec.shape()) +
                " (expected " + spec.elementCount() + " elements)");
        }
        return new Field(spec, data.clone());
    }

    // ==================== Accessors ====================

    public FieldSpec spec() {
        return spec;
    }

    public int[] shape() {
        return spec.shape();
    }

    public int rank() {
        return spec.rank();
    }

    public FieldLayout layout() {
        return spec.layout();
    }

    public int extent(int axis) {
        return spec.extent(axis);
    }

    public long elementCount() {
        return spec.elementCount();
    }

    // ==================== Element Access ====================

    /**
     * Get element at multi-dimensional indices.
     */
    public double get(int... indices) {
        return data[(int) spec.flatIndex(indices)];
    }

    /**
     * Get element at flat index.
     */
    public double getFlat(long index) {
        return data[Math.toIntExact(index)];
    }

    /**
     * Copy field data to a double array.
     */
    public double[] toDoubleArray() {
        return data.clone();
    }

    /**
     * Smallest value in the field, skipping NaN.
     *
     * @return the minimum, or NaN if every value is NaN
     */
    public double nanMin() {
        double min = Double.NaN;
        for (double v : data) {
            if (!Double.isNaN(v) && (Double.isNaN(min) || v < min)) {
                min = v;
            }
        }
        return min;
    }

    // ==================== Shape Operations ====================

    /**
     * Create an independent copy of this field.
     */
    public Field copy() {
        return new Field(spec, data.clone());
    }

    /**
     * Create a field with the same values and a new shape (must have same element count).
     * The layout of the result follows from the new rank.
     */
    public Field reshape(int... newShape) {
        FieldSpec newSpec = FieldSpec.of(newShape);
        if (newSpec.elementCount() != spec.elementCount()) {
            throw new IllegalArgumentException(
                "Cannot reshape from " + spec.elementCount() + " to " + newSpec.elementCount() + " elements");
        }
        return new Field(newSpec, data.clone());
    }

    /**
     * Prepend singleton axes until the field has the target layout.
     * A (y, x) raster promoted to {@link FieldLayout#ENSEMBLE_4D} becomes (1, 1, y, x).
     *
     * @throws ShapeException if the target layout has a lower rank than this field
     */
    public Field promote(FieldLayout target) {
        int added = target.rank() - rank();
        if (added < 0) {
            throw new ShapeException("promote",
                "cannot promote a " + layout() + " field to " + target, spec.shape());
        }
        int[] newShape = new int[target.rank()];
        Arrays.fill(newShape, 0, added, 1);
        System.arraycopy(spec.shape(), 0, newShape, added, rank());
        return new Field(FieldSpec.of(target, newShape), data.clone());
    }

    /**
     * Drop leading singleton axes until the field has the target layout.
     * This is the inverse of {@link #promote(FieldLayout)}.
     *
     * @throws ShapeException if a dropped axis is not a singleton
     */
    public Field demote(FieldLayout target) {
        int removed = rank() - target.rank();
        if (removed < 0) {
            throw new ShapeException("demote",
                "cannot demote a " + layout() + " field to " + target, spec.shape());
        }
        for (int axis = 0; axis < removed; axis++) {
            if (spec.extent(axis) != 1) {
                throw new ShapeException("demote",
                    "axis " + axis + " is not a singleton and cannot be dropped", spec.shape());
            }
        }
        int[] newShape = Arrays.copyOfRange(spec.shape(), removed, rank());
        return new Field(FieldSpec.of(target, newShape), data.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field that)) return false;
        return spec.equals(that.spec) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * spec.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Field[shape=").append(Arrays.toString(spec.shape()));
        sb.append(", layout=").append(spec.layout());
        sb.append(", elements=").append(elementCount());
        if (elementCount() <= 10) {
            sb.append(", data=").append(Arrays.toString(data));
        }
        sb.append("]");
        return sb.toString();
    }
}
