package io.surfworks.gridforge.core.field;

import java.util.Arrays;

/**
 * Field specification: shape, layout, and computed row-major strides.
 * Immutable metadata describing how a field's values are laid out.
 */
public record FieldSpec(
    int[] shape,
    FieldLayout layout,
    long[] strides
) {
    public FieldSpec {
        shape = shape.clone();
        strides = strides.clone();
    }

    /**
     * Create a FieldSpec whose layout is derived from the rank of {@code shape}.
     */
    public static FieldSpec of(int... shape) {
        return of(FieldLayout.forShape(shape), shape);
    }

    /**
     * Create a FieldSpec with an explicit layout.
     *
     * @throws IllegalArgumentException if the layout rank differs from the shape rank
     *                                  or any extent is not positive
     */
    public static FieldSpec of(FieldLayout layout, int... shape) {
        if (layout.rank() != shape.length) {
            throw new IllegalArgumentException(
                "Layout " + layout + " needs " + layout.rank() + " dimensions, got " + Arrays.toString(shape));
        }
        for (int dim : shape) {
            if (dim <= 0) {
                throw new IllegalArgumentException("All extents must be positive, got " + Arrays.toString(shape));
            }
        }
        return new FieldSpec(shape, layout, computeRowMajorStrides(shape));
    }

    /**
     * Extents of every axis; the returned array is a copy.
     */
    @Override
    public int[] shape() {
        return shape.clone();
    }

    /**
     * Row-major strides in elements; the returned array is a copy.
     */
    @Override
    public long[] strides() {
        return strides.clone();
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return shape.length;
    }

    /**
     * Extent along one axis.
     */
    public int extent(int axis) {
        return shape[axis];
    }

    /**
     * Total number of elements.
     */
    public long elementCount() {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Compute flat index from multi-dimensional indices.
     */
    public long flatIndex(int... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + indices.length);
        }
        long idx = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " out of bounds for dimension " + i + " with size " + shape[i]);
            }
            idx += indices[i] * strides[i];
        }
        return idx;
    }

    private static long[] computeRowMajorStrides(int[] shape) {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldSpec that)) return false;
        return Arrays.equals(shape, that.shape) && layout == that.layout;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + layout.hashCode();
    }

    @Override
    public String toString() {
        return "FieldSpec[shape=" + Arrays.toString(shape) +
               ", layout=" + layout + "]";
    }
}
