package io.surfworks.gridforge.core.error;

import java.util.Arrays;

/**
 * Thrown when a field's shape does not fit the operation: rank outside the
 * supported set, an axis out of range, a timestamp list whose length differs
 * from the time axis, or a squared field that cannot be mapped back to its
 * recorded original extent.
 */
public class ShapeException extends ConfigurationException {

    private final int[] shape;

    /**
     * Creates a ShapeException.
     *
     * @param operation the operation that rejected the shape
     * @param message the exception message
     * @param shape the offending shape (copied)
     */
    public ShapeException(String operation, String message, int[] shape) {
        super(operation, message + " (shape " + Arrays.toString(shape) + ")");
        this.shape = shape.clone();
    }

    /**
     * Returns the shape that was rejected.
     *
     * @return a copy of the offending shape
     */
    public int[] shape() {
        return shape.clone();
    }
}
