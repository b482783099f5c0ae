package io.surfworks.gridforge.core.error;

/**
 * Base class for every failure raised while reshaping or aggregating a gridded field.
 *
 * <p>All grid exceptions are unchecked and raised synchronously at the point of
 * detection. No operation produces partial output: when one of these is thrown,
 * no result field or metadata has been returned.
 *
 * @see ConfigurationException
 * @see ShapeException
 * @see DivisibilityException
 */
public class GridException extends RuntimeException {

    private final String operation;

    /**
     * Creates a GridException for the specified operation.
     *
     * @param operation the operation that failed (e.g. "aggregate", "square")
     * @param message the exception message
     */
    public GridException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    /**
     * Creates a GridException wrapping the failure that caused it.
     *
     * @param operation the operation that failed
     * @param message the exception message
     * @param cause the underlying failure
     */
    public GridException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    /**
     * Returns the operation that failed.
     *
     * @return the operation name
     */
    public String operation() {
        return operation;
    }
}
