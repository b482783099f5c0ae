package io.surfworks.gridforge.core.error;

/**
 * Thrown when an operation is invoked with arguments or metadata it cannot act on:
 * an unknown unit or method name, a missing metadata key, a non-positive window,
 * or an inverse square-domain call on a field that was never squared.
 *
 * <p>Shape and divisibility failures are more specific kinds of configuration
 * error and are reported through {@link ShapeException} and
 * {@link DivisibilityException}.
 */
public class ConfigurationException extends GridException {

    public ConfigurationException(String operation, String message) {
        super(operation, message);
    }

    public ConfigurationException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }

    /**
     * Creates the exception raised when a required metadata attribute is absent.
     *
     * @param operation the operation that needed the attribute
     * @param key the metadata dictionary key of the attribute
     * @return the exception to throw
     */
    public static ConfigurationException missingKey(String operation, String key) {
        return new ConfigurationException(operation, "metadata is missing '" + key + "'");
    }
}
