package io.surfworks.gridforge.core.metadata;

import io.surfworks.gridforge.core.error.ConfigurationException;

import java.util.Locale;

/**
 * How a rectangular domain is made square.
 */
public enum SquareMethod {

    /** Add equal bands to both ends of the shorter spatial axis. */
    PAD,

    /** Remove equal bands from both ends of the longer spatial axis (loses data). */
    CROP;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a method name such as {@code "pad"} or {@code "crop"}.
     *
     * @throws ConfigurationException for any other name
     */
    public static SquareMethod fromKey(String key) {
        if (key != null) {
            for (SquareMethod method : values()) {
                if (method.key().equalsIgnoreCase(key)) {
                    return method;
                }
            }
        }
        throw new ConfigurationException("square", "unknown square method '" + key + "', expected pad or crop");
    }
}
