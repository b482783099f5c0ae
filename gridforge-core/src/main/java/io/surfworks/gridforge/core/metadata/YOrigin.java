package io.surfworks.gridforge.core.metadata;

import java.util.Locale;

/**
 * Which geographic edge the first row of a field lies on.
 */
public enum YOrigin {

    /** Row 0 is the northern edge ({@code y2}); the usual radar composite orientation. */
    UPPER,

    /** Row 0 is the southern edge ({@code y1}). */
    LOWER;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static YOrigin fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
