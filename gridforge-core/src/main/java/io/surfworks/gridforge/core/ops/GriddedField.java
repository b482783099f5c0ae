package io.surfworks.gridforge.core.ops;

import io.surfworks.gridforge.core.field.Field;
import io.surfworks.gridforge.core.metadata.Metadata;

import java.util.Objects;

/**
 * A field together with the metadata describing it; the value every
 * reshaping operation takes and returns.
 */
public record GriddedField(Field field, Metadata metadata) {

    public GriddedField {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
    }
}
