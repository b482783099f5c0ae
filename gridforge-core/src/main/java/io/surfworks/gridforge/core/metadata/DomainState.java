package io.surfworks.gridforge.core.metadata;

/**
 * Whether a field's spatial domain has been normalized to a square.
 *
 * <p>A field is either {@link Unmodified} or {@link Squared}; only a squared
 * state carries what the inverse operation needs, so
 * {@code SquareDomainOps.inverse(field, metadata, squared)} cannot be called
 * without it.
 */
public sealed interface DomainState permits Unmodified, Squared {

    /**
     * Returns true if the domain was squared and can be restored.
     */
    boolean isSquared();
}
