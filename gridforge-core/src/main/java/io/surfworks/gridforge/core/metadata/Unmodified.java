package io.surfworks.gridforge.core.metadata;

/**
 * Domain state of a field whose extent was never squared.
 */
public final class Unmodified implements DomainState {

    /** Singleton instance. */
    public static final Unmodified INSTANCE = new Unmodified();

    private Unmodified() {
    }

    @Override
    public boolean isSquared() {
        return false;
    }

    @Override
    public String toString() {
        return "Unmodified";
    }
}
