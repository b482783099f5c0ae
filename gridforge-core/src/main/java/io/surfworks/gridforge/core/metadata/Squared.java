package io.surfworks.gridforge.core.metadata;

import java.util.Objects;

/**
 * Domain state of a field that was padded or cropped into a square.
 *
 * @param method the method used to square the domain
 * @param originalRows the y extent before squaring
 * @param originalCols the x extent before squaring
 */
public record Squared(SquareMethod method, int originalRows, int originalCols) implements DomainState {

    public Squared {
        Objects.requireNonNull(method, "method cannot be null");
        if (originalRows <= 0 || originalCols <= 0) {
            throw new IllegalArgumentException(
                "original domain must be positive, got (" + originalRows + ", " + originalCols + ")");
        }
    }

    @Override
    public boolean isSquared() {
        return true;
    }
}
