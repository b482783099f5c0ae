package io.surfworks.gridforge.core.metadata;

/**
 * Geographic bounding box of a field in projection coordinates.
 *
 * <p>{@code x1 < x2} and {@code y1 < y2}; which row the {@code y1} edge
 * belongs to is decided by the field's {@link YOrigin}.
 */
public record GridBounds(double x1, double x2, double y1, double y2) {

    public double width() {
        return x2 - x1;
    }

    public double height() {
        return y2 - y1;
    }

    public GridBounds withX(double newX1, double newX2) {
        return new GridBounds(newX1, newX2, y1, y2);
    }

    public GridBounds withY(double newY1, double newY2) {
        return new GridBounds(x1, x2, newY1, newY2);
    }
}
