package io.surfworks.gridforge.core.metadata;

import io.surfworks.gridforge.core.error.ConfigurationException;

import java.time.Instant;
import java.util.List;

/**
 * Physical and geometric description of a field.
 *
 * <p>Metadata is a value object: every operation returns a new record and never
 * changes the one it was given. Optional attributes are {@code null} when absent;
 * operations that need one call the matching {@code require*} accessor, which
 * raises a {@link ConfigurationException} naming the missing key.
 *
 * <p>Example:
 * <pre>{@code
 * Metadata metadata = Metadata.builder()
 *     .unit("mm/h")
 *     .timestamps(timestamps)
 *     .pixelSize(1000.0, 1000.0)
 *     .bounds(new GridBounds(0, 700_000, 0, 765_000))
 *     .zerovalue(0.0)
 *     .build();
 * }</pre>
 *
 * @param unit physical unit symbol, e.g. {@code "mm/h"}, {@code "mm"} or {@code "dBZ"}
 * @param transform value transform applied by the unit-transform collaborator, or null
 * @param threshold rain/no-rain threshold in the current unit, or null
 * @param zerovalue value used for "no data" and background cells, or null
 * @param accutime accumulation period of each time step in minutes, or null
 * @param timestamps one timestamp per time step; empty for a single raster
 * @param leadtimes lead time of each time step in minutes, or null when absent
 * @param xpixelsize size of one grid cell along x, or null
 * @param ypixelsize size of one grid cell along y, or null
 * @param bounds bounding box of the grid, or null
 * @param yorigin which edge row 0 lies on
 * @param projection projection definition string, passed through untouched
 * @param domainState whether the domain has been squared
 */
public record Metadata(
    String unit,
    String transform,
    Double threshold,
    Double zerovalue,
    Double accutime,
    List<Instant> timestamps,
    List<Double> leadtimes,
    Double xpixelsize,
    Double ypixelsize,
    GridBounds bounds,
    YOrigin yorigin,
    String projection,
    DomainState domainState
) {
    public Metadata {
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
        leadtimes = leadtimes == null ? null : List.copyOf(leadtimes);
        yorigin = yorigin == null ? YOrigin.UPPER : yorigin;
        domainState = domainState == null ? Unmodified.INSTANCE : domainState;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public boolean hasLeadtimes() {
        return leadtimes != null;
    }

    // ==================== Required Attributes ====================

    public String requireUnit(String operation) {
        if (unit == null) {
            throw ConfigurationException.missingKey(operation, "unit");
        }
        return unit;
    }

    public double requireZerovalue(String operation) {
        if (zerovalue == null) {
            throw ConfigurationException.missingKey(operation, "zerovalue");
        }
        return zerovalue;
    }

    public double requireXPixelSize(String operation) {
        if (xpixelsize == null) {
            throw ConfigurationException.missingKey(operation, "xpixelsize");
        }
        return xpixelsize;
    }

    public double requireYPixelSize(String operation) {
        if (ypixelsize == null) {
            throw ConfigurationException.missingKey(operation, "ypixelsize");
        }
        return ypixelsize;
    }

    public GridBounds requireBounds(String operation) {
        if (bounds == null) {
            throw ConfigurationException.missingKey(operation, "x1, x2, y1, y2");
        }
        return bounds;
    }

    public List<Instant> requireTimestamps(String operation) {
        if (timestamps.isEmpty()) {
            throw ConfigurationException.missingKey(operation, "timestamps");
        }
        return timestamps;
    }

    /**
     * Builder for Metadata.
     */
    public static class Builder {
        private String unit;
        private String transform;
        private Double threshold;
        private Double zerovalue;
        private Double accutime;
        private List<Instant> timestamps = List.of();
        private List<Double> leadtimes;
        private Double xpixelsize;
        private Double ypixelsize;
        private GridBounds bounds;
        private YOrigin yorigin = YOrigin.UPPER;
        private String projection;
        private DomainState domainState = Unmodified.INSTANCE;

        private Builder() {}

        private Builder(Metadata source) {
            this.unit = source.unit;
            this.transform = source.transform;
            this.threshold = source.threshold;
            this.zerovalue = source.zerovalue;
            this.accutime = source.accutime;
            this.timestamps = source.timestamps;
            this.leadtimes = source.leadtimes;
            this.xpixelsize = source.xpixelsize;
            this.ypixelsize = source.ypixelsize;
            this.bounds = source.bounds;
            this.yorigin = source.yorigin;
            this.projection = source.projection;
            this.domainState = source.domainState;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder transform(String transform) {
            this.transform = transform;
            return this;
        }

        public Builder threshold(Double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder zerovalue(Double zerovalue) {
            this.zerovalue = zerovalue;
            return this;
        }

        public Builder accutime(Double minutes) {
            this.accutime = minutes;
            return this;
        }

        public Builder timestamps(List<Instant> timestamps) {
            this.timestamps = timestamps;
            return this;
        }

        public Builder leadtimes(List<Double> minutes) {
            this.leadtimes = minutes;
            return this;
        }

        public Builder xpixelsize(Double xpixelsize) {
            this.xpixelsize = xpixelsize;
            return this;
        }

        public Builder ypixelsize(Double ypixelsize) {
            this.ypixelsize = ypixelsize;
            return this;
        }

        public Builder pixelSize(double xpixelsize, double ypixelsize) {
            this.xpixelsize = xpixelsize;
            this.ypixelsize = ypixelsize;
            return this;
        }

        public Builder bounds(GridBounds bounds) {
            this.bounds = bounds;
            return this;
        }

        public Builder yorigin(YOrigin yorigin) {
            this.yorigin = yorigin;
            return this;
        }

        public Builder projection(String projection) {
            this.projection = projection;
            return this;
        }

        public Builder domainState(DomainState domainState) {
            this.domainState = domainState;
            return this;
        }

        public Metadata build() {
            return new Metadata(unit, transform, threshold, zerovalue, accutime, timestamps, leadtimes,
                    xpixelsize, ypixelsize, bounds, yorigin, projection, domainState);
        }
    }
}
