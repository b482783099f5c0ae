package io.surfworks.gridforge.core.ops;

import io.surfworks.gridforge.core.error.ConfigurationException;

import java.util.Locale;

/**
 * Reduction applied to each block of a window aggregation.
 *
 * <p>{@link #SUM} and {@link #MEAN} propagate NaN. {@link #NANSUM} treats NaN as
 * zero, so an all-NaN block sums to 0. {@link #NANMEAN} averages the non-NaN
 * values only, so an all-NaN block stays NaN.
 */
public enum ReductionMethod {

    SUM {
        @Override
        double reduce(double[] values, int offset, int count, int stride) {
            double sum = 0.0;
            for (int i = 0; i < count; i++) {
                sum += values[offset + i * stride];
            }
            return sum;
        }
    },

    MEAN {
        @Override
        double reduce(double[] values, int offset, int count, int stride) {
            return SUM.reduce(values, offset, count, stride) / count;
        }
    },

    NANSUM {
        @Override
        double reduce(double[] values, int offset, int count, int stride) {
            double sum = 0.0;
            for (int i = 0; i < count; i++) {
                double v = values[offset + i * stride];
                if (!Double.isNaN(v)) {
                    sum += v;
                }
            }
            return sum;
        }
    },

    NANMEAN {
        @Override
        double reduce(double[] values, int offset, int count, int stride) {
            double sum = 0.0;
            int valid = 0;
            for (int i = 0; i < count; i++) {
                double v = values[offset + i * stride];
                if (!Double.isNaN(v)) {
                    sum += v;
                    valid++;
                }
            }
            return valid == 0 ? Double.NaN : sum / valid;
        }
    };

    /**
     * Reduce {@code count} values starting at {@code offset}, {@code stride} apart.
     */
    abstract double reduce(double[] values, int offset, int count, int stride);

    /**
     * Parse a method name, ignoring case ({@code "sum"}, {@code "NanMean"}, ...).
     *
     * @throws ConfigurationException for an unknown name
     */
    public static ReductionMethod fromName(String name) {
        if (name != null) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("aggregate", "unknown method '" + name + "'", e);
            }
        }
        throw new ConfigurationException("aggregate", "unknown method 'null'");
    }
}
