package io.surfworks.gridforge.core.ops;

import io.surfworks.gridforge.core.error.ConfigurationException;

/**
 * Units that can be aggregated, and the reduction their physical meaning implies.
 *
 * <p>A rate ({@code mm/h}) is averaged over a window; an accumulation
 * ({@code mm}) is summed. Other units, such as reflectivity in {@code dBZ},
 * have no meaningful block aggregate.
 */
public enum AggregationUnit {

    RATE("mm/h", ReductionMethod.MEAN),
    ACCUMULATION("mm", ReductionMethod.SUM);

    private final String symbol;
    private final ReductionMethod method;

    AggregationUnit(String symbol, ReductionMethod method) {
        this.symbol = symbol;
        this.method = method;
    }

    public String symbol() {
        return symbol;
    }

    public ReductionMethod method() {
        return method;
    }

    /**
     * Resolve a unit symbol.
     *
     * @param operation the operation asking, used in the error message
     * @param symbol the metadata unit
     * @throws ConfigurationException if the unit cannot be aggregated
     */
    public static AggregationUnit forSymbol(String operation, String symbol) {
        for (AggregationUnit unit : values()) {
            if (unit.symbol.equals(symbol)) {
                return unit;
            }
        }
        throw new ConfigurationException(operation,
                "can only aggregate units of 'mm/h' or 'mm', not '" + symbol + "'");
    }
}
