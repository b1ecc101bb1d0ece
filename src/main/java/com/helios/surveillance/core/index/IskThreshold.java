package com.helios.surveillance.core.index;

import com.helios.surveillance.core.compiler.FilterValues;
import com.helios.surveillance.model.FilterOperator;

/**
 * An ordering constraint on {@code total_value}, e.g. {@code gt 1e9}.
 */
public record IskThreshold(FilterOperator operator, double threshold) {

    public IskThreshold {
        if (!operator.isOrdering()) {
            throw new IllegalArgumentException("ISK thresholds need an ordering operator, got " + operator);
        }
    }

    public boolean satisfiedBy(double totalValue) {
        return FilterValues.compare(operator, totalValue, threshold);
    }
}
