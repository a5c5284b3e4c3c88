package com.riskengine.risk;

import lombok.Value;

/**
 * One suggested threshold next to the portfolio's current value for the same metric. A null
 * {@code suggestedMax} means the metric needs no cap at the requested loss tolerance.
 */
@Value
public class LimitSuggestion {

    /** A {@link RiskLimitSet} field name, or {@code beta:<factor>} for a portfolio beta cap. */
    String name;
    double currentValue;
    Double suggestedMax;

    public boolean isReductionNeeded() {
        return suggestedMax != null && Math.abs(currentValue) > suggestedMax;
    }
}
