package com.riskengine.domain.model;

import com.riskengine.exception.ConfigurationException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied constraints and budgets for one optimization run. Unset budgets fall back to
 * {@code riskengine.optimizer.*}.
 */
@Value
@Builder(toBuilder = true)
public class OptimizationOptions {

    /** When false every weight is bounded below by zero. */
    @Builder.Default
    boolean allowShort = false;

    /** Lower weight bound per holding. Defaults to 0, or -1 when shorts are allowed. */
    Double minWeight;

    /** Upper weight bound per holding, in addition to the limit set's single-holding cap. */
    Double maxWeight;

    /** Gross exposure cap, combined with the limit set's leverage limit (the tighter wins). */
    Double maxLeverage;

    /** Tickers outside the current holdings that the optimizer may allocate to. */
    @Builder.Default
    List<String> candidateTickers = List.of();

    /** Annualized expected returns by ticker; missing tickers use the historical mean. */
    @Builder.Default
    Map<String, Double> expectedReturns = Map.of();

    Integer maxIterations;

    Duration timeout;

    public static OptimizationOptions defaults() {
        return OptimizationOptions.builder().build();
    }

    public void validate() {
        if (minWeight != null && !Double.isFinite(minWeight)) {
            throw new ConfigurationException("minWeight must be finite");
        }
        if (maxWeight != null && !Double.isFinite(maxWeight)) {
            throw new ConfigurationException("maxWeight must be finite");
        }
        if (minWeight != null && maxWeight != null && minWeight > maxWeight) {
            throw new ConfigurationException(
                    "minWeight must not exceed maxWeight", Map.of("minWeight", minWeight, "maxWeight", maxWeight));
        }
        if (maxLeverage != null && (!Double.isFinite(maxLeverage) || maxLeverage <= 0)) {
            throw new ConfigurationException("maxLeverage must be positive and finite");
        }
        if (maxIterations != null && maxIterations <= 0) {
            throw new ConfigurationException("maxIterations must be positive");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new ConfigurationException("timeout must not be negative");
        }
        expectedReturns.forEach((ticker, value) -> {
            if (value == null || !Double.isFinite(value)) {
                throw new ConfigurationException(
                        "Expected return for " + ticker + " must be finite", Map.of("ticker", ticker));
            }
        });
    }
}
