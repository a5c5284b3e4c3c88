package com.riskengine.risk;

import com.riskengine.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * User-configurable risk thresholds. Every limit is optional: a null field means the check is
 * disabled and produces no verdict at all.
 *
 * <p>All values are fractions, e.g. 0.25 = 25% annualized volatility or 25% of portfolio value.
 * {@code maxSingleFactorLoss} is compared against the magnitude of the stressed loss, so both
 * -0.10 and 0.10 mean "no factor crash may cost more than 10%".
 */
@Value
@Builder(toBuilder = true)
public class RiskLimitSet {

    /** Display name only; not part of the limit set's identity. */
    String name;

    /** Max annualized portfolio volatility. */
    Double maxVolatility;

    /** Max absolute weight of any single holding. */
    Double maxSingleHoldingWeight;

    /** Max share of total variance attributable to any one factor. */
    Double maxFactorVarianceShare;

    /** Max share of total variance attributable to all factors together. */
    Double maxTotalFactorVarianceShare;

    /** Max loss from a crash scenario on any one factor. */
    Double maxSingleFactorLoss;

    /** Max gross exposure as a multiple of net value (sum of absolute weights). */
    Double maxLeverage;

    public static RiskLimitSet none() {
        return RiskLimitSet.builder().build();
    }

    public boolean isEmpty() {
        return thresholds().values().stream().allMatch(value -> value == null);
    }

    public Double getSingleFactorLossMagnitude() {
        return maxSingleFactorLoss != null ? Math.abs(maxSingleFactorLoss) : null;
    }

    /**
     * Rejects non-finite thresholds and negative values for every limit except
     * {@code maxSingleFactorLoss}, whose sign is ignored.
     *
     * @throws ConfigurationException on the first malformed threshold
     */
    public void validate() {
        thresholds().forEach((field, value) -> {
            if (value == null) {
                return;
            }
            if (value.isNaN() || value.isInfinite()) {
                throw new ConfigurationException(
                        "Risk limit " + field + " must be finite", Map.of("limit", field, "value", value));
            }
            if (value < 0 && !"maxSingleFactorLoss".equals(field)) {
                throw new ConfigurationException(
                        "Risk limit " + field + " must not be negative", Map.of("limit", field, "value", value));
            }
        });
    }

    /** Threshold values by field name, in a fixed order. Null values are disabled limits. */
    public Map<String, Double> thresholds() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("maxVolatility", maxVolatility);
        values.put("maxSingleHoldingWeight", maxSingleHoldingWeight);
        values.put("maxFactorVarianceShare", maxFactorVarianceShare);
        values.put("maxTotalFactorVarianceShare", maxTotalFactorVarianceShare);
        values.put("maxSingleFactorLoss", maxSingleFactorLoss);
        values.put("maxLeverage", maxLeverage);
        return values;
    }
}
