package com.riskengine.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Output of the aggregator: resolved dollar exposures and weights keyed by analysis ticker
 * (cash already replaced by its proxy where one is mapped).
 */
@Value
@Builder
public class WeightedPortfolio {

    /** Analysis ticker to dollar exposure, in first-seen order. */
    Map<String, BigDecimal> exposures;

    /** Analysis ticker to exposure / net value, or exposure / gross exposure when net is not positive. */
    Map<String, Double> weights;

    BigDecimal totalValue;

    /** Sum of absolute dollar exposures. */
    BigDecimal grossExposure;

    /** Sum of absolute weights; 1.0 for a long-only portfolio. */
    double leverage;

    /** Currencies that had no cash proxy and were passed through as {@code CUR:<ccy>}. */
    List<String> unmappedCurrencies;

    public List<String> getTickers() {
        return new ArrayList<>(weights.keySet());
    }
}
