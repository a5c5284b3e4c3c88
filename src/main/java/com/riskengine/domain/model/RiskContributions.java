package com.riskengine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/**
 * Euler allocation of total variance to holdings and to factors. Holding contributions sum to
 * total variance; factor contributions plus the idiosyncratic bucket sum to total variance.
 */
@Value
@Builder
public class RiskContributions {

    List<HoldingRiskContribution> holdings;
    List<FactorRiskContribution> factors;
    double idiosyncraticContribution;
    double idiosyncraticPercent;

    public Map<String, Double> factorVarianceShares() {
        return Collections.unmodifiableMap(factors.stream()
                .collect(Collectors.toMap(
                        FactorRiskContribution::getFactor,
                        FactorRiskContribution::getPercentOfVariance,
                        (a, b) -> a,
                        LinkedHashMap::new)));
    }

    public Map<String, HoldingRiskContribution> byTicker() {
        return holdings.stream()
                .collect(Collectors.toMap(HoldingRiskContribution::getTicker, Function.identity()));
    }
}
