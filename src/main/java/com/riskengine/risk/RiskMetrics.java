package com.riskengine.risk;

import com.riskengine.domain.model.RiskContributions;
import com.riskengine.domain.model.VarianceDecomposition;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * The metrics that limits are checked against, detached from how they were produced so the
 * optimizer can validate candidate weights with the same checker as a full analysis.
 */
@Value
@Builder
public class RiskMetrics {

    double volatility;
    Map<String, Double> weights;
    Map<String, Double> factorVarianceShares;
    double totalFactorVarianceShare;
    Map<String, Double> factorStressLosses;
    double leverage;

    public static RiskMetrics of(
            Map<String, Double> weights, VarianceDecomposition decomposition, RiskContributions contributions) {
        double leverage = 0.0;
        for (double weight : weights.values()) {
            leverage += Math.abs(weight);
        }
        return RiskMetrics.builder()
                .volatility(decomposition.getVolatility())
                .weights(weights)
                .factorVarianceShares(contributions.factorVarianceShares())
                .totalFactorVarianceShare(decomposition.factorShare())
                .factorStressLosses(decomposition.getFactorStressLosses())
                .leverage(leverage)
                .build();
    }

    public double maxAbsoluteWeight() {
        double max = 0.0;
        for (double weight : weights.values()) {
            max = Math.max(max, Math.abs(weight));
        }
        return max;
    }

    public double maxFactorVarianceShare() {
        double max = 0.0;
        for (double share : factorVarianceShares.values()) {
            max = Math.max(max, share);
        }
        return max;
    }
}
