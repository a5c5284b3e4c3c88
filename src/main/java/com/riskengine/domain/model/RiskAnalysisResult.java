package com.riskengine.domain.model;

import com.riskengine.cache.PipelineFingerprint;
import com.riskengine.risk.LimitVerdict;
import com.riskengine.risk.RiskLimitSet;
import com.riskengine.risk.RiskMetrics;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of one pipeline run. Created once, cached by fingerprint, and superseded
 * by a new run when any input changes; never edited in place.
 */
@Value
@Builder
public class RiskAnalysisResult {

    PipelineFingerprint fingerprint;
    AnalysisWindow window;
    Instant computedAt;

    BigDecimal totalValue;

    /** Analysis ticker to weight, after cash-proxy substitution. */
    Map<String, Double> weights;

    List<String> unmappedCurrencies;

    Map<String, FactorExposure> exposures;

    VarianceDecomposition decomposition;

    RiskContributions contributions;

    FactorCovariance factorCovariance;

    double leverage;

    RiskLimitSet limits;

    List<LimitVerdict> verdicts;

    public double getVolatility() {
        return decomposition.getVolatility();
    }

    public double getTotalVariance() {
        return decomposition.getTotalVariance();
    }

    public Map<String, Double> getPortfolioBetas() {
        return decomposition.getPortfolioBetas();
    }

    public Map<String, Map<String, Double>> getFactorCorrelations() {
        return factorCovariance.correlationTable();
    }

    public boolean hasViolations() {
        return verdicts.stream().anyMatch(LimitVerdict::isFailed);
    }

    public List<LimitVerdict> getFailedVerdicts() {
        return verdicts.stream().filter(LimitVerdict::isFailed).collect(Collectors.toList());
    }

    public RiskMetrics toRiskMetrics() {
        return RiskMetrics.builder()
                .volatility(decomposition.getVolatility())
                .weights(weights)
                .factorVarianceShares(contributions.factorVarianceShares())
                .totalFactorVarianceShare(decomposition.factorShare())
                .factorStressLosses(decomposition.getFactorStressLosses())
                .leverage(leverage)
                .build();
    }
}
