package com.riskengine.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Annualized portfolio variance split into the factor part bᵗΣf b and the idiosyncratic part
 * Σ wᵢ²·residualVarᵢ, where b = Bᵗw are the portfolio betas.
 */
@Value
@Builder
public class VarianceDecomposition {

    double totalVariance;
    double factorVariance;
    double idiosyncraticVariance;
    double volatility;

    /** Weight-sum of holding betas per factor, in factor order. */
    Map<String, Double> portfolioBetas;

    /** Stressed loss |b_f|·crashMove_f per factor, as a positive fraction of portfolio value. */
    Map<String, Double> factorStressLosses;

    /** Σ wᵢ². */
    double herfindahlIndex;

    public double factorShare() {
        return totalVariance > 0.0 ? factorVariance / totalVariance : 0.0;
    }
}
