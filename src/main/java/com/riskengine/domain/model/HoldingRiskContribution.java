package com.riskengine.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HoldingRiskContribution {

    String ticker;
    double weight;

    /** Euler contribution wᵢ·(Σw)ᵢ in variance units. */
    double varianceContribution;

    /** varianceContribution / total variance, 0 when total variance is 0. */
    double percentOfVariance;

    /** varianceContribution / σ; these sum to portfolio volatility. */
    double volatilityContribution;
}
