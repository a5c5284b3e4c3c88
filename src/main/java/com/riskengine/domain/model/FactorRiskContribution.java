package com.riskengine.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FactorRiskContribution {

    String factor;
    double portfolioBeta;

    /** Euler contribution b_f·(Σf b)_f in variance units. */
    double varianceContribution;

    double percentOfVariance;
}
