package com.riskengine.service;

import com.riskengine.domain.model.FactorBetaMatrix;
import com.riskengine.domain.model.RiskContributions;
import com.riskengine.domain.model.VarianceDecomposition;
import com.riskengine.risk.RiskMetrics;
import lombok.Value;

/**
 * Decomposition, contributions and limit metrics for one weight vector under one factor model.
 */
@Value
public class ModelEvaluation {

    FactorBetaMatrix betas;
    VarianceDecomposition decomposition;
    RiskContributions contributions;
    RiskMetrics metrics;
}
