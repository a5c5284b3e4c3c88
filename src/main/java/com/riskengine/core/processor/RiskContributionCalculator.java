package com.riskengine.core.processor;

import com.riskengine.domain.model.FactorBetaMatrix;
import com.riskengine.domain.model.FactorCovariance;
import com.riskengine.domain.model.FactorRiskContribution;
import com.riskengine.domain.model.HoldingRiskContribution;
import com.riskengine.domain.model.RiskContributions;
import com.riskengine.domain.model.VarianceDecomposition;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Component;

/**
 * Euler allocation of portfolio variance.
 *
 * <p>Holdings: with the model asset covariance Σ = B Σf Bᵗ + diag(d), holding i contributes
 * wᵢ·(Σw)ᵢ. Because variance is homogeneous of degree 2 these sum to wᵗΣw, the total variance.
 *
 * <p>Factors: factor f contributes b_f·(Σf b)_f; together with the idiosyncratic bucket
 * Σ wᵢ²dᵢ they also sum to total variance.
 *
 * <p>Percentages are contribution / total variance and are 0 when total variance is 0.
 * Volatility contributions are contribution / σ and sum to σ.
 */
@Component
public class RiskContributionCalculator {

    static final double ROUND_TRIP_TOLERANCE = 1e-9;

    public RiskContributions calculate(
            Map<String, Double> weights,
            FactorBetaMatrix betas,
            FactorCovariance factorCovariance,
            VarianceDecomposition decomposition) {
        VarianceDecompositionEngine.requireSameFactors(betas, factorCovariance);
        List<String> tickers = betas.getTickers();
        RealVector w = VarianceDecompositionEngine.weightVector(weights, tickers);

        RealVector portfolioBetas = betas.betaMatrix().preMultiply(w);
        RealVector sigmaB = factorCovariance.covarianceMatrix().operate(portfolioBetas);
        RealVector marginal = betas.betaMatrix().operate(sigmaB);
        RealVector residuals = betas.residualVariances();

        double total = decomposition.getTotalVariance();
        double volatility = decomposition.getVolatility();

        List<HoldingRiskContribution> holdingContributions = new ArrayList<>(tickers.size());
        double holdingSum = 0.0;
        for (int i = 0; i < tickers.size(); i++) {
            double weight = w.getEntry(i);
            double contribution = weight * (marginal.getEntry(i) + residuals.getEntry(i) * weight);
            VarianceDecompositionEngine.requireFinite("contribution:" + tickers.get(i), contribution);
            holdingSum += contribution;
            holdingContributions.add(HoldingRiskContribution.builder()
                    .ticker(tickers.get(i))
                    .weight(weight)
                    .varianceContribution(contribution)
                    .percentOfVariance(share(contribution, total))
                    .volatilityContribution(volatility > 0.0 ? contribution / volatility : 0.0)
                    .build());
        }
        requireRoundTrip("holding", holdingSum, total);

        List<String> factors = betas.getFactors();
        List<FactorRiskContribution> factorContributions = new ArrayList<>(factors.size());
        double factorSum = 0.0;
        for (int f = 0; f < factors.size(); f++) {
            double contribution = portfolioBetas.getEntry(f) * sigmaB.getEntry(f);
            factorSum += contribution;
            factorContributions.add(FactorRiskContribution.builder()
                    .factor(factors.get(f))
                    .portfolioBeta(portfolioBetas.getEntry(f))
                    .varianceContribution(contribution)
                    .percentOfVariance(share(contribution, total))
                    .build());
        }
        double idiosyncratic = decomposition.getIdiosyncraticVariance();
        requireRoundTrip("factor", factorSum + idiosyncratic, total);

        return RiskContributions.builder()
                .holdings(List.copyOf(holdingContributions))
                .factors(List.copyOf(factorContributions))
                .idiosyncraticContribution(idiosyncratic)
                .idiosyncraticPercent(share(idiosyncratic, total))
                .build();
    }

    private static double share(double contribution, double total) {
        return total > 0.0 ? contribution / total : 0.0;
    }

    private static void requireRoundTrip(String kind, double sum, double total) {
        double scale = Math.max(Math.abs(sum), Math.abs(total));
        if (Math.abs(sum - total) > ROUND_TRIP_TOLERANCE * scale + 1e-15) {
            throw new IllegalStateException(
                    kind + " risk contributions sum to " + sum + " but total variance is " + total);
        }
    }
}
