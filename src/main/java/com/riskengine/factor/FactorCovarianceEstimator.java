package com.riskengine.factor;

import com.riskengine.config.RiskEngineProperties;
import com.riskengine.domain.model.FactorCovariance;
import com.riskengine.domain.model.ReturnSeries;
import com.riskengine.exception.DataInsufficientException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.stereotype.Component;

/**
 * Sample covariance of factor returns over the analysis window, annualized by
 * {@code periodsPerYear}, with the correlation matrix derived from it.
 *
 * <p>A factor with zero variance (up to rounding) has correlation 1 with itself and 0 with every
 * other factor.
 */
@Component
public class FactorCovarianceEstimator {

    /** Annualized variance at or below which a factor counts as constant. */
    static final double ZERO_VARIANCE = 1e-20;

    private final RiskEngineProperties.Model model;

    public FactorCovarianceEstimator(RiskEngineProperties properties) {
        this.model = properties.getModel();
    }

    /**
     * @param factorReturns factor name to return series, in factor order
     * @throws DataInsufficientException if the aligned history is too short or non-finite
     */
    public FactorCovariance estimate(Map<String, ReturnSeries> factorReturns) {
        List<String> factors = new ArrayList<>(factorReturns.keySet());
        AlignedReturns aligned = AlignedReturns.of(new ArrayList<>(factorReturns.values()));

        int required = Math.max(model.getMinObservations(), 2);
        if (aligned.observations() < required) {
            throw new DataInsufficientException(
                    "Factor proxies share only " + aligned.observations() + " dates, need " + required,
                    Map.of("factors", String.join(",", factors), "observations", aligned.observations()));
        }

        RealMatrix sample = new Covariance(aligned.columns(0, factors.size()), true).getCovarianceMatrix();
        int k = factors.size();
        double[][] covariance = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) {
                covariance[i][j] = sample.getEntry(i, j) * model.getPeriodsPerYear();
                if (!Double.isFinite(covariance[i][j])) {
                    throw new DataInsufficientException(
                            "Non-finite covariance between " + factors.get(i) + " and " + factors.get(j),
                            Map.of("factor", factors.get(i)));
                }
            }
        }

        double[][] correlation = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) {
                if (i == j) {
                    correlation[i][j] = 1.0;
                } else if (covariance[i][i] <= ZERO_VARIANCE || covariance[j][j] <= ZERO_VARIANCE) {
                    correlation[i][j] = 0.0;
                } else {
                    double value = covariance[i][j] / Math.sqrt(covariance[i][i] * covariance[j][j]);
                    correlation[i][j] = Math.max(-1.0, Math.min(1.0, value));
                }
            }
        }

        return new FactorCovariance(factors, covariance, correlation, aligned.observations());
    }
}
