package com.riskengine.core.processor;

import com.riskengine.config.RiskEngineProperties;
import com.riskengine.domain.model.FactorBetaMatrix;
import com.riskengine.domain.model.FactorCovariance;
import com.riskengine.domain.model.VarianceDecomposition;
import com.riskengine.exception.ConfigurationException;
import com.riskengine.exception.DataInsufficientException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Component;

/**
 * Splits portfolio variance into factor and idiosyncratic parts.
 *
 * <p>With weights w, holdings × factors betas B, factor covariance Σf and residual variances d:
 * <pre>
 *   b             = Bᵗw                 (portfolio betas)
 *   factorVar     = bᵗ Σf b
 *   idioVar       = Σ wᵢ² dᵢ             (residuals independent across holdings)
 *   totalVar      = factorVar + idioVar
 * </pre>
 * The total is defined as the sum, so the split is exact. An all-zero weight vector gives zero
 * variance everywhere, never a division by zero.
 *
 * <p>Also produces the Herfindahl index Σwᵢ² and, per factor, the stressed loss |b_f| times the
 * configured crash move for that factor.
 *
 * <p>This class is stateless and thread-safe.
 */
@Component
public class VarianceDecompositionEngine {

    private final RiskEngineProperties.Model model;

    public VarianceDecompositionEngine(RiskEngineProperties properties) {
        this.model = properties.getModel();
    }

    /**
     * @param weights analysis ticker to weight; every ticker must be a row of {@code betas}
     * @throws ConfigurationException if a weight is non-finite
     * @throws DataInsufficientException if an intermediate value is non-finite
     */
    public VarianceDecomposition decompose(
            Map<String, Double> weights, FactorBetaMatrix betas, FactorCovariance factorCovariance) {
        requireSameFactors(betas, factorCovariance);
        RealVector w = weightVector(weights, betas.getTickers());

        RealVector portfolioBetas = betas.betaMatrix().preMultiply(w);
        RealVector sigmaB = factorCovariance.covarianceMatrix().operate(portfolioBetas);
        double factorVariance = Math.max(0.0, portfolioBetas.dotProduct(sigmaB));

        RealVector residuals = betas.residualVariances();
        double idiosyncraticVariance = 0.0;
        double herfindahl = 0.0;
        for (int i = 0; i < w.getDimension(); i++) {
            double weight = w.getEntry(i);
            idiosyncraticVariance += weight * weight * residuals.getEntry(i);
            herfindahl += weight * weight;
        }

        double totalVariance = factorVariance + idiosyncraticVariance;
        requireFinite("factorVariance", factorVariance);
        requireFinite("idiosyncraticVariance", idiosyncraticVariance);

        List<String> factors = betas.getFactors();
        Map<String, Double> betaByFactor = new LinkedHashMap<>();
        Map<String, Double> stressLosses = new LinkedHashMap<>();
        for (int f = 0; f < factors.size(); f++) {
            double beta = portfolioBetas.getEntry(f);
            requireFinite("beta:" + factors.get(f), beta);
            betaByFactor.put(factors.get(f), beta);
            stressLosses.put(factors.get(f), Math.abs(beta) * model.crashMoveFor(factors.get(f)));
        }

        return VarianceDecomposition.builder()
                .totalVariance(totalVariance)
                .factorVariance(factorVariance)
                .idiosyncraticVariance(idiosyncraticVariance)
                .volatility(Math.sqrt(totalVariance))
                .portfolioBetas(Collections.unmodifiableMap(betaByFactor))
                .factorStressLosses(Collections.unmodifiableMap(stressLosses))
                .herfindahlIndex(herfindahl)
                .build();
    }

    static RealVector weightVector(Map<String, Double> weights, List<String> tickers) {
        if (weights.size() != tickers.size()) {
            throw new IllegalArgumentException(
                    "Weights cover " + weights.size() + " tickers but the beta matrix has " + tickers.size());
        }
        double[] values = new double[tickers.size()];
        for (int i = 0; i < tickers.size(); i++) {
            Double weight = weights.get(tickers.get(i));
            if (weight == null) {
                throw new IllegalArgumentException("No weight for " + tickers.get(i));
            }
            if (!Double.isFinite(weight)) {
                throw new ConfigurationException(
                        "Non-finite weight for " + tickers.get(i), Map.of("ticker", tickers.get(i)));
            }
            values[i] = weight;
        }
        return new ArrayRealVector(values, false);
    }

    static void requireSameFactors(FactorBetaMatrix betas, FactorCovariance factorCovariance) {
        if (!betas.getFactors().equals(factorCovariance.getFactors())) {
            throw new IllegalArgumentException("Beta matrix factors " + betas.getFactors()
                    + " do not match covariance factors " + factorCovariance.getFactors());
        }
    }

    static void requireFinite(String quantity, double value) {
        if (!Double.isFinite(value)) {
            throw new DataInsufficientException(
                    "Non-finite " + quantity + " in variance decomposition", Map.of("quantity", quantity));
        }
    }
}
