package com.riskengine.domain.model;

import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Holdings × factors beta matrix B with the diagonal of residual variances D, rows in the
 * order of {@link #getTickers()} and columns in the order of {@link #getFactors()}.
 */
public final class FactorBetaMatrix {

    private final List<String> tickers;
    private final List<String> factors;
    private final double[][] betas;
    private final double[] residualVariances;

    private FactorBetaMatrix(List<String> tickers, List<String> factors, double[][] betas, double[] residuals) {
        this.tickers = List.copyOf(tickers);
        this.factors = List.copyOf(factors);
        this.betas = betas;
        this.residualVariances = residuals;
    }

    /**
     * Assembles the matrix for the given tickers. Every ticker must have an exposure row.
     */
    public static FactorBetaMatrix of(List<String> tickers, List<String> factors, Map<String, FactorExposure> rows) {
        double[][] betas = new double[tickers.size()][factors.size()];
        double[] residuals = new double[tickers.size()];
        for (int i = 0; i < tickers.size(); i++) {
            FactorExposure exposure = rows.get(tickers.get(i));
            if (exposure == null) {
                throw new IllegalStateException("No factor exposure for " + tickers.get(i));
            }
            for (int f = 0; f < factors.size(); f++) {
                betas[i][f] = exposure.beta(factors.get(f));
            }
            residuals[i] = exposure.getResidualVariance();
        }
        return new FactorBetaMatrix(tickers, factors, betas, residuals);
    }

    public List<String> getTickers() {
        return tickers;
    }

    public List<String> getFactors() {
        return factors;
    }

    public int holdingCount() {
        return tickers.size();
    }

    public int factorCount() {
        return factors.size();
    }

    public RealMatrix betaMatrix() {
        return new Array2DRowRealMatrix(betas, true);
    }

    public RealVector residualVariances() {
        return new ArrayRealVector(residualVariances, true);
    }

    public double beta(int holding, int factor) {
        return betas[holding][factor];
    }

    public double residualVariance(int holding) {
        return residualVariances[holding];
    }
}
