package com.riskengine.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Annualized factor covariance Σf with the matching correlation matrix, indexed in proxy-set
 * factor order.
 */
public final class FactorCovariance {

    private final List<String> factors;
    private final double[][] covariance;
    private final double[][] correlation;
    private final int observations;

    public FactorCovariance(List<String> factors, double[][] covariance, double[][] correlation, int observations) {
        this.factors = List.copyOf(factors);
        this.covariance = copy(covariance);
        this.correlation = copy(correlation);
        this.observations = observations;
    }

    public List<String> getFactors() {
        return factors;
    }

    public int getObservations() {
        return observations;
    }

    public int size() {
        return factors.size();
    }

    public RealMatrix covarianceMatrix() {
        return new Array2DRowRealMatrix(covariance, true);
    }

    public double covariance(int i, int j) {
        return covariance[i][j];
    }

    public double correlation(String a, String b) {
        return correlation[factors.indexOf(a)][factors.indexOf(b)];
    }

    public double volatility(String factor) {
        int index = factors.indexOf(factor);
        return Math.sqrt(covariance[index][index]);
    }

    /** Correlation matrix keyed by factor name, both levels in factor order. */
    public Map<String, Map<String, Double>> correlationTable() {
        Map<String, Map<String, Double>> table = new LinkedHashMap<>();
        for (int i = 0; i < factors.size(); i++) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (int j = 0; j < factors.size(); j++) {
                row.put(factors.get(j), correlation[i][j]);
            }
            table.put(factors.get(i), row);
        }
        return table;
    }

    public Map<String, Double> volatilities() {
        Map<String, Double> vols = new LinkedHashMap<>();
        for (int i = 0; i < factors.size(); i++) {
            vols.put(factors.get(i), Math.sqrt(covariance[i][i]));
        }
        return vols;
    }

    private static double[][] copy(double[][] source) {
        double[][] target = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            target[i] = source[i].clone();
        }
        return target;
    }
}
