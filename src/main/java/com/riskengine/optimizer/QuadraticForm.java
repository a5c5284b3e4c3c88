package com.riskengine.optimizer;

/**
 * f(w) = wᵗMw + aᵗw + c with M symmetric. M or a may be absent, which covers the variance
 * objective, the return objective and linear constraints with one type.
 */
final class QuadraticForm implements SmoothFunction {

    private final double[][] matrix;
    private final double[] linear;
    private final double constant;

    QuadraticForm(double[][] matrix, double[] linear, double constant) {
        this.matrix = matrix;
        this.linear = linear;
        this.constant = constant;
    }

    static QuadraticForm quadratic(double[][] matrix, double constant) {
        return new QuadraticForm(matrix, null, constant);
    }

    static QuadraticForm linear(double[] coefficients, double constant) {
        return new QuadraticForm(null, coefficients, constant);
    }

    @Override
    public double value(double[] w) {
        double value = constant;
        if (matrix != null) {
            for (int i = 0; i < w.length; i++) {
                double row = 0.0;
                for (int j = 0; j < w.length; j++) {
                    row += matrix[i][j] * w[j];
                }
                value += w[i] * row;
            }
        }
        if (linear != null) {
            for (int i = 0; i < w.length; i++) {
                value += linear[i] * w[i];
            }
        }
        return value;
    }

    @Override
    public double[] gradient(double[] w) {
        double[] gradient = new double[w.length];
        if (matrix != null) {
            for (int i = 0; i < w.length; i++) {
                double row = 0.0;
                for (int j = 0; j < w.length; j++) {
                    row += matrix[i][j] * w[j];
                }
                gradient[i] = 2.0 * row;
            }
        }
        if (linear != null) {
            for (int i = 0; i < w.length; i++) {
                gradient[i] += linear[i];
            }
        }
        return gradient;
    }
}
