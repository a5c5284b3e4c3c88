package com.riskengine.optimizer;

/**
 * g(w) = Σ sqrt(wᵢ² + ε) - L, a differentiable upper bound on Σ|wᵢ| - L. Satisfying g ≤ 0
 * implies the exact gross exposure is within L.
 */
final class SmoothLeverage implements SmoothFunction {

    static final double SMOOTHING = 1e-14;

    private final double limit;

    SmoothLeverage(double limit) {
        this.limit = limit;
    }

    @Override
    public double value(double[] w) {
        double sum = 0.0;
        for (double weight : w) {
            sum += Math.sqrt(weight * weight + SMOOTHING);
        }
        return sum - limit;
    }

    @Override
    public double[] gradient(double[] w) {
        double[] gradient = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            gradient[i] = w[i] / Math.sqrt(w[i] * w[i] + SMOOTHING);
        }
        return gradient;
    }
}
