package com.riskengine.optimizer;

/**
 * Euclidean projection onto {w : Σw = 1, lb ≤ w ≤ ub}.
 *
 * <p>The projection is wᵢ = clamp(vᵢ - τ, lbᵢ, ubᵢ) for the unique shift τ making the weights
 * sum to one; Σ clamp(v - τ) is non-increasing in τ, so τ is found by bisection. Callers must
 * ensure Σlb ≤ 1 ≤ Σub.
 */
final class BoxSumProjection {

    private static final int BISECTION_ITERATIONS = 200;

    private final double[] lower;
    private final double[] upper;

    BoxSumProjection(double[] lower, double[] upper) {
        this.lower = lower;
        this.upper = upper;
    }

    double[] project(double[] v) {
        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < v.length; i++) {
            low = Math.min(low, v[i] - upper[i]);
            high = Math.max(high, v[i] - lower[i]);
        }

        for (int iteration = 0; iteration < BISECTION_ITERATIONS && high - low > 0.0; iteration++) {
            double mid = 0.5 * (low + high);
            if (mid <= low || mid >= high) {
                break;
            }
            if (shiftedSum(v, mid) > 1.0) {
                low = mid;
            } else {
                high = mid;
            }
        }

        double tau = shiftedSum(v, low) - 1.0 <= 1.0 - shiftedSum(v, high) ? low : high;
        double[] w = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            w[i] = clamp(v[i] - tau, i);
        }
        return w;
    }

    boolean contains(double[] w, double tolerance) {
        double sum = 0.0;
        for (int i = 0; i < w.length; i++) {
            if (w[i] < lower[i] - tolerance || w[i] > upper[i] + tolerance) {
                return false;
            }
            sum += w[i];
        }
        return Math.abs(sum - 1.0) <= tolerance;
    }

    private double shiftedSum(double[] v, double tau) {
        double sum = 0.0;
        for (int i = 0; i < v.length; i++) {
            sum += clamp(v[i] - tau, i);
        }
        return sum;
    }

    private double clamp(double value, int i) {
        return Math.max(lower[i], Math.min(upper[i], value));
    }
}
