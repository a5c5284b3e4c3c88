package com.riskengine.optimizer;

/**
 * Constraint g(w) ≤ 0, named after the limit it enforces.
 */
record InequalityConstraint(String name, SmoothFunction function, boolean linear) {

    double violation(double[] w) {
        return Math.max(0.0, function.value(w));
    }
}
