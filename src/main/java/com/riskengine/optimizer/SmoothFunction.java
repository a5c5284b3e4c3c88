package com.riskengine.optimizer;

/**
 * A continuously differentiable function of the weight vector.
 */
interface SmoothFunction {

    double value(double[] w);

    double[] gradient(double[] w);
}
