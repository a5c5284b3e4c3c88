package com.riskengine.optimizer;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimizes a smooth objective over {Σw = 1, lb ≤ w ≤ ub} subject to smooth inequality
 * constraints gⱼ(w) ≤ 0.
 *
 * <p>Outer loop: augmented Lagrangian
 * <pre>
 *   L(w) = f(w) + 1/(2ρ) Σⱼ [max(0, λⱼ + ρ gⱼ(w))² - λⱼ²]
 * </pre>
 * with multiplier update λⱼ ← max(0, λⱼ + ρ gⱼ) and ρ raised tenfold whenever the worst
 * violation fails to shrink by 4×.
 *
 * <p>Inner loop: spectral projected gradient on L with a Barzilai-Borwein trial step and
 * backtracking on the sufficient-decrease condition, projecting with {@link BoxSumProjection}.
 *
 * <p>Every gradient step counts against the iteration budget, and the deadline is checked
 * before each step. The solver never runs past either.
 */
final class AugmentedLagrangianSolver {

    private static final Logger log = LoggerFactory.getLogger(AugmentedLagrangianSolver.class);

    static final double STATIONARITY_TOLERANCE = 1e-10;
    static final double FEASIBILITY_TOLERANCE = 1e-11;
    static final double STEP_TOLERANCE = 1e-9;

    private static final int MAX_OUTER_ITERATIONS = 60;
    private static final double INITIAL_PENALTY = 10.0;
    private static final double MAX_PENALTY = 1e10;
    private static final double MIN_STEP = 1e-12;
    private static final double MAX_STEP = 1e6;

    enum Status {
        CONVERGED,
        BUDGET_EXHAUSTED,
        TIMED_OUT,
        STALLED
    }

    record Outcome(double[] weights, Status status, int iterations, double maxViolation) {

        boolean converged() {
            return status == Status.CONVERGED;
        }
    }

    private final Clock clock;

    AugmentedLagrangianSolver(Clock clock) {
        this.clock = clock;
    }

    Outcome solve(
            SmoothFunction objective,
            List<InequalityConstraint> constraints,
            BoxSumProjection projection,
            double[] start,
            int iterationBudget,
            Instant deadline) {
        int m = constraints.size();
        double[] multipliers = new double[m];
        double penalty = INITIAL_PENALTY;
        double previousViolation = Double.POSITIVE_INFINITY;

        double[] w = projection.project(start);
        int iterations = 0;

        for (int outer = 0; outer < MAX_OUTER_ITERATIONS; outer++) {
            Lagrangian lagrangian = new Lagrangian(objective, constraints, multipliers, penalty);
            double[] previousOuter = w.clone();

            double step = 1.0;
            double[] previousW = null;
            double[] previousGradient = null;
            while (true) {
                if (iterations >= iterationBudget) {
                    return new Outcome(w, Status.BUDGET_EXHAUSTED, iterations, maxViolation(constraints, w));
                }
                if (!clock.instant().isBefore(deadline)) {
                    return new Outcome(w, Status.TIMED_OUT, iterations, maxViolation(constraints, w));
                }

                double[] gradient = lagrangian.gradient(w);
                if (stationarity(projection, w, gradient) < STATIONARITY_TOLERANCE) {
                    break;
                }

                if (previousW != null) {
                    step = barzilaiBorwein(w, previousW, gradient, previousGradient, step);
                }

                double value = lagrangian.value(w);
                double[] candidate = null;
                while (step >= MIN_STEP) {
                    double[] trial = projection.project(axpy(-step, gradient, w));
                    double decrease = 0.0;
                    double distance = 0.0;
                    for (int i = 0; i < w.length; i++) {
                        double d = trial[i] - w[i];
                        decrease += gradient[i] * d;
                        distance += d * d;
                    }
                    if (lagrangian.value(trial) <= value + decrease + distance / (2.0 * step)) {
                        candidate = trial;
                        break;
                    }
                    step *= 0.5;
                }
                iterations++;
                if (candidate == null) {
                    log.debug("Line search stalled at outer iteration {} after {} steps", outer, iterations);
                    break;
                }

                previousW = w;
                previousGradient = gradient;
                w = candidate;
            }

            double violation = maxViolation(constraints, w);
            for (int j = 0; j < m; j++) {
                multipliers[j] = Math.max(0.0, multipliers[j] + penalty * constraints.get(j).function().value(w));
            }

            double movement = maxAbsDifference(w, previousOuter);
            log.debug(
                    "Outer iteration {}: violation={}, movement={}, penalty={}, steps={}",
                    outer,
                    violation,
                    movement,
                    penalty,
                    iterations);

            if (violation <= FEASIBILITY_TOLERANCE && (m == 0 || movement < STEP_TOLERANCE)) {
                return new Outcome(w, Status.CONVERGED, iterations, violation);
            }
            if (violation > 0.25 * previousViolation) {
                penalty = Math.min(penalty * 10.0, MAX_PENALTY);
            }
            previousViolation = violation;
        }

        return new Outcome(w, Status.STALLED, iterations, maxViolation(constraints, w));
    }

    static double maxViolation(List<InequalityConstraint> constraints, double[] w) {
        double worst = 0.0;
        for (InequalityConstraint constraint : constraints) {
            worst = Math.max(worst, constraint.violation(w));
        }
        return worst;
    }

    private static double stationarity(BoxSumProjection projection, double[] w, double[] gradient) {
        return maxAbsDifference(projection.project(axpy(-1.0, gradient, w)), w);
    }

    private static double barzilaiBorwein(double[] w, double[] previousW, double[] g, double[] previousG, double fallback) {
        double ss = 0.0;
        double sy = 0.0;
        for (int i = 0; i < w.length; i++) {
            double s = w[i] - previousW[i];
            double y = g[i] - previousG[i];
            ss += s * s;
            sy += s * y;
        }
        if (sy <= 0.0 || ss == 0.0) {
            return Math.min(MAX_STEP, fallback * 2.0);
        }
        return Math.max(MIN_STEP, Math.min(MAX_STEP, ss / sy));
    }

    private static double[] axpy(double a, double[] x, double[] y) {
        double[] result = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            result[i] = a * x[i] + y[i];
        }
        return result;
    }

    private static double maxAbsDifference(double[] a, double[] b) {
        double max = 0.0;
        for (int i = 0; i < a.length; i++) {
            max = Math.max(max, Math.abs(a[i] - b[i]));
        }
        return max;
    }

    private static final class Lagrangian {

        private final SmoothFunction objective;
        private final List<InequalityConstraint> constraints;
        private final double[] multipliers;
        private final double penalty;

        Lagrangian(SmoothFunction objective, List<InequalityConstraint> constraints, double[] multipliers, double penalty) {
            this.objective = objective;
            this.constraints = constraints;
            this.multipliers = multipliers.clone();
            this.penalty = penalty;
        }

        double value(double[] w) {
            double value = objective.value(w);
            for (int j = 0; j < constraints.size(); j++) {
                double shifted = Math.max(0.0, multipliers[j] + penalty * constraints.get(j).function().value(w));
                value += (shifted * shifted - multipliers[j] * multipliers[j]) / (2.0 * penalty);
            }
            return value;
        }

        double[] gradient(double[] w) {
            double[] gradient = objective.gradient(w);
            for (int j = 0; j < constraints.size(); j++) {
                SmoothFunction g = constraints.get(j).function();
                double shifted = Math.max(0.0, multipliers[j] + penalty * g.value(w));
                if (shifted > 0.0) {
                    double[] constraintGradient = g.gradient(w);
                    for (int i = 0; i < w.length; i++) {
                        gradient[i] += shifted * constraintGradient[i];
                    }
                }
            }
            return gradient;
        }
    }
}
