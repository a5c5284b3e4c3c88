package com.riskengine.optimizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;

/**
 * The linear part of the optimization problem: full investment, per-holding bounds and any
 * linear inequalities, solved with the commons-math simplex method.
 *
 * <p>Used to decide feasibility of the linear constraints, to find a starting point for the
 * iterative solver, and to solve MAX_RETURN exactly when no quadratic constraint is present.
 */
final class LinearProgram {

    private static final int MAX_SIMPLEX_ITERATIONS = 10_000;

    private final int dimension;
    private final List<LinearConstraint> constraints = new ArrayList<>();

    LinearProgram(double[] lower, double[] upper) {
        this.dimension = lower.length;
        double[] ones = new double[dimension];
        Arrays.fill(ones, 1.0);
        constraints.add(new LinearConstraint(ones, Relationship.EQ, 1.0));
        for (int i = 0; i < dimension; i++) {
            double[] unit = new double[dimension];
            unit[i] = 1.0;
            constraints.add(new LinearConstraint(unit, Relationship.GEQ, lower[i]));
            constraints.add(new LinearConstraint(unit.clone(), Relationship.LEQ, upper[i]));
        }
    }

    /** Adds aᵗw ≤ b. */
    LinearProgram lessOrEqual(double[] coefficients, double bound) {
        constraints.add(new LinearConstraint(coefficients, Relationship.LEQ, bound));
        return this;
    }

    /**
     * Any point satisfying all constraints, or empty if none exists.
     *
     * @throws TooManyIterationsException if the simplex method does not terminate in budget
     */
    Optional<double[]> feasiblePoint() {
        return solve(new double[dimension], GoalType.MINIMIZE);
    }

    /**
     * Maximizer of cᵗw over the constraints, or empty if infeasible.
     */
    Optional<double[]> maximize(double[] objective) {
        return solve(objective, GoalType.MAXIMIZE);
    }

    private Optional<double[]> solve(double[] objective, GoalType goal) {
        try {
            PointValuePair solution = new SimplexSolver()
                    .optimize(
                            new MaxIter(MAX_SIMPLEX_ITERATIONS),
                            new LinearObjectiveFunction(objective, 0.0),
                            new LinearConstraintSet(constraints),
                            goal,
                            new NonNegativeConstraint(false));
            return Optional.of(solution.getPoint());
        } catch (NoFeasibleSolutionException e) {
            return Optional.empty();
        } catch (UnboundedSolutionException e) {
            throw new IllegalStateException("Bounded linear program reported unbounded", e);
        }
    }
}
