package com.riskengine.optimizer;

import com.riskengine.config.RiskEngineProperties;
import com.riskengine.domain.enums.OptimizationObjective;
import com.riskengine.domain.model.FactorBetaMatrix;
import com.riskengine.domain.model.FactorCovariance;
import com.riskengine.domain.model.FactorExposure;
import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.Holding;
import com.riskengine.domain.model.OptimizationOptions;
import com.riskengine.domain.model.OptimizationResult;
import com.riskengine.domain.model.Portfolio;
import com.riskengine.factor.FactorExposureEstimator;
import com.riskengine.risk.LimitVerdict;
import com.riskengine.risk.LimitsComplianceChecker;
import com.riskengine.risk.RiskLimitSet;
import com.riskengine.service.ModelEvaluation;
import com.riskengine.service.PipelineInputs;
import com.riskengine.service.RiskAnalysisPipeline;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Searches for portfolio weights that minimize model variance or maximize expected return with
 * every configured risk limit treated as a hard constraint.
 *
 * <p>The universe is the current analysis tickers plus any candidate tickers. The model asset
 * covariance is Σ = B Σf Bᵗ + diag(d), the same model the analysis uses. Constraints:
 * <ul>
 *   <li>Σw = 1 and per-holding bounds lb ≤ w ≤ ub (no-short, caller box, single-holding cap)</li>
 *   <li>per-factor stressed loss: |(Bᵗw)_f|·crash_f ≤ maxLoss, as two linear inequalities</li>
 *   <li>volatility: wᵗΣw ≤ maxVol²</li>
 *   <li>per-factor variance share: wᵗ(Q_f - sΣ)w ≤ 0 with Q_f the quadratic form of factor f's
 *       Euler contribution</li>
 *   <li>total factor variance share: wᵗ(BΣfBᵗ - sΣ)w ≤ 0</li>
 *   <li>gross leverage, when shorts are allowed</li>
 * </ul>
 * Nonlinear limits are tightened by a relative margin inside the solver so that the final exact
 * check has room.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>INFEASIBLE when the bounds cannot sum to one, the linear constraints have no solution
 *       (simplex), the minimum achievable volatility over them exceeds the limit, or minimizing a
 *       variance-share constraint over them from every start leaves it violated</li>
 *   <li>DID_NOT_CONVERGE when the iteration budget or the deadline runs out, or when the final
 *       candidate fails the exact compliance check; the candidate is attached as non-authoritative</li>
 *   <li>FEASIBLE only after {@link LimitsComplianceChecker} passes every verdict on the final weights</li>
 * </ul>
 */
@Service
public class PortfolioOptimizer {

    private static final Logger log = LoggerFactory.getLogger(PortfolioOptimizer.class);

    static final double CONSTRAINT_MARGIN = 1e-6;
    static final double DEFAULT_SHORT_BOUND = -1.0;
    static final double BOX_TOLERANCE = 1e-9;
    static final double INFEASIBILITY_TOLERANCE = 1e-9;

    private final RiskAnalysisPipeline riskAnalysisPipeline;
    private final FactorExposureEstimator factorExposureEstimator;
    private final LimitsComplianceChecker limitsComplianceChecker;
    private final RiskEngineProperties properties;
    private final Clock clock;

    public PortfolioOptimizer(
            RiskAnalysisPipeline riskAnalysisPipeline,
            FactorExposureEstimator factorExposureEstimator,
            LimitsComplianceChecker limitsComplianceChecker,
            RiskEngineProperties properties,
            Clock clock) {
        this.riskAnalysisPipeline = riskAnalysisPipeline;
        this.factorExposureEstimator = factorExposureEstimator;
        this.limitsComplianceChecker = limitsComplianceChecker;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param proxySetHash content hash of {@code proxySet}, used for the exposure cache
     * @throws com.riskengine.exception.ConfigurationException for malformed limits or options
     * @throws com.riskengine.exception.DataInsufficientException if any universe ticker lacks history
     */
    public OptimizationResult optimize(
            Portfolio portfolio,
            FactorProxySet proxySet,
            String proxySetHash,
            OptimizationObjective objective,
            RiskLimitSet limits,
            OptimizationOptions options) {
        limits.validate();
        options.validate();

        Duration timeout = options.getTimeout() != null
                ? options.getTimeout()
                : properties.getOptimizer().getTimeout();
        int budget = options.getMaxIterations() != null
                ? options.getMaxIterations()
                : properties.getOptimizer().getMaxIterations();
        Instant deadline = clock.instant().plus(timeout);

        if (portfolio.isEmpty() && options.getCandidateTickers().isEmpty()) {
            return OptimizationResult.infeasible("Universe is empty: no holdings and no candidate tickers", 0);
        }
        PipelineInputs inputs =
                riskAnalysisPipeline.prepare(portfolio, proxySet, proxySetHash, options.getCandidateTickers());
        List<String> universe = inputs.getUniverse();

        RiskLimitSet effectiveLimits = withCallerLeverage(limits, options.getMaxLeverage());
        Problem problem = buildProblem(universe, inputs, objective, effectiveLimits, options, portfolio);

        Optional<String> boxInfeasibility = problem.boxInfeasibility();
        if (boxInfeasibility.isPresent()) {
            return OptimizationResult.infeasible(boxInfeasibility.get(), 0);
        }
        if (effectiveLimits.getMaxLeverage() != null && effectiveLimits.getMaxLeverage() < 1.0) {
            return OptimizationResult.infeasible(
                    "Leverage limit " + effectiveLimits.getMaxLeverage() + " is below 1.0, the minimum gross"
                            + " exposure of a fully invested portfolio",
                    0);
        }
        if (!clock.instant().isBefore(deadline)) {
            return OptimizationResult.didNotConverge("Timed out before solving", null, null, 0, List.of());
        }

        LinearProgram linearProgram = problem.linearProgram();
        Optional<double[]> start;
        try {
            start = linearProgram.feasiblePoint();
        } catch (TooManyIterationsException e) {
            return OptimizationResult.didNotConverge(
                    "Simplex method exceeded its iteration budget", null, null, 0, List.of());
        }
        if (start.isEmpty()) {
            return OptimizationResult.infeasible(
                    "No weights satisfy full investment, the weight bounds and the factor loss limits together", 0);
        }

        if (objective == OptimizationObjective.MAX_RETURN && !problem.hasNonlinearConstraints()) {
            double[] weights = problem.projection.project(linearProgram.maximize(problem.expectedReturns)
                    .orElse(start.get()));
            return finish(weights, 0, problem, inputs, effectiveLimits, objective, "linear program");
        }

        AugmentedLagrangianSolver solver = new AugmentedLagrangianSolver(clock);
        int used = 0;
        double[] minimumVariance = null;
        if (effectiveLimits.getMaxVolatility() != null) {
            AugmentedLagrangianSolver.Outcome outcome = solver.solve(
                    problem.varianceObjective(),
                    problem.linearConstraints,
                    problem.projection,
                    start.get(),
                    budget,
                    deadline);
            used += outcome.iterations();
            if (!outcome.converged()) {
                return notConverged(outcome, used, problem, "minimum-variance search");
            }
            minimumVariance = outcome.weights();
            double minimumVolatility = Math.sqrt(problem.variance(minimumVariance));
            double maxVolatility = effectiveLimits.getMaxVolatility();
            if (minimumVolatility > maxVolatility * (1.0 + INFEASIBILITY_TOLERANCE)) {
                return OptimizationResult.infeasible(
                        String.format(
                                Locale.ROOT,
                                "Minimum achievable volatility %.6f exceeds the %.6f limit",
                                minimumVolatility,
                                maxVolatility),
                        used);
            }
        }

        for (InequalityConstraint share : problem.shareConstraints()) {
            List<double[]> starts = new ArrayList<>();
            starts.add(start.get());
            if (minimumVariance != null) {
                starts.add(minimumVariance);
            }
            double smallestExcess = Double.POSITIVE_INFINITY;
            boolean conclusive = true;
            for (double[] from : starts) {
                AugmentedLagrangianSolver.Outcome outcome = solver.solve(
                        share.function(),
                        problem.linearConstraints,
                        problem.projection,
                        from,
                        Math.max(0, budget - used),
                        deadline);
                used += outcome.iterations();
                if (outcome.status() == AugmentedLagrangianSolver.Status.BUDGET_EXHAUSTED
                        || outcome.status() == AugmentedLagrangianSolver.Status.TIMED_OUT) {
                    return notConverged(outcome, used, problem, "feasibility search for " + share.name());
                }
                if (!outcome.converged()) {
                    conclusive = false;
                    break;
                }
                double[] w = outcome.weights();
                double allowance = CONSTRAINT_MARGIN * problem.variance(w) + INFEASIBILITY_TOLERANCE;
                smallestExcess = Math.min(smallestExcess, share.function().value(w) - allowance);
            }
            if (conclusive && smallestExcess > 0.0) {
                return OptimizationResult.infeasible(
                        String.format(
                                Locale.ROOT,
                                "No weights satisfy %s: the smallest achievable excess variance is %.6g",
                                share.name(),
                                smallestExcess),
                        used);
            }
        }

        double[] candidate;
        boolean stalled = false;
        if (objective == OptimizationObjective.MIN_VARIANCE
                && minimumVariance != null
                && problem.quadraticLimitConstraints.isEmpty()) {
            candidate = minimumVariance;
        } else {
            List<InequalityConstraint> constraints = new ArrayList<>(problem.linearConstraints);
            constraints.addAll(problem.quadraticLimitConstraints);
            if (problem.volatilityConstraint != null) {
                constraints.add(problem.volatilityConstraint);
            }
            AugmentedLagrangianSolver.Outcome outcome = solver.solve(
                    problem.objective(objective),
                    constraints,
                    problem.projection,
                    minimumVariance != null ? minimumVariance : start.get(),
                    Math.max(0, budget - used),
                    deadline);
            used += outcome.iterations();
            if (outcome.status() == AugmentedLagrangianSolver.Status.BUDGET_EXHAUSTED
                    || outcome.status() == AugmentedLagrangianSolver.Status.TIMED_OUT) {
                return notConverged(outcome, used, problem, "constrained search");
            }
            stalled = outcome.status() == AugmentedLagrangianSolver.Status.STALLED;
            candidate = outcome.weights();
        }

        if (minimumVariance != null && problem.volatilityConstraint.violation(candidate) > 0.0) {
            candidate = restoreVolatility(candidate, minimumVariance, problem);
        }

        return finish(candidate, used, problem, inputs, effectiveLimits, objective, stalled ? "stalled search" : "search");
    }

    // ==============================
    // PROBLEM CONSTRUCTION
    // ==============================

    private Problem buildProblem(
            List<String> universe,
            PipelineInputs inputs,
            OptimizationObjective objective,
            RiskLimitSet limits,
            OptimizationOptions options,
            Portfolio portfolio) {
        int n = universe.size();
        FactorCovariance factorCovariance = inputs.getFactorCovariance();
        List<String> factors = factorCovariance.getFactors();
        FactorBetaMatrix betas = FactorBetaMatrix.of(universe, factors, inputs.getExposures());

        RealMatrix b = betas.betaMatrix();
        RealMatrix sigmaF = factorCovariance.covarianceMatrix();
        double[][] factorPart = b.multiply(sigmaF).multiply(b.transpose()).getData();
        double[][] sigma = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                sigma[i][j] = factorPart[i][j];
            }
            sigma[i][i] += betas.residualVariance(i);
        }

        double[] lower = new double[n];
        double[] upper = new double[n];
        double lowerBound = options.isAllowShort()
                ? (options.getMinWeight() != null ? options.getMinWeight() : DEFAULT_SHORT_BOUND)
                : Math.max(0.0, options.getMinWeight() != null ? options.getMinWeight() : 0.0);
        double upperBound = options.getMaxWeight() != null ? options.getMaxWeight() : Double.POSITIVE_INFINITY;
        if (limits.getMaxSingleHoldingWeight() != null) {
            upperBound = Math.min(upperBound, limits.getMaxSingleHoldingWeight());
            lowerBound = Math.max(lowerBound, -limits.getMaxSingleHoldingWeight());
        }
        double lowerSum = lowerBound * n;
        for (int i = 0; i < n; i++) {
            lower[i] = lowerBound;
            // Σw = 1 caps each weight at 1 minus everyone else's lower bound.
            upper[i] = Math.min(upperBound, 1.0 - (lowerSum - lowerBound));
        }

        Problem problem = new Problem(universe, sigma, lower, upper);

        if (limits.getMaxSingleFactorLoss() != null) {
            double maxLoss = limits.getSingleFactorLossMagnitude() * (1.0 - CONSTRAINT_MARGIN);
            for (int f = 0; f < factors.size(); f++) {
                double crash = properties.getModel().crashMoveFor(factors.get(f));
                if (crash <= 0.0) {
                    continue;
                }
                double[] column = b.getColumn(f);
                double[] negated = new double[n];
                for (int i = 0; i < n; i++) {
                    negated[i] = -column[i];
                }
                double bound = maxLoss / crash;
                String name = LimitsComplianceChecker.MAX_SINGLE_FACTOR_LOSS + ":" + factors.get(f);
                problem.addLinear(name + ":upper", column, bound);
                problem.addLinear(name + ":lower", negated, bound);
            }
        }

        if (limits.getMaxVolatility() != null) {
            double target = limits.getMaxVolatility() * (1.0 - CONSTRAINT_MARGIN);
            problem.volatilityConstraint = new InequalityConstraint(
                    LimitsComplianceChecker.MAX_VOLATILITY,
                    QuadraticForm.quadratic(sigma, -target * target),
                    false);
        }

        if (limits.getMaxFactorVarianceShare() != null) {
            double share = limits.getMaxFactorVarianceShare() * (1.0 - CONSTRAINT_MARGIN);
            double[][] f = sigmaF.getData();
            for (int factor = 0; factor < factors.size(); factor++) {
                double[][] m = new double[factors.size()][factors.size()];
                for (int j = 0; j < factors.size(); j++) {
                    m[factor][j] += 0.5 * f[factor][j];
                    m[j][factor] += 0.5 * f[j][factor];
                }
                double[][] q = b.multiply(MatrixUtils.createRealMatrix(m))
                        .multiply(b.transpose())
                        .getData();
                problem.quadraticLimitConstraints.add(new InequalityConstraint(
                        LimitsComplianceChecker.MAX_FACTOR_VARIANCE_SHARE + ":" + factors.get(factor),
                        QuadraticForm.quadratic(subtractScaled(q, share, sigma), 0.0),
                        false));
            }
        }

        if (limits.getMaxTotalFactorVarianceShare() != null) {
            double share = limits.getMaxTotalFactorVarianceShare() * (1.0 - CONSTRAINT_MARGIN);
            problem.quadraticLimitConstraints.add(new InequalityConstraint(
                    LimitsComplianceChecker.MAX_TOTAL_FACTOR_VARIANCE_SHARE,
                    QuadraticForm.quadratic(subtractScaled(factorPart, share, sigma), 0.0),
                    false));
        }

        if (options.isAllowShort() && limits.getMaxLeverage() != null) {
            problem.quadraticLimitConstraints.add(new InequalityConstraint(
                    LimitsComplianceChecker.MAX_LEVERAGE,
                    new SmoothLeverage(limits.getMaxLeverage() * (1.0 - CONSTRAINT_MARGIN)),
                    false));
        }

        if (objective == OptimizationObjective.MAX_RETURN) {
            problem.expectedReturns = expectedReturns(universe, inputs, options, portfolio);
        }
        return problem;
    }

    private double[] expectedReturns(
            List<String> universe, PipelineInputs inputs, OptimizationOptions options, Portfolio portfolio) {
        Map<String, Double> supplied = new LinkedHashMap<>();
        options.getExpectedReturns().forEach((ticker, value) -> supplied.put(ticker.trim().toUpperCase(), value));
        double[] mu = new double[universe.size()];
        for (int i = 0; i < universe.size(); i++) {
            String ticker = universe.get(i);
            if (supplied.containsKey(ticker)) {
                mu[i] = supplied.get(ticker);
            } else if (ticker.startsWith(Holding.CASH_PREFIX)) {
                mu[i] = 0.0;
            } else {
                mu[i] = factorExposureEstimator.expectedReturn(ticker, inputs.getWindow());
            }
        }
        log.debug("Expected returns for {}: {}", portfolio.getName(), mu);
        return mu;
    }

    private static RiskLimitSet withCallerLeverage(RiskLimitSet limits, Double callerLeverage) {
        if (callerLeverage == null) {
            return limits;
        }
        double leverage = limits.getMaxLeverage() != null
                ? Math.min(limits.getMaxLeverage(), callerLeverage)
                : callerLeverage;
        return limits.toBuilder().maxLeverage(leverage).build();
    }

    private static double[][] subtractScaled(double[][] a, double scale, double[][] b) {
        double[][] result = new double[a.length][a.length];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < a.length; j++) {
                result[i][j] = a[i][j] - scale * b[i][j];
            }
        }
        return result;
    }

    // ==============================
    // FINISHING
    // ==============================

    /**
     * Moves a candidate that breaks only the volatility limit toward the minimum-variance point
     * along the segment between them. Both endpoints satisfy the linear constraints, so every
     * point on the segment does too; variance is convex along it, so bisection finds the first
     * point back inside the tightened limit.
     */
    private static double[] restoreVolatility(double[] candidate, double[] minimumVariance, Problem problem) {
        InequalityConstraint volatility = problem.volatilityConstraint;
        if (volatility.violation(minimumVariance) > 0.0) {
            return candidate;
        }
        double low = 0.0;
        double high = 1.0;
        for (int i = 0; i < 100; i++) {
            double mid = 0.5 * (low + high);
            if (volatility.violation(blend(candidate, minimumVariance, mid)) > 0.0) {
                low = mid;
            } else {
                high = mid;
            }
        }
        log.debug("Restored volatility feasibility at blend factor {}", high);
        return blend(candidate, minimumVariance, high);
    }

    private static double[] blend(double[] from, double[] to, double t) {
        double[] result = new double[from.length];
        for (int i = 0; i < from.length; i++) {
            result[i] = (1.0 - t) * from[i] + t * to[i];
        }
        return result;
    }

    private OptimizationResult finish(
            double[] weights,
            int iterations,
            Problem problem,
            PipelineInputs inputs,
            RiskLimitSet limits,
            OptimizationObjective objective,
            String method) {
        Map<String, Double> weightMap = problem.toWeightMap(weights);
        Map<String, FactorExposure> exposures = inputs.getExposures();
        ModelEvaluation evaluation =
                riskAnalysisPipeline.evaluate(weightMap, exposures, inputs.getFactorCovariance());
        List<LimitVerdict> verdicts = limitsComplianceChecker.check(evaluation.getMetrics(), limits);
        double volatility = evaluation.getDecomposition().getVolatility();

        List<LimitVerdict> failed = verdicts.stream().filter(LimitVerdict::isFailed).collect(Collectors.toList());
        boolean inBox = problem.projection.contains(weights, BOX_TOLERANCE);
        if (!failed.isEmpty() || !inBox) {
            String reason = !failed.isEmpty()
                    ? "Final candidate violates " + failed.stream()
                            .map(LimitVerdict::getRuleName)
                            .collect(Collectors.joining(", "))
                    : "Final candidate is outside the weight bounds";
            log.warn("Optimizer {} did not produce a compliant portfolio: {}", method, reason);
            return OptimizationResult.didNotConverge(reason, weightMap, volatility, iterations, verdicts);
        }

        Double expectedReturn = problem.expectedReturns != null ? dot(problem.expectedReturns, weights) : null;
        double objectiveValue = objective == OptimizationObjective.MAX_RETURN
                ? expectedReturn
                : evaluation.getDecomposition().getTotalVariance();
        log.info(
                "Optimizer ({}, {}) found a compliant portfolio in {} iterations: volatility {}, objective {}",
                objective,
                method,
                iterations,
                volatility,
                objectiveValue);
        return OptimizationResult.feasible(weightMap, objectiveValue, expectedReturn, volatility, iterations, verdicts);
    }

    private static OptimizationResult notConverged(
            AugmentedLagrangianSolver.Outcome outcome, int used, Problem problem, String phase) {
        String reason = outcome.status() == AugmentedLagrangianSolver.Status.TIMED_OUT
                ? "Timed out during " + phase + " after " + used + " iterations"
                : phase + " did not converge within " + used + " iterations";
        log.warn("Optimizer stopped: {}", reason);
        double[] weights = outcome.weights();
        return OptimizationResult.didNotConverge(
                reason, problem.toWeightMap(weights), Math.sqrt(Math.max(0.0, problem.variance(weights))), used, List.of());
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    /**
     * Numeric form of one optimization problem over a fixed universe.
     */
    private static final class Problem {

        private final List<String> universe;
        private final double[][] sigma;
        private final double[] lower;
        private final double[] upper;
        private final BoxSumProjection projection;
        private final List<double[]> linearRows = new ArrayList<>();
        private final List<Double> linearBounds = new ArrayList<>();
        private final List<InequalityConstraint> linearConstraints = new ArrayList<>();
        private final List<InequalityConstraint> quadraticLimitConstraints = new ArrayList<>();
        private InequalityConstraint volatilityConstraint;
        private double[] expectedReturns;

        Problem(List<String> universe, double[][] sigma, double[] lower, double[] upper) {
            this.universe = universe;
            this.sigma = sigma;
            this.lower = lower;
            this.upper = upper;
            this.projection = new BoxSumProjection(lower, upper);
        }

        void addLinear(String name, double[] coefficients, double bound) {
            linearRows.add(coefficients);
            linearBounds.add(bound);
            linearConstraints.add(new InequalityConstraint(name, QuadraticForm.linear(coefficients, -bound), true));
        }

        /** Variance-share limits, as homogeneous quadratics over the weights. */
        List<InequalityConstraint> shareConstraints() {
            return quadraticLimitConstraints.stream()
                    .filter(constraint -> constraint.function() instanceof QuadraticForm)
                    .collect(Collectors.toList());
        }

        boolean hasNonlinearConstraints() {
            return volatilityConstraint != null || !quadraticLimitConstraints.isEmpty();
        }

        Optional<String> boxInfeasibility() {
            double lowerSum = 0.0;
            double upperSum = 0.0;
            for (int i = 0; i < lower.length; i++) {
                if (lower[i] > upper[i]) {
                    return Optional.of("Lower weight bound " + lower[i] + " exceeds upper bound " + upper[i]
                            + " for " + universe.get(i));
                }
                lowerSum += lower[i];
                upperSum += upper[i];
            }
            if (lowerSum > 1.0 + BOX_TOLERANCE || upperSum < 1.0 - BOX_TOLERANCE) {
                return Optional.of(String.format(
                        Locale.ROOT,
                        "Weight bounds cannot sum to 1: %d holdings with bounds summing to [%.6f, %.6f]",
                        universe.size(),
                        lowerSum,
                        upperSum));
            }
            return Optional.empty();
        }

        LinearProgram linearProgram() {
            LinearProgram program = new LinearProgram(lower, upper);
            for (int i = 0; i < linearRows.size(); i++) {
                program.lessOrEqual(linearRows.get(i), linearBounds.get(i));
            }
            return program;
        }

        SmoothFunction varianceObjective() {
            return QuadraticForm.quadratic(sigma, 0.0);
        }

        SmoothFunction objective(OptimizationObjective objective) {
            if (objective == OptimizationObjective.MAX_RETURN) {
                double[] negated = new double[expectedReturns.length];
                for (int i = 0; i < negated.length; i++) {
                    negated[i] = -expectedReturns[i];
                }
                return QuadraticForm.linear(negated, 0.0);
            }
            return varianceObjective();
        }

        double variance(double[] w) {
            return QuadraticForm.quadratic(sigma, 0.0).value(w);
        }

        Map<String, Double> toWeightMap(double[] w) {
            Map<String, Double> weights = new LinkedHashMap<>();
            for (int i = 0; i < universe.size(); i++) {
                double weight = Math.abs(w[i]) < 1e-12 ? 0.0 : w[i];
                weights.put(universe.get(i), weight);
            }
            return weights;
        }
    }
}
