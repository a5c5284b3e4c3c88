package com.riskengine.domain.model;

import com.riskengine.domain.enums.OptimizationStatus;
import com.riskengine.exception.OptimizationInfeasibleException;
import com.riskengine.exception.SolverDidNotConvergeException;
import com.riskengine.risk.LimitVerdict;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * Tagged optimizer outcome.
 *
 * <ul>
 *   <li>FEASIBLE: weights satisfy every configured limit, verified by re-running the limits
 *       checker on the final candidate.</li>
 *   <li>INFEASIBLE: no weight vector in the universe can satisfy the constraints. No weights.</li>
 *   <li>DID_NOT_CONVERGE: iteration or time budget ran out, or the final check failed. May carry
 *       the best candidate found, which is never authoritative.</li>
 * </ul>
 *
 * <p>Callers branch on {@link #getStatus()}; {@link #requireFeasible()} is available for
 * callers that prefer exceptions.
 */
@Getter
public class OptimizationResult {

    private final OptimizationStatus status;
    private final Map<String, Double> weights;
    private final boolean authoritative;
    private final Double objectiveValue;
    private final Double expectedReturn;
    private final Double volatility;
    private final int iterations;
    private final List<LimitVerdict> verdicts;
    private final String reason;

    @Builder(access = AccessLevel.PRIVATE)
    private OptimizationResult(
            OptimizationStatus status,
            Map<String, Double> weights,
            boolean authoritative,
            Double objectiveValue,
            Double expectedReturn,
            Double volatility,
            int iterations,
            List<LimitVerdict> verdicts,
            String reason) {
        this.status = status;
        this.weights = weights != null ? Collections.unmodifiableMap(new LinkedHashMap<>(weights)) : Map.of();
        this.authoritative = authoritative;
        this.objectiveValue = objectiveValue;
        this.expectedReturn = expectedReturn;
        this.volatility = volatility;
        this.iterations = iterations;
        this.verdicts = verdicts != null ? List.copyOf(verdicts) : List.of();
        this.reason = reason;
    }

    public static OptimizationResult feasible(
            Map<String, Double> weights,
            double objectiveValue,
            Double expectedReturn,
            double volatility,
            int iterations,
            List<LimitVerdict> verdicts) {
        return OptimizationResult.builder()
                .status(OptimizationStatus.FEASIBLE)
                .weights(new LinkedHashMap<>(weights))
                .authoritative(true)
                .objectiveValue(objectiveValue)
                .expectedReturn(expectedReturn)
                .volatility(volatility)
                .iterations(iterations)
                .verdicts(verdicts)
                .build();
    }

    public static OptimizationResult infeasible(String reason, int iterations) {
        return OptimizationResult.builder()
                .status(OptimizationStatus.INFEASIBLE)
                .authoritative(false)
                .iterations(iterations)
                .reason(reason)
                .build();
    }

    /**
     * @param bestCandidate best weights found so far, or null if none; never authoritative
     */
    public static OptimizationResult didNotConverge(
            String reason,
            Map<String, Double> bestCandidate,
            Double volatility,
            int iterations,
            List<LimitVerdict> verdicts) {
        return OptimizationResult.builder()
                .status(OptimizationStatus.DID_NOT_CONVERGE)
                .weights(bestCandidate)
                .authoritative(false)
                .volatility(volatility)
                .iterations(iterations)
                .verdicts(verdicts)
                .reason(reason)
                .build();
    }

    public boolean isFeasible() {
        return status == OptimizationStatus.FEASIBLE;
    }

    /**
     * Returns the weights if FEASIBLE, otherwise throws the matching exception.
     */
    public Map<String, Double> requireFeasible() {
        switch (status) {
            case FEASIBLE:
                return weights;
            case INFEASIBLE:
                throw new OptimizationInfeasibleException(reason, Map.of("iterations", iterations));
            default:
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("iterations", iterations);
                details.put("bestCandidate", weights);
                details.put("authoritative", false);
                throw new SolverDidNotConvergeException(reason, details);
        }
    }
}
