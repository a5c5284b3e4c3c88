package com.riskengine.domain.model;

import com.riskengine.risk.LimitVerdict;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/**
 * Before/after comparison of a portfolio and a {@link ScenarioChange} applied to it. Both sides
 * are full analyses under the same proxy set and limits; deltas are scenario minus current.
 */
@Value
@Builder
public class WhatIfResult {

    String scenarioName;
    RiskAnalysisResult current;
    RiskAnalysisResult scenario;
    RiskScoreResult currentScore;
    RiskScoreResult scenarioScore;

    public double getVolatilityDelta() {
        return scenario.getVolatility() - current.getVolatility();
    }

    /** Change in Σw², the Herfindahl concentration index. */
    public double getConcentrationDelta() {
        return scenario.getDecomposition().getHerfindahlIndex() - current.getDecomposition().getHerfindahlIndex();
    }

    public double getFactorVarianceShareDelta() {
        return scenario.getDecomposition().factorShare() - current.getDecomposition().factorShare();
    }

    public double getScoreDelta() {
        return scenarioScore.getOverallScore() - currentScore.getOverallScore();
    }

    public boolean isRiskImprovement() {
        return getVolatilityDelta() < 0.0;
    }

    public boolean isConcentrationImprovement() {
        return getConcentrationDelta() < 0.0;
    }

    /** Per-ticker weight change over the union of both ticker sets. */
    public Map<String, Double> weightDeltas() {
        return deltas(current.getWeights(), scenario.getWeights());
    }

    /** Per-factor portfolio beta change. */
    public Map<String, Double> betaDeltas() {
        return deltas(current.getPortfolioBetas(), scenario.getPortfolioBetas());
    }

    /** Rules that pass (or are absent) today but fail under the scenario. */
    public List<String> newViolations() {
        Set<String> before = failedRules(current);
        return failedRules(scenario).stream().filter(rule -> !before.contains(rule)).collect(Collectors.toList());
    }

    /** Rules that fail today and pass under the scenario. */
    public List<String> resolvedViolations() {
        Set<String> after = failedRules(scenario);
        return failedRules(current).stream().filter(rule -> !after.contains(rule)).collect(Collectors.toList());
    }

    private static Map<String, Double> deltas(Map<String, Double> before, Map<String, Double> after) {
        Set<String> keys = new LinkedHashSet<>(before.keySet());
        keys.addAll(after.keySet());
        Map<String, Double> result = new LinkedHashMap<>();
        for (String key : keys) {
            result.put(key, after.getOrDefault(key, 0.0) - before.getOrDefault(key, 0.0));
        }
        return Collections.unmodifiableMap(result);
    }

    private static Set<String> failedRules(RiskAnalysisResult result) {
        return result.getFailedVerdicts().stream()
                .map(LimitVerdict::getRuleName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
