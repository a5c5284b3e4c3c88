package com.riskengine.risk;

import com.riskengine.config.RiskEngineProperties;
import com.riskengine.domain.enums.RiskCategory;
import com.riskengine.domain.enums.ScoreComponent;
import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.RiskAnalysisResult;
import com.riskengine.domain.model.RiskScoreResult;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a {@link RiskAnalysisResult} to a 0-100 score where higher is safer.
 *
 * <p>Each sub-score runs a metric/target ratio through {@link #excessRatioScore(double)}:
 * <ul>
 *   <li>VOLATILITY: volatility / max volatility (or the configured default target)</li>
 *   <li>CONCENTRATION: largest absolute weight / max single-holding weight (or default)</li>
 *   <li>FACTOR_CONCENTRATION: largest single-factor variance share / max factor share (or default)</li>
 * </ul>
 * COMPLIANCE is 100 minus 25 per failed verdict, floored at 0.
 *
 * <p>The overall score is the {@link ScoreComponent} weighted sum, rounded to one decimal.
 * Recommendations are picked from a fixed table by the worst sub-score and by each failed rule.
 * The result depends only on the analysis result and the configured defaults.
 *
 * <p>{@link #suggestLimits} works the other way: from a maximum acceptable loss back to the
 * thresholds that would keep each crash scenario within it.
 */
@Component
public class RiskScorer {

    private static final Logger log = LoggerFactory.getLogger(RiskScorer.class);

    static final double COMPLIANCE_PENALTY_PER_VIOLATION = 25.0;
    static final double MIN_SUGGESTION_LOSS = 0.01;

    private final RiskEngineProperties.Scoring scoring;
    private final RiskEngineProperties.Model model;

    public RiskScorer(RiskEngineProperties properties) {
        this.scoring = properties.getScoring();
        this.model = properties.getModel();
    }

    public RiskScoreResult score(RiskAnalysisResult result) {
        RiskLimitSet limits = result.getLimits() != null ? result.getLimits() : RiskLimitSet.none();
        RiskMetrics metrics = result.toRiskMetrics();

        double volatilityTarget = orDefault(limits.getMaxVolatility(), scoring.getDefaultVolatilityTarget());
        double weightTarget = orDefault(limits.getMaxSingleHoldingWeight(), scoring.getDefaultMaxHoldingWeight());
        double factorTarget =
                orDefault(limits.getMaxFactorVarianceShare(), scoring.getDefaultMaxFactorVarianceShare());
        int violations = result.getFailedVerdicts().size();

        Map<ScoreComponent, Double> subScores = new EnumMap<>(ScoreComponent.class);
        subScores.put(
                ScoreComponent.FACTOR_CONCENTRATION,
                excessRatioScore(ratio(metrics.maxFactorVarianceShare(), factorTarget)));
        subScores.put(ScoreComponent.CONCENTRATION, excessRatioScore(ratio(metrics.maxAbsoluteWeight(), weightTarget)));
        subScores.put(ScoreComponent.VOLATILITY, excessRatioScore(ratio(metrics.getVolatility(), volatilityTarget)));
        subScores.put(
                ScoreComponent.COMPLIANCE, Math.max(0.0, 100.0 - COMPLIANCE_PENALTY_PER_VIOLATION * violations));

        double overall = 0.0;
        for (Map.Entry<ScoreComponent, Double> entry : subScores.entrySet()) {
            overall += entry.getKey().getWeight() * entry.getValue();
        }
        overall = Math.round(overall * 10.0) / 10.0;
        RiskCategory category = RiskCategory.fromScore(overall);

        return RiskScoreResult.builder()
                .overallScore(overall)
                .subScores(subScores)
                .category(category)
                .recommendations(recommendations(result, metrics, subScores, volatilityTarget, weightTarget))
                .interpretation(category.getInterpretation())
                .build();
    }

    /**
     * Piecewise-linear, non-increasing map from metric/target ratio to score:
     * ≤ 0.8 scores 100, 1.0 scores 75, 1.5 scores 50, ≥ 2.0 scores 0, linear in between.
     */
    public static double excessRatioScore(double ratio) {
        if (ratio <= 0.8) {
            return 100.0;
        }
        if (ratio <= 1.0) {
            return 100.0 - (ratio - 0.8) / 0.2 * 25.0;
        }
        if (ratio <= 1.5) {
            return 75.0 - (ratio - 1.0) / 0.5 * 25.0;
        }
        if (ratio < 2.0) {
            return 50.0 - (ratio - 1.5) / 0.5 * 50.0;
        }
        return 0.0;
    }

    // ==============================
    // SUGGESTED LIMITS
    // ==============================

    public SuggestedRiskLimits suggestLimits(RiskAnalysisResult result, double maxLoss) {
        return suggestLimits(result, maxLoss, scoring.getFactorLossTolerance());
    }

    /**
     * Suggests limits under which no single crash scenario costs more than {@code maxLoss}.
     *
     * <p>Weights already carry leverage, so volatility, holding weight and factor losses are
     * capped at the loss tolerance directly:
     * <ul>
     *   <li>maxVolatility = maxLoss</li>
     *   <li>maxSingleHoldingWeight = maxLoss / single-stock crash move</li>
     *   <li>maxSingleFactorLoss = maxLoss; beta caps are maxLoss / crash for the market factor
     *       and factorLossTolerance / crash for every other factor</li>
     *   <li>maxLeverage = maxLoss / worst loss per unit of gross exposure, unset when no scenario
     *       loses anything</li>
     * </ul>
     * Variance-share limits are not derived from losses and stay unset.
     *
     * @param maxLoss positive fraction of portfolio value; non-positive values are clamped to 1%
     */
    public SuggestedRiskLimits suggestLimits(RiskAnalysisResult result, double maxLoss, double factorLossTolerance) {
        if (!(maxLoss > 0.0)) {
            log.warn("Non-positive max loss {} clamped to {} for limit suggestions", maxLoss, MIN_SUGGESTION_LOSS);
            maxLoss = MIN_SUGGESTION_LOSS;
        }
        double tolerance = Math.abs(factorLossTolerance);
        double leverage = result.getLeverage();
        if (!(leverage > 0.0)) {
            log.warn("Portfolio has no gross exposure; suggesting limits for leverage 1.0");
            leverage = 1.0;
        }

        RiskMetrics metrics = result.toRiskMetrics();
        double stockCrash = scoring.getSingleStockCrashMove();
        List<LimitSuggestion> suggestions = new ArrayList<>();

        for (Map.Entry<String, Double> beta : result.getPortfolioBetas().entrySet()) {
            double crash = model.crashMoveFor(beta.getKey());
            double allowedLoss = FactorProxySet.MARKET.equals(beta.getKey()) ? maxLoss : tolerance;
            suggestions.add(new LimitSuggestion(
                    "beta:" + beta.getKey(), beta.getValue(), crash > 0.0 ? allowedLoss / crash : null));
        }
        suggestions.add(new LimitSuggestion("maxVolatility", metrics.getVolatility(), maxLoss));
        suggestions.add(new LimitSuggestion(
                "maxSingleHoldingWeight", metrics.maxAbsoluteWeight(), maxLoss / stockCrash));
        suggestions.add(new LimitSuggestion("maxSingleFactorLoss", maxStressLoss(metrics), maxLoss));

        double worstLoss = Math.max(
                Math.max(maxStressLoss(metrics), metrics.maxAbsoluteWeight() * stockCrash), metrics.getVolatility());
        double worstUnleveragedLoss = worstLoss / leverage;
        Double suggestedLeverage = worstUnleveragedLoss > 0.0 ? maxLoss / worstUnleveragedLoss : null;
        suggestions.add(new LimitSuggestion("maxLeverage", leverage, suggestedLeverage));

        RiskLimitSet limits = RiskLimitSet.builder()
                .name("suggested")
                .maxVolatility(maxLoss)
                .maxSingleHoldingWeight(maxLoss / stockCrash)
                .maxSingleFactorLoss(maxLoss)
                .maxLeverage(suggestedLeverage)
                .build();
        return SuggestedRiskLimits.builder()
                .maxLoss(maxLoss)
                .factorLossTolerance(tolerance)
                .worstUnleveragedLoss(worstUnleveragedLoss)
                .limits(limits)
                .suggestions(List.copyOf(suggestions))
                .build();
    }

    private static double maxStressLoss(RiskMetrics metrics) {
        double max = 0.0;
        for (double loss : metrics.getFactorStressLosses().values()) {
            max = Math.max(max, loss);
        }
        return max;
    }

    // ==============================
    // RECOMMENDATIONS
    // ==============================

    private List<String> recommendations(
            RiskAnalysisResult result,
            RiskMetrics metrics,
            Map<ScoreComponent, Double> subScores,
            double volatilityTarget,
            double weightTarget) {
        Set<String> recommendations = new LinkedHashSet<>();

        ScoreComponent worst = null;
        for (Map.Entry<ScoreComponent, Double> entry : subScores.entrySet()) {
            if (worst == null || entry.getValue() < subScores.get(worst)) {
                worst = entry.getKey();
            }
        }
        if (worst != null && subScores.get(worst) < 100.0) {
            recommendations.add(forWorstComponent(worst, result, metrics, volatilityTarget, weightTarget));
        }

        for (LimitVerdict verdict : result.getFailedVerdicts()) {
            recommendations.add(forFailedRule(verdict));
        }

        if (recommendations.isEmpty()) {
            recommendations.add("Portfolio is within all configured risk limits; no changes required.");
        }
        return new ArrayList<>(recommendations);
    }

    private String forWorstComponent(
            ScoreComponent component,
            RiskAnalysisResult result,
            RiskMetrics metrics,
            double volatilityTarget,
            double weightTarget) {
        return switch (component) {
            case VOLATILITY -> format(
                    "Reduce portfolio volatility (%.1f%% vs a %.1f%% target) by shifting weight toward"
                            + " lower-volatility holdings or cash.",
                    pct(metrics.getVolatility()),
                    pct(volatilityTarget));
            case CONCENTRATION -> format(
                    "Reduce the largest position %s (%.1f%% of the portfolio) toward %.1f%%.",
                    largestHolding(metrics.getWeights()),
                    pct(metrics.maxAbsoluteWeight()),
                    pct(weightTarget));
            case FACTOR_CONCENTRATION -> format(
                    "Diversify factor exposure: %s drives %.1f%% of portfolio variance.",
                    largestKey(metrics.getFactorVarianceShares()),
                    pct(metrics.maxFactorVarianceShare()));
            case COMPLIANCE -> format(
                    "Resolve %d risk limit violation(s) before adding new positions.",
                    result.getFailedVerdicts().size());
        };
    }

    private String forFailedRule(LimitVerdict verdict) {
        String factor = factorOf(verdict.getRuleName());
        return switch (verdict.getRuleType()) {
            case LimitsComplianceChecker.MAX_VOLATILITY -> format(
                    "Portfolio volatility %.1f%% exceeds the %.1f%% limit.",
                    pct(verdict.getCurrentValue()),
                    pct(verdict.getLimitValue()));
            case LimitsComplianceChecker.MAX_SINGLE_HOLDING_WEIGHT -> format(
                    "Largest holding weight %.1f%% exceeds the %.1f%% limit; trim the position.",
                    pct(verdict.getCurrentValue()),
                    pct(verdict.getLimitValue()));
            case LimitsComplianceChecker.MAX_FACTOR_VARIANCE_SHARE -> format(
                    "The %s factor explains %.1f%% of variance, above the %.1f%% limit; hedge or reduce %s exposure.",
                    factor,
                    pct(verdict.getCurrentValue()),
                    pct(verdict.getLimitValue()),
                    factor);
            case LimitsComplianceChecker.MAX_TOTAL_FACTOR_VARIANCE_SHARE -> format(
                    "Systematic risk is %.1f%% of variance, above the %.1f%% limit; hedge factor exposure.",
                    pct(verdict.getCurrentValue()),
                    pct(verdict.getLimitValue()));
            case LimitsComplianceChecker.MAX_SINGLE_FACTOR_LOSS -> format(
                    "A %s crash would cost %.1f%% of portfolio value, above the %.1f%% limit; reduce %s beta.",
                    factor,
                    pct(verdict.getCurrentValue()),
                    pct(verdict.getLimitValue()),
                    factor);
            case LimitsComplianceChecker.MAX_LEVERAGE -> format(
                    "Leverage %.2fx exceeds the %.2fx limit; reduce gross exposure.",
                    verdict.getCurrentValue(),
                    verdict.getLimitValue());
            default -> format("Rule %s failed.", verdict.getRuleName());
        };
    }

    private static String largestHolding(Map<String, Double> weights) {
        String largest = "n/a";
        double max = -1.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (Math.abs(entry.getValue()) > max) {
                max = Math.abs(entry.getValue());
                largest = entry.getKey();
            }
        }
        return largest;
    }

    private static String largestKey(Map<String, Double> values) {
        String largest = "n/a";
        double max = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (entry.getValue() > max) {
                max = entry.getValue();
                largest = entry.getKey();
            }
        }
        return largest;
    }

    private static String factorOf(String ruleName) {
        int separator = ruleName.indexOf(':');
        return separator < 0 ? "" : ruleName.substring(separator + 1);
    }

    private static double ratio(double value, double target) {
        return target > 0.0 ? value / target : (value > 0.0 ? Double.POSITIVE_INFINITY : 0.0);
    }

    private static double orDefault(Double limit, double fallback) {
        return limit != null ? limit : fallback;
    }

    private static double pct(double fraction) {
        return fraction * 100.0;
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
