package com.riskengine.risk;

import com.riskengine.domain.model.RiskAnalysisResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Compares computed risk metrics against a {@link RiskLimitSet}.
 *
 * <p>Emits one verdict per configured limit, and one per factor for the per-factor limits.
 * Limits left null produce no verdict, so an empty limit set yields an empty list rather than
 * a list of passes. Stateless and side-effect free.
 *
 * <p>Rule names:
 * <ul>
 *   <li>{@code max_volatility}</li>
 *   <li>{@code max_single_holding_weight} (largest absolute weight)</li>
 *   <li>{@code max_factor_variance_share:<factor>}</li>
 *   <li>{@code max_total_factor_variance_share}</li>
 *   <li>{@code max_single_factor_loss:<factor>}</li>
 *   <li>{@code max_leverage}</li>
 * </ul>
 */
@Component
public class LimitsComplianceChecker {

    public static final String MAX_VOLATILITY = "max_volatility";
    public static final String MAX_SINGLE_HOLDING_WEIGHT = "max_single_holding_weight";
    public static final String MAX_FACTOR_VARIANCE_SHARE = "max_factor_variance_share";
    public static final String MAX_TOTAL_FACTOR_VARIANCE_SHARE = "max_total_factor_variance_share";
    public static final String MAX_SINGLE_FACTOR_LOSS = "max_single_factor_loss";
    public static final String MAX_LEVERAGE = "max_leverage";

    public List<LimitVerdict> check(RiskAnalysisResult result, RiskLimitSet limits) {
        return check(result.toRiskMetrics(), limits);
    }

    public List<LimitVerdict> check(RiskMetrics metrics, RiskLimitSet limits) {
        List<LimitVerdict> verdicts = new ArrayList<>();

        if (limits.getMaxVolatility() != null) {
            verdicts.add(LimitVerdict.evaluate(MAX_VOLATILITY, metrics.getVolatility(), limits.getMaxVolatility()));
        }

        if (limits.getMaxSingleHoldingWeight() != null) {
            verdicts.add(LimitVerdict.evaluate(
                    MAX_SINGLE_HOLDING_WEIGHT, metrics.maxAbsoluteWeight(), limits.getMaxSingleHoldingWeight()));
        }

        if (limits.getMaxFactorVarianceShare() != null) {
            for (Map.Entry<String, Double> share : metrics.getFactorVarianceShares().entrySet()) {
                verdicts.add(LimitVerdict.evaluate(
                        MAX_FACTOR_VARIANCE_SHARE + ":" + share.getKey(),
                        share.getValue(),
                        limits.getMaxFactorVarianceShare()));
            }
        }

        if (limits.getMaxTotalFactorVarianceShare() != null) {
            verdicts.add(LimitVerdict.evaluate(
                    MAX_TOTAL_FACTOR_VARIANCE_SHARE,
                    metrics.getTotalFactorVarianceShare(),
                    limits.getMaxTotalFactorVarianceShare()));
        }

        if (limits.getMaxSingleFactorLoss() != null) {
            double limit = limits.getSingleFactorLossMagnitude();
            for (Map.Entry<String, Double> loss : metrics.getFactorStressLosses().entrySet()) {
                verdicts.add(LimitVerdict.evaluate(MAX_SINGLE_FACTOR_LOSS + ":" + loss.getKey(), loss.getValue(), limit));
            }
        }

        if (limits.getMaxLeverage() != null) {
            verdicts.add(LimitVerdict.evaluate(MAX_LEVERAGE, metrics.getLeverage(), limits.getMaxLeverage()));
        }

        return verdicts;
    }
}
