package com.riskengine.risk;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/**
 * Limits worked backwards from a maximum acceptable loss, for the current portfolio structure.
 */
@Value
@Builder
public class SuggestedRiskLimits {

    double maxLoss;
    double factorLossTolerance;

    /** Largest stress loss per unit of gross exposure across the crash scenarios. */
    double worstUnleveragedLoss;

    RiskLimitSet limits;
    List<LimitSuggestion> suggestions;

    public List<LimitSuggestion> getReductionsNeeded() {
        return suggestions.stream().filter(LimitSuggestion::isReductionNeeded).collect(Collectors.toList());
    }
}
