package com.riskengine.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Discrete band of an overall risk score. Higher scores are safer, so LOW risk sits at the top.
 */
@Getter
@RequiredArgsConstructor
public enum RiskCategory {
    LOW(85.0, "Low risk: volatility, concentration and factor exposure are within comfortable bounds."),
    MODERATE(70.0, "Moderate risk: some metrics are approaching their limits and should be monitored."),
    HIGH(50.0, "High risk: one or more metrics exceed their targets; rebalancing is advisable."),
    VERY_HIGH(0.0, "Very high risk: the portfolio is materially outside its risk limits.");

    /** Lowest overall score that still falls in this band. */
    private final double minimumScore;

    private final String interpretation;

    public static RiskCategory fromScore(double score) {
        for (RiskCategory category : values()) {
            if (score >= category.minimumScore) {
                return category;
            }
        }
        return VERY_HIGH;
    }
}
