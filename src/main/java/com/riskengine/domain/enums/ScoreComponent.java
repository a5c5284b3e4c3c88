package com.riskengine.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Sub-scores combined into the overall risk score, with their fixed weights.
 */
@Getter
@RequiredArgsConstructor
public enum ScoreComponent {
    FACTOR_CONCENTRATION(0.30),
    CONCENTRATION(0.30),
    VOLATILITY(0.20),
    COMPLIANCE(0.20);

    private final double weight;
}
