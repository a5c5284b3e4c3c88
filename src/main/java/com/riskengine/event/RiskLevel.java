package com.riskengine.event;

/**
 * Severity of a {@link LimitBreachEvent}.
 */
public enum RiskLevel {

    /** One or more non-volatility limits failed. */
    WARNING,

    /** Portfolio volatility is above its limit. */
    CRITICAL
}
