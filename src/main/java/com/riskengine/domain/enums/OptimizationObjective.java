package com.riskengine.domain.enums;

public enum OptimizationObjective {
    /** Minimize model variance wᵗΣw. */
    MIN_VARIANCE,

    /** Maximize expected return μᵗw. */
    MAX_RETURN
}
