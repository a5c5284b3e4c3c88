package com.riskengine.domain.enums;

/**
 * Outcome tag of an optimization run.
 *
 * <p>Only FEASIBLE carries authoritative weights. DID_NOT_CONVERGE may carry a best-effort
 * candidate, which is always marked non-authoritative.
 */
public enum OptimizationStatus {
    FEASIBLE,
    INFEASIBLE,
    DID_NOT_CONVERGE
}
