package com.riskengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 400),
    DATA_INSUFFICIENT("DATA_INSUFFICIENT", 422),
    DATA_UNAVAILABLE("DATA_UNAVAILABLE", 404),
    OPTIMIZATION_INFEASIBLE("OPTIMIZATION_INFEASIBLE", 422),
    SOLVER_DID_NOT_CONVERGE("SOLVER_DID_NOT_CONVERGE", 504),
    CACHE_ERROR("CACHE_ERROR", 503),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
