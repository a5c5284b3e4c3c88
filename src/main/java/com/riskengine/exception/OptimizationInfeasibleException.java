package com.riskengine.exception;

import java.util.Map;

public class OptimizationInfeasibleException extends BaseException {

    public OptimizationInfeasibleException(String message, Map<String, Object> details) {
        super(ErrorCode.OPTIMIZATION_INFEASIBLE, message, details);
    }
}
