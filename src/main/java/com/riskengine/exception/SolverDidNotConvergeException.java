package com.riskengine.exception;

import java.util.Map;

/**
 * The optimizer exhausted its iteration or time budget. The best candidate found is attached
 * to the details under {@code bestCandidate} and must not be treated as compliant.
 */
public class SolverDidNotConvergeException extends BaseException {

    public SolverDidNotConvergeException(String message, Map<String, Object> details) {
        super(ErrorCode.SOLVER_DID_NOT_CONVERGE, message, details);
    }
}
