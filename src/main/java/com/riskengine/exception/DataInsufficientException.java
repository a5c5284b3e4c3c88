package com.riskengine.exception;

import java.util.Map;

/**
 * Price or return history is missing, too short, or does not cover the analysis window.
 *
 * <p>Surfaced to the caller as-is; the engine never zero-fills a missing series.
 */
public class DataInsufficientException extends BaseException {

    public DataInsufficientException(String message) {
        super(ErrorCode.DATA_INSUFFICIENT, message);
    }

    public DataInsufficientException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_INSUFFICIENT, message, details);
    }

    public DataInsufficientException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.DATA_INSUFFICIENT, message, details, cause);
    }
}
