package com.riskengine.exception;

import java.util.Map;

/**
 * Thrown by a {@link com.riskengine.marketdata.MarketDataProvider} when it has no data for
 * a ticker in the requested range.
 */
public class DataUnavailableException extends BaseException {

    public DataUnavailableException(String message) {
        super(ErrorCode.DATA_UNAVAILABLE, message);
    }

    public DataUnavailableException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_UNAVAILABLE, message, details);
    }
}
