package com.riskengine.risk;

import com.riskengine.domain.enums.LimitStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one configured limit against the computed metric. FAIL iff the current value is
 * strictly greater than the limit, with no tolerance band.
 */
@Value
@Builder
public class LimitVerdict {

    /** Machine-readable rule name, e.g. {@code max_volatility} or {@code max_factor_variance_share:market}. */
    String ruleName;

    double currentValue;
    double limitValue;
    LimitStatus status;

    public static LimitVerdict evaluate(String ruleName, double currentValue, double limitValue) {
        return LimitVerdict.builder()
                .ruleName(ruleName)
                .currentValue(currentValue)
                .limitValue(limitValue)
                .status(currentValue > limitValue ? LimitStatus.FAIL : LimitStatus.PASS)
                .build();
    }

    public boolean isFailed() {
        return status == LimitStatus.FAIL;
    }

    /** Rule name without the per-factor suffix. */
    public String getRuleType() {
        int separator = ruleName.indexOf(':');
        return separator < 0 ? ruleName : ruleName.substring(0, separator);
    }

    @Override
    public String toString() {
        return ruleName + ": " + status + " (" + currentValue + " vs " + limitValue + ")";
    }
}
