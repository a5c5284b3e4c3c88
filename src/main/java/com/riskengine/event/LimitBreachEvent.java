package com.riskengine.event;

import com.riskengine.cache.PipelineFingerprint;
import com.riskengine.risk.LimitVerdict;
import com.riskengine.risk.LimitsComplianceChecker;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per freshly computed analysis whose compliance check has at least one FAIL.
 * Cache hits do not republish.
 *
 * <p>Listeners (alerting, dashboards) receive the failing verdicts only.
 */
public class LimitBreachEvent extends ApplicationEvent {

    private final PipelineFingerprint fingerprint;
    private final List<LimitVerdict> failedVerdicts;
    private final RiskLevel level;

    public LimitBreachEvent(Object source, PipelineFingerprint fingerprint, List<LimitVerdict> failedVerdicts) {
        super(source);
        this.fingerprint = fingerprint;
        this.failedVerdicts = List.copyOf(failedVerdicts);
        this.level = failedVerdicts.stream()
                        .anyMatch(v -> LimitsComplianceChecker.MAX_VOLATILITY.equals(v.getRuleName()))
                ? RiskLevel.CRITICAL
                : RiskLevel.WARNING;
    }

    public PipelineFingerprint getFingerprint() {
        return fingerprint;
    }

    public List<LimitVerdict> getFailedVerdicts() {
        return failedVerdicts;
    }

    public RiskLevel getLevel() {
        return level;
    }
}
