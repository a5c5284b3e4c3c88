package com.riskengine.observability;

import com.riskengine.domain.enums.OptimizationStatus;
import com.riskengine.event.LimitBreachEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the engine:
 * <ul>
 *   <li><b>riskengine.analysis.computations</b> (counter): pipeline runs that were not served from cache</li>
 *   <li><b>riskengine.cache.hits</b> (counter): analyses served from the result cache</li>
 *   <li><b>riskengine.cache.fallbacks</b> (counter): analyses computed directly after a cache failure</li>
 *   <li><b>riskengine.limit.breaches</b> (counter): fresh analyses with failing verdicts</li>
 *   <li><b>riskengine.optimizer.outcome</b> (counter, tag {@code status}): optimizer results by tag</li>
 *   <li><b>riskengine.analysis.latency</b> (timer): end-to-end pipeline computation time</li>
 * </ul>
 */
@Service
public class RiskEngineMetrics {

    private static final Logger log = LoggerFactory.getLogger(RiskEngineMetrics.class);

    private final Counter computationCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheFallbackCounter;
    private final Counter limitBreachCounter;
    private final Map<OptimizationStatus, Counter> optimizerOutcomeCounters = new EnumMap<>(OptimizationStatus.class);
    private final Timer analysisTimer;

    public RiskEngineMetrics(MeterRegistry meterRegistry) {
        this.computationCounter = Counter.builder("riskengine.analysis.computations")
                .description("Pipeline computations not served from cache")
                .register(meterRegistry);

        this.cacheHitCounter = Counter.builder("riskengine.cache.hits")
                .description("Analyses served from the result cache")
                .register(meterRegistry);

        this.cacheFallbackCounter = Counter.builder("riskengine.cache.fallbacks")
                .description("Analyses computed directly because the result cache failed")
                .register(meterRegistry);

        this.limitBreachCounter = Counter.builder("riskengine.limit.breaches")
                .description("Fresh analyses with at least one failing limit")
                .register(meterRegistry);

        for (OptimizationStatus status : OptimizationStatus.values()) {
            optimizerOutcomeCounters.put(
                    status,
                    Counter.builder("riskengine.optimizer.outcome")
                            .description("Optimizer results by outcome")
                            .tag("status", status.name())
                            .register(meterRegistry));
        }

        this.analysisTimer = Timer.builder("riskengine.analysis.latency")
                .description("Risk analysis pipeline latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
    }

    public void recordComputation(long elapsedNanos) {
        computationCounter.increment();
        analysisTimer.record(Duration.ofNanos(elapsedNanos));
    }

    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    public void recordCacheFallback() {
        cacheFallbackCounter.increment();
    }

    public void recordOptimizerOutcome(OptimizationStatus status) {
        optimizerOutcomeCounters.get(status).increment();
    }

    @EventListener
    public void onLimitBreach(LimitBreachEvent event) {
        limitBreachCounter.increment();
        log.info(
                "Limit breach ({}) for {}: {}",
                event.getLevel(),
                event.getFingerprint(),
                event.getFailedVerdicts());
    }

    public double getComputationCount() {
        return computationCounter.count();
    }

    public double getCacheHitCount() {
        return cacheHitCounter.count();
    }

    public double getCacheFallbackCount() {
        return cacheFallbackCounter.count();
    }

    public double getLimitBreachCount() {
        return limitBreachCounter.count();
    }

    public double getOptimizerOutcomeCount(OptimizationStatus status) {
        return optimizerOutcomeCounters.get(status).count();
    }
}
