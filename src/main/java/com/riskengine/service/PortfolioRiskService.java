package com.riskengine.service;

import com.riskengine.cache.AnalysisResultCache;
import com.riskengine.cache.FingerprintGenerator;
import com.riskengine.cache.PipelineFingerprint;
import com.riskengine.domain.enums.OptimizationObjective;
import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.Holding;
import com.riskengine.domain.model.OptimizationOptions;
import com.riskengine.domain.model.OptimizationResult;
import com.riskengine.domain.model.Portfolio;
import com.riskengine.domain.model.RiskAnalysisResult;
import com.riskengine.domain.model.RiskScoreResult;
import com.riskengine.domain.model.ScenarioChange;
import com.riskengine.domain.model.WhatIfResult;
import com.riskengine.event.LimitBreachEvent;
import com.riskengine.exception.CacheException;
import com.riskengine.factor.FactorExposureEstimator;
import com.riskengine.observability.RiskEngineMetrics;
import com.riskengine.optimizer.PortfolioOptimizer;
import com.riskengine.risk.RiskLimitSet;
import com.riskengine.risk.RiskScorer;
import com.riskengine.risk.SuggestedRiskLimits;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry point for risk analysis, scoring, what-if scenarios and optimization.
 *
 * <p>Analysis flow for one call:
 * <ol>
 *   <li>validate the limits and build the {@link PipelineFingerprint}</li>
 *   <li>return a cached or in-flight result for the fingerprint if there is one</li>
 *   <li>otherwise fetch and estimate all inputs, then compute under the cache's single-flight
 *       entry so concurrent callers with the same fingerprint share one computation</li>
 * </ol>
 * A failing cache never fails the analysis: the service logs it and computes directly.
 * Market data I/O happens before the cache entry is installed, so no cache lock is held during
 * I/O.
 *
 * <p>Thread-safe; all collaborators are stateless or internally synchronized.
 */
@Service
public class PortfolioRiskService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioRiskService.class);

    /** Dollar scale for scenario portfolios when the current net value is zero. */
    static final BigDecimal DEFAULT_SCENARIO_NOTIONAL = new BigDecimal("1000000");

    private final RiskAnalysisPipeline riskAnalysisPipeline;
    private final FingerprintGenerator fingerprintGenerator;
    private final AnalysisResultCache analysisResultCache;
    private final RiskScorer riskScorer;
    private final PortfolioOptimizer portfolioOptimizer;
    private final FactorExposureEstimator factorExposureEstimator;
    private final RiskEngineMetrics riskEngineMetrics;
    private final ApplicationEventPublisher eventPublisher;
    private final RiskLimitSet defaultRiskLimits;
    private final FactorProxySet defaultFactorProxySet;

    public PortfolioRiskService(
            RiskAnalysisPipeline riskAnalysisPipeline,
            FingerprintGenerator fingerprintGenerator,
            AnalysisResultCache analysisResultCache,
            RiskScorer riskScorer,
            PortfolioOptimizer portfolioOptimizer,
            FactorExposureEstimator factorExposureEstimator,
            RiskEngineMetrics riskEngineMetrics,
            ApplicationEventPublisher eventPublisher,
            @Qualifier("defaultRiskLimits") RiskLimitSet defaultRiskLimits,
            @Qualifier("defaultFactorProxySet") FactorProxySet defaultFactorProxySet) {
        this.riskAnalysisPipeline = riskAnalysisPipeline;
        this.fingerprintGenerator = fingerprintGenerator;
        this.analysisResultCache = analysisResultCache;
        this.riskScorer = riskScorer;
        this.portfolioOptimizer = portfolioOptimizer;
        this.factorExposureEstimator = factorExposureEstimator;
        this.riskEngineMetrics = riskEngineMetrics;
        this.eventPublisher = eventPublisher;
        this.defaultRiskLimits = defaultRiskLimits;
        this.defaultFactorProxySet = defaultFactorProxySet;
    }

    // ==============================
    // ANALYSIS
    // ==============================

    /**
     * Analyzes a portfolio with the configured default proxy set and limits.
     */
    public RiskAnalysisResult analyzePortfolio(Portfolio portfolio) {
        return analyzePortfolio(portfolio, defaultFactorProxySet, defaultRiskLimits);
    }

    /**
     * Runs the full analysis, serving repeated requests with the same content from cache.
     *
     * @throws com.riskengine.exception.ConfigurationException for malformed limits, proxies or holdings
     * @throws com.riskengine.exception.DataUnavailableException if a share holding has no price
     * @throws com.riskengine.exception.DataInsufficientException if a history is too short or gapped
     */
    public RiskAnalysisResult analyzePortfolio(Portfolio portfolio, FactorProxySet proxySet, RiskLimitSet limits) {
        limits.validate();
        PipelineFingerprint fingerprint = fingerprintGenerator.fingerprint(portfolio, proxySet, limits);

        try {
            RiskAnalysisResult cached = analysisResultCache.getIfPresent(fingerprint);
            if (cached != null) {
                riskEngineMetrics.recordCacheHit();
                return cached;
            }
        } catch (CacheException e) {
            log.warn("Result cache unavailable for {}, computing directly: {}", fingerprint, e.getMessage());
            riskEngineMetrics.recordCacheFallback();
            return computeFresh(
                    riskAnalysisPipeline.prepare(portfolio, proxySet, fingerprint.getProxySetHash(), List.of()),
                    limits,
                    fingerprint);
        }

        PipelineInputs inputs =
                riskAnalysisPipeline.prepare(portfolio, proxySet, fingerprint.getProxySetHash(), List.of());
        try {
            return analysisResultCache.getOrCompute(fingerprint, () -> computeFresh(inputs, limits, fingerprint));
        } catch (CacheException e) {
            log.warn("Result cache insert failed for {}, computing directly: {}", fingerprint, e.getMessage());
            riskEngineMetrics.recordCacheFallback();
            return computeFresh(inputs, limits, fingerprint);
        }
    }

    private RiskAnalysisResult computeFresh(PipelineInputs inputs, RiskLimitSet limits, PipelineFingerprint fingerprint) {
        long start = System.nanoTime();
        RiskAnalysisResult result = riskAnalysisPipeline.assemble(inputs, limits, fingerprint);
        riskEngineMetrics.recordComputation(System.nanoTime() - start);

        if (result.hasViolations()) {
            log.warn("Analysis {} breached {} limit(s)", fingerprint.shortId(), result.getFailedVerdicts().size());
            eventPublisher.publishEvent(new LimitBreachEvent(this, fingerprint, result.getFailedVerdicts()));
        }
        return result;
    }

    // ==============================
    // SCORING
    // ==============================

    public RiskScoreResult scorePortfolio(RiskAnalysisResult result) {
        return riskScorer.score(result);
    }

    /**
     * Derives limits that would cap the worst single stress loss of the analyzed portfolio at
     * {@code maxLoss}, using the configured per-factor loss tolerance.
     */
    public SuggestedRiskLimits suggestRiskLimits(RiskAnalysisResult result, double maxLoss) {
        return riskScorer.suggestLimits(result, maxLoss);
    }

    // ==============================
    // SCENARIOS
    // ==============================

    /**
     * What-if analysis with the configured default proxy set and limits.
     */
    public WhatIfResult analyzeScenario(Portfolio portfolio, ScenarioChange change) {
        return analyzeScenario(portfolio, defaultFactorProxySet, defaultRiskLimits, change);
    }

    /**
     * Analyzes the portfolio as it stands and again with {@code change} applied to its weights,
     * then scores both. Each side goes through {@link #analyzePortfolio} and so shares its cache.
     *
     * @throws com.riskengine.exception.ConfigurationException if the change leaves no exposure
     * @throws com.riskengine.exception.DataInsufficientException if a ticker added by the change
     *     has too little history
     */
    public WhatIfResult analyzeScenario(
            Portfolio portfolio, FactorProxySet proxySet, RiskLimitSet limits, ScenarioChange change) {
        RiskAnalysisResult current = analyzePortfolio(portfolio, proxySet, limits);
        Map<String, Double> scenarioWeights = change.applyTo(current.getWeights());

        BigDecimal notional = current.getTotalValue().signum() != 0
                ? current.getTotalValue().abs()
                : DEFAULT_SCENARIO_NOTIONAL;
        Portfolio.PortfolioBuilder builder = Portfolio.builder()
                .name((portfolio.getName() != null ? portfolio.getName() : "portfolio") + "/" + change.getName())
                .window(portfolio.getWindow());
        scenarioWeights.forEach((ticker, weight) -> builder.holding(
                Holding.of(ticker, null, notional.doubleValue() * weight)));
        RiskAnalysisResult scenario = analyzePortfolio(builder.build(), proxySet, limits);

        WhatIfResult result = WhatIfResult.builder()
                .scenarioName(change.getName())
                .current(current)
                .scenario(scenario)
                .currentScore(riskScorer.score(current))
                .scenarioScore(riskScorer.score(scenario))
                .build();
        log.info(
                "Scenario {}: volatility {} -> {}, score {} -> {}, {} new violation(s)",
                change.getName(),
                current.getVolatility(),
                scenario.getVolatility(),
                result.getCurrentScore().getOverallScore(),
                result.getScenarioScore().getOverallScore(),
                result.newViolations().size());
        return result;
    }

    // ==============================
    // OPTIMIZATION
    // ==============================

    /**
     * Optimizes with the default proxy set and default options.
     */
    public OptimizationResult optimizePortfolio(
            Portfolio portfolio, OptimizationObjective objective, RiskLimitSet limits) {
        return optimizePortfolio(portfolio, defaultFactorProxySet, objective, limits, OptimizationOptions.defaults());
    }

    /**
     * Searches for weights meeting every limit in {@code limits}. The result is a tagged
     * outcome; callers that prefer exceptions can call {@link OptimizationResult#requireFeasible()}.
     *
     * @param options null for defaults
     */
    public OptimizationResult optimizePortfolio(
            Portfolio portfolio,
            FactorProxySet proxySet,
            OptimizationObjective objective,
            RiskLimitSet limits,
            OptimizationOptions options) {
        OptimizationResult result = portfolioOptimizer.optimize(
                portfolio,
                proxySet,
                fingerprintGenerator.proxySetHash(proxySet),
                objective,
                limits,
                options != null ? options : OptimizationOptions.defaults());
        riskEngineMetrics.recordOptimizerOutcome(result.getStatus());
        return result;
    }

    // ==============================
    // CACHE MANAGEMENT
    // ==============================

    /**
     * Drops one cached analysis, or every cached analysis and market data series when
     * {@code fingerprint} is null.
     */
    public void invalidateCache(PipelineFingerprint fingerprint) {
        if (fingerprint == null) {
            analysisResultCache.invalidateAll();
            factorExposureEstimator.invalidateCache();
            log.info("Invalidated all cached analyses and market data");
            return;
        }
        analysisResultCache.invalidate(fingerprint);
        log.debug("Invalidated cached analysis {}", fingerprint);
    }

    /**
     * Drops every cached analysis built with the given proxy set content.
     *
     * @return number of entries removed
     */
    public int invalidateProxySet(FactorProxySet proxySet) {
        String hash = fingerprintGenerator.proxySetHash(proxySet);
        int removed = analysisResultCache.invalidateIf(fp -> fp.getProxySetHash().equals(hash));
        log.info("Invalidated {} cached analyses for proxy set {}", removed, proxySet.getId());
        return removed;
    }

    /**
     * Drops every cached analysis built with the given limit set content.
     *
     * @return number of entries removed
     */
    public int invalidateLimitSet(RiskLimitSet limits) {
        String hash = fingerprintGenerator.limitSetHash(limits);
        int removed = analysisResultCache.invalidateIf(fp -> fp.getLimitSetHash().equals(hash));
        log.info("Invalidated {} cached analyses for limit set {}", removed, limits.getName());
        return removed;
    }
}
