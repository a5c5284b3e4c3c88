package com.riskengine.support;

import com.riskengine.cache.AnalysisResultCache;
import com.riskengine.cache.FingerprintGenerator;
import com.riskengine.config.RiskEngineProperties;
import com.riskengine.core.processor.RiskContributionCalculator;
import com.riskengine.core.processor.VarianceDecompositionEngine;
import com.riskengine.event.LimitBreachEvent;
import com.riskengine.factor.FactorCovarianceEstimator;
import com.riskengine.factor.FactorExposureEstimator;
import com.riskengine.marketdata.MarketDataProvider;
import com.riskengine.observability.RiskEngineMetrics;
import com.riskengine.optimizer.PortfolioOptimizer;
import com.riskengine.portfolio.PortfolioAggregator;
import com.riskengine.risk.LimitsComplianceChecker;
import com.riskengine.risk.RiskLimitSet;
import com.riskengine.risk.RiskScorer;
import com.riskengine.service.PortfolioRiskService;
import com.riskengine.service.RiskAnalysisPipeline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.Getter;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Wires the engine from real components without a Spring context. Published events are
 * recorded and forwarded to the metrics listener.
 */
@Getter
public class RiskEngineTestHarness {

    private final RiskEngineProperties properties;
    private final FactorExposureEstimator factorExposureEstimator;
    private final LimitsComplianceChecker limitsComplianceChecker;
    private final RiskAnalysisPipeline pipeline;
    private final FingerprintGenerator fingerprintGenerator;
    private final AnalysisResultCache resultCache;
    private final PortfolioOptimizer optimizer;
    private final RiskEngineMetrics metrics;
    private final PortfolioRiskService service;
    private final List<Object> publishedEvents = new CopyOnWriteArrayList<>();

    public RiskEngineTestHarness(MarketDataProvider marketDataProvider) {
        this(marketDataProvider, new RiskEngineProperties());
    }

    public RiskEngineTestHarness(MarketDataProvider marketDataProvider, RiskEngineProperties properties) {
        Clock clock = Clock.systemUTC();
        this.properties = properties;
        this.factorExposureEstimator = new FactorExposureEstimator(marketDataProvider, properties);
        this.limitsComplianceChecker = new LimitsComplianceChecker();
        this.pipeline = new RiskAnalysisPipeline(
                new PortfolioAggregator(marketDataProvider),
                factorExposureEstimator,
                new FactorCovarianceEstimator(properties),
                new VarianceDecompositionEngine(properties),
                new RiskContributionCalculator(),
                limitsComplianceChecker,
                clock);
        this.fingerprintGenerator = new FingerprintGenerator();
        this.resultCache = new AnalysisResultCache(properties);
        this.optimizer =
                new PortfolioOptimizer(pipeline, factorExposureEstimator, limitsComplianceChecker, properties, clock);
        this.metrics = new RiskEngineMetrics(new SimpleMeterRegistry());

        ApplicationEventPublisher publisher = event -> {
            publishedEvents.add(event);
            if (event instanceof LimitBreachEvent breach) {
                metrics.onLimitBreach(breach);
            }
        };

        this.service = new PortfolioRiskService(
                pipeline,
                fingerprintGenerator,
                resultCache,
                new RiskScorer(properties),
                optimizer,
                factorExposureEstimator,
                metrics,
                publisher,
                RiskLimitSet.none(),
                MarketDataFixtures.marketOnlyProxySet());
    }
}
