package com.riskengine.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.riskengine.domain.enums.LimitStatus;
import com.riskengine.domain.enums.OptimizationObjective;
import com.riskengine.domain.enums.OptimizationStatus;
import com.riskengine.domain.model.CashHolding;
import com.riskengine.domain.model.EquityHolding;
import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.OptimizationResult;
import com.riskengine.domain.model.Portfolio;
import com.riskengine.domain.model.RiskAnalysisResult;
import com.riskengine.domain.model.RiskScoreResult;
import com.riskengine.domain.model.ScenarioChange;
import com.riskengine.domain.model.WhatIfResult;
import com.riskengine.event.LimitBreachEvent;
import com.riskengine.exception.DataInsufficientException;
import com.riskengine.exception.DataUnavailableException;
import com.riskengine.marketdata.InMemoryMarketDataProvider;
import com.riskengine.risk.LimitSuggestion;
import com.riskengine.risk.LimitVerdict;
import com.riskengine.risk.LimitsComplianceChecker;
import com.riskengine.risk.RiskLimitSet;
import com.riskengine.risk.SuggestedRiskLimits;
import com.riskengine.service.PortfolioRiskService;
import com.riskengine.support.MarketDataFixtures;
import com.riskengine.support.RiskEngineTestHarness;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * End-to-end test of the analysis service wired from real components over in-memory market
 * data: USD cash proxied by SGOV next to a stock with a known market beta.
 * Covers the pipeline -> compliance -> breach event -> cache -> optimizer sequence.
 */
class RiskAnalysisIntegrationTest {

    private static final Map<LocalDate, Double> MARKET = MarketDataFixtures.gaussian(7L, 0.008, 0.045);

    private RiskEngineTestHarness harness;
    private PortfolioRiskService service;
    private FactorProxySet proxySet;
    private Portfolio portfolio;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        InMemoryMarketDataProvider marketData = new InMemoryMarketDataProvider()
                .putReturns("SPY", MARKET)
                .putReturns("AAPL", MarketDataFixtures.exposed(MarketDataFixtures.gaussian(8L, 0.0, 0.002), 1.2, MARKET))
                .putReturns("MSFT", MarketDataFixtures.exposed(MarketDataFixtures.gaussian(10L, 0.0, 0.01), 0.9, MARKET))
                .putReturns("SGOV", MarketDataFixtures.constant(0.004));
        harness = new RiskEngineTestHarness(marketData);
        service = harness.getService();
        proxySet = MarketDataFixtures.marketOnlyProxySet();
        portfolio = Portfolio.builder()
                .name("aapl-and-cash")
                .window(MarketDataFixtures.WINDOW)
                .holding(EquityHolding.ofDollars("AAPL", 6000))
                .holding(CashHolding.of("USD", 4000))
                .build();
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Cash is proxied, betas blend by weight and the holding cap fails")
    void analysis_endToEnd() {
        RiskLimitSet limits = RiskLimitSet.builder().name("cap-50").maxSingleHoldingWeight(0.5).build();

        RiskAnalysisResult result = service.analyzePortfolio(portfolio, proxySet, limits);

        assertThat(result.getWeights()).containsOnlyKeys("AAPL", "SGOV");
        assertThat(result.getWeights().get("AAPL")).isCloseTo(0.6, within(1e-12));
        assertThat(result.getWeights().get("SGOV")).isCloseTo(0.4, within(1e-12));
        assertThat(result.getPortfolioBetas().get("market")).isCloseTo(0.72, within(0.02));
        assertThat(result.getVolatility()).isPositive();

        assertThat(result.getVerdicts())
                .extracting(LimitVerdict::getRuleName)
                .containsExactly(LimitsComplianceChecker.MAX_SINGLE_HOLDING_WEIGHT);
        assertThat(result.getVerdicts().get(0).getStatus()).isEqualTo(LimitStatus.FAIL);
        assertThat(result.getVerdicts().get(0).getCurrentValue()).isCloseTo(0.6, within(1e-12));

        assertThat(harness.getPublishedEvents()).singleElement().isInstanceOf(LimitBreachEvent.class);
        assertThat(harness.getMetrics().getLimitBreachCount()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Repeated analysis is served from cache regardless of holding order")
    void repeatedAnalysis_cacheHit() {
        Portfolio reordered = Portfolio.builder()
                .name("reordered")
                .window(MarketDataFixtures.WINDOW)
                .holding(CashHolding.of("usd", 4000))
                .holding(EquityHolding.ofDollars("aapl", 6000))
                .build();

        RiskAnalysisResult first = service.analyzePortfolio(portfolio, proxySet, RiskLimitSet.none());
        RiskAnalysisResult second = service.analyzePortfolio(reordered, proxySet, RiskLimitSet.none());

        assertThat(second).isSameAs(first);
        assertThat(harness.getMetrics().getComputationCount()).isEqualTo(1.0);
        assertThat(harness.getMetrics().getCacheHitCount()).isEqualTo(1.0);
        assertThat(harness.getPublishedEvents()).isEmpty();
    }

    @Test
    @DisplayName("Cached result cannot be corrupted through its maps")
    void cachedResult_unmodifiable() {
        RiskAnalysisResult first = service.analyzePortfolio(portfolio, proxySet, RiskLimitSet.none());
        double aaplWeight = first.getWeights().get("AAPL");
        double marketBeta = first.getPortfolioBetas().get("market");

        assertThatThrownBy(() -> first.getWeights().put("AAPL", 0.1))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> first.getPortfolioBetas().put("market", 0.0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> first.getDecomposition().getFactorStressLosses().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> first.getExposures().remove("AAPL"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> first.toRiskMetrics().getFactorVarianceShares().put("market", 0.0))
                .isInstanceOf(UnsupportedOperationException.class);

        RiskAnalysisResult second = service.analyzePortfolio(portfolio, proxySet, RiskLimitSet.none());

        assertThat(second).isSameAs(first);
        assertThat(second.getWeights().get("AAPL")).isEqualTo(aaplWeight);
        assertThat(second.getPortfolioBetas().get("market")).isEqualTo(marketBeta);
    }

    @Test
    @DisplayName("Net-short portfolio is analyzed with gross-normalized weights")
    void netShortPortfolio_analyzed() {
        Portfolio netShort = Portfolio.builder()
                .name("net-short")
                .window(MarketDataFixtures.WINDOW)
                .holding(EquityHolding.ofDollars("AAPL", 6000))
                .holding(CashHolding.of("USD", -8000))
                .build();

        RiskAnalysisResult result = service.analyzePortfolio(netShort, proxySet, RiskLimitSet.none());

        assertThat(result.getTotalValue()).isEqualByComparingTo("-2000");
        assertThat(result.getWeights().get("AAPL")).isCloseTo(6000.0 / 14000.0, within(1e-12));
        assertThat(result.getWeights().get("SGOV")).isCloseTo(-8000.0 / 14000.0, within(1e-12));
        assertThat(result.getLeverage()).isCloseTo(1.0, within(1e-12));
        assertThat(result.getVolatility()).isPositive();
    }

    @Test
    @DisplayName("Concurrent requests for the same content compute once")
    void concurrentAnalyses_singleComputation() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RiskAnalysisResult>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return service.analyzePortfolio(portfolio, proxySet, RiskLimitSet.none());
            }));
        }
        start.countDown();

        List<RiskAnalysisResult> results = new ArrayList<>();
        for (Future<RiskAnalysisResult> future : futures) {
            results.add(future.get(30, TimeUnit.SECONDS));
        }

        assertThat(results).allSatisfy(result -> assertThat(result).isSameAs(results.get(0)));
        assertThat(harness.getMetrics().getComputationCount()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Limit set invalidation forces recomputation")
    void limitSetInvalidation_recomputes() {
        RiskLimitSet limits = RiskLimitSet.builder().name("vol").maxVolatility(0.5).build();
        RiskAnalysisResult first = service.analyzePortfolio(portfolio, proxySet, limits);

        int removed = service.invalidateLimitSet(RiskLimitSet.builder().name("renamed").maxVolatility(0.5).build());
        RiskAnalysisResult second = service.analyzePortfolio(portfolio, proxySet, limits);

        assertThat(removed).isEqualTo(1);
        assertThat(second).isNotSameAs(first);
        assertThat(second.getVolatility()).isEqualTo(first.getVolatility());
        assertThat(harness.getMetrics().getComputationCount()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Score stays within bounds and carries a category")
    void score() {
        RiskAnalysisResult result = service.analyzePortfolio(portfolio, proxySet, RiskLimitSet.none());

        RiskScoreResult score = service.scorePortfolio(result);

        assertThat(score.getOverallScore()).isBetween(0.0, 100.0);
        assertThat(score.getCategory()).isNotNull();
        assertThat(score.getInterpretation()).isNotBlank();
    }

    @Test
    @DisplayName("Weight shifts are compared before and after under the same limits")
    void scenarioShift_comparesBeforeAndAfter() {
        RiskLimitSet limits = RiskLimitSet.builder().name("cap-56").maxSingleHoldingWeight(0.56).build();

        WhatIfResult whatIf = service.analyzeScenario(
                portfolio, proxySet, limits, ScenarioChange.parseShifts("de-risk", "AAPL:-1500bp, SGOV:+15%"));

        assertThat(whatIf.getScenarioName()).isEqualTo("de-risk");
        assertThat(whatIf.getScenario().getWeights().get("AAPL")).isCloseTo(0.45, within(1e-9));
        assertThat(whatIf.getScenario().getWeights().get("SGOV")).isCloseTo(0.55, within(1e-9));
        assertThat(whatIf.getVolatilityDelta()).isNegative();
        assertThat(whatIf.isRiskImprovement()).isTrue();
        assertThat(whatIf.isConcentrationImprovement()).isTrue();
        assertThat(whatIf.betaDeltas().get("market")).isCloseTo(-0.18, within(0.01));
        assertThat(whatIf.resolvedViolations()).containsExactly(LimitsComplianceChecker.MAX_SINGLE_HOLDING_WEIGHT);
        assertThat(whatIf.newViolations()).isEmpty();
        assertThat(whatIf.getScoreDelta()).isPositive();
        assertThat(whatIf.getCurrent()).isSameAs(service.analyzePortfolio(portfolio, proxySet, limits));
    }

    @Test
    @DisplayName("Replacement weights may drop holdings and add new tickers")
    void scenarioReplacement_newTicker() {
        WhatIfResult whatIf = service.analyzeScenario(
                portfolio,
                proxySet,
                RiskLimitSet.none(),
                ScenarioChange.replaceWeights("swap", Map.of("AAPL", 1.0, "msft", 1.0)));

        assertThat(whatIf.getScenario().getWeights()).containsOnlyKeys("AAPL", "MSFT");
        assertThat(whatIf.getScenario().getWeights().get("MSFT")).isCloseTo(0.5, within(1e-9));
        assertThat(whatIf.weightDeltas().get("SGOV")).isCloseTo(-0.4, within(1e-9));
        assertThat(whatIf.weightDeltas().get("MSFT")).isCloseTo(0.5, within(1e-9));
        assertThat(whatIf.getVolatilityDelta()).isPositive();
    }

    @Test
    @DisplayName("Suggested limits flag the holding that a tight loss tolerance cannot carry")
    void suggestedLimits() {
        RiskAnalysisResult result = service.analyzePortfolio(portfolio, proxySet, RiskLimitSet.none());

        SuggestedRiskLimits suggested = service.suggestRiskLimits(result, 0.20);

        assertThat(suggested.getLimits().getMaxSingleHoldingWeight()).isCloseTo(0.25, within(1e-12));
        assertThat(suggested.getReductionsNeeded())
                .extracting(LimitSuggestion::getName)
                .contains("maxSingleHoldingWeight");
        RiskAnalysisResult recheck = service.analyzePortfolio(portfolio, proxySet, suggested.getLimits());
        assertThat(recheck.getFailedVerdicts())
                .extracting(LimitVerdict::getRuleName)
                .contains(LimitsComplianceChecker.MAX_SINGLE_HOLDING_WEIGHT);
    }

    @Test
    @DisplayName("Optimizer respects the holding cap and records its outcome")
    void optimize_throughService() {
        RiskLimitSet limits = RiskLimitSet.builder().maxSingleHoldingWeight(0.7).build();

        OptimizationResult result = service.optimizePortfolio(portfolio, OptimizationObjective.MIN_VARIANCE, limits);

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.FEASIBLE);
        assertThat(result.getWeights().get("SGOV")).isCloseTo(0.7, within(1e-6));
        assertThat(result.getWeights().get("AAPL")).isCloseTo(0.3, within(1e-6));
        assertThat(harness.getMetrics().getOptimizerOutcomeCount(OptimizationStatus.FEASIBLE)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Ticker without market data fails as insufficient, keeping the provider's cause")
    void unknownTicker_insufficient() {
        Portfolio unknown = Portfolio.builder()
                .window(MarketDataFixtures.WINDOW)
                .holding(EquityHolding.ofDollars("ZZZZ", 1000))
                .build();

        assertThatThrownBy(() -> service.analyzePortfolio(unknown, proxySet, RiskLimitSet.none()))
                .isInstanceOf(DataInsufficientException.class)
                .hasCauseInstanceOf(DataUnavailableException.class);
        assertThat(harness.getResultCache().size()).isZero();
    }

    @Test
    @DisplayName("Ticker with a short history fails as insufficient")
    void shortHistory_insufficient() {
        InMemoryMarketDataProvider marketData = new InMemoryMarketDataProvider()
                .putReturns("SPY", MARKET)
                .putReturns("NEWCO", new TreeMap<>(MarketDataFixtures.gaussian(9L, 0.01, 0.05)).tailMap(
                        LocalDate.of(2024, 7, 1)));
        RiskEngineTestHarness shortHarness = new RiskEngineTestHarness(marketData);
        Portfolio newco = Portfolio.builder()
                .window(MarketDataFixtures.WINDOW)
                .holding(EquityHolding.ofDollars("NEWCO", 1000))
                .build();

        assertThatThrownBy(() -> shortHarness.getService().analyzePortfolio(newco, proxySet, RiskLimitSet.none()))
                .isInstanceOf(DataInsufficientException.class);
    }
}
