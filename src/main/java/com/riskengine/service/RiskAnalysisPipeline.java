package com.riskengine.service;

import com.riskengine.cache.PipelineFingerprint;
import com.riskengine.core.processor.RiskContributionCalculator;
import com.riskengine.core.processor.VarianceDecompositionEngine;
import com.riskengine.domain.model.FactorBetaMatrix;
import com.riskengine.domain.model.FactorCovariance;
import com.riskengine.domain.model.FactorExposure;
import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.Holding;
import com.riskengine.domain.model.Portfolio;
import com.riskengine.domain.model.ReturnSeries;
import com.riskengine.domain.model.RiskAnalysisResult;
import com.riskengine.domain.model.RiskContributions;
import com.riskengine.domain.model.VarianceDecomposition;
import com.riskengine.domain.model.WeightedPortfolio;
import com.riskengine.exception.ConfigurationException;
import com.riskengine.factor.FactorCovarianceEstimator;
import com.riskengine.factor.FactorExposureEstimator;
import com.riskengine.portfolio.PortfolioAggregator;
import com.riskengine.risk.LimitVerdict;
import com.riskengine.risk.LimitsComplianceChecker;
import com.riskengine.risk.RiskLimitSet;
import com.riskengine.risk.RiskMetrics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the analysis stages in two phases:
 * <ol>
 *   <li>{@link #prepare}: aggregation, factor returns, covariance and beta estimation. All
 *       market data I/O happens here.</li>
 *   <li>{@link #assemble}: decomposition, contributions and compliance. Pure computation over
 *       the prepared inputs.</li>
 * </ol>
 * The split lets the service fetch data before it joins or installs a result-cache entry.
 */
@Component
public class RiskAnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalysisPipeline.class);

    private final PortfolioAggregator portfolioAggregator;
    private final FactorExposureEstimator factorExposureEstimator;
    private final FactorCovarianceEstimator factorCovarianceEstimator;
    private final VarianceDecompositionEngine varianceDecompositionEngine;
    private final RiskContributionCalculator riskContributionCalculator;
    private final LimitsComplianceChecker limitsComplianceChecker;
    private final Clock clock;

    public RiskAnalysisPipeline(
            PortfolioAggregator portfolioAggregator,
            FactorExposureEstimator factorExposureEstimator,
            FactorCovarianceEstimator factorCovarianceEstimator,
            VarianceDecompositionEngine varianceDecompositionEngine,
            RiskContributionCalculator riskContributionCalculator,
            LimitsComplianceChecker limitsComplianceChecker,
            Clock clock) {
        this.portfolioAggregator = portfolioAggregator;
        this.factorExposureEstimator = factorExposureEstimator;
        this.factorCovarianceEstimator = factorCovarianceEstimator;
        this.varianceDecompositionEngine = varianceDecompositionEngine;
        this.riskContributionCalculator = riskContributionCalculator;
        this.limitsComplianceChecker = limitsComplianceChecker;
        this.clock = clock;
    }

    /**
     * Fetches and estimates everything the analysis needs.
     *
     * @param proxySetHash content hash of {@code proxySet}, the exposure cache identity
     * @param extraTickers tickers to estimate in addition to the holdings (may overlap them)
     * @throws ConfigurationException if there is nothing to analyze
     */
    public PipelineInputs prepare(
            Portfolio portfolio, FactorProxySet proxySet, String proxySetHash, Collection<String> extraTickers) {
        WeightedPortfolio weighted = portfolioAggregator.aggregate(portfolio, proxySet);

        Map<String, ReturnSeries> factorReturns = factorExposureEstimator.factorReturns(portfolio.getWindow(), proxySet);
        FactorCovariance factorCovariance = factorCovarianceEstimator.estimate(factorReturns);

        List<String> universe = new ArrayList<>(weighted.getTickers());
        for (String ticker : extraTickers) {
            String normalized = ticker.trim().toUpperCase();
            if (!universe.contains(normalized)) {
                universe.add(normalized);
            }
        }
        if (universe.isEmpty()) {
            throw new ConfigurationException("Portfolio " + portfolio.getName() + " has no holdings");
        }

        Map<String, FactorExposure> exposures = new LinkedHashMap<>();
        for (String ticker : universe) {
            if (ticker.startsWith(Holding.CASH_PREFIX)) {
                exposures.put(ticker, FactorExposure.riskless(ticker, factorCovariance.getFactors()));
            } else {
                exposures.put(
                        ticker,
                        factorExposureEstimator.estimate(ticker, portfolio.getWindow(), proxySet, proxySetHash));
            }
        }

        return PipelineInputs.builder()
                .window(portfolio.getWindow())
                .portfolio(weighted)
                .exposures(Collections.unmodifiableMap(exposures))
                .factorCovariance(factorCovariance)
                .build();
    }

    /**
     * Computes the analysis result from prepared inputs. Performs no I/O.
     */
    public RiskAnalysisResult assemble(PipelineInputs inputs, RiskLimitSet limits, PipelineFingerprint fingerprint) {
        WeightedPortfolio weighted = inputs.getPortfolio();
        Map<String, FactorExposure> held = new LinkedHashMap<>();
        for (String ticker : weighted.getTickers()) {
            held.put(ticker, inputs.getExposures().get(ticker));
        }

        ModelEvaluation evaluation = evaluate(weighted.getWeights(), held, inputs.getFactorCovariance());
        List<LimitVerdict> verdicts = limitsComplianceChecker.check(evaluation.getMetrics(), limits);

        log.info(
                "Analysis {}: {} positions, volatility {}, factor share {}, {} verdicts ({} failed)",
                fingerprint != null ? fingerprint.shortId() : "-",
                held.size(),
                evaluation.getDecomposition().getVolatility(),
                evaluation.getDecomposition().factorShare(),
                verdicts.size(),
                verdicts.stream().filter(LimitVerdict::isFailed).count());

        return RiskAnalysisResult.builder()
                .fingerprint(fingerprint)
                .window(inputs.getWindow())
                .computedAt(clock.instant())
                .totalValue(weighted.getTotalValue())
                .weights(Collections.unmodifiableMap(new LinkedHashMap<>(weighted.getWeights())))
                .unmappedCurrencies(weighted.getUnmappedCurrencies())
                .exposures(Collections.unmodifiableMap(held))
                .decomposition(evaluation.getDecomposition())
                .contributions(evaluation.getContributions())
                .factorCovariance(inputs.getFactorCovariance())
                .leverage(evaluation.getMetrics().getLeverage())
                .limits(limits)
                .verdicts(List.copyOf(verdicts))
                .build();
    }

    /**
     * Decomposes and allocates risk for an arbitrary weight vector over tickers whose exposures
     * are known. Used by {@link #assemble} and by the optimizer's final validation.
     */
    public ModelEvaluation evaluate(
            Map<String, Double> weights, Map<String, FactorExposure> exposures, FactorCovariance factorCovariance) {
        FactorBetaMatrix betas =
                FactorBetaMatrix.of(new ArrayList<>(weights.keySet()), factorCovariance.getFactors(), exposures);
        VarianceDecomposition decomposition = varianceDecompositionEngine.decompose(weights, betas, factorCovariance);
        RiskContributions contributions =
                riskContributionCalculator.calculate(weights, betas, factorCovariance, decomposition);
        return new ModelEvaluation(betas, decomposition, contributions, RiskMetrics.of(weights, decomposition, contributions));
    }
}
