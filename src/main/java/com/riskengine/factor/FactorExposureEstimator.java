package com.riskengine.factor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.riskengine.config.RiskEngineProperties;
import com.riskengine.domain.model.AnalysisWindow;
import com.riskengine.domain.model.FactorExposure;
import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.ReturnSeries;
import com.riskengine.exception.DataInsufficientException;
import com.riskengine.exception.DataUnavailableException;
import com.riskengine.marketdata.MarketDataProvider;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Estimates per-holding factor betas by one joint multivariate OLS regression (with intercept)
 * of the holding's returns on all factor return series over the analysis window.
 *
 * <p>Betas are the slope coefficients of that single fit, not of separate per-factor
 * regressions. The residual variance is the OLS error variance with n - k - 1 degrees of
 * freedom, annualized by {@code periodsPerYear}.
 *
 * <p>Two read-through caches are owned by this instance:
 * <ul>
 *   <li>return series keyed by (ticker, window), shared across holdings and proxy sets so each
 *       proxy's history is fetched once per window</li>
 *   <li>exposure rows keyed by (ticker, window, proxy-set hash)</li>
 * </ul>
 * Lookups use getIfPresent/put, so no cache lock is held while the provider is called.
 * Concurrent misses for the same key may fetch twice; both fetches return the same data.
 *
 * <p>Missing, empty, short, or window-incomplete history is a {@link DataInsufficientException};
 * nothing is zero-filled.
 */
@Component
public class FactorExposureEstimator {

    private static final Logger log = LoggerFactory.getLogger(FactorExposureEstimator.class);

    private final MarketDataProvider marketDataProvider;
    private final RiskEngineProperties.Model model;
    private final Cache<SeriesKey, ReturnSeries> seriesCache;
    private final Cache<ExposureKey, FactorExposure> exposureCache;

    public FactorExposureEstimator(MarketDataProvider marketDataProvider, RiskEngineProperties properties) {
        this.marketDataProvider = marketDataProvider;
        this.model = properties.getModel();
        long maximumSize = properties.getCache().getExposureMaximumSize();
        this.seriesCache = Caffeine.newBuilder().maximumSize(maximumSize).build();
        this.exposureCache = Caffeine.newBuilder().maximumSize(maximumSize).build();
    }

    /**
     * Returns the beta row for {@code ticker}, regressing on the factors of {@code proxySet} in
     * their declared order.
     *
     * @param proxySetHash content hash of the proxy set, used as the cache identity
     * @throws DataInsufficientException if the ticker or any proxy lacks usable history
     */
    public FactorExposure estimate(
            String ticker, AnalysisWindow window, FactorProxySet proxySet, String proxySetHash) {
        ExposureKey key = new ExposureKey(ticker, window, proxySetHash);
        FactorExposure cached = exposureCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        FactorExposure exposure = regress(ticker, window, factorReturns(window, proxySet));
        exposureCache.put(key, exposure);
        return exposure;
    }

    /**
     * Factor return series over the window, keyed by factor name in proxy-set order. Excess
     * factors are returned net of the market factor.
     */
    public Map<String, ReturnSeries> factorReturns(AnalysisWindow window, FactorProxySet proxySet) {
        Map<String, ReturnSeries> factorReturns = new LinkedHashMap<>();
        ReturnSeries market = null;
        if (!proxySet.getExcessFactors().isEmpty()) {
            market = returns(proxySet.proxyFor(FactorProxySet.MARKET), window);
        }
        for (String factor : proxySet.getFactorNames()) {
            ReturnSeries proxyReturns = returns(proxySet.proxyFor(factor), window);
            if (proxySet.isExcessFactor(factor)) {
                proxyReturns = proxyReturns.minus(market, proxyReturns.getTicker() + "-" + market.getTicker());
                requireObservations(proxyReturns, factor, model.getMinObservations());
            }
            factorReturns.put(factor, proxyReturns);
        }
        return Collections.unmodifiableMap(factorReturns);
    }

    /**
     * Annualized historical mean return of {@code ticker} over the window.
     */
    public double expectedReturn(String ticker, AnalysisWindow window) {
        double mean = returns(ticker, window).mean() * model.getPeriodsPerYear();
        if (!Double.isFinite(mean)) {
            throw new DataInsufficientException(
                    "Non-finite mean return for " + ticker, Map.of("ticker", ticker, "window", window.toString()));
        }
        return mean;
    }

    /**
     * Returns the cached or freshly fetched series, after checking it covers the window.
     */
    public ReturnSeries returns(String ticker, AnalysisWindow window) {
        SeriesKey key = new SeriesKey(ticker, window);
        ReturnSeries cached = seriesCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        ReturnSeries series;
        try {
            series = marketDataProvider.getReturns(ticker, window.getStartDate(), window.getEndDate());
        } catch (DataUnavailableException e) {
            throw new DataInsufficientException(
                    "No return history for " + ticker + " over " + window,
                    Map.of("ticker", ticker, "window", window.toString()),
                    e);
        }
        validateCoverage(ticker, series, window);
        seriesCache.put(key, series);
        return series;
    }

    public void invalidateCache() {
        seriesCache.invalidateAll();
        exposureCache.invalidateAll();
        log.info("Factor exposure caches cleared");
    }

    public long cachedSeriesCount() {
        return seriesCache.estimatedSize();
    }

    // ==============================
    // REGRESSION
    // ==============================

    private FactorExposure regress(String ticker, AnalysisWindow window, Map<String, ReturnSeries> factorReturns) {
        List<String> factors = new ArrayList<>(factorReturns.keySet());
        int k = factors.size();

        List<ReturnSeries> series = new ArrayList<>(k + 1);
        series.add(returns(ticker, window));
        series.addAll(factorReturns.values());
        AlignedReturns aligned = AlignedReturns.of(series);

        int required = Math.max(model.getMinObservations(), k + 2);
        if (aligned.observations() < required) {
            throw new DataInsufficientException(
                    ticker + " has " + aligned.observations() + " observations aligned with factor proxies, need "
                            + required,
                    Map.of("ticker", ticker, "observations", aligned.observations(), "required", required));
        }

        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(aligned.column(0), aligned.columns(1, k + 1));

        double[] parameters;
        double errorVariance;
        double rSquared;
        try {
            parameters = ols.estimateRegressionParameters();
            errorVariance = ols.estimateErrorVariance();
            rSquared = ols.calculateRSquared();
        } catch (SingularMatrixException e) {
            throw new DataInsufficientException(
                    "Factor returns are collinear over " + window + "; cannot estimate betas for " + ticker,
                    Map.of("ticker", ticker, "window", window.toString()),
                    e);
        }

        Map<String, Double> betas = new LinkedHashMap<>();
        for (int f = 0; f < k; f++) {
            double beta = parameters[f + 1];
            requireFinite(ticker, "beta:" + factors.get(f), beta);
            betas.put(factors.get(f), beta);
        }
        double residualVariance = Math.max(0.0, errorVariance) * model.getPeriodsPerYear();
        requireFinite(ticker, "residualVariance", residualVariance);

        log.debug(
                "Estimated {} over {}: betas={}, residualVariance={}, r2={}, n={}",
                ticker,
                window,
                betas,
                residualVariance,
                rSquared,
                aligned.observations());

        return FactorExposure.builder()
                .ticker(ticker)
                .betas(Collections.unmodifiableMap(betas))
                .residualVariance(residualVariance)
                .rSquared(Double.isFinite(rSquared) ? rSquared : 0.0)
                .observations(aligned.observations())
                .build();
    }

    // ==============================
    // VALIDATION
    // ==============================

    private void validateCoverage(String ticker, ReturnSeries series, AnalysisWindow window) {
        if (series == null || series.isEmpty()) {
            throw new DataInsufficientException(
                    "Empty return history for " + ticker + " over " + window,
                    Map.of("ticker", ticker, "window", window.toString()));
        }
        LocalDate latestAcceptableStart = window.getStartDate().plusDays(model.getMaxCoverageGapDays());
        LocalDate earliestAcceptableEnd = window.getEndDate().minusDays(model.getMaxCoverageGapDays());
        if (series.firstDate().isAfter(latestAcceptableStart) || series.lastDate().isBefore(earliestAcceptableEnd)) {
            throw new DataInsufficientException(
                    "Return history for " + ticker + " (" + series.firstDate() + ".." + series.lastDate()
                            + ") does not cover " + window,
                    Map.of("ticker", ticker, "window", window.toString()));
        }
        for (Map.Entry<LocalDate, Double> observation : series.asMap().entrySet()) {
            Double value = observation.getValue();
            if (value == null || !Double.isFinite(value)) {
                throw new DataInsufficientException(
                        "Non-finite return for " + ticker + " on " + observation.getKey(),
                        Map.of("ticker", ticker, "date", observation.getKey().toString()));
            }
        }
    }

    private static void requireObservations(ReturnSeries series, String factor, int minimum) {
        if (series.size() < minimum) {
            throw new DataInsufficientException(
                    "Factor " + factor + " has only " + series.size() + " excess-return observations",
                    Map.of("factor", factor, "observations", series.size()));
        }
    }

    private static void requireFinite(String ticker, String quantity, double value) {
        if (!Double.isFinite(value)) {
            throw new DataInsufficientException(
                    "Non-finite " + quantity + " for " + ticker, Map.of("ticker", ticker, "quantity", quantity));
        }
    }

    private record SeriesKey(String ticker, AnalysisWindow window) {}

    private record ExposureKey(String ticker, AnalysisWindow window, String proxySetHash) {}
}
