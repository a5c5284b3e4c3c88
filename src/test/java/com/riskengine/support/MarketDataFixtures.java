package com.riskengine.support;

import com.riskengine.domain.model.AnalysisWindow;
import com.riskengine.domain.model.FactorProxySet;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic synthetic monthly return histories for tests.
 */
public final class MarketDataFixtures {

    /** Three years of month-end observations: 2022-01-31 through 2024-12-31. */
    public static final AnalysisWindow WINDOW =
            AnalysisWindow.of(LocalDate.of(2022, 1, 1), LocalDate.of(2024, 12, 31));

    private MarketDataFixtures() {}

    public static FactorProxySet marketOnlyProxySet() {
        return FactorProxySet.builder()
                .id("market-only")
                .factor(FactorProxySet.MARKET, "SPY")
                .cashProxy("USD", "SGOV")
                .build();
    }

    public static List<LocalDate> monthEnds(AnalysisWindow window) {
        List<LocalDate> dates = new ArrayList<>();
        YearMonth month = YearMonth.from(window.getStartDate());
        while (!month.atEndOfMonth().isAfter(window.getEndDate())) {
            dates.add(month.atEndOfMonth());
            month = month.plusMonths(1);
        }
        return dates;
    }

    /** Gaussian returns with the given mean and standard deviation, reproducible by seed. */
    public static Map<LocalDate, Double> gaussian(long seed, double mean, double standardDeviation) {
        Random random = new Random(seed);
        Map<LocalDate, Double> returns = new LinkedHashMap<>();
        for (LocalDate date : monthEnds(WINDOW)) {
            returns.put(date, mean + standardDeviation * random.nextGaussian());
        }
        return returns;
    }

    public static Map<LocalDate, Double> constant(double value) {
        Map<LocalDate, Double> returns = new LinkedHashMap<>();
        for (LocalDate date : monthEnds(WINDOW)) {
            returns.put(date, value);
        }
        return returns;
    }

    /** residual + beta × factor, date by date. */
    public static Map<LocalDate, Double> exposed(
            Map<LocalDate, Double> residual, double beta, Map<LocalDate, Double> factor) {
        return exposed(residual, new double[] {beta}, List.of(factor));
    }

    /** residual + Σ betaₖ × factorₖ, date by date. */
    public static Map<LocalDate, Double> exposed(
            Map<LocalDate, Double> residual, double[] betas, List<Map<LocalDate, Double>> factors) {
        Map<LocalDate, Double> returns = new LinkedHashMap<>();
        for (Map.Entry<LocalDate, Double> entry : residual.entrySet()) {
            double value = entry.getValue();
            for (int k = 0; k < betas.length; k++) {
                value += betas[k] * factors.get(k).get(entry.getKey());
            }
            returns.put(entry.getKey(), value);
        }
        return returns;
    }
}
