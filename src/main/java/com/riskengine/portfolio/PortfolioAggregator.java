package com.riskengine.portfolio;

import com.riskengine.domain.enums.QuantityType;
import com.riskengine.domain.model.CashHolding;
import com.riskengine.domain.model.EquityHolding;
import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.Holding;
import com.riskengine.domain.model.Portfolio;
import com.riskengine.domain.model.WeightedPortfolio;
import com.riskengine.exception.ConfigurationException;
import com.riskengine.exception.DataInsufficientException;
import com.riskengine.exception.DataUnavailableException;
import com.riskengine.marketdata.MarketDataProvider;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw holdings into dollar exposures and weights keyed by analysis ticker.
 *
 * <p>Processing order:
 * <ol>
 *   <li>Reject a non-cash ticker that appears with both share and dollar quantities</li>
 *   <li>Value each holding: shares × latest price on or before the valuation date, or dollars as given</li>
 *   <li>Substitute each cash currency with its proxy ticker; unmapped currencies pass through
 *       as {@code CUR:<ccy>} and are logged</li>
 *   <li>Sum duplicates, verify total dollars are unchanged by the substitution, normalize</li>
 * </ol>
 *
 * <p>Weights are normalized by net value when it is positive. A net-short or dollar-neutral book is
 * normalized by gross exposure instead so weights keep the sign of their positions; a portfolio
 * with no exposure at all gets all-zero weights.
 */
@Component
public class PortfolioAggregator {

    private static final Logger log = LoggerFactory.getLogger(PortfolioAggregator.class);

    static final BigDecimal CASH_MAPPING_TOLERANCE = new BigDecimal("0.01");

    private final MarketDataProvider marketDataProvider;

    public PortfolioAggregator(MarketDataProvider marketDataProvider) {
        this.marketDataProvider = marketDataProvider;
    }

    public WeightedPortfolio aggregate(Portfolio portfolio, FactorProxySet proxySet) {
        return aggregate(portfolio.getHoldings(), proxySet, portfolio.getWindow().getEndDate());
    }

    public WeightedPortfolio aggregate(List<Holding> holdings, FactorProxySet proxySet, LocalDate valuationDate) {
        rejectAmbiguousTickers(holdings);

        Map<String, BigDecimal> exposures = new LinkedHashMap<>();
        List<String> unmappedCurrencies = new ArrayList<>();
        BigDecimal originalTotal = BigDecimal.ZERO;

        for (Holding holding : holdings) {
            BigDecimal dollars = dollarExposure(holding, valuationDate);
            originalTotal = originalTotal.add(dollars);
            exposures.merge(analysisTicker(holding, proxySet, unmappedCurrencies), dollars, BigDecimal::add);
        }

        BigDecimal mappedTotal = exposures.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (mappedTotal.subtract(originalTotal).abs().compareTo(CASH_MAPPING_TOLERANCE) > 0) {
            throw new ConfigurationException(
                    "Cash mapping changed portfolio value",
                    Map.of(
                            "originalTotal", originalTotal.toPlainString(),
                            "mappedTotal", mappedTotal.toPlainString()));
        }

        BigDecimal gross = exposures.values().stream().map(BigDecimal::abs).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal denominator = normalizationBase(mappedTotal, gross);

        Map<String, Double> weights = new LinkedHashMap<>();
        double leverage = 0.0;
        for (Map.Entry<String, BigDecimal> entry : exposures.entrySet()) {
            double weight = denominator.signum() == 0
                    ? 0.0
                    : entry.getValue().divide(denominator, MathContext.DECIMAL64).doubleValue();
            weights.put(entry.getKey(), weight);
            leverage += Math.abs(weight);
        }

        log.debug(
                "Aggregated {} holdings into {} positions, total value {}, leverage {}",
                holdings.size(),
                weights.size(),
                mappedTotal,
                leverage);

        return WeightedPortfolio.builder()
                .exposures(Collections.unmodifiableMap(exposures))
                .weights(Collections.unmodifiableMap(weights))
                .totalValue(mappedTotal)
                .grossExposure(gross)
                .leverage(leverage)
                .unmappedCurrencies(List.copyOf(unmappedCurrencies))
                .build();
    }

    private static BigDecimal normalizationBase(BigDecimal net, BigDecimal gross) {
        if (net.signum() > 0) {
            return net;
        }
        if (gross.signum() > 0) {
            log.warn("Portfolio net value {} is not positive; normalizing weights by gross exposure {}", net, gross);
        }
        return gross;
    }

    private void rejectAmbiguousTickers(List<Holding> holdings) {
        Map<String, QuantityType> seen = new HashMap<>();
        for (Holding holding : holdings) {
            if (holding.isCash()) {
                continue;
            }
            QuantityType previous = seen.putIfAbsent(holding.getTicker(), holding.getQuantityType());
            if (previous != null && previous != holding.getQuantityType()) {
                throw new ConfigurationException(
                        "Ticker " + holding.getTicker() + " is held as both " + previous + " and "
                                + holding.getQuantityType(),
                        Map.of("ticker", holding.getTicker()));
            }
        }
    }

    private BigDecimal dollarExposure(Holding holding, LocalDate valuationDate) {
        if (holding instanceof CashHolding cash) {
            return cash.getDollars();
        }
        EquityHolding equity = (EquityHolding) holding;
        if (equity.getQuantityType() == QuantityType.DOLLARS) {
            return equity.getQuantity();
        }
        try {
            BigDecimal price = marketDataProvider.getLatestPrice(equity.getTicker(), valuationDate);
            return equity.getQuantity().multiply(price);
        } catch (DataUnavailableException e) {
            throw new DataInsufficientException(
                    "Cannot value " + equity.getTicker() + " shares: " + e.getMessage(),
                    Map.of("ticker", equity.getTicker(), "valuationDate", valuationDate.toString()),
                    e);
        }
    }

    private String analysisTicker(Holding holding, FactorProxySet proxySet, List<String> unmappedCurrencies) {
        if (!(holding instanceof CashHolding cash)) {
            return holding.getTicker();
        }
        return proxySet.cashProxyFor(cash.getCurrency()).orElseGet(() -> {
            if (!unmappedCurrencies.contains(cash.getCurrency())) {
                unmappedCurrencies.add(cash.getCurrency());
                log.warn(
                        "No cash proxy for currency {}; holding {} passes through unmapped and is treated as riskless",
                        cash.getCurrency(),
                        cash.getTicker());
            }
            return cash.getTicker();
        });
    }
}
