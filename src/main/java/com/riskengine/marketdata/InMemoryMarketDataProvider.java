package com.riskengine.marketdata;

import com.riskengine.domain.model.ReturnSeries;
import com.riskengine.exception.DataUnavailableException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe in-memory provider. Registered as the default bean when the application supplies
 * no provider of its own, and used directly by tests.
 */
public class InMemoryMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMarketDataProvider.class);

    private final Map<String, NavigableMap<LocalDate, Double>> returns = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<LocalDate, BigDecimal>> prices = new ConcurrentHashMap<>();

    public InMemoryMarketDataProvider putReturns(String ticker, Map<LocalDate, Double> series) {
        returns.computeIfAbsent(ticker.toUpperCase(), key -> new ConcurrentSkipListMap<>())
                .putAll(series);
        return this;
    }

    public InMemoryMarketDataProvider putReturn(String ticker, LocalDate date, double value) {
        returns.computeIfAbsent(ticker.toUpperCase(), key -> new ConcurrentSkipListMap<>())
                .put(date, value);
        return this;
    }

    public InMemoryMarketDataProvider putPrice(String ticker, LocalDate date, BigDecimal price) {
        prices.computeIfAbsent(ticker.toUpperCase(), key -> new ConcurrentSkipListMap<>())
                .put(date, price);
        return this;
    }

    public void clear() {
        returns.clear();
        prices.clear();
    }

    @Override
    public ReturnSeries getReturns(String ticker, LocalDate startDate, LocalDate endDate) {
        NavigableMap<LocalDate, Double> series = returns.get(ticker.toUpperCase());
        if (series == null) {
            throw new DataUnavailableException("No return history for " + ticker, Map.of("ticker", ticker));
        }
        NavigableMap<LocalDate, Double> range = series.subMap(startDate, true, endDate, true);
        if (range.isEmpty()) {
            throw new DataUnavailableException(
                    "No returns for " + ticker + " between " + startDate + " and " + endDate,
                    Map.of("ticker", ticker, "startDate", startDate.toString(), "endDate", endDate.toString()));
        }
        log.debug("Serving {} returns for {} in [{}, {}]", range.size(), ticker, startDate, endDate);
        return ReturnSeries.of(ticker.toUpperCase(), range);
    }

    @Override
    public BigDecimal getLatestPrice(String ticker, LocalDate asOf) {
        NavigableMap<LocalDate, BigDecimal> series = prices.get(ticker.toUpperCase());
        Map.Entry<LocalDate, BigDecimal> latest = series != null ? series.floorEntry(asOf) : null;
        if (latest == null) {
            throw new DataUnavailableException(
                    "No price for " + ticker + " on or before " + asOf,
                    Map.of("ticker", ticker, "asOf", asOf.toString()));
        }
        return latest.getValue();
    }
}
