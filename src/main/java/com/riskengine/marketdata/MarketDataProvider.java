package com.riskengine.marketdata;

import com.riskengine.domain.model.ReturnSeries;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Source of historical returns and prices. The engine only pulls by ticker and date range;
 * how the history is sourced (vendor API, database, files) is the implementation's concern.
 *
 * <p>Implementations must be thread-safe. The engine never calls a provider while holding a
 * lock.
 */
public interface MarketDataProvider {

    /**
     * Returns the period returns of {@code ticker} with dates in [startDate, endDate], ordered
     * by date.
     *
     * @throws com.riskengine.exception.DataUnavailableException if the ticker has no data in range
     */
    ReturnSeries getReturns(String ticker, LocalDate startDate, LocalDate endDate);

    /**
     * Returns the most recent price of {@code ticker} on or before {@code asOf}, used to value
     * share-count holdings.
     *
     * @throws com.riskengine.exception.DataUnavailableException if no price exists on or before asOf
     */
    BigDecimal getLatestPrice(String ticker, LocalDate asOf);
}
