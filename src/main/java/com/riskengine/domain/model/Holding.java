package com.riskengine.domain.model;

import com.riskengine.domain.enums.QuantityType;
import com.riskengine.exception.ConfigurationException;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Getter;

/**
 * A single raw position, resolved at ingestion into either an {@link EquityHolding} or a
 * {@link CashHolding}. Downstream components only see the resolved dollar exposure produced
 * by the {@link com.riskengine.portfolio.PortfolioAggregator}.
 *
 * <p>Negative quantities are allowed and encode shorts or margin debt.
 */
@Getter
public abstract class Holding {

    public static final String CASH_PREFIX = "CUR:";

    private final String ticker;

    Holding(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new ConfigurationException("Holding ticker must not be blank");
        }
        this.ticker = ticker.trim().toUpperCase();
    }

    public abstract QuantityType getQuantityType();

    public abstract BigDecimal getQuantity();

    public abstract boolean isCash();

    /**
     * Resolves a raw (ticker, shares, dollars) record. Tickers of the form {@code CUR:<ccy>}
     * become cash holdings and must be given in dollars; everything else is an equity with
     * exactly one of shares or dollars set.
     */
    public static Holding of(String ticker, Double shares, Double dollars) {
        if (ticker != null && ticker.trim().toUpperCase().startsWith(CASH_PREFIX)) {
            if (shares != null) {
                throw new ConfigurationException(
                        "Cash holding " + ticker + " must be expressed in dollars", Map.of("ticker", ticker));
            }
            return CashHolding.of(ticker.trim().substring(CASH_PREFIX.length()), toDecimal(ticker, dollars));
        }
        if ((shares == null) == (dollars == null)) {
            throw new ConfigurationException(
                    "Holding " + ticker + " must set exactly one of shares or dollars",
                    Map.of("ticker", String.valueOf(ticker)));
        }
        return shares != null
                ? EquityHolding.ofShares(ticker, toDecimal(ticker, shares))
                : EquityHolding.ofDollars(ticker, toDecimal(ticker, dollars));
    }

    static BigDecimal toDecimal(String ticker, Double value) {
        if (value == null) {
            throw new ConfigurationException("Holding " + ticker + " has no quantity", Map.of("ticker", ticker));
        }
        if (value.isNaN() || value.isInfinite()) {
            throw new ConfigurationException(
                    "Holding " + ticker + " has a non-finite quantity", Map.of("ticker", ticker, "quantity", value));
        }
        return BigDecimal.valueOf(value);
    }
}
