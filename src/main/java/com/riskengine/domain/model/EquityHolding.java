package com.riskengine.domain.model;

import com.riskengine.domain.enums.QuantityType;
import com.riskengine.exception.ConfigurationException;
import java.math.BigDecimal;
import java.util.Map;

/**
 * A security position held either as a share count (valued at the latest price on or before
 * the valuation date) or directly as a dollar amount.
 */
public final class EquityHolding extends Holding {

    private final QuantityType quantityType;
    private final BigDecimal quantity;

    private EquityHolding(String ticker, QuantityType quantityType, BigDecimal quantity) {
        super(ticker);
        if (quantity == null) {
            throw new ConfigurationException("Holding " + ticker + " has no quantity", Map.of("ticker", ticker));
        }
        if (getTicker().startsWith(CASH_PREFIX)) {
            throw new ConfigurationException(
                    "Ticker " + ticker + " is reserved for cash holdings", Map.of("ticker", ticker));
        }
        this.quantityType = quantityType;
        this.quantity = quantity;
    }

    public static EquityHolding ofShares(String ticker, BigDecimal shares) {
        return new EquityHolding(ticker, QuantityType.SHARES, shares);
    }

    public static EquityHolding ofDollars(String ticker, BigDecimal dollars) {
        return new EquityHolding(ticker, QuantityType.DOLLARS, dollars);
    }

    public static EquityHolding ofShares(String ticker, double shares) {
        return ofShares(ticker, toDecimal(ticker, shares));
    }

    public static EquityHolding ofDollars(String ticker, double dollars) {
        return ofDollars(ticker, toDecimal(ticker, dollars));
    }

    @Override
    public QuantityType getQuantityType() {
        return quantityType;
    }

    @Override
    public BigDecimal getQuantity() {
        return quantity;
    }

    @Override
    public boolean isCash() {
        return false;
    }

    @Override
    public String toString() {
        return getTicker() + "(" + quantity.toPlainString() + " " + quantityType + ")";
    }
}
