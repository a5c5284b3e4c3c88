package com.riskengine.domain.model;

import com.riskengine.domain.enums.QuantityType;
import com.riskengine.exception.ConfigurationException;
import java.math.BigDecimal;
import java.util.Map;

/**
 * A cash balance in one currency, identified by the ticker {@code CUR:<currency>}.
 * A negative balance is margin debt.
 */
public final class CashHolding extends Holding {

    private final String currency;
    private final BigDecimal dollars;

    private CashHolding(String currency, BigDecimal dollars) {
        super(CASH_PREFIX + currency);
        if (dollars == null) {
            throw new ConfigurationException(
                    "Cash holding " + currency + " has no dollar amount", Map.of("currency", currency));
        }
        this.currency = currency;
        this.dollars = dollars;
    }

    public static CashHolding of(String currency, BigDecimal dollars) {
        if (currency == null || currency.isBlank()) {
            throw new ConfigurationException("Cash holding currency must not be blank");
        }
        return new CashHolding(currency.trim().toUpperCase(), dollars);
    }

    public static CashHolding of(String currency, double dollars) {
        return of(currency, toDecimal(CASH_PREFIX + currency, dollars));
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getDollars() {
        return dollars;
    }

    @Override
    public QuantityType getQuantityType() {
        return QuantityType.DOLLARS;
    }

    @Override
    public BigDecimal getQuantity() {
        return dollars;
    }

    @Override
    public boolean isCash() {
        return true;
    }

    @Override
    public String toString() {
        return getTicker() + "(" + dollars.toPlainString() + ")";
    }
}
