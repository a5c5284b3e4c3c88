package com.riskengine.domain.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.Getter;

/**
 * Date-ordered period returns for one ticker, as supplied by the market data provider.
 * Immutable.
 */
public final class ReturnSeries {

    @Getter
    private final String ticker;

    private final NavigableMap<LocalDate, Double> returns;

    private ReturnSeries(String ticker, NavigableMap<LocalDate, Double> returns) {
        this.ticker = ticker;
        this.returns = Collections.unmodifiableNavigableMap(returns);
    }

    public static ReturnSeries of(String ticker, Map<LocalDate, Double> returns) {
        return new ReturnSeries(ticker, new TreeMap<>(returns));
    }

    public static ReturnSeries empty(String ticker) {
        return new ReturnSeries(ticker, new TreeMap<>());
    }

    public int size() {
        return returns.size();
    }

    public boolean isEmpty() {
        return returns.isEmpty();
    }

    public LocalDate firstDate() {
        return returns.isEmpty() ? null : returns.firstKey();
    }

    public LocalDate lastDate() {
        return returns.isEmpty() ? null : returns.lastKey();
    }

    public Double get(LocalDate date) {
        return returns.get(date);
    }

    public NavigableMap<LocalDate, Double> asMap() {
        return returns;
    }

    /** Returns the sub-series with dates in [start, end], both inclusive. */
    public ReturnSeries between(LocalDate start, LocalDate end) {
        return new ReturnSeries(ticker, new TreeMap<>(returns.subMap(start, true, end, true)));
    }

    /**
     * Returns this series minus {@code other} on the dates both share. Used for style factors
     * measured in excess of the market.
     */
    public ReturnSeries minus(ReturnSeries other, String resultTicker) {
        TreeMap<LocalDate, Double> difference = new TreeMap<>();
        for (Map.Entry<LocalDate, Double> entry : returns.entrySet()) {
            Double subtrahend = other.get(entry.getKey());
            if (subtrahend != null) {
                difference.put(entry.getKey(), entry.getValue() - subtrahend);
            }
        }
        return new ReturnSeries(resultTicker, difference);
    }

    public double mean() {
        if (returns.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : returns.values()) {
            sum += value;
        }
        return sum / returns.size();
    }

    @Override
    public String toString() {
        return "ReturnSeries{" + ticker + ", " + size() + " obs, " + firstDate() + ".." + lastDate() + "}";
    }
}
