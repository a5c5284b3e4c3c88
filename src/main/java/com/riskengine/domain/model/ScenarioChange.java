package com.riskengine.domain.model;

import com.riskengine.exception.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.Value;

/**
 * A what-if edit of a portfolio's analysis weights: either a full replacement of the weight
 * vector or additive shifts applied to the current weights. Tickers are analysis tickers, so
 * cash is addressed by its proxy ticker (or {@code CUR:<ccy>} when unmapped).
 *
 * <p>Shift strings accept basis points ({@code "+200bp"}, {@code "-75bps"}), percentages
 * ({@code "1.5%"}) or plain decimals ({@code "-0.01"}).
 */
@Value
public class ScenarioChange {

    String name;

    /** Full replacement weights; null for a shift scenario. */
    Map<String, Double> newWeights;

    /** Additive weight shifts; null for a replacement scenario. */
    Map<String, Double> weightShifts;

    private ScenarioChange(String name, Map<String, Double> newWeights, Map<String, Double> weightShifts) {
        this.name = name != null ? name : "what-if";
        this.newWeights = newWeights != null ? normalizeKeys(newWeights) : null;
        this.weightShifts = weightShifts != null ? normalizeKeys(weightShifts) : null;
    }

    public static ScenarioChange replaceWeights(String name, Map<String, Double> newWeights) {
        if (newWeights == null || newWeights.isEmpty()) {
            throw new ConfigurationException("Scenario " + name + " has no replacement weights");
        }
        return new ScenarioChange(name, newWeights, null);
    }

    public static ScenarioChange shiftWeights(String name, Map<String, Double> weightShifts) {
        if (weightShifts == null || weightShifts.isEmpty()) {
            throw new ConfigurationException("Scenario " + name + " has no weight shifts");
        }
        return new ScenarioChange(name, null, weightShifts);
    }

    /**
     * Parses comma-separated {@code TICKER:shift} pairs, e.g. {@code "AAPL:+500bp,SGOV:-2%"}.
     */
    public static ScenarioChange parseShifts(String name, String inline) {
        if (inline == null || inline.isBlank()) {
            throw new ConfigurationException("Scenario " + name + " has no weight shifts");
        }
        Map<String, Double> shifts = new LinkedHashMap<>();
        for (String pair : inline.split(",")) {
            int separator = pair.lastIndexOf(':');
            if (separator <= 0 || separator == pair.length() - 1) {
                throw new ConfigurationException(
                        "Weight shift must look like TICKER:+200bp", Map.of("shift", pair.trim()));
            }
            shifts.merge(pair.substring(0, separator).trim(), parseShift(pair.substring(separator + 1)), Double::sum);
        }
        return shiftWeights(name, shifts);
    }

    /**
     * Converts one shift string to a decimal weight change.
     *
     * @throws ConfigurationException if the text is not a finite number in a supported unit
     */
    public static double parseShift(String text) {
        String t = text == null ? "" : text.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        double divisor = 1.0;
        if (t.endsWith("%")) {
            t = t.substring(0, t.length() - 1);
            divisor = 100.0;
        } else if (t.endsWith("bps")) {
            t = t.substring(0, t.length() - 3);
            divisor = 10_000.0;
        } else if (t.endsWith("bp")) {
            t = t.substring(0, t.length() - 2);
            divisor = 10_000.0;
        }
        try {
            double value = Double.parseDouble(t) / divisor;
            if (!Double.isFinite(value)) {
                throw new NumberFormatException("non-finite");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Unreadable weight shift '" + text + "'", Map.of("shift", String.valueOf(text)));
        }
    }

    public boolean isReplacement() {
        return newWeights != null;
    }

    /**
     * Applies the change to {@code currentWeights} and renormalizes: by the net sum when it is
     * positive, otherwise by the gross sum, the same rule the aggregator uses for dollars.
     *
     * @throws ConfigurationException if the resulting weights are all zero
     */
    public Map<String, Double> applyTo(Map<String, Double> currentWeights) {
        Map<String, Double> raw = new LinkedHashMap<>();
        if (isReplacement()) {
            raw.putAll(newWeights);
        } else {
            raw.putAll(currentWeights);
            weightShifts.forEach((ticker, shift) -> raw.merge(ticker, shift, Double::sum));
        }

        double net = 0.0;
        double gross = 0.0;
        for (double weight : raw.values()) {
            net += weight;
            gross += Math.abs(weight);
        }
        double denominator = net > 0.0 ? net : gross;
        if (denominator <= 0.0) {
            throw new ConfigurationException("Scenario " + name + " leaves no exposure", Map.of("scenario", name));
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        raw.forEach((ticker, weight) -> weights.put(ticker, weight / denominator));
        return Collections.unmodifiableMap(weights);
    }

    private static Map<String, Double> normalizeKeys(Map<String, Double> values) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        values.forEach((ticker, value) -> {
            if (ticker == null || ticker.isBlank()) {
                throw new ConfigurationException("Scenario ticker must not be blank");
            }
            if (value == null || !Double.isFinite(value)) {
                throw new ConfigurationException(
                        "Scenario weight for " + ticker + " must be finite", Map.of("ticker", ticker));
            }
            normalized.merge(ticker.trim().toUpperCase(Locale.ROOT), value, Double::sum);
        });
        return Collections.unmodifiableMap(normalized);
    }
}
