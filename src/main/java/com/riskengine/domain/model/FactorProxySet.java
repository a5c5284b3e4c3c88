package com.riskengine.domain.model;

import com.riskengine.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Maps each risk factor to the tradable proxy whose returns stand in for it, and each cash
 * currency to the instrument that replaces it for analysis.
 *
 * <p>Factor order is significant: it fixes the column order of every beta matrix and factor
 * covariance built from this set. Factors listed in {@code excessFactors} are measured as the
 * proxy's return minus the {@value #MARKET} factor's return on the same date.
 *
 * <p>Cache identity is the content hash computed by
 * {@link com.riskengine.cache.FingerprintGenerator#proxySetHash}, not {@link #getId()}.
 */
@Getter
public class FactorProxySet {

    public static final String MARKET = "market";

    private final String id;
    private final Map<String, String> factors;
    private final Set<String> excessFactors;
    private final Map<String, String> cashProxies;

    @Builder
    private FactorProxySet(
            String id,
            @Singular("factor") Map<String, String> factors,
            @Singular("excessFactor") Set<String> excessFactors,
            @Singular("cashProxy") Map<String, String> cashProxies) {
        if (factors == null || factors.isEmpty()) {
            throw new ConfigurationException("Factor proxy set must define at least one factor");
        }
        Map<String, String> normalizedFactors = new LinkedHashMap<>();
        factors.forEach((name, proxy) -> {
            if (name == null || name.isBlank() || proxy == null || proxy.isBlank()) {
                throw new ConfigurationException(
                        "Factor proxy entries require a name and a ticker",
                        Map.of("factor", String.valueOf(name), "proxy", String.valueOf(proxy)));
            }
            normalizedFactors.put(name.trim(), proxy.trim().toUpperCase());
        });
        for (String excess : excessFactors) {
            if (!normalizedFactors.containsKey(excess)) {
                throw new ConfigurationException(
                        "Excess factor " + excess + " is not defined in the proxy set", Map.of("factor", excess));
            }
            if (MARKET.equals(excess) || !normalizedFactors.containsKey(MARKET)) {
                throw new ConfigurationException(
                        "Excess factor " + excess + " requires a separate '" + MARKET + "' factor",
                        Map.of("factor", excess));
            }
        }
        Map<String, String> normalizedCash = new LinkedHashMap<>();
        cashProxies.forEach((currency, proxy) -> {
            if (currency == null || currency.isBlank() || proxy == null || proxy.isBlank()) {
                throw new ConfigurationException(
                        "Cash proxy entries require a currency and a ticker",
                        Map.of("currency", String.valueOf(currency), "proxy", String.valueOf(proxy)));
            }
            normalizedCash.put(currency.trim().toUpperCase(), proxy.trim().toUpperCase());
        });

        this.id = id;
        this.factors = Collections.unmodifiableMap(normalizedFactors);
        this.excessFactors = Collections.unmodifiableSet(new LinkedHashSet<>(excessFactors));
        this.cashProxies = Collections.unmodifiableMap(normalizedCash);
    }

    public List<String> getFactorNames() {
        return new ArrayList<>(factors.keySet());
    }

    public String proxyFor(String factor) {
        return factors.get(factor);
    }

    public boolean isExcessFactor(String factor) {
        return excessFactors.contains(factor);
    }

    public Optional<String> cashProxyFor(String currency) {
        return Optional.ofNullable(cashProxies.get(currency.toUpperCase()));
    }
}
