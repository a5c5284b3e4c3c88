package com.riskengine.domain.model;

import com.riskengine.exception.ConfigurationException;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Unordered set of raw holdings plus the analysis window. Total value and weights are derived
 * by the aggregator and never stored here.
 */
@Getter
public class Portfolio {

    private final String name;
    private final List<Holding> holdings;
    private final AnalysisWindow window;

    @Builder
    private Portfolio(String name, @Singular List<Holding> holdings, AnalysisWindow window) {
        if (window == null) {
            throw new ConfigurationException("Portfolio requires an analysis window");
        }
        this.name = name;
        this.holdings = List.copyOf(holdings);
        this.window = window;
    }

    public boolean isEmpty() {
        return holdings.isEmpty();
    }
}
