package com.riskengine.service;

import com.riskengine.domain.model.AnalysisWindow;
import com.riskengine.domain.model.FactorCovariance;
import com.riskengine.domain.model.FactorExposure;
import com.riskengine.domain.model.WeightedPortfolio;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the pipeline needs from the market data provider, fetched up front so the
 * computation that follows does no I/O.
 */
@Value
@Builder
public class PipelineInputs {

    AnalysisWindow window;

    WeightedPortfolio portfolio;

    /** Beta rows for every held ticker plus any extra tickers requested (optimizer candidates). */
    Map<String, FactorExposure> exposures;

    FactorCovariance factorCovariance;

    /** Held analysis tickers followed by extra tickers not already held. */
    public List<String> getUniverse() {
        return new ArrayList<>(exposures.keySet());
    }

    public List<String> getFactors() {
        return factorCovariance.getFactors();
    }
}
