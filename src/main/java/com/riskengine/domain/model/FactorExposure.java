package com.riskengine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the beta matrix: a holding's loadings on each factor from a joint OLS regression,
 * plus its annualized residual (idiosyncratic) variance.
 */
@Value
@Builder
public class FactorExposure {

    String ticker;

    /** Factor name to beta, in proxy-set factor order. */
    Map<String, Double> betas;

    /** Annualized OLS residual variance. */
    double residualVariance;

    double rSquared;

    /** Aligned observations used in the regression; 0 for synthetic rows. */
    int observations;

    public double beta(String factor) {
        Double beta = betas.get(factor);
        return beta != null ? beta : 0.0;
    }

    /**
     * Zero-beta, zero-residual row for positions treated as risk free (unmapped cash).
     */
    public static FactorExposure riskless(String ticker, List<String> factors) {
        Map<String, Double> betas = new LinkedHashMap<>();
        for (String factor : factors) {
            betas.put(factor, 0.0);
        }
        return FactorExposure.builder()
                .ticker(ticker)
                .betas(Collections.unmodifiableMap(betas))
                .residualVariance(0.0)
                .rSquared(0.0)
                .observations(0)
                .build();
    }
}
