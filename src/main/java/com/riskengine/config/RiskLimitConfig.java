package com.riskengine.config;

import com.riskengine.risk.RiskLimitSet;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the default {@link RiskLimitSet} bean from application.properties.
 *
 * <p>Every limit defaults to null (disabled), so a fresh deployment reports metrics without
 * any verdicts until limits are configured. Callers may always pass their own limit set to
 * {@link com.riskengine.service.PortfolioRiskService}.
 *
 * <p>Properties prefix: {@code riskengine.limits.*}
 */
@Configuration
public class RiskLimitConfig {

    @Bean
    public RiskLimitSet defaultRiskLimits(
            @Value("${riskengine.limits.name:default}") String name,
            @Value("${riskengine.limits.max-volatility:#{null}}") Double maxVolatility,
            @Value("${riskengine.limits.max-single-holding-weight:#{null}}") Double maxSingleHoldingWeight,
            @Value("${riskengine.limits.max-factor-variance-share:#{null}}") Double maxFactorVarianceShare,
            @Value("${riskengine.limits.max-total-factor-variance-share:#{null}}") Double maxTotalFactorVarianceShare,
            @Value("${riskengine.limits.max-single-factor-loss:#{null}}") Double maxSingleFactorLoss,
            @Value("${riskengine.limits.max-leverage:#{null}}") Double maxLeverage) {
        RiskLimitSet limits = RiskLimitSet.builder()
                .name(name)
                .maxVolatility(maxVolatility)
                .maxSingleHoldingWeight(maxSingleHoldingWeight)
                .maxFactorVarianceShare(maxFactorVarianceShare)
                .maxTotalFactorVarianceShare(maxTotalFactorVarianceShare)
                .maxSingleFactorLoss(maxSingleFactorLoss)
                .maxLeverage(maxLeverage)
                .build();
        limits.validate();
        return limits;
    }
}
