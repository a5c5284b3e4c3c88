package com.riskengine.config;

import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.marketdata.InMemoryMarketDataProvider;
import com.riskengine.marketdata.MarketDataProvider;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Core engine beans. The market data provider and clock are overridable: the surrounding
 * application registers its own {@link MarketDataProvider} and the in-memory one backs off.
 */
@Configuration
public class RiskEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(MarketDataProvider.class)
    public InMemoryMarketDataProvider inMemoryMarketDataProvider() {
        return new InMemoryMarketDataProvider();
    }

    /**
     * Proxy set used when a caller does not pass one, built from {@code riskengine.proxies.*}.
     */
    @Bean
    public FactorProxySet defaultFactorProxySet(RiskEngineProperties properties) {
        RiskEngineProperties.Proxies proxies = properties.getProxies();
        return FactorProxySet.builder()
                .id(proxies.getId())
                .factors(proxies.getFactors())
                .excessFactors(proxies.getExcessFactors())
                .cashProxies(proxies.getCash())
                .build();
    }
}
