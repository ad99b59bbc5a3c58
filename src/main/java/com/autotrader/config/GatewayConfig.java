package com.autotrader.config;

import com.autotrader.gateway.PriceOracle;
import com.autotrader.service.monitoring.CachingPriceOracle;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Wraps the market price source in the TTL cache.
 * <p>
 * The raw source is the bean named {@code marketPriceOracle}: the simulator in demo mode,
 * otherwise whatever the deployment provides.
 */
@Configuration
public class GatewayConfig {

    @Bean
    @Primary
    public CachingPriceOracle cachingPriceOracle(@Qualifier("marketPriceOracle") PriceOracle marketPriceOracle,
                                                 MonitoringConfig monitoringConfig,
                                                 Clock clock) {
        return new CachingPriceOracle(marketPriceOracle, monitoringConfig, clock);
    }
}
