package com.autotrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Monitoring loop configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "monitoring")
@Data
public class MonitoringConfig {

    /** Start the tick driver on application startup */
    private boolean enabled = true;

    /** Fixed tick period; a tick still running when the next one is due causes a skip */
    private long tickIntervalMs = 8000;

    /** Upper bound on tokens priced and positions processed concurrently within one tick */
    private int maxConcurrentChecks = 5;

    /** Price cache TTL; 0 disables caching */
    private long priceCacheTtlMs = 30_000;

    /** Price moves larger than this are logged at info level */
    private double priceChangeLogThresholdPercent = 1.0;

    /** Upper bound on how long a tick waits for its per-token work; tokens still running are left to finish */
    private long tickTimeoutMs = 60_000;

    /** Failed attempts per triggering condition before the position is flagged for manual intervention */
    private int maxActionRetries = 3;
}
