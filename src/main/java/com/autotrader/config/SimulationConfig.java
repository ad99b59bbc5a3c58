package com.autotrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Demo mode configuration.
 * Controls the simulated price oracle and trade executor used instead of a real aggregator.
 */
@Configuration
@ConfigurationProperties(prefix = "simulation")
@Data
public class SimulationConfig {

    // Master flag
    private boolean enabled = true;

    // Price random walk
    private double initialPrice = 0.000001;
    private double volatilityPercent = 3.0;

    // Execution configuration
    private double slippagePercent = 0.5;
    private boolean enableExecutionDelay = false;
    private long executionDelayMs = 1500;

    // Order rejection simulation
    private boolean enableOrderRejection = false;
    private double rejectionProbability = 0.1; // 10%
}
