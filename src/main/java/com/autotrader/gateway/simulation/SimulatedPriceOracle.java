package com.autotrader.gateway.simulation;

import com.autotrader.config.SimulationConfig;
import com.autotrader.exception.PriceUnavailableException;
import com.autotrader.gateway.PriceOracle;
import com.autotrader.util.TradingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Demo-mode price source.
 * <p>
 * Each token starts at {@code simulation.initial-price} and moves by a uniform random step of
 * at most {@code simulation.volatility-percent} on every read. Prices set explicitly are pinned
 * and no longer walk. Tokens can be told to fail to exercise the price-unavailable path.
 */
@Slf4j
@Component("marketPriceOracle")
@ConditionalOnProperty(prefix = "simulation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedPriceOracle implements PriceOracle {

    private final SimulationConfig config;
    private final Random random;

    private final Map<String, Double> prices = new ConcurrentHashMap<>();
    private final Set<String> pinnedTokens = ConcurrentHashMap.newKeySet();
    private final Set<String> failingTokens = ConcurrentHashMap.newKeySet();

    @Autowired
    public SimulatedPriceOracle(SimulationConfig config) {
        this(config, new Random());
    }

    SimulatedPriceOracle(SimulationConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    @Override
    public double getPrice(String tokenId) {
        if (failingTokens.contains(tokenId)) {
            throw new PriceUnavailableException(tokenId, "Simulated price feed failure for " + tokenId);
        }
        return prices.compute(tokenId, (k, old) -> {
            if (old == null) {
                return config.getInitialPrice();
            }
            return pinnedTokens.contains(k) ? old : walk(old);
        });
    }

    /**
     * Last price of the token without advancing the walk.
     */
    public double currentPrice(String tokenId) {
        if (failingTokens.contains(tokenId)) {
            throw new PriceUnavailableException(tokenId, "Simulated price feed failure for " + tokenId);
        }
        return prices.computeIfAbsent(tokenId, k -> config.getInitialPrice());
    }

    /**
     * Pins the token at a fixed price.
     */
    public void setPrice(String tokenId, double price) {
        if (!(price > 0)) {
            throw new IllegalArgumentException("Price must be positive");
        }
        prices.put(tokenId, price);
        pinnedTokens.add(tokenId);
        log.info("{} Price for {} pinned at {}", TradingConstants.LOG_PREFIX_SIMULATION, tokenId, price);
    }

    /**
     * Lets a pinned token walk again from its current price.
     */
    public void releasePrice(String tokenId) {
        pinnedTokens.remove(tokenId);
    }

    public void setFailing(String tokenId, boolean failing) {
        if (failing) {
            failingTokens.add(tokenId);
        } else {
            failingTokens.remove(tokenId);
        }
        log.info("{} Price feed for {} {}", TradingConstants.LOG_PREFIX_SIMULATION, tokenId,
                failing ? "failing" : "restored");
    }

    private double walk(double price) {
        double volatility = Math.min(Math.max(config.getVolatilityPercent(), 0.0), 50.0);
        double step = (random.nextDouble() * 2.0 - 1.0) * volatility / 100.0;
        return price * (1.0 + step);
    }
}
