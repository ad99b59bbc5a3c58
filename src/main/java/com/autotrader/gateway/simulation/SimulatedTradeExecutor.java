package com.autotrader.gateway.simulation;

import com.autotrader.config.SimulationConfig;
import com.autotrader.exception.PriceUnavailableException;
import com.autotrader.gateway.TradeExecutor;
import com.autotrader.gateway.TradeOptions;
import com.autotrader.gateway.TradeResult;
import com.autotrader.util.TradingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.UUID;

/**
 * Demo-mode trade executor.
 * <p>
 * Fills immediately at the simulated market price moved against the trader by
 * {@code simulation.slippage-percent}. A fill whose slippage exceeds the caller's tolerance is
 * refused. Execution delay and random rejection can be switched on to exercise the
 * failure paths.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "simulation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedTradeExecutor implements TradeExecutor {

    private static final String LOG_PREFIX = TradingConstants.LOG_PREFIX_SIMULATION;

    private final SimulationConfig config;
    private final SimulatedPriceOracle priceOracle;
    private final Random random;

    @Autowired
    public SimulatedTradeExecutor(SimulationConfig config, SimulatedPriceOracle priceOracle) {
        this(config, priceOracle, new Random());
    }

    SimulatedTradeExecutor(SimulationConfig config, SimulatedPriceOracle priceOracle, Random random) {
        this.config = config;
        this.priceOracle = priceOracle;
        this.random = random;
    }

    @Override
    public TradeResult buy(String tokenId, double amountQuote, TradeOptions options) {
        log.info("{} Buying {} with {} quote", LOG_PREFIX, tokenId, amountQuote);
        if (!(amountQuote > 0)) {
            return reject(tokenId, "Buy amount must be positive");
        }
        String precheck = simulateExecution(options);
        if (precheck != null) {
            return reject(tokenId, precheck);
        }
        try {
            double fillPrice = priceOracle.currentPrice(tokenId) * (1.0 + config.getSlippagePercent() / 100.0);
            double amountOut = amountQuote / fillPrice;
            String txRef = newTxRef();
            log.info("{} Buy filled: {} {} @ {} ({})", LOG_PREFIX, amountOut, tokenId, fillPrice, txRef);
            return TradeResult.success(amountOut, fillPrice, txRef);
        } catch (PriceUnavailableException e) {
            return reject(tokenId, "No price: " + e.getMessage());
        }
    }

    @Override
    public TradeResult sell(String tokenId, double amountBase, TradeOptions options) {
        log.info("{} Selling {} {}", LOG_PREFIX, amountBase, tokenId);
        if (!(amountBase > 0)) {
            return reject(tokenId, "Sell amount must be positive");
        }
        String precheck = simulateExecution(options);
        if (precheck != null) {
            return reject(tokenId, precheck);
        }
        try {
            double fillPrice = priceOracle.currentPrice(tokenId) * (1.0 - config.getSlippagePercent() / 100.0);
            double quoteOut = amountBase * fillPrice;
            String txRef = newTxRef();
            log.info("{} Sell filled: {} {} @ {} for {} quote ({})", LOG_PREFIX, amountBase, tokenId, fillPrice, quoteOut, txRef);
            return TradeResult.success(quoteOut, fillPrice, txRef);
        } catch (PriceUnavailableException e) {
            return reject(tokenId, "No price: " + e.getMessage());
        }
    }

    /**
     * Applies delay, slippage tolerance and random rejection.
     *
     * @return rejection reason, or null when the trade may fill
     */
    private String simulateExecution(TradeOptions options) {
        if (config.isEnableExecutionDelay()) {
            try {
                Thread.sleep(config.getExecutionDelayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("{} Thread interrupted: {}", LOG_PREFIX, e.getMessage(), e);
                return "Execution interrupted";
            }
        }
        if (options != null && config.getSlippagePercent() > options.getSlippagePercent()) {
            return "Slippage " + config.getSlippagePercent() + "% exceeds tolerance " + options.getSlippagePercent() + "%";
        }
        if (config.isEnableOrderRejection() && random.nextDouble() < config.getRejectionProbability()) {
            return "Random rejection for simulation";
        }
        return null;
    }

    private TradeResult reject(String tokenId, String reason) {
        log.warn("{} Trade rejected for {}: {}", LOG_PREFIX, tokenId, reason);
        return TradeResult.failure(reason);
    }

    private static String newTxRef() {
        return TradingConstants.SIMULATED_TX_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
