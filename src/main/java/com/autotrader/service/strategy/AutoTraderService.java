package com.autotrader.service.strategy;

import com.autotrader.config.TradingConfig;
import com.autotrader.exception.InvalidInputException;
import com.autotrader.exception.TradeExecutionException;
import com.autotrader.gateway.TradeExecutor;
import com.autotrader.gateway.TradeOptions;
import com.autotrader.gateway.TradeResult;
import com.autotrader.model.Position;
import com.autotrader.model.Strategy;
import com.autotrader.notification.NotificationEventType;
import com.autotrader.notification.Notifier;
import com.autotrader.service.position.CreatePositionCommand;
import com.autotrader.service.position.PositionManager;
import com.autotrader.util.TradingConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens positions on behalf of a strategy.
 * <p>
 * Entries for the same strategy are serialized so that two concurrent requests cannot both
 * pass the position-count and budget checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoTraderService {

    private final StrategyService strategyService;
    private final PositionManager positionManager;
    private final PositionSizer positionSizer;
    private final TradeExecutor tradeExecutor;
    private final Notifier notifier;
    private final TradingConfig tradingConfig;

    private final Map<String, Object> strategyLocks = new ConcurrentHashMap<>();

    /**
     * Buys {@code tokenId} sized by the strategy's limits and registers the resulting position
     * with the strategy's exit rules and scale-in plan.
     *
     * @throws InvalidInputException   if the strategy is disabled or its limits refuse the entry
     * @throws TradeExecutionException if the buy fails
     */
    public Position openPosition(String strategyId, String tokenId, String tokenSymbol) {
        if (tokenId == null || tokenId.isBlank()) {
            throw new InvalidInputException("Token id is required");
        }
        Strategy strategy = strategyService.getStrategy(strategyId);
        if (!strategy.isEnabled()) {
            throw new InvalidInputException("Strategy " + strategy.getName() + " is disabled");
        }

        synchronized (strategyLocks.computeIfAbsent(strategyId, k -> new Object())) {
            List<Position> open = positionManager.getOpenPositions().stream()
                    .filter(p -> strategyId.equals(p.getStrategyId()))
                    .toList();
            PositionSizingDecision decision = positionSizer.size(strategy, open);
            if (!decision.isAllowed()) {
                log.warn("Entry refused for strategy {} on {}: {}", strategy.getName(), tokenId, decision.getReason());
                throw new InvalidInputException(decision.getReason());
            }

            log.info("Executing strategy {} entry on {}: budget={}, initialBuy={}",
                    strategy.getName(), tokenId, decision.getPositionBudget(), decision.getInitialBuyQuote());
            TradeResult result = buy(tokenId, decision.getInitialBuyQuote());
            if (!result.isSuccess() || !(result.getAmountOut() > 0)) {
                String error = result.getError() != null ? result.getError() : "Buy returned no tokens";
                strategyService.recordTradeOutcome(strategyId, false);
                Map<String, Object> payload = payload(strategyId, tokenId, tokenSymbol);
                payload.put(TradingConstants.KEY_QUOTE, decision.getInitialBuyQuote());
                payload.put(TradingConstants.KEY_ERROR, error);
                notifier.emit(NotificationEventType.STRATEGY_TRADE_FAILED, payload);
                log.error("Strategy {} entry on {} failed: {}", strategy.getName(), tokenId, error);
                throw new TradeExecutionException(TradeExecutionException.Side.BUY,
                        "Buy of " + tokenId + " failed: " + error);
            }

            double amount = result.getAmountOut();
            double entryPrice = result.getExecutionPrice() > 0
                    ? result.getExecutionPrice()
                    : decision.getInitialBuyQuote() / amount;
            Position position = positionManager.createPosition(CreatePositionCommand.builder()
                    .tokenId(tokenId)
                    .tokenSymbol(tokenSymbol)
                    .strategyId(strategyId)
                    .entryPrice(entryPrice)
                    .amount(amount)
                    .budgetQuote(decision.getPositionBudget())
                    .investedQuote(decision.getInitialBuyQuote())
                    .exitRules(strategy.getDefaultExitRules())
                    .scaleInPlan(strategy.getDefaultScaleInPlan())
                    .build());
            strategyService.recordTradeOutcome(strategyId, true);

            Map<String, Object> payload = payload(strategyId, tokenId, tokenSymbol);
            payload.put(TradingConstants.KEY_POSITION_ID, position.getId());
            payload.put(TradingConstants.KEY_AMOUNT, amount);
            payload.put(TradingConstants.KEY_PRICE, entryPrice);
            payload.put(TradingConstants.KEY_QUOTE, decision.getInitialBuyQuote());
            payload.put(TradingConstants.KEY_TX_REF, result.getTxRef());
            notifier.emit(NotificationEventType.STRATEGY_TRADE_EXECUTED, payload);
            return position;
        }
    }

    private TradeResult buy(String tokenId, double quote) {
        TradeOptions options = TradeOptions.builder()
                .slippagePercent(tradingConfig.getBuySlippagePercent())
                .maxRetries(tradingConfig.getExecutorMaxRetries())
                .build();
        try {
            TradeResult result = tradeExecutor.buy(tokenId, quote, options);
            return result != null ? result : TradeResult.failure("Trade executor returned no result");
        } catch (RuntimeException e) {
            log.error("Buy of {} threw: {}", tokenId, e.getMessage(), e);
            return TradeResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static Map<String, Object> payload(String strategyId, String tokenId, String tokenSymbol) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TradingConstants.KEY_STRATEGY_ID, strategyId);
        payload.put(TradingConstants.KEY_TOKEN_ID, tokenId);
        payload.put(TradingConstants.KEY_TOKEN_SYMBOL, tokenSymbol);
        return payload;
    }
}
