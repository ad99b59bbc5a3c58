package com.autotrader.service.strategy;

import com.autotrader.config.TradingConfig;
import com.autotrader.exception.InvalidInputException;
import com.autotrader.exception.TradeExecutionException;
import com.autotrader.gateway.TradeExecutor;
import com.autotrader.gateway.TradeResult;
import com.autotrader.model.ExitRules;
import com.autotrader.model.Position;
import com.autotrader.model.Strategy;
import com.autotrader.notification.NotificationEventType;
import com.autotrader.notification.Notifier;
import com.autotrader.service.position.CreatePositionCommand;
import com.autotrader.service.position.PositionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AutoTraderServiceTest {

    private static final String STRATEGY_ID = "strat_1";

    private StrategyService strategyService;
    private PositionManager positionManager;
    private TradeExecutor tradeExecutor;
    private Notifier notifier;
    private AutoTraderService autoTrader;
    private Strategy strategy;

    @BeforeEach
    void setUp() {
        strategyService = mock(StrategyService.class);
        positionManager = mock(PositionManager.class);
        tradeExecutor = mock(TradeExecutor.class);
        notifier = mock(Notifier.class);
        autoTrader = new AutoTraderService(strategyService, positionManager, new PositionSizer(),
                tradeExecutor, notifier, new TradingConfig());

        strategy = Strategy.builder()
                .id(STRATEGY_ID)
                .name("Momentum")
                .enabled(true)
                .maxConcurrentPositions(2)
                .maxPositionSize(0.1)
                .totalBudget(1.0)
                .defaultExitRules(ExitRules.builder().stopLossPercent(5.0).build())
                .build();
        when(strategyService.getStrategy(STRATEGY_ID)).thenReturn(strategy);
        when(positionManager.getOpenPositions()).thenReturn(List.of());
    }

    @Test
    @DisplayName("Should buy the sized amount and register the position with the strategy templates")
    void opensPosition() {
        when(tradeExecutor.buy(eq("T"), eq(0.1), any())).thenReturn(TradeResult.success(50.0, 0.002, "tx-1"));
        Position created = Position.builder().id("pos_new").tokenId("T").strategyId(STRATEGY_ID).build();
        when(positionManager.createPosition(any(CreatePositionCommand.class))).thenReturn(created);

        Position position = autoTrader.openPosition(STRATEGY_ID, "T", "TKN");

        assertSame(created, position);
        ArgumentCaptor<CreatePositionCommand> command = ArgumentCaptor.forClass(CreatePositionCommand.class);
        verify(positionManager).createPosition(command.capture());
        assertEquals(STRATEGY_ID, command.getValue().getStrategyId());
        assertEquals(0.002, command.getValue().getEntryPrice(), 1e-12);
        assertEquals(50.0, command.getValue().getAmount(), 1e-12);
        assertEquals(0.1, command.getValue().getBudgetQuote(), 1e-12);
        assertEquals(5.0, command.getValue().getExitRules().getStopLossPercent().doubleValue());
        verify(strategyService).recordTradeOutcome(STRATEGY_ID, true);
        verify(notifier).emit(eq(NotificationEventType.STRATEGY_TRADE_EXECUTED), anyMap());
    }

    @Test
    @DisplayName("Should refuse entries for a disabled strategy without trading")
    void disabledStrategy() {
        strategy.setEnabled(false);

        assertThrows(InvalidInputException.class, () -> autoTrader.openPosition(STRATEGY_ID, "T", null));
        verifyNoInteractions(tradeExecutor);
    }

    @Test
    @DisplayName("Should refuse entries once the strategy holds its maximum positions")
    void positionCap() {
        when(positionManager.getOpenPositions()).thenReturn(List.of(
                Position.builder().id("a").tokenId("T").strategyId(STRATEGY_ID).budgetQuote(0.1).build(),
                Position.builder().id("b").tokenId("U").strategyId(STRATEGY_ID).budgetQuote(0.1).build(),
                Position.builder().id("c").tokenId("V").strategyId("strat_other").budgetQuote(0.1).build()));

        assertThrows(InvalidInputException.class, () -> autoTrader.openPosition(STRATEGY_ID, "W", null));
        verifyNoInteractions(tradeExecutor);
    }

    @Test
    @DisplayName("Should count a failed buy and raise TradeExecutionException")
    void failedBuy() {
        when(tradeExecutor.buy(anyString(), anyDouble(), any())).thenReturn(TradeResult.failure("no route"));

        TradeExecutionException e = assertThrows(TradeExecutionException.class,
                () -> autoTrader.openPosition(STRATEGY_ID, "T", null));

        assertEquals(TradeExecutionException.Side.BUY, e.getSide());
        verify(strategyService).recordTradeOutcome(STRATEGY_ID, false);
        verify(notifier).emit(eq(NotificationEventType.STRATEGY_TRADE_FAILED), anyMap());
        verify(positionManager, never()).createPosition(any(CreatePositionCommand.class));
    }

    @Test
    @DisplayName("Should reject a blank token id")
    void blankToken() {
        assertThrows(InvalidInputException.class, () -> autoTrader.openPosition(STRATEGY_ID, " ", null));
    }
}
