package com.autotrader.service.position;

import com.autotrader.config.MonitoringConfig;
import com.autotrader.config.TradingConfig;
import com.autotrader.exception.ConcurrencyViolationException;
import com.autotrader.exception.InvalidInputException;
import com.autotrader.exception.ResourceNotFoundException;
import com.autotrader.gateway.TradeExecutor;
import com.autotrader.gateway.TradeOptions;
import com.autotrader.gateway.TradeResult;
import com.autotrader.model.ActionOutcome;
import com.autotrader.model.ActionResult;
import com.autotrader.model.ExitReason;
import com.autotrader.model.ExitRules;
import com.autotrader.model.PartialProfitLevel;
import com.autotrader.model.Position;
import com.autotrader.model.PositionStatus;
import com.autotrader.model.ScaleInPhase;
import com.autotrader.model.ScaleInPlan;
import com.autotrader.model.TrailingStopConfig;
import com.autotrader.notification.NotificationEventType;
import com.autotrader.notification.Notifier;
import com.autotrader.service.monitoring.exit.ExitAction;
import com.autotrader.service.monitoring.exit.ExitRuleEvaluator;
import com.autotrader.service.persistence.PositionStore;
import com.autotrader.util.TradingConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PositionManagerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private static final String TOKEN = "TOKEN";

    private TradeExecutor tradeExecutor;
    private PositionStore positionStore;
    private Notifier notifier;
    private TradingConfig tradingConfig;
    private MonitoringConfig monitoringConfig;
    private PositionManager manager;

    @BeforeEach
    void setUp() {
        tradeExecutor = mock(TradeExecutor.class);
        positionStore = mock(PositionStore.class);
        notifier = mock(Notifier.class);
        tradingConfig = new TradingConfig();
        monitoringConfig = new MonitoringConfig();
        monitoringConfig.setMaxActionRetries(3);
        manager = new PositionManager(tradeExecutor, positionStore, notifier, tradingConfig, monitoringConfig,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ExitRules rulesWithLevels() {
        return ExitRules.builder()
                .stopLossPercent(10.0)
                .takeProfitPercent(50.0)
                .partialProfitLevels(new ArrayList<>(List.of(
                        PartialProfitLevel.builder().levelId("L1").thresholdPercent(8.0).sellFraction(0.3).build(),
                        PartialProfitLevel.builder().levelId("L2").thresholdPercent(15.0).sellFraction(0.7).build())))
                .build();
    }

    private static ScaleInPlan twoPhasePlan() {
        return ScaleInPlan.builder()
                .enabled(true)
                .phases(new ArrayList<>(List.of(
                        ScaleInPhase.builder().phaseNumber(1).triggerDropPercent(10.0).sizeFraction(0.25).build(),
                        ScaleInPhase.builder().phaseNumber(2).triggerDropPercent(20.0).sizeFraction(0.25).build())))
                .build();
    }

    private Position open(ExitRules rules, ScaleInPlan plan) {
        return manager.createPosition(CreatePositionCommand.builder()
                .tokenId(TOKEN)
                .entryPrice(100.0)
                .amount(10.0)
                .budgetQuote(2000.0)
                .exitRules(rules)
                .scaleInPlan(plan)
                .build());
    }

    private void stubSell(TradeResult result) {
        when(tradeExecutor.sell(eq(TOKEN), anyDouble(), any(TradeOptions.class))).thenReturn(result);
    }

    @Nested
    @DisplayName("Position Creation")
    class CreationTests {

        @Test
        @DisplayName("Should create an OPEN position with full amount remaining and emit POSITION_OPENED")
        void createsOpenPosition() {
            Position position = open(rulesWithLevels(), null);

            assertTrue(position.getId().startsWith(TradingConstants.POSITION_ID_PREFIX));
            assertEquals(PositionStatus.OPEN, position.getStatus());
            assertEquals(10.0, position.getAmountRemaining());
            assertEquals(100.0, position.getAverageEntryPrice());
            assertEquals(100.0, position.getHighestPriceSeenSinceEntry());
            assertEquals(NOW, position.getEntryTimestamp());
            verify(positionStore).save(any(Position.class));
            verify(notifier).emit(eq(NotificationEventType.POSITION_OPENED), anyMap());
        }

        @Test
        @DisplayName("Should default exit rules from trading configuration")
        void defaultsExitRules() {
            Position position = open(null, null);

            assertEquals(tradingConfig.getDefaultStopLossPercent(), position.getExitRules().getStopLossPercent().doubleValue());
            assertEquals(3, position.getExitRules().getPartialProfitLevels().size());
        }

        @Test
        @DisplayName("Should reject non-positive entry price and amount without touching state")
        void rejectsInvalidInput() {
            assertThrows(InvalidInputException.class, () -> manager.createPosition(TOKEN, 0.0, 10.0, null, null));
            assertThrows(InvalidInputException.class, () -> manager.createPosition(TOKEN, 100.0, -1.0, null, null));
            assertThrows(InvalidInputException.class, () -> manager.createPosition(" ", 100.0, 1.0, null, null));

            assertTrue(manager.getOpenPositions().isEmpty());
            verifyNoInteractions(positionStore, notifier);
        }

        @Test
        @DisplayName("Should not share the caller's exit rules with the stored position")
        void deepCopiesRules() {
            ExitRules rules = rulesWithLevels();
            Position position = open(rules, null);

            rules.getPartialProfitLevels().get(0).setExecuted(true);

            Position stored = manager.getPosition(position.getId()).orElseThrow();
            assertFalse(stored.getExitRules().findLevel("L1").isExecuted());
        }
    }

    @Nested
    @DisplayName("Full Close")
    class FullCloseTests {

        @Test
        @DisplayName("Should close, record the sell and remove from the active set on success")
        void closesOnSuccess() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.success(900.0, 90.0, "tx-1"));

            ActionResult result = manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);

            assertEquals(ActionOutcome.APPLIED, result.getOutcome());
            Position closed = result.getPosition();
            assertEquals(PositionStatus.CLOSED, closed.getStatus());
            assertEquals(0.0, closed.getAmountRemaining());
            assertEquals(ExitReason.STOP_LOSS, closed.getCloseReason());
            assertEquals(90.0, closed.getExitPrice().doubleValue());
            assertEquals(-10.0, closed.getRealizedProfitPercent().doubleValue(), 1e-9);
            assertEquals(1, closed.getSellHistory().size());
            assertTrue(manager.getOpenPositions().isEmpty());
            verify(notifier).emit(eq(NotificationEventType.POSITION_CLOSED), anyMap());
        }

        @Test
        @DisplayName("Should sell protective exits with the wider slippage tolerance")
        void protectiveSlippage() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.success(900.0, 90.0, "tx-1"));

            manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);

            ArgumentCaptor<TradeOptions> options = ArgumentCaptor.forClass(TradeOptions.class);
            verify(tradeExecutor).sell(eq(TOKEN), eq(10.0), options.capture());
            assertEquals(tradingConfig.getStopLossSellSlippagePercent(), options.getValue().getSlippagePercent());
        }

        @Test
        @DisplayName("Should leave the position OPEN with its amount unchanged when the sell fails")
        void failureKeepsPositionOpen() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.failure("slippage exceeded"));

            ActionResult result = manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);

            assertEquals(ActionOutcome.FAILED, result.getOutcome());
            Position after = manager.getPosition(position.getId()).orElseThrow();
            assertEquals(PositionStatus.OPEN, after.getStatus());
            assertEquals(10.0, after.getAmountRemaining());
            assertEquals("slippage exceeded", after.getLastError());
            assertFalse(after.hasPendingAction());
            verify(notifier).emit(eq(NotificationEventType.ACTION_FAILED), anyMap());
        }

        @Test
        @DisplayName("Should treat an executor exception as a failed attempt")
        void executorExceptionIsFailure() {
            Position position = open(rulesWithLevels(), null);
            when(tradeExecutor.sell(anyString(), anyDouble(), any())).thenThrow(new IllegalStateException("rpc down"));

            ActionResult result = manager.applyFullClose(position.getId(), 90.0, ExitReason.TAKE_PROFIT);

            assertEquals(ActionOutcome.FAILED, result.getOutcome());
            assertEquals(1, manager.failedAttempts(position.getId(), "FULL_CLOSE:TAKE_PROFIT"));
        }

        @Test
        @DisplayName("Should skip a position that is already closed")
        void alreadyClosedIsSkipped() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.success(900.0, 90.0, "tx-1"));
            ActionResult first = manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);
            when(positionStore.load(position.getId())).thenReturn(Optional.of(first.getPosition()));

            ActionResult second = manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);

            assertEquals(ActionOutcome.SKIPPED, second.getOutcome());
            verify(tradeExecutor, times(1)).sell(anyString(), anyDouble(), any());
        }

        @Test
        @DisplayName("Should reject unknown position ids")
        void unknownPosition() {
            when(positionStore.load("missing")).thenReturn(Optional.empty());

            assertThrows(ResourceNotFoundException.class,
                    () -> manager.applyFullClose("missing", 90.0, ExitReason.MANUAL));
        }
    }

    @Nested
    @DisplayName("Partial Close")
    class PartialCloseTests {

        @Test
        @DisplayName("Should sell the level fraction of the total amount and mark the level executed")
        void sellsFraction() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.success(327.0, 109.0, "tx-p1"));

            ActionResult result = manager.applyPartialClose(position.getId(), 0.3, "L1");

            assertEquals(ActionOutcome.APPLIED, result.getOutcome());
            Position after = result.getPosition();
            assertEquals(PositionStatus.PARTIALLY_CLOSED, after.getStatus());
            assertEquals(7.0, after.getAmountRemaining(), 1e-9);
            assertTrue(after.getExitRules().findLevel("L1").isExecuted());
            verify(tradeExecutor).sell(eq(TOKEN), doubleThat(a -> Math.abs(a - 3.0) < 1e-9), any());
            verify(notifier).emit(eq(NotificationEventType.PARTIAL_SELL_EXECUTED), anyMap());
        }

        @Test
        @DisplayName("Should be idempotent per level id")
        void idempotentPerLevel() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.success(327.0, 109.0, "tx-p1"));

            manager.applyPartialClose(position.getId(), 0.3, "L1");
            ActionResult again = manager.applyPartialClose(position.getId(), 0.3, "L1");

            assertEquals(ActionOutcome.SKIPPED, again.getOutcome());
            assertEquals(7.0, again.getPosition().getAmountRemaining(), 1e-9);
            verify(tradeExecutor, times(1)).sell(anyString(), anyDouble(), any());
        }

        @Test
        @DisplayName("Should close the position when a level sells everything that remains")
        void lastLevelCloses() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.success(500.0, 110.0, "tx"));

            manager.applyPartialClose(position.getId(), 0.3, "L1");
            ActionResult result = manager.applyPartialClose(position.getId(), 0.7, "L2");

            assertEquals(PositionStatus.CLOSED, result.getPosition().getStatus());
            assertEquals(ExitReason.PARTIAL_TAKE_PROFIT, result.getPosition().getCloseReason());
            assertTrue(manager.getOpenPositions().isEmpty());
            verify(notifier).emit(eq(NotificationEventType.POSITION_CLOSED), anyMap());
        }

        @Test
        @DisplayName("Should not mark the level executed when the sell fails")
        void failureLeavesLevelPending() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.failure("no liquidity"));

            ActionResult result = manager.applyPartialClose(position.getId(), 0.3, "L1");

            assertEquals(ActionOutcome.FAILED, result.getOutcome());
            assertFalse(result.getPosition().getExitRules().findLevel("L1").isExecuted());
            assertEquals(10.0, result.getPosition().getAmountRemaining());
        }

        @Test
        @DisplayName("Should reject unknown level ids and invalid fractions")
        void rejectsInvalidInput() {
            Position position = open(rulesWithLevels(), null);

            assertThrows(InvalidInputException.class, () -> manager.applyPartialClose(position.getId(), 0.3, "L9"));
            assertThrows(InvalidInputException.class, () -> manager.applyPartialClose(position.getId(), 1.5, "L1"));
            assertThrows(InvalidInputException.class, () -> manager.applyPartialClose(position.getId(), 0.0, "L1"));
        }
    }

    @Nested
    @DisplayName("Scale In")
    class ScaleInTests {

        @Test
        @DisplayName("Should buy the phase fraction of the budget and recompute the VWAP cost basis")
        void recomputesVwap() {
            Position position = open(rulesWithLevels(), twoPhasePlan());
            double bought = 500.0 / 90.0;
            when(tradeExecutor.buy(eq(TOKEN), eq(500.0), any())).thenReturn(TradeResult.success(bought, 90.0, "tx-b1"));
            ScaleInPhase phase = position.getScaleInPlan().getPhases().get(0);

            ActionResult result = manager.applyScaleIn(position.getId(), phase);

            assertEquals(ActionOutcome.APPLIED, result.getOutcome());
            Position after = result.getPosition();
            double expectedVwap = (100.0 * 10.0 + 500.0) / (10.0 + bought);
            assertEquals(expectedVwap, after.getAverageEntryPrice(), 1e-9);
            assertEquals(10.0 + bought, after.getAmountTotal(), 1e-9);
            assertEquals(10.0 + bought, after.getAmountRemaining(), 1e-9);
            assertEquals(1500.0, after.getInvestedQuote(), 1e-9);
            assertEquals(1, after.getScaleInPlan().getCurrentPhase());
            assertTrue(after.getScaleInPlan().getPhases().get(0).isExecuted());
            assertEquals(100.0, after.getEntryPrice());
            verify(notifier).emit(eq(NotificationEventType.SCALE_IN_EXECUTED), anyMap());
        }

        @Test
        @DisplayName("Should skip a phase that already executed and reject one that is out of order")
        void phaseOrdering() {
            Position position = open(rulesWithLevels(), twoPhasePlan());
            when(tradeExecutor.buy(anyString(), anyDouble(), any())).thenReturn(TradeResult.success(5.0, 100.0, "tx"));
            ScaleInPhase first = position.getScaleInPlan().getPhases().get(0);
            ScaleInPhase second = position.getScaleInPlan().getPhases().get(1);

            assertThrows(InvalidInputException.class, () -> manager.applyScaleIn(position.getId(), second));

            manager.applyScaleIn(position.getId(), first);
            assertEquals(ActionOutcome.SKIPPED, manager.applyScaleIn(position.getId(), first).getOutcome());
            verify(tradeExecutor, times(1)).buy(anyString(), anyDouble(), any());
        }

        @Test
        @DisplayName("Should leave the plan untouched when the buy fails")
        void failedBuy() {
            Position position = open(rulesWithLevels(), twoPhasePlan());
            when(tradeExecutor.buy(anyString(), anyDouble(), any())).thenReturn(TradeResult.failure("rejected"));

            ActionResult result = manager.applyScaleIn(position.getId(), position.getScaleInPlan().getPhases().get(0));

            assertEquals(ActionOutcome.FAILED, result.getOutcome());
            assertEquals(0, result.getPosition().getScaleInPlan().getCurrentPhase());
            assertEquals(100.0, result.getPosition().getAverageEntryPrice());
        }
    }

    @Nested
    @DisplayName("Concurrency Guard")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should reject a second action while a sell is in flight")
        void rejectsOverlappingAction() throws Exception {
            Position position = open(rulesWithLevels(), null);
            CountDownLatch sellStarted = new CountDownLatch(1);
            CountDownLatch releaseSell = new CountDownLatch(1);
            when(tradeExecutor.sell(anyString(), anyDouble(), any())).thenAnswer(invocation -> {
                sellStarted.countDown();
                releaseSell.await(5, TimeUnit.SECONDS);
                return TradeResult.success(900.0, 90.0, "tx-slow");
            });

            CompletableFuture<ActionResult> inFlight = CompletableFuture.supplyAsync(
                    () -> manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS));
            assertTrue(sellStarted.await(5, TimeUnit.SECONDS));

            assertTrue(manager.getPosition(position.getId()).orElseThrow().hasPendingAction());
            assertThrows(ConcurrencyViolationException.class,
                    () -> manager.applyPartialClose(position.getId(), 0.3, "L1"));

            releaseSell.countDown();
            ActionResult result = inFlight.get(5, TimeUnit.SECONDS);
            assertEquals(ActionOutcome.APPLIED, result.getOutcome());
            verify(tradeExecutor, times(1)).sell(anyString(), anyDouble(), any());
        }
    }

    @Nested
    @DisplayName("Retry Exhaustion")
    class RetryTests {

        @Test
        @DisplayName("Should flag manual intervention after max retries and emit ACTION_ABANDONED")
        void abandonsAfterMaxRetries() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.failure("down"));

            assertEquals(ActionOutcome.FAILED,
                    manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS).getOutcome());
            assertEquals(ActionOutcome.FAILED,
                    manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS).getOutcome());
            ActionResult third = manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);

            assertEquals(ActionOutcome.ABANDONED, third.getOutcome());
            assertTrue(third.getPosition().isManualInterventionRequired());
            verify(notifier).emit(eq(NotificationEventType.ACTION_ABANDONED), anyMap());
        }

        @Test
        @DisplayName("Should clear the flag on a successful manual close")
        void manualCloseClearsFlag() {
            Position position = open(rulesWithLevels(), null);
            when(tradeExecutor.sell(anyString(), anyDouble(), any()))
                    .thenReturn(TradeResult.failure("down"))
                    .thenReturn(TradeResult.failure("down"))
                    .thenReturn(TradeResult.failure("down"))
                    .thenReturn(TradeResult.success(950.0, 95.0, "tx-manual"));
            for (int i = 0; i < 3; i++) {
                manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);
            }

            ActionResult result = manager.applyFullClose(position.getId(), 95.0, ExitReason.MANUAL);

            assertEquals(ActionOutcome.APPLIED, result.getOutcome());
            assertFalse(result.getPosition().isManualInterventionRequired());
            assertEquals(ExitReason.MANUAL, result.getPosition().getCloseReason());
        }

        @Test
        @DisplayName("Should clear the flag and counters on resume")
        void resumeClearsFlag() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.failure("down"));
            for (int i = 0; i < 3; i++) {
                manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);
            }

            Position resumed = manager.resumeMonitoring(position.getId());

            assertFalse(resumed.isManualInterventionRequired());
            assertNull(resumed.getLastError());
            assertEquals(0, manager.failedAttempts(position.getId(), "FULL_CLOSE:STOP_LOSS"));
        }

        @Test
        @DisplayName("Should count attempts per triggering condition")
        void countersArePerCondition() {
            Position position = open(rulesWithLevels(), null);
            stubSell(TradeResult.failure("down"));

            manager.applyFullClose(position.getId(), 90.0, ExitReason.STOP_LOSS);
            manager.applyPartialClose(position.getId(), 0.3, "L1");

            assertEquals(1, manager.failedAttempts(position.getId(), "FULL_CLOSE:STOP_LOSS"));
            assertEquals(1, manager.failedAttempts(position.getId(), "PARTIAL_CLOSE:L1"));
        }
    }

    @Nested
    @DisplayName("Price Tracking")
    class PriceTrackingTests {

        @Test
        @DisplayName("Should raise the peak but never lower it")
        void peakIsMonotonic() {
            Position position = open(rulesWithLevels(), null);

            manager.recordPrice(position.getId(), 120.0, NOW);
            Optional<Position> after = manager.recordPrice(position.getId(), 110.0, NOW);

            assertTrue(after.isPresent());
            assertEquals(120.0, after.get().getHighestPriceSeenSinceEntry());
            assertEquals(110.0, after.get().getCurrentPrice());
        }

        @Test
        @DisplayName("Should latch trailing stop activation once the peak crosses the trigger")
        void latchesTrailingActivation() {
            ExitRules rules = rulesWithLevels();
            rules.setTrailingStop(new TrailingStopConfig(true, 10.0, 5.0));
            Position position = open(rules, null);

            manager.recordPrice(position.getId(), 111.0, NOW);
            Position after = manager.recordPrice(position.getId(), 101.0, NOW).orElseThrow();

            assertTrue(after.isTrailingStopActivated());
        }

        @Test
        @DisplayName("Should not activate the trailing stop when a scale-in lowers the basis below an old peak")
        void scaleInDoesNotActivateTrailingFromOldPeak() {
            ExitRules rules = ExitRules.builder()
                    .stopLossPercent(20.0)
                    .trailingStop(new TrailingStopConfig(true, 5.0, 3.0))
                    .build();
            ScaleInPlan plan = ScaleInPlan.builder()
                    .enabled(true)
                    .phases(new ArrayList<>(List.of(
                            ScaleInPhase.builder().phaseNumber(1).triggerDropPercent(10.0).sizeFraction(1.0).build())))
                    .build();
            Position position = open(rules, plan);
            when(tradeExecutor.buy(eq(TOKEN), eq(2000.0), any()))
                    .thenReturn(TradeResult.success(2000.0 / 90.0, 90.0, "tx-b1"));

            manager.recordPrice(position.getId(), 102.0, NOW);
            manager.recordPrice(position.getId(), 90.0, NOW);
            Position scaled = manager.applyScaleIn(position.getId(),
                    position.getScaleInPlan().getPhases().get(0)).getPosition();
            Position after = manager.recordPrice(position.getId(), 95.0, NOW).orElseThrow();

            assertTrue(scaled.getAverageEntryPrice() < 95.0);
            assertEquals(102.0, after.getHighestPriceSeenSinceEntry());
            assertFalse(after.isTrailingStopActivated());
            ExitAction action = new ExitRuleEvaluator().evaluate(after, 95.0, NOW);
            assertFalse(action.requiresAction());
        }

        @Test
        @DisplayName("Should return empty for positions that are no longer active")
        void inactiveReturnsEmpty() {
            assertTrue(manager.recordPrice("unknown", 100.0, NOW).isEmpty());
        }
    }

    @Test
    @DisplayName("Should restore active positions from storage on startup")
    void loadsActivePositions() {
        Position stored = Position.builder()
                .id("pos_restored")
                .tokenId(TOKEN)
                .entryPrice(1.0)
                .entryTimestamp(NOW)
                .amountTotal(1.0)
                .amountRemaining(1.0)
                .exitRules(ExitRules.builder().build())
                .build();
        when(positionStore.loadActive()).thenReturn(List.of(stored));

        manager.loadActivePositions();

        List<Position> open = manager.getOpenPositions();
        assertEquals(1, open.size());
        assertEquals("pos_restored", open.get(0).getId());
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("Should report realised profit in the close event payload")
    void closeEventCarriesProfit() {
        Position position = open(rulesWithLevels(), null);
        stubSell(TradeResult.success(1200.0, 120.0, "tx"));

        manager.applyFullClose(position.getId(), 120.0, ExitReason.TAKE_PROFIT);

        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(notifier).emit(eq(NotificationEventType.POSITION_CLOSED), payload.capture());
        assertEquals(200.0, ((Double) payload.getValue().get(TradingConstants.KEY_REALIZED_PROFIT)).doubleValue(), 1e-9);
        assertEquals("TAKE_PROFIT", payload.getValue().get(TradingConstants.KEY_REASON));
    }
}
