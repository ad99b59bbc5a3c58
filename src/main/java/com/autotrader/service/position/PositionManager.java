package com.autotrader.service.position;

import com.autotrader.config.MonitoringConfig;
import com.autotrader.config.TradingConfig;
import com.autotrader.exception.ConcurrencyViolationException;
import com.autotrader.exception.InvalidInputException;
import com.autotrader.exception.ResourceNotFoundException;
import com.autotrader.gateway.TradeExecutor;
import com.autotrader.gateway.TradeOptions;
import com.autotrader.gateway.TradeResult;
import com.autotrader.model.ActionResult;
import com.autotrader.model.ExitReason;
import com.autotrader.model.ExitRules;
import com.autotrader.model.PartialProfitLevel;
import com.autotrader.model.PendingAction;
import com.autotrader.model.PendingActionType;
import com.autotrader.model.Position;
import com.autotrader.model.PositionStatus;
import com.autotrader.model.ScaleInPhase;
import com.autotrader.model.ScaleInPlan;
import com.autotrader.model.SellRecord;
import com.autotrader.notification.NotificationEventType;
import com.autotrader.notification.Notifier;
import com.autotrader.service.persistence.PositionStore;
import com.autotrader.util.TradingConstants;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the set of active positions and applies every state change to them.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Each mutating action claims the position's pending-action slot before calling the
 *       trade executor and releases it on every exit path. A second action on the same
 *       position while one is in flight raises {@link ConcurrencyViolationException}.</li>
 *   <li>Field updates happen under the position's monitor so that {@link Position#snapshot()}
 *       never observes a half-applied action.</li>
 *   <li>Nothing is marked executed unless the trade executor reported success.</li>
 * </ul>
 *
 * <h2>Failure handling</h2>
 * Failed attempts are counted per position and triggering condition. When the count reaches
 * {@code monitoring.max-action-retries} the position is flagged for manual intervention,
 * an ACTION_ABANDONED event is emitted and the monitoring loop stops acting on it until an
 * operator closes or resumes it.
 */
@Slf4j
@Service
public class PositionManager {

    /** Remaining amounts below this are treated as fully sold */
    private static final double DUST = 1e-12;

    private final TradeExecutor tradeExecutor;
    private final PositionStore positionStore;
    private final Notifier notifier;
    private final TradingConfig tradingConfig;
    private final MonitoringConfig monitoringConfig;
    private final Clock clock;

    private final Map<String, Position> activePositions = new ConcurrentHashMap<>();

    /** Failed attempts keyed by positionId + "|" + actionKey */
    private final Map<String, AtomicInteger> failedAttempts = new ConcurrentHashMap<>();

    public PositionManager(TradeExecutor tradeExecutor,
                           PositionStore positionStore,
                           Notifier notifier,
                           TradingConfig tradingConfig,
                           MonitoringConfig monitoringConfig,
                           Clock clock) {
        this.tradeExecutor = tradeExecutor;
        this.positionStore = positionStore;
        this.notifier = notifier;
        this.tradingConfig = tradingConfig;
        this.monitoringConfig = monitoringConfig;
        this.clock = clock;
    }

    /**
     * Restores active positions. A corrupt record aborts startup.
     */
    @PostConstruct
    public void loadActivePositions() {
        List<Position> positions = positionStore.loadActive();
        for (Position position : positions) {
            activePositions.put(position.getId(), position);
        }
        log.info("Loaded {} active positions from storage", positions.size());
    }

    // ==================== CREATION ====================

    public Position createPosition(String tokenId, double entryPrice, double amount,
                                   ExitRules exitRules, ScaleInPlan scaleInPlan) {
        return createPosition(CreatePositionCommand.builder()
                .tokenId(tokenId)
                .entryPrice(entryPrice)
                .amount(amount)
                .exitRules(exitRules)
                .scaleInPlan(scaleInPlan)
                .build());
    }

    /**
     * Registers a position for a completed buy. Validation happens before any state is
     * touched; the exit rules and scale-in plan are deep-copied.
     *
     * @throws InvalidInputException on a malformed request
     */
    public Position createPosition(CreatePositionCommand command) {
        if (command == null || command.getTokenId() == null || command.getTokenId().isBlank()) {
            throw new InvalidInputException("Token id is required");
        }
        PositionValidator.requirePositive(command.getEntryPrice(), "Entry price");
        PositionValidator.requirePositive(command.getAmount(), "Amount");
        if (command.getBudgetQuote() != null) {
            PositionValidator.requirePositive(command.getBudgetQuote(), "Budget");
        }

        ExitRules rules = PositionValidator.normalizeExitRules(
                command.getExitRules() != null ? command.getExitRules() : tradingConfig.defaultExitRules());
        ScaleInPlan plan = PositionValidator.normalizeScaleInPlan(command.getScaleInPlan());

        double initialCost = command.getEntryPrice() * command.getAmount();
        Instant now = clock.instant();
        Position position = Position.builder()
                .id(TradingConstants.POSITION_ID_PREFIX + UUID.randomUUID())
                .tokenId(command.getTokenId())
                .tokenSymbol(command.getTokenSymbol())
                .strategyId(command.getStrategyId())
                .entryPrice(command.getEntryPrice())
                .entryTimestamp(now)
                .averageEntryPrice(command.getEntryPrice())
                .amountTotal(command.getAmount())
                .amountRemaining(command.getAmount())
                .budgetQuote(command.getBudgetQuote() != null ? command.getBudgetQuote() : initialCost)
                .investedQuote(command.getInvestedQuote() != null ? command.getInvestedQuote() : initialCost)
                .currentPrice(command.getEntryPrice())
                .highestPriceSeenSinceEntry(command.getEntryPrice())
                .status(PositionStatus.OPEN)
                .exitRules(rules)
                .scaleInPlan(plan)
                .lastCheckedAt(now)
                .build();

        positionStore.save(position);
        activePositions.put(position.getId(), position);

        log.info("Position created: id={}, token={}, entry={}, amount={}, budget={}, strategy={}",
                position.getId(), position.getTokenId(), position.getEntryPrice(),
                position.getAmountTotal(), position.getBudgetQuote(), position.getStrategyId());

        Map<String, Object> payload = payload(position);
        payload.put(TradingConstants.KEY_PRICE, position.getEntryPrice());
        payload.put(TradingConstants.KEY_AMOUNT, position.getAmountTotal());
        notifier.emit(NotificationEventType.POSITION_OPENED, payload);

        return position.snapshot();
    }

    // ==================== FULL CLOSE ====================

    /**
     * Sells everything that remains.
     * <p>
     * A no-op on a position that is already closed. A manual close also clears the
     * manual-intervention flag.
     *
     * @throws ConcurrencyViolationException if another action is in flight
     */
    public ActionResult applyFullClose(String positionId, double exitPrice, ExitReason reason) {
        PositionValidator.requirePositive(exitPrice, "Exit price");
        if (reason == null) {
            throw new InvalidInputException("Exit reason is required");
        }
        Position position = activePositions.get(positionId);
        if (position == null) {
            return closedOrMissing(positionId);
        }

        PendingAction action = newAction(PendingActionType.FULL_CLOSE, "FULL_CLOSE:" + reason);
        acquire(position, action);
        try {
            double amount;
            synchronized (position) {
                if (!position.isActive()) {
                    return ActionResult.skipped(position.snapshot(), "Position already closed");
                }
                amount = position.getAmountRemaining();
                position.setLastActionAttemptAt(action.getStartedAt());
            }

            log.warn("Closing position {} ({}): reason={}, amount={}, price={}",
                    positionId, position.getTokenId(), reason, amount, exitPrice);
            TradeResult result = sell(position, amount, sellOptions(reason));
            if (!result.isSuccess()) {
                return handleFailure(position, action, result.getError());
            }

            double fillPrice = result.getExecutionPrice() > 0 ? result.getExecutionPrice() : exitPrice;
            double realizedProfit;
            synchronized (position) {
                realizedProfit = result.getAmountOut() - position.costBasis() * amount;
                recordSell(position, amount, fillPrice, reason, null, result);
                position.setAmountRemaining(0.0);
                markClosed(position, fillPrice, reason, result.getTxRef());
                if (reason == ExitReason.MANUAL) {
                    position.setManualInterventionRequired(false);
                }
            }
            onActionSucceeded(position, action);
            persist(position);
            activePositions.remove(positionId);
            clearFailures(positionId);

            log.info("Position closed: id={}, reason={}, exitPrice={}, realizedProfit={}%",
                    positionId, reason, fillPrice, position.getRealizedProfitPercent());
            emitClosed(position, reason, amount, fillPrice, result, realizedProfit);
            return ActionResult.applied(position.snapshot());
        } finally {
            position.release(action);
        }
    }

    // ==================== PARTIAL CLOSE ====================

    /**
     * Sells {@code fraction * amountTotal}, capped at the remaining amount, for one partial
     * profit level. Idempotent per level id.
     *
     * @throws ConcurrencyViolationException if another action is in flight
     */
    public ActionResult applyPartialClose(String positionId, double fraction, String levelId) {
        if (!(fraction > 0) || fraction > 1.0) {
            throw new InvalidInputException("Sell fraction must be in (0, 1], got " + fraction);
        }
        if (levelId == null || levelId.isBlank()) {
            throw new InvalidInputException("Level id is required");
        }
        Position position = activePositions.get(positionId);
        if (position == null) {
            return closedOrMissing(positionId);
        }
        if (position.getExitRules().findLevel(levelId) == null) {
            throw new InvalidInputException("Unknown partial profit level " + levelId + " for position " + positionId);
        }

        PendingAction action = newAction(PendingActionType.PARTIAL_CLOSE, "PARTIAL_CLOSE:" + levelId);
        acquire(position, action);
        try {
            double amount;
            double referencePrice;
            synchronized (position) {
                if (!position.isActive()) {
                    return ActionResult.skipped(position.snapshot(), "Position already closed");
                }
                if (position.getExitRules().findLevel(levelId).isExecuted()) {
                    return ActionResult.skipped(position.snapshot(), "Level " + levelId + " already executed");
                }
                amount = Math.min(fraction * position.getAmountTotal(), position.getAmountRemaining());
                if (amount <= 0) {
                    return ActionResult.skipped(position.snapshot(), "Nothing left to sell");
                }
                referencePrice = position.getCurrentPrice();
                position.setLastActionAttemptAt(action.getStartedAt());
            }

            log.info("Partial sell for position {} ({}): level={}, amount={}",
                    positionId, position.getTokenId(), levelId, amount);
            TradeResult result = sell(position, amount, sellOptions(ExitReason.PARTIAL_TAKE_PROFIT));
            if (!result.isSuccess()) {
                return handleFailure(position, action, result.getError());
            }

            double fillPrice = result.getExecutionPrice() > 0 ? result.getExecutionPrice() : referencePrice;
            double realizedProfit;
            boolean fullyClosed;
            synchronized (position) {
                realizedProfit = result.getAmountOut() - position.costBasis() * amount;
                PartialProfitLevel level = position.getExitRules().findLevel(levelId);
                level.setExecuted(true);
                level.setExecutedAt(clock.instant());
                recordSell(position, amount, fillPrice, ExitReason.PARTIAL_TAKE_PROFIT, levelId, result);

                double remaining = position.getAmountRemaining() - amount;
                fullyClosed = remaining <= DUST;
                position.setAmountRemaining(fullyClosed ? 0.0 : remaining);
                if (fullyClosed) {
                    markClosed(position, fillPrice, ExitReason.PARTIAL_TAKE_PROFIT, result.getTxRef());
                } else {
                    position.setStatus(PositionStatus.PARTIALLY_CLOSED);
                }
            }
            onActionSucceeded(position, action);
            persist(position);

            log.info("Partial sell executed: id={}, level={}, sold={}, remaining={}, price={}",
                    positionId, levelId, amount, position.getAmountRemaining(), fillPrice);
            Map<String, Object> payload = payload(position);
            payload.put(TradingConstants.KEY_LEVEL_ID, levelId);
            payload.put(TradingConstants.KEY_AMOUNT, amount);
            payload.put(TradingConstants.KEY_PRICE, fillPrice);
            payload.put(TradingConstants.KEY_QUOTE, result.getAmountOut());
            payload.put(TradingConstants.KEY_REALIZED_PROFIT, realizedProfit);
            payload.put(TradingConstants.KEY_TX_REF, result.getTxRef());
            notifier.emit(NotificationEventType.PARTIAL_SELL_EXECUTED, payload);

            if (fullyClosed) {
                activePositions.remove(positionId);
                clearFailures(positionId);
                log.info("Position closed by partial sell: id={}, level={}", positionId, levelId);
                emitClosed(position, ExitReason.PARTIAL_TAKE_PROFIT, amount, fillPrice, result, 0.0);
            }
            return ActionResult.applied(position.snapshot());
        } finally {
            position.release(action);
        }
    }

    // ==================== SCALE IN ====================

    /**
     * Buys {@code phase.sizeFraction * budgetQuote} more and recomputes the VWAP cost basis.
     * Only the plan's current phase can be applied; an already executed phase is a no-op.
     *
     * @throws ConcurrencyViolationException if another action is in flight
     */
    public ActionResult applyScaleIn(String positionId, ScaleInPhase phase) {
        if (phase == null) {
            throw new InvalidInputException("Scale-in phase is required");
        }
        Position position = activePositions.get(positionId);
        if (position == null) {
            return closedOrMissing(positionId);
        }
        if (!position.hasScaleInPlan()) {
            throw new InvalidInputException("Position " + positionId + " has no scale-in plan");
        }

        PendingAction action = newAction(PendingActionType.SCALE_IN, "SCALE_IN:" + phase.getPhaseNumber());
        acquire(position, action);
        try {
            double quote;
            synchronized (position) {
                if (!position.isActive()) {
                    return ActionResult.skipped(position.snapshot(), "Position already closed");
                }
                ScaleInPlan plan = position.getScaleInPlan();
                ScaleInPhase next = plan.nextPendingPhase();
                if (next == null || next.getPhaseNumber() != phase.getPhaseNumber()) {
                    if (isPhaseExecuted(plan, phase.getPhaseNumber())) {
                        return ActionResult.skipped(position.snapshot(),
                                "Phase " + phase.getPhaseNumber() + " already executed");
                    }
                    throw new InvalidInputException("Phase " + phase.getPhaseNumber()
                            + " is not the next pending phase of position " + positionId);
                }
                if (plan.executedSizeFraction() + next.getSizeFraction() > 1.0 + 1e-9) {
                    throw new InvalidInputException("Scale-in would exceed the position budget");
                }
                quote = next.getSizeFraction() * position.getBudgetQuote();
                position.setLastActionAttemptAt(action.getStartedAt());
            }

            log.info("Scale-in for position {} ({}): phase={}, quote={}",
                    positionId, position.getTokenId(), phase.getPhaseNumber(), quote);
            TradeResult result = buy(position, quote);
            if (!result.isSuccess()) {
                return handleFailure(position, action, result.getError());
            }
            if (!(result.getAmountOut() > 0)) {
                return handleFailure(position, action, "Buy returned no tokens");
            }

            double bought = result.getAmountOut();
            double fillPrice = quote / bought;
            synchronized (position) {
                double oldTotal = position.getAmountTotal();
                double vwap = (position.costBasis() * oldTotal + quote) / (oldTotal + bought);

                ScaleInPlan plan = position.getScaleInPlan();
                ScaleInPhase executed = plan.nextPendingPhase();
                executed.setExecuted(true);
                executed.setExecutedAt(clock.instant());
                executed.setExecutionPrice(fillPrice);
                executed.setAmountBought(bought);
                plan.setCurrentPhase(plan.getCurrentPhase() + 1);

                position.setAmountTotal(oldTotal + bought);
                position.setAmountRemaining(position.getAmountRemaining() + bought);
                position.setInvestedQuote(position.getInvestedQuote() + quote);
                position.setAverageEntryPrice(vwap);
            }
            onActionSucceeded(position, action);
            persist(position);

            log.info("Scale-in executed: id={}, phase={}, bought={}, fillPrice={}, newAverageEntry={}",
                    positionId, phase.getPhaseNumber(), bought, fillPrice, position.getAverageEntryPrice());
            Map<String, Object> payload = payload(position);
            payload.put(TradingConstants.KEY_PHASE_NUMBER, phase.getPhaseNumber());
            payload.put(TradingConstants.KEY_AMOUNT, bought);
            payload.put(TradingConstants.KEY_PRICE, fillPrice);
            payload.put(TradingConstants.KEY_QUOTE, quote);
            payload.put(TradingConstants.KEY_TX_REF, result.getTxRef());
            notifier.emit(NotificationEventType.SCALE_IN_EXECUTED, payload);
            return ActionResult.applied(position.snapshot());
        } finally {
            position.release(action);
        }
    }

    // ==================== PRICE TRACKING ====================

    /**
     * Records an observed price: updates the peak and latches trailing-stop activation.
     * Activation is decided by the observed price against the cost basis in force now, so a
     * scale-in that lowers the basis never activates the stop from an older peak.
     *
     * @return snapshot after the update, empty if the position is no longer active
     */
    public Optional<Position> recordPrice(String positionId, double price, Instant now) {
        PositionValidator.requirePositive(price, "Price");
        Position position = activePositions.get(positionId);
        if (position == null) {
            return Optional.empty();
        }

        boolean changed = false;
        Position snapshot;
        synchronized (position) {
            if (!position.isActive()) {
                return Optional.empty();
            }
            position.setCurrentPrice(price);
            position.setLastCheckedAt(now);
            if (price > position.getHighestPriceSeenSinceEntry()) {
                position.setHighestPriceSeenSinceEntry(price);
                changed = true;
                log.debug("New high for position {}: {}", positionId, price);
            }
            ExitRules rules = position.getExitRules();
            if (rules.hasTrailingStop() && !position.isTrailingStopActivated()
                    && position.profitPercentAt(price) >= rules.getTrailingStop().getTriggerPercent()) {
                position.setTrailingStopActivated(true);
                changed = true;
                log.info("Trailing stop activated for position {}: price={}, basis={}", positionId,
                        price, position.costBasis());
            }
            snapshot = position.snapshot();
        }
        if (changed) {
            persist(position);
        }
        return Optional.of(snapshot);
    }

    // ==================== OPERATOR ACTIONS ====================

    /**
     * Clears the manual-intervention flag so the monitoring loop acts on the position again.
     */
    public Position resumeMonitoring(String positionId) {
        Position position = activePositions.get(positionId);
        if (position == null) {
            throw new ResourceNotFoundException("Active position not found: " + positionId);
        }
        synchronized (position) {
            position.setManualInterventionRequired(false);
            position.setLastError(null);
        }
        clearFailures(positionId);
        persist(position);
        log.info("Monitoring resumed for position {}", positionId);
        return position.snapshot();
    }

    // ==================== QUERIES ====================

    /**
     * Snapshots of all active positions, oldest first.
     */
    public List<Position> getOpenPositions() {
        List<Position> result = new ArrayList<>(activePositions.size());
        for (Position position : activePositions.values()) {
            result.add(position.snapshot());
        }
        result.sort(Comparator.comparing(Position::getEntryTimestamp));
        return result;
    }

    /**
     * Active positions from memory, closed ones from storage.
     */
    public Optional<Position> getPosition(String positionId) {
        Position position = activePositions.get(positionId);
        if (position != null) {
            return Optional.of(position.snapshot());
        }
        return positionStore.load(positionId);
    }

    public List<Position> getPositionsByStrategy(String strategyId) {
        return positionStore.loadByStrategy(strategyId);
    }

    int failedAttempts(String positionId, String actionKey) {
        AtomicInteger counter = failedAttempts.get(attemptKey(positionId, actionKey));
        return counter != null ? counter.get() : 0;
    }

    // ==================== INTERNALS ====================

    private ActionResult closedOrMissing(String positionId) {
        Position stored = positionStore.load(positionId)
                .orElseThrow(() -> new ResourceNotFoundException("Position not found: " + positionId));
        return ActionResult.skipped(stored, "Position is " + stored.getStatus());
    }

    private PendingAction newAction(PendingActionType type, String actionKey) {
        return PendingAction.builder()
                .type(type)
                .actionKey(actionKey)
                .startedAt(clock.instant())
                .build();
    }

    private void acquire(Position position, PendingAction action) {
        if (!position.tryAcquire(action)) {
            PendingAction inFlight = position.getPendingAction();
            throw new ConcurrencyViolationException(position.getId(),
                    "Action " + action.getActionKey() + " rejected for position " + position.getId()
                            + ": " + (inFlight != null ? inFlight.getActionKey() : "another action") + " in flight");
        }
    }

    private TradeOptions sellOptions(ExitReason reason) {
        double slippage = reason.isProtective()
                ? tradingConfig.getStopLossSellSlippagePercent()
                : tradingConfig.getSellSlippagePercent();
        return TradeOptions.builder()
                .slippagePercent(slippage)
                .maxRetries(tradingConfig.getExecutorMaxRetries())
                .build();
    }

    private TradeResult sell(Position position, double amount, TradeOptions options) {
        try {
            TradeResult result = tradeExecutor.sell(position.getTokenId(), amount, options);
            return result != null ? result : TradeResult.failure("Trade executor returned no result");
        } catch (RuntimeException e) {
            log.error("Sell failed for position {} ({}): {}", position.getId(), position.getTokenId(), e.getMessage(), e);
            return TradeResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private TradeResult buy(Position position, double quote) {
        TradeOptions options = TradeOptions.builder()
                .slippagePercent(tradingConfig.getBuySlippagePercent())
                .maxRetries(tradingConfig.getExecutorMaxRetries())
                .build();
        try {
            TradeResult result = tradeExecutor.buy(position.getTokenId(), quote, options);
            return result != null ? result : TradeResult.failure("Trade executor returned no result");
        } catch (RuntimeException e) {
            log.error("Buy failed for position {} ({}): {}", position.getId(), position.getTokenId(), e.getMessage(), e);
            return TradeResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void recordSell(Position position, double amount, double price, ExitReason reason,
                            String levelId, TradeResult result) {
        position.getSellHistory().add(SellRecord.builder()
                .timestamp(clock.instant())
                .amount(amount)
                .price(price)
                .reason(reason)
                .levelId(levelId)
                .quoteReceived(result.getAmountOut())
                .txRef(result.getTxRef())
                .build());
        position.setQuoteReceived(position.getQuoteReceived() + result.getAmountOut());
    }

    private void markClosed(Position position, double exitPrice, ExitReason reason, String txRef) {
        position.setStatus(PositionStatus.CLOSED);
        position.setExitPrice(exitPrice);
        position.setCloseReason(reason);
        position.setClosedAt(clock.instant());
        position.setExitTxRef(txRef);
        double realizedPercent = position.getInvestedQuote() > 0
                ? (position.getQuoteReceived() - position.getInvestedQuote()) / position.getInvestedQuote() * 100.0
                : position.profitPercentAt(exitPrice);
        position.setRealizedProfitPercent(realizedPercent);
    }

    private void onActionSucceeded(Position position, PendingAction action) {
        failedAttempts.remove(attemptKey(position.getId(), action.getActionKey()));
        synchronized (position) {
            position.setLastError(null);
        }
    }

    private ActionResult handleFailure(Position position, PendingAction action, String error) {
        String message = error != null ? error : "unknown error";
        int attempts = failedAttempts
                .computeIfAbsent(attemptKey(position.getId(), action.getActionKey()), k -> new AtomicInteger())
                .incrementAndGet();
        boolean exhausted = attempts >= monitoringConfig.getMaxActionRetries();

        synchronized (position) {
            position.setLastError(message);
            position.setLastActionAttemptAt(clock.instant());
            if (exhausted) {
                position.setManualInterventionRequired(true);
            }
        }
        persist(position);

        Map<String, Object> payload = payload(position);
        payload.put(TradingConstants.KEY_ACTION, action.getActionKey());
        payload.put(TradingConstants.KEY_ERROR, message);
        payload.put(TradingConstants.KEY_ATTEMPTS, attempts);

        if (exhausted) {
            log.warn("Action {} abandoned for position {} after {} attempts, manual intervention required: {}",
                    action.getActionKey(), position.getId(), attempts, message);
            notifier.emit(NotificationEventType.ACTION_ABANDONED, payload);
            return ActionResult.abandoned(position.snapshot(), message);
        }
        log.error("Action {} failed for position {} (attempt {}/{}): {}",
                action.getActionKey(), position.getId(), attempts, monitoringConfig.getMaxActionRetries(), message);
        notifier.emit(NotificationEventType.ACTION_FAILED, payload);
        return ActionResult.failed(position.snapshot(), message);
    }

    private void emitClosed(Position position, ExitReason reason, double amount, double price,
                            TradeResult result, double realizedProfit) {
        Map<String, Object> payload = payload(position);
        payload.put(TradingConstants.KEY_REASON, reason.name());
        payload.put(TradingConstants.KEY_AMOUNT, amount);
        payload.put(TradingConstants.KEY_PRICE, price);
        payload.put(TradingConstants.KEY_QUOTE, result.getAmountOut());
        payload.put(TradingConstants.KEY_PROFIT_PERCENT, position.getRealizedProfitPercent());
        payload.put(TradingConstants.KEY_REALIZED_PROFIT, realizedProfit);
        payload.put(TradingConstants.KEY_TX_REF, result.getTxRef());
        notifier.emit(NotificationEventType.POSITION_CLOSED, payload);
    }

    private void persist(Position position) {
        Position snapshot = position.snapshot();
        try {
            positionStore.save(snapshot);
        } catch (RuntimeException e) {
            log.error("Failed to persist position {}: {}", position.getId(), e.getMessage(), e);
        }
    }

    private void clearFailures(String positionId) {
        String prefix = positionId + "|";
        failedAttempts.keySet().removeIf(key -> key.startsWith(prefix));
    }

    private static boolean isPhaseExecuted(ScaleInPlan plan, int phaseNumber) {
        for (ScaleInPhase p : plan.getPhases()) {
            if (p.getPhaseNumber() == phaseNumber) {
                return p.isExecuted();
            }
        }
        return false;
    }

    private static String attemptKey(String positionId, String actionKey) {
        return positionId + "|" + actionKey;
    }

    private static Map<String, Object> payload(Position position) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TradingConstants.KEY_POSITION_ID, position.getId());
        payload.put(TradingConstants.KEY_TOKEN_ID, position.getTokenId());
        payload.put(TradingConstants.KEY_TOKEN_SYMBOL, position.getTokenSymbol());
        payload.put(TradingConstants.KEY_STRATEGY_ID, position.getStrategyId());
        return payload;
    }
}
