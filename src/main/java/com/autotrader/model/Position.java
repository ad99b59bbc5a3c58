package com.autotrader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A holding of one token under active monitoring.
 * <p>
 * Identity, token, original entry price, entry time and the exit rule snapshot never
 * change after creation. {@link #averageEntryPrice} is the volume-weighted cost basis
 * across the initial buy and every executed scale-in, while {@link #entryPrice} keeps
 * the original fill used for scale-in triggers.
 * <p>
 * Instances held by the position manager are live; everything handed out to callers
 * is a {@link #snapshot()}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Position {

    @Setter(AccessLevel.NONE)
    private String id;

    @Setter(AccessLevel.NONE)
    private String tokenId;

    private String tokenSymbol;

    private String strategyId;

    @Setter(AccessLevel.NONE)
    private double entryPrice;

    @Setter(AccessLevel.NONE)
    private Instant entryTimestamp;

    /** VWAP cost basis, recomputed on every scale-in */
    private double averageEntryPrice;

    private double amountTotal;

    private double amountRemaining;

    /** Quote budget reserved for this position; scale-in phases spend fractions of it */
    private double budgetQuote;

    /** Quote actually spent across all buys */
    private double investedQuote;

    private double currentPrice;

    private double highestPriceSeenSinceEntry;

    /** Latched once the peak profit crossed the trailing trigger */
    private boolean trailingStopActivated;

    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;

    @Setter(AccessLevel.NONE)
    private ExitRules exitRules;

    private ScaleInPlan scaleInPlan;

    @Builder.Default
    private List<SellRecord> sellHistory = new ArrayList<>();

    // Exit bookkeeping
    private Double exitPrice;
    private Double realizedProfitPercent;
    private ExitReason closeReason;
    private Instant closedAt;
    private String exitTxRef;
    private double quoteReceived;

    // Failure bookkeeping
    private String lastError;
    private Instant lastActionAttemptAt;
    private boolean manualInterventionRequired;

    private Instant lastCheckedAt;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private AtomicReference<PendingAction> pendingActionRef = new AtomicReference<>();

    public boolean isActive() {
        return status != null && status.isActive();
    }

    /**
     * Profit percent of the given price against the VWAP cost basis.
     */
    public double profitPercentAt(double price) {
        double basis = costBasis();
        return (price - basis) / basis * 100.0;
    }

    /**
     * Cost basis used for stop-loss, take-profit, trailing and partial levels.
     */
    public double costBasis() {
        return averageEntryPrice > 0 ? averageEntryPrice : entryPrice;
    }

    /**
     * Percent drop of the given price below the original entry price.
     */
    public double dropFromEntryPercent(double price) {
        return (entryPrice - price) / entryPrice * 100.0;
    }

    public boolean hasScaleInPlan() {
        return scaleInPlan != null && scaleInPlan.isEnabled();
    }

    // ==================== PENDING ACTION GUARD ====================

    public PendingAction getPendingAction() {
        return pendingActionRef.get();
    }

    public boolean hasPendingAction() {
        return pendingActionRef.get() != null;
    }

    /**
     * Claims the single in-flight action slot.
     *
     * @return false when another action already holds it
     */
    public boolean tryAcquire(PendingAction action) {
        return pendingActionRef.compareAndSet(null, action);
    }

    public void release(PendingAction action) {
        pendingActionRef.compareAndSet(action, null);
    }

    /**
     * Deep copy for callers outside the position manager. The copy carries the
     * current pending action for inspection but does not share the guard.
     */
    public synchronized Position snapshot() {
        Position copy = copyFields();
        copy.pendingActionRef = new AtomicReference<>(pendingActionRef.get());
        return copy;
    }

    private Position copyFields() {
        return Position.builder()
                .id(id)
                .tokenId(tokenId)
                .tokenSymbol(tokenSymbol)
                .strategyId(strategyId)
                .entryPrice(entryPrice)
                .entryTimestamp(entryTimestamp)
                .averageEntryPrice(averageEntryPrice)
                .amountTotal(amountTotal)
                .amountRemaining(amountRemaining)
                .budgetQuote(budgetQuote)
                .investedQuote(investedQuote)
                .currentPrice(currentPrice)
                .highestPriceSeenSinceEntry(highestPriceSeenSinceEntry)
                .trailingStopActivated(trailingStopActivated)
                .status(status)
                .exitRules(exitRules != null ? exitRules.copy() : null)
                .scaleInPlan(scaleInPlan != null ? scaleInPlan.copy() : null)
                .sellHistory(new ArrayList<>(sellHistory))
                .exitPrice(exitPrice)
                .realizedProfitPercent(realizedProfitPercent)
                .closeReason(closeReason)
                .closedAt(closedAt)
                .exitTxRef(exitTxRef)
                .quoteReceived(quoteReceived)
                .lastError(lastError)
                .lastActionAttemptAt(lastActionAttemptAt)
                .manualInterventionRequired(manualInterventionRequired)
                .lastCheckedAt(lastCheckedAt)
                .build();
    }
}
