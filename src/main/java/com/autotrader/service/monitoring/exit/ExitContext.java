package com.autotrader.service.monitoring.exit;

import com.autotrader.model.ExitRules;
import com.autotrader.model.Position;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of one position at one price, passed to every {@link ExitRule}.
 * <p>
 * Derived values (profit, peak, retracement) are computed once on construction
 * so that each rule reads primitives only.
 */
@Getter
public final class ExitContext {

    private final Position position;

    private final ExitRules rules;

    private final double currentPrice;

    private final Instant now;

    /** Profit percent of currentPrice against the VWAP cost basis */
    private final double profitPercent;

    /** Highest price seen including the current one */
    private final double peakPrice;

    /** Percent retraced from the peak price */
    private final double retracePercent;

    private final Duration heldFor;

    private ExitContext(Position position, double currentPrice, Instant now) {
        this.position = position;
        this.rules = position.getExitRules();
        this.currentPrice = currentPrice;
        this.now = now;
        this.profitPercent = position.profitPercentAt(currentPrice);
        this.peakPrice = Math.max(position.getHighestPriceSeenSinceEntry(), currentPrice);
        this.retracePercent = (peakPrice - currentPrice) / peakPrice * 100.0;
        this.heldFor = position.getEntryTimestamp() != null
                ? Duration.between(position.getEntryTimestamp(), now)
                : Duration.ZERO;
    }

    public static ExitContext of(Position position, double currentPrice, Instant now) {
        return new ExitContext(position, currentPrice, now);
    }

    public String getPositionId() {
        return position.getId();
    }
}
