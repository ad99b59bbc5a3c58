package com.autotrader.service.monitoring.exit;

import com.autotrader.model.ExitReason;
import lombok.Getter;

/**
 * Result of exit rule evaluation: nothing, a full close, or a partial close.
 */
@Getter
public final class ExitAction {

    public enum ActionType {
        /** No exit condition met, continue monitoring */
        NONE,
        /** Sell everything that remains */
        FULL_CLOSE,
        /** Sell one partial profit level */
        PARTIAL_CLOSE
    }

    private static final ExitAction NONE = new ExitAction(ActionType.NONE, null, 0.0, null, null);

    private final ActionType type;

    private final ExitReason reason;

    /** Sell fraction of amountTotal (PARTIAL_CLOSE only) */
    private final double fraction;

    /** Partial level id (PARTIAL_CLOSE only) */
    private final String levelId;

    /** Formatted description for logs and notifications */
    private final String description;

    private ExitAction(ActionType type, ExitReason reason, double fraction, String levelId, String description) {
        this.type = type;
        this.reason = reason;
        this.fraction = fraction;
        this.levelId = levelId;
        this.description = description;
    }

    public static ExitAction none() {
        return NONE;
    }

    public static ExitAction fullClose(ExitReason reason, String description) {
        return new ExitAction(ActionType.FULL_CLOSE, reason, 1.0, null, description);
    }

    public static ExitAction partialClose(double fraction, String levelId, String description) {
        return new ExitAction(ActionType.PARTIAL_CLOSE, ExitReason.PARTIAL_TAKE_PROFIT, fraction, levelId, description);
    }

    public boolean requiresAction() {
        return type != ActionType.NONE;
    }

    public boolean isFullClose() {
        return type == ActionType.FULL_CLOSE;
    }

    public boolean isPartialClose() {
        return type == ActionType.PARTIAL_CLOSE;
    }

    @Override
    public String toString() {
        if (type == ActionType.NONE) {
            return "ExitAction[NONE]";
        }
        return "ExitAction[" + type + ", " + reason + (levelId != null ? ", level=" + levelId : "") + "]";
    }
}
