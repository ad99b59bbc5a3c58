package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a position manager action together with the position state after it.
 */
@Getter
@ToString
@AllArgsConstructor
public final class ActionResult {

    private final ActionOutcome outcome;

    private final Position position;

    private final String message;

    public static ActionResult applied(Position position) {
        return new ActionResult(ActionOutcome.APPLIED, position, null);
    }

    public static ActionResult skipped(Position position, String message) {
        return new ActionResult(ActionOutcome.SKIPPED, position, message);
    }

    public static ActionResult failed(Position position, String message) {
        return new ActionResult(ActionOutcome.FAILED, position, message);
    }

    public static ActionResult abandoned(Position position, String message) {
        return new ActionResult(ActionOutcome.ABANDONED, position, message);
    }

    public boolean isApplied() {
        return outcome == ActionOutcome.APPLIED;
    }
}
