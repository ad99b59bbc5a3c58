package com.autotrader.service.monitoring.exit;

import com.autotrader.model.ExitReason;
import lombok.extern.slf4j.Slf4j;

/**
 * Forced liquidation once a position has been held for its maximum hold time,
 * regardless of profit.
 */
@Slf4j
public class MaxHoldTimeExitRule extends AbstractExitRule {

    private static final int PRIORITY = 100;

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public String getName() {
        return "MaxHoldTime";
    }

    @Override
    public boolean isEnabled(ExitContext ctx) {
        return ctx.getRules().hasMaxHoldTime();
    }

    @Override
    public ExitAction evaluate(ExitContext ctx) {
        final long maxHoldSeconds = ctx.getRules().getMaxHoldTimeSeconds();
        final long heldSeconds = ctx.getHeldFor().getSeconds();
        if (heldSeconds >= maxHoldSeconds) {
            log.info("Max hold time reached for position {}: held {}s, limit {}s",
                    ctx.getPositionId(), heldSeconds, maxHoldSeconds);
            return ExitAction.fullClose(ExitReason.MAX_HOLD,
                    "MAX_HOLD (held: " + heldSeconds + "s, limit: " + maxHoldSeconds + "s)");
        }
        return ExitAction.none();
    }
}
