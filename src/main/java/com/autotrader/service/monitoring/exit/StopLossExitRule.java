package com.autotrader.service.monitoring.exit;

import com.autotrader.model.ExitReason;
import lombok.extern.slf4j.Slf4j;

/**
 * Closes the whole position once the loss against the cost basis reaches the stop-loss percent.
 * Evaluated before everything else.
 */
@Slf4j
public class StopLossExitRule extends AbstractExitRule {

    private static final int PRIORITY = 0;

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public String getName() {
        return "StopLoss";
    }

    @Override
    public boolean isEnabled(ExitContext ctx) {
        return ctx.getRules().hasStopLoss();
    }

    @Override
    public ExitAction evaluate(ExitContext ctx) {
        final double stopLoss = ctx.getRules().getStopLossPercent();
        final double profit = ctx.getProfitPercent();
        if (profit <= -stopLoss) {
            log.warn("Stop loss hit for position {}: profit={}%, stopLoss=-{}%",
                    ctx.getPositionId(), formatDouble(profit), formatDouble(stopLoss));
            return ExitAction.fullClose(ExitReason.STOP_LOSS, describe("STOP_LOSS", profit, -stopLoss));
        }
        return ExitAction.none();
    }
}
