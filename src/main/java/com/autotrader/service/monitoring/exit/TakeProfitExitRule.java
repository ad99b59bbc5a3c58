package com.autotrader.service.monitoring.exit;

import com.autotrader.model.ExitReason;
import lombok.extern.slf4j.Slf4j;

/**
 * Closes the whole position once profit reaches the take-profit percent.
 */
@Slf4j
public class TakeProfitExitRule extends AbstractExitRule {

    private static final int PRIORITY = 200;

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public String getName() {
        return "TakeProfit";
    }

    @Override
    public boolean isEnabled(ExitContext ctx) {
        return ctx.getRules().hasTakeProfit();
    }

    @Override
    public ExitAction evaluate(ExitContext ctx) {
        final double takeProfit = ctx.getRules().getTakeProfitPercent();
        final double profit = ctx.getProfitPercent();
        if (profit >= takeProfit) {
            log.info("Take profit hit for position {}: profit={}%, target={}%",
                    ctx.getPositionId(), formatDouble(profit), formatDouble(takeProfit));
            return ExitAction.fullClose(ExitReason.TAKE_PROFIT, describe("TAKE_PROFIT", profit, takeProfit));
        }
        return ExitAction.none();
    }
}
