package com.autotrader.service.monitoring.exit;

import com.autotrader.model.PartialProfitLevel;
import lombok.extern.slf4j.Slf4j;

/**
 * Sells a fraction of the position for the lowest-threshold level that is not yet
 * executed and whose threshold has been reached. At most one level per evaluation;
 * higher levels follow on later ticks.
 */
@Slf4j
public class PartialProfitExitRule extends AbstractExitRule {

    private static final int PRIORITY = 400;

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public String getName() {
        return "PartialProfit";
    }

    @Override
    public boolean isEnabled(ExitContext ctx) {
        return !ctx.getRules().getPartialProfitLevels().isEmpty()
                && ctx.getPosition().getAmountRemaining() > 0;
    }

    @Override
    public ExitAction evaluate(ExitContext ctx) {
        final double profit = ctx.getProfitPercent();
        // Levels are kept sorted ascending by threshold
        for (PartialProfitLevel level : ctx.getRules().getPartialProfitLevels()) {
            if (level.isExecuted()) {
                continue;
            }
            if (level.getThresholdPercent() > profit) {
                break;
            }
            log.info("Partial profit level {} reached for position {}: profit={}%, selling {} of total",
                    level.getLevelId(), ctx.getPositionId(), formatDouble(profit), level.getSellFraction());
            return ExitAction.partialClose(level.getSellFraction(), level.getLevelId(),
                    describe("PARTIAL_TAKE_PROFIT " + level.getLevelId(), profit, level.getThresholdPercent()));
        }
        return ExitAction.none();
    }
}
