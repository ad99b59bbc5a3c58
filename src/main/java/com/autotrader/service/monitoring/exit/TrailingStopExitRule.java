package com.autotrader.service.monitoring.exit;

import com.autotrader.model.ExitReason;
import com.autotrader.model.TrailingStopConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Trailing stop that follows the peak price once activated.
 *
 * <h2>Trailing Stop Logic</h2>
 * <ol>
 *   <li><b>Activation</b>: an observed price reaches triggerPercent profit against the cost
 *       basis in force when it was observed. Activation is latched on the position and never
 *       revoked; the current price can activate it as well.</li>
 *   <li><b>Peak</b>: highestPriceSeenSinceEntry, monotonically non-decreasing</li>
 *   <li><b>Exit</b>: current price has retraced distancePercent or more from the peak</li>
 * </ol>
 * <p>
 * The rule itself holds no state; activation and peak live on the position so that they
 * survive restarts.
 */
@Slf4j
public class TrailingStopExitRule extends AbstractExitRule {

    private static final int PRIORITY = 300;

    private static final String EXIT_PREFIX = "TRAILING_STOP (price: ";
    private static final String EXIT_PEAK = ", peak: ";
    private static final String EXIT_RETRACE = ", retrace: ";
    private static final String EXIT_SUFFIX = "%)";

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public String getName() {
        return "TrailingStop";
    }

    @Override
    public boolean isEnabled(ExitContext ctx) {
        TrailingStopConfig trailing = ctx.getRules().getTrailingStop();
        return ctx.getRules().hasTrailingStop() && trailing.getDistancePercent() > 0;
    }

    @Override
    public ExitAction evaluate(ExitContext ctx) {
        final TrailingStopConfig trailing = ctx.getRules().getTrailingStop();

        boolean activated = ctx.getPosition().isTrailingStopActivated()
                || ctx.getProfitPercent() >= trailing.getTriggerPercent();
        if (!activated) {
            return ExitAction.none();
        }

        final double retrace = ctx.getRetracePercent();
        if (retrace >= trailing.getDistancePercent()) {
            log.warn("Trailing stop hit for position {}: price={}, peak={}, retrace={}%",
                    ctx.getPositionId(), ctx.getCurrentPrice(), ctx.getPeakPrice(), formatDouble(retrace));
            return ExitAction.fullClose(ExitReason.TRAILING_STOP,
                    buildExitReason(ctx.getCurrentPrice(), ctx.getPeakPrice(), retrace));
        }
        return ExitAction.none();
    }

    private String buildExitReason(double price, double peak, double retrace) {
        StringBuilder sb = new StringBuilder(96);
        sb.append(EXIT_PREFIX).append(price);
        sb.append(EXIT_PEAK).append(peak);
        sb.append(EXIT_RETRACE);
        appendDouble(sb, retrace);
        sb.append(EXIT_SUFFIX);
        return sb.toString();
    }
}
