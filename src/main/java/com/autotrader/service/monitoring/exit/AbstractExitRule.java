package com.autotrader.service.monitoring.exit;

import com.autotrader.util.FormatUtils;

/**
 * Base class for exit rules with shared formatting for exit descriptions.
 */
public abstract class AbstractExitRule implements ExitRule {

    protected static String formatDouble(double value) {
        return FormatUtils.formatDouble(value);
    }

    protected static void appendDouble(StringBuilder sb, double value) {
        FormatUtils.appendDouble(sb, value);
    }

    /**
     * Builds "PREFIX (profit: x%, threshold: y%)".
     */
    protected static String describe(String prefix, double profitPercent, double thresholdPercent) {
        StringBuilder sb = new StringBuilder(64);
        sb.append(prefix).append(" (profit: ");
        appendDouble(sb, profitPercent);
        sb.append("%, threshold: ");
        appendDouble(sb, thresholdPercent);
        sb.append("%)");
        return sb.toString();
    }
}
