package com.autotrader.service.monitoring.scalein;

import com.autotrader.model.Position;
import com.autotrader.model.ScaleInPhase;
import com.autotrader.model.ScaleInPlan;
import com.autotrader.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether the next scale-in phase of a position should fire.
 * <p>
 * Only the phase at {@code currentPhase} is ever considered, so a deep drop that already
 * satisfies phase 2 still fires phase 1 first. Triggers are measured from the original
 * entry price, never from the VWAP cost basis.
 */
@Slf4j
@Component
public class ScaleInPlanner {

    public Optional<ScaleInPhase> nextPhase(Position position, double currentPrice) {
        if (!(currentPrice > 0) || !position.isActive() || !position.hasScaleInPlan()) {
            return Optional.empty();
        }
        ScaleInPlan plan = position.getScaleInPlan();
        ScaleInPhase phase = plan.nextPendingPhase();
        if (phase == null || phase.isExecuted()) {
            return Optional.empty();
        }

        double drop = position.dropFromEntryPercent(currentPrice);
        if (drop >= phase.getTriggerDropPercent()) {
            log.info("Scale-in phase {} triggered for position {}: drop={}% >= {}%",
                    phase.getPhaseNumber(), position.getId(),
                    FormatUtils.formatDouble(drop), phase.getTriggerDropPercent());
            return Optional.of(phase);
        }
        return Optional.empty();
    }
}
