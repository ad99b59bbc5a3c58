package com.autotrader.dto;

import com.autotrader.model.ExitRules;
import com.autotrader.model.NotificationSettings;
import com.autotrader.model.ScaleInPlan;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyRequest {

    @NotBlank(message = "Strategy name is required")
    private String name;

    private Boolean enabled; // default: true

    @Positive(message = "Max concurrent positions must be positive")
    private Integer maxConcurrentPositions; // default: 3

    @Positive(message = "Max position size must be positive")
    private Double maxPositionSize; // default: 0.1

    @Positive(message = "Total budget must be positive")
    private Double totalBudget; // default: 1.0

    private ExitRules exitRules; // default: trading.* exit rules

    private ScaleInPlan scaleInPlan; // optional

    private NotificationSettings notifications; // default: all on
}
