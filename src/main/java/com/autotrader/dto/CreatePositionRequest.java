package com.autotrader.dto;

import com.autotrader.model.ExitRules;
import com.autotrader.model.ScaleInPlan;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registers a position for a buy that has already been executed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreatePositionRequest {

    @NotBlank(message = "Token id is required")
    private String tokenId;

    private String tokenSymbol;

    @NotNull(message = "Entry price is required")
    @Positive(message = "Entry price must be positive")
    private Double entryPrice;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private Double amount;

    private Double budgetQuote; // Defaults to entryPrice * amount

    private String strategyId;

    private ExitRules exitRules; // Uses trading.* defaults if not provided

    private ScaleInPlan scaleInPlan; // Optional
}
