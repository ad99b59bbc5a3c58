package com.autotrader.dto;

import com.autotrader.model.ExitReason;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClosePositionRequest {

    @Positive(message = "Exit price must be positive")
    private Double exitPrice; // Current oracle price if not provided

    private ExitReason reason; // MANUAL if not provided
}
