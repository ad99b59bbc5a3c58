package com.autotrader.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OpenStrategyPositionRequest {

    @NotBlank(message = "Token id is required")
    private String tokenId;

    private String tokenSymbol;
}
