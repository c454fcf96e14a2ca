package com.apex.decision.dto;

import com.apex.decision.model.MarketDirection;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecideRequest {

    @NotNull
    private Double confidence;
    private MarketDirection direction;
}
