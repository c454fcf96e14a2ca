package com.apex.decision.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TickRequest {

    @NotBlank
    private String symbol;
    @Positive
    private double bid;
    @Positive
    private double ask;
    private Instant time;
}
