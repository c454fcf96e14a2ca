package com.apex.decision.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradeTransactionRequest {

    private String symbol;
    private Long ticket;
    private String type;
    private double profit;
}
