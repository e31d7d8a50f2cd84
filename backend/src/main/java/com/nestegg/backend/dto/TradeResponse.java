package com.nestegg.backend.dto;

import com.nestegg.backend.model.TradeSide;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeResponse {
    private Long transactionId;
    private Long sandboxId;
    private String symbol;
    private TradeSide side;
    private BigDecimal price;
    private BigDecimal quantity;
    private BigDecimal total;
    private BigDecimal realizedPnl;
    private BigDecimal newCashBalance;
    private Instant executedAt;
}
