package com.nestegg.backend.dto;

import com.nestegg.backend.model.TradeSide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Side must be BUY or SELL")
    private TradeSide side;

    private BigDecimal quantity;

    // Cash amount; used only when quantity is absent or not positive
    private BigDecimal amount;
}
