package com.nestegg.backend.dto;

import com.nestegg.backend.model.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioResponse {
    private Long sandboxId;
    private String name;
    private List<LotDTO> lots;
    private BigDecimal cash;
    private BigDecimal initialCash;
    private BigDecimal holdingsValue;
    private BigDecimal totalEquity;
    private BigDecimal realizedPnl;
    private List<EquityPointDTO> equityCurve;
    // Advisory only; set when the history could not be reconstructed
    private String historyError;
    private AccessLevel permission;
}
