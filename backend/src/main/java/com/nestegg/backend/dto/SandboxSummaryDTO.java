package com.nestegg.backend.dto;

import com.nestegg.backend.model.AccessLevel;
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
public class SandboxSummaryDTO {
    private Long id;
    private String name;
    private BigDecimal cash;
    private BigDecimal initialCash;
    private BigDecimal totalEquity;
    private Instant createdAt;
    private Long ownerId;
    private AccessLevel permission;
    private boolean shared;
}
