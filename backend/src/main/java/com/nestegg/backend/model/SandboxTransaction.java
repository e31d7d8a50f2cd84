package com.nestegg.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One executed trade. Rows are append-only; replay orders by executedAt, then id.
 */
@Entity
@Table(name = "sandbox_transactions")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class SandboxTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sandbox_id", nullable = false, updatable = false)
    private Long sandboxId;

    @Column(nullable = false, updatable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 4)
    private TradeSide side;

    @Column(nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal price;

    // Exact cash delta applied by this trade
    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal total;

    // Populated for SELL only
    @Column(updatable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(nullable = false, updatable = false)
    private Instant executedAt;
}
