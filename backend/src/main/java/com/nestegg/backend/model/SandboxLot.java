package com.nestegg.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Current holding of one symbol in a sandbox. Rows at (or within epsilon of) zero
 * quantity are deleted rather than kept.
 */
@Entity
@Table(name = "sandbox_lots",
        uniqueConstraints = @UniqueConstraint(name = "uk_sandbox_lots_symbol", columnNames = {"sandbox_id", "symbol"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SandboxLot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sandbox_id", nullable = false)
    private Long sandboxId;

    @Column(nullable = false)
    private String symbol;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(name = "avg_cost", nullable = false, precision = 19, scale = 6)
    private BigDecimal averageCost;

    @Column(nullable = false)
    private Instant updatedAt;
}
