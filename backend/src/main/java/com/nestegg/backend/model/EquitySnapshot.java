package com.nestegg.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "sandbox_equity_snapshots",
        uniqueConstraints = @UniqueConstraint(name = "uk_equity_snapshot_day", columnNames = {"sandbox_id", "snapshot_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquitySnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sandbox_id", nullable = false)
    private Long sandboxId;

    @Column(name = "snapshot_date", nullable = false)
    private LocalDate snapshotDate;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal totalEquity;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal cash;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal holdingsValue;

    @Column(nullable = false)
    private Instant writtenAt;
}
