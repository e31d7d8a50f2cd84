package com.nestegg.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Grant of watch/edit rights on a sandbox. Rows are written by the sharing collaborator;
 * this service only reads them.
 */
@Entity
@Table(name = "sandbox_shares",
        uniqueConstraints = @UniqueConstraint(name = "uk_sandbox_shares_grantee", columnNames = {"sandbox_id", "shared_with_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SandboxShare {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sandbox_id", nullable = false)
    private Long sandboxId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "shared_with_id", nullable = false)
    private Long sharedWithId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private SharePermission permission;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
