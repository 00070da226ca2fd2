package com.scanhub.pairing.model.domain;

import java.time.Instant;

import com.scanhub.pairing.model.enums.SyncStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pairing Record - a committed (platform, product) association.
 *
 * A record is written once by the pairing commit. Afterwards only two things may change:
 * - the overwrite flag, set when a later scan of the same product supersedes it
 * - the sync status, set once by the legacy reconciliation worker
 *
 * Records are never deleted.
 */
@Entity
@Table(name = "pairing_records", indexes = {
    @Index(name = "idx_pr_platform_product", columnList = "platform, product"),
    @Index(name = "idx_pr_product", columnList = "product"),
    @Index(name = "idx_pr_scanned", columnList = "scanned_at"),
    @Index(name = "idx_pr_login", columnList = "login")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PairingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Login of the identity whose scanner produced the pairing.
     */
    @Column(name = "login", nullable = false, length = 100)
    private String login;

    @Column(name = "platform", nullable = false)
    private Integer platform;

    @Column(name = "product", nullable = false)
    private Long product;

    @Column(name = "scanned_at", nullable = false)
    private Instant scannedAt;

    /**
     * True once a later record for the same product exists.
     */
    @Column(name = "is_overwrite", nullable = false)
    @Builder.Default
    private Boolean overwrite = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", nullable = false, length = 10)
    @Builder.Default
    private SyncStatus syncStatus = SyncStatus.PENDING;

    /**
     * Diagnostic text from the legacy system when reconciliation failed.
     */
    @Column(name = "sync_error", length = 1000)
    private String syncError;

    @PrePersist
    protected void onCreate() {
        if (scannedAt == null) {
            scannedAt = Instant.now();
        }
    }
}
