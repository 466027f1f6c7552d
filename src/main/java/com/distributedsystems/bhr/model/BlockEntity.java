package com.distributedsystems.bhr.model;

import com.distributedsystems.bhr.util.Network;
import com.distributedsystems.bhr.util.NetworkConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(
        name = "bhr_block",
        indexes = {
                @Index(name = "idx_block_cidr", columnList = "cidr"),
                @Index(name = "idx_block_active", columnList = "active"),
                @Index(name = "idx_block_expires_at", columnList = "expires_at")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_block_active_cidr", columnNames = "active_cidr")
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BlockEntity {

    public enum DeactivationReason {
        EXPIRED,
        WITHDRAWN
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = NetworkConverter.class)
    @Column(name = "cidr", nullable = false, length = 64)
    private Network cidr;

    // Mirrors cidr while active, null afterwards; the unique constraint allows one live row per network.
    @Column(name = "active_cidr", length = 64)
    private String activeCidr;

    @Column(nullable = false, length = 128)
    private String requestedBy;

    @Column(nullable = false)
    private String source;

    @Column(nullable = false, length = 1024)
    private String reason;

    @Column(nullable = false)
    private Instant createdAt;

    private Long durationSeconds;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Builder.Default
    private boolean skipWhitelist = false;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    private Instant deactivatedAt;

    @Column(length = 128)
    private String deactivatedBy;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private DeactivationReason deactivationReason;

    @Column(length = 1024)
    private String withdrawReason;

    @Version
    @Builder.Default
    private long rowVersion = 0L;

    public boolean isLiveAt(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }

    public boolean hasExpiredBy(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public void deactivate(Instant when, String by, DeactivationReason why) {
        this.active = false;
        this.activeCidr = null;
        this.deactivatedAt = when;
        this.deactivatedBy = by;
        this.deactivationReason = why;
    }
}
