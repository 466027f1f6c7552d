package com.distributedsystems.bhr.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One agent's acknowledgement state for one block. Rows are never deleted; an agent
 * reporting the route removed only clears {@code confirmedAt}.
 */
@Entity
@Table(
        name = "agent_confirmation",
        uniqueConstraints = @UniqueConstraint(name = "uk_confirmation_block_agent", columnNames = {"block_id", "agent_id"}),
        indexes = @Index(name = "idx_confirmation_agent", columnList = "agent_id")
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentConfirmationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "block_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private BlockEntity block;

    @Column(name = "agent_id", nullable = false, length = 128)
    private String agentId;

    private Instant confirmedAt;

    private Instant firstConfirmedAt;

    private Instant lastUnconfirmedAt;

    @Version
    @Builder.Default
    private long rowVersion = 0L;

    public boolean isConfirmed() {
        return confirmedAt != null;
    }
}
