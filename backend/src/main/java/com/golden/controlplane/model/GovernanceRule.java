package com.golden.controlplane.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Entity
@Table(name = "governance_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GovernanceRule {

    @Id
    @Column(name = "role", length = 64)
    private String role;

    @Column(name = "max_updates_per_day", nullable = false)
    private int maxUpdatesPerDay;

    @Column(name = "cooldown_seconds", nullable = false)
    private long cooldownSeconds;

    @Column(name = "requires_human_approval", nullable = false)
    private boolean requiresHumanApproval;

    @Column(name = "last_update_at")
    private Instant lastUpdateAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }
}
