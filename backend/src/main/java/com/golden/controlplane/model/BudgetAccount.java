package com.golden.controlplane.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "budget_accounts",
        uniqueConstraints = @UniqueConstraint(name = "uk_budget_account_key", columnNames = {"tenant_id", "project_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 128)
    private String tenantId;

    @Column(name = "project_id", nullable = false, length = 128)
    private String projectId;

    @Column(name = "total_limit", nullable = false)
    private long totalLimit;

    @Column(nullable = false)
    private long used;

    @Column(nullable = false)
    private long reserved;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public long available() {
        return totalLimit - used - reserved;
    }
}
