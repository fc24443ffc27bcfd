package com.golden.controlplane.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only ledger entry. Rows are inserted, never updated.
 */
@Entity
@Table(name = "budget_transactions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetTransaction {

    public enum Type {
        RESERVE,
        COMMIT,
        RELEASE
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 128)
    private String tenantId;

    @Column(name = "project_id", nullable = false, length = 128)
    private String projectId;

    @Column(name = "request_id", length = 128)
    private String requestId;

    @Column(name = "reservation_id", nullable = false, length = 64)
    private String reservationId;

    @Column(name = "task_id", length = 128)
    private String taskId;

    @Column(length = 256)
    private String purpose;

    @Enumerated(EnumType.STRING)
    @Column(name = "txn_type", nullable = false, length = 16)
    private Type type;

    @Column(nullable = false)
    private long amount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
