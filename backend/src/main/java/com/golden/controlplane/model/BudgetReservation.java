package com.golden.controlplane.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "budget_reservations",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_budget_reservation_id", columnNames = "reservation_id"),
                @UniqueConstraint(name = "uk_budget_reservation_request", columnNames = {"tenant_id", "request_id"})
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetReservation {

    public enum Status {
        RESERVED,
        COMMITTED,
        RELEASED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reservation_id", nullable = false, length = 64)
    private String reservationId;

    @Column(name = "tenant_id", nullable = false, length = 128)
    private String tenantId;

    @Column(name = "project_id", nullable = false, length = 128)
    private String projectId;

    @Column(name = "request_id", nullable = false, length = 128)
    private String requestId;

    @Column(name = "task_id", length = 128)
    private String taskId;

    @Column(length = 128)
    private String model;

    @Column(length = 256)
    private String purpose;

    @Column(nullable = false)
    private long amount;

    @Column(name = "committed_amount")
    private Long committedAmount;

    @Column(name = "released_amount")
    private Long releasedAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "finalized_at")
    private Instant finalizedAt;
}
