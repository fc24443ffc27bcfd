package com.golden.controlplane.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One self-modification attempt by an agent role, applied automatically or routed to review.
 */
@Entity
@Table(name = "learning_updates")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningUpdate {

    public enum Status {
        AUTO_APPLIED,
        PENDING_REVIEW,
        HUMAN_APPROVED,
        REJECTED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String role;

    @Column(length = 1024)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status;

    @Column(name = "requested_by", length = 128)
    private String requestedBy;

    @Column(length = 128)
    private String reviewer;

    @Column(name = "review_note", length = 1024)
    private String reviewNote;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;
}
