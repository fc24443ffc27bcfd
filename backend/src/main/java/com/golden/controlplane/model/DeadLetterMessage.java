package com.golden.controlplane.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Work that exhausted its retries. Never deleted; resolution is recorded in place.
 */
@Entity
@Table(name = "dead_letter_messages")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "original_destination", nullable = false, length = 255)
    private String originalDestination;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "source_work_item_id")
    private Long sourceWorkItemId;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "resolution_note", length = 1024)
    private String resolutionNote;

    @Column(nullable = false)
    private boolean requeued;

    @Column(name = "resolved_by", length = 128)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
