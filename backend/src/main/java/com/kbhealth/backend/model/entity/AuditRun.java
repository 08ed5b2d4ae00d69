package com.kbhealth.backend.model.entity;

import com.kbhealth.backend.model.enums.AuditRunStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * One audit of every stored article of a source, kept as history with its totals.
 */
@Entity
@Table(name = "audit_runs", indexes = {
        @Index(name = "idx_audit_runs_source", columnList = "sourceId"),
        @Index(name = "idx_audit_runs_started", columnList = "startedAt")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AuditRun {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 100)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AuditRunStatus status = AuditRunStatus.RUNNING;

    @Column(nullable = false)
    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private Long durationMs;

    @Builder.Default
    private int rulesExecuted = 0;

    @Builder.Default
    private int articlesProcessed = 0;

    @Builder.Default
    private int articlesFailed = 0;

    @Builder.Default
    private int totalIssues = 0;

    private Double averageHealthScore;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
