package com.example.canarycontroller.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * History entry for a rollback attempt. FAILED means the revert itself failed,
 * which is distinct from a deployment that never needed one.
 */
@Entity
@Table(name = "canary_rollbacks", indexes = {
        @Index(name = "idx_rollback_deployment", columnList = "deployment_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RollbackRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "deployment_id", nullable = false)
    private String deploymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rollback_trigger", nullable = false)
    private Trigger trigger;

    @Column(name = "canary_percent_at_rollback")
    private int canaryPercentAtRollback;

    @Column(name = "step_at_rollback")
    private Integer stepAtRollback;

    @Column(name = "rollback_to_version")
    private String rollbackToVersion;

    @Column(name = "rollback_to_image")
    private String rollbackToImage;

    @Column(name = "initiated_by")
    private String initiatedBy;

    @Column(length = 2048)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private RollbackStatus status = RollbackStatus.IN_PROGRESS;

    @Column(name = "error_message", length = 4096)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public enum Trigger {
        AUTO_ERROR_RATE, AUTO_LATENCY, AUTO_POD_FAILURE, AUTO_HEALTH_CHECK, MANUAL, TIMEOUT, CANCELLED
    }

    public enum RollbackStatus {
        IN_PROGRESS, COMPLETED, FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
