package com.example.canarycontroller.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable audit trail entry for a deployment lifecycle event.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_actor", columnList = "actor"),
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_target", columnList = "target"),
        @Index(name = "idx_audit_recorded_at", columnList = "recorded_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** Who performed the action: a user name, "system" or "driver" */
    @Column(nullable = false)
    private String actor;

    /** CANARY_CREATED, CANARY_STARTED, CANARY_PROGRESSED, CANARY_PROMOTED, CANARY_ROLLBACK_INITIATED, ... */
    @Column(nullable = false)
    private String action;

    /** Deployment or template id */
    private String target;

    /** Deployment status after the event; null for template changes */
    @Column(name = "deployment_status")
    private String deploymentStatus;

    @Column(name = "canary_percent")
    private Integer canaryPercent;

    /** JSON details about the action */
    @Column(length = 8192)
    private String details;

    @Builder.Default
    private boolean success = true;

    @Column(name = "recorded_at", nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
