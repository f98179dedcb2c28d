package com.example.canarycontroller.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Reusable rollout settings. Null fields fall through to the configured defaults.
 */
@Entity
@Table(name = "canary_templates")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanaryTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "traffic_split_type")
    private CanaryDeployment.TrafficSplitType trafficSplitType;

    @Column(name = "initial_canary_percent")
    private Integer initialCanaryPercent;

    @Column(name = "increment_percent")
    private Integer incrementPercent;

    @Column(name = "increment_interval_minutes")
    private Integer incrementIntervalMinutes;

    @Column(name = "error_rate_threshold")
    private Double errorRateThreshold;

    @Column(name = "latency_threshold_ms")
    private Long latencyThresholdMs;

    @Column(name = "success_rate_threshold")
    private Double successRateThreshold;

    @Column(name = "auto_rollback_enabled")
    private Boolean autoRollbackEnabled;

    @Column(name = "require_manual_approval")
    private Boolean requireManualApproval;

    @Column(name = "default_template")
    @Builder.Default
    private boolean defaultTemplate = false;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
