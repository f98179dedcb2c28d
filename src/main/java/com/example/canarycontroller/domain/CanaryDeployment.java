package com.example.canarycontroller.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * One progressive rollout of a canary version against a target workload.
 * Owns its steps, rollback records and metric samples (referenced by deploymentId).
 */
@Entity
@Table(name = "canary_deployments", indexes = {
        @Index(name = "idx_canary_status", columnList = "status"),
        @Index(name = "idx_canary_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanaryDeployment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Version
    @Column(name = "row_version")
    private Long rowVersion;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String namespace;

    @Column(name = "target_deployment", nullable = false)
    private String targetDeployment;

    @Column(name = "cluster_id")
    private String clusterId;

    @Column(name = "stable_image")
    private String stableImage;

    @Column(name = "stable_version")
    private String stableVersion;

    @Column(name = "canary_image", nullable = false)
    private String canaryImage;

    @Column(name = "canary_version")
    private String canaryVersion;

    // Traffic plan
    @Enumerated(EnumType.STRING)
    @Column(name = "traffic_split_type", nullable = false)
    @Builder.Default
    private TrafficSplitType trafficSplitType = TrafficSplitType.PERCENTAGE;

    @Column(name = "initial_canary_percent")
    private int initialCanaryPercent;

    @Column(name = "target_canary_percent")
    private int targetCanaryPercent;

    @Column(name = "increment_percent")
    private int incrementPercent;

    /** Advisory cadence for the caller; the engine never schedules itself */
    @Column(name = "increment_interval_minutes")
    private int incrementIntervalMinutes;

    // Health thresholds
    @Column(name = "error_rate_threshold")
    private double errorRateThreshold;

    @Column(name = "latency_threshold_ms")
    private long latencyThresholdMs;

    @Column(name = "success_rate_threshold")
    private double successRateThreshold;

    @Column(name = "min_healthy_pods")
    private int minHealthyPods;

    // Rollback policy
    @Column(name = "auto_rollback_enabled")
    private boolean autoRollbackEnabled;

    @Column(name = "rollback_on_error_rate")
    private boolean rollbackOnErrorRate;

    @Column(name = "rollback_on_latency")
    private boolean rollbackOnLatency;

    @Column(name = "rollback_on_pod_failure")
    private boolean rollbackOnPodFailure;

    @Column(name = "require_manual_approval")
    private boolean requireManualApproval;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    // Mutable state
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeploymentStatus status;

    /** Status to return to on resume */
    @Enumerated(EnumType.STRING)
    @Column(name = "paused_from_status")
    private DeploymentStatus pausedFromStatus;

    @Column(name = "current_canary_percent")
    private int currentCanaryPercent;

    @Column(name = "status_message", length = 2048)
    private String statusMessage;

    // Provenance
    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "git_commit")
    private String gitCommit;

    @Column(name = "git_branch")
    private String gitBranch;

    @Column(name = "pull_request_url", length = 1024)
    private String pullRequestUrl;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "last_progress_at")
    private Instant lastProgressAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public enum TrafficSplitType {
        PERCENTAGE, HEADER, COOKIE
    }

    public enum DeploymentStatus {
        PENDING, INITIALIZING, PROGRESSING, PAUSED, PROMOTED, ROLLING_BACK, ROLLED_BACK, FAILED, CANCELLED;

        private static final Set<DeploymentStatus> TERMINAL = EnumSet.of(PROMOTED, ROLLED_BACK, FAILED, CANCELLED);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }

        /** Traffic is being shifted and exactly one step is running */
        public boolean isActive() {
            return this == INITIALIZING || this == PROGRESSING;
        }
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isApproved() {
        return approvedAt != null;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = Instant.now();
        if (status == null) status = DeploymentStatus.PENDING;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
