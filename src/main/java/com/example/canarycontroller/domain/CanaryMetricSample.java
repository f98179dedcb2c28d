package com.example.canarycontroller.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Metrics observed at one tick, together with the verdict reached on them.
 */
@Entity
@Table(name = "canary_metric_samples", indexes = {
        @Index(name = "idx_sample_deployment", columnList = "deployment_id"),
        @Index(name = "idx_sample_sampled_at", columnList = "sampled_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanaryMetricSample {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "deployment_id", nullable = false)
    private String deploymentId;

    @Column(name = "step_id")
    private String stepId;

    @Column(name = "step_number")
    private Integer stepNumber;

    @Column(name = "canary_percent")
    private int canaryPercent;

    @Column(name = "metrics_available")
    private boolean metricsAvailable;

    @Column(name = "canary_error_rate")
    private Double canaryErrorRate;

    @Column(name = "stable_error_rate")
    private Double stableErrorRate;

    @Column(name = "canary_avg_latency_ms")
    private Double canaryAvgLatencyMs;

    @Column(name = "stable_avg_latency_ms")
    private Double stableAvgLatencyMs;

    @Column(name = "canary_requests")
    private Long canaryRequests;

    @Column(name = "stable_requests")
    private Long stableRequests;

    @Column(name = "canary_healthy_pods")
    private Integer canaryHealthyPods;

    @Column(name = "canary_total_pods")
    private Integer canaryTotalPods;

    @Column(name = "analysis_result", nullable = false)
    private String analysisResult;

    @Column(name = "analysis_notes", length = 4096)
    private String analysisNotes;

    /** Advisor commentary; filled in asynchronously and absent when the advisor failed */
    @Column(name = "advisor_narrative", length = 4096)
    private String advisorNarrative;

    @Column(name = "sampled_at", nullable = false)
    private Instant sampledAt;

    @PrePersist
    protected void onCreate() {
        if (sampledAt == null) sampledAt = Instant.now();
    }
}
