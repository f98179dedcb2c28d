package com.example.canarycontroller.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of a deployment's traffic schedule.
 */
@Entity
@Table(name = "canary_deployment_steps", indexes = {
        @Index(name = "idx_step_deployment", columnList = "deployment_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "deployment_id", nullable = false)
    private String deploymentId;

    @Column(name = "step_number", nullable = false)
    private int stepNumber;

    @Column(name = "target_percent", nullable = false)
    private int targetPercent;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public enum StepStatus {
        PENDING, RUNNING, COMPLETED, FAILED, SKIPPED
    }
}
