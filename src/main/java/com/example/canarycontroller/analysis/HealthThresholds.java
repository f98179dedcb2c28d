package com.example.canarycontroller.analysis;

import com.example.canarycontroller.domain.CanaryDeployment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Health gate configuration of a deployment: thresholds and rollback policy flags.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthThresholds {

    /** Maximum canary error rate, in percent */
    private double errorRateThreshold;
    private long latencyThresholdMs;
    /** Minimum canary success rate, in percent, required to promote */
    private double successRateThreshold;
    private int minHealthyPods;

    private boolean autoRollbackEnabled;
    private boolean rollbackOnErrorRate;
    private boolean rollbackOnLatency;
    private boolean rollbackOnPodFailure;

    public static HealthThresholds from(CanaryDeployment deployment) {
        return HealthThresholds.builder()
                .errorRateThreshold(deployment.getErrorRateThreshold())
                .latencyThresholdMs(deployment.getLatencyThresholdMs())
                .successRateThreshold(deployment.getSuccessRateThreshold())
                .minHealthyPods(deployment.getMinHealthyPods())
                .autoRollbackEnabled(deployment.isAutoRollbackEnabled())
                .rollbackOnErrorRate(deployment.isRollbackOnErrorRate())
                .rollbackOnLatency(deployment.isRollbackOnLatency())
                .rollbackOnPodFailure(deployment.isRollbackOnPodFailure())
                .build();
    }
}
