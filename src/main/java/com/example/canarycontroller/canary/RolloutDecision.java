package com.example.canarycontroller.canary;

import com.example.canarycontroller.analysis.HealthVerdict;
import com.example.canarycontroller.domain.CanaryDeployment;
import com.example.canarycontroller.domain.RollbackRecord;

/**
 * Result of an engine operation: the deployment after the operation, the action the caller
 * must apply to the workload, and for ticks the verdict and recorded metric sample.
 */
public record RolloutDecision(
        CanaryDeployment deployment,
        TrafficAction action,
        HealthVerdict verdict,
        RollbackRecord rollback,
        String sampleId
) {

    public static RolloutDecision of(CanaryDeployment deployment, TrafficAction action) {
        return new RolloutDecision(deployment, action, null, null, null);
    }

    public static RolloutDecision unchanged(CanaryDeployment deployment) {
        return of(deployment, TrafficAction.none());
    }
}
